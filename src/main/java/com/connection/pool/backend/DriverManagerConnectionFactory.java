package com.connection.pool.backend;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * {@link ConnectionFactory} backed by {@link DriverManager}.
 */
public class DriverManagerConnectionFactory implements ConnectionFactory {

    private final String url;
    private final Properties properties;

    public DriverManagerConnectionFactory(String url) {
        this(url, new Properties());
    }

    public DriverManagerConnectionFactory(String url, Properties properties) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        this.url = url;
        this.properties = new Properties();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    public String getUrl() {
        return url;
    }

    @Override
    public Connection connect() throws SQLException {
        return DriverManager.getConnection(url, properties);
    }

    @Override
    public String toString() {
        return "DriverManagerConnectionFactory{url='" + url + "'}";
    }
}
