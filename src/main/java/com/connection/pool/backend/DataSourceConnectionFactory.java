package com.connection.pool.backend;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionFactory} that opens connections from an unpooled {@link DataSource}.
 */
public class DataSourceConnectionFactory implements ConnectionFactory {

    private final DataSource dataSource;

    public DataSourceConnectionFactory(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    @Override
    public Connection connect() throws SQLException {
        return dataSource.getConnection();
    }
}
