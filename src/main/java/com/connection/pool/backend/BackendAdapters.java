package com.connection.pool.backend;

import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/**
 * Picks a {@link BackendAdapter} for a JDBC URL.
 */
public final class BackendAdapters {

    private BackendAdapters() {
    }

    public static BackendAdapter forUrl(String url, Properties properties, Duration validationTimeout) {
        ConnectionFactory factory = new DriverManagerConnectionFactory(url, properties);
        String lower = url.toLowerCase(Locale.ROOT);

        if (lower.startsWith("jdbc:mysql:") || lower.startsWith("jdbc:mariadb:")) {
            return new PingBackendAdapter(factory, validationTimeout);
        }
        if (lower.startsWith("jdbc:postgresql:")) {
            return new TransactionAwareBackendAdapter(factory);
        }
        if (lower.startsWith("jdbc:sqlite:") || lower.startsWith("jdbc:h2:")
                || lower.startsWith("jdbc:hsqldb:") || lower.startsWith("jdbc:derby:")) {
            return new QueryProbeBackendAdapter(factory, probeQueryFor(lower));
        }
        return new GenericBackendAdapter(factory);
    }

    public static BackendAdapter forUrl(String url) {
        return forUrl(url, new Properties(), Duration.ofSeconds(5));
    }

    private static String probeQueryFor(String lowerUrl) {
        if (lowerUrl.startsWith("jdbc:hsqldb:")) {
            return "SELECT 1 FROM INFORMATION_SCHEMA.SYSTEM_USERS";
        }
        if (lowerUrl.startsWith("jdbc:derby:")) {
            return "VALUES 1";
        }
        return QueryProbeBackendAdapter.DEFAULT_PROBE_QUERY;
    }
}
