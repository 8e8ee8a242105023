package com.connection.pool.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.time.Duration;

/**
 * Adapter for MySQL-class drivers: liveness is a driver-level ping via
 * {@link Connection#isValid(int)}. Any failure marks the connection closed.
 */
public class PingBackendAdapter extends AbstractBackendAdapter {
    private static final Logger log = LoggerFactory.getLogger(PingBackendAdapter.class);

    private final int timeoutSeconds;

    public PingBackendAdapter(ConnectionFactory factory) {
        this(factory, Duration.ofSeconds(5));
    }

    public PingBackendAdapter(ConnectionFactory factory, Duration validationTimeout) {
        super(factory);
        // isValid(0) means no timeout
        this.timeoutSeconds = (int) Math.min(Integer.MAX_VALUE,
                Math.max(0, (validationTimeout.toMillis() + 999) / 1000));
    }

    @Override
    public boolean isClosed(Connection connection) {
        try {
            return !connection.isValid(timeoutSeconds);
        } catch (Exception e) {
            log.warn("Ping failed, discarding connection: {}", e.getMessage());
            return true;
        }
    }

    int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    @Override
    public String getName() {
        return "ping";
    }
}
