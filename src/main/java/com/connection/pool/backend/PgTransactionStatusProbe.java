package com.connection.pool.backend;

import org.postgresql.core.BaseConnection;
import org.postgresql.core.TransactionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Probe for the PostgreSQL JDBC driver, which tracks the backend's transaction
 * state from the ReadyForQuery messages it receives.
 */
public class PgTransactionStatusProbe implements TransactionStatusProbe {
    private static final Logger log = LoggerFactory.getLogger(PgTransactionStatusProbe.class);

    private final TransactionStatusProbe fallback;

    public PgTransactionStatusProbe() {
        this(new JdbcTransactionStatusProbe());
    }

    /**
     * @param fallback used for connections that are not PostgreSQL driver connections
     */
    public PgTransactionStatusProbe(TransactionStatusProbe fallback) {
        this.fallback = fallback;
    }

    @Override
    public TransactionStatus statusOf(Connection connection) {
        try {
            if (connection.isClosed()) {
                return TransactionStatus.UNKNOWN;
            }
            if (!connection.isWrapperFor(BaseConnection.class)) {
                return fallback.statusOf(connection);
            }
            TransactionState state = connection.unwrap(BaseConnection.class).getTransactionState();
            if (state == null) {
                return TransactionStatus.UNKNOWN;
            }
            return switch (state) {
                case IDLE -> TransactionStatus.IDLE;
                case OPEN -> TransactionStatus.IN_TRANSACTION;
                case FAILED -> TransactionStatus.IN_ERROR;
            };
        } catch (SQLException e) {
            log.debug("Could not read transaction state: {}", e.getMessage());
            return TransactionStatus.UNKNOWN;
        }
    }
}
