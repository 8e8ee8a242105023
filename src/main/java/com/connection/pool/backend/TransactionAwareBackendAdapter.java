package com.connection.pool.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Adapter for PostgreSQL-class drivers that expose the server transaction state.
 *
 * <p>A connection whose state is {@link TransactionStatus#UNKNOWN} has lost the server and is
 * never reused. A connection returned mid-transaction is rolled back, and one returned in a
 * failed transaction has its session reset, before it goes back to the idle set. Either way
 * auto-commit is switched back on, so the next borrower does not inherit an open transaction.</p>
 */
public class TransactionAwareBackendAdapter extends AbstractBackendAdapter {
    private static final Logger log = LoggerFactory.getLogger(TransactionAwareBackendAdapter.class);

    private final TransactionStatusProbe probe;

    public TransactionAwareBackendAdapter(ConnectionFactory factory) {
        this(factory, new PgTransactionStatusProbe());
    }

    public TransactionAwareBackendAdapter(ConnectionFactory factory, TransactionStatusProbe probe) {
        super(factory);
        this.probe = probe;
    }

    @Override
    public boolean isClosed(Connection connection) {
        try {
            if (connection.isClosed()) {
                return true;
            }
        } catch (SQLException e) {
            return true;
        }
        return probe.statusOf(connection) == TransactionStatus.UNKNOWN;
    }

    @Override
    public boolean canReuse(Connection connection) {
        TransactionStatus status = probe.statusOf(connection);
        try {
            switch (status) {
                case UNKNOWN:
                    return false;
                case IN_ERROR:
                    log.debug("Connection returned in failed transaction, resetting session");
                    resetSession(connection);
                    return true;
                case ACTIVE:
                case IN_TRANSACTION:
                    log.debug("Connection returned mid-transaction, rolling back");
                    connection.rollback();
                    connection.setAutoCommit(true);
                    return true;
                default:
                    return true;
            }
        } catch (SQLException e) {
            log.warn("Could not clean up returned connection ({}), discarding it: {}", status, e.getMessage());
            return false;
        }
    }

    private void resetSession(Connection connection) throws SQLException {
        connection.rollback();
        connection.clearWarnings();
        connection.setAutoCommit(true);
    }

    @Override
    public String getName() {
        return "transaction-aware";
    }
}
