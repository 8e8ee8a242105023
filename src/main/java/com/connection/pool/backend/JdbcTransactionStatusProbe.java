package com.connection.pool.backend;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Portable probe using only {@link Connection} methods. It cannot see a failed transaction,
 * so an open transaction is reported as {@link TransactionStatus#IN_TRANSACTION} whenever
 * auto-commit is off.
 */
public class JdbcTransactionStatusProbe implements TransactionStatusProbe {

    @Override
    public TransactionStatus statusOf(Connection connection) {
        try {
            if (connection.isClosed()) {
                return TransactionStatus.UNKNOWN;
            }
            return connection.getAutoCommit() ? TransactionStatus.IDLE : TransactionStatus.IN_TRANSACTION;
        } catch (SQLException e) {
            return TransactionStatus.UNKNOWN;
        }
    }
}
