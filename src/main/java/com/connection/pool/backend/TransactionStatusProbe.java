package com.connection.pool.backend;

import java.sql.Connection;

/**
 * Reads the {@link TransactionStatus} of a connection. Must not throw; a connection whose
 * state cannot be read is {@link TransactionStatus#UNKNOWN}.
 */
@FunctionalInterface
public interface TransactionStatusProbe {

    TransactionStatus statusOf(Connection connection);
}
