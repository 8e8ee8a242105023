package com.connection.pool.backend;

/**
 * Server-side transaction state of a connection, as far as the driver can tell.
 */
public enum TransactionStatus {
    /** No transaction open. */
    IDLE,
    /** A command is currently executing. */
    ACTIVE,
    /** Inside a transaction block. */
    IN_TRANSACTION,
    /** Inside a failed transaction block; every statement will fail until rollback. */
    IN_ERROR,
    /** The connection to the server is lost. */
    UNKNOWN
}
