package com.connection.pool.core;

/**
 * Thrown when the pool is at {@code maxConnections} and no idle connection could be recovered.
 */
public class PoolExhaustedException extends ConnectionPoolException {

    public PoolExhaustedException(String message) {
        super(message);
    }

    public PoolExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
