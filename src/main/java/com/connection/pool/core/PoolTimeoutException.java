package com.connection.pool.core;

/**
 * Thrown by the waiting checkout when no connection became available before the deadline.
 */
public class PoolTimeoutException extends PoolExhaustedException {

    public PoolTimeoutException(String message) {
        super(message);
    }

    public PoolTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
