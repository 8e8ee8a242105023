package com.connection.pool.core;

/**
 * Base runtime exception for connection pool failures.
 */
public class ConnectionPoolException extends RuntimeException {

    public ConnectionPoolException(String message) {
        super(message);
    }

    public ConnectionPoolException(String message, Throwable cause) {
        super(message, cause);
    }
}
