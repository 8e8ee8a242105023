package com.connection.pool.core;

/**
 * Thrown when the backend factory could not open a new connection.
 * The cause is the driver's original exception.
 */
public class BackendConnectException extends ConnectionPoolException {

    public BackendConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
