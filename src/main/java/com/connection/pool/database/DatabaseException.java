package com.connection.pool.database;

/**
 * Runtime exception wrapping a {@link java.sql.SQLException} raised while running a statement.
 */
public class DatabaseException extends RuntimeException {

    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
