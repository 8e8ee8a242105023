package com.connection.pool.backend;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens raw connections to the backend. Implementations are not pooled themselves.
 */
@FunctionalInterface
public interface ConnectionFactory {

    /**
     * Opens a new connection.
     *
     * @return a live connection
     * @throws SQLException if the backend cannot be reached or rejects the login
     */
    Connection connect() throws SQLException;
}
