package com.connection.pool.database;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Unit of work run against a pooled connection.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface SqlWork<T> {

    T run(Connection connection) throws SQLException;
}
