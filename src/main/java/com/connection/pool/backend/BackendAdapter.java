package com.connection.pool.backend;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Per-database policy used by the pool to open, close and validate connections.
 *
 * <p>{@link #isClosed(Connection)} is consulted when an idle connection is checked out,
 * {@link #canReuse(Connection)} when a connection is checked in. Neither may throw.</p>
 */
public interface BackendAdapter {

    /**
     * Opens a new connection through the backend's factory.
     *
     * @throws SQLException propagated unchanged from the driver
     */
    Connection connect() throws SQLException;

    /**
     * Closes a connection that is being discarded.
     *
     * @throws SQLException propagated from the driver; the pool logs and ignores it
     */
    void close(Connection connection) throws SQLException;

    /**
     * Returns true if the connection is dead and must be thrown away without reuse.
     */
    boolean isClosed(Connection connection);

    /**
     * Decides whether a returned connection may go back to the idle set. May roll back
     * or reset the connection as part of deciding.
     */
    boolean canReuse(Connection connection);

    /**
     * Short name used in logs and metrics.
     */
    String getName();
}
