package com.connection.pool.core;

import java.sql.Connection;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Opaque token for one live backend connection managed by a {@link ConnectionPool}.
 *
 * <p>Identity is the generated {@link #id()}, never the wrapped connection, so handles can be
 * used as map keys regardless of how the driver implements {@code equals}/{@code hashCode}.</p>
 */
public final class ConnectionHandle {

    private static final AtomicLong SEQUENCE = new AtomicLong(0);

    private final long id;
    private final Connection connection;

    ConnectionHandle(Connection connection) {
        this.id = SEQUENCE.incrementAndGet();
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    public long id() {
        return id;
    }

    /**
     * The underlying JDBC connection. Only valid while the handle is checked out.
     */
    public Connection connection() {
        return connection;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConnectionHandle)) return false;
        return id == ((ConnectionHandle) o).id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "ConnectionHandle{id=" + id + '}';
    }
}
