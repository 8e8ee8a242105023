package com.connection.pool.backend;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Base adapter that delegates {@code connect}/{@code close} to a {@link ConnectionFactory}.
 * The default reuse policy accepts every returned connection.
 */
public abstract class AbstractBackendAdapter implements BackendAdapter {

    private final ConnectionFactory factory;

    protected AbstractBackendAdapter(ConnectionFactory factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    @Override
    public Connection connect() throws SQLException {
        return factory.connect();
    }

    @Override
    public void close(Connection connection) throws SQLException {
        connection.close();
    }

    @Override
    public boolean canReuse(Connection connection) {
        return true;
    }

    protected ConnectionFactory getFactory() {
        return factory;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{factory=" + factory + '}';
    }
}
