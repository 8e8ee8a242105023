package com.connection.pool.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Adapter for drivers with no cheaper liveness signal than {@link Connection#isClosed()}.
 */
public class GenericBackendAdapter extends AbstractBackendAdapter {
    private static final Logger log = LoggerFactory.getLogger(GenericBackendAdapter.class);

    public GenericBackendAdapter(ConnectionFactory factory) {
        super(factory);
    }

    @Override
    public boolean isClosed(Connection connection) {
        try {
            return connection.isClosed();
        } catch (SQLException e) {
            log.debug("isClosed() failed, treating connection as closed: {}", e.getMessage());
            return true;
        }
    }

    @Override
    public String getName() {
        return "generic";
    }
}
