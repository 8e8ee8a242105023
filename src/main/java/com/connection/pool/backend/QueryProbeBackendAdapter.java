package com.connection.pool.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;

/**
 * Adapter for embedded drivers (SQLite, H2) where a trivial query is the cheapest way
 * to learn whether the connection still works.
 */
public class QueryProbeBackendAdapter extends AbstractBackendAdapter {
    private static final Logger log = LoggerFactory.getLogger(QueryProbeBackendAdapter.class);

    public static final String DEFAULT_PROBE_QUERY = "SELECT 1";

    private final String probeQuery;

    public QueryProbeBackendAdapter(ConnectionFactory factory) {
        this(factory, DEFAULT_PROBE_QUERY);
    }

    public QueryProbeBackendAdapter(ConnectionFactory factory, String probeQuery) {
        super(factory);
        if (probeQuery == null || probeQuery.isBlank()) {
            throw new IllegalArgumentException("probeQuery must not be blank");
        }
        this.probeQuery = probeQuery;
    }

    @Override
    public boolean isClosed(Connection connection) {
        try (Statement statement = connection.createStatement();
             ResultSet ignored = statement.executeQuery(probeQuery)) {
            return false;
        } catch (Exception e) {
            log.warn("Probe query failed, discarding connection: {}", e.getMessage());
            return true;
        }
    }

    public String getProbeQuery() {
        return probeQuery;
    }

    @Override
    public String getName() {
        return "query-probe";
    }
}
