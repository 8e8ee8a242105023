package com.connection.pool.health;

import com.connection.pool.core.ConnectionPool;
import com.connection.pool.core.PoolStats;

/**
 * Reports pool utilization; see {@link HealthStatus#of(PoolStats)} for the thresholds.
 * A closed pool is DOWN.
 */
public class ConnectionPoolHealthCheck implements HealthCheck {

    private final ConnectionPool pool;

    public ConnectionPoolHealthCheck(ConnectionPool pool) {
        this.pool = pool;
    }

    @Override
    public String getName() {
        return "connectionPool:" + pool.getConfig().getPoolName();
    }

    @Override
    public HealthStatus check() {
        try {
            PoolStats stats = pool.getStats();
            return pool.isClosed() ? HealthStatus.closed(stats) : HealthStatus.of(stats);
        } catch (Exception e) {
            return HealthStatus.failed(e);
        }
    }
}
