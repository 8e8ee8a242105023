package com.connection.pool.health;

import com.connection.pool.core.PoolStats;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of a connection pool, derived from a {@link PoolStats} snapshot.
 *
 * <p>A bounded pool is {@link Status#DEGRADED} once 80% of its
 * connections are checked out and {@link Status#DOWN} when all of them are. An unbounded
 * pool has no usage ratio and is always {@link Status#UP} while open.</p>
 *
 * @param status  overall state
 * @param message human-readable reason
 * @param stats   the snapshot the status was derived from; null when the pool could not be read
 */
public record HealthStatus(Status status, String message, PoolStats stats) {

    public enum Status { UP, DEGRADED, DOWN }

    static final double DEGRADED_USAGE = 0.80;

    /**
     * Classifies an open pool by how many of its connections are checked out.
     */
    public static HealthStatus of(PoolStats stats) {
        double usage = usage(stats);
        if (usage >= 1.0) {
            return new HealthStatus(Status.DOWN, "Connection pool exhausted: all connections in use", stats);
        }
        if (usage >= DEGRADED_USAGE) {
            return new HealthStatus(Status.DEGRADED,
                    String.format("Connection pool usage high: %.0f%%", usage * 100), stats);
        }
        return new HealthStatus(Status.UP, "OK", stats);
    }

    public static HealthStatus closed(PoolStats stats) {
        return new HealthStatus(Status.DOWN, "Connection pool is closed", stats);
    }

    public static HealthStatus failed(Exception e) {
        return new HealthStatus(Status.DOWN, "Connection pool check failed: " + e.getMessage(), null);
    }

    /**
     * Fraction of {@code maxConnections} checked out; 0 for an unbounded pool.
     */
    public double usage() {
        return stats == null ? 0.0 : usage(stats);
    }

    private static double usage(PoolStats stats) {
        return stats.isBounded() ? (double) stats.inUseConnections() / stats.maxConnections() : 0.0;
    }

    /**
     * The snapshot as flat key-value pairs, for health endpoints.
     */
    public Map<String, Object> details() {
        if (stats == null) {
            return Map.of();
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("inUseConnections", stats.inUseConnections());
        details.put("idleConnections", stats.idleConnections());
        details.put("maxConnections", stats.maxConnections());
        details.put("totalCreated", stats.totalCreated());
        details.put("totalClosed", stats.totalClosed());
        details.put("totalExhausted", stats.totalExhausted());
        return details;
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }
}
