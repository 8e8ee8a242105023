package com.connection.pool.core;

/**
 * Point-in-time statistics for a {@link ConnectionPool}.
 *
 * @param inUseConnections connections currently checked out
 * @param idleConnections  connections available for checkout
 * @param maxConnections   configured capacity, 0 when unbounded
 * @param totalCheckouts   cumulative successful checkouts
 * @param totalCheckins    cumulative checkins of tracked handles
 * @param totalCreated     cumulative connections opened
 * @param totalClosed      cumulative connections closed or discarded
 * @param totalExhausted   cumulative checkouts rejected because the pool was full
 */
public record PoolStats(
        int inUseConnections,
        int idleConnections,
        int maxConnections,
        long totalCheckouts,
        long totalCheckins,
        long totalCreated,
        long totalClosed,
        long totalExhausted
) {

    public int totalConnections() {
        return inUseConnections + idleConnections;
    }

    public boolean isBounded() {
        return maxConnections > 0;
    }
}
