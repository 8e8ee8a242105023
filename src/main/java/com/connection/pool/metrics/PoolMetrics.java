package com.connection.pool.metrics;

import com.connection.pool.core.CloseReason;
import com.connection.pool.core.PoolStats;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Interface for recording connection pool metrics.
 * The default {@link NoOpPoolMetrics} does nothing, so the pool works
 * without any metrics dependencies on the classpath.
 */
public interface PoolMetrics {

    void recordCreated();

    void recordClosed(CloseReason reason);

    void recordCheckout(Duration waited);

    void recordCheckin();

    void recordExhausted();

    /**
     * Registers gauges that read live pool statistics. Called once by the pool.
     */
    void registerGauges(Supplier<PoolStats> stats);
}
