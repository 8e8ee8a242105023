package com.connection.pool.metrics;

import com.connection.pool.core.CloseReason;
import com.connection.pool.core.PoolStats;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * No-op implementation of {@link PoolMetrics}.
 */
public class NoOpPoolMetrics implements PoolMetrics {

    @Override
    public void recordCreated() {
    }

    @Override
    public void recordClosed(CloseReason reason) {
    }

    @Override
    public void recordCheckout(Duration waited) {
    }

    @Override
    public void recordCheckin() {
    }

    @Override
    public void recordExhausted() {
    }

    @Override
    public void registerGauges(Supplier<PoolStats> stats) {
    }
}
