package com.connection.pool.metrics;

import com.connection.pool.core.CloseReason;
import com.connection.pool.core.PoolStats;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Micrometer-based implementation of {@link PoolMetrics}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics, all tagged with {@code pool}:</p>
 * <ul>
 *   <li>{@code pool.connections.created} - Counter</li>
 *   <li>{@code pool.connections.closed} - Counter (tag: reason)</li>
 *   <li>{@code pool.connections.checkout} - Timer of time spent waiting for a connection</li>
 *   <li>{@code pool.connections.checkin} - Counter</li>
 *   <li>{@code pool.connections.exhausted} - Counter</li>
 *   <li>{@code pool.connections.idle}, {@code pool.connections.in-use} - Gauges</li>
 * </ul>
 */
public class MicrometerPoolMetrics implements PoolMetrics {

    private final MeterRegistry registry;
    private final String poolName;
    private final Counter createdCounter;
    private final Counter checkinCounter;
    private final Counter exhaustedCounter;
    private final Timer checkoutTimer;
    private final Map<CloseReason, Counter> closedCounters = new EnumMap<>(CloseReason.class);

    public MicrometerPoolMetrics(MeterRegistry registry, String poolName) {
        this.registry = registry;
        this.poolName = poolName;
        this.createdCounter = Counter.builder("pool.connections.created")
                .description("Number of backend connections opened")
                .tag("pool", poolName)
                .register(registry);
        this.checkinCounter = Counter.builder("pool.connections.checkin")
                .description("Number of connections returned to the pool")
                .tag("pool", poolName)
                .register(registry);
        this.exhaustedCounter = Counter.builder("pool.connections.exhausted")
                .description("Number of checkouts rejected because the pool was full")
                .tag("pool", poolName)
                .register(registry);
        this.checkoutTimer = Timer.builder("pool.connections.checkout")
                .description("Time spent waiting to check out a connection")
                .tag("pool", poolName)
                .register(registry);
        for (CloseReason reason : CloseReason.values()) {
            closedCounters.put(reason, Counter.builder("pool.connections.closed")
                    .description("Number of connections closed or discarded by the pool")
                    .tag("pool", poolName)
                    .tag("reason", reason.name())
                    .register(registry));
        }
    }

    @Override
    public void recordCreated() {
        createdCounter.increment();
    }

    @Override
    public void recordClosed(CloseReason reason) {
        closedCounters.get(reason).increment();
    }

    @Override
    public void recordCheckout(Duration waited) {
        checkoutTimer.record(waited);
    }

    @Override
    public void recordCheckin() {
        checkinCounter.increment();
    }

    @Override
    public void recordExhausted() {
        exhaustedCounter.increment();
    }

    /**
     * The supplier is usually a method reference that nothing else holds on to, so the
     * gauges keep a strong reference to it.
     */
    @Override
    public void registerGauges(Supplier<PoolStats> stats) {
        Gauge.builder("pool.connections.idle", stats, s -> s.get().idleConnections())
                .description("Connections available for checkout")
                .tag("pool", poolName)
                .strongReference(true)
                .register(registry);
        Gauge.builder("pool.connections.in-use", stats, s -> s.get().inUseConnections())
                .description("Connections currently checked out")
                .tag("pool", poolName)
                .strongReference(true)
                .register(registry);
    }
}
