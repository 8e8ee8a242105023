package com.connection.pool.metrics;

import com.connection.pool.backend.FakeBackendAdapter;
import com.connection.pool.core.CloseReason;
import com.connection.pool.core.ConnectionHandle;
import com.connection.pool.core.ConnectionPool;
import com.connection.pool.core.PoolConfig;
import com.connection.pool.core.PoolExhaustedException;
import com.connection.pool.core.PoolStats;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PoolMetricsTest {

    @Nested
    @DisplayName("NoOpPoolMetrics")
    class NoOpTests {

        @Test
        @DisplayName("All operations should be no-ops without error")
        void allOperationsNoOp() {
            PoolMetrics metrics = new NoOpPoolMetrics();
            assertDoesNotThrow(() -> {
                metrics.recordCreated();
                metrics.recordClosed(CloseReason.STALE);
                metrics.recordCheckout(Duration.ofMillis(5));
                metrics.recordCheckin();
                metrics.recordExhausted();
                metrics.registerGauges(() -> new PoolStats(0, 0, 0, 0, 0, 0, 0, 0));
            });
        }
    }

    @Nested
    @DisplayName("MicrometerPoolMetrics")
    class MicrometerTests {

        private SimpleMeterRegistry registry;
        private FakeBackendAdapter adapter;
        private ConnectionPool pool;

        @BeforeEach
        void setUp() {
            registry = new SimpleMeterRegistry();
            adapter = new FakeBackendAdapter();
            pool = new ConnectionPool(PoolConfig.builder()
                    .poolName("orders")
                    .maxConnections(2)
                    .waitTimeout(Duration.ZERO)
                    .build(), adapter, new MicrometerPoolMetrics(registry, "orders"));
        }

        private double counter(String name) {
            return registry.get(name).tag("pool", "orders").counter().count();
        }

        @Test
        @DisplayName("Checkout and checkin update counters and the checkout timer")
        void checkoutCheckin() {
            ConnectionHandle handle = pool.checkout();
            pool.checkin(handle);
            pool.checkin(pool.checkout());

            assertEquals(1.0, counter("pool.connections.created"));
            assertEquals(2.0, counter("pool.connections.checkin"));
            assertEquals(2, registry.get("pool.connections.checkout").tag("pool", "orders").timer().count());
        }

        @Test
        @DisplayName("Gauges track idle and in-use connections")
        void gauges() {
            ConnectionHandle first = pool.checkout();
            pool.checkout();
            pool.checkin(first);

            assertEquals(1.0, registry.get("pool.connections.idle").tag("pool", "orders").gauge().value());
            assertEquals(1.0, registry.get("pool.connections.in-use").tag("pool", "orders").gauge().value());
        }

        @Test
        @DisplayName("Gauges keep reporting after garbage collection")
        void gaugesSurviveGc() {
            pool.checkout();

            System.gc();
            System.gc();

            assertEquals(1.0, registry.get("pool.connections.in-use").tag("pool", "orders").gauge().value());
            assertEquals(0.0, registry.get("pool.connections.idle").tag("pool", "orders").gauge().value());
        }

        @Test
        @DisplayName("A rejected checkout increments the exhausted counter")
        void exhausted() {
            pool.checkout();
            pool.checkout();
            assertThrows(PoolExhaustedException.class, pool::checkout);

            assertEquals(1.0, counter("pool.connections.exhausted"));
        }

        @Test
        @DisplayName("Closed connections are counted by reason")
        void closedByReason() {
            ConnectionHandle refused = pool.checkout();
            adapter.refuseReuse(refused.connection());
            pool.checkin(refused);
            pool.checkin(pool.checkout());
            pool.closeIdle();

            assertEquals(1.0, registry.get("pool.connections.closed")
                    .tags("pool", "orders", "reason", "REFUSED").counter().count());
            assertEquals(1.0, registry.get("pool.connections.closed")
                    .tags("pool", "orders", "reason", "IDLE").counter().count());
            assertEquals(0.0, registry.get("pool.connections.closed")
                    .tags("pool", "orders", "reason", "STALE").counter().count());
        }
    }
}
