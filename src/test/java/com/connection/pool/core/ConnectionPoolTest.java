package com.connection.pool.core;

import com.connection.pool.backend.FakeBackendAdapter;
import com.connection.pool.metrics.NoOpPoolMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class ConnectionPoolTest {

    private FakeBackendAdapter adapter;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        adapter = new FakeBackendAdapter();
        clock = new MutableClock();
    }

    private ConnectionPool pool(PoolConfig config) {
        return new ConnectionPool(config, adapter, new NoOpPoolMetrics(), clock);
    }

    private ConnectionPool pool(int maxConnections) {
        return pool(PoolConfig.builder().maxConnections(maxConnections).waitTimeout(Duration.ZERO).build());
    }

    // ========== PoolConfig Tests ==========

    @Nested
    @DisplayName("PoolConfig")
    class PoolConfigTests {

        @Test
        @DisplayName("Should create pool config with defaults")
        void testDefaults() {
            PoolConfig config = PoolConfig.builder().build();
            assertEquals("pool", config.getPoolName());
            assertEquals(20, config.getMaxConnections());
            assertFalse(config.isStaleTimeoutEnabled());
            assertEquals(Duration.ofSeconds(5), config.getWaitTimeout());
            assertEquals(Duration.ofMillis(100), config.getRetryInterval());
            assertFalse(config.isWaitForever());
        }

        @Test
        @DisplayName("Zero maxConnections means unbounded")
        void testUnbounded() {
            PoolConfig config = PoolConfig.builder().maxConnections(0).build();
            assertFalse(config.isBounded());
        }

        @Test
        @DisplayName("Should reject negative maxConnections")
        void testNegativeMaxConnections() {
            assertThrows(IllegalArgumentException.class,
                    () -> PoolConfig.builder().maxConnections(-1));
        }

        @Test
        @DisplayName("Null or zero stale timeout disables staleness")
        void testStaleTimeoutDisabled() {
            assertFalse(PoolConfig.builder().staleTimeout(null).build().isStaleTimeoutEnabled());
            assertFalse(PoolConfig.builder().staleTimeout(Duration.ZERO).build().isStaleTimeoutEnabled());
            assertTrue(PoolConfig.builder().staleTimeout(Duration.ofSeconds(1)).build().isStaleTimeoutEnabled());
        }

        @Test
        @DisplayName("Should reject negative waits and a zero retry interval")
        void testRejectsInvalidDurations() {
            assertThrows(IllegalArgumentException.class,
                    () -> PoolConfig.builder().waitTimeout(Duration.ofMillis(-1)));
            assertThrows(IllegalArgumentException.class,
                    () -> PoolConfig.builder().staleTimeout(Duration.ofMillis(-1)));
            assertThrows(IllegalArgumentException.class,
                    () -> PoolConfig.builder().retryInterval(Duration.ZERO));
            assertThrows(IllegalArgumentException.class,
                    () -> PoolConfig.builder().poolName(" "));
        }

        @Test
        @DisplayName("waitForever should be reported in toString")
        void testWaitForever() {
            PoolConfig config = PoolConfig.builder().waitForever().build();
            assertTrue(config.isWaitForever());
            assertTrue(config.toString().contains("waitTimeout=forever"));
        }
    }

    // ========== checkout / checkin ==========

    @Nested
    @DisplayName("Checkout and checkin")
    class CheckoutCheckinTests {

        @Test
        @DisplayName("Should open a connection when the pool is empty")
        void testCheckoutCreates() {
            ConnectionPool pool = pool(2);
            ConnectionHandle handle = pool.checkout();

            assertNotNull(handle.connection());
            assertTrue(pool.isCheckedOut(handle));
            assertEquals(1, adapter.openedCount());
            assertEquals(1, pool.getStats().inUseConnections());
        }

        @Test
        @DisplayName("Should reuse a checked-in connection")
        void testCheckinThenReuse() {
            ConnectionPool pool = pool(2);
            ConnectionHandle first = pool.checkout();
            pool.checkin(first);

            assertFalse(pool.isCheckedOut(first));
            assertEquals(List.of(first), pool.idleHandles());

            ConnectionHandle second = pool.checkout();
            assertEquals(first, second);
            assertEquals(1, adapter.openedCount());
        }

        @Test
        @DisplayName("Should fail immediately when max connections are in use")
        void testExhausted() {
            ConnectionPool pool = pool(2);
            pool.checkout();
            pool.checkout();

            assertThrows(PoolExhaustedException.class, pool::checkout);
            assertThrows(PoolExhaustedException.class, pool::connect);
            assertEquals(2, pool.getStats().totalExhausted());
            assertEquals(2, adapter.openedCount());
        }

        @Test
        @DisplayName("Unbounded pool should never report exhaustion")
        void testUnboundedPool() {
            ConnectionPool pool = pool(0);
            for (int i = 0; i < 50; i++) {
                pool.checkout();
            }
            assertEquals(50, pool.getStats().inUseConnections());
        }

        @Test
        @DisplayName("Connection refused for reuse is closed and never handed out again")
        void testRefusedReuse() {
            ConnectionPool pool = pool(2);
            ConnectionHandle refused = pool.checkout();
            adapter.refuseReuse(refused.connection());

            pool.checkin(refused);

            assertTrue(adapter.wasClosed(refused.connection()));
            assertTrue(pool.idleHandles().isEmpty());
            for (int i = 0; i < 5; i++) {
                ConnectionHandle next = pool.checkout();
                assertNotEquals(refused, next);
                pool.checkin(next);
            }
        }

        @Test
        @DisplayName("Double checkin should be a no-op")
        void testDoubleCheckin() {
            ConnectionPool pool = pool(2);
            ConnectionHandle handle = pool.checkout();
            pool.checkin(handle);
            pool.checkin(handle);

            assertEquals(1, pool.getStats().idleConnections());
            assertEquals(1, pool.getStats().totalCheckins());
        }

        @Test
        @DisplayName("Checkin of a foreign or null handle should be ignored")
        void testForeignCheckin() {
            ConnectionPool pool = pool(2);
            assertDoesNotThrow(() -> pool.checkin(new ConnectionHandle(mock(Connection.class))));
            assertDoesNotThrow(() -> pool.checkin(null));
            assertEquals(0, pool.getStats().totalConnections());
        }

        @Test
        @DisplayName("Should hand out the longest-idle connection first")
        void testOldestFirst() {
            ConnectionPool pool = pool(3);
            ConnectionHandle a = pool.checkout();
            ConnectionHandle b = pool.checkout();
            ConnectionHandle c = pool.checkout();

            pool.checkin(b);
            clock.advance(Duration.ofMillis(5));
            pool.checkin(c);
            clock.advance(Duration.ofMillis(5));
            pool.checkin(a);

            assertEquals(List.of(b, c, a), pool.idleHandles());
            assertEquals(b, pool.checkout());
            assertEquals(c, pool.checkout());
            assertEquals(a, pool.checkout());
        }

        @Test
        @DisplayName("Dead idle connection is discarded without a close call")
        void testDeadIdleDiscarded() {
            ConnectionPool pool = pool(2);
            ConnectionHandle dead = pool.checkout();
            pool.checkin(dead);
            adapter.markDead(dead.connection());

            ConnectionHandle fresh = pool.checkout();

            assertNotEquals(dead, fresh);
            assertFalse(adapter.wasClosed(dead.connection()));
            assertEquals(2, adapter.openedCount());
            assertEquals(1, pool.getStats().totalClosed());
        }
    }

    // ========== staleness ==========

    @Nested
    @DisplayName("Staleness")
    class StalenessTests {

        private ConnectionPool stalePool() {
            return pool(PoolConfig.builder()
                    .maxConnections(2)
                    .staleTimeout(Duration.ofSeconds(30))
                    .waitTimeout(Duration.ZERO)
                    .build());
        }

        @Test
        @DisplayName("Idle connection past the stale timeout is closed on the next checkout")
        void testStaleIdleClosedOnCheckout() {
            ConnectionPool pool = stalePool();
            ConnectionHandle old = pool.checkout();
            pool.checkin(old);

            clock.advance(Duration.ofSeconds(31));
            ConnectionHandle next = pool.checkout();

            assertNotEquals(old, next);
            assertTrue(adapter.wasClosed(old.connection()));
            assertEquals(2, adapter.openedCount());
        }

        @Test
        @DisplayName("Idle connection within the stale timeout is reused")
        void testFreshIdleReused() {
            ConnectionPool pool = stalePool();
            ConnectionHandle handle = pool.checkout();
            pool.checkin(handle);

            clock.advance(Duration.ofSeconds(29));
            assertEquals(handle, pool.checkout());
        }

        @Test
        @DisplayName("Connection already stale at checkin is closed instead of pooled")
        void testStaleOnCheckin() {
            ConnectionPool pool = stalePool();
            ConnectionHandle handle = pool.checkout();

            clock.advance(Duration.ofSeconds(31));
            pool.checkin(handle);

            assertTrue(adapter.wasClosed(handle.connection()));
            assertTrue(pool.idleHandles().isEmpty());
        }

        @Test
        @DisplayName("Several stale idle connections are all swept by one checkout")
        void testMultipleStaleSwept() {
            ConnectionPool pool = stalePool();
            ConnectionHandle a = pool.checkout();
            ConnectionHandle b = pool.checkout();
            pool.checkin(a);
            pool.checkin(b);

            clock.advance(Duration.ofMinutes(1));
            ConnectionHandle c = pool.checkout();

            assertTrue(adapter.wasClosed(a.connection()));
            assertTrue(adapter.wasClosed(b.connection()));
            assertNotEquals(a, c);
            assertNotEquals(b, c);
            assertEquals(0, pool.getStats().idleConnections());
        }
    }

    // ========== jitter ==========

    @Nested
    @DisplayName("Timestamp jitter")
    class JitterTests {

        private boolean withinJitter(Instant timestamp, Instant now) {
            return !timestamp.isAfter(now) && timestamp.isAfter(now.minusMillis(1));
        }

        @Test
        @DisplayName("Created and returned timestamps are pushed back by less than a millisecond")
        void testTimestampsWithinOneMillisecond() {
            ConnectionPool pool = pool(5);
            Instant now = clock.instant();

            List<ConnectionHandle> handles = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                ConnectionHandle handle = pool.checkout();
                handles.add(handle);
                assertTrue(withinJitter(pool.createdAt(handle), now), "createdAt " + pool.createdAt(handle));
            }
            handles.forEach(pool::checkin);

            List<Instant> returned = pool.idleTimestamps();
            assertEquals(5, returned.size());
            for (Instant timestamp : returned) {
                assertTrue(withinJitter(timestamp, now), "returnedAt " + timestamp);
            }
        }

        @Test
        @DisplayName("A handle taken from the idle set keeps its returned timestamp")
        void testCreatedAtFromIdleEntry() {
            ConnectionPool pool = pool(1);
            pool.checkin(pool.checkout());
            Instant returnedAt = pool.idleTimestamps().get(0);

            ConnectionHandle handle = pool.checkout();

            assertEquals(returnedAt, pool.createdAt(handle));
        }

        @Test
        @DisplayName("Handles returned at the same instant are not always reused in id order")
        void testSameInstantOrderVaries() {
            int lowerIdFirst = 0;
            int higherIdFirst = 0;
            for (int trial = 0; trial < 64; trial++) {
                ConnectionPool pool = pool(2);
                ConnectionHandle a = pool.checkout();
                ConnectionHandle b = pool.checkout();
                pool.checkin(a);
                pool.checkin(b);

                ConnectionHandle first = pool.idleHandles().get(0);
                ConnectionHandle lower = a.id() < b.id() ? a : b;
                if (first.equals(lower)) {
                    lowerIdFirst++;
                } else {
                    higherIdFirst++;
                }
            }
            assertTrue(lowerIdFirst > 0, "lower id never came first");
            assertTrue(higherIdFirst > 0, "higher id never came first");
        }
    }

    // ========== maintenance ==========

    @Nested
    @DisplayName("Maintenance operations")
    class MaintenanceTests {

        @Test
        @DisplayName("closeStale(0) closes every in-use connection")
        void testCloseStaleZero() {
            ConnectionPool pool = pool(5);
            List<ConnectionHandle> handles = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                handles.add(pool.checkout());
            }

            int closed = pool.closeStale(Duration.ZERO);

            assertEquals(3, closed);
            assertEquals(0, pool.getStats().inUseConnections());
            for (ConnectionHandle handle : handles) {
                assertTrue(adapter.wasClosed(handle.connection()));
            }
        }

        @Test
        @DisplayName("closeStale only closes connections checked out before the cutoff")
        void testCloseStaleAge() {
            ConnectionPool pool = pool(5);
            ConnectionHandle old = pool.checkout();
            clock.advance(Duration.ofMinutes(15));
            ConnectionHandle recent = pool.checkout();

            assertEquals(1, pool.closeStale());

            assertTrue(adapter.wasClosed(old.connection()));
            assertFalse(adapter.wasClosed(recent.connection()));
            assertTrue(pool.isCheckedOut(recent));
        }

        @Test
        @DisplayName("Checkin after closeStale reclaimed the connection is ignored")
        void testCheckinAfterReclaim() {
            ConnectionPool pool = pool(1);
            ConnectionHandle leaked = pool.checkout();
            pool.closeStale(Duration.ZERO);

            pool.checkin(leaked);

            assertTrue(pool.idleHandles().isEmpty());
            assertNotEquals(leaked, pool.checkout());
        }

        @Test
        @DisplayName("closeIdle closes idle connections and leaves in-use ones alone")
        void testCloseIdle() {
            ConnectionPool pool = pool(3);
            ConnectionHandle a = pool.checkout();
            ConnectionHandle b = pool.checkout();
            pool.checkin(a);

            assertEquals(1, pool.closeIdle());

            assertTrue(adapter.wasClosed(a.connection()));
            assertFalse(adapter.wasClosed(b.connection()));
            assertTrue(pool.isCheckedOut(b));
            assertEquals(0, pool.getStats().idleConnections());
        }

        @Test
        @DisplayName("closeAll empties both registries and the pool stays usable")
        void testCloseAll() {
            ConnectionPool pool = pool(3);
            ConnectionHandle a = pool.checkout();
            ConnectionHandle b = pool.checkout();
            pool.checkin(a);

            pool.closeAll();

            assertTrue(adapter.wasClosed(a.connection()));
            assertTrue(adapter.wasClosed(b.connection()));
            assertEquals(0, pool.getStats().totalConnections());

            ConnectionHandle c = pool.checkout();
            assertNotEquals(a, c);
            assertNotEquals(b, c);
        }

        @Test
        @DisplayName("manualClose discards the connection instead of recycling it")
        void testManualClose() {
            ConnectionPool pool = pool(2);
            ConnectionHandle handle = pool.checkout();

            assertTrue(pool.manualClose(handle));

            assertTrue(adapter.wasClosed(handle.connection()));
            assertFalse(pool.isCheckedOut(handle));
            assertTrue(pool.idleHandles().isEmpty());
            assertFalse(pool.manualClose(handle));
        }

        @Test
        @DisplayName("close() shuts the pool and rejects further checkouts")
        void testClose() {
            ConnectionPool pool = pool(2);
            ConnectionHandle handle = pool.checkout();

            pool.close();

            assertTrue(pool.isClosed());
            assertTrue(adapter.wasClosed(handle.connection()));
            assertThrows(IllegalStateException.class, pool::checkout);
            assertDoesNotThrow(pool::close);
        }
    }

    // ========== failures ==========

    @Nested
    @DisplayName("Backend failures")
    class FailureTests {

        @Test
        @DisplayName("Connect failure surfaces as BackendConnectException and frees capacity")
        void testConnectFailure() {
            ConnectionPool pool = pool(1);
            adapter.failConnects(1);

            BackendConnectException e = assertThrows(BackendConnectException.class, pool::checkout);
            assertInstanceOf(SQLException.class, e.getCause());

            ConnectionHandle handle = pool.checkout();
            assertNotNull(handle);
            assertEquals(1, pool.getStats().inUseConnections());
        }

        @Test
        @DisplayName("Close failures are swallowed")
        void testCloseFailureSwallowed() {
            FakeBackendAdapter failingClose = new FakeBackendAdapter() {
                @Override
                public void close(Connection connection) {
                    throw new IllegalStateException("simulated close failure");
                }
            };
            ConnectionPool pool = new ConnectionPool(
                    PoolConfig.builder().maxConnections(2).build(), failingClose);
            ConnectionHandle handle = pool.checkout();

            assertTrue(pool.manualClose(handle));
            pool.checkout();
            assertDoesNotThrow(pool::closeAll);
        }

        @Test
        @DisplayName("A throwing reuse check closes the connection instead of failing checkin")
        void testCanReuseThrows() {
            FakeBackendAdapter throwingReuse = new FakeBackendAdapter() {
                @Override
                public boolean canReuse(Connection connection) {
                    throw new IllegalStateException("simulated probe failure");
                }
            };
            ConnectionPool pool = new ConnectionPool(
                    PoolConfig.builder().maxConnections(1).build(), throwingReuse);
            ConnectionHandle handle = pool.checkout();

            assertDoesNotThrow(() -> pool.checkin(handle));
            assertTrue(throwingReuse.wasClosed(handle.connection()));
            assertNotEquals(handle, pool.checkout());
        }
    }

    // ========== invariants ==========

    @Test
    @DisplayName("No handle is ever idle and in use at once")
    void testRegistriesDisjoint() {
        ConnectionPool pool = pool(4);
        List<ConnectionHandle> held = new ArrayList<>();
        for (int round = 0; round < 20; round++) {
            if (held.size() < 4 && (round % 3 != 2)) {
                held.add(pool.checkout());
            } else if (!held.isEmpty()) {
                pool.checkin(held.remove(0));
            }
            clock.advance(Duration.ofMillis(2));

            Set<ConnectionHandle> idle = new HashSet<>(pool.idleHandles());
            for (ConnectionHandle h : held) {
                assertFalse(idle.contains(h));
                assertTrue(pool.isCheckedOut(h));
            }
            PoolStats stats = pool.getStats();
            assertTrue(stats.totalConnections() <= stats.totalCreated());
            assertTrue(stats.inUseConnections() <= 4);
        }
    }

    @Test
    @DisplayName("ConnectionHandle equality is by generated id")
    void testHandleIdentity() {
        Connection connection = mock(Connection.class);
        ConnectionHandle a = new ConnectionHandle(connection);
        ConnectionHandle b = new ConnectionHandle(connection);

        assertNotEquals(a, b);
        assertEquals(a, a);
        assertNotEquals(a.id(), b.id());
        assertEquals(Long.hashCode(a.id()), a.hashCode());
    }
}
