package com.connection.pool.core;

import com.connection.pool.backend.BackendAdapter;
import com.connection.pool.logging.LogContext;
import com.connection.pool.metrics.NoOpPoolMetrics;
import com.connection.pool.metrics.PoolMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded pool of reusable JDBC connections shared by concurrent callers.
 *
 * <p>Idle connections are kept in a min-heap ordered by the time they were returned, so
 * checkout always hands out the connection that has been idle longest. Checked-out
 * connections are tracked by {@link ConnectionHandle} together with their checkout time.
 * Both registries are guarded by a single {@link ReentrantLock}; the lock is never held
 * while the {@link BackendAdapter} talks to the database.</p>
 *
 * <p>A handle that has left one registry but not yet entered the other (because it is
 * being validated, opened or returned) is counted as reserved, so the number of in-use
 * plus reserved handles never exceeds {@code maxConnections}.</p>
 */
public class ConnectionPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);

    private static final long MAX_JITTER_NANOS = 1_000_000L;

    private final PoolConfig config;
    private final BackendAdapter adapter;
    private final PoolMetrics metrics;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition released = lock.newCondition();
    private final PriorityQueue<IdleEntry> idle = new PriorityQueue<>(IdleEntry.OLDEST_FIRST);
    private final Map<ConnectionHandle, InUseEntry> inUse = new HashMap<>();
    private int reserved;
    private boolean closed;

    private final AtomicLong totalCheckouts = new AtomicLong(0);
    private final AtomicLong totalCheckins = new AtomicLong(0);
    private final AtomicLong totalCreated = new AtomicLong(0);
    private final AtomicLong totalClosed = new AtomicLong(0);
    private final AtomicLong totalExhausted = new AtomicLong(0);

    public ConnectionPool(PoolConfig config, BackendAdapter adapter) {
        this(config, adapter, new NoOpPoolMetrics());
    }

    public ConnectionPool(PoolConfig config, BackendAdapter adapter, PoolMetrics metrics) {
        this(config, adapter, metrics, Clock.systemUTC());
    }

    public ConnectionPool(PoolConfig config, BackendAdapter adapter, PoolMetrics metrics, Clock clock) {
        this.config = config;
        this.adapter = adapter;
        this.metrics = metrics;
        this.clock = clock;
        metrics.registerGauges(this::getStats);
        log.info("Connection pool initialized: {} backend={}", config, adapter.getName());
    }

    /**
     * Checks out a connection, waiting up to the configured wait timeout for one to
     * become available.
     *
     * @throws PoolTimeoutException    if the pool stayed full until the deadline
     * @throws BackendConnectException if the last attempt to open a connection failed
     */
    public ConnectionHandle connect() {
        return checkout(config.getWaitTimeout());
    }

    /**
     * Checks out a connection without waiting.
     *
     * @throws PoolExhaustedException  if {@code maxConnections} are in use and none is idle
     * @throws BackendConnectException if a new connection was needed and could not be opened
     */
    public ConnectionHandle checkout() {
        ConnectionHandle handle = acquire();
        metrics.recordCheckout(Duration.ZERO);
        return handle;
    }

    /**
     * Checks out a connection, retrying a full pool every {@code retryInterval} until
     * {@code waitTimeout} elapses. A checkin wakes waiters early.
     *
     * @param waitTimeout zero to fail immediately, {@link PoolConfig#WAIT_FOREVER} to never give up
     */
    public ConnectionHandle checkout(Duration waitTimeout) {
        if (waitTimeout.isZero()) {
            return checkout();
        }

        long start = System.nanoTime();
        long retryNanos = config.getRetryInterval().toNanos();
        long waitNanos = saturatedNanos(waitTimeout);
        boolean forever = PoolConfig.WAIT_FOREVER.equals(waitTimeout) || waitNanos == Long.MAX_VALUE;

        while (true) {
            ConnectionPoolException lastFailure;
            try {
                ConnectionHandle handle = acquire();
                metrics.recordCheckout(Duration.ofNanos(System.nanoTime() - start));
                return handle;
            } catch (PoolExhaustedException | BackendConnectException e) {
                lastFailure = e;
            }

            long remaining = waitNanos - (System.nanoTime() - start);
            if (!forever && remaining <= 0) {
                if (lastFailure instanceof BackendConnectException) {
                    throw lastFailure;
                }
                throw new PoolTimeoutException("Max connections exceeded, timed out after "
                        + waitTimeout.toMillis() + "ms attempting to connect", lastFailure);
            }
            awaitRelease(forever ? retryNanos : Math.min(retryNanos, remaining));
        }
    }

    /**
     * Returns a connection to the pool. Unknown or already returned handles are ignored.
     * Never throws: a connection that cannot be reused is closed instead.
     */
    public void checkin(ConnectionHandle handle) {
        if (handle == null) {
            return;
        }

        InUseEntry entry;
        lock.lock();
        try {
            entry = inUse.remove(handle);
            if (entry == null) {
                log.debug("Ignoring checkin of untracked {}", handle);
                return;
            }
            reserved++;
        } finally {
            lock.unlock();
        }

        totalCheckins.incrementAndGet();
        metrics.recordCheckin();

        boolean reuse = false;
        try {
            if (isStale(entry.createdAt())) {
                log.debug("{} is stale on checkin, closing", handle);
                closeQuietly(handle, CloseReason.STALE);
            } else if (!adapter.canReuse(handle.connection())) {
                log.debug("Backend refused reuse of {}, closing", handle);
                closeQuietly(handle, CloseReason.REFUSED);
            } else {
                reuse = true;
            }
        } catch (RuntimeException e) {
            log.warn("Reuse check failed for {}, closing: {}", handle, e.getMessage());
            closeQuietly(handle, CloseReason.REFUSED);
        }

        boolean poolClosed;
        lock.lock();
        try {
            reserved--;
            poolClosed = closed;
            if (reuse && !poolClosed) {
                idle.add(new IdleEntry(jittered(now()), handle));
            }
            released.signalAll();
        } finally {
            lock.unlock();
        }

        if (reuse && poolClosed) {
            closeQuietly(handle, CloseReason.SHUTDOWN);
        }
        log.debug("Checked in {} (reused={})", handle, reuse && !poolClosed);
    }

    /**
     * Stops tracking a checked-out connection and closes it instead of recycling it.
     *
     * @return false if the handle was not checked out from this pool
     */
    public boolean manualClose(ConnectionHandle handle) {
        if (handle == null) {
            return false;
        }
        lock.lock();
        try {
            if (inUse.remove(handle) == null) {
                return false;
            }
            released.signalAll();
        } finally {
            lock.unlock();
        }
        closeQuietly(handle, CloseReason.MANUAL);
        return true;
    }

    /**
     * Closes every idle connection.
     *
     * @return the number of connections closed
     */
    public int closeIdle() {
        List<IdleEntry> drained;
        lock.lock();
        try {
            drained = new ArrayList<>(idle);
            idle.clear();
        } finally {
            lock.unlock();
        }

        try (LogContext ctx = LogContext.forPool(config.getPoolName(), "closeIdle")) {
            for (IdleEntry entry : drained) {
                closeQuietly(entry.handle(), CloseReason.IDLE);
            }
            log.info("Closed {} idle connections", drained.size());
        }
        return drained.size();
    }

    /**
     * Closes the default 10 minute stale set; see {@link #closeStale(Duration)}.
     */
    public int closeStale() {
        return closeStale(Duration.ofMinutes(10));
    }

    /**
     * Force-closes connections that have been checked out for at least {@code age}.
     * Meant to reclaim connections from callers that never check in.
     *
     * @return the number of connections closed
     */
    public int closeStale(Duration age) {
        Instant cutoff = now().minus(age);
        List<ConnectionHandle> leaked = new ArrayList<>();
        lock.lock();
        try {
            Iterator<InUseEntry> it = inUse.values().iterator();
            while (it.hasNext()) {
                InUseEntry entry = it.next();
                if (!entry.checkedOutAt().isAfter(cutoff)) {
                    leaked.add(entry.handle());
                    it.remove();
                }
            }
            if (!leaked.isEmpty()) {
                released.signalAll();
            }
        } finally {
            lock.unlock();
        }

        try (LogContext ctx = LogContext.forPool(config.getPoolName(), "closeStale")
                .with("maxAge", age.toString())) {
            for (ConnectionHandle handle : leaked) {
                closeQuietly(handle, CloseReason.LEAKED);
            }
            if (!leaked.isEmpty()) {
                log.warn("Closed {} connections checked out for longer than {}", leaked.size(), age);
            }
        }
        return leaked.size();
    }

    /**
     * Closes every idle and every checked-out connection. Callers still holding a
     * handle will find its connection closed; use only at shutdown.
     */
    public void closeAll() {
        List<ConnectionHandle> handles = new ArrayList<>();
        lock.lock();
        try {
            for (IdleEntry entry : idle) {
                handles.add(entry.handle());
            }
            handles.addAll(inUse.keySet());
            idle.clear();
            inUse.clear();
            released.signalAll();
        } finally {
            lock.unlock();
        }

        try (LogContext ctx = LogContext.forPool(config.getPoolName(), "closeAll")
                .with("closeReason", CloseReason.SHUTDOWN.name())) {
            for (ConnectionHandle handle : handles) {
                closeQuietly(handle, CloseReason.SHUTDOWN);
            }
            log.info("Closed all {} pooled connections", handles.size());
        }
    }

    /**
     * Closes all connections and rejects further checkouts.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
        } finally {
            lock.unlock();
        }
        log.info("Closing connection pool '{}'", config.getPoolName());
        closeAll();
    }

    public boolean isCheckedOut(ConnectionHandle handle) {
        lock.lock();
        try {
            return inUse.containsKey(handle);
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public PoolStats getStats() {
        int inUseCount;
        int idleCount;
        lock.lock();
        try {
            inUseCount = inUse.size();
            idleCount = idle.size();
        } finally {
            lock.unlock();
        }
        return new PoolStats(
                inUseCount,
                idleCount,
                config.getMaxConnections(),
                totalCheckouts.get(),
                totalCheckins.get(),
                totalCreated.get(),
                totalClosed.get(),
                totalExhausted.get()
        );
    }

    public PoolConfig getConfig() {
        return config;
    }

    public BackendAdapter getAdapter() {
        return adapter;
    }

    /**
     * Idle handles, oldest first.
     */
    List<ConnectionHandle> idleHandles() {
        lock.lock();
        try {
            List<IdleEntry> entries = new ArrayList<>(idle);
            entries.sort(IdleEntry.OLDEST_FIRST);
            List<ConnectionHandle> handles = new ArrayList<>(entries.size());
            for (IdleEntry entry : entries) {
                handles.add(entry.handle());
            }
            return handles;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Idle timestamps, oldest first.
     */
    List<Instant> idleTimestamps() {
        lock.lock();
        try {
            List<IdleEntry> entries = new ArrayList<>(idle);
            entries.sort(IdleEntry.OLDEST_FIRST);
            List<Instant> timestamps = new ArrayList<>(entries.size());
            for (IdleEntry entry : entries) {
                timestamps.add(entry.returnedAt());
            }
            return timestamps;
        } finally {
            lock.unlock();
        }
    }

    /**
     * The staleness timestamp of a checked-out handle, or null if it is not checked out.
     */
    Instant createdAt(ConnectionHandle handle) {
        lock.lock();
        try {
            InUseEntry entry = inUse.get(handle);
            return entry == null ? null : entry.createdAt();
        } finally {
            lock.unlock();
        }
    }

    // ========== internals ==========

    private ConnectionHandle acquire() {
        while (true) {
            IdleEntry candidate;
            lock.lock();
            try {
                if (closed) {
                    throw new IllegalStateException("Pool '" + config.getPoolName() + "' is closed");
                }
                candidate = idle.poll();
                if (candidate == null && config.isBounded()
                        && inUse.size() + reserved >= config.getMaxConnections()) {
                    totalExhausted.incrementAndGet();
                    metrics.recordExhausted();
                    throw new PoolExhaustedException(
                            "Exceeded maximum connections (" + config.getMaxConnections() + ")");
                }
                reserved++;
            } finally {
                lock.unlock();
            }

            if (candidate == null) {
                return create();
            }
            if (isUsable(candidate)) {
                return register(candidate.handle(), candidate.returnedAt());
            }
            unreserve();
        }
    }

    private boolean isUsable(IdleEntry candidate) {
        ConnectionHandle handle = candidate.handle();
        try {
            if (adapter.isClosed(handle.connection())) {
                // already dead, nothing to close
                log.debug("Discarding dead idle {}", handle);
                totalClosed.incrementAndGet();
                metrics.recordClosed(CloseReason.DEAD);
                return false;
            }
        } catch (RuntimeException e) {
            log.warn("Liveness check failed for {}, closing: {}", handle, e.getMessage());
            closeQuietly(handle, CloseReason.DEAD);
            return false;
        }
        if (isStale(candidate.returnedAt())) {
            log.debug("Closing stale idle {}", handle);
            closeQuietly(handle, CloseReason.STALE);
            return false;
        }
        return true;
    }

    private ConnectionHandle create() {
        Connection connection;
        try {
            connection = adapter.connect();
        } catch (SQLException e) {
            unreserve();
            throw new BackendConnectException(
                    "Could not open connection for pool '" + config.getPoolName() + "'", e);
        } catch (RuntimeException e) {
            unreserve();
            throw e;
        }
        totalCreated.incrementAndGet();
        metrics.recordCreated();
        ConnectionHandle handle = new ConnectionHandle(connection);
        log.debug("Opened new connection {}", handle);
        return register(handle, jittered(now()));
    }

    private ConnectionHandle register(ConnectionHandle handle, Instant createdAt) {
        lock.lock();
        try {
            reserved--;
            if (!closed) {
                inUse.put(handle, new InUseEntry(createdAt, handle, now()));
                totalCheckouts.incrementAndGet();
                log.debug("Checked out {} (inUse={}, idle={})", handle, inUse.size(), idle.size());
                return handle;
            }
            released.signalAll();
        } finally {
            lock.unlock();
        }
        closeQuietly(handle, CloseReason.SHUTDOWN);
        throw new IllegalStateException("Pool '" + config.getPoolName() + "' is closed");
    }

    private void unreserve() {
        lock.lock();
        try {
            reserved--;
            released.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void awaitRelease(long nanos) {
        lock.lock();
        try {
            released.awaitNanos(nanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PoolTimeoutException("Interrupted while waiting for a connection", e);
        } finally {
            lock.unlock();
        }
    }

    private boolean isStale(Instant timestamp) {
        return config.isStaleTimeoutEnabled()
                && Duration.between(timestamp, now()).compareTo(config.getStaleTimeout()) > 0;
    }

    private Instant now() {
        return clock.instant();
    }

    /**
     * Pushes a timestamp back by up to one millisecond so that connections returned at the
     * same instant are not always reused in the same order.
     */
    private static Instant jittered(Instant timestamp) {
        return timestamp.minusNanos(ThreadLocalRandom.current().nextLong(MAX_JITTER_NANOS));
    }

    private static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private void closeQuietly(ConnectionHandle handle, CloseReason reason) {
        totalClosed.incrementAndGet();
        metrics.recordClosed(reason);
        try {
            adapter.close(handle.connection());
        } catch (Exception e) {
            log.warn("Error closing {} ({}): {}", handle, reason, e.getMessage());
        }
    }
}
