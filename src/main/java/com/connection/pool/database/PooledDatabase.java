package com.connection.pool.database;

import com.connection.pool.backend.BackendAdapter;
import com.connection.pool.backend.BackendAdapters;
import com.connection.pool.core.ConnectionHandle;
import com.connection.pool.core.ConnectionPool;
import com.connection.pool.core.PoolConfig;
import com.connection.pool.health.ConnectionPoolHealthCheck;
import com.connection.pool.health.HealthStatus;
import com.connection.pool.metrics.NoOpPoolMetrics;
import com.connection.pool.metrics.PoolMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Properties;

/**
 * Database entry point that multiplexes callers onto a {@link ConnectionPool}.
 *
 * <p>Each thread has at most one current connection. {@link #connect()} checks one out
 * and binds it to the calling thread, {@link #close()} returns it to the pool rather than
 * closing it. The statement helpers ({@link #execute}, {@link #query}, ...) use the
 * current connection when there is one; otherwise, with autoconnect on, they check a
 * connection out for the single call and return it afterwards. Outside {@link #atomic} every
 * statement is committed, whatever auto-commit mode the connection was left in.</p>
 *
 * <pre>
 * PooledDatabase db = PooledDatabase.builder()
 *         .url("jdbc:postgresql://localhost/app")
 *         .poolConfig(PoolConfig.builder().maxConnections(10).build())
 *         .build();
 * db.execute("UPDATE account SET balance = balance - ? WHERE id = ?", 10, 42);
 * </pre>
 */
public class PooledDatabase {
    private static final Logger log = LoggerFactory.getLogger(PooledDatabase.class);

    private final ConnectionPool pool;
    private final boolean autoconnect;
    private final ThreadLocal<ConnectionHandle> current = new ThreadLocal<>();
    private final ThreadLocal<Boolean> inTransaction = ThreadLocal.withInitial(() -> false);

    public PooledDatabase(ConnectionPool pool) {
        this(pool, true);
    }

    public PooledDatabase(ConnectionPool pool, boolean autoconnect) {
        this.pool = pool;
        this.autoconnect = autoconnect;
    }

    // ========== connection lifecycle ==========

    /**
     * Checks out a connection for the calling thread, waiting up to the pool's wait timeout.
     *
     * @return false if the thread already holds a connection
     */
    public boolean connect() {
        ConnectionHandle existing = current.get();
        if (existing != null) {
            if (pool.isCheckedOut(existing)) {
                return false;
            }
            // reclaimed by closeStale or closeAll
            current.remove();
        }
        current.set(pool.connect());
        return true;
    }

    /**
     * Returns the calling thread's connection to the pool.
     *
     * @return false if the thread held no connection
     */
    public boolean close() {
        ConnectionHandle handle = current.get();
        if (handle == null) {
            return false;
        }
        current.remove();
        pool.checkin(handle);
        return true;
    }

    /**
     * Closes the calling thread's connection without returning it to the pool.
     *
     * @return false if the thread held no connection
     */
    public boolean manualClose() {
        ConnectionHandle handle = current.get();
        if (handle == null) {
            return false;
        }
        current.remove();
        return pool.manualClose(handle);
    }

    public boolean isClosed() {
        return current.get() == null;
    }

    /**
     * The calling thread's current connection.
     *
     * @throws IllegalStateException if {@link #connect()} has not been called
     */
    public Connection connection() {
        return currentHandle().connection();
    }

    public ConnectionHandle currentHandle() {
        ConnectionHandle handle = current.get();
        if (handle == null) {
            throw new IllegalStateException("No connection open on this thread; call connect() first");
        }
        return handle;
    }

    public int closeIdle() {
        return pool.closeIdle();
    }

    public int closeStale(Duration age) {
        return pool.closeStale(age);
    }

    public int closeStale() {
        return pool.closeStale();
    }

    /**
     * Closes every pooled connection, including ones other threads are using.
     */
    public void closeAll() {
        current.remove();
        pool.closeAll();
    }

    /**
     * Closes the pool. The database cannot be used afterwards.
     */
    public void shutdown() {
        current.remove();
        pool.close();
    }

    public ConnectionPool getPool() {
        return pool;
    }

    public boolean isAutoconnect() {
        return autoconnect;
    }

    public HealthStatus health() {
        return new ConnectionPoolHealthCheck(pool).check();
    }

    // ========== statements ==========

    /**
     * Runs an INSERT, UPDATE, DELETE or DDL statement.
     *
     * @return the update count
     */
    public int execute(String sql, Object... params) {
        return withConnection(conn -> {
            try (PreparedStatement statement = conn.prepareStatement(sql)) {
                bind(statement, params);
                return statement.executeUpdate();
            }
        });
    }

    /**
     * Runs a query and returns every row as a column-label to value map.
     */
    public List<Map<String, Object>> query(String sql, Object... params) {
        return withConnection(conn -> {
            try (PreparedStatement statement = conn.prepareStatement(sql)) {
                bind(statement, params);
                try (ResultSet rs = statement.executeQuery()) {
                    return readRows(rs);
                }
            }
        });
    }

    /**
     * Runs an INSERT and returns the first generated key, or null if the driver returned none.
     */
    public Object insert(String sql, Object... params) {
        return withConnection(conn -> {
            try (PreparedStatement statement = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
                bind(statement, params);
                statement.executeUpdate();
                try (ResultSet keys = statement.getGeneratedKeys()) {
                    return keys != null && keys.next() ? keys.getObject(1) : null;
                }
            }
        });
    }

    /**
     * Returns the first row of a query.
     *
     * @throws NoSuchElementException if the query returned no rows
     */
    public Map<String, Object> get(String sql, Object... params) {
        List<Map<String, Object>> rows = query(sql, params);
        if (rows.isEmpty()) {
            throw new NoSuchElementException("Query returned no rows");
        }
        return rows.get(0);
    }

    public Map<String, Object> getOrNull(String sql, Object... params) {
        List<Map<String, Object>> rows = query(sql, params);
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Runs {@code work} in a transaction and commits it.
     */
    public <T> T atomic(SqlWork<T> work) {
        return atomic(work, true);
    }

    /**
     * Runs {@code work} in a transaction on one connection. The transaction is committed when
     * {@code commit} is true and rolled back otherwise; any exception rolls it back and is
     * rethrown. Statement helpers called by {@code work} on this thread join the transaction.
     */
    public <T> T atomic(SqlWork<T> work, boolean commit) {
        boolean owned = acquireForCall();
        boolean outer = !inTransaction.get();
        try {
            Connection conn = connection();
            boolean previousAutoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            inTransaction.set(true);
            try {
                T result = work.run(conn);
                if (commit) {
                    conn.commit();
                } else {
                    conn.rollback();
                }
                return result;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn);
                throw e;
            } finally {
                if (outer) {
                    inTransaction.set(false);
                }
                restoreAutoCommitQuietly(conn, previousAutoCommit);
            }
        } catch (SQLException e) {
            throw new DatabaseException("Transaction failed: " + e.getMessage(), e);
        } finally {
            if (owned) {
                close();
            }
        }
    }

    /**
     * Runs {@code work} on the thread's current connection, or on a connection checked out
     * for this call only. Unless the call is part of {@link #atomic}, the work is committed
     * when the connection is not in auto-commit mode.
     */
    public <T> T withConnection(SqlWork<T> work) {
        boolean owned = acquireForCall();
        try {
            Connection conn = connection();
            T result = work.run(conn);
            if (!inTransaction.get() && !conn.getAutoCommit()) {
                conn.commit();
            }
            return result;
        } catch (SQLException e) {
            throw new DatabaseException("Statement failed: " + e.getMessage(), e);
        } finally {
            if (owned) {
                close();
            }
        }
    }

    private boolean acquireForCall() {
        ConnectionHandle handle = current.get();
        if (handle != null) {
            if (pool.isCheckedOut(handle)) {
                return false;
            }
            log.debug("Dropping {} reclaimed by the pool", handle);
            current.remove();
        }
        if (!autoconnect) {
            throw new IllegalStateException("No connection open on this thread and autoconnect is disabled");
        }
        return connect();
    }

    private static void bind(PreparedStatement statement, Object[] params) throws SQLException {
        if (params == null) {
            return;
        }
        for (int i = 0; i < params.length; i++) {
            statement.setObject(i + 1, params[i]);
        }
    }

    private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columns = meta.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columns; i++) {
                row.put(meta.getColumnLabel(i), rs.getObject(i));
            }
            rows.add(row);
        }
        return rows;
    }

    private static void restoreAutoCommitQuietly(Connection conn, boolean autoCommit) {
        try {
            conn.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            log.warn("Could not restore auto-commit={}: {}", autoCommit, e.getMessage());
        }
    }

    private static void rollbackQuietly(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed: {}", e.getMessage());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String url;
        private Properties properties = new Properties();
        private BackendAdapter adapter;
        private PoolConfig poolConfig = PoolConfig.builder().build();
        private PoolMetrics metrics = new NoOpPoolMetrics();
        private ConnectionPool pool;
        private boolean autoconnect = true;

        /**
         * JDBC URL; the backend adapter is chosen from its prefix unless {@link #adapter} is set.
         */
        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder properties(Properties properties) {
            this.properties = properties;
            return this;
        }

        public Builder credentials(String user, String password) {
            if (user != null) {
                properties.setProperty("user", user);
            }
            if (password != null) {
                properties.setProperty("password", password);
            }
            return this;
        }

        public Builder adapter(BackendAdapter adapter) {
            this.adapter = adapter;
            return this;
        }

        public Builder poolConfig(PoolConfig poolConfig) {
            this.poolConfig = poolConfig;
            return this;
        }

        public Builder metrics(PoolMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Uses an existing pool; url, adapter, config and metrics are ignored.
         */
        public Builder pool(ConnectionPool pool) {
            this.pool = pool;
            return this;
        }

        public Builder autoconnect(boolean autoconnect) {
            this.autoconnect = autoconnect;
            return this;
        }

        public PooledDatabase build() {
            if (pool != null) {
                return new PooledDatabase(pool, autoconnect);
            }
            BackendAdapter backend = adapter;
            if (backend == null) {
                if (url == null) {
                    throw new IllegalStateException("Either url, adapter or pool is required");
                }
                backend = BackendAdapters.forUrl(url, properties, poolConfig.getValidationTimeout());
            }
            return new PooledDatabase(new ConnectionPool(poolConfig, backend, metrics), autoconnect);
        }
    }
}
