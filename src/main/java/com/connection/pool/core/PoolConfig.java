package com.connection.pool.core;

import java.time.Duration;

/**
 * Configuration for {@link ConnectionPool}.
 */
public class PoolConfig {

    /**
     * Wait timeout meaning "retry until a connection becomes available".
     */
    public static final Duration WAIT_FOREVER = Duration.ofSeconds(Long.MAX_VALUE);

    private final String poolName;
    private final int maxConnections;
    private final Duration staleTimeout;
    private final Duration waitTimeout;
    private final Duration retryInterval;
    private final Duration validationTimeout;

    private PoolConfig(Builder builder) {
        this.poolName = builder.poolName;
        this.maxConnections = builder.maxConnections;
        this.staleTimeout = builder.staleTimeout;
        this.waitTimeout = builder.waitTimeout;
        this.retryInterval = builder.retryInterval;
        this.validationTimeout = builder.validationTimeout;
    }

    public String getPoolName() { return poolName; }
    public int getMaxConnections() { return maxConnections; }
    public Duration getStaleTimeout() { return staleTimeout; }
    public Duration getWaitTimeout() { return waitTimeout; }
    public Duration getRetryInterval() { return retryInterval; }
    public Duration getValidationTimeout() { return validationTimeout; }

    public boolean isBounded() {
        return maxConnections > 0;
    }

    public boolean isStaleTimeoutEnabled() {
        return !staleTimeout.isZero();
    }

    public boolean isWaitForever() {
        return WAIT_FOREVER.equals(waitTimeout);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String poolName = "pool";
        private int maxConnections = 20;
        private Duration staleTimeout = Duration.ZERO;
        private Duration waitTimeout = Duration.ofSeconds(5);
        private Duration retryInterval = Duration.ofMillis(100);
        private Duration validationTimeout = Duration.ofSeconds(5);

        public Builder poolName(String poolName) {
            if (poolName == null || poolName.isBlank()) {
                throw new IllegalArgumentException("poolName must not be blank");
            }
            this.poolName = poolName;
            return this;
        }

        /**
         * @param maxConnections maximum number of checked-out connections, 0 for unbounded
         */
        public Builder maxConnections(int maxConnections) {
            if (maxConnections < 0) throw new IllegalArgumentException("maxConnections must be >= 0");
            this.maxConnections = maxConnections;
            return this;
        }

        /**
         * @param staleTimeout age after which a connection is closed instead of reused;
         *                     null or zero disables the check
         */
        public Builder staleTimeout(Duration staleTimeout) {
            if (staleTimeout != null && staleTimeout.isNegative()) {
                throw new IllegalArgumentException("staleTimeout must be >= 0");
            }
            this.staleTimeout = staleTimeout == null ? Duration.ZERO : staleTimeout;
            return this;
        }

        /**
         * @param waitTimeout how long {@link ConnectionPool#connect()} retries a full pool;
         *                    zero fails immediately, {@link #WAIT_FOREVER} never gives up
         */
        public Builder waitTimeout(Duration waitTimeout) {
            if (waitTimeout == null || waitTimeout.isNegative()) {
                throw new IllegalArgumentException("waitTimeout must be >= 0");
            }
            this.waitTimeout = waitTimeout;
            return this;
        }

        public Builder waitForever() {
            this.waitTimeout = WAIT_FOREVER;
            return this;
        }

        public Builder retryInterval(Duration retryInterval) {
            if (retryInterval == null || retryInterval.isZero() || retryInterval.isNegative()) {
                throw new IllegalArgumentException("retryInterval must be > 0");
            }
            this.retryInterval = retryInterval;
            return this;
        }

        public Builder validationTimeout(Duration validationTimeout) {
            if (validationTimeout == null || validationTimeout.isNegative()) {
                throw new IllegalArgumentException("validationTimeout must be >= 0");
            }
            this.validationTimeout = validationTimeout;
            return this;
        }

        public PoolConfig build() {
            return new PoolConfig(this);
        }
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
                "poolName='" + poolName + '\'' +
                ", maxConnections=" + maxConnections +
                ", staleTimeout=" + staleTimeout +
                ", waitTimeout=" + (isWaitForever() ? "forever" : waitTimeout.toString()) +
                ", retryInterval=" + retryInterval +
                ", validationTimeout=" + validationTimeout +
                '}';
    }
}
