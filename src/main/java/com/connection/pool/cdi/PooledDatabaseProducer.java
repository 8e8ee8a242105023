package com.connection.pool.cdi;

import com.connection.pool.core.PoolConfig;
import com.connection.pool.database.PooledDatabase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that builds a {@link PooledDatabase} from MicroProfile Config properties.
 *
 * <h2>Required configuration</h2>
 * <pre>
 * pooled-database:
 *   url: jdbc:postgresql://localhost:5432/app
 *   user: app
 *   password: secret
 *   pool:
 *     max-connections: 20
 *     stale-timeout-seconds: 300
 *     wait-timeout-millis: 5000
 * </pre>
 *
 * <p>{@code wait-timeout-millis} of {@code 0} fails immediately when the pool is full,
 * {@code -1} waits forever. {@code stale-timeout-seconds} of {@code 0} disables staleness.</p>
 */
@ApplicationScoped
public class PooledDatabaseProducer {

    private static final Logger log = LoggerFactory.getLogger(PooledDatabaseProducer.class);

    static final long WAIT_FOREVER = -1;

    // ── Backend ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "pooled-database.url")
    String url;

    @Inject
    @ConfigProperty(name = "pooled-database.user")
    Optional<String> user;

    @Inject
    @ConfigProperty(name = "pooled-database.password")
    Optional<String> password;

    @Inject
    @ConfigProperty(name = "pooled-database.autoconnect", defaultValue = "true")
    boolean autoconnect;

    // ── Connection Pool ───────────────────────────────────────

    @Inject
    @ConfigProperty(name = "pooled-database.pool.name", defaultValue = "pool")
    String poolName;

    @Inject
    @ConfigProperty(name = "pooled-database.pool.max-connections", defaultValue = "20")
    int maxConnections;

    @Inject
    @ConfigProperty(name = "pooled-database.pool.stale-timeout-seconds", defaultValue = "0")
    long staleTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "pooled-database.pool.wait-timeout-millis", defaultValue = "5000")
    long waitTimeoutMillis;

    @Inject
    @ConfigProperty(name = "pooled-database.pool.retry-interval-millis", defaultValue = "100")
    long retryIntervalMillis;

    @Inject
    @ConfigProperty(name = "pooled-database.pool.validation-timeout-seconds", defaultValue = "5")
    long validationTimeoutSeconds;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public PoolConfig poolConfig() {
        PoolConfig.Builder builder = PoolConfig.builder()
                .poolName(poolName)
                .maxConnections(maxConnections)
                .staleTimeout(Duration.ofSeconds(staleTimeoutSeconds))
                .retryInterval(Duration.ofMillis(retryIntervalMillis))
                .validationTimeout(Duration.ofSeconds(validationTimeoutSeconds));

        if (waitTimeoutMillis == WAIT_FOREVER) {
            builder.waitForever();
        } else {
            builder.waitTimeout(Duration.ofMillis(waitTimeoutMillis));
        }
        return builder.build();
    }

    @Produces
    @ApplicationScoped
    public PooledDatabase pooledDatabase(PoolConfig config) {
        log.info("Producing PooledDatabase: url={} pool={}", url, config);
        return PooledDatabase.builder()
                .url(url)
                .credentials(user.orElse(null), password.orElse(null))
                .poolConfig(config)
                .autoconnect(autoconnect)
                .build();
    }

    public void closeDatabase(@Disposes PooledDatabase database) {
        log.info("Closing PooledDatabase");
        database.shutdown();
    }
}
