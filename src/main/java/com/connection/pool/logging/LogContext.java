package com.connection.pool.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scoped SLF4J MDC entries for pool maintenance logging.
 *
 * <p>Closing the context puts back whatever the MDC held for its keys before it was opened,
 * so a maintenance call made while the caller has its own {@code operation} tag leaves that
 * tag intact.</p>
 *
 * <pre>
 * try (LogContext ctx = LogContext.forPool("orders", "closeStale").with("maxAge", "PT10M")) {
 *     log.warn("Closed {} connections", n);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    public static LogContext forPool(String poolName, String operation) {
        return new LogContext()
                .with("poolName", poolName)
                .with("operation", operation);
    }

    public LogContext with(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
        return this;
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
