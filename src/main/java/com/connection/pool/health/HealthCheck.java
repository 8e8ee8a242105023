package com.connection.pool.health;

/**
 * A named check that reports the current state of one component.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
