package com.cypher.bridge.health;

/**
 * A single health check for one component (graph, pool, session).
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
