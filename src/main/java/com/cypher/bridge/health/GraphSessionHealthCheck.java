package com.cypher.bridge.health;

import com.cypher.bridge.graph.GraphSession;

/**
 * Reports whether the engine's session is still open. Used when the engine
 * was given a session instead of a connection pool.
 */
public class GraphSessionHealthCheck implements HealthCheck {

    private final GraphSession session;

    public GraphSessionHealthCheck(GraphSession session) {
        this.session = session;
    }

    @Override
    public String getName() {
        return "graphSession";
    }

    @Override
    public HealthStatus check() {
        return session.isOpen()
                ? HealthStatus.up()
                : HealthStatus.down("Graph session is closed");
    }
}
