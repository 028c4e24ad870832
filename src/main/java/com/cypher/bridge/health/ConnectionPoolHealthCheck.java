package com.cypher.bridge.health;

import com.zaxxer.hikari.HikariPoolMXBean;

/**
 * Health check for the HikariCP pool. Reports DEGRADED while callers are waiting
 * for a connection, and DOWN when the pool is not running.
 */
public class ConnectionPoolHealthCheck implements HealthCheck {

    private final HikariPoolMXBean pool;
    private final int maximumPoolSize;

    public ConnectionPoolHealthCheck(HikariPoolMXBean pool, int maximumPoolSize) {
        this.pool = pool;
        this.maximumPoolSize = maximumPoolSize;
    }

    @Override
    public String getName() {
        return "connectionPool";
    }

    @Override
    public HealthStatus check() {
        if (pool == null) {
            return HealthStatus.down("Connection pool is not running");
        }
        try {
            int active = pool.getActiveConnections();
            int idle = pool.getIdleConnections();
            int total = pool.getTotalConnections();
            int waiting = pool.getThreadsAwaitingConnection();

            HealthStatus base = waiting > 0
                    ? HealthStatus.degraded(waiting + " thread(s) waiting for a connection")
                    : HealthStatus.up();

            return base
                    .withDetail("totalConnections", total)
                    .withDetail("activeConnections", active)
                    .withDetail("idleConnections", idle)
                    .withDetail("threadsAwaiting", waiting)
                    .withDetail("maximumPoolSize", maximumPoolSize);
        } catch (Exception e) {
            return HealthStatus.down("Connection pool check failed: " + e.getMessage());
        }
    }
}
