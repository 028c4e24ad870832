package com.cypher.bridge.health;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;

/**
 * Checks that the server is reachable and the graph exists in {@code ag_catalog.ag_graph}.
 * Borrows a pooled connection so the engine's own session is not touched.
 */
public class AgeGraphHealthCheck implements HealthCheck {

    static final String GRAPH_EXISTS_SQL = "SELECT count(*) FROM ag_catalog.ag_graph WHERE name = ?";

    private final DataSource dataSource;
    private final String graphName;

    public AgeGraphHealthCheck(DataSource dataSource, String graphName) {
        this.dataSource = dataSource;
        this.graphName = graphName;
    }

    @Override
    public String getName() {
        return "age";
    }

    @Override
    public HealthStatus check() {
        long startMs = System.currentTimeMillis();
        try (Connection connection = dataSource.getConnection();
             PreparedStatement stmt = connection.prepareStatement(GRAPH_EXISTS_SQL)) {
            stmt.setString(1, graphName);
            long count;
            try (ResultSet rs = stmt.executeQuery()) {
                count = rs.next() ? rs.getLong(1) : 0;
            }
            long latencyMs = System.currentTimeMillis() - startMs;
            HealthStatus base = count > 0
                    ? HealthStatus.up()
                    : HealthStatus.down("Graph '" + graphName + "' does not exist");
            return base
                    .withDetail("latencyMs", latencyMs)
                    .withDetail("graphName", graphName);
        } catch (Exception e) {
            return HealthStatus.down("AGE connection failed: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName());
        }
    }
}
