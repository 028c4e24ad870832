package com.cypher.bridge.mcp;

import com.cypher.bridge.api.ExecutionCoordinator;
import com.cypher.bridge.core.model.Outcome;
import com.cypher.bridge.core.model.Row;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the MCP tool that lets an LLM agent run Cypher against the graph.
 *
 * <p>Available tools:</p>
 * <ul>
 *   <li>{@code send_cypher}: executes one or more {@code ;}-separated statements as a batch</li>
 * </ul>
 *
 * <p>The handler never throws. It returns {@code success}, and either
 * {@code rowCount}, {@code columns} and {@code rows}, or {@code error}.</p>
 */
public final class CypherMcpTools {

    public static final String SEND_CYPHER = "send_cypher";

    private static final String SEND_CYPHER_DESCRIPTION =
            "Execute a pure Cypher query on the AGE/PostgreSQL graph database and return results. "
                    + "Pass the Cypher statement only: no SQL wrapper, no graph name, no trailing semicolon. "
                    + "Examples: MATCH (n) RETURN n AS node | MATCH (p:Person) RETURN count(p) AS count | "
                    + "CREATE (:Person {name: 'Alice'}). Use it to retrieve, create, update, delete, count, "
                    + "filter or analyze graph data; do not use it for conceptual or syntax questions.";

    private final ExecutionCoordinator coordinator;

    public CypherMcpTools(ExecutionCoordinator coordinator) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator is required");
    }

    public List<McpToolDefinition> getToolDefinitions() {
        return List.of(buildSendCypherTool());
    }

    public Optional<McpToolDefinition> getTool(String name) {
        return getToolDefinitions().stream()
                .filter(t -> t.name().equals(name))
                .findFirst();
    }

    private McpToolDefinition buildSendCypherTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "query", Map.of("type", "string", "description",
                                "The full Cypher statement, e.g. MATCH (n) RETURN n AS node")
                ),
                "required", List.of("query")
        );

        return new McpToolDefinition(SEND_CYPHER, SEND_CYPHER_DESCRIPTION, schema, params -> {
            Object query = params.get("query");
            if (!(query instanceof String text) || text.isBlank()) {
                return Map.of("success", false, "error", "Parameter 'query' is required");
            }
            Outcome outcome = coordinator.executeBatch(text);
            if (outcome.isFailure()) {
                return Map.of("success", false, "error", outcome.message());
            }
            return toResult(outcome.rows());
        });
    }

    private static Map<String, Object> toResult(List<Row> rows) {
        List<Map<String, Object>> rowMaps = new ArrayList<>(rows.size());
        for (Row row : rows) {
            // row values may hold nulls, so no Map.copyOf here
            rowMaps.add(row.values());
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("rowCount", rows.size());
        result.put("columns", rows.isEmpty() ? List.of() : rows.get(0).columns());
        result.put("rows", rowMaps);
        return result;
    }
}
