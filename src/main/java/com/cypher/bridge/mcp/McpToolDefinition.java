package com.cypher.bridge.mcp;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Definition of an MCP (Model Context Protocol) tool exposed to LLM agents.
 *
 * @param name        tool name, e.g. {@code send_cypher}
 * @param description what the tool does and how to call it
 * @param inputSchema JSON Schema of the tool's parameters
 * @param handler     executes the tool with the given parameters and returns a result map
 */
public record McpToolDefinition(
        String name,
        String description,
        Map<String, Object> inputSchema,
        Function<Map<String, Object>, Map<String, Object>> handler
) {
    public McpToolDefinition {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(description, "description is required");
        Objects.requireNonNull(inputSchema, "inputSchema is required");
        Objects.requireNonNull(handler, "handler is required");
        inputSchema = Map.copyOf(inputSchema);
    }

    public Map<String, Object> invoke(Map<String, Object> params) {
        return handler.apply(params != null ? params : Map.of());
    }
}
