package com.cypher.bridge.core.model;

import java.util.Objects;

/**
 * One declared result column of a bridge invocation.
 * Every column carries the same opaque graph value type.
 */
public record ColumnDefinition(String name, String type) {

    /**
     * The single value kind the bridge can declare for graph results.
     */
    public static final String GRAPH_VALUE_TYPE = "agtype";

    public ColumnDefinition {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(type, "type is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Column name must not be blank");
        }
    }

    public static ColumnDefinition graphValue(String name) {
        return new ColumnDefinition(name, GRAPH_VALUE_TYPE);
    }

    /**
     * Renders this column as it appears inside an {@code AS (...)} list.
     */
    public String toSql() {
        return name + " " + type;
    }
}
