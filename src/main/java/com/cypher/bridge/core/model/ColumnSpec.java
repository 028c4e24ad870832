package com.cypher.bridge.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered, non-empty column schema declared to the bridge before a query runs.
 *
 * <p>Two canonical shapes exist: the default schema with the single column
 * {@value #DEFAULT_COLUMN_NAME}, and an inferred schema with one column per
 * projected item. Equality is by value, so an inferred schema that happens to
 * equal the default one is treated as the default.</p>
 */
public record ColumnSpec(List<ColumnDefinition> columns) {

    public static final String DEFAULT_COLUMN_NAME = "result";

    private static final ColumnSpec DEFAULT = new ColumnSpec(
            List.of(ColumnDefinition.graphValue(DEFAULT_COLUMN_NAME)));

    public ColumnSpec {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("A column schema needs at least one column");
        }
        columns = List.copyOf(columns);
    }

    /**
     * Returns the single-column fallback schema.
     */
    public static ColumnSpec defaultSpec() {
        return DEFAULT;
    }

    /**
     * Builds a graph-value schema from the given column names, in order.
     */
    public static ColumnSpec of(String... names) {
        return ofNames(List.of(names));
    }

    public static ColumnSpec ofNames(List<String> names) {
        List<ColumnDefinition> defs = new ArrayList<>(names.size());
        for (String name : names) {
            defs.add(ColumnDefinition.graphValue(name));
        }
        return new ColumnSpec(defs);
    }

    public List<String> names() {
        return columns.stream().map(ColumnDefinition::name).toList();
    }

    public int size() {
        return columns.size();
    }

    public boolean isDefault() {
        return DEFAULT.equals(this);
    }

    /**
     * Renders the column list for the bridge call, e.g. {@code (a agtype, b agtype)}.
     */
    public String toSql() {
        return columns.stream()
                .map(ColumnDefinition::toSql)
                .collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public String toString() {
        return "ColumnSpec" + names();
    }
}
