package com.cypher.bridge.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One result row, keyed by the column names declared for the invocation that
 * produced it. Iteration follows the declared column order. Values may be null.
 */
public record Row(Map<String, Object> values) {

    public Row {
        values = values == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Object get(String column) {
        return values.get(column);
    }

    public List<String> columns() {
        return List.copyOf(values.keySet());
    }

    public int size() {
        return values.size();
    }
}
