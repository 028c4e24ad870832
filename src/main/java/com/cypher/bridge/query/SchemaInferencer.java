package com.cypher.bridge.query;

import com.cypher.bridge.core.model.ColumnSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the column schema to declare to the bridge from a statement's
 * {@code RETURN} clause.
 *
 * <p>This is a regex heuristic, not a parser. Items are split on every comma,
 * so a comma inside a function call, list or map literal starts a new item.
 * A single projected item always maps to the default schema because complex
 * nested values are hard to name and easy to mis-declare.</p>
 */
public final class SchemaInferencer {

    private static final Pattern RETURN_CLAUSE = Pattern.compile(
            "\\bRETURN\\s+(.+?)(?:\\s+(?:ORDER|LIMIT|SKIP|UNION)|$)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern ALIAS = Pattern.compile("\\s+AS\\s+(\\w+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern IDENTIFIER = Pattern.compile("(\\w+)");

    private SchemaInferencer() {
        // utility class
    }

    /**
     * Infers a schema for {@code statement}.
     *
     * @param statement     sanitized Cypher text
     * @param defaultSchema schema used when there is no RETURN clause or only one item
     * @return inferred schema, or {@code defaultSchema}
     */
    public static ColumnSpec inferSchema(String statement, ColumnSpec defaultSchema) {
        List<String> items = returnItems(statement);
        if (items.size() < 2) {
            return defaultSchema;
        }
        List<String> names = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            names.add(columnName(items.get(i), i + 1));
        }
        return ColumnSpec.ofNames(names);
    }

    /**
     * Returns the trimmed top-level items of the first RETURN clause, or an empty
     * list when the statement has none.
     */
    public static List<String> returnItems(String statement) {
        if (statement == null) {
            return List.of();
        }
        Matcher m = RETURN_CLAUSE.matcher(statement.strip());
        if (!m.find()) {
            return List.of();
        }
        String clause = m.group(1).strip();
        List<String> items = new ArrayList<>();
        for (String item : clause.split(",", -1)) {
            items.add(item.strip());
        }
        return items;
    }

    static String columnName(String item, int position) {
        Matcher alias = ALIAS.matcher(item);
        if (alias.find()) {
            return alias.group(1);
        }
        Matcher identifier = IDENTIFIER.matcher(item);
        if (identifier.find()) {
            return identifier.group(1);
        }
        return "col" + position;
    }
}
