package com.cypher.bridge.graph;

import java.util.regex.Pattern;

/**
 * Validation for graph names, which are interpolated into bridge SQL as a literal.
 */
public final class GraphNames {

    /** PostgreSQL identifier limit (NAMEDATALEN - 1). */
    public static final int MAX_LENGTH = 63;

    private static final Pattern VALID = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private GraphNames() {
        // utility class
    }

    public static boolean isValid(String graphName) {
        return graphName != null
                && graphName.length() <= MAX_LENGTH
                && VALID.matcher(graphName).matches();
    }

    /**
     * Returns {@code graphName} unchanged if it is a valid graph name.
     *
     * @throws IllegalArgumentException if it is not
     */
    public static String validate(String graphName) {
        if (graphName == null || graphName.isBlank()) {
            throw new IllegalArgumentException("Graph name must not be null or blank");
        }
        if (graphName.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(
                    "Graph name exceeds maximum length of " + MAX_LENGTH +
                            " characters (was " + graphName.length() + ")");
        }
        if (!VALID.matcher(graphName).matches()) {
            throw new IllegalArgumentException(
                    "Graph name must start with a letter or underscore and contain only " +
                            "letters, digits and underscores, got: '" + graphName + "'");
        }
        return graphName;
    }
}
