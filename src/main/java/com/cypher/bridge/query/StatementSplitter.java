package com.cypher.bridge.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits raw multi-statement text into individual statements.
 *
 * <p>Splitting is naive: every {@code ;} is a boundary, including one inside a
 * string literal or a map. Pieces are trimmed and empty pieces are dropped, so
 * the returned statements are never blank.</p>
 */
public final class StatementSplitter {

    /** Statement terminator. */
    public static final char TERMINATOR = ';';

    private StatementSplitter() {
        // utility class
    }

    /**
     * Splits {@code text} on the terminator.
     *
     * @param text raw input, may be null
     * @return trimmed, non-empty statements in input order; empty when there are none
     */
    public static List<String> split(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> statements = new ArrayList<>();
        for (String piece : text.split(String.valueOf(TERMINATOR), -1)) {
            String statement = piece.strip();
            if (!statement.isEmpty()) {
                statements.add(statement);
            }
        }
        return List.copyOf(statements);
    }
}
