package com.cypher.bridge.core.model;

import java.util.List;

/**
 * Result of an execution operation: either a success carrying rows or a failure
 * carrying a single-line message. Execution operations return an outcome instead
 * of throwing.
 */
public record Outcome(boolean success, List<Row> rows, String message) {

    public Outcome {
        rows = rows != null ? List.copyOf(rows) : List.of();
        if (success && message != null) {
            throw new IllegalArgumentException("A successful outcome has no message");
        }
        if (!success) {
            if (message == null) {
                throw new IllegalArgumentException("A failed outcome needs a message");
            }
            if (!rows.isEmpty()) {
                throw new IllegalArgumentException("A failed outcome has no rows");
            }
            if (message.indexOf('\n') >= 0 || message.indexOf('\r') >= 0) {
                throw new IllegalArgumentException("Failure message must be a single line");
            }
        }
    }

    public static Outcome success(List<Row> rows) {
        return new Outcome(true, rows, null);
    }

    public static Outcome empty() {
        return new Outcome(true, List.of(), null);
    }

    /**
     * Creates a failure. Only the first line of {@code message} is kept.
     */
    public static Outcome failure(String message) {
        return new Outcome(false, List.of(), firstLine(message));
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public int rowCount() {
        return rows.size();
    }

    private static String firstLine(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.strip();
        int end = 0;
        while (end < trimmed.length() && trimmed.charAt(end) != '\n' && trimmed.charAt(end) != '\r') {
            end++;
        }
        return trimmed.substring(0, end);
    }

    @Override
    public String toString() {
        return success
                ? "Outcome{success, rows=" + rows.size() + '}'
                : "Outcome{failure, message='" + message + "'}";
    }
}
