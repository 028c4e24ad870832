package com.cypher.bridge.graph;

import java.sql.SQLException;
import java.util.Locale;

/**
 * Runtime exception raised by a {@link GraphSession} when the bridge reports a failure.
 * The message may span several lines; {@link #firstLine()} yields the part that is
 * safe to show to callers.
 */
public class BridgeException extends RuntimeException {

    /**
     * Coarse classification of bridge failures, used for logging and metrics.
     */
    public enum Kind {
        /** Declared column schema does not match the returned row shape. */
        SCHEMA_MISMATCH,
        SYNTAX,
        CONNECTION,
        EXECUTION
    }

    private final String sqlState;
    private final Kind kind;

    public BridgeException(String message) {
        this(message, null, null);
    }

    public BridgeException(String message, String sqlState, Throwable cause) {
        super(message, cause);
        this.sqlState = sqlState;
        this.kind = classify(sqlState, message);
    }

    /**
     * Wraps a JDBC failure, keeping its SQLSTATE.
     */
    public static BridgeException from(SQLException e) {
        return new BridgeException(e.getMessage(), e.getSQLState(), e);
    }

    public String getSqlState() {
        return sqlState;
    }

    public Kind getKind() {
        return kind;
    }

    public String firstLine() {
        return firstLine(getMessage());
    }

    /**
     * Returns the first line of {@code text}, trimmed. Null yields an empty string.
     */
    public static String firstLine(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.strip();
        int cut = trimmed.length();
        int lf = trimmed.indexOf('\n');
        int cr = trimmed.indexOf('\r');
        if (lf >= 0) {
            cut = lf;
        }
        if (cr >= 0 && cr < cut) {
            cut = cr;
        }
        return trimmed.substring(0, cut).strip();
    }

    static Kind classify(String sqlState, String message) {
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if ("42804".equals(sqlState) || lower.contains("column definition list")) {
            return Kind.SCHEMA_MISMATCH;
        }
        if ("42601".equals(sqlState)) {
            return Kind.SYNTAX;
        }
        if (sqlState != null && sqlState.startsWith("08")) {
            return Kind.CONNECTION;
        }
        return Kind.EXECUTION;
    }
}
