package com.cypher.bridge.query;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts pure Cypher from text that arrives wrapped in bridge-call syntax.
 *
 * <p>Upstream generators sometimes echo the whole
 * {@code SELECT * FROM cypher('g', $$ ... $$) AS (...);} wrapper, or just the
 * {@code cypher(..., $$ ... $$)} call, instead of the query itself. The full
 * wrapper is tried first, then the bare call. Unwrapping repeats until neither
 * pattern matches, and trailing terminators and whitespace are always removed,
 * which makes {@link #sanitize(String)} idempotent.</p>
 */
public final class QuerySanitizer {

    private static final Pattern SQL_WRAPPER = Pattern.compile(
            "SELECT\\s+\\*\\s+FROM\\s+cypher\\([^$]*\\$\\$\\s*(?<cypher>.+?)\\s*\\$\\$\\)\\s+AS\\s*\\([^)]+\\);?",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern CYPHER_CALL = Pattern.compile(
            "cypher\\([^$]*\\$\\$\\s*(?<cypher>.+?)\\s*\\$\\$\\)\\s*;?",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private QuerySanitizer() {
        // utility class
    }

    /**
     * Returns the inner Cypher text of {@code text}, or {@code text} itself with
     * trailing terminators removed when it is not wrapped.
     *
     * @param text statement text, may be null
     * @return sanitized query, empty when nothing remains
     */
    public static String sanitize(String text) {
        if (text == null) {
            return "";
        }
        String current = stripTerminators(text);
        String inner = unwrapOnce(current);
        while (inner != null) {
            String next = stripTerminators(inner);
            if (next.equals(current)) {
                break;
            }
            current = next;
            inner = unwrapOnce(current);
        }
        return current;
    }

    /**
     * Returns true if {@code text} contains a full bridge wrapper or a bare bridge call.
     */
    public static boolean isBridgeWrapped(String text) {
        return text != null && unwrapOnce(text.strip()) != null;
    }

    private static String unwrapOnce(String text) {
        Matcher m = SQL_WRAPPER.matcher(text);
        if (m.find()) {
            return m.group("cypher");
        }
        m = CYPHER_CALL.matcher(text);
        if (m.find()) {
            return m.group("cypher");
        }
        return null;
    }

    static String stripTerminators(String text) {
        int end = text.length();
        while (end > 0) {
            char c = text.charAt(end - 1);
            if (c == StatementSplitter.TERMINATOR || Character.isWhitespace(c)) {
                end--;
            } else {
                break;
            }
        }
        return text.substring(0, end).strip();
    }
}
