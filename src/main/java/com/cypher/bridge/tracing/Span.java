package com.cypher.bridge.tracing;

/**
 * A traced statement or batch. Closing the span ends it, so spans fit
 * try-with-resources:
 *
 * <pre>
 * try (Span span = tracingService.startStatementSpan("demo", "name,age")) {
 *     span.finish(2, rows.size());
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    /**
     * Marks a successful statement or batch with its attempt and row counts;
     * {@code attempts} is ignored when not positive.
     */
    default void finish(int attempts, int rows) {
        if (attempts > 0) {
            setAttribute(TracingService.ATTEMPTS_ATTRIBUTE, attempts);
        }
        setAttribute(TracingService.ROWS_ATTRIBUTE, rows);
        setStatus(SpanStatus.OK);
    }

    /**
     * Marks a failed statement after {@code attempts} bridge calls.
     */
    default void fail(int attempts, Throwable cause) {
        if (attempts > 0) {
            setAttribute(TracingService.ATTEMPTS_ATTRIBUTE, attempts);
        }
        if (cause != null) {
            recordException(cause);
        }
        setStatus(SpanStatus.ERROR);
    }

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
