package com.cypher.bridge.tracing;

import java.util.Map;

/**
 * Default {@link TracingService} when no tracer is configured. Statement and
 * batch spans are the same inert instance, so tracing costs nothing per call.
 */
public class NoOpTracingService implements TracingService {

    private static final Span NO_OP_SPAN = new NoOpSpan();

    @Override
    public Span startSpan(String operationName) {
        return NO_OP_SPAN;
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return NO_OP_SPAN;
    }

    @Override
    public Span startStatementSpan(String graphName, String columns) {
        return NO_OP_SPAN;
    }

    @Override
    public Span startBatchSpan(String graphName, int statements) {
        return NO_OP_SPAN;
    }

    private static final class NoOpSpan implements Span {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void setStatus(SpanStatus status) {
        }

        @Override
        public void recordException(Throwable t) {
        }

        @Override
        public void finish(int attempts, int rows) {
        }

        @Override
        public void fail(int attempts, Throwable cause) {
        }

        @Override
        public void close() {
        }
    }
}
