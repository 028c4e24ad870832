package com.cypher.bridge.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * OpenTelemetry-based implementation of {@link TracingService}.
 * Requires {@code opentelemetry-api} on the classpath (optional dependency).
 *
 * <p>Every span is a {@link SpanKind#CLIENT} span tagged {@code db.system=postgresql},
 * so backends group statement spans with other database calls.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    public static final String INSTRUMENTATION_SCOPE = "com.cypher.bridge";
    static final String DB_SYSTEM_ATTRIBUTE = "db.system";
    static final String DB_SYSTEM = "postgresql";

    private final Tracer tracer;

    public OpenTelemetryTracingService(OpenTelemetry openTelemetry) {
        this(openTelemetry.getTracer(INSTRUMENTATION_SCOPE));
    }

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName);
        builder.setSpanKind(SpanKind.CLIENT);
        builder.setAttribute(DB_SYSTEM_ATTRIBUTE, DB_SYSTEM);
        if (attributes != null) {
            attributes.forEach(builder::setAttribute);
        }
        return new OTelSpan(builder.startSpan());
    }

    private static final class OTelSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;

        OTelSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setStatus(SpanStatus status) {
            delegate.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void recordException(Throwable t) {
            delegate.recordException(t);
        }

        @Override
        public void fail(int attempts, Throwable cause) {
            if (attempts > 0) {
                delegate.setAttribute(ATTEMPTS_ATTRIBUTE, (long) attempts);
            }
            if (cause != null) {
                delegate.recordException(cause);
                delegate.setStatus(StatusCode.ERROR, cause.getClass().getSimpleName());
            } else {
                delegate.setStatus(StatusCode.ERROR);
            }
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
