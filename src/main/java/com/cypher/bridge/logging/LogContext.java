package com.cypher.bridge.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper: entries added through this context are removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forStatement(correlationId, graphName)) {
 *     log.info("statement.executed rows={}", rows);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forStatement(String correlationId, String graphName) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("graph", graphName);
        ctx.put("operation", "statement");
        return ctx;
    }

    public static LogContext forBatch(String batchId, String graphName) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("graph", graphName);
        ctx.put("operation", "batch");
        return ctx;
    }

    /**
     * Context for loading one statement file; {@code source} is the file path or reader label.
     */
    public static LogContext forFile(String source) {
        LogContext ctx = new LogContext();
        ctx.put("source", source);
        ctx.put("operation", "load");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
