package com.cypher.bridge.api;

import com.cypher.bridge.core.model.ColumnSpec;
import com.cypher.bridge.core.model.Outcome;
import com.cypher.bridge.core.model.Row;
import com.cypher.bridge.graph.BridgeException;
import com.cypher.bridge.graph.GraphSession;
import com.cypher.bridge.logging.LogContext;
import com.cypher.bridge.metrics.MetricsService;
import com.cypher.bridge.metrics.NoOpMetricsService;
import com.cypher.bridge.query.QuerySanitizer;
import com.cypher.bridge.query.SchemaInferencer;
import com.cypher.bridge.query.StatementSplitter;
import com.cypher.bridge.tracing.NoOpTracingService;
import com.cypher.bridge.tracing.Span;
import com.cypher.bridge.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs Cypher statements through a {@link GraphSession}.
 *
 * <p>For each statement: sanitize, infer a column schema, invoke the bridge, then
 * commit on success or roll back on failure. If the bridge rejects an inferred
 * schema, the statement is retried once with the default schema. Batches run
 * statement by statement and stop at the first failure; statements that already
 * succeeded stay committed.</p>
 *
 * <p>Neither operation throws. Every failure becomes an {@link Outcome} whose
 * message is {@code "Cypher error: "} followed by the first line of the
 * underlying error. Calls are serialized, so one coordinator can be shared
 * between threads without interleaving transactions on its session.</p>
 */
public class ExecutionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);

    static final String ERROR_PREFIX = "Cypher error: ";

    private final GraphSession session;
    private final ExecutionOptions defaultOptions;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final ReentrantLock lock = new ReentrantLock();

    public ExecutionCoordinator(GraphSession session) {
        this(session, ExecutionOptions.defaults(), new NoOpMetricsService(), new NoOpTracingService());
    }

    public ExecutionCoordinator(GraphSession session, ExecutionOptions defaultOptions,
                                MetricsService metricsService, TracingService tracingService) {
        if (session == null) {
            throw new IllegalArgumentException("GraphSession is required");
        }
        this.session = session;
        this.defaultOptions = defaultOptions != null ? defaultOptions : ExecutionOptions.defaults();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.tracingService = tracingService != null ? tracingService : new NoOpTracingService();
    }

    public Outcome executeStatement(String text) {
        return executeStatement(text, defaultOptions);
    }

    /**
     * Executes one statement.
     *
     * @param text    statement text, possibly wrapped in bridge-call syntax
     * @param options graph, default schema and verbosity for this call
     * @return rows on success; a single-line failure otherwise. Blank input yields an empty success.
     */
    public Outcome executeStatement(String text, ExecutionOptions options) {
        ExecutionOptions opts = options != null ? options : defaultOptions;
        lock.lock();
        try (LogContext ignored = LogContext.forStatement(LogContext.generateCorrelationId(), opts.getGraphName())) {
            return runStatement(text, opts);
        } finally {
            lock.unlock();
        }
    }

    public Outcome executeBatch(String text) {
        return executeBatch(text, defaultOptions);
    }

    /**
     * Splits {@code text} into statements and executes them in order, stopping at
     * the first failure. Rows of all statements are concatenated.
     */
    public Outcome executeBatch(String text, ExecutionOptions options) {
        ExecutionOptions opts = options != null ? options : defaultOptions;
        List<String> statements = StatementSplitter.split(text);
        if (statements.isEmpty()) {
            return Outcome.empty();
        }
        if (statements.size() == 1) {
            return executeStatement(statements.get(0), opts);
        }

        lock.lock();
        try (LogContext ignored = LogContext.forBatch(LogContext.generateCorrelationId(), opts.getGraphName());
             Span span = tracingService.startBatchSpan(opts.getGraphName(), statements.size())) {
            metricsService.recordBatchSize(statements.size());
            logEvent(opts, "batch.started statements={}", statements.size());

            List<Row> allRows = new ArrayList<>();
            for (int i = 0; i < statements.size(); i++) {
                Outcome outcome = runStatement(statements.get(i), opts);
                if (outcome.isFailure()) {
                    log.warn("batch.aborted statement={} of={} committed={} message={}",
                            i + 1, statements.size(), i, outcome.message());
                    span.fail(0, null);
                    return outcome;
                }
                allRows.addAll(outcome.rows());
            }

            span.finish(0, allRows.size());
            logEvent(opts, "batch.completed statements={} rows={}", statements.size(), allRows.size());
            return Outcome.success(allRows);
        } finally {
            lock.unlock();
        }
    }

    public ExecutionOptions getDefaultOptions() {
        return defaultOptions;
    }

    public GraphSession getSession() {
        return session;
    }

    private Outcome runStatement(String text, ExecutionOptions options) {
        String query = QuerySanitizer.sanitize(text);
        if (query.isEmpty()) {
            return Outcome.empty();
        }
        if (QuerySanitizer.isBridgeWrapped(text)) {
            metricsService.incrementSanitizedUnwrap();
            log.debug("statement.unwrapped query={}", query);
        }

        ColumnSpec defaultSchema = options.getDefaultSchema();
        ColumnSpec schema = SchemaInferencer.inferSchema(query, defaultSchema);
        long start = System.nanoTime();

        try (Span span = tracingService.startStatementSpan(options.getGraphName(),
                String.join(",", schema.names()))) {
            logEvent(options, "statement.started columns={} query={}", schema.names(), query);

            RuntimeException failure;
            int attempts = 1;
            try {
                return succeeded(attempt(query, schema, options), attempts, start, span, options);
            } catch (RuntimeException e) {
                failure = e;
            }

            if (!schema.equals(defaultSchema)) {
                attempts++;
                metricsService.incrementSchemaRetry();
                logEvent(options, "statement.retry columns={} reason={}",
                        defaultSchema.names(), BridgeException.firstLine(failure.getMessage()));
                try {
                    return succeeded(attempt(query, defaultSchema, options), attempts, start, span, options);
                } catch (RuntimeException e) {
                    failure = e;
                }
            }
            return failed(failure, attempts, start, span);
        }
    }

    /**
     * One bridge invocation followed by exactly one commit, or one rollback if anything failed.
     */
    private List<Row> attempt(String query, ColumnSpec schema, ExecutionOptions options) {
        try {
            List<Row> rows = session.cypher(options.getGraphName(), query, schema);
            session.commit();
            return rows;
        } catch (RuntimeException e) {
            rollbackQuietly();
            throw e;
        }
    }

    private void rollbackQuietly() {
        try {
            session.rollback();
        } catch (RuntimeException e) {
            log.warn("statement.rollback.failed message={}", BridgeException.firstLine(e.getMessage()));
        }
    }

    private Outcome succeeded(List<Row> rows, int attempts, long start, Span span, ExecutionOptions options) {
        List<Row> result = rows != null ? rows : List.of();
        metricsService.recordStatementDuration("success", Duration.ofNanos(System.nanoTime() - start));
        metricsService.recordRowCount(result.size());
        span.finish(attempts, result.size());
        logEvent(options, "statement.executed attempts={} rows={}", attempts, result.size());
        return Outcome.success(result);
    }

    private Outcome failed(RuntimeException e, int attempts, long start, Span span) {
        String kind = e instanceof BridgeException be
                ? be.getKind().name().toLowerCase(Locale.ROOT)
                : "execution";
        String detail = BridgeException.firstLine(e.getMessage());
        if (detail.isEmpty()) {
            detail = e.getClass().getSimpleName();
        }
        metricsService.recordStatementDuration("failure", Duration.ofNanos(System.nanoTime() - start));
        metricsService.incrementStatementFailed(kind);
        span.fail(attempts, e);
        log.warn("statement.failed kind={} attempts={} message={}", kind, attempts, detail);
        log.debug("statement.failed cause", e);
        return Outcome.failure(ERROR_PREFIX + detail);
    }

    private void logEvent(ExecutionOptions options, String format, Object... args) {
        if (options.isVerbose()) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }
}
