package com.cypher.bridge.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code cypher.statement.duration}: Timer (tag: status)</li>
 *   <li>{@code cypher.schema.retry}: Counter</li>
 *   <li>{@code cypher.statement.failed}: Counter (tag: kind)</li>
 *   <li>{@code cypher.batch.size}: DistributionSummary</li>
 *   <li>{@code cypher.statement.rows}: DistributionSummary</li>
 *   <li>{@code cypher.sanitizer.unwrapped}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> failedCounters = new ConcurrentHashMap<>();
    private final Counter schemaRetryCounter;
    private final Counter unwrapCounter;
    private final DistributionSummary batchSizeSummary;
    private final DistributionSummary rowCountSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.schemaRetryCounter = Counter.builder("cypher.schema.retry")
                .description("Statements retried with the default column schema")
                .register(registry);
        this.unwrapCounter = Counter.builder("cypher.sanitizer.unwrapped")
                .description("Statements that arrived wrapped in bridge-call syntax")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("cypher.batch.size")
                .description("Number of statements per batch")
                .register(registry);
        this.rowCountSummary = DistributionSummary.builder("cypher.statement.rows")
                .description("Rows returned per successful statement")
                .register(registry);
    }

    @Override
    public void recordStatementDuration(String status, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(status, k ->
                Timer.builder("cypher.statement.duration")
                        .description("Duration of Cypher statement execution")
                        .tag("status", status)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementSchemaRetry() {
        schemaRetryCounter.increment();
    }

    @Override
    public void incrementStatementFailed(String errorKind) {
        Counter counter = failedCounters.computeIfAbsent(errorKind, k ->
                Counter.builder("cypher.statement.failed")
                        .description("Statements that ended in a failure outcome")
                        .tag("kind", errorKind)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordRowCount(int rows) {
        rowCountSummary.record(rows);
    }

    @Override
    public void incrementSanitizedUnwrap() {
        unwrapCounter.increment();
    }
}
