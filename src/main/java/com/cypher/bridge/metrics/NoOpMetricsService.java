package com.cypher.bridge.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordStatementDuration(String status, Duration duration) {
    }

    @Override
    public void incrementSchemaRetry() {
    }

    @Override
    public void incrementStatementFailed(String errorKind) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordRowCount(int rows) {
    }

    @Override
    public void incrementSanitizedUnwrap() {
    }
}
