package com.cypher.bridge.metrics;

import java.time.Duration;

/**
 * Interface for recording statement execution metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    /**
     * Records how long one statement took, including a schema retry.
     *
     * @param status {@code success} or {@code failure}
     */
    void recordStatementDuration(String status, Duration duration);

    void incrementSchemaRetry();

    void incrementStatementFailed(String errorKind);

    void recordBatchSize(int size);

    void recordRowCount(int rows);

    void incrementSanitizedUnwrap();
}
