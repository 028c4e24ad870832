package com.cypher.bridge.tracing;

import java.util.Map;

/**
 * Interface for distributed tracing of statement execution.
 * The default {@link NoOpTracingService} does nothing.
 *
 * <p>Statement spans carry {@link #GRAPH_ATTRIBUTE} and {@link #COLUMNS_ATTRIBUTE} from the
 * start, then {@link #ATTEMPTS_ATTRIBUTE} and {@link #ROWS_ATTRIBUTE} when they finish.
 * Batch spans carry the graph and {@link #STATEMENTS_ATTRIBUTE}.</p>
 */
public interface TracingService {

    /** Span for one statement, including its schema retry. */
    String STATEMENT_SPAN = "cypher.statement";

    /** Span for a multi-statement batch. */
    String BATCH_SPAN = "cypher.batch";

    String GRAPH_ATTRIBUTE = "cypher.graph";
    String COLUMNS_ATTRIBUTE = "cypher.columns";
    String ATTEMPTS_ATTRIBUTE = "cypher.attempts";
    String ROWS_ATTRIBUTE = "cypher.rows";
    String STATEMENTS_ATTRIBUTE = "cypher.statements";

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);

    default Span startStatementSpan(String graphName, String columns) {
        return startSpan(STATEMENT_SPAN, Map.of(GRAPH_ATTRIBUTE, graphName, COLUMNS_ATTRIBUTE, columns));
    }

    default Span startBatchSpan(String graphName, int statements) {
        Span span = startSpan(BATCH_SPAN, Map.of(GRAPH_ATTRIBUTE, graphName));
        span.setAttribute(STATEMENTS_ATTRIBUTE, statements);
        return span;
    }
}
