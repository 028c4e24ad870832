package com.cypher.bridge.graph;

import com.cypher.bridge.core.model.ColumnSpec;
import com.cypher.bridge.core.model.Row;

import java.util.List;

/**
 * The graph execution bridge: runs one Cypher query with a declared column schema.
 *
 * <p>A session holds transaction state and does not manage it on its own. Callers
 * must {@link #commit()} after a successful {@link #cypher} call and
 * {@link #rollback()} after a failed one. Implementations are not thread-safe.</p>
 */
public interface GraphSession extends AutoCloseable {

    /**
     * Runs {@code query} against {@code graphName}, declaring {@code schema} as the result shape.
     *
     * @param graphName target graph
     * @param query     pure Cypher text, no wrapper and no terminator
     * @param schema    columns declared to the bridge
     * @return rows keyed by the declared column names
     * @throws BridgeException if the bridge rejects the query or the schema
     */
    List<Row> cypher(String graphName, String query, ColumnSpec schema);

    /**
     * Commits the current transaction.
     *
     * @throws BridgeException if the commit fails
     */
    void commit();

    /**
     * Rolls back the current transaction.
     *
     * @throws BridgeException if the rollback fails
     */
    void rollback();

    /**
     * Returns true while the underlying connection is usable.
     */
    boolean isOpen();

    @Override
    void close();
}
