package com.cypher.bridge.api;

import com.cypher.bridge.core.model.ColumnSpec;
import com.cypher.bridge.graph.GraphNames;

/**
 * Per-call execution settings: target graph, fallback column schema and verbosity.
 * Passed explicitly with each call instead of being read from shared state.
 */
public class ExecutionOptions {

    public static final String DEFAULT_GRAPH_NAME = "demo";

    private final String graphName;
    private final ColumnSpec defaultSchema;
    private final boolean verbose;

    private ExecutionOptions(Builder builder) {
        this.graphName = builder.graphName;
        this.defaultSchema = builder.defaultSchema;
        this.verbose = builder.verbose;
    }

    public String getGraphName() {
        return graphName;
    }

    /**
     * Schema declared when no better one can be inferred, and for the mismatch retry.
     */
    public ColumnSpec getDefaultSchema() {
        return defaultSchema;
    }

    /**
     * When set, statement lifecycle events are logged at INFO instead of DEBUG.
     */
    public boolean isVerbose() {
        return verbose;
    }

    public static ExecutionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-filled with this instance's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .graphName(graphName)
                .defaultSchema(defaultSchema)
                .verbose(verbose);
    }

    public static class Builder {
        private String graphName = DEFAULT_GRAPH_NAME;
        private ColumnSpec defaultSchema = ColumnSpec.defaultSpec();
        private boolean verbose = false;

        public Builder graphName(String graphName) {
            this.graphName = GraphNames.validate(graphName);
            return this;
        }

        public Builder defaultSchema(ColumnSpec defaultSchema) {
            if (defaultSchema == null) {
                throw new IllegalArgumentException("defaultSchema must not be null");
            }
            this.defaultSchema = defaultSchema;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public ExecutionOptions build() {
            return new ExecutionOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ExecutionOptions{" +
                "graphName='" + graphName + '\'' +
                ", defaultSchema=" + defaultSchema +
                ", verbose=" + verbose +
                '}';
    }
}
