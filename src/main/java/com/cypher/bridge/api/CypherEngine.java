package com.cypher.bridge.api;

import com.cypher.bridge.bulk.CypherFileLoader;
import com.cypher.bridge.bulk.FileLoadResult;
import com.cypher.bridge.bulk.ProgressCallback;
import com.cypher.bridge.core.model.Outcome;
import com.cypher.bridge.graph.AgeConnectionConfig;
import com.cypher.bridge.graph.AgeDataSourceFactory;
import com.cypher.bridge.graph.AgeGraphSession;
import com.cypher.bridge.graph.AgeSessionInitializer;
import com.cypher.bridge.graph.BridgeException;
import com.cypher.bridge.graph.GraphSession;
import com.cypher.bridge.health.AgeGraphHealthCheck;
import com.cypher.bridge.health.ConnectionPoolHealthCheck;
import com.cypher.bridge.health.GraphSessionHealthCheck;
import com.cypher.bridge.health.HealthCheckRegistry;
import com.cypher.bridge.health.HealthStatus;
import com.cypher.bridge.mcp.CypherMcpTools;
import com.cypher.bridge.metrics.MetricsService;
import com.cypher.bridge.tracing.TracingService;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Main entry point: runs Cypher text against an Apache AGE graph.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (CypherEngine engine = CypherEngine.builder()
 *         .age(AgeConnectionConfig.builder().host("localhost").graphName("demo").build())
 *         .build()) {
 *
 *     Outcome created = engine.executeBatch("CREATE (:Person {name: 'Alice'}); CREATE (:Person {name: 'Bob'})");
 *     Outcome people = engine.executeStatement("MATCH (p:Person) RETURN p.name AS name, id(p) AS id");
 *     people.rows().forEach(row -&gt; System.out.println(row.get("name")));
 * }
 * </pre>
 *
 * <p>When built from an {@link AgeConnectionConfig} the engine owns a HikariCP pool
 * and one dedicated session connection, and closes both. When given a
 * {@link GraphSession} it only closes the session if told it owns it.</p>
 */
public class CypherEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CypherEngine.class);

    private final GraphSession session;
    private final boolean ownsSession;
    private final HikariDataSource dataSource;
    private final ExecutionCoordinator coordinator;
    private final HealthCheckRegistry healthCheckRegistry;

    private CypherEngine(GraphSession session, boolean ownsSession, HikariDataSource dataSource,
                         ExecutionOptions options, Builder builder) {
        this.session = session;
        this.ownsSession = ownsSession;
        this.dataSource = dataSource;
        this.coordinator = new ExecutionCoordinator(session, options,
                builder.metricsService, builder.tracingService);

        this.healthCheckRegistry = new HealthCheckRegistry();
        if (dataSource != null) {
            healthCheckRegistry.register(new AgeGraphHealthCheck(dataSource, options.getGraphName()));
            healthCheckRegistry.register(new ConnectionPoolHealthCheck(
                    dataSource.getHikariPoolMXBean(), dataSource.getMaximumPoolSize()));
        } else {
            healthCheckRegistry.register(new GraphSessionHealthCheck(session));
        }

        log.info("CypherEngine initialized with graph: {}", options.getGraphName());
    }

    // ========== Execution API ==========

    public Outcome executeStatement(String text) {
        return coordinator.executeStatement(text);
    }

    public Outcome executeStatement(String text, ExecutionOptions options) {
        return coordinator.executeStatement(text, options);
    }

    public Outcome executeBatch(String text) {
        return coordinator.executeBatch(text);
    }

    public Outcome executeBatch(String text, ExecutionOptions options) {
        return coordinator.executeBatch(text, options);
    }

    // ========== Files and tools ==========

    public FileLoadResult loadFiles(List<Path> files) {
        return loadFiles(files, ProgressCallback.NOOP);
    }

    public FileLoadResult loadFiles(List<Path> files, ProgressCallback callback) {
        return new CypherFileLoader(coordinator).loadFiles(files, callback);
    }

    /**
     * Returns the MCP tools backed by this engine.
     */
    public CypherMcpTools getMcpTools() {
        return new CypherMcpTools(coordinator);
    }

    /**
     * Aggregate health: graph and pool checks when the engine owns a pool,
     * otherwise whether the session is open.
     */
    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    public ExecutionCoordinator getCoordinator() {
        return coordinator;
    }

    public ExecutionOptions getOptions() {
        return coordinator.getDefaultOptions();
    }

    @Override
    public void close() {
        if (ownsSession) {
            try {
                session.close();
            } catch (Exception e) {
                log.warn("Error closing graph session", e);
            }
        }
        if (dataSource != null) {
            dataSource.close();
        }
        log.info("CypherEngine closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private GraphSession session;
        private boolean ownsSession = false;
        private AgeConnectionConfig connectionConfig;
        private ExecutionOptions options;
        private boolean initializeGraph = true;
        private MetricsService metricsService;
        private TracingService tracingService;

        /**
         * Uses an existing session. The engine closes it only if {@code ownsSession(true)} is set.
         */
        public Builder graphSession(GraphSession session) {
            this.session = session;
            return this;
        }

        public Builder ownsSession(boolean ownsSession) {
            this.ownsSession = ownsSession;
            return this;
        }

        /**
         * Connects to an AGE server through a pool created from {@code config}.
         */
        public Builder age(AgeConnectionConfig config) {
            this.connectionConfig = config;
            return this;
        }

        /**
         * Default options for calls that do not pass their own. When omitted with
         * {@link #age}, the graph name is taken from the connection config.
         */
        public Builder options(ExecutionOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Whether to install AGE and create the graph when connecting. Defaults to true.
         */
        public Builder initializeGraph(boolean initializeGraph) {
            this.initializeGraph = initializeGraph;
            return this;
        }

        /**
         * Defaults to {@link com.cypher.bridge.metrics.NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Defaults to {@link com.cypher.bridge.tracing.NoOpTracingService} if not set.
         */
        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public CypherEngine build() {
            if (session != null) {
                ExecutionOptions opts = options != null ? options : ExecutionOptions.defaults();
                return new CypherEngine(session, ownsSession, null, opts, this);
            }
            if (connectionConfig == null) {
                throw new IllegalStateException("GraphSession or AgeConnectionConfig is required");
            }
            ExecutionOptions opts = options != null
                    ? options
                    : ExecutionOptions.builder().graphName(connectionConfig.getGraphName()).build();

            HikariDataSource dataSource = AgeDataSourceFactory.create(connectionConfig);
            try {
                Connection connection = dataSource.getConnection();
                AgeSessionInitializer initializer = new AgeSessionInitializer();
                if (initializeGraph) {
                    initializer.initialize(connection, opts.getGraphName());
                } else {
                    initializer.prepareSession(connection);
                }
                GraphSession ageSession = new AgeGraphSession(connection, connectionConfig.isDecodeAgtype());
                return new CypherEngine(ageSession, true, dataSource, opts, this);
            } catch (SQLException e) {
                dataSource.close();
                throw BridgeException.from(e);
            } catch (RuntimeException e) {
                dataSource.close();
                throw e;
            }
        }
    }
}
