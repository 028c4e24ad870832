package com.cypher.bridge.cdi;

import com.cypher.bridge.api.CypherEngine;
import com.cypher.bridge.api.ExecutionCoordinator;
import com.cypher.bridge.api.ExecutionOptions;
import com.cypher.bridge.graph.AgeConnectionConfig;
import com.cypher.bridge.mcp.CypherMcpTools;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CDI producer that wires a {@link CypherEngine} from MicroProfile Config properties.
 *
 * <pre>
 * cypher-bridge:
 *   postgres:
 *     host: localhost
 *     port: 5432
 *     database: postgres
 *     user: postgres
 *     password: secret
 *   age:
 *     graph-name: demo
 * </pre>
 *
 * <p>Each property can also be set from the environment, for example
 * {@code CYPHER_BRIDGE_POSTGRES_HOST}.</p>
 */
@ApplicationScoped
public class CypherBridgeProducer {

    private static final Logger log = LoggerFactory.getLogger(CypherBridgeProducer.class);

    // ── PostgreSQL ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "cypher-bridge.postgres.host", defaultValue = "localhost")
    String host;

    @Inject
    @ConfigProperty(name = "cypher-bridge.postgres.port", defaultValue = "5432")
    int port;

    @Inject
    @ConfigProperty(name = "cypher-bridge.postgres.database", defaultValue = "postgres")
    String database;

    @Inject
    @ConfigProperty(name = "cypher-bridge.postgres.user", defaultValue = "postgres")
    String user;

    @Inject
    @ConfigProperty(name = "cypher-bridge.postgres.password", defaultValue = "")
    String password;

    // ── AGE ───────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "cypher-bridge.age.graph-name", defaultValue = "demo")
    String graphName;

    @Inject
    @ConfigProperty(name = "cypher-bridge.age.initialize-graph", defaultValue = "true")
    boolean initializeGraph;

    @Inject
    @ConfigProperty(name = "cypher-bridge.age.decode-agtype", defaultValue = "true")
    boolean decodeAgtype;

    // ── Connection Pool ───────────────────────────────────────

    @Inject
    @ConfigProperty(name = "cypher-bridge.pool.max-size", defaultValue = "5")
    int poolMaxSize;

    @Inject
    @ConfigProperty(name = "cypher-bridge.pool.min-idle", defaultValue = "1")
    int poolMinIdle;

    @Inject
    @ConfigProperty(name = "cypher-bridge.pool.connection-timeout-millis", defaultValue = "30000")
    long poolConnectionTimeoutMillis;

    // ── Execution ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "cypher-bridge.execution.verbose", defaultValue = "false")
    boolean verbose;

    @Produces
    @Singleton
    public CypherEngine cypherEngine() {
        log.info("Producing CypherEngine: postgres={}:{}/{} graph={}", host, port, database, graphName);

        AgeConnectionConfig config = connectionConfig();
        ExecutionOptions options = ExecutionOptions.builder()
                .graphName(graphName)
                .verbose(verbose)
                .build();

        return CypherEngine.builder()
                .age(config)
                .options(options)
                .initializeGraph(initializeGraph)
                .build();
    }

    public void closeEngine(@Disposes CypherEngine engine) {
        log.info("Closing CypherEngine");
        engine.close();
    }

    // The engine and the types it hands out have no proxyable constructor, hence no normal scope.

    @Produces
    public ExecutionCoordinator executionCoordinator(CypherEngine engine) {
        return engine.getCoordinator();
    }

    @Produces
    public CypherMcpTools cypherMcpTools(CypherEngine engine) {
        return engine.getMcpTools();
    }

    AgeConnectionConfig connectionConfig() {
        return AgeConnectionConfig.builder()
                .host(host)
                .port(port)
                .database(database)
                .user(user)
                .password(password)
                .graphName(graphName)
                .maxPoolSize(poolMaxSize)
                .minIdle(poolMinIdle)
                .connectionTimeoutMillis(poolConnectionTimeoutMillis)
                .decodeAgtype(decodeAgtype)
                .build();
    }
}
