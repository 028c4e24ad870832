package com.cypher.bridge.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Prepares a connection for Cypher: installs and loads AGE, puts {@code ag_catalog}
 * on the search path, and creates the graph.
 *
 * <p>{@link #prepareSession(Connection)} runs only the per-connection steps, for
 * graphs that are managed elsewhere.</p>
 *
 * <p>Each step runs in its own transaction. Failures are expected on repeat runs
 * (the graph already exists) and are logged, not propagated.</p>
 */
public class AgeSessionInitializer {
    private static final Logger log = LoggerFactory.getLogger(AgeSessionInitializer.class);

    static final List<String> SESSION_STATEMENTS = List.of(
            "LOAD 'age'",
            "SET search_path = ag_catalog, \"$user\", public");

    public static List<String> statementsFor(String graphName) {
        List<String> statements = new ArrayList<>();
        statements.add("CREATE EXTENSION IF NOT EXISTS age");
        statements.addAll(SESSION_STATEMENTS);
        statements.add("SELECT create_graph('" + GraphNames.validate(graphName) + "')");
        return List.copyOf(statements);
    }

    /**
     * Runs the bootstrap statements on {@code connection}.
     *
     * @return number of statements that succeeded
     */
    public int initialize(Connection connection, String graphName) {
        int succeeded = 0;
        for (String sql : statementsFor(graphName)) {
            if (safeExecute(connection, sql)) {
                succeeded++;
            }
        }
        log.info("age.initialized graph={} succeeded={}", graphName, succeeded);
        return succeeded;
    }

    /**
     * Loads AGE and sets the search path without touching the extension or the graph.
     *
     * @return number of statements that succeeded
     */
    public int prepareSession(Connection connection) {
        int succeeded = 0;
        for (String sql : SESSION_STATEMENTS) {
            if (safeExecute(connection, sql)) {
                succeeded++;
            }
        }
        log.debug("age.session.prepared succeeded={}", succeeded);
        return succeeded;
    }

    private boolean safeExecute(Connection connection, String sql) {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(sql);
            if (!connection.getAutoCommit()) {
                connection.commit();
            }
            return true;
        } catch (SQLException e) {
            // extension or graph might already exist
            log.debug("age.init statement={} failed: {}", sql, BridgeException.firstLine(e.getMessage()));
            rollbackQuietly(connection);
            return false;
        }
    }

    private void rollbackQuietly(Connection connection) {
        try {
            if (!connection.getAutoCommit()) {
                connection.rollback();
            }
        } catch (SQLException e) {
            log.warn("age.init rollback failed: {}", e.getMessage());
        }
    }
}
