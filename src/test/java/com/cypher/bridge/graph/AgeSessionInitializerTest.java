package com.cypher.bridge.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AgeSessionInitializerTest {

    @Mock
    private Connection connection;
    @Mock
    private Statement statement;

    private final AgeSessionInitializer initializer = new AgeSessionInitializer();

    @Test
    @DisplayName("Should load AGE, set the search path and create the graph")
    void bootstrapStatements() {
        assertEquals(List.of(
                "CREATE EXTENSION IF NOT EXISTS age",
                "LOAD 'age'",
                "SET search_path = ag_catalog, \"$user\", public",
                "SELECT create_graph('demo')"), AgeSessionInitializer.statementsFor("demo"));
    }

    @Test
    @DisplayName("Should reject an invalid graph name")
    void invalidGraphName() {
        assertThrows(IllegalArgumentException.class, () -> AgeSessionInitializer.statementsFor("de mo"));
    }

    @Test
    @DisplayName("Should commit each statement and count successes")
    void allSucceed() throws Exception {
        when(connection.createStatement()).thenReturn(statement);

        int succeeded = initializer.initialize(connection, "demo");

        assertEquals(4, succeeded);
        verify(statement, times(4)).execute(anyString());
        verify(connection, times(4)).commit();
        verify(connection, never()).rollback();
    }

    @Test
    @DisplayName("Should roll back a failing statement and carry on")
    void existingGraph() throws Exception {
        when(connection.createStatement()).thenReturn(statement);
        when(statement.execute(anyString())).thenReturn(false);
        when(statement.execute(startsWith("SELECT create_graph")))
                .thenThrow(new SQLException("graph \"demo\" already exists", "42P06"));

        int succeeded = initializer.initialize(connection, "demo");

        assertEquals(3, succeeded);
        verify(connection, times(3)).commit();
        verify(connection).rollback();
    }

    @Test
    @DisplayName("Should skip commit and rollback in auto-commit mode")
    void autoCommitMode() throws Exception {
        when(connection.createStatement()).thenReturn(statement);
        when(connection.getAutoCommit()).thenReturn(true);

        assertEquals(4, initializer.initialize(connection, "demo"));
        verify(connection, never()).commit();
    }

    @Test
    @DisplayName("Should only load AGE and set the search path when preparing a session")
    void prepareSession() throws Exception {
        when(connection.createStatement()).thenReturn(statement);

        assertEquals(2, initializer.prepareSession(connection));
        verify(statement).execute("LOAD 'age'");
        verify(statement).execute("SET search_path = ag_catalog, \"$user\", public");
        verify(statement, never()).execute(startsWith("SELECT create_graph"));
        verify(statement, never()).execute(startsWith("CREATE EXTENSION"));
    }
}
