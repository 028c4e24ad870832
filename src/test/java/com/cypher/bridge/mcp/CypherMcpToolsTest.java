package com.cypher.bridge.mcp;

import com.cypher.bridge.api.ExecutionCoordinator;
import com.cypher.bridge.core.model.ColumnSpec;
import com.cypher.bridge.core.model.Row;
import com.cypher.bridge.graph.BridgeException;
import com.cypher.bridge.graph.GraphSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CypherMcpToolsTest {

    @Mock
    private GraphSession session;

    private CypherMcpTools tools;

    @BeforeEach
    void setUp() {
        tools = new CypherMcpTools(new ExecutionCoordinator(session));
    }

    private McpToolDefinition sendCypher() {
        return tools.getTool(CypherMcpTools.SEND_CYPHER).orElseThrow();
    }

    @Test
    @DisplayName("Should define send_cypher with a required query parameter")
    void toolDefinition() {
        assertEquals(1, tools.getToolDefinitions().size());
        McpToolDefinition tool = sendCypher();

        assertEquals("send_cypher", tool.name());
        assertEquals(List.of("query"), tool.inputSchema().get("required"));
        assertTrue(tool.description().contains("no SQL wrapper"));
        assertTrue(tools.getTool("unknown").isEmpty());
    }

    @Test
    @DisplayName("Should return rows and columns on success")
    void success() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("name", "Alice");
        values.put("age", null);
        when(session.cypher("demo", "MATCH (p:Person) RETURN p.name AS name, p.age AS age",
                ColumnSpec.of("name", "age"))).thenReturn(List.of(new Row(values)));

        Map<String, Object> result = sendCypher().invoke(
                Map.of("query", "MATCH (p:Person) RETURN p.name AS name, p.age AS age"));

        assertEquals(true, result.get("success"));
        assertEquals(1, result.get("rowCount"));
        assertEquals(List.of("name", "age"), result.get("columns"));
        List<?> rows = (List<?>) result.get("rows");
        assertEquals(values, rows.get(0));
    }

    @Test
    @DisplayName("Should run several statements as a batch")
    void batch() {
        when(session.cypher(eq("demo"), anyString(), any())).thenReturn(List.of());

        Map<String, Object> result = sendCypher().invoke(Map.of("query", "CREATE (:A); CREATE (:B)"));

        assertEquals(true, result.get("success"));
        assertEquals(0, result.get("rowCount"));
        verify(session, times(2)).commit();
    }

    @Test
    @DisplayName("Should return the error message on failure")
    void failure() {
        when(session.cypher(anyString(), anyString(), any())).thenThrow(new BridgeException("label missing\nDETAIL"));

        Map<String, Object> result = sendCypher().invoke(Map.of("query", "MATCH (n:Nope) RETURN n"));

        assertEquals(false, result.get("success"));
        assertEquals("Cypher error: label missing", result.get("error"));
    }

    @Test
    @DisplayName("Should reject a missing or blank query")
    void missingQuery() {
        Map<String, Object> params = new HashMap<>();
        params.put("query", null);

        assertEquals(false, sendCypher().invoke(Map.of()).get("success"));
        assertEquals(false, sendCypher().invoke(params).get("success"));
        assertEquals(false, sendCypher().invoke(Map.of("query", "  ")).get("success"));
        assertEquals(false, sendCypher().invoke(null).get("success"));
        verifyNoInteractions(session);
    }

    @Test
    @DisplayName("Tool definition should require all fields")
    void definitionValidation() {
        assertThrows(NullPointerException.class,
                () -> new McpToolDefinition(null, "d", Map.of(), p -> Map.of()));
        assertThrows(NullPointerException.class,
                () -> new McpToolDefinition("n", "d", Map.of(), null));
    }
}
