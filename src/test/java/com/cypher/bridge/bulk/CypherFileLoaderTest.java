package com.cypher.bridge.bulk;

import com.cypher.bridge.api.ExecutionCoordinator;
import com.cypher.bridge.core.model.Row;
import com.cypher.bridge.graph.BridgeException;
import com.cypher.bridge.graph.GraphSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CypherFileLoaderTest {

    @Mock
    private GraphSession session;

    @TempDir
    Path dir;

    private CypherFileLoader loader;

    @BeforeEach
    void setUp() {
        loader = new CypherFileLoader(new ExecutionCoordinator(session));
    }

    @Test
    @DisplayName("Should execute every statement of every file in order")
    void loadsFilesInOrder() throws IOException {
        Path first = Files.writeString(dir.resolve("a.cypher"), "CREATE (:A);\nCREATE (:B);");
        Path second = Files.writeString(dir.resolve("b.cypher"), "MATCH (n) RETURN n;");
        when(session.cypher(anyString(), anyString(), any())).thenReturn(List.of());
        when(session.cypher(anyString(), eq("MATCH (n) RETURN n"), any()))
                .thenReturn(List.of(new Row(Map.of("result", 1)), new Row(Map.of("result", 2))));

        FileLoadResult result = loader.loadFiles(List.of(first, second), null);

        assertEquals(2, result.filesProcessed());
        assertEquals(3, result.statementsExecuted());
        assertEquals(0, result.statementsFailed());
        assertEquals(2, result.rowsReturned());
        assertFalse(result.hasErrors());
    }

    @Test
    @DisplayName("Should continue after a failing statement")
    void continuesAfterFailure() throws IOException {
        Path file = Files.writeString(dir.resolve("seed.cypher"), "CREATE (:A); CREATE (:B; CREATE (:C)");
        when(session.cypher(anyString(), anyString(), any())).thenReturn(List.of());
        when(session.cypher(anyString(), eq("CREATE (:B"), any()))
                .thenThrow(new BridgeException("syntax error at end of input\nLINE 1"));

        FileLoadResult result = loader.loadFiles(List.of(file), ProgressCallback.NOOP);

        assertEquals(3, result.statementsExecuted());
        assertEquals(1, result.statementsFailed());
        assertEquals(2, result.statementsSucceeded());
        FileLoadResult.LoadError error = result.errors().get(0);
        assertEquals(2, error.statementNumber());
        assertEquals("CREATE (:B", error.statement());
        assertEquals("Cypher error: syntax error at end of input", error.message());
        verify(session).cypher(anyString(), eq("CREATE (:C)"), any());
    }

    @Test
    @DisplayName("Should record a missing file and load the next one")
    void missingFile() throws IOException {
        Path missing = dir.resolve("missing.cypher");
        Path present = Files.writeString(dir.resolve("present.cypher"), "CREATE (:A)");
        when(session.cypher(anyString(), anyString(), any())).thenReturn(List.of());

        FileLoadResult result = loader.loadFiles(List.of(missing, present), null);

        assertEquals(1, result.filesProcessed());
        assertEquals(1, result.statementsExecuted());
        assertEquals(1, result.errors().size());
        assertEquals("File '" + missing + "' not found", result.errors().get(0).message());
        assertEquals(0, result.errors().get(0).statementNumber());
        assertNull(result.errors().get(0).statement());
    }

    @Test
    @DisplayName("Should record other read errors")
    void unreadableFile() {
        FileLoadResult result = loader.loadFiles(List.of(dir), null);

        assertEquals(0, result.filesProcessed());
        assertTrue(result.errors().get(0).message().startsWith("Error reading file '" + dir + "': "));
        verifyNoInteractions(session);
    }

    @Test
    @DisplayName("Should report progress per statement")
    void reportsProgress() throws IOException {
        Path file = Files.writeString(dir.resolve("p.cypher"), "CREATE (:A); CREATE (:B)");
        when(session.cypher(anyString(), anyString(), any())).thenReturn(List.of());
        List<String> progress = new ArrayList<>();

        loader.loadFiles(List.of(file), (processed, total, message) -> progress.add(processed + "/" + total));

        assertEquals(List.of("1/2", "2/2"), progress);
    }

    @Test
    @DisplayName("Should load statements from a reader")
    void loadsReader() {
        when(session.cypher(anyString(), anyString(), any())).thenReturn(List.of());

        FileLoadResult result = loader.loadReader("inline", new StringReader("CREATE (:A);;\n CREATE (:B);"));

        assertEquals(1, result.filesProcessed());
        assertEquals(2, result.statementsExecuted());
    }

    @Test
    @DisplayName("Should record a reader failure")
    void readerFailure() {
        Reader failing = new Reader() {
            @Override
            public int read(char[] buf, int off, int len) throws IOException {
                throw new IOException("stream closed");
            }

            @Override
            public void close() {
            }
        };

        FileLoadResult result = loader.loadReader("stdin", failing);

        assertEquals("Error reading file 'stdin': stream closed", result.errors().get(0).message());
        verifyNoInteractions(session);
    }
}
