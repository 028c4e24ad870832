package com.cypher.bridge.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatementSplitterTest {

    @Test
    @DisplayName("Should split on terminator and trim each statement")
    void splitsAndTrims() {
        List<String> statements = StatementSplitter.split("  CREATE (a:Person) ;\n MATCH (n) RETURN n  ;");

        assertEquals(List.of("CREATE (a:Person)", "MATCH (n) RETURN n"), statements);
    }

    @Test
    @DisplayName("Should drop empty pieces between terminators")
    void dropsEmptyPieces() {
        assertEquals(List.of("A", "B"), StatementSplitter.split(";;A;  ;\n;B;;"));
    }

    @Test
    @DisplayName("Should return a single statement without terminator")
    void singleStatement() {
        assertEquals(List.of("MATCH (n) RETURN n"), StatementSplitter.split("MATCH (n) RETURN n"));
    }

    @Test
    @DisplayName("Should yield nothing for null, blank, or terminator-only input")
    void emptyInputs() {
        assertTrue(StatementSplitter.split(null).isEmpty());
        assertTrue(StatementSplitter.split("").isEmpty());
        assertTrue(StatementSplitter.split("   \n\t").isEmpty());
        assertTrue(StatementSplitter.split(" ; ;\n;").isEmpty());
    }

    @Test
    @DisplayName("Should split inside string literals (naive splitting)")
    void splitsInsideLiterals() {
        List<String> statements = StatementSplitter.split("CREATE (:Note {text: 'a;b'})");

        assertEquals(List.of("CREATE (:Note {text: 'a", "b'})"), statements);
    }

    @Test
    @DisplayName("Should keep multi-line statements intact")
    void multiLineStatement() {
        String text = """
                MATCH (p:Person)
                WHERE p.age > 30
                RETURN p.name AS name, p.age AS age;
                """;

        List<String> statements = StatementSplitter.split(text);

        assertEquals(1, statements.size());
        assertTrue(statements.get(0).startsWith("MATCH (p:Person)"));
        assertTrue(statements.get(0).endsWith("p.age AS age"));
    }
}
