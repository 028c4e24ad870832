package com.cypher.bridge.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QuerySanitizerTest {

    @Nested
    @DisplayName("Full SQL wrapper")
    class SqlWrapper {

        @Test
        @DisplayName("Should extract the dollar-quoted body")
        void extractsBody() {
            String wrapped = "SELECT * FROM cypher('g', $$ MATCH (n) RETURN n $$) AS (n agtype);";

            assertEquals("MATCH (n) RETURN n", QuerySanitizer.sanitize(wrapped));
        }

        @Test
        @DisplayName("Should match case-insensitively across line breaks")
        void caseInsensitiveMultiline() {
            String wrapped = """
                    select *
                    from CYPHER('demo', $$
                        MATCH (p:Person)
                        RETURN p.name AS name, p.age AS age
                    $$) as (name agtype, age agtype);
                    """;

            String sanitized = QuerySanitizer.sanitize(wrapped);

            assertTrue(sanitized.startsWith("MATCH (p:Person)"));
            assertTrue(sanitized.endsWith("p.age AS age"));
        }

        @Test
        @DisplayName("Should strip a terminator inside the body")
        void stripsInnerTerminator() {
            String wrapped = "SELECT * FROM cypher('g', $$ MATCH (n) RETURN n; $$) AS (result agtype)";

            assertEquals("MATCH (n) RETURN n", QuerySanitizer.sanitize(wrapped));
        }
    }

    @Nested
    @DisplayName("Bare bridge call")
    class BareCall {

        @Test
        @DisplayName("Should extract the body of a bare cypher() call")
        void extractsBody() {
            assertEquals("CREATE (:Person {name: 'Alice'})",
                    QuerySanitizer.sanitize("cypher('demo', $$ CREATE (:Person {name: 'Alice'}) $$);"));
        }

        @Test
        @DisplayName("Should report wrapped input")
        void reportsWrapped() {
            assertTrue(QuerySanitizer.isBridgeWrapped("cypher('g', $$ RETURN 1 $$)"));
            assertTrue(QuerySanitizer.isBridgeWrapped(
                    "SELECT * FROM cypher('g', $$ RETURN 1 $$) AS (result agtype)"));
            assertFalse(QuerySanitizer.isBridgeWrapped("MATCH (n) RETURN n"));
            assertFalse(QuerySanitizer.isBridgeWrapped(null));
        }
    }

    @Nested
    @DisplayName("Unwrapped input")
    class Identity {

        @Test
        @DisplayName("Should leave clean Cypher unchanged")
        void cleanUnchanged() {
            assertEquals("MATCH (n) RETURN n", QuerySanitizer.sanitize("MATCH (n) RETURN n"));
        }

        @Test
        @DisplayName("Should strip trailing terminators and whitespace")
        void stripsTerminators() {
            assertEquals("MATCH (n) RETURN n", QuerySanitizer.sanitize("  MATCH (n) RETURN n ;  "));
            assertEquals("MATCH (n) RETURN n", QuerySanitizer.sanitize("MATCH (n) RETURN n;;"));
        }

        @Test
        @DisplayName("Should keep terminators that are not trailing")
        void keepsInnerTerminator() {
            assertEquals("RETURN 'a;b'", QuerySanitizer.sanitize("RETURN 'a;b';"));
        }

        @Test
        @DisplayName("Should yield empty text for null, blank, or terminator-only input")
        void emptyInputs() {
            assertEquals("", QuerySanitizer.sanitize(null));
            assertEquals("", QuerySanitizer.sanitize("   "));
            assertEquals("", QuerySanitizer.sanitize(" ;\n; "));
        }
    }

    @Test
    @DisplayName("Should be idempotent")
    void idempotent() {
        List<String> inputs = List.of(
                "MATCH (n) RETURN n",
                "MATCH (n) RETURN n ; ",
                " ; ",
                "",
                "RETURN 'a;b';",
                "SELECT * FROM cypher('g', $$ MATCH (n) RETURN n $$) AS (n agtype);",
                "cypher('g', $$ cypher('g', $$ RETURN 1 $$) $$)",
                "SELECT * FROM cypher('g', $$ SELECT * FROM cypher('g', $$ RETURN 1 $$) AS (a agtype) $$) AS (b agtype);",
                "cypher('g', $$ ; $$)",
                "MATCH (a)-[:KNOWS]->(b)\nRETURN a, b;\n");

        for (String input : inputs) {
            String once = QuerySanitizer.sanitize(input);
            assertEquals(once, QuerySanitizer.sanitize(once), "not idempotent for: " + input);
        }
    }
}
