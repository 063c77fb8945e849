package com.agentmesh.core.parser;

import com.agentmesh.core.model.ActionProposal;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ProposalParser}.
 */
class ProposalParserTest {

    private final ProposalParser parser = new ProposalParser();

    @Nested
    @DisplayName("masked pass")
    class MaskedTests {

        @Test
        @DisplayName("extracts a JSON object surrounded by prose")
        void surroundedByProse() {
            var result = parser.parse(
                    "prefix {\"thought\":\"x\",\"action\":\"WRITE_FILE\",\"params\":{\"path\":\"a.txt\"}} suffix");

            assertTrue(result.success());
            assertEquals(ParseMethod.MASKED, result.method());
            assertEquals("x", result.proposal().thought());
            assertEquals("WRITE_FILE", result.proposal().action());
            assertEquals(Map.of("path", "a.txt"), result.proposal().params());
            assertNull(result.error());
        }

        @Test
        @DisplayName("reads fenced json blocks")
        void fencedBlock() {
            var result = parser.parse("Plan:\n```json\n{\"action\": \"READ\", \"params\": {\"line\": 3}}\n```\nDone.");

            assertEquals(ParseMethod.MASKED, result.method());
            assertEquals(3, result.proposal().params().get("line"));
        }

        @Test
        @DisplayName("ignores braces inside string values")
        void bracesInStrings() {
            var result = parser.parse("Sure: {\"thought\": \"close } then {\", \"action\": \"EDIT\"} ok");

            assertTrue(result.success());
            assertEquals("close } then {", result.proposal().thought());
        }

        @Test
        @DisplayName("first valid candidate wins")
        void firstValidWins() {
            var result = parser.parse("{\"note\": 1} and then {\"action\": \"A\"} or {\"action\": \"B\"}");

            assertEquals("A", result.proposal().action());
        }

        @Test
        @DisplayName("defaults missing params and thought")
        void defaults() {
            var result = parser.parse("{\"action\": \"COMPLETE\"}");

            assertEquals(Map.of(), result.proposal().params());
            assertEquals("", result.proposal().thought());
        }

        @Test
        @DisplayName("keeps optional expectedOutcome and risk")
        void optionalFields() {
            var result = parser.parse(
                    "{\"action\": \"RUN\", \"expectedOutcome\": \"tests pass\", \"risk\": \"slow\"}");

            assertEquals("tests pass", result.proposal().expectedOutcome());
            assertEquals("slow", result.proposal().risk());
        }

        @Test
        @DisplayName("a serialized proposal parses back unchanged")
        void serializedProposalRoundTrips() throws Exception {
            var original = new ActionProposal("look around", "LIST_DIR",
                    Map.of("path", "src", "depth", 2), "a listing", "none");
            String json = new ObjectMapper().writeValueAsString(original);

            var result = parser.parse(json);

            assertEquals(ParseMethod.MASKED, result.method());
            assertEquals(original, result.proposal());
        }
    }

    @Nested
    @DisplayName("repaired pass")
    class RepairedTests {

        @Test
        @DisplayName("recovers single quotes and bare keys")
        void singleQuotesAndBareKeys() {
            var result = parser.parse("{ thought: 'fix', action: 'SHELL_EXEC', params: { command: 'ls -la' } }");

            assertTrue(result.success());
            assertEquals(ParseMethod.REPAIRED, result.method());
            assertEquals("fix", result.proposal().thought());
            assertEquals("SHELL_EXEC", result.proposal().action());
            assertEquals("ls -la", result.proposal().params().get("command"));
        }

        @Test
        @DisplayName("recovers comments and trailing commas inside a fence")
        void commentsAndTrailingCommas() {
            var result = parser.parse("```\n{\n  // read first\n  \"action\": \"READ\",\n  \"params\": {\"files\": [\"a\", \"b\",],},\n}\n```");

            assertEquals(ParseMethod.REPAIRED, result.method());
            assertEquals(List.of("a", "b"), result.proposal().params().get("files"));
        }

        @Test
        @DisplayName("recovers curly quotes")
        void curlyQuotes() {
            var result = parser.parse("{\u201Caction\u201D: \u201CRUN\u201D}");

            assertEquals(ParseMethod.REPAIRED, result.method());
            assertEquals("RUN", result.proposal().action());
        }
    }

    @Nested
    @DisplayName("failure")
    class FailureTests {

        @Test
        @DisplayName("empty output reports no candidate")
        void emptyOutput() {
            var result = parser.parse("   ");

            assertFalse(result.success());
            assertEquals("no parse candidate found: output is empty", result.error());
            assertNull(parser.parse(null).proposal());
        }

        @Test
        @DisplayName("missing action names both passes in the diagnostic")
        void missingAction() {
            var result = parser.parse("{\"thought\": \"hmm\", \"params\": {}}");

            assertFalse(result.success());
            assertTrue(result.error().startsWith("1 candidate(s) failed: "), result.error());
            assertTrue(result.error().contains("masked[candidate 1]"));
            assertTrue(result.error().contains("repaired[candidate 1]"));
            assertTrue(result.error().contains("\"action\" must be a non-empty string"));
        }

        @Test
        @DisplayName("params must be an object")
        void paramsNotObject() {
            var result = parser.parse("{\"action\": \"RUN\", \"params\": [1, 2]}");

            assertFalse(result.success());
            assertTrue(result.error().contains("\"params\" must be an object"));
        }

        @Test
        @DisplayName("thought must be a string")
        void thoughtNotString() {
            var result = parser.parse("{\"action\": \"RUN\", \"thought\": 42}");

            assertFalse(result.success());
            assertTrue(result.error().contains("\"thought\" must be a string"));
        }

        @Test
        @DisplayName("garbage never throws")
        void garbage() {
            assertDoesNotThrow(() -> parser.parse("}{ not json at all {{"));
            assertFalse(parser.parse("plain prose only").success());
        }
    }

    @Test
    @DisplayName("candidates are ordered and de-duplicated")
    void candidateOrder() {
        var candidates = parser.collectCandidates("see ```json\n{\"a\":1}\n``` and {\"b\":2}");

        assertEquals("see ```json\n{\"a\":1}\n``` and {\"b\":2}", candidates.get(0));
        assertEquals("{\"a\":1}", candidates.get(1));
        assertTrue(candidates.contains("{\"b\":2}"));
        assertEquals(candidates.size(), candidates.stream().distinct().count());
    }
}
