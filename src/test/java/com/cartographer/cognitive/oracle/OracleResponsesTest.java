package com.cartographer.cognitive.oracle;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OracleResponses Tests")
class OracleResponsesTest {

    @Test
    @DisplayName("Should strip json code fence")
    void shouldStripJsonFence() {
        assertEquals("{\"a\": 1}", OracleResponses.stripCodeFence("Here you go:\n```json\n{\"a\": 1}\n```\nDone."));
    }

    @Test
    @DisplayName("Should strip bare and single-line fences")
    void shouldStripBareFences() {
        assertEquals("[1]", OracleResponses.stripCodeFence("```\n[1]\n```"));
        assertEquals("[1]", OracleResponses.stripCodeFence("```[1]```"));
    }

    @Test
    @DisplayName("Should strip language tag from single-line fence")
    void shouldStripTagFromSingleLineFence() {
        assertEquals("{\"a\":1}", OracleResponses.stripCodeFence("```json{\"a\":1}```"));
        assertEquals("[\"x\"]", OracleResponses.stripCodeFence("```json [\"x\"]```"));
        assertEquals("true", OracleResponses.stripCodeFence("```true```"));
    }

    @Test
    @DisplayName("Should return trimmed text without fence")
    void shouldReturnTrimmedTextWithoutFence() {
        assertEquals("{}", OracleResponses.stripCodeFence("  {}  "));
        assertNull(OracleResponses.stripCodeFence(null));
    }
}
