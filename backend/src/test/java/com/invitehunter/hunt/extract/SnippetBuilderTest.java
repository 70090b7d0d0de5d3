package com.invitehunter.hunt.extract;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SnippetBuilderTest {
    private final SnippetBuilder builder = new SnippetBuilder();

    @Test
    void highlightsTokenAndFlattensNewlines() {
        String snippet = builder.build("Title", "Here is SORA2X9 for you", "SORA2X9");

        assertEquals("Title Here is <mark>SORA2X9</mark> for you", snippet);
    }

    @Test
    void matchesCaseInsensitivelyAndKeepsSourceCasing() {
        String snippet = builder.build("", "my code is sora2x9, enjoy", "SORA2X9");

        assertEquals("my code is <mark>sora2x9</mark>, enjoy", snippet);
    }

    @Test
    void escapesSurroundingMarkup() {
        String snippet = builder.build(null, "<b>SORA2X9</b> & more", "SORA2X9");

        assertEquals("&lt;b&gt;<mark>SORA2X9</mark>&lt;/b&gt; &amp; more", snippet);
    }

    @Test
    void limitsContextAroundFirstMatch() {
        String body = "x".repeat(100) + " SORA2X9 " + "y".repeat(100);

        String snippet = builder.build("", body, "SORA2X9");

        assertEquals("x".repeat(59) + " <mark>SORA2X9</mark> " + "y".repeat(59), snippet);
    }

    @Test
    void highlightsEveryOccurrenceInsideWindow() {
        String snippet = builder.build("ABC123", "repeat ABC123", "ABC123");

        assertEquals("<mark>ABC123</mark> repeat <mark>ABC123</mark>", snippet);
    }

    @Test
    void fallsBackToLeadingTextWhenTokenAbsent() {
        String snippet = builder.build("", "b".repeat(300), "ZZZ111");

        assertEquals("b".repeat(SnippetBuilder.FALLBACK_LENGTH), snippet);
        assertFalse(snippet.contains("<mark>"));
    }

    @Test
    void emptyTextFallsBackToTitleOrToken() {
        assertEquals("ABC123", builder.build(null, null, "ABC123"));
        assertEquals("ABC123", builder.build("", "   ", "ABC123"));
        assertTrue(builder.build(null, null, null).isEmpty());
    }
}
