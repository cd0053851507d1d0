package com.omnigovernor.governor.signal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SentimentAnalyzerTest {

    private final SentimentAnalyzer analyzer = new SentimentAnalyzer(Map.of("bullish", 3, "crash", -4, "good", 2));

    @Test
    @DisplayName("comparative = weight sum / token count")
    void comparative() {
        assertEquals(5.0 / 4, analyzer.comparative("Bullish and GOOD news"), 1e-12);
    }

    @Test
    @DisplayName("punctuation and symbols are stripped before tokenizing")
    void punctuation() {
        assertEquals(3.0 / 2, analyzer.comparative("$PEPE bullish!!!"), 1e-12);
    }

    @Test
    @DisplayName("negative words pull the score below zero")
    void negative() {
        assertTrue(analyzer.comparative("market crash incoming") < 0);
    }

    @Test
    @DisplayName("blank or symbol-only text scores 0")
    void blank() {
        assertEquals(0.0, analyzer.comparative(null));
        assertEquals(0.0, analyzer.comparative("   "));
        assertEquals(0.0, analyzer.comparative("$$$ !!!"));
    }

    @Test
    @DisplayName("bundled lexicon loads from the classpath")
    void bundledLexicon() {
        SentimentAnalyzer bundled = new SentimentAnalyzer();
        assertTrue(bundled.comparative("great strong profit") > 0.1);
        assertTrue(bundled.comparative("terrible scam") < 0);
    }
}
