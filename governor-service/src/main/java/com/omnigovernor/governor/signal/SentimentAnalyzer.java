package com.omnigovernor.governor.signal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Lexicon sentiment scorer (AFINN style).
 *
 * <p>Each token found in the lexicon contributes its integer weight in [-5, 5]; the
 * comparative score is the weight sum divided by the total token count.
 */
@Component
public class SentimentAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SentimentAnalyzer.class);

    static final String LEXICON_RESOURCE = "sentiment/lexicon.tsv";

    private static final Pattern NON_WORD   = Pattern.compile("[^a-z0-9'\\s-]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Map<String, Integer> lexicon;

    public SentimentAnalyzer() {
        this(loadLexicon(LEXICON_RESOURCE));
    }

    SentimentAnalyzer(Map<String, Integer> lexicon) {
        this.lexicon = Map.copyOf(lexicon);
    }

    /** Comparative score; 0.0 for blank text. */
    public double comparative(String text) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        String cleaned = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
        if (cleaned.isEmpty()) {
            return 0.0;
        }
        String[] tokens = WHITESPACE.split(cleaned);
        int score = 0;
        for (String token : tokens) {
            score += lexicon.getOrDefault(token, 0);
        }
        return (double) score / tokens.length;
    }

    private static Map<String, Integer> loadLexicon(String resource) {
        Map<String, Integer> words = new HashMap<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(
                new ClassPathResource(resource).getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank() || line.startsWith("#")) continue;
                String[] parts = line.split("\t");
                if (parts.length != 2) {
                    log.debug("Skipping malformed lexicon line: {}", line);
                    continue;
                }
                words.put(parts[0].trim(), Integer.parseInt(parts[1].trim()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Sentiment lexicon not found on classpath: " + resource, e);
        }
        log.info("Sentiment lexicon loaded. words={}", words.size());
        return words;
    }
}
