package com.marketpulse.service.nlp;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Loads the word lists bundled on the classpath. Blank lines and # comments are skipped. */
@Slf4j
public final class WordLists {

    public static final String SENTIMENT_LEXICON = "lexicon/sentiment_lexicon.txt";
    public static final String ENGLISH_STOPWORDS = "stopwords/english.txt";

    private WordLists() {
    }

    public static Set<String> loadSet(String resource) {
        return new LinkedHashSet<>(readLines(resource));
    }

    /** Reads {@code word<TAB>valence} lines. */
    public static Map<String, Double> loadValences(String resource) {
        Map<String, Double> valences = new LinkedHashMap<>();
        for (String line : readLines(resource)) {
            String[] parts = line.split("\t");
            if (parts.length < 2) {
                log.warn("Skipping malformed lexicon line in {}: '{}'", resource, line);
                continue;
            }
            try {
                valences.put(parts[0].trim(), Double.parseDouble(parts[1].trim()));
            } catch (NumberFormatException e) {
                log.warn("Skipping lexicon line with bad valence in {}: '{}'", resource, line);
            }
        }
        return valences;
    }

    private static List<String> readLines(String resource) {
        ClassPathResource file = new ClassPathResource(resource);
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String t = line.trim().toLowerCase(Locale.ROOT);
                if (t.isEmpty() || t.startsWith("#")) continue;
                lines.add(t);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read word list: " + resource, e);
        }
        log.debug("Loaded {} entries from {}", lines.size(), resource);
        return lines;
    }
}
