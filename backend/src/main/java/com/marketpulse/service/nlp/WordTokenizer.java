package com.marketpulse.service.nlp;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into word-like units. Hyphenated compounds stay whole; apostrophes
 * split contractions ("don't" gives "don" and "t"); punctuation is dropped.
 */
public final class WordTokenizer {

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}_]+(?:-[\\p{L}\\p{N}_]+)*");
    private static final Pattern LOWER_ALPHA = Pattern.compile("[a-z]+");

    private WordTokenizer() {
    }

    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            tokens.add(m.group());
        }
        return tokens;
    }

    /** Only a-z, nothing else. */
    public static boolean isLowerAlpha(String token) {
        return LOWER_ALPHA.matcher(token).matches();
    }
}
