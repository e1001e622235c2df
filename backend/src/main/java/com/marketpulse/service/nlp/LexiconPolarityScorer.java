package com.marketpulse.service.nlp;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rule-based, offline polarity scorer.
 *
 * - Valence per word from a fixed lexicon (classpath: lexicon/sentiment_lexicon.txt)
 * - Boosters/dampeners up to three words back shift the valence, decaying with distance
 * - Negators up to three words back flip and damp the valence
 * - ALL-CAPS words in mixed-case text are emphasised
 * - "but" shifts weight to the clause that follows it
 * - "!" and repeated "?" amplify the sum in its own direction
 * - The sum is squashed into [-1, 1] with s / sqrt(s^2 + 15)
 */
@Component
@Slf4j
public class LexiconPolarityScorer implements PolarityScorer {

    static final double BOOST = 0.293;
    static final double DAMP = -0.293;
    static final double CAPS_EMPHASIS = 0.733;
    static final double NEGATION_SCALAR = -0.74;
    static final double NORMALIZATION_ALPHA = 15;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EDGE_PUNCT = Pattern.compile("^[\\p{Punct}\\p{IsPunctuation}]+|[\\p{Punct}\\p{IsPunctuation}]+$");

    private static final Set<String> NEGATORS = Set.of(
        "aint", "arent", "cannot", "cant", "couldnt", "darent", "didnt", "doesnt", "dont", "hadnt",
        "hasnt", "havent", "isnt", "mightnt", "mustnt", "neither", "neednt", "never", "none", "nope",
        "nor", "not", "nothing", "nowhere", "oughtnt", "shant", "shouldnt", "wasnt", "werent",
        "without", "wont", "wouldnt", "rarely", "seldom", "despite", "no");

    private static final Set<String> BOOSTERS = Set.of(
        "absolutely", "amazingly", "awfully", "completely", "considerably", "decidedly", "deeply",
        "enormously", "entirely", "especially", "exceptionally", "extremely", "fabulously", "fully",
        "greatly", "highly", "hugely", "incredibly", "intensely", "majorly", "more", "most",
        "particularly", "purely", "quite", "really", "remarkably", "so", "substantially",
        "thoroughly", "totally", "tremendously", "unbelievably", "unusually", "utterly", "very");

    private static final Set<String> DAMPENERS = Set.of(
        "almost", "barely", "hardly", "kinda", "less", "little", "marginally", "occasionally",
        "partly", "scarcely", "slightly", "somewhat", "sorta");

    private final Map<String, Double> lexicon;

    public LexiconPolarityScorer() {
        this(WordLists.loadValences(WordLists.SENTIMENT_LEXICON));
    }

    public LexiconPolarityScorer(Map<String, Double> lexicon) {
        this.lexicon = Map.copyOf(lexicon);
        log.info("Sentiment lexicon loaded: {} entries", this.lexicon.size());
    }

    @Override
    public double compound(String text) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        List<String> words = tokenize(text);
        if (words.isEmpty()) {
            return 0.0;
        }
        boolean mixedCase = isMixedCase(words);

        List<String> lower = new ArrayList<>(words.size());
        for (String w : words) {
            lower.add(normalize(w));
        }

        double[] valences = new double[words.size()];
        for (int i = 0; i < words.size(); i++) {
            String word = lower.get(i);
            if (BOOSTERS.contains(word) || DAMPENERS.contains(word)) {
                continue;
            }
            Double base = lexicon.get(word);
            if (base == null) {
                continue;
            }
            double valence = base;
            if (mixedCase && isAllCaps(words.get(i))) {
                valence += Math.signum(valence) * CAPS_EMPHASIS;
            }
            for (int back = 1; back <= 3 && i - back >= 0; back++) {
                String prev = lower.get(i - back);
                if (!lexicon.containsKey(prev)) {
                    double s = scalar(prev, words.get(i - back), valence, mixedCase);
                    if (back == 2) s *= 0.95;
                    if (back == 3) s *= 0.9;
                    valence += s;
                }
                if (isNegator(prev)) {
                    valence *= NEGATION_SCALAR;
                }
            }
            valences[i] = valence;
        }

        applyContrast(lower, valences);

        double sum = 0.0;
        for (double v : valences) {
            sum += v;
        }
        double emphasis = punctuationEmphasis(text);
        if (sum > 0) {
            sum += emphasis;
        } else if (sum < 0) {
            sum -= emphasis;
        }
        return normalizeScore(sum);
    }

    static double normalizeScore(double sum) {
        double score = sum / Math.sqrt(sum * sum + NORMALIZATION_ALPHA);
        score = Math.max(-1.0, Math.min(1.0, score));
        return Math.round(score * 10_000d) / 10_000d;
    }

    /** Words before "but" count half, words after it count one and a half. */
    private static void applyContrast(List<String> lower, double[] valences) {
        int but = lower.indexOf("but");
        if (but < 0) {
            return;
        }
        for (int i = 0; i < valences.length; i++) {
            if (i < but) {
                valences[i] *= 0.5;
            } else if (i > but) {
                valences[i] *= 1.5;
            }
        }
    }

    private static double punctuationEmphasis(String text) {
        int exclamations = 0;
        int questions = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '!') exclamations++;
            if (c == '?') questions++;
        }
        double emphasis = Math.min(exclamations, 4) * 0.292;
        if (questions > 1) {
            emphasis += questions <= 3 ? questions * 0.18 : 0.96;
        }
        return emphasis;
    }

    private static double scalar(String lowerWord, String original, double valence, boolean mixedCase) {
        double scalar;
        if (BOOSTERS.contains(lowerWord)) {
            scalar = BOOST;
        } else if (DAMPENERS.contains(lowerWord)) {
            scalar = DAMP;
        } else {
            return 0.0;
        }
        if (valence < 0) {
            scalar = -scalar;
        }
        if (mixedCase && isAllCaps(original)) {
            scalar += Math.signum(valence) * CAPS_EMPHASIS;
        }
        return scalar;
    }

    private static boolean isNegator(String lowerWord) {
        return NEGATORS.contains(lowerWord.replace("'", "")) || lowerWord.contains("n't");
    }

    private static List<String> tokenize(String text) {
        List<String> out = new ArrayList<>();
        for (String raw : WHITESPACE.split(text.trim())) {
            String w = EDGE_PUNCT.matcher(raw).replaceAll("");
            if (w.length() > 1) {
                out.add(w);
            }
        }
        return out;
    }

    private static String normalize(String word) {
        return word.toLowerCase(Locale.ROOT).replace('’', '\'');
    }

    private static boolean isAllCaps(String word) {
        boolean anyLetter = false;
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (Character.isLetter(c)) {
                anyLetter = true;
                if (!Character.isUpperCase(c)) return false;
            }
        }
        return anyLetter;
    }

    /** True when some, but not all, words are shouted. */
    private static boolean isMixedCase(List<String> words) {
        int caps = 0;
        for (String w : words) {
            if (isAllCaps(w)) caps++;
        }
        return caps > 0 && caps < words.size();
    }
}
