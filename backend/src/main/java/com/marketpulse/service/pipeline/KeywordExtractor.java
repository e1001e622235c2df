package com.marketpulse.service.pipeline;

import com.marketpulse.dto.analytics.TrendingTopic;
import com.marketpulse.model.RecordTable;
import com.marketpulse.model.SentimentLabel;
import com.marketpulse.service.nlp.WordLists;
import com.marketpulse.service.nlp.WordTokenizer;
import com.marketpulse.util.Rounding;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

// ========== Keyword / Topic Extractor ==========
@Service
@Slf4j
public class KeywordExtractor {

    static final int TOPIC_MIN_LENGTH = 4;
    static final int KEYWORD_MIN_LENGTH = 3;

    private final ColumnRoleResolver roleResolver;
    private final Set<String> stopwords;
    private final int defaultTopTopics;
    private final int defaultTopKeywords;

    public KeywordExtractor(
            ColumnRoleResolver roleResolver,
            @Value("${marketpulse.analysis.top-topics:10}") int defaultTopTopics,
            @Value("${marketpulse.analysis.top-keywords:20}") int defaultTopKeywords) {
        this.roleResolver = roleResolver;
        this.stopwords = Set.copyOf(WordLists.loadSet(WordLists.ENGLISH_STOPWORDS));
        this.defaultTopTopics = defaultTopTopics;
        this.defaultTopKeywords = defaultTopKeywords;
    }

    public Map<String, TrendingTopic> trendingTopics(RecordTable table) {
        return trendingTopics(table, defaultTopTopics);
    }

    /**
     * Ranks keywords by mentions and attaches the sentiment split of the rows that mention them.
     * Ties keep first-seen order. Returned map iterates in rank order.
     */
    public Map<String, TrendingTopic> trendingTopics(RecordTable table, int topN) {
        Optional<String> textColumn = roleResolver.resolveText(table);
        if (textColumn.isEmpty() || topN <= 0) {
            return Map.of();
        }
        log.info("Extracting trending topics from column: {}", textColumn.get());

        Map<String, Map<SentimentLabel, Long>> counts = new LinkedHashMap<>();
        boolean hasSentiment = table.hasColumn(SentimentClassifier.SENTIMENT_COLUMN);
        for (Map<String, Object> row : table.rows()) {
            Object text = row.get(textColumn.get());
            if (text == null) {
                continue;
            }
            SentimentLabel label = hasSentiment
                ? SentimentLabel.fromValue(row.get(SentimentClassifier.SENTIMENT_COLUMN)).orElse(SentimentLabel.NEUTRAL)
                : SentimentLabel.NEUTRAL;
            for (String keyword : keywords(String.valueOf(text), TOPIC_MIN_LENGTH)) {
                counts.computeIfAbsent(keyword, k -> new EnumMap<>(SentimentLabel.class))
                    .merge(label, 1L, Long::sum);
            }
        }

        List<Map.Entry<String, Map<SentimentLabel, Long>>> ranked = new ArrayList<>(counts.entrySet());
        ranked.sort(Comparator.comparingLong(
            (Map.Entry<String, Map<SentimentLabel, Long>> e) -> total(e.getValue())).reversed());

        Map<String, TrendingTopic> result = new LinkedHashMap<>();
        for (Map.Entry<String, Map<SentimentLabel, Long>> e : ranked.subList(0, Math.min(topN, ranked.size()))) {
            result.put(e.getKey(), toTopic(e.getValue()));
        }
        return result;
    }

    public Map<String, Long> commonKeywords(RecordTable table) {
        return commonKeywords(table, defaultTopKeywords);
    }

    /** Most common words, no sentiment attribution. Ties keep first-seen order. */
    public Map<String, Long> commonKeywords(RecordTable table, int topN) {
        Optional<String> textColumn = roleResolver.resolveText(table);
        if (textColumn.isEmpty() || topN <= 0) {
            return Map.of();
        }
        log.info("Running keyword extraction on column: {}", textColumn.get());

        Map<String, Long> counts = new LinkedHashMap<>();
        for (Object text : table.column(textColumn.get())) {
            if (text == null) {
                continue;
            }
            for (String keyword : keywords(String.valueOf(text), KEYWORD_MIN_LENGTH)) {
                counts.merge(keyword, 1L, Long::sum);
            }
        }

        List<Map.Entry<String, Long>> ranked = new ArrayList<>(counts.entrySet());
        ranked.sort(Map.Entry.<String, Long>comparingByValue().reversed());
        Map<String, Long> result = new LinkedHashMap<>();
        for (Map.Entry<String, Long> e : ranked.subList(0, Math.min(topN, ranked.size()))) {
            result.put(e.getKey(), e.getValue());
        }
        return result;
    }

    List<String> keywords(String text, int minLength) {
        List<String> out = new ArrayList<>();
        for (String token : WordTokenizer.tokenize(text)) {
            if (token.length() >= minLength && WordTokenizer.isLowerAlpha(token) && !stopwords.contains(token)) {
                out.add(token);
            }
        }
        return out;
    }

    private static TrendingTopic toTopic(Map<SentimentLabel, Long> counts) {
        long total = total(counts);
        long positive = counts.getOrDefault(SentimentLabel.POSITIVE, 0L);
        long negative = counts.getOrDefault(SentimentLabel.NEGATIVE, 0L);
        long neutral = counts.getOrDefault(SentimentLabel.NEUTRAL, 0L);
        return TrendingTopic.builder()
            .mentions(total)
            .positiveRatio(Rounding.percent(positive, total))
            .negativeRatio(Rounding.percent(negative, total))
            .neutralRatio(Rounding.percent(neutral, total))
            .dominantSentiment(dominant(counts))
            .build();
    }

    /** Highest count wins; ties go to the earlier label in Positive, Negative, Neutral order. */
    static SentimentLabel dominant(Map<SentimentLabel, Long> counts) {
        SentimentLabel best = SentimentLabel.POSITIVE;
        long bestCount = -1;
        for (SentimentLabel label : SentimentLabel.values()) {
            long c = counts.getOrDefault(label, 0L);
            if (c > bestCount) {
                best = label;
                bestCount = c;
            }
        }
        return best;
    }

    private static long total(Map<SentimentLabel, Long> counts) {
        long sum = 0;
        for (long c : counts.values()) {
            sum += c;
        }
        return sum;
    }
}
