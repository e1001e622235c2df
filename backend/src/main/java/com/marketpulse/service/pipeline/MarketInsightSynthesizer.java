package com.marketpulse.service.pipeline;

import com.marketpulse.dto.analytics.MarketInsight;
import com.marketpulse.model.RecordTable;
import com.marketpulse.model.SentimentLabel;
import com.marketpulse.model.TemporalTrend;
import com.marketpulse.util.Rounding;
import com.marketpulse.util.TimestampParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;
import java.util.function.Predicate;

// ========== Market Insight Synthesizer ==========
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketInsightSynthesizer {

    static final String NO_SENTIMENT_DATA = "No sentiment data available";
    static final String DEFAULT_ENGAGEMENT = "Stable";
    static final String POSITIVE_ENGAGEMENT = "Positive content drives higher engagement";
    static final String NEGATIVE_ENGAGEMENT = "Negative content drives higher engagement";
    static final String BALANCED_ENGAGEMENT = "Balanced engagement across sentiments";
    static final String IMPROVING_NOTE = "📈 Sentiment is improving over time";
    static final String DECLINING_NOTE = "📉 Sentiment is declining - requires attention";

    static final double ENGAGEMENT_LEAD = 1.5;
    static final double TREND_MARGIN = 0.1;

    /** Verdict bands, checked in order; the first matching band wins. */
    enum VerdictBand {
        VERY_POSITIVE("Very Positive", s -> s > 0.2, s -> Math.min(95, 70 + s * 50)),
        POSITIVE("Positive", s -> s > 0.05, s -> 65),
        VERY_NEGATIVE("Very Negative", s -> s < -0.2, s -> Math.min(95, 70 + Math.abs(s) * 50)),
        NEGATIVE("Negative", s -> s < -0.05, s -> 65),
        NEUTRAL("Neutral", s -> true, s -> 55);

        private final String label;
        private final Predicate<Double> applies;
        private final DoubleUnaryOperator confidence;

        VerdictBand(String label, Predicate<Double> applies, DoubleUnaryOperator confidence) {
            this.label = label;
            this.applies = applies;
            this.confidence = confidence;
        }

        static VerdictBand of(double score) {
            for (VerdictBand band : values()) {
                if (band.applies.test(score)) {
                    return band;
                }
            }
            return NEUTRAL;
        }
    }

    /** Recommendation groups, checked in order; only the first matching group fires. */
    enum RecommendationRule {
        STRONG_POSITIVE(r -> r.positive > 60, List.of(
            "✅ Strong positive sentiment - maintain current strategy",
            "📈 Consider amplifying positive messaging")),
        HIGH_NEGATIVE(r -> r.negative > 40, List.of(
            "⚠️ High negative sentiment detected",
            "🔧 Immediate action recommended - investigate root causes",
            "💬 Increase customer engagement and support")),
        HIGH_NEUTRAL(r -> r.neutral > 50, List.of(
            "📊 High neutral sentiment - opportunity to create stronger emotional connection",
            "🎯 Focus on creating more engaging content"));

        private final Predicate<Ratios> applies;
        private final List<String> messages;

        RecommendationRule(Predicate<Ratios> applies, List<String> messages) {
            this.applies = applies;
            this.messages = messages;
        }

        static List<String> messagesFor(Ratios ratios) {
            for (RecommendationRule rule : values()) {
                if (rule.applies.test(ratios)) {
                    return rule.messages;
                }
            }
            return List.of();
        }
    }

    static final class Ratios {
        final double positive;
        final double negative;
        final double neutral;

        Ratios(double positive, double negative, double neutral) {
            this.positive = positive;
            this.negative = negative;
            this.neutral = neutral;
        }
    }

    private final ColumnRoleResolver roleResolver;

    /**
     * Reduces per-row sentiment into one verdict with confidence, engagement reading,
     * recommendations and, when a time column exists, a first-half/second-half trend note.
     */
    public MarketInsight synthesize(RecordTable table) {
        MarketInsight insight = defaults(table.rowCount());
        if (!table.hasColumn(SentimentClassifier.SENTIMENT_COLUMN)) {
            insight.getRecommendations().add(NO_SENTIMENT_DATA);
            return insight;
        }
        long total = table.rowCount();
        if (total == 0) {
            return insight;
        }

        Map<SentimentLabel, Long> counts = countLabels(table);
        long positive = counts.getOrDefault(SentimentLabel.POSITIVE, 0L);
        long negative = counts.getOrDefault(SentimentLabel.NEGATIVE, 0L);
        long neutral = counts.getOrDefault(SentimentLabel.NEUTRAL, 0L);

        Ratios ratios = new Ratios(
            Rounding.percent(positive, total),
            Rounding.percent(negative, total),
            Rounding.percent(neutral, total));
        insight.setPositiveRatio(ratios.positive);
        insight.setNegativeRatio(ratios.negative);
        insight.setNeutralRatio(ratios.neutral);

        double score = (double) (positive - negative) / total;
        insight.setSentimentScore(Rounding.round(score, 3));

        VerdictBand band = VerdictBand.of(score);
        insight.setOverallSentiment(band.label);
        insight.setConfidence(band.confidence.applyAsDouble(score));

        roleResolver.resolveEngagement(table)
            .ifPresent(column -> insight.setEngagementTrend(engagementTrend(table, column)));

        insight.getRecommendations().addAll(RecommendationRule.messagesFor(ratios));

        Optional<TemporalTrend> trend = temporalTrend(table);
        trend.ifPresent(t -> {
            insight.setTemporalTrend(t);
            if (t == TemporalTrend.IMPROVING) {
                insight.getRecommendations().add(IMPROVING_NOTE);
            } else if (t == TemporalTrend.DECLINING) {
                insight.getRecommendations().add(DECLINING_NOTE);
            }
        });

        log.info("Market sentiment: {} (score={}, confidence={}, rows={})",
            insight.getOverallSentiment(), insight.getSentimentScore(), insight.getConfidence(), total);
        return insight;
    }

    /**
     * Compares the positive share of the earlier and later halves of the time-ordered rows.
     * Empty means "not computed": no time column, no readable timestamps, or a half with no rows.
     */
    public Optional<TemporalTrend> temporalTrend(RecordTable table) {
        Optional<String> timeColumn = roleResolver.resolveTime(table);
        if (timeColumn.isEmpty() || !table.hasColumn(SentimentClassifier.SENTIMENT_COLUMN)) {
            return Optional.empty();
        }
        try {
            return temporalTrend(table, timeColumn.get());
        } catch (RuntimeException e) {
            log.debug("Temporal trend not computed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<TemporalTrend> temporalTrend(RecordTable table, String timeColumn) {
        List<Map.Entry<LocalDateTime, Boolean>> timeline = new ArrayList<>();
        for (Map<String, Object> row : table.rows()) {
            Optional<LocalDateTime> time = TimestampParser.parse(row.get(timeColumn));
            if (time.isPresent()) {
                boolean isPositive = SentimentLabel.fromValue(row.get(SentimentClassifier.SENTIMENT_COLUMN))
                    .filter(l -> l == SentimentLabel.POSITIVE)
                    .isPresent();
                timeline.add(Map.entry(time.get(), isPositive));
            }
        }
        timeline.sort(Map.Entry.comparingByKey(Comparator.naturalOrder()));

        int midpoint = timeline.size() / 2;
        List<Map.Entry<LocalDateTime, Boolean>> firstHalf = timeline.subList(0, midpoint);
        List<Map.Entry<LocalDateTime, Boolean>> secondHalf = timeline.subList(midpoint, timeline.size());
        if (firstHalf.isEmpty() || secondHalf.isEmpty()) {
            return Optional.empty();
        }

        double first = positiveShare(firstHalf);
        double second = positiveShare(secondHalf);
        if (second > first + TREND_MARGIN) {
            return Optional.of(TemporalTrend.IMPROVING);
        }
        if (second < first - TREND_MARGIN) {
            return Optional.of(TemporalTrend.DECLINING);
        }
        return Optional.of(TemporalTrend.STABLE);
    }

    /** Mean engagement of positive rows against negative rows; a label with no numeric values counts as 0. */
    String engagementTrend(RecordTable table, String engagementColumn) {
        double positiveMean = meanEngagement(table, engagementColumn, SentimentLabel.POSITIVE);
        double negativeMean = meanEngagement(table, engagementColumn, SentimentLabel.NEGATIVE);
        if (positiveMean > negativeMean * ENGAGEMENT_LEAD) {
            return POSITIVE_ENGAGEMENT;
        }
        if (negativeMean > positiveMean * ENGAGEMENT_LEAD) {
            return NEGATIVE_ENGAGEMENT;
        }
        return BALANCED_ENGAGEMENT;
    }

    private static double meanEngagement(RecordTable table, String column, SentimentLabel label) {
        double sum = 0;
        long n = 0;
        for (Map<String, Object> row : table.rows()) {
            if (SentimentLabel.fromValue(row.get(SentimentClassifier.SENTIMENT_COLUMN)).orElse(null) != label) {
                continue;
            }
            Optional<Double> value = toNumber(row.get(column));
            if (value.isPresent()) {
                sum += value.get();
                n++;
            }
        }
        return n == 0 ? 0.0 : sum / n;
    }

    private static Optional<Double> toNumber(Object value) {
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return Double.isNaN(d) ? Optional.empty() : Optional.of(d);
        }
        if (value instanceof String) {
            try {
                return Optional.of(Double.parseDouble(((String) value).trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static double positiveShare(List<Map.Entry<LocalDateTime, Boolean>> rows) {
        long positives = rows.stream().filter(Map.Entry::getValue).count();
        return (double) positives / rows.size();
    }

    private static Map<SentimentLabel, Long> countLabels(RecordTable table) {
        Map<SentimentLabel, Long> counts = new EnumMap<>(SentimentLabel.class);
        for (Object value : table.column(SentimentClassifier.SENTIMENT_COLUMN)) {
            SentimentLabel.fromValue(value).ifPresent(l -> counts.merge(l, 1L, Long::sum));
        }
        return counts;
    }

    private static MarketInsight defaults(long totalMentions) {
        return MarketInsight.builder()
            .overallSentiment(VerdictBand.NEUTRAL.label)
            .sentimentScore(0)
            .confidence(0)
            .totalMentions(totalMentions)
            .engagementTrend(DEFAULT_ENGAGEMENT)
            .recommendations(new ArrayList<>())
            .build();
    }
}
