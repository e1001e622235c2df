package com.marketpulse.service.pipeline;

import com.marketpulse.dto.analytics.MarketInsight;
import com.marketpulse.model.RecordTable;
import com.marketpulse.model.TemporalTrend;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.marketpulse.TestTables.row;
import static com.marketpulse.TestTables.table;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MarketInsightSynthesizerTest {

    private static final String MAINTAIN = "✅ Strong positive sentiment - maintain current strategy";

    private final MarketInsightSynthesizer synthesizer = new MarketInsightSynthesizer(new ColumnRoleResolver());

    @Test
    void sixtyPercentPositiveIsVeryPositiveWithoutMaintainAdvice() {
        MarketInsight insight = synthesizer.synthesize(labels(6, 2, 2));

        assertThat(insight.getSentimentScore()).isEqualTo(0.4);
        assertThat(insight.getOverallSentiment()).isEqualTo("Very Positive");
        assertThat(insight.getConfidence()).isCloseTo(90.0, within(1e-9));
        assertThat(insight.getPositiveRatio()).isEqualTo(60.0);
        assertThat(insight.getNegativeRatio()).isEqualTo(20.0);
        assertThat(insight.getNeutralRatio()).isEqualTo(20.0);
        assertThat(insight.getTotalMentions()).isEqualTo(10);
        assertThat(insight.getRecommendations()).doesNotContain(MAINTAIN);
        assertThat(insight.getEngagementTrend()).isEqualTo("Stable");
        assertThat(insight.getTemporalTrend()).isNull();
    }

    @Test
    void justAboveSixtyPercentTriggersMaintainAdvice() {
        MarketInsight insight = synthesizer.synthesize(labels(601, 399, 0));

        assertThat(insight.getPositiveRatio()).isEqualTo(60.1);
        assertThat(insight.getRecommendations()).containsExactly(
            MAINTAIN, "📈 Consider amplifying positive messaging");
    }

    @Test
    void highNegativeShare() {
        MarketInsight insight = synthesizer.synthesize(labels(3, 5, 2));

        assertThat(insight.getSentimentScore()).isEqualTo(-0.2);
        assertThat(insight.getOverallSentiment()).isEqualTo("Negative");
        assertThat(insight.getConfidence()).isEqualTo(65.0);
        assertThat(insight.getRecommendations()).containsExactly(
            "⚠️ High negative sentiment detected",
            "🔧 Immediate action recommended - investigate root causes",
            "💬 Increase customer engagement and support");
    }

    @Test
    void strongNegativeConfidenceScalesWithScore() {
        MarketInsight insight = synthesizer.synthesize(labels(1, 9, 0));

        assertThat(insight.getOverallSentiment()).isEqualTo("Very Negative");
        assertThat(insight.getConfidence()).isCloseTo(95.0, within(1e-9));
    }

    @Test
    void highNeutralShare() {
        MarketInsight insight = synthesizer.synthesize(labels(2, 2, 6));

        assertThat(insight.getOverallSentiment()).isEqualTo("Neutral");
        assertThat(insight.getConfidence()).isEqualTo(55.0);
        assertThat(insight.getRecommendations()).containsExactly(
            "📊 High neutral sentiment - opportunity to create stronger emotional connection",
            "🎯 Focus on creating more engaging content");
    }

    @Test
    void ratiosSumToHundred() {
        MarketInsight insight = synthesizer.synthesize(labels(1, 1, 1));

        double sum = insight.getPositiveRatio() + insight.getNegativeRatio() + insight.getNeutralRatio();
        assertThat(sum).isCloseTo(100.0, within(0.1));
    }

    @Test
    void withoutSentimentColumnReportsNoData() {
        RecordTable t = table(List.of("rating"), row("rating", 5L), row("rating", 1L));

        MarketInsight insight = synthesizer.synthesize(t);

        assertThat(insight.getOverallSentiment()).isEqualTo("Neutral");
        assertThat(insight.getConfidence()).isZero();
        assertThat(insight.getTotalMentions()).isEqualTo(2);
        assertThat(insight.getRecommendations()).containsExactly("No sentiment data available");
    }

    @Test
    void emptyClassifiedTableKeepsDefaults() {
        MarketInsight insight = synthesizer.synthesize(table(List.of("review", "sentiment")));

        assertThat(insight.getTotalMentions()).isZero();
        assertThat(insight.getRecommendations()).isEmpty();
    }

    @Test
    void engagementComparesMeanLikesPerLabel() {
        RecordTable positiveLed = table(List.of("sentiment", "likes"),
            row("sentiment", "Positive", "likes", 100L),
            row("sentiment", "Negative", "likes", 10L));
        RecordTable negativeLed = table(List.of("sentiment", "likes"),
            row("sentiment", "Positive", "likes", 10L),
            row("sentiment", "Negative", "likes", 16L));
        RecordTable balanced = table(List.of("sentiment", "likes"),
            row("sentiment", "Positive", "likes", 10L),
            row("sentiment", "Negative", "likes", 15L));

        assertThat(synthesizer.synthesize(positiveLed).getEngagementTrend())
            .isEqualTo("Positive content drives higher engagement");
        assertThat(synthesizer.synthesize(negativeLed).getEngagementTrend())
            .isEqualTo("Negative content drives higher engagement");
        assertThat(synthesizer.synthesize(balanced).getEngagementTrend())
            .isEqualTo("Balanced engagement across sentiments");
    }

    @Test
    void labelWithoutEngagementValuesCountsAsZero() {
        RecordTable t = table(List.of("sentiment", "likes"),
            row("sentiment", "Positive", "likes", 5L),
            row("sentiment", "Negative", "likes", null));

        assertThat(synthesizer.synthesize(t).getEngagementTrend())
            .isEqualTo("Positive content drives higher engagement");
    }

    @Test
    void improvingWhenLaterHalfIsMorePositive() {
        RecordTable t = timeline("Negative", "Negative", "Positive", "Positive");

        MarketInsight insight = synthesizer.synthesize(t);

        assertThat(insight.getTemporalTrend()).isEqualTo(TemporalTrend.IMPROVING);
        assertThat(insight.getRecommendations()).endsWith("📈 Sentiment is improving over time");
    }

    @Test
    void decliningWhenLaterHalfIsLessPositive() {
        RecordTable t = timeline("Positive", "Positive", "Negative", "Neutral");

        MarketInsight insight = synthesizer.synthesize(t);

        assertThat(insight.getTemporalTrend()).isEqualTo(TemporalTrend.DECLINING);
        assertThat(insight.getRecommendations()).endsWith("📉 Sentiment is declining - requires attention");
    }

    @Test
    void stableAddsNoNote() {
        RecordTable t = timeline("Positive", "Neutral", "Positive", "Neutral");

        MarketInsight insight = synthesizer.synthesize(t);

        assertThat(insight.getTemporalTrend()).isEqualTo(TemporalTrend.STABLE);
        assertThat(insight.getRecommendations()).isEmpty();
    }

    @Test
    void temporalTrendSortsByTimeFirst() {
        // listed newest first; chronologically the positives come last
        RecordTable t = table(List.of("date", "sentiment"),
            row("date", LocalDateTime.of(2024, 1, 4, 0, 0), "sentiment", "Positive"),
            row("date", LocalDateTime.of(2024, 1, 3, 0, 0), "sentiment", "Positive"),
            row("date", LocalDateTime.of(2024, 1, 2, 0, 0), "sentiment", "Negative"),
            row("date", LocalDateTime.of(2024, 1, 1, 0, 0), "sentiment", "Negative"));

        assertThat(synthesizer.temporalTrend(t)).contains(TemporalTrend.IMPROVING);
    }

    @Test
    void temporalTrendNotComputedForTooFewTimestamps() {
        RecordTable single = timeline("Positive");
        RecordTable noTime = labels(1, 1, 0);

        assertThat(synthesizer.temporalTrend(single)).isEmpty();
        assertThat(synthesizer.temporalTrend(noTime)).isEmpty();
    }

    private static RecordTable labels(int positive, int negative, int neutral) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < positive; i++) rows.add(row("review", "p", "sentiment", "Positive"));
        for (int i = 0; i < negative; i++) rows.add(row("review", "n", "sentiment", "Negative"));
        for (int i = 0; i < neutral; i++) rows.add(row("review", "u", "sentiment", "Neutral"));
        return RecordTable.of(List.of("review", "sentiment"), rows);
    }

    /** Rows one day apart, in the given chronological order. */
    private static RecordTable timeline(String... labels) {
        List<Map<String, Object>> rows = new ArrayList<>();
        LocalDateTime start = LocalDateTime.of(2024, 1, 1, 0, 0);
        for (int i = 0; i < labels.length; i++) {
            rows.add(row("date", start.plusDays(i), "sentiment", labels[i]));
        }
        return RecordTable.of(List.of("date", "sentiment"), rows);
    }
}
