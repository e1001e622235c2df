package com.marketpulse.dto.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketpulse.model.TemporalTrend;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

// ========== Market Insight DTO ==========
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketInsight {
    @JsonProperty("overall_sentiment")
    private String overallSentiment;

    @JsonProperty("sentiment_score")
    private double sentimentScore;  // -1.0 to 1.0, three decimals

    private double confidence;      // 0-95

    @JsonProperty("positive_ratio")
    private double positiveRatio;

    @JsonProperty("negative_ratio")
    private double negativeRatio;

    @JsonProperty("neutral_ratio")
    private double neutralRatio;

    @JsonProperty("total_mentions")
    private long totalMentions;

    @JsonProperty("engagement_trend")
    private String engagementTrend;

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    // null when the first-half/second-half comparison could not be made
    @JsonProperty("temporal_trend")
    private TemporalTrend temporalTrend;
}
