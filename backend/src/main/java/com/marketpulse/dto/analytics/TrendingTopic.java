package com.marketpulse.dto.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketpulse.model.SentimentLabel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

// ========== Trending Topic DTO ==========
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrendingTopic {
    private long mentions;

    @JsonProperty("positive_ratio")
    private double positiveRatio;   // 0-100, one decimal

    @JsonProperty("negative_ratio")
    private double negativeRatio;

    @JsonProperty("neutral_ratio")
    private double neutralRatio;

    @JsonProperty("dominant_sentiment")
    private SentimentLabel dominantSentiment;
}
