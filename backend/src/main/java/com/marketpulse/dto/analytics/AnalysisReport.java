package com.marketpulse.dto.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketpulse.dto.dataset.DatasetInfo;
import com.marketpulse.dto.dataset.DatasetSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

// ========== Combined Analysis Report DTO ==========
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisReport {
    private DatasetInfo dataset;
    private DatasetSummary summary;
    private List<TrendPoint> trends;

    @JsonProperty("trending_topics")
    private Map<String, TrendingTopic> trendingTopics;

    @JsonProperty("market_insights")
    private MarketInsight marketInsights;

    @JsonProperty("emerging_issues")
    private List<EmergingIssue> emergingIssues;

    private Map<String, Long> keywords;

    // "Positive" / "Negative" / "Neutral" -> rows
    @JsonProperty("sentiment_distribution")
    private Map<String, Long> sentimentDistribution;

    @JsonProperty("score_histogram")
    private List<HistogramBin> scoreHistogram;
}
