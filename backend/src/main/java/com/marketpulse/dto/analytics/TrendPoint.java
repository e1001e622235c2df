package com.marketpulse.dto.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

// ========== Sentiment Trend Point DTO ==========
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"date_str", "Positive", "Negative", "Neutral"})
public class TrendPoint {
    @JsonProperty("date_str")
    private String dateStr;     // yyyy-MM-dd bucket label

    @JsonProperty("Positive")
    private long positive;

    @JsonProperty("Negative")
    private long negative;

    @JsonProperty("Neutral")
    private long neutral;
}
