package com.marketpulse.dto.analytics;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

// ========== Score Histogram Bin DTO ==========
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HistogramBin {
    private double lower;   // inclusive
    private double upper;   // exclusive, except the last bin which includes 1.0
    private long count;
}
