package com.marketpulse.dto.analytics;

import com.marketpulse.model.SeverityTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

// ========== Emerging Issue DTO ==========
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmergingIssue {
    private String issue;
    private long mentions;
    private SeverityTier severity;
    private double percentage;      // share of negative rows, one decimal
}
