package com.marketpulse.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Prevalence of an issue among negative rows. Evaluated top to bottom; the first tier whose share is exceeded wins. */
public enum SeverityTier {
    HIGH("High", 0.3),
    MEDIUM("Medium", 0.1),
    LOW("Low", 0.0);

    private final String label;
    private final double minShare;

    SeverityTier(String label, double minShare) {
        this.label = label;
        this.minShare = minShare;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static SeverityTier of(long mentions, long negativeRows) {
        for (SeverityTier tier : values()) {
            if (tier != LOW && mentions > negativeRows * tier.minShare) {
                return tier;
            }
        }
        return LOW;
    }
}
