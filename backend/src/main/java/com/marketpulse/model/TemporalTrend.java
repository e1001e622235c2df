package com.marketpulse.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Direction of the positive share between the first and second half of a time-ordered dataset. */
public enum TemporalTrend {
    IMPROVING("Improving"),
    DECLINING("Declining"),
    STABLE("Stable");

    private final String label;

    TemporalTrend(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
