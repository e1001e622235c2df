package com.marketpulse.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/** Polarity label attached to every classified row. Declaration order is the tie-break priority. */
public enum SentimentLabel {
    POSITIVE("Positive"),
    NEGATIVE("Negative"),
    NEUTRAL("Neutral");

    public static final double POSITIVE_THRESHOLD = 0.05;
    public static final double NEGATIVE_THRESHOLD = -0.05;

    private final String label;

    SentimentLabel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static SentimentLabel fromScore(double compound) {
        if (compound >= POSITIVE_THRESHOLD) return POSITIVE;
        if (compound <= NEGATIVE_THRESHOLD) return NEGATIVE;
        return NEUTRAL;
    }

    /** Reads a cell value written by the classifier; anything unrecognised is empty. */
    public static Optional<SentimentLabel> fromValue(Object value) {
        if (value instanceof SentimentLabel) {
            return Optional.of((SentimentLabel) value);
        }
        if (value instanceof String) {
            String s = ((String) value).trim();
            for (SentimentLabel l : values()) {
                if (l.label.equalsIgnoreCase(s)) {
                    return Optional.of(l);
                }
            }
        }
        return Optional.empty();
    }
}
