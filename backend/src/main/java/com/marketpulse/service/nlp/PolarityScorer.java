package com.marketpulse.service.nlp;

/** Scores free text on a single polarity axis. */
public interface PolarityScorer {

    /**
     * Compound polarity of {@code text} in [-1, 1]; 0 for null or blank text.
     */
    double compound(String text);
}
