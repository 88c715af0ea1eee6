package com.metaperception.core.reflexivity;

/** Magnitude band of the reflexivity coefficient: 0.1 / 0.3 / 0.6 cut points. */
public enum FeedbackStrength {
    NONE,
    WEAK,
    MODERATE,
    STRONG;

    public static FeedbackStrength classify(double coefficient) {
        double magnitude = Math.abs(coefficient);
        if (magnitude < 0.1) return NONE;
        if (magnitude < 0.3) return WEAK;
        if (magnitude < 0.6) return MODERATE;
        return STRONG;
    }
}
