package com.metaperception.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Probability triple over the three participant-intent hypotheses.
 *
 * <p>Each component lies in [0, 1] and the three sum to 1 within {@value #TOLERANCE}.
 * Construction fails otherwise.
 */
public record IntentProbabilities(
    @JsonProperty("long")    double longProbability,
    @JsonProperty("short")   double shortProbability,
    @JsonProperty("neutral") double neutralProbability
) {
    public static final double TOLERANCE = 1e-6;

    public IntentProbabilities {
        requireProbability("long", longProbability);
        requireProbability("short", shortProbability);
        requireProbability("neutral", neutralProbability);
        double sum = longProbability + shortProbability + neutralProbability;
        if (Math.abs(sum - 1.0) > TOLERANCE) {
            throw new IllegalArgumentException("intent probabilities must sum to 1, got " + sum);
        }
    }

    public static IntentProbabilities uniform() {
        return new IntentProbabilities(1.0 / 3.0, 1.0 / 3.0, 1.0 / 3.0);
    }

    public double of(MarketPressure pressure) {
        return switch (pressure) {
            case LONG    -> longProbability;
            case SHORT   -> shortProbability;
            case NEUTRAL -> neutralProbability;
            case UNKNOWN -> 0.0;
        };
    }

    /** Arg-max; ties resolve NEUTRAL, then LONG, then SHORT. */
    @JsonIgnore
    public MarketPressure dominant() {
        MarketPressure best = MarketPressure.NEUTRAL;
        double bestP = neutralProbability;
        if (longProbability > bestP) {
            best = MarketPressure.LONG;
            bestP = longProbability;
        }
        if (shortProbability > bestP) {
            best = MarketPressure.SHORT;
        }
        return best;
    }

    private static void requireProbability(String name, double p) {
        if (!Double.isFinite(p) || p < 0.0 || p > 1.0 + TOLERANCE) {
            throw new IllegalArgumentException(name + " probability out of range: " + p);
        }
    }
}
