package com.metaperception.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.metaperception.core.exception.PerceptionConfigException;

/**
 * Weights of the four normalized uncertainty components. Must be non-negative;
 * they need not sum to 1, although {@link #defaults()} does.
 */
public record UncertaintyWeights(
    @JsonProperty("entropy")     double entropy,
    @JsonProperty("noise")       double noise,
    @JsonProperty("reflexivity") double reflexivity,
    @JsonProperty("regime")      double regime
) {
    public UncertaintyWeights {
        requireNonNegative("uncertaintyWeights.entropy", entropy);
        requireNonNegative("uncertaintyWeights.noise", noise);
        requireNonNegative("uncertaintyWeights.reflexivity", reflexivity);
        requireNonNegative("uncertaintyWeights.regime", regime);
    }

    public static UncertaintyWeights defaults() {
        return new UncertaintyWeights(0.30, 0.30, 0.20, 0.20);
    }

    public double sum() {
        return entropy + noise + reflexivity + regime;
    }

    private static void requireNonNegative(String field, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new PerceptionConfigException(field, "weight must be a finite non-negative number, got " + value);
        }
    }
}
