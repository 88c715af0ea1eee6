package com.metaperception.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.metaperception.core.exception.PerceptionConfigException;

import java.util.List;

/**
 * Pre-calibrated logit weights of the intent classifier, one row per hypothesis.
 *
 * <p>Column order matches {@link com.metaperception.core.intent.IntentInferencer#FEATURE_ORDER}:
 * open-interest change, funding rate, whale net flow, futures basis, put/call ratio.
 */
public record IntentWeights(
    @JsonProperty("longWeights")    List<Double> longWeights,
    @JsonProperty("shortWeights")   List<Double> shortWeights,
    @JsonProperty("neutralWeights") List<Double> neutralWeights
) {
    public static final int FEATURE_COUNT = 5;

    public IntentWeights {
        longWeights    = requireRow("intentWeights.longWeights", longWeights);
        shortWeights   = requireRow("intentWeights.shortWeights", shortWeights);
        neutralWeights = requireRow("intentWeights.neutralWeights", neutralWeights);
    }

    public static IntentWeights defaults() {
        return new IntentWeights(
            List.of( 0.8,  0.6,  1.0,  0.5, -0.7),
            List.of(-0.8, -0.6, -1.0, -0.5,  0.7),
            List.of( 0.0,  0.0,  0.0,  0.0,  0.0));
    }

    private static List<Double> requireRow(String field, List<Double> row) {
        if (row == null || row.size() != FEATURE_COUNT) {
            throw new PerceptionConfigException(field,
                "expected " + FEATURE_COUNT + " weights, got " + (row == null ? "null" : row.size()));
        }
        for (Double w : row) {
            if (w == null || !Double.isFinite(w)) {
                throw new PerceptionConfigException(field, "weights must be finite numbers");
            }
        }
        return List.copyOf(row);
    }
}
