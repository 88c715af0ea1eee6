package com.metaperception.core.reflexivity;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of {@link ReflexivityAnalyzer}.
 *
 * @param coefficient      Pearson correlation of decision directions with subsequent returns, in [-1, 1]
 * @param marketImpactBps  estimated self-impact in basis points, capped at 5
 * @param systemImpact     impact normalized to [0, 1]
 * @param feedbackStrength magnitude band of the coefficient
 * @param sampleSize       paired observations used
 * @param decisionVector   reduced directions (+1 / -1 / 0) that were correlated
 * @param returnVector     returns they were paired with
 */
public record ReflexivityScore(
    @JsonProperty("coefficient")      double coefficient,
    @JsonProperty("marketImpactBps")  double marketImpactBps,
    @JsonProperty("systemImpact")     double systemImpact,
    @JsonProperty("feedbackStrength") FeedbackStrength feedbackStrength,
    @JsonProperty("sampleSize")       int sampleSize,
    @JsonProperty("decisionVector")   List<Double> decisionVector,
    @JsonProperty("returnVector")     List<Double> returnVector
) {
    public ReflexivityScore {
        decisionVector = decisionVector == null ? List.of() : List.copyOf(decisionVector);
        returnVector = returnVector == null ? List.of() : List.copyOf(returnVector);
    }

    public static ReflexivityScore neutral(int sampleSize) {
        return new ReflexivityScore(0.0, 0.0, 0.0, FeedbackStrength.NONE, sampleSize, List.of(), List.of());
    }
}
