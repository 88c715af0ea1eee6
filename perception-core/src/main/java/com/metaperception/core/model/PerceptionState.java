package com.metaperception.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Canonical snapshot of what the market feels like at the end of one cycle.
 *
 * <p>Produced once per cycle by {@link com.metaperception.core.state.StateComposer} and never
 * mutated afterwards. {@code shouldAct} is not an independent input: it is always the
 * result of {@link com.metaperception.core.state.StateComposer#deriveShouldAct}.
 *
 * <p>Map and set fields are copied into sorted, unmodifiable collections so that two
 * states built from the same inputs serialize identically.
 */
public record PerceptionState(
    @JsonProperty("timestamp")               Instant timestamp,
    @JsonProperty("marketEntropy")           double marketEntropy,
    @JsonProperty("featureEntropy")          Map<String, Double> featureEntropy,
    @JsonProperty("noiseScore")              double noiseScore,
    @JsonProperty("signalQuality")           double signalQuality,
    @JsonProperty("intentProbabilities")     IntentProbabilities intentProbabilities,
    @JsonProperty("dominantPressure")        MarketPressure dominantPressure,
    @JsonProperty("reflexivityCoefficient")  double reflexivityCoefficient,
    @JsonProperty("systemImpact")            double systemImpact,
    @JsonProperty("currentRegime")           String currentRegime,
    @JsonProperty("regimeConfidence")        double regimeConfidence,
    @JsonProperty("regimeStress")            double regimeStress,
    @JsonProperty("pivotProbability")        double pivotProbability,
    @JsonProperty("activeShocks")            Set<String> activeShocks,
    @JsonProperty("aggregateShockIntensity") double aggregateShockIntensity,
    @JsonProperty("criticalShockCount")      int criticalShockCount,
    @JsonProperty("totalUncertainty")        double totalUncertainty,
    @JsonProperty("shouldAct")               boolean shouldAct
) {
    public PerceptionState {
        featureEntropy = featureEntropy == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new TreeMap<>(featureEntropy));
        SortedSet<String> shocks = activeShocks == null ? new TreeSet<>() : new TreeSet<>(activeShocks);
        activeShocks = Collections.unmodifiableSortedSet(shocks);
        if (intentProbabilities == null) {
            intentProbabilities = IntentProbabilities.uniform();
        }
        if (dominantPressure == null) {
            dominantPressure = MarketPressure.UNKNOWN;
        }
    }
}
