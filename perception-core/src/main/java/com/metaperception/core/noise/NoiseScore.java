package com.metaperception.core.noise;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Output of {@link NoiseEvaluator}.
 *
 * <p>{@code acceptable} is the noise gate of the should-act guard: it alone can block
 * action regardless of every other signal.
 */
public record NoiseScore(
    @JsonProperty("noiseLevel")     double noiseLevel,
    @JsonProperty("signalQuality")  double signalQuality,
    @JsonProperty("featureNoise")   Map<String, Double> featureNoise,
    @JsonProperty("classification") NoiseClassification classification,
    @JsonProperty("acceptable")     boolean acceptable,
    @JsonProperty("threshold")      double threshold,
    @JsonProperty("window")         int window,
    @JsonProperty("confidence")     double confidence
) {
    public NoiseScore {
        featureNoise = featureNoise == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new TreeMap<>(featureNoise));
    }
}
