package com.metaperception.core.entropy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Output of {@link EntropyEngine}.
 *
 * @param marketEntropy    mean of the per-feature entropies, in bits
 * @param featureEntropy   entropy of every series that qualified
 * @param interpretation   band of {@code marketEntropy}
 * @param confidence       sample adequacy in [0, 1]
 * @param binCount         histogram bins used
 * @param observationCount returns consumed across all qualifying series
 */
public record EntropyMetrics(
    @JsonProperty("marketEntropy")    double marketEntropy,
    @JsonProperty("featureEntropy")   Map<String, Double> featureEntropy,
    @JsonProperty("interpretation")   EntropyInterpretation interpretation,
    @JsonProperty("confidence")       double confidence,
    @JsonProperty("binCount")         int binCount,
    @JsonProperty("observationCount") int observationCount
) {
    public EntropyMetrics {
        featureEntropy = featureEntropy == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new TreeMap<>(featureEntropy));
    }

    public static EntropyMetrics empty(int binCount) {
        return new EntropyMetrics(0.0, Map.of(), EntropyInterpretation.LOW_ENTROPY, 0.0, binCount, 0);
    }
}
