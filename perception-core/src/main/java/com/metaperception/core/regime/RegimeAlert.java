package com.metaperception.core.regime;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Output of {@link RegimePivotDetector}.
 *
 * @param stress           weighted leading-indicator stress, ≥ 0
 * @param pivotDetected    stress reached the configured threshold
 * @param pivotProbability sigmoid of the distance to the threshold
 * @param alertLevel       band of the stress
 * @param currentRegime    regime carried over from the previous state, may be null
 * @param expectedRegime   regime the pivot leads into; null when no pivot
 * @param indicators       the five indicator values used
 * @param threshold        pivot threshold in force
 */
public record RegimeAlert(
    @JsonProperty("stress")           double stress,
    @JsonProperty("pivotDetected")    boolean pivotDetected,
    @JsonProperty("pivotProbability") double pivotProbability,
    @JsonProperty("alertLevel")       AlertLevel alertLevel,
    @JsonProperty("currentRegime")    String currentRegime,
    @JsonProperty("expectedRegime")   RegimeLabel expectedRegime,
    @JsonProperty("indicators")       Map<String, Double> indicators,
    @JsonProperty("threshold")        double threshold
) {
    public RegimeAlert {
        indicators = indicators == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new TreeMap<>(indicators));
    }
}
