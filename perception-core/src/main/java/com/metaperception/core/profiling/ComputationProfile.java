package com.metaperception.core.profiling;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-stage wall-clock breakdown of one cycle.
 *
 * @param stageMillis    stage name to duration, in execution order
 * @param totalMillis    end-to-end duration
 * @param budgetMillis   configured budget
 * @param budgetExceeded total strictly above budget
 */
public record ComputationProfile(
    @JsonProperty("stageMillis")    Map<String, Double> stageMillis,
    @JsonProperty("totalMillis")    double totalMillis,
    @JsonProperty("budgetMillis")   long budgetMillis,
    @JsonProperty("budgetExceeded") boolean budgetExceeded
) {
    public ComputationProfile {
        stageMillis = stageMillis == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(stageMillis));
    }

    /** Name of the slowest stage, or null when nothing was recorded. */
    public String slowestStage() {
        return stageMillis.entrySet().stream()
            .max(Map.Entry.comparingByValue())
            .map(Map.Entry::getKey)
            .orElse(null);
    }
}
