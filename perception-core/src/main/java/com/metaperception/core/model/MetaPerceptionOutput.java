package com.metaperception.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.metaperception.core.profiling.ComputationProfile;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Everything a cycle hands to its caller.
 *
 * @param delta        null on the first cycle
 * @param artifacts    artifact id to storage location; empty until a publisher fills it
 * @param withinBudget false when the cycle exceeded {@code maxComputationTimeMs}; advisory only
 */
public record MetaPerceptionOutput(
    @JsonProperty("snapshot")          PerceptionSnapshot snapshot,
    @JsonProperty("delta")             PerceptionDelta delta,
    @JsonProperty("decision")          MetaPerceptionDecision decision,
    @JsonProperty("artifacts")         Map<String, String> artifacts,
    @JsonProperty("computationTimeMs") double computationTimeMs,
    @JsonProperty("withinBudget")      boolean withinBudget,
    @JsonProperty("profile")           ComputationProfile profile
) {
    public MetaPerceptionOutput {
        artifacts = artifacts == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(artifacts));
    }

    /** Copy with the storage locations reported by the persistence collaborator. */
    public MetaPerceptionOutput withArtifacts(Map<String, String> locations) {
        return new MetaPerceptionOutput(snapshot, delta, decision, locations, computationTimeMs, withinBudget, profile);
    }
}
