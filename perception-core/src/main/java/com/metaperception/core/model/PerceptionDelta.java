package com.metaperception.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.metaperception.core.shock.ShockEvent;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Signed difference between two consecutive states. Absent on the first cycle.
 *
 * @param newShocks      events whose ids are active now but were not before
 * @param shocksResolved ids active before that are no longer active
 * @param alertPriority  CRITICAL for a new critical shock, HIGH for a regime change,
 *                       MEDIUM for any new shock, LOW otherwise
 */
public record PerceptionDelta(
    @JsonProperty("previousTimestamp") Instant previousTimestamp,
    @JsonProperty("currentTimestamp")  Instant currentTimestamp,
    @JsonProperty("entropyDelta")      double entropyDelta,
    @JsonProperty("noiseDelta")        double noiseDelta,
    @JsonProperty("intentShift")       IntentShift intentShift,
    @JsonProperty("reflexivityDelta")  double reflexivityDelta,
    @JsonProperty("regimeChanged")     boolean regimeChanged,
    @JsonProperty("previousRegime")    String previousRegime,
    @JsonProperty("currentRegime")     String currentRegime,
    @JsonProperty("newShocks")         List<ShockEvent> newShocks,
    @JsonProperty("shocksResolved")    Set<String> shocksResolved,
    @JsonProperty("alertPriority")     AlertPriority alertPriority
) {
    public PerceptionDelta {
        newShocks = newShocks == null ? List.of() : List.copyOf(newShocks);
        shocksResolved = shocksResolved == null
            ? Collections.emptySortedSet()
            : Collections.unmodifiableSortedSet(new TreeSet<>(shocksResolved));
    }
}
