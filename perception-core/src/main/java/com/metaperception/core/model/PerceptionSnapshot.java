package com.metaperception.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.metaperception.core.entropy.EntropyMetrics;
import com.metaperception.core.intent.IntentScore;
import com.metaperception.core.noise.NoiseScore;
import com.metaperception.core.reflexivity.ReflexivityScore;
import com.metaperception.core.regime.RegimeAlert;
import com.metaperception.core.shock.ShockEvent;
import com.metaperception.core.uncertainty.UncertaintyBreakdown;

import java.time.Instant;
import java.util.List;

/**
 * Write-once audit bundle of one cycle: the composed state plus every component output
 * that produced it. This is the artifact handed to persistence.
 *
 * @param snapshotId        deterministic id derived from the cycle timestamp
 * @param shocks            every shock detected this cycle, resolved ones included
 * @param computationTimeMs wall-clock duration of the cycle
 */
public record PerceptionSnapshot(
    @JsonProperty("snapshotId")        String snapshotId,
    @JsonProperty("timestamp")         Instant timestamp,
    @JsonProperty("state")             PerceptionState state,
    @JsonProperty("entropy")           EntropyMetrics entropy,
    @JsonProperty("noise")             NoiseScore noise,
    @JsonProperty("intent")            IntentScore intent,
    @JsonProperty("reflexivity")       ReflexivityScore reflexivity,
    @JsonProperty("shocks")            List<ShockEvent> shocks,
    @JsonProperty("regimeAlert")       RegimeAlert regimeAlert,
    @JsonProperty("uncertainty")       UncertaintyBreakdown uncertainty,
    @JsonProperty("computationTimeMs") double computationTimeMs
) {
    public PerceptionSnapshot {
        shocks = shocks == null ? List.of() : List.copyOf(shocks);
    }
}
