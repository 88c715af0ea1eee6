package com.metaperception.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Action-facing output of one cycle.
 *
 * @param leverageAdjustment multiplier for downstream sizing; null means no override
 * @param rationale          ordered triggering conditions when blocking, a status line otherwise
 * @param keyFactors         contributing factors; never empty when {@code shouldAct} is false
 */
public record MetaPerceptionDecision(
    @JsonProperty("decisionId")          String decisionId,
    @JsonProperty("snapshotId")          String snapshotId,
    @JsonProperty("timestamp")           Instant timestamp,
    @JsonProperty("shouldAct")           boolean shouldAct,
    @JsonProperty("confidence")          double confidence,
    @JsonProperty("recommendedRiskMode") RiskMode recommendedRiskMode,
    @JsonProperty("leverageAdjustment")  Double leverageAdjustment,
    @JsonProperty("alertOperator")       boolean alertOperator,
    @JsonProperty("alertPriority")       AlertPriority alertPriority,
    @JsonProperty("rationale")           String rationale,
    @JsonProperty("keyFactors")          List<String> keyFactors
) {
    public MetaPerceptionDecision {
        keyFactors = keyFactors == null ? List.of() : List.copyOf(keyFactors);
    }
}
