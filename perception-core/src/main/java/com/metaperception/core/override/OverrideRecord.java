package com.metaperception.core.override;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.metaperception.core.model.MarketPressure;

import java.time.Instant;

/**
 * Audit record of one blocked cycle: what the system would have done and what stopped it.
 *
 * @param triggerValue      observed value of the triggering metric
 * @param threshold         bound the value crossed
 * @param preventedTrades   estimated trades not taken, 0 or 1
 * @param preventedCapital  estimated notional kept out of the market
 */
public record OverrideRecord(
    @JsonProperty("overrideId")       String overrideId,
    @JsonProperty("decisionId")       String decisionId,
    @JsonProperty("snapshotId")       String snapshotId,
    @JsonProperty("timestamp")        Instant timestamp,
    @JsonProperty("trigger")          OverrideTrigger trigger,
    @JsonProperty("triggerValue")     double triggerValue,
    @JsonProperty("threshold")        double threshold,
    @JsonProperty("dominantPressure") MarketPressure dominantPressure,
    @JsonProperty("preventedTrades")  int preventedTrades,
    @JsonProperty("preventedCapital") double preventedCapital,
    @JsonProperty("rationale")        String rationale
) {}
