package com.metaperception.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Locale;

/**
 * A past action taken by the system, reduced by the reflexivity analyzer to a
 * direction of +1 (buy), -1 (sell) or 0 (anything else).
 */
public record PriorDecision(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("action")    String action,
    @JsonProperty("symbol")    String symbol
) {
    public int direction() {
        if (action == null) return 0;
        return switch (action.trim().toUpperCase(Locale.ROOT)) {
            case "BUY", "LONG"   -> 1;
            case "SELL", "SHORT" -> -1;
            default              -> 0;
        };
    }
}
