package com.metaperception.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Signed per-hypothesis change of intent probability between two states. */
public record IntentShift(
    @JsonProperty("long")    double longShift,
    @JsonProperty("short")   double shortShift,
    @JsonProperty("neutral") double neutralShift
) {
    public static IntentShift between(IntentProbabilities previous, IntentProbabilities current) {
        return new IntentShift(
            current.longProbability() - previous.longProbability(),
            current.shortProbability() - previous.shortProbability(),
            current.neutralProbability() - previous.neutralProbability());
    }

    public double maxAbsoluteShift() {
        return Math.max(Math.abs(longShift), Math.max(Math.abs(shortShift), Math.abs(neutralShift)));
    }
}
