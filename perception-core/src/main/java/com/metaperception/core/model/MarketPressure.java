package com.metaperception.core.model;

/**
 * Dominant participant pressure inferred for the cycle.
 * {@link #UNKNOWN} when no intent feature was supplied.
 */
public enum MarketPressure {
    LONG,
    SHORT,
    NEUTRAL,
    UNKNOWN
}
