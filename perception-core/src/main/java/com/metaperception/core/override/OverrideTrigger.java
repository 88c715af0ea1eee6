package com.metaperception.core.override;

/**
 * Why a cycle blocked action. Declaration order is the classification priority.
 */
public enum OverrideTrigger {
    HIGH_NOISE,
    HIGH_UNCERTAINTY,
    REGIME_PIVOT,
    CRITICAL_SHOCK,
    LOW_CONFIDENCE
}
