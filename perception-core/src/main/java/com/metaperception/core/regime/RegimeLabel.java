package com.metaperception.core.regime;

/** Regimes a pivot can lead into. */
public enum RegimeLabel {
    BULL,
    BEAR,
    NEUTRAL,
    CRISIS
}
