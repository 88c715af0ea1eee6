package com.metaperception.core.shock;

import java.util.Locale;

/** Semantic class of a shock, derived from the name of the feature that spiked. */
public enum ShockType {
    FUNDING_SHOCK,
    OPEN_INTEREST_SHOCK,
    FLOW_SHOCK,
    CORRELATION_SHOCK,
    ENTROPY_SHOCK,
    UNKNOWN;

    public static ShockType fromFeature(String feature) {
        if (feature == null) return UNKNOWN;
        String name = feature.toLowerCase(Locale.ROOT);
        if (name.contains("funding")) return FUNDING_SHOCK;
        if (name.contains("open_interest") || name.equals("oi") || name.startsWith("oi_") || name.endsWith("_oi")) {
            return OPEN_INTEREST_SHOCK;
        }
        if (name.contains("flow")) return FLOW_SHOCK;
        if (name.contains("corr")) return CORRELATION_SHOCK;
        if (name.contains("entropy")) return ENTROPY_SHOCK;
        return UNKNOWN;
    }
}
