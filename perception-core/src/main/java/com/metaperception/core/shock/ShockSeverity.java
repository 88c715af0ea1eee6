package com.metaperception.core.shock;

/**
 * Severity of a shock by normalized intensity (3σ = 1.0).
 *
 * <pre>
 *   intensity &lt; 1 → LOW
 *   intensity &lt; 2 → MEDIUM
 *   intensity &lt; 5 → HIGH
 *   otherwise    → CRITICAL
 * </pre>
 */
public enum ShockSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static ShockSeverity fromIntensity(double intensity) {
        if (intensity < 1.0) return LOW;
        if (intensity < 2.0) return MEDIUM;
        if (intensity < 5.0) return HIGH;
        return CRITICAL;
    }
}
