package com.metaperception.core.regime;

/**
 * Regime alert level by stress.
 *
 * <pre>
 *   stress ≥ 2.0       → CRITICAL
 *   stress ≥ threshold → WARNING
 *   stress ≥ 0.7       → WATCH
 *   otherwise          → INFO
 * </pre>
 */
public enum AlertLevel {
    INFO,
    WATCH,
    WARNING,
    CRITICAL;

    static final double CRITICAL_STRESS = 2.0;
    static final double WATCH_STRESS    = 0.7;

    public static AlertLevel fromStress(double stress, double pivotThreshold) {
        if (stress >= CRITICAL_STRESS) return CRITICAL;
        if (stress >= pivotThreshold) return WARNING;
        if (stress >= WATCH_STRESS) return WATCH;
        return INFO;
    }
}
