package com.metaperception.core.model;

/**
 * Risk posture recommended to downstream sizing.
 *
 * <ul>
 *   <li>{@link #NORMAL}:    no adverse conditions.</li>
 *   <li>{@link #CAUTIOUS}:  elevated noise or moderate regime stress.</li>
 *   <li>{@link #DEFENSIVE}: severe regime stress or a critical shock.</li>
 * </ul>
 */
public enum RiskMode {
    NORMAL,
    CAUTIOUS,
    DEFENSIVE
}
