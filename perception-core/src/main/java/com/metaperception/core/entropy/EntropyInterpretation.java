package com.metaperception.core.entropy;

/**
 * Bands of market entropy, in bits.
 *
 * <pre>
 *   H &lt; 1.5  → LOW_ENTROPY
 *   H &lt; 3.0  → MEDIUM_ENTROPY
 *   H &lt; 4.5  → HIGH_ENTROPY
 *   else     → EXTREME_ENTROPY
 * </pre>
 */
public enum EntropyInterpretation {
    LOW_ENTROPY,
    MEDIUM_ENTROPY,
    HIGH_ENTROPY,
    EXTREME_ENTROPY;

    public static EntropyInterpretation classify(double bits) {
        if (bits < 1.5) return LOW_ENTROPY;
        if (bits < 3.0) return MEDIUM_ENTROPY;
        if (bits < 4.5) return HIGH_ENTROPY;
        return EXTREME_ENTROPY;
    }
}
