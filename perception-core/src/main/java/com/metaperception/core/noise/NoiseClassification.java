package com.metaperception.core.noise;

/** Bands of the normalized noise level. */
public enum NoiseClassification {
    CLEAN,
    NORMAL,
    NOISY,
    EXTREME_NOISE;

    public static NoiseClassification classify(double noise) {
        if (noise < 0.3) return CLEAN;
        if (noise < 0.5) return NORMAL;
        if (noise < 0.7) return NOISY;
        return EXTREME_NOISE;
    }
}
