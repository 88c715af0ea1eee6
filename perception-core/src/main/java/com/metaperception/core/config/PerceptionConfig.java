package com.metaperception.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.metaperception.core.exception.PerceptionConfigException;

/**
 * Cycle-invariant configuration of the perception pipeline.
 *
 * <p>Passed explicitly into every component call; never read from ambient state.
 * Instances are immutable and validated on construction, so a hot reload replaces the
 * whole object. Use {@link #defaults()} or {@link #builder()}.
 *
 * @param noiseThreshold           noise at or above this blocks action
 * @param shockZThreshold          |z| above which a point is a shock
 * @param shockIntensityThreshold  aggregate active intensity reported as elevated
 * @param regimeStressThreshold    stress at or above this is a regime pivot
 * @param uncertaintyThreshold     total uncertainty at or above this blocks action
 * @param entropyBins              histogram bins for return discretization
 * @param noiseWindow              moving-average window of the trend component
 * @param minEntropyPoints         minimum observations for a series to enter entropy
 * @param minShockPoints           minimum observations for a series to enter shock detection
 * @param shockDecayPoints         observations after which a shock counts as resolved
 * @param reflexivityWindow        maximum prior decisions correlated with returns
 * @param priceFeature             market-data series used as the reference return series
 * @param uncertaintyWeights       weights of the uncertainty components
 * @param intentWeights            logit weights of the intent classifier
 * @param maxComputationTimeMs     advisory performance budget of one cycle
 */
public record PerceptionConfig(
    @JsonProperty("noiseThreshold")          double noiseThreshold,
    @JsonProperty("shockZThreshold")         double shockZThreshold,
    @JsonProperty("shockIntensityThreshold") double shockIntensityThreshold,
    @JsonProperty("regimeStressThreshold")   double regimeStressThreshold,
    @JsonProperty("uncertaintyThreshold")    double uncertaintyThreshold,
    @JsonProperty("entropyBins")             int entropyBins,
    @JsonProperty("noiseWindow")             int noiseWindow,
    @JsonProperty("minEntropyPoints")        int minEntropyPoints,
    @JsonProperty("minShockPoints")          int minShockPoints,
    @JsonProperty("shockDecayPoints")        int shockDecayPoints,
    @JsonProperty("reflexivityWindow")       int reflexivityWindow,
    @JsonProperty("priceFeature")            String priceFeature,
    @JsonProperty("uncertaintyWeights")      UncertaintyWeights uncertaintyWeights,
    @JsonProperty("intentWeights")           IntentWeights intentWeights,
    @JsonProperty("maxComputationTimeMs")    long maxComputationTimeMs
) {
    public PerceptionConfig {
        requirePositive("noiseThreshold", noiseThreshold);
        requirePositive("shockZThreshold", shockZThreshold);
        requirePositive("shockIntensityThreshold", shockIntensityThreshold);
        requirePositive("regimeStressThreshold", regimeStressThreshold);
        requirePositive("uncertaintyThreshold", uncertaintyThreshold);
        requireAtLeast("entropyBins", entropyBins, 2);
        requireAtLeast("noiseWindow", noiseWindow, 2);
        requireAtLeast("minEntropyPoints", minEntropyPoints, 2);
        requireAtLeast("minShockPoints", minShockPoints, 3);
        requireAtLeast("shockDecayPoints", shockDecayPoints, 1);
        requireAtLeast("reflexivityWindow", reflexivityWindow, 2);
        if (priceFeature == null || priceFeature.isBlank()) {
            throw new PerceptionConfigException("priceFeature", "must name a market-data series");
        }
        if (uncertaintyWeights == null) {
            throw new PerceptionConfigException("uncertaintyWeights", "must not be null");
        }
        if (intentWeights == null) {
            throw new PerceptionConfigException("intentWeights", "must not be null");
        }
        if (maxComputationTimeMs <= 0) {
            throw new PerceptionConfigException("maxComputationTimeMs", "must be positive, got " + maxComputationTimeMs);
        }
    }

    public static PerceptionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .noiseThreshold(noiseThreshold)
            .shockZThreshold(shockZThreshold)
            .shockIntensityThreshold(shockIntensityThreshold)
            .regimeStressThreshold(regimeStressThreshold)
            .uncertaintyThreshold(uncertaintyThreshold)
            .entropyBins(entropyBins)
            .noiseWindow(noiseWindow)
            .minEntropyPoints(minEntropyPoints)
            .minShockPoints(minShockPoints)
            .shockDecayPoints(shockDecayPoints)
            .reflexivityWindow(reflexivityWindow)
            .priceFeature(priceFeature)
            .uncertaintyWeights(uncertaintyWeights)
            .intentWeights(intentWeights)
            .maxComputationTimeMs(maxComputationTimeMs);
    }

    private static void requirePositive(String field, double value) {
        if (!Double.isFinite(value) || value <= 0.0) {
            throw new PerceptionConfigException(field, "must be a finite positive number, got " + value);
        }
    }

    private static void requireAtLeast(String field, int value, int min) {
        if (value < min) {
            throw new PerceptionConfigException(field, "must be >= " + min + ", got " + value);
        }
    }

    public static final class Builder {
        private double noiseThreshold          = 0.70;
        private double shockZThreshold         = 3.0;
        private double shockIntensityThreshold = 3.0;
        private double regimeStressThreshold   = 1.0;
        private double uncertaintyThreshold    = 0.75;
        private int    entropyBins             = 32;
        private int    noiseWindow             = 5;
        private int    minEntropyPoints        = 2;
        private int    minShockPoints          = 10;
        private int    shockDecayPoints        = 5;
        private int    reflexivityWindow       = 20;
        private String priceFeature            = "price";
        private UncertaintyWeights uncertaintyWeights = UncertaintyWeights.defaults();
        private IntentWeights      intentWeights      = IntentWeights.defaults();
        private long   maxComputationTimeMs    = 250L;

        private Builder() {}

        public Builder noiseThreshold(double v)          { this.noiseThreshold = v; return this; }
        public Builder shockZThreshold(double v)         { this.shockZThreshold = v; return this; }
        public Builder shockIntensityThreshold(double v) { this.shockIntensityThreshold = v; return this; }
        public Builder regimeStressThreshold(double v)   { this.regimeStressThreshold = v; return this; }
        public Builder uncertaintyThreshold(double v)    { this.uncertaintyThreshold = v; return this; }
        public Builder entropyBins(int v)                { this.entropyBins = v; return this; }
        public Builder noiseWindow(int v)                { this.noiseWindow = v; return this; }
        public Builder minEntropyPoints(int v)           { this.minEntropyPoints = v; return this; }
        public Builder minShockPoints(int v)             { this.minShockPoints = v; return this; }
        public Builder shockDecayPoints(int v)           { this.shockDecayPoints = v; return this; }
        public Builder reflexivityWindow(int v)          { this.reflexivityWindow = v; return this; }
        public Builder priceFeature(String v)            { this.priceFeature = v; return this; }
        public Builder uncertaintyWeights(UncertaintyWeights v) { this.uncertaintyWeights = v; return this; }
        public Builder intentWeights(IntentWeights v)    { this.intentWeights = v; return this; }
        public Builder maxComputationTimeMs(long v)      { this.maxComputationTimeMs = v; return this; }

        public PerceptionConfig build() {
            return new PerceptionConfig(noiseThreshold, shockZThreshold, shockIntensityThreshold,
                regimeStressThreshold, uncertaintyThreshold, entropyBins, noiseWindow,
                minEntropyPoints, minShockPoints, shockDecayPoints, reflexivityWindow,
                priceFeature, uncertaintyWeights, intentWeights, maxComputationTimeMs);
        }
    }
}
