package com.metaperception.orchestrator.config;

import com.metaperception.core.config.IntentWeights;
import com.metaperception.core.config.PerceptionConfig;
import com.metaperception.core.config.UncertaintyWeights;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Externalized thresholds and weights of the perception pipeline, bound from
 * {@code perception.*}. Converted once into the immutable {@link PerceptionConfig};
 * validation happens there.
 */
@Configuration
@ConfigurationProperties(prefix = "perception")
@Data
public class PerceptionProperties {

    /**
     * Noise level at or above which action is blocked
     */
    private double noiseThreshold = 0.70;

    /**
     * |z| above which an observation is a shock
     */
    private double shockZThreshold = 3.0;

    /**
     * Aggregate active-shock intensity reported as an elevated factor
     */
    private double shockIntensityThreshold = 3.0;

    /**
     * Leading-indicator stress at which a regime pivot is detected
     */
    private double regimeStressThreshold = 1.0;

    /**
     * Total uncertainty at or above which action is blocked
     */
    private double uncertaintyThreshold = 0.75;

    private int entropyBins = 32;
    private int noiseWindow = 5;
    private int minEntropyPoints = 2;
    private int minShockPoints = 10;

    /**
     * Shocks older than this many points are resolved
     */
    private int shockDecayPoints = 5;

    private int reflexivityWindow = 20;

    /**
     * Market-data series the reflexivity analyzer correlates decisions against
     */
    private String priceFeature = "price";

    /**
     * Advisory cycle budget; breaches are logged, never enforced
     */
    private long maxComputationTimeMs = 250L;

    private UncertaintyWeightsProperties uncertaintyWeights = new UncertaintyWeightsProperties();

    private IntentWeightsProperties intentWeights = new IntentWeightsProperties();

    public PerceptionConfig toConfig() {
        return PerceptionConfig.builder()
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
            .uncertaintyWeights(uncertaintyWeights.toWeights())
            .intentWeights(intentWeights.toWeights())
            .maxComputationTimeMs(maxComputationTimeMs)
            .build();
    }

    @Data
    public static class UncertaintyWeightsProperties {
        private double entropy = 0.3;
        private double noise = 0.3;
        private double reflexivity = 0.2;
        private double regime = 0.2;

        UncertaintyWeights toWeights() {
            return new UncertaintyWeights(entropy, noise, reflexivity, regime);
        }
    }

    /**
     * Logit weights per hypothesis, in the order open-interest change, funding rate,
     * whale net flow, futures basis, put/call ratio
     */
    @Data
    public static class IntentWeightsProperties {
        private List<Double> longWeights = new ArrayList<>(IntentWeights.defaults().longWeights());
        private List<Double> shortWeights = new ArrayList<>(IntentWeights.defaults().shortWeights());
        private List<Double> neutralWeights = new ArrayList<>(IntentWeights.defaults().neutralWeights());

        IntentWeights toWeights() {
            return new IntentWeights(longWeights, shortWeights, neutralWeights);
        }
    }
}
