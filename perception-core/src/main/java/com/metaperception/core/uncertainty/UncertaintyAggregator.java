package com.metaperception.core.uncertainty;

import com.metaperception.core.config.PerceptionConfig;
import com.metaperception.core.config.UncertaintyWeights;
import com.metaperception.core.entropy.EntropyMetrics;
import com.metaperception.core.noise.NoiseScore;
import com.metaperception.core.reflexivity.ReflexivityScore;
import com.metaperception.core.regime.RegimeAlert;
import com.metaperception.core.util.StatMath;

/**
 * Folds entropy, noise, reflexivity and regime stress into one uncertainty scalar.
 *
 * <pre>
 *   entropy     → H / 5 bits, capped at 1
 *   noise       → noise level
 *   reflexivity → |coefficient|
 *   regime      → stress / 2, capped at 1
 *   total       = Σ weight_i · component_i
 * </pre>
 */
public final class UncertaintyAggregator {

    /** Theoretical ceiling used to normalize entropy. */
    public static final double MAX_ENTROPY_BITS = 5.0;

    /** Stress at which the regime component saturates. */
    public static final double MAX_REGIME_STRESS = 2.0;

    private UncertaintyAggregator() {}

    public static UncertaintyBreakdown aggregate(EntropyMetrics entropy,
                                                 NoiseScore noise,
                                                 ReflexivityScore reflexivity,
                                                 RegimeAlert regime,
                                                 PerceptionConfig config) {
        double entropyComponent     = StatMath.clamp01(entropy.marketEntropy() / MAX_ENTROPY_BITS);
        double noiseComponent       = StatMath.clamp01(noise.noiseLevel());
        double reflexivityComponent = StatMath.clamp01(Math.abs(reflexivity.coefficient()));
        double regimeComponent      = StatMath.clamp01(regime.stress() / MAX_REGIME_STRESS);

        UncertaintyWeights w = config.uncertaintyWeights();
        double total = w.entropy() * entropyComponent
            + w.noise() * noiseComponent
            + w.reflexivity() * reflexivityComponent
            + w.regime() * regimeComponent;

        return new UncertaintyBreakdown(entropyComponent, noiseComponent, reflexivityComponent,
            regimeComponent, w, total);
    }
}
