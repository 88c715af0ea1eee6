package com.metaperception.core.regime;

import com.metaperception.core.config.PerceptionConfig;
import com.metaperception.core.model.PerceptionState;
import com.metaperception.core.util.StatMath;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines five pre-normalized leading indicators into a regime stress score.
 *
 * <h3>Stress</h3>
 * <pre>
 *   stress = 0.30·|volatility_acceleration| + 0.25·|correlation_instability|
 *          + 0.20·|liquidity_stress|        + 0.15·|flow_divergence|
 *          + 0.10·|entropy_spike|
 *   pivot       ⇔ stress ≥ threshold
 *   probability = 1 / (1 + e^(−5·(stress − threshold)))
 * </pre>
 * Magnitudes are summed so that stress stays non-negative; the sign of flow divergence
 * only matters when labelling the expected regime.
 *
 * <h3>Expected regime (only when a pivot is detected)</h3>
 * <ol>
 *   <li>acceleration &gt; 1.5 and divergence &lt; −1.0 → {@link RegimeLabel#CRISIS}</li>
 *   <li>acceleration &lt; 0.5 and divergence &gt; 0    → {@link RegimeLabel#BULL}</li>
 *   <li>acceleration &gt; 1.0                       → {@link RegimeLabel#BEAR}</li>
 *   <li>otherwise                                 → {@link RegimeLabel#NEUTRAL}</li>
 * </ol>
 */
public final class RegimePivotDetector {

    public static final String VOLATILITY_ACCELERATION = "volatility_acceleration";
    public static final String CORRELATION_INSTABILITY = "correlation_instability";
    public static final String LIQUIDITY_STRESS        = "liquidity_stress";
    public static final String FLOW_DIVERGENCE         = "flow_divergence";
    public static final String ENTROPY_SPIKE           = "entropy_spike";

    public static final List<String> INDICATORS = List.of(
        VOLATILITY_ACCELERATION, CORRELATION_INSTABILITY, LIQUIDITY_STRESS, FLOW_DIVERGENCE, ENTROPY_SPIKE);

    static final List<Double> INDICATOR_WEIGHTS = List.of(0.30, 0.25, 0.20, 0.15, 0.10);

    /** Steepness of the pivot-probability sigmoid. */
    static final double SIGMOID_STEEPNESS = 5.0;

    private RegimePivotDetector() {}

    /**
     * @param features      current scalar features; missing indicators count as 0
     * @param previousState previous cycle's state, null on the first cycle
     */
    public static RegimeAlert detectRegimePivot(Map<String, Double> features,
                                                PerceptionState previousState,
                                                PerceptionConfig config) {
        Map<String, Double> indicators = new LinkedHashMap<>();
        double stress = 0.0;
        for (int i = 0; i < INDICATORS.size(); i++) {
            String name = INDICATORS.get(i);
            Double raw = features == null ? null : features.get(name);
            double value = raw == null ? 0.0 : raw;
            indicators.put(name, value);
            stress += INDICATOR_WEIGHTS.get(i) * Math.abs(value);
        }

        double threshold = config.regimeStressThreshold();
        boolean detected = stress >= threshold;
        double probability = StatMath.sigmoid(SIGMOID_STEEPNESS * (stress - threshold));

        RegimeLabel expected = detected
            ? expectedRegime(indicators.get(VOLATILITY_ACCELERATION), indicators.get(FLOW_DIVERGENCE))
            : null;

        return new RegimeAlert(
            stress,
            detected,
            probability,
            AlertLevel.fromStress(stress, threshold),
            previousState == null ? null : previousState.currentRegime(),
            expected,
            indicators,
            threshold);
    }

    static RegimeLabel expectedRegime(double volatilityAcceleration, double flowDivergence) {
        if (volatilityAcceleration > 1.5 && flowDivergence < -1.0) return RegimeLabel.CRISIS;
        if (volatilityAcceleration < 0.5 && flowDivergence > 0.0) return RegimeLabel.BULL;
        if (volatilityAcceleration > 1.0) return RegimeLabel.BEAR;
        return RegimeLabel.NEUTRAL;
    }
}
