package com.metaperception.core.override;

import com.metaperception.core.config.PerceptionConfig;
import com.metaperception.core.model.ArtifactIds;
import com.metaperception.core.model.MarketPressure;
import com.metaperception.core.model.MetaPerceptionDecision;
import com.metaperception.core.model.PerceptionState;

import java.util.Map;
import java.util.Optional;

/**
 * Classifies blocked cycles and estimates what the block kept out of the market.
 *
 * <p>Trigger classification, first match wins:
 * <pre>
 *   noise ≥ noiseThreshold             → HIGH_NOISE
 *   uncertainty ≥ uncertaintyThreshold → HIGH_UNCERTAINTY
 *   stress ≥ regimeStressThreshold     → REGIME_PIVOT
 *   criticalShockCount &gt; 0            → CRITICAL_SHOCK
 *   otherwise                          → LOW_CONFIDENCE
 * </pre>
 *
 * <p>Prevented trades is 1 when the dominant pressure was directional (LONG or SHORT).
 * Prevented capital is trades × {@code portfolio_value} × {@value #EXPOSURE_FRACTION}.
 */
public final class OverrideDetector {

    public static final String PORTFOLIO_VALUE = "portfolio_value";
    public static final double EXPOSURE_FRACTION = 0.10;

    private OverrideDetector() {}

    /** Empty when the decision authorized action. */
    public static Optional<OverrideRecord> detect(MetaPerceptionDecision decision,
                                                  PerceptionState state,
                                                  Map<String, Object> portfolioContext,
                                                  PerceptionConfig config) {
        if (decision.shouldAct()) {
            return Optional.empty();
        }

        OverrideTrigger trigger;
        double value;
        double threshold;
        if (state.noiseScore() >= config.noiseThreshold()) {
            trigger = OverrideTrigger.HIGH_NOISE;
            value = state.noiseScore();
            threshold = config.noiseThreshold();
        } else if (state.totalUncertainty() >= config.uncertaintyThreshold()) {
            trigger = OverrideTrigger.HIGH_UNCERTAINTY;
            value = state.totalUncertainty();
            threshold = config.uncertaintyThreshold();
        } else if (state.regimeStress() >= config.regimeStressThreshold()) {
            trigger = OverrideTrigger.REGIME_PIVOT;
            value = state.regimeStress();
            threshold = config.regimeStressThreshold();
        } else if (state.criticalShockCount() > 0) {
            trigger = OverrideTrigger.CRITICAL_SHOCK;
            value = state.criticalShockCount();
            threshold = 0.0;
        } else {
            trigger = OverrideTrigger.LOW_CONFIDENCE;
            value = decision.confidence();
            threshold = 1.0 - config.uncertaintyThreshold();
        }

        MarketPressure pressure = state.dominantPressure();
        int trades = pressure == MarketPressure.LONG || pressure == MarketPressure.SHORT ? 1 : 0;
        double capital = trades * portfolioValue(portfolioContext) * EXPOSURE_FRACTION;

        return Optional.of(new OverrideRecord(
            ArtifactIds.overrideId(decision.decisionId()),
            decision.decisionId(),
            decision.snapshotId(),
            decision.timestamp(),
            trigger,
            value,
            threshold,
            pressure,
            trades,
            capital,
            decision.rationale()));
    }

    // non-numeric or missing values count as 0
    static double portfolioValue(Map<String, Object> portfolioContext) {
        if (portfolioContext == null) return 0.0;
        Object raw = portfolioContext.get(PORTFOLIO_VALUE);
        if (raw instanceof Number n) {
            double v = n.doubleValue();
            return Double.isFinite(v) && v > 0.0 ? v : 0.0;
        }
        if (raw instanceof String s) {
            try {
                double v = Double.parseDouble(s.trim());
                return Double.isFinite(v) && v > 0.0 ? v : 0.0;
            } catch (NumberFormatException e) {
                return 0.0;
            }
        }
        return 0.0;
    }
}
