package com.metaperception.core.decision;

import com.metaperception.core.config.PerceptionConfig;
import com.metaperception.core.model.AlertPriority;
import com.metaperception.core.model.ArtifactIds;
import com.metaperception.core.model.MetaPerceptionDecision;
import com.metaperception.core.model.PerceptionState;
import com.metaperception.core.model.RiskMode;
import com.metaperception.core.regime.AlertLevel;
import com.metaperception.core.regime.RegimeAlert;
import com.metaperception.core.shock.ShockEvent;
import com.metaperception.core.state.ActionGuards;
import com.metaperception.core.util.StatMath;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a composed {@link PerceptionState} into the externally consumed decision.
 *
 * <h3>Risk mode</h3>
 * <pre>
 *   stress &gt; 1.5 or critical shock → DEFENSIVE
 *   noise &gt; 0.6 or stress &gt; 0.8   → CAUTIOUS
 *   otherwise                      → NORMAL
 * </pre>
 *
 * <h3>Leverage adjustment</h3>
 * <pre>
 *   !shouldAct          → 0.5
 *   uncertainty &gt; 0.7  → 0.7
 *   otherwise           → none (null)
 * </pre>
 *
 * <h3>Operator alert</h3>
 * Fires when not acting, on any critical shock, or on a CRITICAL regime alert.
 * Priority is CRITICAL when not acting, HIGH when alerting while still acting, LOW otherwise.
 *
 * <p>The decision never re-evaluates {@code shouldAct}; it reads the state's flag.
 */
public final class DecisionMaker {

    static final double DEFENSIVE_STRESS     = 1.5;
    static final double CAUTIOUS_STRESS      = 0.8;
    static final double CAUTIOUS_NOISE       = 0.6;
    static final double BLOCKED_LEVERAGE     = 0.5;
    static final double HIGH_UNCERTAINTY     = 0.7;
    static final double UNCERTAIN_LEVERAGE   = 0.7;

    static final String STATUS_LINE =
        "All perception guards passed: noise acceptable, uncertainty within bound, no regime pivot, no critical shocks";

    private DecisionMaker() {}

    public static MetaPerceptionDecision decide(PerceptionState state,
                                                List<ShockEvent> shocks,
                                                RegimeAlert regimeAlert,
                                                String snapshotId,
                                                PerceptionConfig config) {
        boolean criticalShock = state.criticalShockCount() > 0;

        RiskMode riskMode = riskMode(state, criticalShock);
        Double leverage = leverageAdjustment(state);

        boolean alert = !state.shouldAct()
            || criticalShock
            || regimeAlert.alertLevel() == AlertLevel.CRITICAL;
        AlertPriority priority = !state.shouldAct()
            ? AlertPriority.CRITICAL
            : alert ? AlertPriority.HIGH : AlertPriority.LOW;

        List<String> reasons = new ArrayList<>();
        List<String> factors = new ArrayList<>();
        if (state.shouldAct()) {
            reasons.add(STATUS_LINE);
            contextualFactors(state, regimeAlert, config, factors);
        } else {
            blockingReasons(state, shocks, regimeAlert, config, reasons, factors);
        }

        return new MetaPerceptionDecision(
            ArtifactIds.decisionId(snapshotId, state.timestamp()),
            snapshotId,
            state.timestamp(),
            state.shouldAct(),
            StatMath.clamp01(1.0 - state.totalUncertainty()),
            riskMode,
            leverage,
            alert,
            priority,
            (state.shouldAct() ? "" : "BLOCKED: ") + String.join("; ", reasons),
            factors);
    }

    static RiskMode riskMode(PerceptionState state, boolean criticalShock) {
        if (state.regimeStress() > DEFENSIVE_STRESS || criticalShock) return RiskMode.DEFENSIVE;
        if (state.noiseScore() > CAUTIOUS_NOISE || state.regimeStress() > CAUTIOUS_STRESS) return RiskMode.CAUTIOUS;
        return RiskMode.NORMAL;
    }

    static Double leverageAdjustment(PerceptionState state) {
        if (!state.shouldAct()) return BLOCKED_LEVERAGE;
        if (state.totalUncertainty() > HIGH_UNCERTAINTY) return UNCERTAIN_LEVERAGE;
        return null;
    }

    // order: noise, uncertainty, shocks, pivot
    private static void blockingReasons(PerceptionState state, List<ShockEvent> shocks, RegimeAlert regime,
                                        PerceptionConfig config, List<String> reasons, List<String> factors) {
        ActionGuards guards = ActionGuards.evaluate(state, config);

        if (!guards.noiseAcceptable()) {
            reasons.add(fmt("Noise level %.3f at or above threshold %.3f", state.noiseScore(), config.noiseThreshold()));
            factors.add(fmt("noise_level=%.3f", state.noiseScore()));
        }
        if (!guards.uncertaintyWithinBound()) {
            reasons.add(fmt("Total uncertainty %.3f at or above threshold %.3f",
                state.totalUncertainty(), config.uncertaintyThreshold()));
            factors.add(fmt("total_uncertainty=%.3f", state.totalUncertainty()));
        }
        if (!guards.noCriticalShocks()) {
            List<String> ids = shocks.stream()
                .filter(s -> s.isActive() && s.isCritical())
                .map(ShockEvent::shockId)
                .toList();
            reasons.add(fmt("%d critical shock(s) active", state.criticalShockCount())
                + (ids.isEmpty() ? "" : " " + ids));
            factors.add(fmt("critical_shocks=%d", state.criticalShockCount()));
        }
        if (!guards.noRegimePivot()) {
            String target = regime.expectedRegime() == null ? "UNKNOWN" : regime.expectedRegime().name();
            reasons.add(fmt("Regime pivot detected: stress %.3f at or above %.3f, probability %.2f, expected regime %s",
                state.regimeStress(), config.regimeStressThreshold(), state.pivotProbability(), target));
            factors.add(fmt("regime_stress=%.3f", state.regimeStress()));
        }
        if (reasons.isEmpty()) {
            // unreachable while the state honours its guard invariant
            reasons.add("Perception state does not authorize action");
            factors.add("should_act=false");
        }
    }

    private static void contextualFactors(PerceptionState state, RegimeAlert regime,
                                          PerceptionConfig config, List<String> factors) {
        factors.add(fmt("noise_level=%.3f", state.noiseScore()));
        factors.add(fmt("total_uncertainty=%.3f", state.totalUncertainty()));
        factors.add(fmt("regime_stress=%.3f", state.regimeStress()));
        factors.add(fmt("dominant_pressure=%s(%.2f)", state.dominantPressure(),
            state.intentProbabilities().of(state.dominantPressure())));
        if (state.aggregateShockIntensity() >= config.shockIntensityThreshold()) {
            factors.add(fmt("elevated_shock_intensity=%.3f", state.aggregateShockIntensity()));
        }
        if (regime.alertLevel() == AlertLevel.CRITICAL) {
            factors.add("regime_alert=CRITICAL");
        }
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
