package com.metaperception.core.state;

import com.metaperception.core.config.PerceptionConfig;
import com.metaperception.core.entropy.EntropyMetrics;
import com.metaperception.core.intent.IntentScore;
import com.metaperception.core.model.PerceptionState;
import com.metaperception.core.noise.NoiseScore;
import com.metaperception.core.reflexivity.ReflexivityScore;
import com.metaperception.core.regime.RegimeAlert;
import com.metaperception.core.shock.ShockEvent;
import com.metaperception.core.uncertainty.UncertaintyBreakdown;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the cycle's immutable {@link PerceptionState} from every component output.
 *
 * <p>The previous state is read only for regime continuity: the regime carries over
 * unless a pivot names a new one.
 *
 * <p>{@code shouldAct} is decided here and nowhere else, via {@link ActionGuards}.
 */
public final class StateComposer {

    private StateComposer() {}

    public static PerceptionState compose(Instant timestamp,
                                          EntropyMetrics entropy,
                                          NoiseScore noise,
                                          IntentScore intent,
                                          ReflexivityScore reflexivity,
                                          List<ShockEvent> shocks,
                                          RegimeAlert regime,
                                          UncertaintyBreakdown uncertainty,
                                          PerceptionState previousState,
                                          PerceptionConfig config) {
        Set<String> active = new TreeSet<>();
        double aggregateIntensity = 0.0;
        int critical = 0;
        for (ShockEvent shock : shocks) {
            if (!shock.isActive()) {
                continue;
            }
            active.add(shock.shockId());
            aggregateIntensity += shock.intensity();
            if (shock.isCritical()) {
                critical++;
            }
        }

        String previousRegime = previousState == null ? null : previousState.currentRegime();
        String regimeLabel = regime.pivotDetected() && regime.expectedRegime() != null
            ? regime.expectedRegime().name()
            : previousRegime;
        double regimeConfidence = regime.pivotDetected()
            ? regime.pivotProbability()
            : 1.0 - regime.pivotProbability();

        PerceptionState draft = new PerceptionState(
            timestamp,
            entropy.marketEntropy(),
            entropy.featureEntropy(),
            noise.noiseLevel(),
            noise.signalQuality(),
            intent.probabilities(),
            intent.dominantPressure(),
            reflexivity.coefficient(),
            reflexivity.systemImpact(),
            regimeLabel,
            regimeConfidence,
            regime.stress(),
            regime.pivotProbability(),
            active,
            aggregateIntensity,
            critical,
            uncertainty.total(),
            false);

        return withShouldAct(draft, deriveShouldAct(draft, config));
    }

    /** Re-derives the master flag from the other fields of {@code state}. */
    public static boolean deriveShouldAct(PerceptionState state, PerceptionConfig config) {
        return ActionGuards.evaluate(state, config).allPass();
    }

    private static PerceptionState withShouldAct(PerceptionState s, boolean shouldAct) {
        return new PerceptionState(s.timestamp(), s.marketEntropy(), s.featureEntropy(), s.noiseScore(),
            s.signalQuality(), s.intentProbabilities(), s.dominantPressure(), s.reflexivityCoefficient(),
            s.systemImpact(), s.currentRegime(), s.regimeConfidence(), s.regimeStress(),
            s.pivotProbability(), s.activeShocks(), s.aggregateShockIntensity(), s.criticalShockCount(),
            s.totalUncertainty(), shouldAct);
    }
}
