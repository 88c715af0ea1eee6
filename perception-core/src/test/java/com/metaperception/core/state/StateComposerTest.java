package com.metaperception.core.state;

import com.metaperception.core.PerceptionFixtures;
import com.metaperception.core.config.PerceptionConfig;
import com.metaperception.core.config.UncertaintyWeights;
import com.metaperception.core.entropy.EntropyMetrics;
import com.metaperception.core.intent.IntentScore;
import com.metaperception.core.intent.ParticipantType;
import com.metaperception.core.model.IntentProbabilities;
import com.metaperception.core.model.MarketPressure;
import com.metaperception.core.model.PerceptionState;
import com.metaperception.core.noise.NoiseClassification;
import com.metaperception.core.noise.NoiseScore;
import com.metaperception.core.reflexivity.ReflexivityScore;
import com.metaperception.core.regime.AlertLevel;
import com.metaperception.core.regime.RegimeAlert;
import com.metaperception.core.regime.RegimeLabel;
import com.metaperception.core.shock.ShockEvent;
import com.metaperception.core.uncertainty.UncertaintyBreakdown;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.metaperception.core.PerceptionFixtures.T0;
import static org.junit.jupiter.api.Assertions.*;

class StateComposerTest {

    private static final PerceptionConfig CONFIG = PerceptionConfig.defaults();

    private static final IntentScore INTENT = new IntentScore(
        new IntentProbabilities(0.6, 0.1, 0.3), MarketPressure.LONG, 0.6,
        ParticipantType.UNKNOWN, List.of(1.0, -1.0, 0.0), Map.of(), Map.of());

    private static NoiseScore noise(double level) {
        return new NoiseScore(level, 1.0 - level, Map.of(), NoiseClassification.classify(level),
            level < CONFIG.noiseThreshold(), CONFIG.noiseThreshold(), 5, 1.0);
    }

    private static RegimeAlert regime(double stress, RegimeLabel expected) {
        boolean pivot = stress >= CONFIG.regimeStressThreshold();
        return new RegimeAlert(stress, pivot, pivot ? 0.9 : 0.1, AlertLevel.fromStress(stress, 1.0),
            null, pivot ? expected : null, Map.of(), CONFIG.regimeStressThreshold());
    }

    private static UncertaintyBreakdown uncertainty(double total) {
        return new UncertaintyBreakdown(0.0, 0.0, 0.0, 0.0, UncertaintyWeights.defaults(), total);
    }

    private static PerceptionState compose(double noise, double stress, double uncertainty,
                                           List<ShockEvent> shocks, PerceptionState previous) {
        return StateComposer.compose(T0, EntropyMetrics.empty(10), noise(noise), INTENT,
            ReflexivityScore.neutral(0), shocks, regime(stress, RegimeLabel.BEAR),
            uncertainty(uncertainty), previous, CONFIG);
    }

    @Nested
    @DisplayName("shouldAct")
    class ShouldAct {

        @Test
        @DisplayName("all guards pass → act")
        void allPass() {
            assertTrue(compose(0.2, 0.1, 0.3, List.of(), null).shouldAct());
        }

        @Test
        @DisplayName("noise at or above threshold blocks, monotonically, whatever else holds")
        void noiseGuardMonotonic() {
            boolean blockedBefore = false;
            for (int i = 0; i <= 100; i++) {
                double level = i / 100.0;
                PerceptionState state = compose(level, 0.0, 0.0, List.of(), null);
                if (level >= CONFIG.noiseThreshold()) {
                    assertFalse(state.shouldAct(), "noise " + level);
                }
                if (blockedBefore) {
                    assertFalse(state.shouldAct(), "re-authorized at noise " + level);
                }
                blockedBefore |= !state.shouldAct();
            }
        }

        @Test
        @DisplayName("each guard alone is enough to block")
        void eachGuardBlocks() {
            assertFalse(compose(0.2, 0.1, 0.8, List.of(), null).shouldAct());
            assertFalse(compose(0.2, 1.2, 0.3, List.of(), null).shouldAct());
            assertFalse(compose(0.2, 0.1, 0.3,
                List.of(PerceptionFixtures.shock("price:crit", 6.0, false)), null).shouldAct());
        }

        @Test
        @DisplayName("deriveShouldAct agrees with the composed flag")
        void derivedAgrees() {
            PerceptionState state = compose(0.65, 0.9, 0.7, List.of(), null);
            assertEquals(StateComposer.deriveShouldAct(state, CONFIG), state.shouldAct());
        }
    }

    @Nested
    @DisplayName("shock aggregation")
    class Shocks {

        @Test
        @DisplayName("only unresolved shocks count as active")
        void activeOnly() {
            List<ShockEvent> shocks = List.of(
                PerceptionFixtures.shock("price:a", 1.5, false),
                PerceptionFixtures.shock("price:b", 6.0, true),
                PerceptionFixtures.shock("price:c", 2.5, false));

            PerceptionState state = compose(0.2, 0.1, 0.3, shocks, null);

            assertEquals(Set.of("price:a", "price:c"), state.activeShocks());
            assertEquals(4.0, state.aggregateShockIntensity(), 1e-12);
            assertEquals(0, state.criticalShockCount());
            assertTrue(state.shouldAct());
        }
    }

    @Nested
    @DisplayName("regime continuity")
    class Regime {

        @Test
        @DisplayName("no pivot → previous regime carries over")
        void carryOver() {
            PerceptionState previous = PerceptionFixtures.state().regime("BULL").build();
            assertEquals("BULL", compose(0.2, 0.1, 0.3, List.of(), previous).currentRegime());
        }

        @Test
        @DisplayName("pivot → expected regime replaces previous")
        void pivotReplaces() {
            PerceptionState previous = PerceptionFixtures.state().regime("BULL").build();
            PerceptionState state = compose(0.2, 1.4, 0.3, List.of(), previous);
            assertEquals("BEAR", state.currentRegime());
            assertEquals(0.9, state.regimeConfidence(), 1e-12);
        }

        @Test
        @DisplayName("first cycle without pivot → no regime label yet")
        void firstCycle() {
            PerceptionState state = compose(0.2, 0.1, 0.3, List.of(), null);
            assertNull(state.currentRegime());
            assertEquals(0.9, state.regimeConfidence(), 1e-12);
        }
    }
}
