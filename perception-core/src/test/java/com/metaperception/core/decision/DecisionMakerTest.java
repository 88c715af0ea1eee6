package com.metaperception.core.decision;

import com.metaperception.core.PerceptionFixtures;
import com.metaperception.core.config.PerceptionConfig;
import com.metaperception.core.model.AlertPriority;
import com.metaperception.core.model.ArtifactIds;
import com.metaperception.core.model.MetaPerceptionDecision;
import com.metaperception.core.model.PerceptionState;
import com.metaperception.core.model.RiskMode;
import com.metaperception.core.regime.AlertLevel;
import com.metaperception.core.regime.RegimeAlert;
import com.metaperception.core.regime.RegimeLabel;
import com.metaperception.core.shock.ShockEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DecisionMakerTest {

    private static final PerceptionConfig CONFIG = PerceptionConfig.defaults();
    private static final String SNAPSHOT_ID = ArtifactIds.snapshotId(PerceptionFixtures.T0);

    private static RegimeAlert alert(double stress, double threshold) {
        boolean pivot = stress >= threshold;
        return new RegimeAlert(stress, pivot, pivot ? 0.95 : 0.05, AlertLevel.fromStress(stress, threshold),
            null, pivot ? RegimeLabel.CRISIS : null, Map.of(), threshold);
    }

    private static MetaPerceptionDecision decide(PerceptionState state) {
        return DecisionMaker.decide(state, List.of(), alert(state.regimeStress(), 1.0), SNAPSHOT_ID, CONFIG);
    }

    @Nested
    @DisplayName("acting")
    class Acting {

        @Test
        @DisplayName("quiet state → NORMAL, no leverage override, no alert, LOW")
        void quiet() {
            PerceptionState state = PerceptionFixtures.state().noise(0.2).stress(0.1).uncertainty(0.3).build();
            MetaPerceptionDecision d = decide(state);

            assertTrue(d.shouldAct());
            assertEquals(RiskMode.NORMAL, d.recommendedRiskMode());
            assertNull(d.leverageAdjustment());
            assertFalse(d.alertOperator());
            assertEquals(AlertPriority.LOW, d.alertPriority());
            assertEquals(0.7, d.confidence(), 1e-12);
            assertEquals(DecisionMaker.STATUS_LINE, d.rationale());
            assertTrue(d.keyFactors().contains("dominant_pressure=LONG(0.50)"));
        }

        @Test
        @DisplayName("uncertainty above 0.7 but under the guard → leverage 0.7")
        void highUncertaintyLeverage() {
            PerceptionState state = PerceptionFixtures.state().uncertainty(0.72).build();
            assertEquals(0.7, decide(state).leverageAdjustment());
        }

        @Test
        @DisplayName("moderate noise or stress → CAUTIOUS")
        void cautious() {
            assertEquals(RiskMode.CAUTIOUS, decide(PerceptionFixtures.state().noise(0.65).build()).recommendedRiskMode());
            assertEquals(RiskMode.CAUTIOUS, decide(PerceptionFixtures.state().stress(0.9).build()).recommendedRiskMode());
        }

        @Test
        @DisplayName("CRITICAL regime alert while still acting → alert at HIGH, DEFENSIVE")
        void criticalRegimeWhileActing() {
            PerceptionConfig lenient = CONFIG.toBuilder().regimeStressThreshold(3.0).build();
            PerceptionState state = PerceptionFixtures.state().stress(2.2).build();

            MetaPerceptionDecision d = DecisionMaker.decide(state, List.of(), alert(2.2, 3.0), SNAPSHOT_ID, lenient);

            assertTrue(d.shouldAct());
            assertTrue(d.alertOperator());
            assertEquals(AlertPriority.HIGH, d.alertPriority());
            assertEquals(RiskMode.DEFENSIVE, d.recommendedRiskMode());
            assertTrue(d.keyFactors().contains("regime_alert=CRITICAL"));
        }

        @Test
        @DisplayName("aggregate shock intensity at the configured threshold is reported")
        void elevatedShockIntensity() {
            PerceptionState state = PerceptionFixtures.state().shockIntensity(3.2).build();
            assertTrue(decide(state).keyFactors().contains("elevated_shock_intensity=3.200"));
        }
    }

    @Nested
    @DisplayName("blocking")
    class Blocking {

        @Test
        @DisplayName("noise guard → CRITICAL alert, leverage 0.5, rationale names the noise")
        void noise() {
            PerceptionState state = PerceptionFixtures.state().noise(0.8).shouldAct(false).build();
            MetaPerceptionDecision d = decide(state);

            assertFalse(d.shouldAct());
            assertTrue(d.alertOperator());
            assertEquals(AlertPriority.CRITICAL, d.alertPriority());
            assertEquals(0.5, d.leverageAdjustment());
            assertEquals(RiskMode.CAUTIOUS, d.recommendedRiskMode());
            assertTrue(d.rationale().startsWith("BLOCKED: Noise level 0.800 at or above threshold 0.700"));
            assertEquals(List.of("noise_level=0.800"), d.keyFactors());
        }

        @Test
        @DisplayName("every failing guard is listed, in order noise, uncertainty, shocks, pivot")
        void ordering() {
            ShockEvent critical = PerceptionFixtures.shock("price:crit", 6.0, false);
            PerceptionState state = PerceptionFixtures.state()
                .noise(0.8).uncertainty(0.9).stress(1.6)
                .activeShocks(Set.of("price:crit")).criticalShocks(1).shockIntensity(6.0)
                .shouldAct(false).build();

            MetaPerceptionDecision d = DecisionMaker.decide(state, List.of(critical), alert(1.6, 1.0),
                SNAPSHOT_ID, CONFIG);

            String r = d.rationale();
            int noise = r.indexOf("Noise level");
            int uncertainty = r.indexOf("Total uncertainty");
            int shocks = r.indexOf("critical shock");
            int pivot = r.indexOf("Regime pivot");
            assertTrue(noise >= 0 && noise < uncertainty && uncertainty < shocks && shocks < pivot, r);
            assertTrue(r.contains("price:crit"));
            assertTrue(r.contains("expected regime CRISIS"));
            assertEquals(4, d.keyFactors().size());
            assertEquals(RiskMode.DEFENSIVE, d.recommendedRiskMode());
            assertEquals(0.1, d.confidence(), 1e-12);
        }

        @Test
        @DisplayName("critical shock alone → DEFENSIVE")
        void criticalShock() {
            PerceptionState state = PerceptionFixtures.state().criticalShocks(1).shouldAct(false).build();
            MetaPerceptionDecision d = decide(state);
            assertEquals(RiskMode.DEFENSIVE, d.recommendedRiskMode());
            assertFalse(d.keyFactors().isEmpty());
        }
    }

    @Test
    @DisplayName("ids are deterministic and the decision never recomputes shouldAct")
    void idsAndFlag() {
        PerceptionState state = PerceptionFixtures.state().shouldAct(true).build();
        MetaPerceptionDecision first = decide(state);
        MetaPerceptionDecision second = decide(state);

        assertEquals(first, second);
        assertEquals(ArtifactIds.decisionId(SNAPSHOT_ID, PerceptionFixtures.T0), first.decisionId());
        assertTrue(first.decisionId().startsWith(ArtifactIds.DECISION_PREFIX));
        assertEquals(SNAPSHOT_ID, first.snapshotId());
        assertEquals(state.shouldAct(), first.shouldAct());
    }
}
