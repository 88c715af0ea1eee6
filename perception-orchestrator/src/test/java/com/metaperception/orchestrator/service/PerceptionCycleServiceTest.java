package com.metaperception.orchestrator.service;

import com.metaperception.core.config.PerceptionConfig;
import com.metaperception.core.decision.PerceptionArtifactPublisher;
import com.metaperception.core.exception.InvalidPerceptionInputException;
import com.metaperception.core.model.MetaPerceptionOutput;
import com.metaperception.core.model.PerceptionState;
import com.metaperception.orchestrator.PerceptionInputs;
import com.metaperception.orchestrator.config.OrchestratorConfig;
import com.metaperception.orchestrator.logger.PerceptionFlowLogger;
import com.metaperception.orchestrator.publisher.InMemoryPerceptionArtifactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static com.metaperception.orchestrator.PerceptionInputs.T0;
import static org.junit.jupiter.api.Assertions.*;

class PerceptionCycleServiceTest {

    private InMemoryPerceptionArtifactStore store;
    private PerceptionCycleService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryPerceptionArtifactStore(new OrchestratorConfig().objectMapper());
        service = new PerceptionCycleService(PerceptionConfig.defaults(), store, new PerceptionFlowLogger());
    }

    // ── state threading ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("state threading")
    class StateThreading {

        @Test
        @DisplayName("first cycle has no delta, second cycle carries one")
        void delta() {
            StepVerifier.create(service.step("binance", PerceptionInputs.calm(T0)))
                .assertNext(out -> assertNull(out.delta()))
                .verifyComplete();

            StepVerifier.create(service.step("binance", PerceptionInputs.crash(T0.plusSeconds(60))))
                .assertNext(out -> {
                    assertNotNull(out.delta());
                    assertFalse(out.decision().shouldAct());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("venues keep independent state")
        void venues() {
            service.step("binance", PerceptionInputs.crash(T0)).block();
            service.step("okx", PerceptionInputs.calm(T0.plusSeconds(1))).block();

            StepVerifier.create(service.currentState("binance"))
                .assertNext(state -> assertEquals("CRISIS", state.currentRegime()))
                .verifyComplete();
            StepVerifier.create(service.currentState("okx"))
                .assertNext(state -> assertTrue(state.shouldAct()))
                .verifyComplete();
        }

        @Test
        @DisplayName("current state is empty before the first cycle")
        void emptyBeforeFirstCycle() {
            StepVerifier.create(service.currentState("kraken")).verifyComplete();
        }

        @Test
        @DisplayName("reset drops the state; the next cycle starts without a delta")
        void reset() {
            service.step("binance", PerceptionInputs.calm(T0)).block();

            StepVerifier.create(service.reset("binance")).expectNext(true).verifyComplete();
            StepVerifier.create(service.reset("binance")).expectNext(false).verifyComplete();
            StepVerifier.create(service.step("binance", PerceptionInputs.calm(T0.plusSeconds(60))))
                .assertNext(out -> assertNull(out.delta()))
                .verifyComplete();
        }
    }

    // ── failures ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("invalid input errors and leaves the previous state untouched")
        void invalidInput() {
            service.step("binance", PerceptionInputs.calm(T0)).block();
            PerceptionState before = service.currentState("binance").block();

            StepVerifier.create(service.step("binance", PerceptionInputs.withoutTimestamp()))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(InvalidPerceptionInputException.class, e);
                    assertEquals("timestamp", ((InvalidPerceptionInputException) e).getField());
                })
                .verify();

            assertEquals(before, service.currentState("binance").block());
        }

        @Test
        @DisplayName("null input errors instead of throwing at assembly")
        void nullInput() {
            StepVerifier.create(service.step("binance", null))
                .expectError(InvalidPerceptionInputException.class)
                .verify();
        }

        @Test
        @DisplayName("publisher failure is non-critical: output returned without artifacts")
        void publisherFailure() {
            PerceptionArtifactPublisher failing = (venue, output, override) -> {
                throw new IllegalStateException("store offline");
            };
            PerceptionCycleService degraded =
                new PerceptionCycleService(PerceptionConfig.defaults(), failing, new PerceptionFlowLogger());

            StepVerifier.create(degraded.step("binance", PerceptionInputs.calm(T0)))
                .assertNext(out -> {
                    assertTrue(out.artifacts().isEmpty());
                    assertTrue(out.decision().shouldAct());
                })
                .verifyComplete();
            assertNotNull(degraded.currentState("binance").block());
        }
    }

    // ── artifacts ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("artifacts")
    class Artifacts {

        @Test
        @DisplayName("acting cycle publishes snapshot and decision")
        void acting() {
            MetaPerceptionOutput out = service.step("binance", PerceptionInputs.calm(T0)).block();

            assertNotNull(out);
            assertEquals(2, out.artifacts().size());
            assertTrue(store.find("binance", out.snapshot().snapshotId()).isPresent());
            assertTrue(store.find("binance", out.decision().decisionId()).isPresent());
        }

        @Test
        @DisplayName("blocked cycle publishes an override record too")
        void blocked() {
            MetaPerceptionOutput out = service.step("binance", PerceptionInputs.crash(T0)).block();

            assertNotNull(out);
            assertEquals(3, out.artifacts().size());
            assertTrue(out.artifacts().keySet().stream().anyMatch(id -> id.startsWith("OVR-")));
            assertTrue(out.artifacts().values().stream().anyMatch(loc -> loc.startsWith("perception://binance/overrides/")));
        }

        @Test
        @DisplayName("two venues at one timestamp → each location holds that venue's own decision")
        void venuesAtSameTimestamp() {
            MetaPerceptionOutput binance = service.step("binance", PerceptionInputs.crash(T0)).block();
            MetaPerceptionOutput okx = service.step("okx", PerceptionInputs.calm(T0)).block();

            assertNotNull(binance);
            assertNotNull(okx);
            String decisionId = okx.decision().decisionId();
            assertEquals(binance.decision().decisionId(), decisionId);
            assertEquals("perception://okx/decisions/" + decisionId, okx.artifacts().get(decisionId));
            assertTrue(store.find("okx", decisionId).orElseThrow().contains("\"shouldAct\":true"));
            assertTrue(store.find("binance", decisionId).orElseThrow().contains("\"shouldAct\":false"));
        }

        @Test
        @DisplayName("replay after reset with different content → no artifacts, first cycle kept")
        void replayAfterReset() {
            service.step("binance", PerceptionInputs.crash(T0)).block();
            service.reset("binance").block();

            StepVerifier.create(service.step("binance", PerceptionInputs.calm(T0)))
                .assertNext(out -> {
                    assertTrue(out.decision().shouldAct());
                    assertTrue(out.artifacts().isEmpty());
                    assertTrue(store.find("binance", out.decision().decisionId()).orElseThrow()
                        .contains("\"shouldAct\":false"));
                })
                .verifyComplete();
        }
    }

    @Test
    @DisplayName("cycle id combines venue and timestamp")
    void cycleId() {
        assertEquals("binance@2026-03-02T14:30:00Z", PerceptionCycleService.cycleId("binance", PerceptionInputs.calm(T0)));
        assertEquals("binance@unknown", PerceptionCycleService.cycleId("binance", null));
    }
}
