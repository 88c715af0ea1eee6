package com.metaperception.orchestrator.publisher;

import com.metaperception.core.config.PerceptionConfig;
import com.metaperception.core.model.MetaPerceptionOutput;
import com.metaperception.core.override.OverrideDetector;
import com.metaperception.core.override.OverrideRecord;
import com.metaperception.core.pipeline.MetaPerceptionOrchestrator;
import com.metaperception.orchestrator.PerceptionInputs;
import com.metaperception.orchestrator.config.OrchestratorConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryPerceptionArtifactStoreTest {

    private static final PerceptionConfig CONFIG = PerceptionConfig.defaults();

    private InMemoryPerceptionArtifactStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryPerceptionArtifactStore(new OrchestratorConfig().objectMapper());
    }

    @Test
    @DisplayName("acting cycle → snapshot and decision stored under the venue's perception:// locations")
    void actingCycle() {
        MetaPerceptionOutput output = MetaPerceptionOrchestrator
            .step(null, PerceptionInputs.calm(PerceptionInputs.T0), CONFIG).output();

        Map<String, String> locations = store.publish("binance", output, null);

        String snapshotId = output.snapshot().snapshotId();
        String decisionId = output.decision().decisionId();
        assertEquals(2, locations.size());
        assertEquals("perception://binance/snapshots/" + snapshotId, locations.get(snapshotId));
        assertEquals("perception://binance/decisions/" + decisionId, locations.get(decisionId));
        assertTrue(store.find("binance", snapshotId).orElseThrow().contains("\"snapshotId\":\"" + snapshotId + "\""));
        assertTrue(store.find("binance", decisionId).orElseThrow().contains("\"shouldAct\":true"));
    }

    @Test
    @DisplayName("blocked cycle → override record stored as well")
    void blockedCycle() {
        MetaPerceptionOutput output = MetaPerceptionOrchestrator
            .step(null, PerceptionInputs.crash(PerceptionInputs.T0), CONFIG).output();
        OverrideRecord override = OverrideDetector.detect(output.decision(), output.snapshot().state(),
            Map.of("portfolio_value", 1_000_000.0), CONFIG).orElseThrow();

        Map<String, String> locations = store.publish("binance", output, override);

        assertEquals(3, locations.size());
        assertEquals("perception://binance/overrides/" + override.overrideId(), locations.get(override.overrideId()));
        assertTrue(store.find("binance", override.overrideId()).orElseThrow().contains("\"trigger\":\"REGIME_PIVOT\""));
    }

    @Test
    @DisplayName("re-publishing identical content is a no-op")
    void appendOnly() {
        MetaPerceptionOutput output = MetaPerceptionOrchestrator
            .step(null, PerceptionInputs.calm(PerceptionInputs.T0), CONFIG).output();

        store.publish("binance", output, null);
        String before = store.find("binance", output.snapshot().snapshotId()).orElseThrow();
        Map<String, String> again = store.publish("binance", output, null);

        assertEquals(2, store.size());
        assertEquals(before, store.find("binance", output.snapshot().snapshotId()).orElseThrow());
        assertEquals(2, again.size());
    }

    @Test
    @DisplayName("two venues at one timestamp share ids but not storage")
    void venuesIsolated() {
        MetaPerceptionOutput crash = MetaPerceptionOrchestrator
            .step(null, PerceptionInputs.crash(PerceptionInputs.T0), CONFIG).output();
        MetaPerceptionOutput calm = MetaPerceptionOrchestrator
            .step(null, PerceptionInputs.calm(PerceptionInputs.T0), CONFIG).output();
        String decisionId = calm.decision().decisionId();
        assertEquals(crash.decision().decisionId(), decisionId);

        store.publish("binance", crash, null);
        Map<String, String> okx = store.publish("okx", calm, null);

        assertEquals("perception://okx/decisions/" + decisionId, okx.get(decisionId));
        assertTrue(store.find("okx", decisionId).orElseThrow().contains("\"shouldAct\":true"));
        assertTrue(store.find("binance", decisionId).orElseThrow().contains("\"shouldAct\":false"));
    }

    @Test
    @DisplayName("different content under a stored id → rejected, first write kept")
    void conflictingRewrite() {
        MetaPerceptionOutput crash = MetaPerceptionOrchestrator
            .step(null, PerceptionInputs.crash(PerceptionInputs.T0), CONFIG).output();
        MetaPerceptionOutput calm = MetaPerceptionOrchestrator
            .step(null, PerceptionInputs.calm(PerceptionInputs.T0), CONFIG).output();

        store.publish("binance", crash, null);

        assertThrows(IllegalStateException.class, () -> store.publish("binance", calm, null));
        assertTrue(store.find("binance", crash.decision().decisionId()).orElseThrow().contains("\"shouldAct\":false"));
    }

    @Test
    @DisplayName("unknown id or venue → empty")
    void unknown() {
        MetaPerceptionOutput output = MetaPerceptionOrchestrator
            .step(null, PerceptionInputs.calm(PerceptionInputs.T0), CONFIG).output();
        store.publish("binance", output, null);

        assertTrue(store.find("binance", "PS-missing").isEmpty());
        assertTrue(store.find("okx", output.snapshot().snapshotId()).isEmpty());
    }
}
