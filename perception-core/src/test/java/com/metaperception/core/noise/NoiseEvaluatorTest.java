package com.metaperception.core.noise;

import com.metaperception.core.PerceptionFixtures;
import com.metaperception.core.config.PerceptionConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NoiseEvaluatorTest {

    private static final PerceptionConfig CONFIG = PerceptionConfig.defaults();

    @Nested
    @DisplayName("seriesNoise()")
    class SeriesNoise {

        @Test
        @DisplayName("constant series → 0")
        void constant() {
            assertEquals(0.0, NoiseEvaluator.seriesNoise(Collections.nCopies(20, 42.0), 5));
        }

        @Test
        @DisplayName("linear trend → residual is constant → ~0")
        void linearTrend() {
            assertEquals(0.0, NoiseEvaluator.seriesNoise(PerceptionFixtures.linear(40, 100.0, 0.5), 5), 1e-9);
        }

        @Test
        @DisplayName("alternating series → residual dominates trend (16/17)")
        void alternating() {
            double noise = NoiseEvaluator.seriesNoise(PerceptionFixtures.alternating(40, 100.0, 110.0), 5);
            assertEquals(16.0 / 17.0, noise, 1e-9);
        }
    }

    @Nested
    @DisplayName("evaluateNoise()")
    class Evaluate {

        @Test
        @DisplayName("noisy series → EXTREME_NOISE, not acceptable")
        void noisy() {
            NoiseScore score = NoiseEvaluator.evaluateNoise(
                Map.of("price", PerceptionFixtures.alternating(40, 100.0, 110.0)), CONFIG);

            assertEquals(NoiseClassification.EXTREME_NOISE, score.classification());
            assertFalse(score.acceptable());
            assertEquals(1.0 - score.noiseLevel(), score.signalQuality(), 1e-12);
            assertEquals(1.0, score.confidence());
        }

        @Test
        @DisplayName("clean trend → CLEAN and acceptable")
        void clean() {
            NoiseScore score = NoiseEvaluator.evaluateNoise(
                Map.of("price", PerceptionFixtures.linear(40, 100.0, 0.5)), CONFIG);

            assertEquals(NoiseClassification.CLEAN, score.classification());
            assertTrue(score.acceptable());
        }

        @Test
        @DisplayName("overall level is the mean over features")
        void meanOverFeatures() {
            NoiseScore score = NoiseEvaluator.evaluateNoise(Map.of(
                "a", PerceptionFixtures.alternating(40, 100.0, 110.0),
                "b", Collections.nCopies(40, 1.0)), CONFIG);

            assertEquals(16.0 / 17.0 / 2.0, score.noiseLevel(), 1e-9);
            assertEquals(2, score.featureNoise().size());
        }

        @Test
        @DisplayName("series shorter than the window → nothing evaluated, confidence 0")
        void tooShort() {
            NoiseScore score = NoiseEvaluator.evaluateNoise(Map.of("price", List.of(1.0, 2.0, 3.0)), CONFIG);
            assertEquals(0.0, score.noiseLevel());
            assertEquals(0.0, score.confidence());
            assertTrue(score.featureNoise().isEmpty());
        }
    }
}
