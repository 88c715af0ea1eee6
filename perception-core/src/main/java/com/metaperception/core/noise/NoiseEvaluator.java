package com.metaperception.core.noise;

import com.metaperception.core.config.PerceptionConfig;
import com.metaperception.core.util.StatMath;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Separates trend from noise and scores signal quality.
 *
 * <p>For each series the trend is a trailing moving average over {@code noiseWindow}
 * points; the residual is value minus trend. The noise-to-signal ratio
 * var(residual) / var(trend) is squashed into [0, 1) with {@code ratio / (1 + ratio)}.
 * A flat trend with a non-flat residual is pure noise (1.0); a flat trend with a flat
 * residual is a constant series (0.0).
 *
 * <p>Series shorter than the window are skipped. With nothing to evaluate the level is
 * 0.0 with confidence 0.0.
 */
public final class NoiseEvaluator {

    private NoiseEvaluator() {}

    public static NoiseScore evaluateNoise(Map<String, List<Double>> marketData, PerceptionConfig config) {
        int window = config.noiseWindow();
        Map<String, Double> perFeature = new LinkedHashMap<>();

        if (marketData != null) {
            for (Map.Entry<String, List<Double>> entry : marketData.entrySet()) {
                List<Double> series = entry.getValue();
                if (series == null || series.size() < window) {
                    continue;
                }
                perFeature.put(entry.getKey(), seriesNoise(series, window));
            }
        }

        double noise = perFeature.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double confidence = perFeature.isEmpty() ? 0.0 : 1.0;

        return new NoiseScore(
            noise,
            1.0 - noise,
            perFeature,
            NoiseClassification.classify(noise),
            noise < config.noiseThreshold(),
            config.noiseThreshold(),
            window,
            confidence);
    }

    /** Normalized noise of one series; the series must hold at least {@code window} points. */
    public static double seriesNoise(List<Double> series, int window) {
        List<Double> trend = new ArrayList<>();
        List<Double> residual = new ArrayList<>();

        double rolling = 0.0;
        for (int i = 0; i < series.size(); i++) {
            rolling += series.get(i);
            if (i >= window) {
                rolling -= series.get(i - window);
            }
            if (i >= window - 1) {
                double ma = rolling / window;
                trend.add(ma);
                residual.add(series.get(i) - ma);
            }
        }

        double trendVar = StatMath.variance(trend);
        double residualVar = StatMath.variance(residual);

        if (StatMath.isZero(trendVar)) {
            return StatMath.isZero(residualVar) ? 0.0 : 1.0;
        }
        double ratio = residualVar / trendVar;
        return StatMath.clamp01(ratio / (1.0 + ratio));
    }
}
