package com.metaperception.core.entropy;

import com.metaperception.core.config.PerceptionConfig;
import com.metaperception.core.util.StatMath;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shannon entropy of discretized return distributions.
 *
 * <h3>Per series</h3>
 * <ol>
 *   <li>log-returns (first differences for series with non-positive values)</li>
 *   <li>equal-width histogram of {@code entropyBins} bins over [min, max]</li>
 *   <li>additive smoothing: p = (count + ε) / (n + ε·bins)</li>
 *   <li>H = −Σ p·log2(p)</li>
 * </ol>
 * A series whose returns are all identical carries no information and scores 0 bits.
 * Series shorter than {@code minEntropyPoints} are skipped.
 *
 * <p>Pure static utility. No logging, no state.
 */
public final class EntropyEngine {

    /** Additive smoothing mass per bin. */
    static final double SMOOTHING = 1e-10;

    /** Returns per feature at which the histogram is considered fully populated. */
    private static final double FULL_CONFIDENCE_SAMPLES = 30.0;

    private EntropyEngine() {}

    public static EntropyMetrics computeMarketEntropy(Map<String, List<Double>> marketData,
                                                      PerceptionConfig config) {
        int bins = config.entropyBins();
        if (marketData == null || marketData.isEmpty()) {
            return EntropyMetrics.empty(bins);
        }

        Map<String, Double> perFeature = new LinkedHashMap<>();
        int observations = 0;
        for (Map.Entry<String, List<Double>> entry : marketData.entrySet()) {
            List<Double> series = entry.getValue();
            if (series == null || series.size() < config.minEntropyPoints()) {
                continue;
            }
            List<Double> returns = StatMath.returns(series);
            perFeature.put(entry.getKey(), shannonEntropy(returns, bins));
            observations += returns.size();
        }

        if (perFeature.isEmpty()) {
            return EntropyMetrics.empty(bins);
        }

        double market = perFeature.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double confidence = StatMath.clamp01((double) observations / perFeature.size() / FULL_CONFIDENCE_SAMPLES);

        return new EntropyMetrics(market, perFeature, EntropyInterpretation.classify(market),
            confidence, bins, observations);
    }

    /**
     * Entropy in bits of {@code values} discretized into {@code bins} equal-width bins.
     * Returns 0.0 for empty input or a zero-width range.
     */
    public static double shannonEntropy(List<Double> values, int bins) {
        if (values == null || values.isEmpty()) return 0.0;

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double range = max - min;
        if (StatMath.isZero(range)) return 0.0;

        int[] counts = new int[bins];
        for (double v : values) {
            int idx = (int) ((v - min) / range * bins);
            counts[Math.min(idx, bins - 1)]++;
        }

        double total = values.size() + SMOOTHING * bins;
        double entropy = 0.0;
        for (int count : counts) {
            double p = (count + SMOOTHING) / total;
            entropy -= p * log2(p);
        }
        return Math.max(0.0, entropy);
    }

    private static double log2(double x) {
        return Math.log(x) / Math.log(2.0);
    }
}
