package com.metaperception.core.shock;

import com.metaperception.core.config.PerceptionConfig;
import com.metaperception.core.util.StatMath;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags per-feature z-score outliers as discrete shock events.
 *
 * <p>Every series with at least {@code minShockPoints} observations is standardized with
 * its own mean and population standard deviation; points with |z| above
 * {@code shockZThreshold} become {@link ShockEvent}s. There is no de-duplication across
 * features: two series spiking together yield two events.
 *
 * <p>A shock stays active until it is {@code shockDecayPoints} observations old. Its id is
 * a fingerprint of the spike value and the {@code shockDecayPoints} observations before it,
 * not of its position, so a spike keeps its identity while it slides through consecutive
 * rolling windows. Equal-valued spikes with different lead-ins get different ids; a
 * fingerprint repeated within one series gets an ordinal suffix on every later occurrence.
 *
 * <p>Results are ordered by descending intensity, then by id.
 */
public final class ShockDetector {

    /** Intensity normalization: a 3σ move has intensity 1.0. */
    public static final double SIGMA_NORMALIZER = 3.0;

    private static final Comparator<ShockEvent> BY_INTENSITY_DESC =
        Comparator.comparingDouble(ShockEvent::intensity).reversed()
            .thenComparing(ShockEvent::shockId);

    private ShockDetector() {}

    public static List<ShockEvent> detectShocks(Map<String, List<Double>> marketData, PerceptionConfig config) {
        List<ShockEvent> events = new ArrayList<>();
        if (marketData == null) return events;

        for (Map.Entry<String, List<Double>> entry : marketData.entrySet()) {
            List<Double> series = entry.getValue();
            if (series == null || series.size() < config.minShockPoints()) {
                continue;
            }
            events.addAll(detectInSeries(entry.getKey(), series, config));
        }

        events.sort(BY_INTENSITY_DESC);
        return List.copyOf(events);
    }

    static List<ShockEvent> detectInSeries(String feature, List<Double> series, PerceptionConfig config) {
        double mean = StatMath.mean(series);
        double std = StatMath.stdDev(series);
        if (StatMath.isZero(std)) return List.of();

        List<ShockEvent> events = new ArrayList<>();
        Map<String, Integer> seen = new HashMap<>();
        int last = series.size() - 1;
        for (int i = 0; i < series.size(); i++) {
            double value = series.get(i);
            double z = (value - mean) / std;
            if (Math.abs(z) <= config.shockZThreshold()) {
                continue;
            }
            double intensity = Math.abs(z) / SIGMA_NORMALIZER;
            String baseId = shockId(feature, series, i, config.shockDecayPoints());
            int occurrence = seen.merge(baseId, 1, Integer::sum);
            events.add(new ShockEvent(
                occurrence == 1 ? baseId : baseId + "#" + occurrence,
                feature,
                i,
                value,
                z,
                intensity,
                ShockSeverity.fromIntensity(intensity),
                ShockType.fromFeature(feature),
                direction(value, mean),
                last - i >= config.shockDecayPoints()));
        }
        return events;
    }

    /**
     * Fingerprint of {@code series[index]} together with up to {@code contextPoints}
     * observations preceding it.
     */
    public static String shockId(String feature, List<Double> series, int index, int contextPoints) {
        long hash = Double.doubleToLongBits(series.get(index));
        for (int j = Math.max(0, index - contextPoints); j < index; j++) {
            hash = 31 * hash + Double.doubleToLongBits(series.get(j));
        }
        return feature + ":" + String.format("%016x", hash);
    }

    private static PriceDirection direction(double value, double mean) {
        if (value > mean) return PriceDirection.UP;
        if (value < mean) return PriceDirection.DOWN;
        return PriceDirection.FLAT;
    }
}
