package com.metaperception.core.util;

import java.util.List;

/**
 * Numeric helpers shared by the perception components.
 *
 * <p>Every method degrades to a neutral value (0.0) instead of producing NaN or
 * throwing on empty, short or zero-variance input.
 */
public final class StatMath {

    private static final double EPSILON = 1e-12;

    private StatMath() {}

    public static double mean(List<Double> values) {
        if (values == null || values.isEmpty()) return 0.0;
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /** Population variance. */
    public static double variance(List<Double> values) {
        if (values == null || values.size() < 2) return 0.0;
        double mean = mean(values);
        double sum = 0.0;
        for (double v : values) {
            sum += (v - mean) * (v - mean);
        }
        return sum / values.size();
    }

    public static double stdDev(List<Double> values) {
        return Math.sqrt(variance(values));
    }

    /**
     * Pearson correlation of two equally long samples.
     * Returns 0.0 when either side has zero variance or the lengths differ.
     */
    public static double pearson(List<Double> xs, List<Double> ys) {
        if (xs == null || ys == null || xs.size() != ys.size() || xs.size() < 2) return 0.0;

        double meanX = mean(xs);
        double meanY = mean(ys);
        double cov = 0.0, varX = 0.0, varY = 0.0;
        for (int i = 0; i < xs.size(); i++) {
            double dx = xs.get(i) - meanX;
            double dy = ys.get(i) - meanY;
            cov  += dx * dy;
            varX += dx * dx;
            varY += dy * dy;
        }
        if (varX < EPSILON || varY < EPSILON) return 0.0;
        return clamp(cov / Math.sqrt(varX * varY), -1.0, 1.0);
    }

    /**
     * Log-returns of a series; falls back to first differences when any value is
     * non-positive (funding rates, flows and other signed features).
     */
    public static List<Double> returns(List<Double> series) {
        if (series == null || series.size() < 2) return List.of();

        boolean strictlyPositive = series.stream().allMatch(v -> v > 0.0);
        Double[] out = new Double[series.size() - 1];
        for (int i = 1; i < series.size(); i++) {
            double prev = series.get(i - 1);
            double curr = series.get(i);
            out[i - 1] = strictlyPositive ? Math.log(curr / prev) : curr - prev;
        }
        return List.of(out);
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double clamp01(double value) {
        return clamp(value, 0.0, 1.0);
    }

    public static double sigmoid(double x) {
        return 1.0 / (1.0 + Math.exp(-x));
    }

    public static boolean isZero(double value) {
        return Math.abs(value) < EPSILON;
    }
}
