package com.metaperception.core.profiling;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Stopwatch for the stages of one perception cycle.
 *
 * <p>Single-use and not thread-safe: one profiler per cycle. Measurements only feed the
 * reported profile; nothing branches on them.
 *
 * <pre>
 *   CycleProfiler profiler = CycleProfiler.start();
 *   ... entropy ...
 *   profiler.mark("entropy");
 *   ComputationProfile profile = profiler.finish(config.maxComputationTimeMs());
 * </pre>
 */
public final class CycleProfiler {

    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private final LongSupplier nanoClock;
    private final long startNanos;
    private final Map<String, Double> stages = new LinkedHashMap<>();
    private long lastMarkNanos;

    CycleProfiler(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
        this.startNanos = nanoClock.getAsLong();
        this.lastMarkNanos = startNanos;
    }

    public static CycleProfiler start() {
        return new CycleProfiler(System::nanoTime);
    }

    /** Records the time elapsed since the previous mark under {@code stage}. */
    public void mark(String stage) {
        long now = nanoClock.getAsLong();
        stages.merge(stage, (now - lastMarkNanos) / NANOS_PER_MILLI, Double::sum);
        lastMarkNanos = now;
    }

    public double elapsedMillis() {
        return (nanoClock.getAsLong() - startNanos) / NANOS_PER_MILLI;
    }

    public ComputationProfile finish(long budgetMillis) {
        double total = elapsedMillis();
        return new ComputationProfile(stages, total, budgetMillis, total > budgetMillis);
    }
}
