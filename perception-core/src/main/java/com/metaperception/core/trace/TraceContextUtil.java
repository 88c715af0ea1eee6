package com.metaperception.core.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.time.Instant;

/**
 * Carries the venue and cycle id of a perception cycle through reactive pipelines.
 *
 * <p>A cycle id is {@code venue@timestamp}: one venue never steps the same timestamp twice
 * within a state lineage, while different venues may. Reactor Context holds both values;
 * MDC is written only around a single log statement.
 *
 * <pre>
 *     return TraceContextUtil.withCycle(pipeline, venue, TraceContextUtil.cycleId(venue, ts));
 *     ...
 *     signal -> TraceContextUtil.getCycleId(signal.getContextView())
 * </pre>
 */
public final class TraceContextUtil {

    public static final String CYCLE_ID_KEY = "cycleId";
    public static final String VENUE_KEY = "venue";
    public static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    public static String cycleId(String venue, Instant timestamp) {
        return (venue == null ? UNKNOWN : venue) + "@" + (timestamp == null ? UNKNOWN : timestamp.toString());
    }

    /**
     * Stores venue and cycle id in the Reactor Context. {@code contextWrite} propagates
     * upstream during subscription, so call this at the end of pipeline assembly.
     */
    public static <T> Mono<T> withCycle(Mono<T> mono, String venue, String cycleId) {
        return mono.contextWrite(ctx -> ctx
            .put(VENUE_KEY, venue == null ? UNKNOWN : venue)
            .put(CYCLE_ID_KEY, cycleId == null ? UNKNOWN : cycleId));
    }

    /** Never null; {@value #UNKNOWN} when absent. */
    public static String getCycleId(ContextView ctx) {
        return ctx.getOrDefault(CYCLE_ID_KEY, UNKNOWN);
    }

    /** Never null; {@value #UNKNOWN} when absent. */
    public static String getVenue(ContextView ctx) {
        return ctx.getOrDefault(VENUE_KEY, UNKNOWN);
    }

    /** Bridges venue and cycle id from {@code ctx} into MDC around {@code logAction}. */
    public static void withMdc(ContextView ctx, Runnable logAction) {
        withMdc(getVenue(ctx), getCycleId(ctx), logAction);
    }

    /**
     * Puts venue and cycle id into MDC for the duration of {@code logAction}, then removes
     * both. Only for logging side effects.
     */
    public static void withMdc(String venue, String cycleId, Runnable logAction) {
        MDC.put(VENUE_KEY, venue);
        MDC.put(CYCLE_ID_KEY, cycleId);
        try {
            logAction.run();
        } finally {
            MDC.remove(CYCLE_ID_KEY);
            MDC.remove(VENUE_KEY);
        }
    }
}
