package com.metaperception.orchestrator.logger;

import com.metaperception.core.model.MetaPerceptionDecision;
import com.metaperception.core.model.MetaPerceptionOutput;
import com.metaperception.core.model.PerceptionState;
import com.metaperception.core.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.Locale;
import java.util.function.Consumer;

/**
 * Logs each stage of a perception cycle inside the reactive service pipeline.
 * Pure side effects; never changes pipeline behavior.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #CYCLE_RECEIVED}      step requested for a venue</li>
 *   <li>{@link #INPUT_VALIDATED}     input passed validation</li>
 *   <li>{@link #PERCEPTION_COMPUTED} core pipeline returned state and decision</li>
 *   <li>{@link #OVERRIDE_DETECTED}   a blocked cycle was classified</li>
 *   <li>{@link #ARTIFACTS_PUBLISHED} snapshot, decision and override stored</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(PerceptionFlowLogger.PERCEPTION_COMPUTED))
 * </pre>
 */
@Component
public class PerceptionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(PerceptionFlowLogger.class);

    public static final String CYCLE_RECEIVED      = "CYCLE_RECEIVED";
    public static final String INPUT_VALIDATED     = "INPUT_VALIDATED";
    public static final String PERCEPTION_COMPUTED = "PERCEPTION_COMPUTED";
    public static final String OVERRIDE_DETECTED   = "OVERRIDE_DETECTED";
    public static final String ARTIFACTS_PUBLISHED = "ARTIFACTS_PUBLISHED";

    /**
     * {@code doOnEach} consumer that logs the stage on {@code onNext} only. Venue and cycle id
     * are read from the Reactor Context and bridged into MDC for the log call.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String cycleId = TraceContextUtil.getCycleId(signal.getContextView());
            TraceContextUtil.withMdc(signal.getContextView(), () ->
                log.info("[PerceptionFlow] stage={} cycleId={}", stageName, cycleId)
            );
        };
    }

    public void logStage(String stageName, String venue, String cycleId) {
        TraceContextUtil.withMdc(venue, cycleId, () ->
            log.info("[PerceptionFlow] stage={} cycleId={}", stageName, cycleId)
        );
    }

    /** One-line summary of a finished cycle. */
    public void logCycleSummary(String venue, MetaPerceptionOutput output, String cycleId) {
        PerceptionState state = output.snapshot().state();
        MetaPerceptionDecision decision = output.decision();
        TraceContextUtil.withMdc(venue, cycleId, () ->
            log.info("[PerceptionFlow] venue={} shouldAct={} riskMode={} noise={} uncertainty={} "
                     + "regime={} stress={} activeShocks={} pressure={} totalMs={} cycleId={}",
                     venue, decision.shouldAct(), decision.recommendedRiskMode(),
                     fmt("%.3f", state.noiseScore()),
                     fmt("%.3f", state.totalUncertainty()),
                     state.currentRegime(),
                     fmt("%.3f", state.regimeStress()),
                     state.activeShocks().size(), state.dominantPressure(),
                     fmt("%.1f", output.computationTimeMs()),
                     cycleId)
        );
    }

    static String fmt(String pattern, double value) {
        return String.format(Locale.ROOT, pattern, value);
    }
}
