package com.metaperception.orchestrator.service;

import com.metaperception.core.config.PerceptionConfig;
import com.metaperception.core.decision.PerceptionArtifactPublisher;
import com.metaperception.core.model.MetaPerceptionInput;
import com.metaperception.core.model.MetaPerceptionOutput;
import com.metaperception.core.model.PerceptionState;
import com.metaperception.core.override.OverrideDetector;
import com.metaperception.core.override.OverrideRecord;
import com.metaperception.core.pipeline.MetaPerceptionOrchestrator;
import com.metaperception.core.pipeline.PerceptionStepResult;
import com.metaperception.core.profiling.ComputationProfile;
import com.metaperception.core.trace.TraceContextUtil;
import com.metaperception.core.validation.MetaPerceptionInputValidator;
import com.metaperception.orchestrator.logger.PerceptionFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Threads perception state per venue through the core pipeline.
 *
 * <p>Each venue has its own independent state. Cycles of one venue are serialized by
 * {@link ConcurrentHashMap#compute}; different venues run concurrently. A failed cycle
 * leaves the venue's previous state untouched.
 *
 * <p>Publishing is non-critical: a failing publisher is logged and the output is returned
 * without artifact locations.
 */
@Service
public class PerceptionCycleService {

    private static final Logger log = LoggerFactory.getLogger(PerceptionCycleService.class);

    private final PerceptionConfig config;
    private final PerceptionArtifactPublisher artifactPublisher;
    private final PerceptionFlowLogger flowLogger;
    private final Map<String, PerceptionState> states = new ConcurrentHashMap<>();

    public PerceptionCycleService(PerceptionConfig config,
                                  PerceptionArtifactPublisher artifactPublisher,
                                  PerceptionFlowLogger flowLogger) {
        this.config            = config;
        this.artifactPublisher = artifactPublisher;
        this.flowLogger        = flowLogger;
    }

    public Mono<MetaPerceptionOutput> step(String venue, MetaPerceptionInput input) {
        return Mono.defer(() -> {
            String cycleId = cycleId(venue, input);
            log.info("[Perception] cycle started. venue={} cycleId={}", venue, cycleId);

            Mono<MetaPerceptionOutput> pipeline = Mono.just(venue)
                .doOnEach(flowLogger.stage(PerceptionFlowLogger.CYCLE_RECEIVED))
                .map(v -> {
                    MetaPerceptionInputValidator.validate(input);
                    return input;
                })
                .doOnEach(flowLogger.stage(PerceptionFlowLogger.INPUT_VALIDATED))
                .map(in -> runCycle(venue, in))
                .doOnEach(flowLogger.stage(PerceptionFlowLogger.PERCEPTION_COMPUTED))
                .doOnNext(output -> {
                    flowLogger.logCycleSummary(venue, output, cycleId);
                    warnIfOverBudget(venue, output, cycleId);
                })
                .flatMap(output -> publish(venue, output, input, cycleId))
                .doOnEach(flowLogger.stage(PerceptionFlowLogger.ARTIFACTS_PUBLISHED))
                .doOnError(e -> log.warn("[Perception] cycle failed. venue={} cycleId={} reason={}",
                                         venue, cycleId, e.getMessage()));

            return TraceContextUtil.withCycle(pipeline, venue, cycleId);
        });
    }

    /** Latest state of the venue; empty before its first cycle. */
    public Mono<PerceptionState> currentState(String venue) {
        return Mono.justOrEmpty(states.get(venue));
    }

    /** Drops the venue's state so the next cycle starts fresh. Emits whether a state existed. */
    public Mono<Boolean> reset(String venue) {
        return Mono.fromCallable(() -> {
            boolean removed = states.remove(venue) != null;
            log.info("[Perception] state reset. venue={} existed={}", venue, removed);
            return removed;
        });
    }

    private MetaPerceptionOutput runCycle(String venue, MetaPerceptionInput input) {
        // Captured inside compute; read after it returns.
        final MetaPerceptionOutput[] captured = {null};
        states.compute(venue, (v, previous) -> {
            PerceptionStepResult result = MetaPerceptionOrchestrator.step(previous, input, config);
            captured[0] = result.output();
            return result.newState();
        });
        return captured[0];
    }

    private Mono<MetaPerceptionOutput> publish(String venue, MetaPerceptionOutput output,
                                               MetaPerceptionInput input, String cycleId) {
        return Mono.fromCallable(() -> {
                OverrideRecord override = OverrideDetector
                    .detect(output.decision(), output.snapshot().state(), input.portfolioContext(), config)
                    .orElse(null);
                if (override != null) {
                    flowLogger.logStage(PerceptionFlowLogger.OVERRIDE_DETECTED, venue, cycleId);
                    log.warn("[Perception] action blocked. trigger={} preventedTrades={} preventedCapital={} "
                             + "rationale=\"{}\" cycleId={}",
                             override.trigger(), override.preventedTrades(), override.preventedCapital(),
                             output.decision().rationale(), cycleId);
                }
                Map<String, String> locations = artifactPublisher.publish(venue, output, override);
                log.info("[Perception] artifacts published. count={} cycleId={}", locations.size(), cycleId);
                return output.withArtifacts(locations);
            })
            .onErrorResume(e -> {
                log.warn("[Perception] artifact publish failed (non-critical). venue={} cycleId={}", venue, cycleId, e);
                return Mono.just(output);
            });
    }

    private void warnIfOverBudget(String venue, MetaPerceptionOutput output, String cycleId) {
        if (output.withinBudget()) return;
        ComputationProfile profile = output.profile();
        log.warn("[Perception] cycle over budget. venue={} totalMs={} budgetMs={} slowestStage={} cycleId={}",
                 venue, profile.totalMillis(), profile.budgetMillis(), profile.slowestStage(), cycleId);
    }

    static String cycleId(String venue, MetaPerceptionInput input) {
        return TraceContextUtil.cycleId(venue, input == null ? null : input.timestamp());
    }
}
