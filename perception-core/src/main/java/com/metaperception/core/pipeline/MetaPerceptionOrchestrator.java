package com.metaperception.core.pipeline;

import com.metaperception.core.config.PerceptionConfig;
import com.metaperception.core.decision.DecisionMaker;
import com.metaperception.core.entropy.EntropyEngine;
import com.metaperception.core.entropy.EntropyMetrics;
import com.metaperception.core.intent.IntentInferencer;
import com.metaperception.core.intent.IntentScore;
import com.metaperception.core.model.ArtifactIds;
import com.metaperception.core.model.MetaPerceptionDecision;
import com.metaperception.core.model.MetaPerceptionInput;
import com.metaperception.core.model.MetaPerceptionOutput;
import com.metaperception.core.model.PerceptionDelta;
import com.metaperception.core.model.PerceptionSnapshot;
import com.metaperception.core.model.PerceptionState;
import com.metaperception.core.noise.NoiseEvaluator;
import com.metaperception.core.noise.NoiseScore;
import com.metaperception.core.profiling.ComputationProfile;
import com.metaperception.core.profiling.CycleProfiler;
import com.metaperception.core.reflexivity.ReflexivityAnalyzer;
import com.metaperception.core.reflexivity.ReflexivityScore;
import com.metaperception.core.regime.RegimeAlert;
import com.metaperception.core.regime.RegimePivotDetector;
import com.metaperception.core.shock.ShockDetector;
import com.metaperception.core.shock.ShockEvent;
import com.metaperception.core.state.DeltaComputer;
import com.metaperception.core.state.StateComposer;
import com.metaperception.core.uncertainty.UncertaintyAggregator;
import com.metaperception.core.uncertainty.UncertaintyBreakdown;
import com.metaperception.core.validation.MetaPerceptionInputValidator;

import java.util.List;
import java.util.Objects;

/**
 * Runs one perception cycle as a pure function of (previous state, input, config).
 *
 * <p>Stage order is fixed:
 * <pre>
 *   entropy → noise → intent → reflexivity → shocks → regime → uncertainty
 *           → state → delta → decision
 * </pre>
 *
 * <p>No hidden state: the caller threads {@link PerceptionStepResult#newState()} into the
 * next call. Identical arguments give identical states, decisions and ids; only the
 * timing fields differ between runs.
 *
 * <p>The computation budget is advisory. An over-budget cycle still completes and is
 * reported with {@code withinBudget = false}.
 *
 * <p>Persistence is not part of a step: artifacts come back with an empty location map
 * and the service layer publishes them.
 */
public final class MetaPerceptionOrchestrator {

    public static final String STAGE_ENTROPY     = "entropy";
    public static final String STAGE_NOISE       = "noise";
    public static final String STAGE_INTENT      = "intent";
    public static final String STAGE_REFLEXIVITY = "reflexivity";
    public static final String STAGE_SHOCKS      = "shocks";
    public static final String STAGE_REGIME      = "regime";
    public static final String STAGE_UNCERTAINTY = "uncertainty";
    public static final String STAGE_STATE       = "state";
    public static final String STAGE_DELTA       = "delta";
    public static final String STAGE_DECISION    = "decision";

    public static final List<String> STAGES = List.of(
        STAGE_ENTROPY, STAGE_NOISE, STAGE_INTENT, STAGE_REFLEXIVITY, STAGE_SHOCKS,
        STAGE_REGIME, STAGE_UNCERTAINTY, STAGE_STATE, STAGE_DELTA, STAGE_DECISION
    );

    private MetaPerceptionOrchestrator() {}

    /**
     * @param previousState last cycle's state, null on the first cycle
     * @throws com.metaperception.core.exception.InvalidPerceptionInputException on malformed input
     */
    public static PerceptionStepResult step(PerceptionState previousState,
                                            MetaPerceptionInput input,
                                            PerceptionConfig config) {
        Objects.requireNonNull(config, "config");
        MetaPerceptionInputValidator.validate(input);

        CycleProfiler profiler = CycleProfiler.start();

        EntropyMetrics entropy = EntropyEngine.computeMarketEntropy(input.marketData(), config);
        profiler.mark(STAGE_ENTROPY);

        NoiseScore noise = NoiseEvaluator.evaluateNoise(input.marketData(), config);
        profiler.mark(STAGE_NOISE);

        IntentScore intent = IntentInferencer.inferIntent(input.features(), config);
        profiler.mark(STAGE_INTENT);

        ReflexivityScore reflexivity =
            ReflexivityAnalyzer.analyzeReflexivity(input.priorDecisions(), input.marketData(), config);
        profiler.mark(STAGE_REFLEXIVITY);

        List<ShockEvent> shocks = ShockDetector.detectShocks(input.marketData(), config);
        profiler.mark(STAGE_SHOCKS);

        RegimeAlert regime = RegimePivotDetector.detectRegimePivot(input.features(), previousState, config);
        profiler.mark(STAGE_REGIME);

        UncertaintyBreakdown uncertainty =
            UncertaintyAggregator.aggregate(entropy, noise, reflexivity, regime, config);
        profiler.mark(STAGE_UNCERTAINTY);

        PerceptionState state = StateComposer.compose(input.timestamp(), entropy, noise, intent,
            reflexivity, shocks, regime, uncertainty, previousState, config);
        profiler.mark(STAGE_STATE);

        PerceptionDelta delta = previousState == null
            ? null
            : DeltaComputer.compute(previousState, state, shocks);
        profiler.mark(STAGE_DELTA);

        String snapshotId = ArtifactIds.snapshotId(input.timestamp());
        MetaPerceptionDecision decision = DecisionMaker.decide(state, shocks, regime, snapshotId, config);
        profiler.mark(STAGE_DECISION);

        ComputationProfile profile = profiler.finish(config.maxComputationTimeMs());
        PerceptionSnapshot snapshot = new PerceptionSnapshot(snapshotId, input.timestamp(), state,
            entropy, noise, intent, reflexivity, shocks, regime, uncertainty, profile.totalMillis());

        MetaPerceptionOutput output = new MetaPerceptionOutput(snapshot, delta, decision, null,
            profile.totalMillis(), !profile.budgetExceeded(), profile);

        return new PerceptionStepResult(state, output);
    }
}
