package com.metaperception.core.state;

import com.metaperception.core.config.PerceptionConfig;
import com.metaperception.core.model.PerceptionState;

/**
 * The four independent guards behind {@code shouldAct}.
 *
 * <p>Action is authorized only when all four pass; any single failure is enough to block.
 * This is a strict AND, never a weighted score. The guard order here (noise, uncertainty,
 * regime pivot, critical shock) is also the priority order used when a blocking decision
 * is explained or an override trigger is classified.
 */
public record ActionGuards(
    boolean noiseAcceptable,
    boolean uncertaintyWithinBound,
    boolean noRegimePivot,
    boolean noCriticalShocks
) {
    public static ActionGuards evaluate(PerceptionState state, PerceptionConfig config) {
        return new ActionGuards(
            state.noiseScore() < config.noiseThreshold(),
            state.totalUncertainty() < config.uncertaintyThreshold(),
            state.regimeStress() < config.regimeStressThreshold(),
            state.criticalShockCount() == 0);
    }

    public boolean allPass() {
        return noiseAcceptable && uncertaintyWithinBound && noRegimePivot && noCriticalShocks;
    }
}
