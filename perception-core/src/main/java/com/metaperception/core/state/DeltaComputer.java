package com.metaperception.core.state;

import com.metaperception.core.model.AlertPriority;
import com.metaperception.core.model.IntentShift;
import com.metaperception.core.model.PerceptionDelta;
import com.metaperception.core.model.PerceptionState;
import com.metaperception.core.shock.ShockEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Diffs two consecutive states for alerting.
 *
 * <p>Priority, first match wins:
 * <ol>
 *   <li>a newly active shock is CRITICAL → {@link AlertPriority#CRITICAL}</li>
 *   <li>the regime changed             → {@link AlertPriority#HIGH}</li>
 *   <li>any newly active shock         → {@link AlertPriority#MEDIUM}</li>
 *   <li>otherwise                      → {@link AlertPriority#LOW}</li>
 * </ol>
 */
public final class DeltaComputer {

    private DeltaComputer() {}

    /**
     * @param previous      last cycle's state, must not be null
     * @param current       this cycle's state
     * @param currentShocks every shock detected this cycle; newly active ids are resolved against it
     */
    public static PerceptionDelta compute(PerceptionState previous,
                                          PerceptionState current,
                                          List<ShockEvent> currentShocks) {
        Objects.requireNonNull(previous, "previous state is required to compute a delta");

        Set<String> addedIds = new TreeSet<>(current.activeShocks());
        addedIds.removeAll(previous.activeShocks());

        Set<String> resolvedIds = new TreeSet<>(previous.activeShocks());
        resolvedIds.removeAll(current.activeShocks());

        List<ShockEvent> newShocks = new ArrayList<>();
        Set<String> matched = new TreeSet<>();
        for (ShockEvent shock : currentShocks) {
            if (addedIds.contains(shock.shockId()) && matched.add(shock.shockId())) {
                newShocks.add(shock);
            }
        }

        boolean regimeChanged = !Objects.equals(previous.currentRegime(), current.currentRegime());

        return new PerceptionDelta(
            previous.timestamp(),
            current.timestamp(),
            current.marketEntropy() - previous.marketEntropy(),
            current.noiseScore() - previous.noiseScore(),
            IntentShift.between(previous.intentProbabilities(), current.intentProbabilities()),
            current.reflexivityCoefficient() - previous.reflexivityCoefficient(),
            regimeChanged,
            previous.currentRegime(),
            current.currentRegime(),
            newShocks,
            resolvedIds,
            priority(newShocks, regimeChanged));
    }

    static AlertPriority priority(List<ShockEvent> newShocks, boolean regimeChanged) {
        if (newShocks.stream().anyMatch(ShockEvent::isCritical)) return AlertPriority.CRITICAL;
        if (regimeChanged) return AlertPriority.HIGH;
        if (!newShocks.isEmpty()) return AlertPriority.MEDIUM;
        return AlertPriority.LOW;
    }
}
