package com.metaperception.core.decision;

import com.metaperception.core.model.MetaPerceptionOutput;
import com.metaperception.core.override.OverrideRecord;

import java.util.Map;

/**
 * Persistence seam for the artifacts of one perception cycle.
 *
 * <p>Stores the snapshot, the decision and, for blocked cycles, the override record, each
 * under its deterministic id within the venue's namespace. Ids derive from the cycle
 * timestamp only, so two venues stepping the same timestamp share ids and must not share
 * storage. Storing an id twice with identical content is a no-op; storing it with different
 * content must fail rather than return a location holding the other artifact.
 *
 * <p>Current implementation: {@code InMemoryPerceptionArtifactStore}.
 */
public interface PerceptionArtifactPublisher {

    /**
     * @param venue    namespace the artifacts belong to
     * @param output   the completed cycle output
     * @param override override record of a blocked cycle, null when the cycle authorized action
     * @return artifact id to storage location
     */
    Map<String, String> publish(String venue, MetaPerceptionOutput output, OverrideRecord override);
}
