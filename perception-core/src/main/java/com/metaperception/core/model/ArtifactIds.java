package com.metaperception.core.model;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

/**
 * Deterministic identifiers of the per-cycle artifacts.
 *
 * <p>Name-based (type 3) UUIDs, so replaying a cycle with the same timestamp reproduces
 * the same ids and persistence stays idempotent.
 */
public final class ArtifactIds {

    public static final String SNAPSHOT_PREFIX = "PS-";
    public static final String DECISION_PREFIX = "MPD-";
    public static final String OVERRIDE_PREFIX = "OVR-";

    private ArtifactIds() {}

    public static String snapshotId(Instant timestamp) {
        return SNAPSHOT_PREFIX + nameUuid("snapshot|" + timestamp);
    }

    public static String decisionId(String snapshotId, Instant timestamp) {
        return DECISION_PREFIX + nameUuid("decision|" + snapshotId + "|" + timestamp);
    }

    public static String overrideId(String decisionId) {
        return OVERRIDE_PREFIX + nameUuid("override|" + decisionId);
    }

    private static UUID nameUuid(String name) {
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
    }
}
