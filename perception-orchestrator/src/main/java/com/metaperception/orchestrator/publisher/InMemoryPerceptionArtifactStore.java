package com.metaperception.orchestrator.publisher;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metaperception.core.decision.PerceptionArtifactPublisher;
import com.metaperception.core.model.MetaPerceptionOutput;
import com.metaperception.core.override.OverrideRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only, in-process implementation of {@link PerceptionArtifactPublisher}.
 *
 * <p>Artifacts are stored as JSON keyed by venue and deterministic id. Re-publishing
 * identical content returns the existing location; publishing different content under a
 * stored key throws, so a location never points at another cycle's artifact.
 * Locations take the form {@code perception://{venue}/{kind}/{id}}.
 *
 * <p>Nothing survives a restart.
 */
@Component
public class InMemoryPerceptionArtifactStore implements PerceptionArtifactPublisher {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPerceptionArtifactStore.class);

    public static final String SCHEME = "perception://";
    public static final String SNAPSHOTS = "snapshots";
    public static final String DECISIONS = "decisions";
    public static final String OVERRIDES = "overrides";

    private final ObjectMapper objectMapper;
    private final Map<String, String> artifacts = new ConcurrentHashMap<>();

    public InMemoryPerceptionArtifactStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Map<String, String> publish(String venue, MetaPerceptionOutput output, OverrideRecord override) {
        Map<String, String> locations = new LinkedHashMap<>();
        String snapshotId = output.snapshot().snapshotId();
        locations.put(snapshotId, store(venue, SNAPSHOTS, snapshotId, output.snapshot()));
        String decisionId = output.decision().decisionId();
        locations.put(decisionId, store(venue, DECISIONS, decisionId, output.decision()));
        if (override != null) {
            locations.put(override.overrideId(), store(venue, OVERRIDES, override.overrideId(), override));
        }
        return locations;
    }

    /** Stored JSON of a venue's artifact, if any. */
    public Optional<String> find(String venue, String artifactId) {
        return Optional.ofNullable(artifacts.get(key(venue, artifactId)));
    }

    public int size() {
        return artifacts.size();
    }

    private String store(String venue, String kind, String id, Object artifact) {
        String json = toJson(artifact);
        String existing = artifacts.putIfAbsent(key(venue, id), json);
        if (existing != null) {
            if (!existing.equals(json)) {
                throw new IllegalStateException(
                    "Artifact " + id + " of venue " + venue + " already stored with different content");
            }
            log.debug("[ArtifactStore] identical artifact already stored. venue={} id={}", venue, id);
        }
        return SCHEME + venue + "/" + kind + "/" + id;
    }

    private static String key(String venue, String id) {
        return venue + "/" + id;
    }

    private String toJson(Object artifact) {
        try {
            return objectMapper.writeValueAsString(artifact);
        } catch (Exception e) {
            throw new RuntimeException("Failed to serialize perception artifact for persistence", e);
        }
    }
}
