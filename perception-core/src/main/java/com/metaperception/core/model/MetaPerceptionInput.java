package com.metaperception.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Fully materialized inputs of one perception cycle.
 *
 * @param timestamp         cycle timestamp; also the seed of the snapshot id
 * @param marketData        feature name to ordered observations (oldest first)
 * @param features          feature name to current scalar value (intent and regime indicators)
 * @param priorDecisions    recent system decisions, oldest first
 * @param portfolioContext  pass-through context, read only by override estimation
 * @param governanceContext pass-through context, unused by the core
 */
public record MetaPerceptionInput(
    @JsonProperty("timestamp")         Instant timestamp,
    @JsonProperty("marketData")        Map<String, List<Double>> marketData,
    @JsonProperty("features")          Map<String, Double> features,
    @JsonProperty("priorDecisions")    List<PriorDecision> priorDecisions,
    @JsonProperty("portfolioContext")  Map<String, Object> portfolioContext,
    @JsonProperty("governanceContext") Map<String, Object> governanceContext
) {
    public MetaPerceptionInput {
        marketData        = copySeries(marketData);
        features          = sorted(features);
        priorDecisions    = copy(priorDecisions);
        portfolioContext  = copy(portfolioContext);
        governanceContext = copy(governanceContext);
    }

    /** Convenience factory for callers without portfolio or governance context. */
    public static MetaPerceptionInput of(Instant timestamp,
                                         Map<String, List<Double>> marketData,
                                         Map<String, Double> features,
                                         List<PriorDecision> priorDecisions) {
        return new MetaPerceptionInput(timestamp, marketData, features, priorDecisions, null, null);
    }

    // Copies keep null elements so the validator can report them by field.
    private static Map<String, List<Double>> copySeries(Map<String, List<Double>> source) {
        if (source == null) return Map.of();
        Map<String, List<Double>> copy = new TreeMap<>();
        source.forEach((name, series) -> copy.put(name, series == null ? null : copy(series)));
        return Collections.unmodifiableMap(copy);
    }

    private static <T> List<T> copy(List<T> source) {
        return source == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(source));
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    private static <V> Map<String, V> sorted(Map<String, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(source));
    }
}
