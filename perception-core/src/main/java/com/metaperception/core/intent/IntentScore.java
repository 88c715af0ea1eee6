package com.metaperception.core.intent;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.metaperception.core.model.IntentProbabilities;
import com.metaperception.core.model.MarketPressure;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Output of {@link IntentInferencer}.
 *
 * @param probabilities    posterior over LONG / SHORT / NEUTRAL
 * @param dominantPressure arg-max hypothesis, UNKNOWN without intent features
 * @param intentStrength   probability of the dominant hypothesis
 * @param participantType  whale-flow heuristic
 * @param logits           raw logits in LONG, SHORT, NEUTRAL order
 * @param scaledFeatures   rescaled feature vector fed to the classifier
 * @param rawFeatures      intent features as supplied
 */
public record IntentScore(
    @JsonProperty("probabilities")    IntentProbabilities probabilities,
    @JsonProperty("dominantPressure") MarketPressure dominantPressure,
    @JsonProperty("intentStrength")   double intentStrength,
    @JsonProperty("participantType")  ParticipantType participantType,
    @JsonProperty("logits")           List<Double> logits,
    @JsonProperty("scaledFeatures")   Map<String, Double> scaledFeatures,
    @JsonProperty("rawFeatures")      Map<String, Double> rawFeatures
) {
    public IntentScore {
        logits = logits == null ? List.of() : List.copyOf(logits);
        scaledFeatures = scaledFeatures == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(scaledFeatures));
        rawFeatures = rawFeatures == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(rawFeatures));
    }
}
