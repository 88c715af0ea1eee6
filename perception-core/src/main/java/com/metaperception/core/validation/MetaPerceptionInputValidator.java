package com.metaperception.core.validation;

import com.metaperception.core.exception.InvalidPerceptionInputException;
import com.metaperception.core.model.MetaPerceptionInput;
import com.metaperception.core.model.PriorDecision;

import java.util.List;
import java.util.Map;

/**
 * Rejects malformed cycle inputs before any component runs.
 *
 * <p>Components degrade silently on short or degenerate series; they are never handed
 * structurally broken data. Rejected:
 * <ul>
 *   <li>null input or timestamp</li>
 *   <li>blank series or feature names</li>
 *   <li>null series, null or non-finite observations</li>
 *   <li>null or non-finite feature values</li>
 *   <li>prior decisions without an action</li>
 * </ul>
 */
public final class MetaPerceptionInputValidator {

    private MetaPerceptionInputValidator() {}

    public static void validate(MetaPerceptionInput input) {
        if (input == null) {
            throw new InvalidPerceptionInputException("input", "must not be null");
        }
        if (input.timestamp() == null) {
            throw new InvalidPerceptionInputException("timestamp", "must not be null");
        }
        for (Map.Entry<String, List<Double>> e : input.marketData().entrySet()) {
            String name = requireName("marketData", e.getKey());
            List<Double> series = e.getValue();
            if (series == null) {
                throw new InvalidPerceptionInputException("marketData." + name, "series must not be null");
            }
            for (int i = 0; i < series.size(); i++) {
                Double v = series.get(i);
                if (v == null || !Double.isFinite(v)) {
                    throw new InvalidPerceptionInputException("marketData." + name,
                        "observation " + i + " is not a finite number: " + v);
                }
            }
        }
        for (Map.Entry<String, Double> e : input.features().entrySet()) {
            String name = requireName("features", e.getKey());
            Double v = e.getValue();
            if (v == null || !Double.isFinite(v)) {
                throw new InvalidPerceptionInputException("features." + name, "not a finite number: " + v);
            }
        }
        List<PriorDecision> decisions = input.priorDecisions();
        for (int i = 0; i < decisions.size(); i++) {
            PriorDecision d = decisions.get(i);
            if (d == null || d.action() == null || d.action().isBlank()) {
                throw new InvalidPerceptionInputException("priorDecisions[" + i + "]", "action is required");
            }
        }
    }

    private static String requireName(String field, String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidPerceptionInputException(field, "names must not be blank");
        }
        return name;
    }
}
