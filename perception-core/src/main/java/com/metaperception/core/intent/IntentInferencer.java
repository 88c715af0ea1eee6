package com.metaperception.core.intent;

import com.metaperception.core.config.IntentWeights;
import com.metaperception.core.config.PerceptionConfig;
import com.metaperception.core.model.IntentProbabilities;
import com.metaperception.core.model.MarketPressure;
import com.metaperception.core.util.StatMath;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed-form Bayesian-style classifier of participant intent.
 *
 * <h3>Model</h3>
 * <pre>
 *   x        = rescaled feature vector (5 components, each clamped to [-5, 5])
 *   logit_h  = w_h · x           for h ∈ {LONG, SHORT, NEUTRAL}
 *   P(h | x) = softmax(logit)_h  (max-subtracted for numerical stability)
 * </pre>
 *
 * <h3>Rescaling</h3>
 * <ul>
 *   <li>{@code open_interest_change} (fraction) × 10</li>
 *   <li>{@code funding_rate} (per interval) × 1000</li>
 *   <li>{@code whale_net_flow} (notional) ÷ 1e8</li>
 *   <li>{@code futures_basis} (fraction) × 100</li>
 *   <li>{@code put_call_ratio} − 1, centred on parity</li>
 * </ul>
 * Missing features contribute 0. When none of the five is present the result is the
 * uniform prior with pressure {@link MarketPressure#UNKNOWN}.
 *
 * <p>Weights are configuration, never updated here.
 */
public final class IntentInferencer {

    public static final String OPEN_INTEREST_CHANGE = "open_interest_change";
    public static final String FUNDING_RATE         = "funding_rate";
    public static final String WHALE_NET_FLOW       = "whale_net_flow";
    public static final String FUTURES_BASIS        = "futures_basis";
    public static final String PUT_CALL_RATIO       = "put_call_ratio";

    public static final List<String> FEATURE_ORDER = List.of(
        OPEN_INTEREST_CHANGE, FUNDING_RATE, WHALE_NET_FLOW, FUTURES_BASIS, PUT_CALL_RATIO);

    private static final double FEATURE_CLAMP = 5.0;

    private IntentInferencer() {}

    public static IntentScore inferIntent(Map<String, Double> features, PerceptionConfig config) {
        Map<String, Double> raw = new LinkedHashMap<>();
        if (features != null) {
            for (String name : FEATURE_ORDER) {
                Double value = features.get(name);
                if (value != null) {
                    raw.put(name, value);
                }
            }
        }

        if (raw.isEmpty()) {
            IntentProbabilities uniform = IntentProbabilities.uniform();
            return new IntentScore(uniform, MarketPressure.UNKNOWN, uniform.neutralProbability(),
                ParticipantType.UNKNOWN, List.of(0.0, 0.0, 0.0), Map.of(), Map.of());
        }

        Map<String, Double> scaled = new LinkedHashMap<>();
        double[] x = new double[FEATURE_ORDER.size()];
        for (int i = 0; i < FEATURE_ORDER.size(); i++) {
            String name = FEATURE_ORDER.get(i);
            x[i] = rescale(name, raw.getOrDefault(name, neutralValue(name)));
            scaled.put(name, x[i]);
        }

        IntentWeights weights = config.intentWeights();
        double[] logits = {
            dot(weights.longWeights(), x),
            dot(weights.shortWeights(), x),
            dot(weights.neutralWeights(), x)
        };
        double[] p = softmax(logits);
        IntentProbabilities probabilities = normalized(p[0], p[1], p[2]);

        MarketPressure dominant = probabilities.dominant();
        return new IntentScore(
            probabilities,
            dominant,
            probabilities.of(dominant),
            ParticipantType.fromWhaleFlow(raw.getOrDefault(WHALE_NET_FLOW, 0.0)),
            List.of(logits[0], logits[1], logits[2]),
            scaled,
            raw);
    }

    /** Numerically stable softmax. */
    public static double[] softmax(double[] logits) {
        double max = Double.NEGATIVE_INFINITY;
        for (double l : logits) {
            max = Math.max(max, l);
        }
        double[] out = new double[logits.length];
        double sum = 0.0;
        for (int i = 0; i < logits.length; i++) {
            out[i] = Math.exp(logits[i] - max);
            sum += out[i];
        }
        for (int i = 0; i < out.length; i++) {
            out[i] /= sum;
        }
        return out;
    }

    static double rescale(String feature, double value) {
        double scaled = switch (feature) {
            case OPEN_INTEREST_CHANGE -> value * 10.0;
            case FUNDING_RATE         -> value * 1000.0;
            case WHALE_NET_FLOW       -> value / 1e8;
            case FUTURES_BASIS        -> value * 100.0;
            case PUT_CALL_RATIO       -> value - 1.0;
            default                   -> value;
        };
        return StatMath.clamp(scaled, -FEATURE_CLAMP, FEATURE_CLAMP);
    }

    private static double neutralValue(String feature) {
        // parity, so that a missing put/call ratio rescales to 0
        return PUT_CALL_RATIO.equals(feature) ? 1.0 : 0.0;
    }

    private static double dot(List<Double> w, double[] x) {
        double sum = 0.0;
        for (int i = 0; i < x.length; i++) {
            sum += w.get(i) * x[i];
        }
        return sum;
    }

    // absorbs rounding so the triple passes the sum-to-one check exactly
    private static IntentProbabilities normalized(double pLong, double pShort, double pNeutral) {
        double sum = pLong + pShort + pNeutral;
        pLong /= sum;
        pShort /= sum;
        return new IntentProbabilities(pLong, pShort, Math.max(0.0, 1.0 - pLong - pShort));
    }
}
