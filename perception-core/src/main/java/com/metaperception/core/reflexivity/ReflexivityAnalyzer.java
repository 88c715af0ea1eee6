package com.metaperception.core.reflexivity;

import com.metaperception.core.config.PerceptionConfig;
import com.metaperception.core.model.PriorDecision;
import com.metaperception.core.util.StatMath;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Estimates how much the system's own decisions move the market.
 *
 * <p>The last {@code reflexivityWindow} prior decisions are reduced to directions and
 * paired, most recent with most recent, against the returns of the reference
 * ({@code priceFeature}) series. Their Pearson correlation is the reflexivity coefficient;
 * market impact grows linearly with its magnitude up to {@value #MAX_IMPACT_BPS} bps.
 *
 * <p>With fewer than two pairs the result is neutral with zero impact.
 */
public final class ReflexivityAnalyzer {

    public static final double MAX_IMPACT_BPS = 5.0;

    private ReflexivityAnalyzer() {}

    public static ReflexivityScore analyzeReflexivity(List<PriorDecision> priorDecisions,
                                                      Map<String, List<Double>> marketData,
                                                      PerceptionConfig config) {
        if (priorDecisions == null || priorDecisions.size() < 2) {
            return ReflexivityScore.neutral(priorDecisions == null ? 0 : priorDecisions.size());
        }

        List<Double> prices = marketData == null ? null : marketData.get(config.priceFeature());
        List<Double> returns = StatMath.returns(prices);

        int n = Math.min(Math.min(priorDecisions.size(), config.reflexivityWindow()), returns.size());
        if (n < 2) {
            return ReflexivityScore.neutral(n);
        }

        List<Double> decisions = new ArrayList<>(n);
        for (PriorDecision d : priorDecisions.subList(priorDecisions.size() - n, priorDecisions.size())) {
            decisions.add((double) d.direction());
        }
        List<Double> paired = returns.subList(returns.size() - n, returns.size());

        return fromCoefficient(StatMath.pearson(decisions, paired), n, decisions, paired);
    }

    static ReflexivityScore fromCoefficient(double rawCoefficient, int sampleSize,
                                            List<Double> decisions, List<Double> returns) {
        double coefficient = StatMath.clamp(rawCoefficient, -1.0, 1.0);
        double impactBps = Math.min(MAX_IMPACT_BPS, Math.abs(coefficient) * MAX_IMPACT_BPS);
        return new ReflexivityScore(
            coefficient,
            impactBps,
            impactBps / MAX_IMPACT_BPS,
            FeedbackStrength.classify(coefficient),
            sampleSize,
            decisions,
            returns);
    }
}
