package com.feedbackengine.common.risk;

import com.feedbackengine.common.model.Holding;
import com.feedbackengine.common.model.RiskContext;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Correlation to existing holdings and the size reduction it implies.
 *
 * <pre>
 *   ρ*     = max |ρ(asset, held)| over held assets other than the asset itself
 *   factor = 1.0                                   if ρ* ≤ threshold
 *          = 1 − 0.5 × (ρ* − threshold)/(1 − threshold), floor 0.5   otherwise
 * </pre>
 *
 * <p>Never rejects; at ρ* = 1.0 the size is halved.
 */
public final class CorrelationAnalyzer {

    public static final double MIN_FACTOR = 0.5;

    /** Minimum overlapping observations for a Pearson estimate. */
    static final int MIN_OBSERVATIONS = 3;

    private final double threshold;

    public CorrelationAnalyzer(double threshold) {
        if (!(threshold >= 0) || threshold >= 1.0) {
            throw new IllegalArgumentException("correlation threshold must be in [0, 1), got " + threshold);
        }
        this.threshold = threshold;
    }

    public double threshold() {
        return threshold;
    }

    public double maxAbsCorrelation(String assetPair, RiskContext context) {
        double max = 0.0;
        for (Holding holding : context.holdings()) {
            if (holding.assetPair().equals(assetPair)) continue;
            Double rho = context.correlation(assetPair, holding.assetPair());
            if (rho != null && Double.isFinite(rho)) max = Math.max(max, Math.abs(rho));
        }
        return Math.min(1.0, max);
    }

    public double correlationFactor(String assetPair, RiskContext context) {
        return factorFor(maxAbsCorrelation(assetPair, context));
    }

    double factorFor(double absCorrelation) {
        if (absCorrelation <= threshold) return 1.0;
        double factor = 1.0 - 0.5 * (absCorrelation - threshold) / (1.0 - threshold);
        return Math.max(MIN_FACTOR, factor);
    }

    /**
     * Pairwise Pearson matrix from per-asset return series. Series are aligned on
     * their most recent common observations; pairs with too little overlap are omitted.
     */
    public static Map<String, Map<String, Double>> matrix(Map<String, List<Double>> returnsByAsset) {
        Map<String, Map<String, Double>> matrix = new TreeMap<>();
        List<String> assets = List.copyOf(new TreeMap<>(returnsByAsset).keySet());
        PearsonsCorrelation pearson = new PearsonsCorrelation();
        for (int i = 0; i < assets.size(); i++) {
            for (int j = i + 1; j < assets.size(); j++) {
                List<Double> a = returnsByAsset.get(assets.get(i));
                List<Double> b = returnsByAsset.get(assets.get(j));
                int n = Math.min(a.size(), b.size());
                if (n < MIN_OBSERVATIONS) continue;
                double rho = pearson.correlation(tail(a, n), tail(b, n));
                if (!Double.isFinite(rho)) continue;
                matrix.computeIfAbsent(assets.get(i), k -> new LinkedHashMap<>()).put(assets.get(j), rho);
                matrix.computeIfAbsent(assets.get(j), k -> new LinkedHashMap<>()).put(assets.get(i), rho);
            }
        }
        return matrix;
    }

    private static double[] tail(List<Double> values, int n) {
        double[] out = new double[n];
        int offset = values.size() - n;
        for (int k = 0; k < n; k++) out[k] = values.get(offset + k);
        return out;
    }
}
