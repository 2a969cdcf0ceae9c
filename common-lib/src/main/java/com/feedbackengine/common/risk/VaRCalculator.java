package com.feedbackengine.common.risk;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Value-at-Risk estimates over a return series (fractions, e.g. -0.012 = -1.2%).
 *
 * <h3>Historical</h3>
 * <pre>
 *   sorted = returns ascending
 *   idx    = round(n × (1 − confidence)), clamped to [0, n − 1]
 *   VaR    = |sorted[idx]|
 * </pre>
 * Requires at least {@value #MIN_OBSERVATIONS} observations; fewer yields empty.
 *
 * <h3>Parametric</h3>
 * <pre>
 *   VaR = max(0, −(μ + z(1 − confidence) × σ))
 * </pre>
 */
public final class VaRCalculator {

    public static final int MIN_OBSERVATIONS = 30;

    private VaRCalculator() {}

    public static OptionalDouble historical(List<Double> returns, double confidence) {
        requireConfidence(confidence);
        if (returns == null || returns.size() < MIN_OBSERVATIONS) return OptionalDouble.empty();
        double[] sorted = returns.stream().mapToDouble(Double::doubleValue).filter(Double::isFinite).sorted().toArray();
        if (sorted.length < MIN_OBSERVATIONS) return OptionalDouble.empty();
        int idx = (int) Math.round(sorted.length * (1.0 - confidence));
        idx = Math.max(0, Math.min(sorted.length - 1, idx));
        return OptionalDouble.of(Math.abs(sorted[idx]));
    }

    public static OptionalDouble parametric(List<Double> returns, double confidence) {
        requireConfidence(confidence);
        if (returns == null || returns.size() < MIN_OBSERVATIONS) return OptionalDouble.empty();
        DescriptiveStatistics stats = new DescriptiveStatistics();
        returns.stream().filter(Double::isFinite).forEach(stats::addValue);
        double z = new NormalDistribution().inverseCumulativeProbability(1.0 - confidence);
        return OptionalDouble.of(Math.max(0.0, -(stats.getMean() + z * stats.getStandardDeviation())));
    }

    private static void requireConfidence(double confidence) {
        if (!(confidence > 0.5) || confidence >= 1.0) {
            throw new IllegalArgumentException("VaR confidence must be in (0.5, 1), got " + confidence);
        }
    }
}
