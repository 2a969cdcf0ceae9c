package com.feedbackengine.common.metrics;

import com.feedbackengine.common.model.TradeOutcome;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.List;

/**
 * Equity-curve statistics.
 *
 * <pre>
 *   r_t    = E_t / E_{t−1} − 1
 *   sharpe = mean(r) / std(r) × √periodsPerYear      (0 when fewer than 2 returns or std = 0)
 *   maxDD  = max_t (peak_t − E_t) / peak_t
 * </pre>
 */
public final class PerformanceMetrics {

    public static final int DEFAULT_PERIODS_PER_YEAR = 252;

    private PerformanceMetrics() {}

    public static PerformanceReport evaluate(List<Double> equityCurve, List<TradeOutcome> trades,
                                             int periodsPerYear) {
        double initial = equityCurve.isEmpty() ? 0.0 : equityCurve.get(0);
        double last = equityCurve.isEmpty() ? 0.0 : equityCurve.get(equityCurve.size() - 1);
        return new PerformanceReport(initial, last,
            initial > 0 ? (last - initial) / initial : 0.0,
            sharpe(equityCurve, periodsPerYear),
            maxDrawdown(equityCurve),
            winRate(trades),
            trades.size());
    }

    public static List<Double> returns(List<Double> equityCurve) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < equityCurve.size(); i++) {
            double prev = equityCurve.get(i - 1);
            if (prev > 0) returns.add(equityCurve.get(i) / prev - 1.0);
        }
        return returns;
    }

    public static double sharpe(List<Double> equityCurve, int periodsPerYear) {
        List<Double> returns = returns(equityCurve);
        if (returns.size() < 2) return 0.0;
        DescriptiveStatistics stats = new DescriptiveStatistics();
        returns.forEach(stats::addValue);
        double std = stats.getStandardDeviation();
        if (!(std > 1e-12)) return 0.0;
        return stats.getMean() / std * Math.sqrt(periodsPerYear);
    }

    public static double maxDrawdown(List<Double> equityCurve) {
        double peak = Double.NEGATIVE_INFINITY;
        double worst = 0.0;
        for (double equity : equityCurve) {
            peak = Math.max(peak, equity);
            if (peak > 0) worst = Math.max(worst, (peak - equity) / peak);
        }
        return worst;
    }

    /** Trailing drawdown: fall of the latest point from the running peak. */
    public static double currentDrawdown(List<Double> equityCurve) {
        if (equityCurve.isEmpty()) return 0.0;
        double peak = equityCurve.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double last = equityCurve.get(equityCurve.size() - 1);
        return peak > 0 ? (peak - last) / peak : 0.0;
    }

    public static double winRate(List<TradeOutcome> trades) {
        if (trades.isEmpty()) return 0.0;
        long wins = trades.stream().filter(TradeOutcome::wasProfitable).count();
        return wins / (double) trades.size();
    }
}
