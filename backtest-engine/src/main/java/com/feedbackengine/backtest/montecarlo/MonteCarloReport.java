package com.feedbackengine.backtest.montecarlo;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.List;

/**
 * Distribution of final equity over Monte Carlo paths.
 *
 * <pre>
 *   pN             = N-th percentile of final equity (linear interpolation)
 *   valueAtRisk95  = initial − p5
 *   expectedReturn = (mean − initial) / initial
 *   stdDev         = population std-dev of final equity
 * </pre>
 */
public record MonteCarloReport(
    @JsonProperty("requestedPaths")  int requestedPaths,
    @JsonProperty("completedPaths")  int completedPaths,
    @JsonProperty("initialBalance")  double initialBalance,
    @JsonProperty("priceNoiseStd")   double priceNoiseStd,
    @JsonProperty("p5")              double p5,
    @JsonProperty("p25")             double p25,
    @JsonProperty("p50")             double p50,
    @JsonProperty("p75")             double p75,
    @JsonProperty("p95")             double p95,
    @JsonProperty("valueAtRisk95")   double valueAtRisk95,
    @JsonProperty("expectedReturn")  double expectedReturn,
    @JsonProperty("worst")           double worst,
    @JsonProperty("best")            double best,
    @JsonProperty("stdDev")          double stdDev,
    @JsonProperty("cancelled")       boolean cancelled
) {

    /** @param finalEquities one value per completed path; empty when cancelled before any path ran */
    public static MonteCarloReport of(int requestedPaths, double initialBalance, double priceNoiseStd,
                                      List<Double> finalEquities, boolean cancelled) {
        if (finalEquities.isEmpty()) {
            return new MonteCarloReport(requestedPaths, 0, initialBalance, priceNoiseStd,
                0, 0, 0, 0, 0, 0, 0, 0, 0, 0, cancelled);
        }
        double[] values = finalEquities.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(values);
        DescriptiveStatistics stats = new DescriptiveStatistics(values);

        double p5 = percentile.evaluate(5);
        return new MonteCarloReport(requestedPaths, values.length, initialBalance, priceNoiseStd,
            p5, percentile.evaluate(25), percentile.evaluate(50), percentile.evaluate(75), percentile.evaluate(95),
            initialBalance - p5,
            (stats.getMean() - initialBalance) / initialBalance,
            stats.getMin(), stats.getMax(),
            Math.sqrt(stats.getPopulationVariance()),
            cancelled);
    }
}
