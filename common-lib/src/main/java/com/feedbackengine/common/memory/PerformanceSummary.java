package com.feedbackengine.common.memory;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate view over all recorded outcomes.
 *
 * @param profitFactor gross profit / gross loss; {@code null} when there are no losing trades
 * @param maxDrawdown  largest peak-to-trough fall of cumulative realized P&amp;L (currency units)
 * @param sharpe       mean / standard deviation of per-trade return %, not annualized
 */
public record PerformanceSummary(
    @JsonProperty("totalTrades")  int totalTrades,
    @JsonProperty("wins")         int wins,
    @JsonProperty("losses")       int losses,
    @JsonProperty("winRate")      double winRate,
    @JsonProperty("totalPnl")     double totalPnl,
    @JsonProperty("averagePnl")   double averagePnl,
    @JsonProperty("profitFactor") Double profitFactor,
    @JsonProperty("maxDrawdown")  double maxDrawdown,
    @JsonProperty("sharpe")       double sharpe
) {

    public static PerformanceSummary empty() {
        return new PerformanceSummary(0, 0, 0, 0.0, 0.0, 0.0, null, 0.0, 0.0);
    }
}
