package com.feedbackengine.backtest.replay;

import com.feedbackengine.common.metrics.PerformanceReport;
import com.feedbackengine.common.model.TradeOutcome;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param equityCurve  initial balance followed by one mark-to-market point per snapshot
 * @param skippedSteps snapshots for which no provider produced a usable vote
 */
public record BacktestResult(
    @JsonProperty("assetPair")     String assetPair,
    @JsonProperty("metrics")       PerformanceReport metrics,
    @JsonProperty("equityCurve")   List<Double> equityCurve,
    @JsonProperty("trades")        List<TradeOutcome> trades,
    @JsonProperty("decisions")     int decisions,
    @JsonProperty("approved")      int approved,
    @JsonProperty("denied")        int denied,
    @JsonProperty("cacheHits")     int cacheHits,
    @JsonProperty("skippedSteps")  int skippedSteps
) {

    public BacktestResult {
        equityCurve = List.copyOf(equityCurve);
        trades      = List.copyOf(trades);
    }

    public double finalEquity() {
        return metrics.finalEquity();
    }
}
