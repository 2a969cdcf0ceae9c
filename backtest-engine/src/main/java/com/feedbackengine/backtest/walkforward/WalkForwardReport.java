package com.feedbackengine.backtest.walkforward;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param averageSharpeRatio  mean test/train Sharpe ratio over windows
 * @param averageWinRateRatio mean test/train win-rate ratio over windows
 * @param severity            worst of the two per-metric severities
 * @param cancelled           {@code true} when the run stopped at a window boundary
 */
public record WalkForwardReport(
    @JsonProperty("windows")              List<WindowResult> windows,
    @JsonProperty("averageTestSharpe")    double averageTestSharpe,
    @JsonProperty("averageTestReturn")    double averageTestReturn,
    @JsonProperty("averageTestWinRate")   double averageTestWinRate,
    @JsonProperty("averageSharpeRatio")   double averageSharpeRatio,
    @JsonProperty("averageWinRateRatio")  double averageWinRateRatio,
    @JsonProperty("sharpeSeverity")       OverfittingSeverity sharpeSeverity,
    @JsonProperty("winRateSeverity")      OverfittingSeverity winRateSeverity,
    @JsonProperty("severity")             OverfittingSeverity severity,
    @JsonProperty("recommendation")       String recommendation,
    @JsonProperty("cancelled")            boolean cancelled
) {

    public WalkForwardReport {
        windows = List.copyOf(windows);
    }

    public boolean overfittingDetected() {
        return severity.isOverfit();
    }
}
