package com.feedbackengine.common.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Metrics of one replay run or window.
 *
 * @param netReturn   (final − initial) / initial
 * @param maxDrawdown largest peak-to-trough fall of the equity curve, as a fraction of the peak
 */
public record PerformanceReport(
    @JsonProperty("initialEquity") double initialEquity,
    @JsonProperty("finalEquity")   double finalEquity,
    @JsonProperty("netReturn")     double netReturn,
    @JsonProperty("sharpe")        double sharpe,
    @JsonProperty("maxDrawdown")   double maxDrawdown,
    @JsonProperty("winRate")       double winRate,
    @JsonProperty("trades")        int trades
) {}
