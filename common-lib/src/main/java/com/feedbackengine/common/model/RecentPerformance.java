package com.feedbackengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Trailing portfolio performance used by the drawdown / VaR step.
 *
 * @param trailingDrawdown current peak-to-trough drawdown as a fraction (0.12 = 12%)
 * @param returns          per-period portfolio returns, oldest first
 */
public record RecentPerformance(
    @JsonProperty("trailingDrawdown") double trailingDrawdown,
    @JsonProperty("returns")          List<Double> returns
) {

    public RecentPerformance {
        returns = returns == null ? List.of() : List.copyOf(returns);
    }

    public static RecentPerformance none() {
        return new RecentPerformance(0.0, List.of());
    }
}
