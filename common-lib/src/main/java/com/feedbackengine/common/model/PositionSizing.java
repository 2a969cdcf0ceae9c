package com.feedbackengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Concrete sizing attached to a non-signal-only {@link Decision}.
 *
 * @param stopLossPct  fraction of entry price (0.02 = 2%)
 * @param riskPct      fraction of balance risked (0.01 = 1%)
 * @param stopLossPrice absolute stop level derived from entry and direction, {@code null} for HOLD
 */
public record PositionSizing(
    @JsonProperty("recommendedPositionSize") double recommendedPositionSize,
    @JsonProperty("entryPrice")              double entryPrice,
    @JsonProperty("stopLossPct")             double stopLossPct,
    @JsonProperty("riskPct")                 double riskPct,
    @JsonProperty("stopLossPrice")           Double stopLossPrice
) {

    public double notional() {
        return recommendedPositionSize * entryPrice;
    }
}
