package com.feedbackengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** An open position held by the portfolio. */
public record Holding(
    @JsonProperty("assetPair")    String assetPair,
    @JsonProperty("positionType") PositionType positionType,
    @JsonProperty("size")         double size,
    @JsonProperty("entryPrice")   double entryPrice
) {

    public double notional() {
        return Math.abs(size) * entryPrice;
    }
}
