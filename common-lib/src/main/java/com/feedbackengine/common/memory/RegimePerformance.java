package com.feedbackengine.common.memory;

import com.feedbackengine.common.model.MarketRegime;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public record RegimePerformance(
    @JsonProperty("regime")   MarketRegime regime,
    @JsonProperty("trades")   int trades,
    @JsonProperty("wins")     int wins,
    @JsonProperty("totalPnl") double totalPnl
) {

    public static RegimePerformance empty(MarketRegime regime) {
        return new RegimePerformance(regime, 0, 0, 0.0);
    }

    public RegimePerformance record(boolean won, double pnl) {
        return new RegimePerformance(regime, trades + 1, wins + (won ? 1 : 0), totalPnl + pnl);
    }

    @JsonIgnore
    public double winRate() {
        return trades > 0 ? wins / (double) trades : 0.0;
    }
}
