package com.feedbackengine.common.memory;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Running record of how often a provider's vote matched the realized result.
 * A vote is correct when it backed a profitable trade or opposed a losing one.
 */
public record ProviderPerformance(
    @JsonProperty("providerId") String providerId,
    @JsonProperty("trades")     int trades,
    @JsonProperty("correct")    int correct,
    @JsonProperty("totalPnl")   double totalPnl
) {

    public static ProviderPerformance empty(String providerId) {
        return new ProviderPerformance(providerId, 0, 0, 0.0);
    }

    public ProviderPerformance record(boolean wasCorrect, double pnl) {
        return new ProviderPerformance(providerId, trades + 1, correct + (wasCorrect ? 1 : 0), totalPnl + pnl);
    }

    @JsonIgnore
    public double accuracy() {
        return trades > 0 ? correct / (double) trades : 0.0;
    }
}
