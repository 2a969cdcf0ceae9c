package com.feedbackengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Portfolio exposure at assessment time.
 *
 * @param portfolioValue total equity, {@code null} when the balance is unavailable
 * @param openNotional   notional already committed to open positions
 */
public record ExposureSnapshot(
    @JsonProperty("portfolioValue") Double portfolioValue,
    @JsonProperty("openNotional")   double openNotional
) {

    public static ExposureSnapshot unknown() {
        return new ExposureSnapshot(null, 0.0);
    }

    public boolean hasUsableBalance() {
        return portfolioValue != null && Double.isFinite(portfolioValue) && portfolioValue > 0;
    }
}
