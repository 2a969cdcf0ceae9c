package com.feedbackengine.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * One provider's recommendation for a snapshot. Ephemeral.
 *
 * <p>The record is deliberately lenient so that a provider returning garbage can
 * still be represented; {@link #isValid()} decides whether the aggregator may use it.
 *
 * @param suggestedAmount optional provider-side size hint, {@code null} when not given
 */
public record ProviderVote(
    @JsonProperty("providerId")      String providerId,
    @JsonProperty("action")          TradeAction action,
    @JsonProperty("confidence")      double confidence,
    @JsonProperty("rationale")       String rationale,
    @JsonProperty("latency")         Duration latency,
    @JsonProperty("suggestedAmount") Double suggestedAmount
) {

    public static ProviderVote of(String providerId, TradeAction action, double confidence, String rationale) {
        return new ProviderVote(providerId, action, confidence, rationale, Duration.ZERO, null);
    }

    public ProviderVote withLatency(Duration measured) {
        return new ProviderVote(providerId, action, confidence, rationale, measured, suggestedAmount);
    }

    @JsonIgnore
    public boolean isValid() {
        return providerId != null
            && !providerId.isBlank()
            && action != null
            && Double.isFinite(confidence)
            && confidence >= 0.0
            && confidence <= 100.0
            && (suggestedAmount == null || (Double.isFinite(suggestedAmount) && suggestedAmount >= 0.0));
    }
}
