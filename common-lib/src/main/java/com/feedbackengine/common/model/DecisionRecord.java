package com.feedbackengine.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Durable persisted form of a decision plus its risk verdict.
 *
 * <p>Field presence is part of the contract: for signal-only decisions the sizing
 * fields are written as explicit JSON {@code null}, never as zero.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record DecisionRecord(
    @JsonProperty("decision_id")               String decisionId,
    @JsonProperty("asset_pair")                String assetPair,
    @JsonProperty("timestamp")                 Instant timestamp,
    @JsonProperty("action")                    TradeAction action,
    @JsonProperty("confidence")                double confidence,
    @JsonProperty("position_type")             PositionType positionType,
    @JsonProperty("recommended_position_size") Double recommendedPositionSize,
    @JsonProperty("entry_price")               Double entryPrice,
    @JsonProperty("stop_loss_percentage")      Double stopLossPercentage,
    @JsonProperty("risk_percentage")           Double riskPercentage,
    @JsonProperty("signal_only")               boolean signalOnly,
    @JsonProperty("aggregation_tier")          int aggregationTier,
    @JsonProperty("risk_allowed")              boolean riskAllowed,
    @JsonProperty("risk_verdict_reason")       String riskVerdictReason
) {

    public static DecisionRecord from(Decision decision, RiskVerdict verdict) {
        PositionSizing sizing = decision.sizing();
        return new DecisionRecord(
            decision.id(),
            decision.assetPair(),
            decision.timestamp(),
            decision.action(),
            decision.confidence(),
            decision.positionType(),
            sizing != null ? sizing.recommendedPositionSize() : null,
            sizing != null ? sizing.entryPrice() : null,
            sizing != null ? sizing.stopLossPct() : null,
            sizing != null ? sizing.riskPct() : null,
            decision.signalOnly(),
            decision.aggregationTier() != null ? decision.aggregationTier().level() : 0,
            verdict == null || verdict.allow(),
            verdict != null ? verdict.reason() : null);
    }
}
