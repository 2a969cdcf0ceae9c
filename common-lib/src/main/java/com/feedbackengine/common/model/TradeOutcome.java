package com.feedbackengine.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Realized result of a closed position. Immutable; consumed by the weight
 * optimizer and portfolio memory.
 */
public record TradeOutcome(
    @JsonProperty("tradeId")           String tradeId,
    @JsonProperty("decisionId")        String decisionId,
    @JsonProperty("assetPair")         String assetPair,
    @JsonProperty("positionType")      PositionType positionType,
    @JsonProperty("entryTimestamp")    Instant entryTimestamp,
    @JsonProperty("exitTimestamp")     Instant exitTimestamp,
    @JsonProperty("entryPrice")        double entryPrice,
    @JsonProperty("exitPrice")         double exitPrice,
    @JsonProperty("size")              double size,
    @JsonProperty("fees")              double fees,
    @JsonProperty("realizedPnl")       double realizedPnl,
    @JsonProperty("regime")            MarketRegime regime,
    @JsonProperty("contributingVotes") List<ProviderVote> contributingVotes,
    @JsonProperty("exitReason")        String exitReason
) {

    public TradeOutcome {
        contributingVotes = contributingVotes == null ? List.of() : List.copyOf(contributingVotes);
        regime = regime == null ? MarketRegime.UNKNOWN : regime;
    }

    /**
     * Builds an outcome from entry/exit fills. P&amp;L is direction-aware and net of fees.
     */
    public static TradeOutcome close(String tradeId, Decision decision, Instant exitTimestamp,
                                     double entryPrice, double exitPrice, double size, double fees,
                                     MarketRegime regime, String exitReason) {
        double gross = decision.positionType() == PositionType.SHORT
            ? (entryPrice - exitPrice) * size
            : (exitPrice - entryPrice) * size;
        return new TradeOutcome(tradeId, decision.id(), decision.assetPair(), decision.positionType(),
            decision.timestamp(), exitTimestamp, entryPrice, exitPrice, size, fees, gross - fees,
            regime, decision.contributingVotes(), exitReason);
    }

    @JsonIgnore
    public boolean wasProfitable() {
        return realizedPnl > 0.0;
    }

    @JsonIgnore
    public double pnlPct() {
        double notional = entryPrice * size;
        return notional > 0 ? realizedPnl / notional * 100.0 : 0.0;
    }

    @JsonIgnore
    public Duration holdingPeriod() {
        if (entryTimestamp == null || exitTimestamp == null) return Duration.ZERO;
        return Duration.between(entryTimestamp, exitTimestamp);
    }
}
