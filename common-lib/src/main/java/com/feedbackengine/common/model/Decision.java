package com.feedbackengine.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * A finalized trade recommendation.
 *
 * <p>{@code signalOnly} is the discriminant for the two shapes a decision can take:
 * <ul>
 *   <li>{@code signalOnly = false}: sized decision; {@code sizing} is populated for
 *       BUY/SELL and {@code null} only for HOLD</li>
 *   <li>{@code signalOnly = true}: action and confidence only; {@code sizing} is
 *       always {@code null} (never zero-filled)</li>
 * </ul>
 *
 * <p>Created by the aggregator + sizer, transitioned exactly once by
 * {@link #withExecution(ExecutionResult)}.
 */
public record Decision(
    @JsonProperty("id")                String id,
    @JsonProperty("assetPair")         String assetPair,
    @JsonProperty("timestamp")         Instant timestamp,
    @JsonProperty("action")            TradeAction action,
    @JsonProperty("confidence")        double confidence,
    @JsonProperty("positionType")      PositionType positionType,
    @JsonProperty("sizing")            PositionSizing sizing,
    @JsonProperty("aggregationTier")   AggregationTier aggregationTier,
    @JsonProperty("contributingVotes") List<ProviderVote> contributingVotes,
    @JsonProperty("signalOnly")        boolean signalOnly,
    @JsonProperty("reasoning")         String reasoning,
    @JsonProperty("execution")         ExecutionResult execution
) {

    public Decision {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Decision id must not be blank");
        }
        if (action == null) {
            throw new IllegalArgumentException("Decision action must not be null. id=" + id);
        }
        if (!Double.isFinite(confidence) || confidence < 0.0 || confidence > 100.0) {
            throw new IllegalArgumentException("Decision confidence out of [0,100]: " + confidence + " id=" + id);
        }
        if (signalOnly && sizing != null) {
            throw new IllegalArgumentException("Signal-only decision must not carry sizing. id=" + id);
        }
        if (positionType != PositionType.fromAction(action)) {
            throw new IllegalArgumentException("Position type " + positionType + " inconsistent with " + action);
        }
        contributingVotes = contributingVotes == null ? List.of() : List.copyOf(contributingVotes);
    }

    public static Decision sized(String id, String assetPair, Instant timestamp, TradeAction action,
                                 double confidence, PositionSizing sizing, AggregationTier tier,
                                 List<ProviderVote> votes, String reasoning) {
        return new Decision(id, assetPair, timestamp, action, confidence, PositionType.fromAction(action),
            sizing, tier, votes, false, reasoning, null);
    }

    public static Decision signalOnly(String id, String assetPair, Instant timestamp, TradeAction action,
                                      double confidence, AggregationTier tier,
                                      List<ProviderVote> votes, String reasoning) {
        return new Decision(id, assetPair, timestamp, action, confidence, PositionType.fromAction(action),
            null, tier, votes, true, reasoning, null);
    }

    /**
     * Records the execution result. A decision is executed at most once.
     *
     * @throws IllegalStateException when an execution result is already attached
     */
    public Decision withExecution(ExecutionResult result) {
        if (execution != null) {
            throw new IllegalStateException("Decision already executed. id=" + id);
        }
        return new Decision(id, assetPair, timestamp, action, confidence, positionType, sizing,
            aggregationTier, contributingVotes, signalOnly, reasoning, result);
    }

    @JsonIgnore
    public boolean isActionable() {
        return !signalOnly && action.isDirectional() && sizing != null && sizing.recommendedPositionSize() > 0;
    }

    @JsonIgnore
    public Double recommendedPositionSize() {
        return sizing != null ? sizing.recommendedPositionSize() : null;
    }

    @JsonIgnore
    public Double entryPrice() {
        return sizing != null ? sizing.entryPrice() : null;
    }
}
