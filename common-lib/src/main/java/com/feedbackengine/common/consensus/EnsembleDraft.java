package com.feedbackengine.common.consensus;

import com.feedbackengine.common.model.AggregationTier;
import com.feedbackengine.common.model.ProviderVote;
import com.feedbackengine.common.model.TradeAction;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Unsized decision produced by {@link EnsembleAggregator}.
 *
 * @param strategy     name of the strategy that produced the action at {@code tier}
 * @param votes        valid votes in provider priority order
 * @param weights      normalized weights actually used
 * @param droppedVotes number of invalid votes discarded before tiering
 */
public record EnsembleDraft(
    @JsonProperty("assetPair")       String assetPair,
    @JsonProperty("action")          TradeAction action,
    @JsonProperty("confidence")      double confidence,
    @JsonProperty("tier")            AggregationTier tier,
    @JsonProperty("strategy")        String strategy,
    @JsonProperty("votes")           List<ProviderVote> votes,
    @JsonProperty("weights")         Map<String, Double> weights,
    @JsonProperty("scores")          Map<TradeAction, Double> scores,
    @JsonProperty("suggestedAmount") Double suggestedAmount,
    @JsonProperty("reasoning")       String reasoning,
    @JsonProperty("droppedVotes")    int droppedVotes
) {

    public EnsembleDraft {
        votes   = votes == null ? List.of() : List.copyOf(votes);
        weights = weights == null ? Map.of() : Map.copyOf(weights);
        scores  = scores == null ? Map.of() : Map.copyOf(scores);
    }
}
