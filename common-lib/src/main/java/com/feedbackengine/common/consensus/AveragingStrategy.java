package com.feedbackengine.common.consensus;

import com.feedbackengine.common.model.ProviderVote;
import com.feedbackengine.common.model.TradeAction;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tier 3. The action with the highest summed confidence wins (ties by priority);
 * confidence and suggested amount are averaged across all valid votes. Needs at
 * least two votes.
 */
public class AveragingStrategy implements VotingStrategy {

    @Override
    public String name() {
        return "AVERAGE";
    }

    @Override
    public Optional<StrategyOutcome> apply(List<ProviderVote> votes, Map<String, Double> weights) {
        if (votes.size() < 2) return Optional.empty();

        Map<TradeAction, Double> summed = new EnumMap<>(TradeAction.class);
        for (ProviderVote vote : votes) {
            summed.merge(vote.action(), vote.confidence(), Double::sum);
        }
        TradeAction winner = VoteMath.argmaxByPriority(summed, votes);

        return Optional.of(new StrategyOutcome(winner, VoteMath.meanConfidence(votes), summed,
            VoteMath.meanSuggestedAmount(votes)));
    }
}
