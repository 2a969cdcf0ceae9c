package com.feedbackengine.common.consensus;

import com.feedbackengine.common.model.ProviderVote;
import com.feedbackengine.common.model.TradeAction;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One vote per provider; the action with a strict plurality wins. Confidence is the
 * mean confidence of the winning votes. Needs at least two votes; a tied top count
 * is inconclusive.
 */
public class MajorityVotingStrategy implements VotingStrategy {

    @Override
    public String name() {
        return "MAJORITY";
    }

    @Override
    public Optional<StrategyOutcome> apply(List<ProviderVote> votes, Map<String, Double> weights) {
        if (votes.size() < 2) return Optional.empty();

        Map<TradeAction, Integer> counts = new EnumMap<>(TradeAction.class);
        for (ProviderVote vote : votes) {
            counts.merge(vote.action(), 1, Integer::sum);
        }

        int top = counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        List<TradeAction> leaders = counts.entrySet().stream()
            .filter(e -> e.getValue() == top)
            .map(Map.Entry::getKey)
            .toList();
        if (leaders.size() != 1) return Optional.empty();

        TradeAction winner = leaders.get(0);
        List<ProviderVote> winning = votes.stream().filter(v -> v.action() == winner).toList();

        Map<TradeAction, Double> ratios = new EnumMap<>(TradeAction.class);
        counts.forEach((action, count) -> ratios.put(action, count / (double) votes.size()));

        return Optional.of(new StrategyOutcome(winner, VoteMath.meanConfidence(winning), ratios,
            VoteMath.meanSuggestedAmount(votes)));
    }
}
