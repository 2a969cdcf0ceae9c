package com.feedbackengine.common.consensus;

import com.feedbackengine.common.model.ProviderVote;
import com.feedbackengine.common.model.TradeAction;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Tier 4. The single most confident vote; ties go to the higher-priority provider. */
public class HighestConfidenceStrategy implements VotingStrategy {

    @Override
    public String name() {
        return "SINGLE_BEST";
    }

    @Override
    public Optional<StrategyOutcome> apply(List<ProviderVote> votes, Map<String, Double> weights) {
        if (votes.isEmpty()) return Optional.empty();

        ProviderVote best = votes.get(0);
        for (ProviderVote vote : votes) {
            if (vote.confidence() > best.confidence()) best = vote;
        }
        return Optional.of(new StrategyOutcome(best.action(), best.confidence(),
            Map.of(best.action(), best.confidence()), best.suggestedAmount()));
    }
}
