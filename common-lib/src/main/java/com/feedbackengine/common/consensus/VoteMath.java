package com.feedbackengine.common.consensus;

import com.feedbackengine.common.model.ProviderVote;
import com.feedbackengine.common.model.TradeAction;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/** Small helpers shared by the strategies. */
final class VoteMath {

    private VoteMath() {}

    /** Relative tolerance under which two summed scores count as tied. */
    static final double TIE_EPSILON = 1e-9;

    /**
     * Action with the highest score. On a tie (within {@link #TIE_EPSILON}) the action
     * voted by the earliest provider in {@code votes} (priority order) wins.
     */
    static TradeAction argmaxByPriority(Map<TradeAction, Double> scores, List<ProviderVote> votes) {
        double best = scores.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double tolerance = TIE_EPSILON * Math.max(1.0, Math.abs(best));
        for (ProviderVote vote : votes) {
            Double score = scores.get(vote.action());
            if (score != null && best - score <= tolerance) return vote.action();
        }
        return votes.get(0).action();
    }

    static Double meanSuggestedAmount(List<ProviderVote> votes) {
        OptionalDouble mean = votes.stream()
            .map(ProviderVote::suggestedAmount)
            .filter(Objects::nonNull)
            .mapToDouble(Double::doubleValue)
            .average();
        return mean.isPresent() ? mean.getAsDouble() : null;
    }

    static double meanConfidence(List<ProviderVote> votes) {
        return votes.stream().mapToDouble(ProviderVote::confidence).average().orElse(0.0);
    }
}
