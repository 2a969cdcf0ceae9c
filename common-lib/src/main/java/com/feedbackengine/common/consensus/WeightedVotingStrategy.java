package com.feedbackengine.common.consensus;

import com.feedbackengine.common.model.ProviderVote;
import com.feedbackengine.common.model.TradeAction;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Weighted voting with winning-action-only confidence.
 *
 * <pre>
 *   power_i    = weight_i × confidence_i / 100
 *   action     = argmax_a Σ power_i  (i voted a)         ties → earliest provider in priority order
 *   confidence = Σ weight_i × confidence_i / Σ weight_i  (i voted action)
 * </pre>
 *
 * <p>Example: BUY@80, BUY@60, HOLD@50 with weights 0.4, 0.4, 0.2 gives
 * BUY power 0.56 vs HOLD 0.10, confidence (32 + 24) / 0.8 = 70.0.
 *
 * <p>Inapplicable when the total voting power is zero.
 */
public class WeightedVotingStrategy implements VotingStrategy {

    @Override
    public String name() {
        return "WEIGHTED";
    }

    @Override
    public Optional<StrategyOutcome> apply(List<ProviderVote> votes, Map<String, Double> weights) {
        if (votes.isEmpty()) return Optional.empty();

        Map<TradeAction, Double> power = new EnumMap<>(TradeAction.class);
        double totalPower = 0.0;
        for (ProviderVote vote : votes) {
            double p = weights.getOrDefault(vote.providerId(), 0.0) * vote.confidence() / 100.0;
            power.merge(vote.action(), p, Double::sum);
            totalPower += p;
        }
        if (totalPower <= 0.0) return Optional.empty();

        TradeAction winner = VoteMath.argmaxByPriority(power, votes);

        double weightSum = 0.0;
        double weightedConfidence = 0.0;
        for (ProviderVote vote : votes) {
            if (vote.action() != winner) continue;
            double w = weights.getOrDefault(vote.providerId(), 0.0);
            weightSum += w;
            weightedConfidence += w * vote.confidence();
        }
        double confidence = weightSum > 0 ? weightedConfidence / weightSum : 0.0;

        return Optional.of(new StrategyOutcome(winner, confidence, power, VoteMath.meanSuggestedAmount(votes)));
    }
}
