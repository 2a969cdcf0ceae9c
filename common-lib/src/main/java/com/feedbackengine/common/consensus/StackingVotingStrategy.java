package com.feedbackengine.common.consensus;

import com.feedbackengine.common.model.ProviderVote;
import com.feedbackengine.common.model.TradeAction;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stacking over vote meta-features with a logistic-regression meta-learner.
 *
 * <pre>
 *   features   = [buy_ratio, sell_ratio, hold_ratio, mean(confidence), std(confidence)]
 *   p          = softmax(W · scale(features) + b)
 *   action     = argmax p
 *   confidence = max p × 100
 * </pre>
 *
 * <p>Needs at least two votes and a model; {@code std} is the population standard deviation.
 */
public class StackingVotingStrategy implements VotingStrategy {

    private final StackingModel model;

    public StackingVotingStrategy(StackingModel model) {
        this.model = model;
    }

    @Override
    public String name() {
        return "STACKING";
    }

    @Override
    public Optional<StrategyOutcome> apply(List<ProviderVote> votes, Map<String, Double> weights) {
        if (model == null || votes.size() < 2) return Optional.empty();

        double[] proba = model.predictProba(metaFeatures(votes));

        Map<TradeAction, Double> scores = new EnumMap<>(TradeAction.class);
        int best = 0;
        for (int k = 0; k < proba.length; k++) {
            scores.merge(model.classes().get(k), proba[k], Double::sum);
            if (proba[k] > proba[best]) best = k;
        }
        return Optional.of(new StrategyOutcome(model.classes().get(best), proba[best] * 100.0, scores,
            VoteMath.meanSuggestedAmount(votes)));
    }

    static double[] metaFeatures(List<ProviderVote> votes) {
        int n = votes.size();
        long buys  = votes.stream().filter(v -> v.action() == TradeAction.BUY).count();
        long sells = votes.stream().filter(v -> v.action() == TradeAction.SELL).count();
        long holds = n - buys - sells;
        double mean = VoteMath.meanConfidence(votes);
        double variance = votes.stream()
            .mapToDouble(v -> (v.confidence() - mean) * (v.confidence() - mean))
            .sum() / n;
        return new double[] {
            buys / (double) n, sells / (double) n, holds / (double) n, mean, Math.sqrt(variance)
        };
    }
}
