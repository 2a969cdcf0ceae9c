package com.feedbackengine.common.consensus;

import com.feedbackengine.common.exception.InsufficientProvidersException;
import com.feedbackengine.common.model.AggregationTier;
import com.feedbackengine.common.model.ProviderVote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Combines provider votes into one {@link EnsembleDraft} through a progressive fallback.
 *
 * <h3>Tiers</h3>
 * <pre>
 *   1  configured strategy, when its own precondition holds
 *   2  majority            (≥2 votes, strict plurality)
 *   3  averaging           (≥2 votes, majority inconclusive)
 *   4  highest confidence  (≥1 vote)
 *   -  zero valid votes → InsufficientProvidersException
 * </pre>
 *
 * <h3>Preparation</h3>
 * <ol>
 *   <li>Invalid votes (null action, confidence outside [0,100], NaN) are dropped with a warning.</li>
 *   <li>Only the first vote per provider is kept.</li>
 *   <li>Votes are ordered by the configured provider priority; unlisted providers follow
 *       in provider-id order. This order breaks every tie.</li>
 *   <li>Weights: dynamic weight, else static fallback weight, else an equal share; then
 *       normalized to sum 1.0 over the surviving providers.</li>
 * </ol>
 *
 * <p>Stateless apart from its configuration; safe to share across assets and threads.
 */
public class EnsembleAggregator {

    private static final Logger log = LoggerFactory.getLogger(EnsembleAggregator.class);

    private final VotingStrategy configured;
    private final VotingStrategy majority = new MajorityVotingStrategy();
    private final VotingStrategy averaging = new AveragingStrategy();
    private final VotingStrategy highestConfidence = new HighestConfidenceStrategy();
    private final Map<String, Double> fallbackWeights;
    private final List<String> providerPriority;

    public EnsembleAggregator(VotingStrategyType strategyType,
                              Map<String, Double> fallbackWeights,
                              List<String> providerPriority,
                              StackingModel stackingModel) {
        this.configured = switch (strategyType) {
            case WEIGHTED -> new WeightedVotingStrategy();
            case MAJORITY -> majority;
            case STACKING -> new StackingVotingStrategy(stackingModel);
        };
        this.fallbackWeights  = fallbackWeights == null ? Map.of() : Map.copyOf(fallbackWeights);
        this.providerPriority = providerPriority == null ? List.of() : List.copyOf(providerPriority);
    }

    public EnsembleAggregator(VotingStrategyType strategyType) {
        this(strategyType, Map.of(), List.of(), StackingModel.defaults());
    }

    public String configuredStrategy() {
        return configured.name();
    }

    /**
     * @param dynamicWeights sampled weights by provider id, may be empty
     * @throws InsufficientProvidersException when no valid vote survives
     */
    public EnsembleDraft aggregate(String assetPair, List<ProviderVote> votes, Map<String, Double> dynamicWeights) {
        List<ProviderVote> received = votes == null ? List.of() : votes;
        List<ProviderVote> valid = prioritize(received);
        int dropped = received.size() - valid.size();
        if (dropped > 0) {
            log.warn("[Ensemble] Dropped {} invalid or duplicate vote(s). asset={}", dropped, assetPair);
        }
        if (valid.isEmpty()) {
            throw new InsufficientProvidersException(assetPair, received.size());
        }

        Map<String, Double> weights = normalizeWeights(valid, dynamicWeights);

        AggregationTier tier = AggregationTier.CONFIGURED_STRATEGY;
        VotingStrategy used = configured;
        Optional<StrategyOutcome> outcome = configured.apply(valid, weights);

        if (outcome.isEmpty() && valid.size() >= 2) {
            tier = AggregationTier.MAJORITY;
            used = majority;
            outcome = majority.apply(valid, weights);
            if (outcome.isEmpty()) {
                tier = AggregationTier.AVERAGE;
                used = averaging;
                outcome = averaging.apply(valid, weights);
            }
        }
        if (outcome.isEmpty()) {
            tier = AggregationTier.SINGLE_BEST;
            used = highestConfidence;
            outcome = highestConfidence.apply(valid, weights);
        }

        StrategyOutcome result = outcome.orElseThrow(
            () -> new InsufficientProvidersException(assetPair, received.size()));

        if (tier != AggregationTier.CONFIGURED_STRATEGY) {
            log.info("[Ensemble] Fallback to tier={} strategy={} asset={} validVotes={}",
                tier.level(), used.name(), assetPair, valid.size());
        }
        log.debug("[Ensemble] asset={} action={} confidence={} tier={}",
            assetPair, result.action(), result.confidence(), tier.level());

        return new EnsembleDraft(assetPair, result.action(), result.confidence(), tier, used.name(), valid,
            weights, result.scores(), result.suggestedAmount(),
            ReasoningComposer.compose(result.action(), used.name(), valid), dropped);
    }

    /** Valid, one-per-provider votes in priority order. */
    List<ProviderVote> prioritize(List<ProviderVote> votes) {
        Set<String> seen = new LinkedHashSet<>();
        List<ProviderVote> kept = new ArrayList<>();
        for (ProviderVote vote : votes) {
            if (vote == null || !vote.isValid()) continue;
            if (seen.add(vote.providerId())) kept.add(vote);
        }
        kept.sort(Comparator
            .comparingInt((ProviderVote v) -> priorityIndex(v.providerId()))
            .thenComparing(ProviderVote::providerId));
        return kept;
    }

    Map<String, Double> normalizeWeights(List<ProviderVote> valid, Map<String, Double> dynamicWeights) {
        double equalShare = 1.0 / valid.size();
        Map<String, Double> raw = new LinkedHashMap<>();
        for (ProviderVote vote : valid) {
            String id = vote.providerId();
            Double w = dynamicWeights != null ? dynamicWeights.get(id) : null;
            if (w == null || !Double.isFinite(w) || w < 0) w = fallbackWeights.get(id);
            if (w == null || !Double.isFinite(w) || w < 0) w = equalShare;
            raw.put(id, w);
        }
        double sum = raw.values().stream().mapToDouble(Double::doubleValue).sum();
        Map<String, Double> normalized = new LinkedHashMap<>();
        raw.forEach((id, w) -> normalized.put(id, sum > 0 ? w / sum : equalShare));
        return normalized;
    }

    private int priorityIndex(String providerId) {
        int idx = providerPriority.indexOf(providerId);
        return idx >= 0 ? idx : Integer.MAX_VALUE;
    }
}
