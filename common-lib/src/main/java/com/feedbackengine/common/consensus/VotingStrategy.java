package com.feedbackengine.common.consensus;

import com.feedbackengine.common.model.ProviderVote;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Contract for combining valid provider votes into one action.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: safe to call concurrently</li>
 *   <li><b>Pure</b>: no logging, no side effects</li>
 *   <li><b>Honest</b>: return {@link Optional#empty()} when their precondition does not
 *       hold, so the aggregator can fall through to the next tier</li>
 * </ul>
 *
 * <p>Votes arrive already validated, de-duplicated and sorted by provider priority;
 * weights are normalized over exactly those providers.
 */
public interface VotingStrategy {

    String name();

    Optional<StrategyOutcome> apply(List<ProviderVote> votes, Map<String, Double> weights);
}
