package com.feedbackengine.engine.provider;

import com.feedbackengine.common.model.MarketSnapshot;
import com.feedbackengine.common.model.ProviderVote;

/**
 * One independent source of trading votes (AI model, indicator strategy, ...).
 * Implementations may block; {@link ProviderPool} runs them on a bounded-elastic scheduler.
 */
public interface DecisionProvider {

    String providerId();

    /** @return the vote, or {@code null} to abstain */
    ProviderVote decide(MarketSnapshot snapshot);
}
