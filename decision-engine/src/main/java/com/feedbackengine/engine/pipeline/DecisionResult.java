package com.feedbackengine.engine.pipeline;

import com.feedbackengine.common.consensus.EnsembleDraft;
import com.feedbackengine.common.model.Decision;
import com.feedbackengine.common.model.RiskVerdict;

/**
 * @param draft    the aggregated draft the decision was sized from
 * @param cacheHit {@code true} when providers were skipped
 */
public record DecisionResult(Decision decision, RiskVerdict verdict, EnsembleDraft draft, boolean cacheHit) {

    /** Approved and carrying a positive size. */
    public boolean isExecutable() {
        return verdict.allow() && decision.isActionable();
    }
}
