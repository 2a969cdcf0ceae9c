package com.feedbackengine.common.consensus;

import com.feedbackengine.common.model.TradeAction;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Result of one voting strategy over the valid votes.
 *
 * @param scores          per-action score the strategy ranked by (power, count ratio, probability, ...)
 * @param suggestedAmount mean provider size hint, {@code null} when no vote carried one
 */
public record StrategyOutcome(
    TradeAction action,
    double confidence,
    Map<TradeAction, Double> scores,
    Double suggestedAmount
) {

    public StrategyOutcome {
        confidence = Math.max(0.0, Math.min(100.0, confidence));
        EnumMap<TradeAction, Double> copy = new EnumMap<>(TradeAction.class);
        if (scores != null) copy.putAll(scores);
        scores = Collections.unmodifiableMap(copy);
    }
}
