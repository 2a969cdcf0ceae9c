package com.feedbackengine.common.model;

/**
 * Market condition label attached to trade outcomes and used to select the
 * regime multiplier inside {@link com.feedbackengine.common.weights.ThompsonSamplingWeightOptimizer}.
 * {@link #UNKNOWN} carries no multiplier.
 */
public enum MarketRegime {
    TRENDING,
    RANGING,
    VOLATILE,
    UNKNOWN;

    public boolean isTracked() {
        return this != UNKNOWN;
    }
}
