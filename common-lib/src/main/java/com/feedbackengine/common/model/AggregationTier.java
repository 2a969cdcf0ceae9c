package com.feedbackengine.common.model;

/**
 * Progressive fallback tiers of the ensemble aggregator.
 *
 * <pre>
 *   1 CONFIGURED_STRATEGY  configured strategy (weighted / majority / stacking)
 *   2 MAJORITY             one vote per provider, strict plurality
 *   3 AVERAGE              confidence averaged across all valid votes
 *   4 SINGLE_BEST          highest-confidence single vote
 * </pre>
 */
public enum AggregationTier {

    CONFIGURED_STRATEGY(1),
    MAJORITY(2),
    AVERAGE(3),
    SINGLE_BEST(4);

    private final int level;

    AggregationTier(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    public static AggregationTier ofLevel(int level) {
        for (AggregationTier tier : values()) {
            if (tier.level == level) return tier;
        }
        throw new IllegalArgumentException("Unknown aggregation tier: " + level);
    }
}
