package com.feedbackengine.common.consensus;

/** Strategy applied at tier 1 of the ensemble. */
public enum VotingStrategyType {
    WEIGHTED,
    MAJORITY,
    STACKING
}
