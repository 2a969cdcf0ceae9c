package com.feedbackengine.backtest.learning;

/** Severity of win-rate variation across time windows. */
public enum DriftSeverity {

    LOW,
    MEDIUM,
    HIGH;

    public static DriftSeverity classify(double driftScore) {
        if (driftScore > 0.15) return HIGH;
        if (driftScore > 0.08) return MEDIUM;
        return LOW;
    }
}
