package com.feedbackengine.backtest.walkforward;

/**
 * Degradation from train to test performance, classified from a test/train ratio.
 *
 * <pre>
 *   ratio &gt; 0.8 → NONE,  &gt; 0.5 → LOW,  &gt; 0.3 → MEDIUM,  else HIGH
 * </pre>
 */
public enum OverfittingSeverity {

    NONE("Strategy shows good generalization. Safe to deploy."),
    LOW("Minor degradation in test performance. Monitor closely in live trading."),
    MEDIUM("Significant overfitting detected. Consider simplifying strategy or using more regularization."),
    HIGH("Severe overfitting. Strategy not recommended for live trading. Redesign needed.");

    private final String recommendation;

    OverfittingSeverity(String recommendation) {
        this.recommendation = recommendation;
    }

    public String recommendation() {
        return recommendation;
    }

    public boolean isOverfit() {
        return this == MEDIUM || this == HIGH;
    }

    public static OverfittingSeverity classify(double ratio) {
        if (ratio > 0.8) return NONE;
        if (ratio > 0.5) return LOW;
        if (ratio > 0.3) return MEDIUM;
        return HIGH;
    }

    public static OverfittingSeverity worst(OverfittingSeverity a, OverfittingSeverity b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
