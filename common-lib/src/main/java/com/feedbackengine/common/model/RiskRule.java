package com.feedbackengine.common.model;

/** Rule of the risk pipeline that produced a denial (or a warning). */
public enum RiskRule {
    MARKET_SCHEDULE,
    DATA_FRESHNESS,
    CORRELATION,
    DRAWDOWN,
    VALUE_AT_RISK,
    VOLATILITY_CONFIDENCE,
    EXPOSURE_RESERVATION,
    IN_FLIGHT
}
