package com.feedbackengine.common.model;

/**
 * Action a provider or the ensemble recommends. Declaration order is also the
 * deterministic fallback order when no provider priority can break a tie.
 */
public enum TradeAction {
    BUY,
    SELL,
    HOLD;

    public boolean isDirectional() {
        return this != HOLD;
    }

    /** Lenient parse used for provider payloads; unknown values map to {@code null}. */
    public static TradeAction parse(String value) {
        if (value == null) return null;
        try {
            return TradeAction.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
