package com.feedbackengine.common.model;

/**
 * Direction of an opened position. HOLD decisions carry no position type ({@code null}).
 */
public enum PositionType {

    LONG,
    SHORT;

    /** Derives the position type from an action; {@code null} for HOLD. */
    public static PositionType fromAction(TradeAction action) {
        if (action == TradeAction.BUY)  return LONG;
        if (action == TradeAction.SELL) return SHORT;
        return null;
    }

    public TradeAction closingAction() {
        return this == LONG ? TradeAction.SELL : TradeAction.BUY;
    }
}
