package com.feedbackengine.backtest.replay;

import com.feedbackengine.common.exception.EngineException;

/** Replay input that would break chronology (out-of-order, duplicate or mixed-asset snapshots). */
public class BacktestValidationException extends EngineException {

    private final int index;

    public BacktestValidationException(int index, String message) {
        super("Replay", message + " (snapshot index " + index + ")");
        this.index = index;
    }

    public int getIndex() {
        return index;
    }
}
