package com.feedbackengine.backtest.replay;

/**
 * Cooperative cancellation for long runs. Checked only between walk-forward windows
 * and before Monte Carlo paths, where memory is in a restored state.
 */
public class CancellationToken {

    private volatile boolean cancelled;

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
