package com.feedbackengine.backtest.replay;

import java.time.Instant;

/** Progress of a running replay, safe to poll from another thread. */
public class ReplayState {

    private volatile int totalSteps;
    private volatile int currentStep;
    private volatile Instant currentTimestamp;
    private volatile double equity;
    private volatile boolean running;

    void start(int totalSteps, double initialEquity) {
        this.totalSteps  = totalSteps;
        this.currentStep = 0;
        this.equity      = initialEquity;
        this.running     = true;
    }

    void advance(int step, Instant timestamp, double equity) {
        this.currentStep      = step;
        this.currentTimestamp = timestamp;
        this.equity           = equity;
    }

    void finish(double finalEquity) {
        this.currentStep = totalSteps;
        this.equity      = finalEquity;
        this.running     = false;
    }

    public int totalSteps() {
        return totalSteps;
    }

    public int currentStep() {
        return currentStep;
    }

    public Instant currentTimestamp() {
        return currentTimestamp;
    }

    public double equity() {
        return equity;
    }

    public boolean isRunning() {
        return running;
    }

    /** Fraction of steps processed, 0.0 – 1.0. */
    public double progress() {
        int total = totalSteps;
        return total == 0 ? 0.0 : Math.min(1.0, currentStep / (double) total);
    }
}
