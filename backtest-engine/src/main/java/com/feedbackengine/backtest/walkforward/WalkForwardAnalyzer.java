package com.feedbackengine.backtest.walkforward;

import com.feedbackengine.backtest.replay.BacktestReplayEngine;
import com.feedbackengine.backtest.replay.BacktestResult;
import com.feedbackengine.backtest.replay.BacktestValidationException;
import com.feedbackengine.backtest.replay.CancellationToken;
import com.feedbackengine.common.memory.PortfolioMemorySnapshot;
import com.feedbackengine.common.metrics.PerformanceReport;
import com.feedbackengine.common.model.MarketSnapshot;
import com.feedbackengine.common.model.ProviderWeightState;
import com.feedbackengine.engine.pipeline.DecisionSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Walk-forward validation. Each window runs on a private fork of the given session:
 * <pre>
 *   snapshot(memory, weights) → replay train (learns) → memory read-only → replay test
 *     → metrics → restore(memory, weights)
 * </pre>
 * so nothing learned in one window is visible to the next, and the test range never
 * writes to memory.
 *
 * <p>Ratios per window (test over train):
 * <pre>
 *   sharpe:   train &gt; 0 → test/train;  both &lt; 0 → train/test;  train &lt; 0 ≤ test → 1.0;  train = 0 → 0.0
 *   win rate: train ≠ 0 → test/train, else 0.0
 * </pre>
 * Severity is the worse of the two classifications of the averaged ratios.
 */
public class WalkForwardAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(WalkForwardAnalyzer.class);

    private final BacktestReplayEngine engine;
    private final WalkForwardSplitter splitter;
    private final Clock clock;

    public WalkForwardAnalyzer(BacktestReplayEngine engine, WalkForwardSplitter splitter, Clock clock) {
        this.engine   = engine;
        this.splitter = splitter;
        this.clock    = clock;
    }

    public WalkForwardReport analyze(DecisionSession base, List<MarketSnapshot> snapshots, long seed) {
        return analyze(base, snapshots, seed, CancellationToken.none());
    }

    public WalkForwardReport analyze(DecisionSession base, List<MarketSnapshot> snapshots, long seed,
                                     CancellationToken token) {
        BacktestReplayEngine.validateChronology(snapshots);
        List<BacktestWindow> windows = splitter.split(snapshots);
        if (windows.isEmpty()) {
            throw new BacktestValidationException(snapshots.size(), "No walk-forward windows: "
                + snapshots.size() + " snapshots, window " + (splitter.trainSize() + splitter.testSize()));
        }
        log.info("[WalkForward] Starting. session={} windows={} train={} test={} step={}",
            base.name(), windows.size(), splitter.trainSize(), splitter.testSize(), splitter.step());

        DecisionSession work = base.fork(base.name() + "-walk-forward", base.memory().snapshot(), seed, clock);
        List<WindowResult> results = new ArrayList<>();
        boolean cancelled = false;
        for (BacktestWindow window : windows) {
            if (token.isCancelled()) {
                cancelled = true;
                log.info("[WalkForward] Cancelled before window={}", window.index());
                break;
            }
            results.add(runWindow(work, window));
        }
        return report(results, cancelled);
    }

    private WindowResult runWindow(DecisionSession work, BacktestWindow window) {
        PortfolioMemorySnapshot memory = work.memory().snapshot();
        Map<String, ProviderWeightState> weights = work.optimizer().stateSnapshot();
        try {
            work.memory().setReadonly(false);
            BacktestResult train = engine.replay(work, window.train());
            work.memory().setReadonly(true);
            BacktestResult test = engine.replay(work, window.test());

            PerformanceReport trainMetrics = train.metrics();
            PerformanceReport testMetrics  = test.metrics();
            WindowResult result = new WindowResult(window.index(),
                window.trainStart(), window.trainEnd(), window.testStart(), window.testEnd(),
                trainMetrics, testMetrics,
                sharpeRatio(trainMetrics.sharpe(), testMetrics.sharpe()),
                winRateRatio(trainMetrics.winRate(), testMetrics.winRate()));
            log.info("[WalkForward] Window done. window={} trainSharpe={} testSharpe={} trainWinRate={} testWinRate={}",
                window.index(), trainMetrics.sharpe(), testMetrics.sharpe(), trainMetrics.winRate(), testMetrics.winRate());
            return result;
        } finally {
            work.memory().restore(memory);
            work.optimizer().restore(weights);
            work.inFlight().clear();
            work.gatekeeper().reservations().clearAll();
        }
    }

    static double sharpeRatio(double train, double test) {
        if (train > 0) return test / train;
        if (train < 0 && test < 0) return train / test;
        if (train < 0) return 1.0;
        return 0.0;
    }

    static double winRateRatio(double train, double test) {
        return train != 0 ? test / train : 0.0;
    }

    static WalkForwardReport report(List<WindowResult> windows, boolean cancelled) {
        double testSharpe = windows.stream().mapToDouble(w -> w.test().sharpe()).average().orElse(0.0);
        double testReturn = windows.stream().mapToDouble(w -> w.test().netReturn()).average().orElse(0.0);
        double testWinRate = windows.stream().mapToDouble(w -> w.test().winRate()).average().orElse(0.0);
        double sharpeRatio = windows.stream().mapToDouble(WindowResult::sharpeRatio).average().orElse(0.0);
        double winRateRatio = windows.stream().mapToDouble(WindowResult::winRateRatio).average().orElse(0.0);

        OverfittingSeverity sharpeSeverity  = OverfittingSeverity.classify(sharpeRatio);
        OverfittingSeverity winRateSeverity = OverfittingSeverity.classify(winRateRatio);
        OverfittingSeverity severity        = OverfittingSeverity.worst(sharpeSeverity, winRateSeverity);
        log.info("[WalkForward] Complete. windows={} avgTestSharpe={} sharpeRatio={} winRateRatio={} severity={}",
            windows.size(), testSharpe, sharpeRatio, winRateRatio, severity);

        return new WalkForwardReport(windows, testSharpe, testReturn, testWinRate, sharpeRatio, winRateRatio,
            sharpeSeverity, winRateSeverity, severity, severity.recommendation(), cancelled);
    }
}
