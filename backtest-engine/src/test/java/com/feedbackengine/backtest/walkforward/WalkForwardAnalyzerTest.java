package com.feedbackengine.backtest.walkforward;

import com.feedbackengine.backtest.ReplayFixtures;
import com.feedbackengine.backtest.replay.BacktestReplayEngine;
import com.feedbackengine.backtest.replay.BacktestResult;
import com.feedbackengine.backtest.replay.BacktestSettings;
import com.feedbackengine.backtest.replay.BacktestValidationException;
import com.feedbackengine.backtest.replay.CancellationToken;
import com.feedbackengine.backtest.replay.FillSimulator;
import com.feedbackengine.common.model.MarketSnapshot;
import com.feedbackengine.engine.feedback.OutcomeFeedbackService;
import com.feedbackengine.engine.logger.DecisionFlowLogger;
import com.feedbackengine.engine.pipeline.DecisionSession;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WalkForwardAnalyzerTest {

    /** Records the memory state each replay starts from. */
    static class RecordingEngine extends BacktestReplayEngine {

        record Call(int memorySize, boolean readonly, int snapshots) {}

        final List<Call> calls = new ArrayList<>();

        RecordingEngine() {
            super(ReplayFixtures.pipeline(), new OutcomeFeedbackService(new DecisionFlowLogger()),
                new FillSimulator(0.0005, 0.001), BacktestSettings.crypto(10_000.0));
        }

        @Override
        public BacktestResult replay(DecisionSession session, List<MarketSnapshot> snapshots) {
            calls.add(new Call(session.memory().size(), session.memory().isReadonly(), snapshots.size()));
            return super.replay(session, snapshots);
        }
    }

    /** BUY on every third bar, SELL two bars later: a trade roughly every three bars. */
    private static List<MarketSnapshot> cycling(int n) {
        List<MarketSnapshot> bars = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            int signal = i % 3 == 0 ? 1 : i % 3 == 2 ? -1 : 0;
            bars.add(ReplayFixtures.bar(i, 100 + i, signal));
        }
        return bars;
    }

    // ── Isolation ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("Window isolation")
    class IsolationTests {

        @Test
        @DisplayName("train learns, test is read-only, and every window starts from the same memory")
        void trainThenFrozenTest() {
            RecordingEngine engine = new RecordingEngine();
            WalkForwardAnalyzer analyzer = new WalkForwardAnalyzer(engine,
                new WalkForwardSplitter(10, 0.6, 0), Clock.systemUTC());

            WalkForwardReport report = analyzer.analyze(ReplayFixtures.session(1L), cycling(18), 7L);

            assertEquals(3, report.windows().size());
            assertEquals(6, engine.calls.size());
            for (int w = 0; w < 3; w++) {
                RecordingEngine.Call train = engine.calls.get(2 * w);
                RecordingEngine.Call test  = engine.calls.get(2 * w + 1);
                assertFalse(train.readonly());
                assertEquals(0, train.memorySize(), "window " + w + " saw a previous window's trades");
                assertEquals(6, train.snapshots());
                assertTrue(test.readonly());
                assertEquals(4, test.snapshots());
            }
            assertTrue(engine.calls.get(1).memorySize() > 0, "train range produced no trades");
        }

        @Test
        @DisplayName("the caller's session is untouched")
        void baseUntouched() {
            DecisionSession base = ReplayFixtures.session(1L);
            WalkForwardAnalyzer analyzer = new WalkForwardAnalyzer(new RecordingEngine(),
                new WalkForwardSplitter(10, 0.6, 0), Clock.systemUTC());

            analyzer.analyze(base, cycling(18), 7L);

            assertEquals(0, base.memory().size());
            assertFalse(base.memory().isReadonly());
            assertEquals(0, base.optimizer().state("alpha").observations());
            assertEquals(0, base.inFlight().size());
        }

        @Test
        @DisplayName("a cancelled token stops before the first window")
        void cancelled() {
            CancellationToken token = new CancellationToken();
            token.cancel();
            RecordingEngine engine = new RecordingEngine();
            WalkForwardAnalyzer analyzer = new WalkForwardAnalyzer(engine,
                new WalkForwardSplitter(10, 0.6, 0), Clock.systemUTC());

            WalkForwardReport report = analyzer.analyze(ReplayFixtures.session(1L), cycling(18), 7L, token);

            assertTrue(report.cancelled());
            assertTrue(report.windows().isEmpty());
            assertTrue(engine.calls.isEmpty());
        }

        @Test
        @DisplayName("not enough data for one window → validation error")
        void noWindows() {
            WalkForwardAnalyzer analyzer = new WalkForwardAnalyzer(new RecordingEngine(),
                new WalkForwardSplitter(10, 0.6, 0), Clock.systemUTC());

            assertThrows(BacktestValidationException.class,
                () -> analyzer.analyze(ReplayFixtures.session(1L), cycling(5), 7L));
        }
    }

    // ── Ratios and severity ─────────────────────────────────────────────

    @Nested
    @DisplayName("Ratios")
    class RatioTests {

        @Test
        @DisplayName("sharpe ratio covers sign combinations")
        void sharpeRatio() {
            assertEquals(0.5, WalkForwardAnalyzer.sharpeRatio(2.0, 1.0), 1e-12);
            assertEquals(0.5, WalkForwardAnalyzer.sharpeRatio(-1.0, -2.0), 1e-12);
            assertEquals(1.0, WalkForwardAnalyzer.sharpeRatio(-1.0, 0.5), 1e-12);
            assertEquals(0.0, WalkForwardAnalyzer.sharpeRatio(0.0, 1.0), 1e-12);
        }

        @Test
        @DisplayName("win rate ratio with zero train win rate → 0")
        void winRateRatio() {
            assertEquals(0.75, WalkForwardAnalyzer.winRateRatio(0.8, 0.6), 1e-12);
            assertEquals(0.0, WalkForwardAnalyzer.winRateRatio(0.0, 0.6), 1e-12);
        }

        @Test
        @DisplayName("severity thresholds and worst-of")
        void severity() {
            assertEquals(OverfittingSeverity.NONE, OverfittingSeverity.classify(0.9));
            assertEquals(OverfittingSeverity.LOW, OverfittingSeverity.classify(0.8));
            assertEquals(OverfittingSeverity.MEDIUM, OverfittingSeverity.classify(0.4));
            assertEquals(OverfittingSeverity.HIGH, OverfittingSeverity.classify(0.3));
            assertEquals(OverfittingSeverity.MEDIUM,
                OverfittingSeverity.worst(OverfittingSeverity.LOW, OverfittingSeverity.MEDIUM));
            assertTrue(OverfittingSeverity.MEDIUM.isOverfit());
            assertFalse(OverfittingSeverity.LOW.isOverfit());
        }

        @Test
        @DisplayName("empty report → zero averages, HIGH severity")
        void emptyReport() {
            WalkForwardReport report = WalkForwardAnalyzer.report(List.of(), true);

            assertEquals(0.0, report.averageSharpeRatio(), 1e-12);
            assertEquals(OverfittingSeverity.HIGH, report.severity());
            assertTrue(report.overfittingDetected());
        }
    }
}
