package com.feedbackengine.backtest.replay;

import com.feedbackengine.common.classifier.MarketRegimeClassifier;
import com.feedbackengine.common.exception.InsufficientProvidersException;
import com.feedbackengine.common.metrics.PerformanceMetrics;
import com.feedbackengine.common.model.Decision;
import com.feedbackengine.common.model.ExecutionResult;
import com.feedbackengine.common.model.ExposureSnapshot;
import com.feedbackengine.common.model.Holding;
import com.feedbackengine.common.model.MarketRegime;
import com.feedbackengine.common.model.MarketSnapshot;
import com.feedbackengine.common.model.PositionType;
import com.feedbackengine.common.model.RecentPerformance;
import com.feedbackengine.common.model.RiskContext;
import com.feedbackengine.common.model.TradeOutcome;
import com.feedbackengine.engine.feedback.OutcomeFeedbackService;
import com.feedbackengine.engine.pipeline.DecisionPipeline;
import com.feedbackengine.engine.pipeline.DecisionRequest;
import com.feedbackengine.engine.pipeline.DecisionResult;
import com.feedbackengine.engine.pipeline.DecisionSession;
import com.feedbackengine.engine.provider.MarketSnapshotProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Drives the live decision pipeline over historical snapshots.
 *
 * <p>Per snapshot, strictly in input order:
 * <pre>
 *   stop-loss check → regime (closes up to now only) → pipeline.decide
 *     → open (simulated fill) | close on opposite signal → mark-to-market equity
 * </pre>
 * An open position is force-closed at the last close. Every closed trade is fed back
 * through {@link OutcomeFeedbackService}, which skips learning while memory is read-only.
 *
 * <p>Input is never reordered: an out-of-order, duplicate or foreign-asset snapshot raises
 * {@link BacktestValidationException} before any step runs.
 */
public class BacktestReplayEngine {

    private static final Logger log = LoggerFactory.getLogger(BacktestReplayEngine.class);

    static final String STOP_LOSS       = "STOP_LOSS";
    static final String OPPOSITE_SIGNAL = "OPPOSITE_SIGNAL";
    static final String END_OF_DATA     = "END_OF_DATA";

    private final DecisionPipeline pipeline;
    private final OutcomeFeedbackService feedback;
    private final FillSimulator fills;
    private final BacktestSettings settings;

    public BacktestReplayEngine(DecisionPipeline pipeline, OutcomeFeedbackService feedback,
                                FillSimulator fills, BacktestSettings settings) {
        this.pipeline = pipeline;
        this.feedback = feedback;
        this.fills    = fills;
        this.settings = settings;
    }

    public BacktestSettings settings() {
        return settings;
    }

    public BacktestResult replay(DecisionSession session, List<MarketSnapshot> snapshots) {
        return replay(session, snapshots, new ReplayState());
    }

    /** Replays {@code [from, to)} as served by {@code source}. */
    public BacktestResult replay(DecisionSession session, MarketSnapshotProvider source, String assetPair,
                                 String timeframe, Instant from, Instant to) {
        if (!from.isBefore(to)) {
            throw new BacktestValidationException(0, "Empty replay range " + from + " .. " + to);
        }
        List<MarketSnapshot> snapshots = source.history(assetPair, timeframe, from, to);
        log.debug("[Replay] Loaded history. asset={} timeframe={} from={} to={} snapshots={}",
            assetPair, timeframe, from, to, snapshots.size());
        return replay(session, snapshots);
    }

    public BacktestResult replay(DecisionSession session, List<MarketSnapshot> snapshots, ReplayState state) {
        validateChronology(snapshots);
        String assetPair = snapshots.isEmpty() ? null : snapshots.get(0).assetPair();
        log.info("[Replay] Starting. session={} asset={} steps={} initialBalance={} readonly={}",
            session.name(), assetPair, snapshots.size(), settings.initialBalance(), session.memory().isReadonly());

        Run run = new Run(session);
        state.start(snapshots.size(), settings.initialBalance());
        for (int i = 0; i < snapshots.size(); i++) {
            run.step(snapshots.get(i));
            state.advance(i + 1, snapshots.get(i).timestamp(), run.lastEquity());
        }
        if (run.position != null) {
            MarketSnapshot last = snapshots.get(snapshots.size() - 1);
            run.close(last.close(), last.timestamp(), END_OF_DATA);
            run.equity.set(run.equity.size() - 1, run.cash);
        }
        state.finish(run.cash);

        BacktestResult result = new BacktestResult(assetPair,
            PerformanceMetrics.evaluate(run.equity, run.trades, settings.periodsPerYear()),
            run.equity, run.trades, run.decisions, run.approved, run.denied, run.cacheHits, run.skipped);
        log.info("[Replay] Finished. session={} asset={} trades={} finalEquity={} netReturn={} sharpe={} cacheHits={}",
            session.name(), assetPair, run.trades.size(), result.finalEquity(), result.metrics().netReturn(),
            result.metrics().sharpe(), run.cacheHits);
        return result;
    }

    public static void validateChronology(List<MarketSnapshot> snapshots) {
        for (int i = 1; i < snapshots.size(); i++) {
            MarketSnapshot previous = snapshots.get(i - 1);
            MarketSnapshot current  = snapshots.get(i);
            if (!current.assetPair().equals(previous.assetPair())) {
                throw new BacktestValidationException(i,
                    "Mixed asset pairs " + previous.assetPair() + " and " + current.assetPair());
            }
            int order = current.timestamp().compareTo(previous.timestamp());
            if (order == 0) {
                throw new BacktestValidationException(i, "Duplicate timestamp " + current.timestamp());
            }
            if (order < 0) {
                throw new BacktestValidationException(i,
                    "Out-of-order timestamp " + current.timestamp() + " after " + previous.timestamp());
            }
        }
    }

    private record OpenPosition(Decision decision, PositionType type, double entryPrice, double size,
                                double entryFees, Double stopPrice, MarketRegime regime) {

        double unrealized(double price) {
            return type == PositionType.LONG ? (price - entryPrice) * size : (entryPrice - price) * size;
        }
    }

    /** Mutable ledger of one replay. */
    private final class Run {

        private final DecisionSession session;
        private final List<Double> equity = new ArrayList<>();
        private final List<Double> closes = new ArrayList<>();
        private final List<TradeOutcome> trades = new ArrayList<>();
        private double cash = settings.initialBalance();
        private OpenPosition position;
        private int decisions;
        private int approved;
        private int denied;
        private int cacheHits;
        private int skipped;

        Run(DecisionSession session) {
            this.session = session;
            equity.add(cash);
        }

        double lastEquity() {
            return equity.get(equity.size() - 1);
        }

        void step(MarketSnapshot snapshot) {
            checkStopLoss(snapshot);
            closes.add(snapshot.close());
            MarketRegime regime = MarketRegimeClassifier.classify(
                closes.subList(Math.max(0, closes.size() - settings.regimeLookback()), closes.size()));

            DecisionResult result;
            try {
                result = pipeline.decide(session, new DecisionRequest(snapshot, riskContext(snapshot), regime, cash, null));
            } catch (InsufficientProvidersException e) {
                skipped++;
                log.warn("[Replay] No usable votes; step skipped. asset={} timestamp={}",
                    snapshot.assetPair(), snapshot.timestamp());
                equity.add(markToMarket(snapshot.close()));
                return;
            }

            decisions++;
            if (result.cacheHit()) cacheHits++;
            if (result.verdict().allow()) approved++; else denied++;

            Decision decision = result.decision();
            if (position != null && result.verdict().allow() && decision.action() == position.type().closingAction()) {
                close(snapshot.close(), snapshot.timestamp(), OPPOSITE_SIGNAL);
            } else if (position == null && result.isExecutable()) {
                open(pipeline.execute(session, result, fills), regime);
            }
            equity.add(markToMarket(snapshot.close()));
        }

        void open(Decision executed, MarketRegime regime) {
            ExecutionResult fill = executed.execution();
            if (fill == null || !fill.success()) return;
            cash -= fill.fees();
            position = new OpenPosition(executed, executed.positionType(), fill.fillPrice(), fill.filledSize(),
                fill.fees(), executed.sizing().stopLossPrice(), regime);
            log.debug("[Replay] Opened. decisionId={} type={} size={} fill={} stop={}",
                executed.id(), position.type(), position.size(), position.entryPrice(), position.stopPrice());
        }

        void close(double price, Instant at, String reason) {
            OpenPosition open = position;
            double exit = fills.exitPrice(open.type(), price);
            double exitFees = fills.fee(exit, open.size());
            TradeOutcome outcome = TradeOutcome.close("trade-" + open.decision().id(), open.decision(), at,
                open.entryPrice(), exit, open.size(), open.entryFees() + exitFees, open.regime(), reason);
            // entry fees were already deducted on open
            cash += outcome.realizedPnl() + open.entryFees();
            position = null;
            trades.add(outcome);
            feedback.recordOutcome(session, outcome);
            log.debug("[Replay] Closed. tradeId={} reason={} exit={} pnl={}",
                outcome.tradeId(), reason, exit, outcome.realizedPnl());
        }

        private void checkStopLoss(MarketSnapshot snapshot) {
            if (position == null || position.stopPrice() == null) return;
            double stop = position.stopPrice();
            boolean longPosition = position.type() == PositionType.LONG;
            boolean hit = longPosition ? snapshot.low() <= stop : snapshot.high() >= stop;
            if (hit) {
                // a bar that opens through the stop fills at the open
                double trigger = longPosition ? Math.min(snapshot.open(), stop) : Math.max(snapshot.open(), stop);
                close(trigger, snapshot.timestamp(), STOP_LOSS);
            }
        }

        private double markToMarket(double price) {
            return position == null ? cash : cash + position.unrealized(price);
        }

        private RiskContext riskContext(MarketSnapshot snapshot) {
            double mtm = markToMarket(snapshot.close());
            List<Double> curve = new ArrayList<>(equity);
            curve.add(mtm);
            RecentPerformance performance = new RecentPerformance(
                PerformanceMetrics.currentDrawdown(curve), PerformanceMetrics.returns(curve));
            List<Holding> holdings = position == null
                ? List.of()
                : List.of(new Holding(snapshot.assetPair(), position.type(), position.size(), position.entryPrice()));
            double openNotional = position == null ? 0.0 : position.size() * position.entryPrice();
            return new RiskContext(settings.assetType(), snapshot.timestamp(), snapshot.timestamp(), performance,
                holdings, null, new ExposureSnapshot(mtm, openNotional), snapshot.indicator("volatility"));
        }
    }
}
