package com.feedbackengine.backtest.learning;

import com.feedbackengine.backtest.learning.LearningValidationReport.ConceptDrift;
import com.feedbackengine.backtest.learning.LearningValidationReport.CumulativeRegret;
import com.feedbackengine.backtest.learning.LearningValidationReport.LearningCurve;
import com.feedbackengine.backtest.learning.LearningValidationReport.ProviderSelection;
import com.feedbackengine.backtest.learning.LearningValidationReport.SampleEfficiency;
import com.feedbackengine.common.model.PositionType;
import com.feedbackengine.common.model.ProviderVote;
import com.feedbackengine.common.model.ProviderWeightState;
import com.feedbackengine.common.model.TradeAction;
import com.feedbackengine.common.model.TradeOutcome;
import com.feedbackengine.engine.pipeline.DecisionSession;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.IntStream;

/**
 * Learning diagnostics over a session's recorded outcomes, in record order.
 *
 * <pre>
 *   sample efficiency  rolling win rate over 20 trades; first window at ≥ 60 %;
 *                      speed = (mean of last k windows − mean of first k) / (trades / 100),
 *                      k = clamp(windows / 4, 1, 10)
 *   cumulative regret  Σ (best provider's mean P&amp;L − trade P&amp;L) over attributed trades
 *   concept drift      population std-dev of win rate over 5 equal windows (≥ 100 trades)
 *   provider selection exploration = non-dominant leads / all leads;
 *                      convergence = dominant leads in the last 50 trades / those trades
 *   learning curve     first quartile against last quartile (≥ 40 trades);
 *                      detected when win rate improves &gt; 5 % or mean P&amp;L &gt; 10 %
 * </pre>
 *
 * A trade is attributed to its lead provider: the highest-confidence vote that backed the
 * position's direction (ties by provider id). Trades no vote backed are left out of the
 * provider sections.
 */
public class LearningValidationAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(LearningValidationAnalyzer.class);

    public static final String ALL_ASSETS         = "ALL";
    public static final int    EFFICIENCY_WINDOW  = 20;
    public static final double TARGET_WIN_RATE    = 0.60;
    public static final int    MIN_DRIFT_TRADES   = 100;
    public static final int    DRIFT_WINDOWS      = 5;
    public static final int    CONVERGENCE_WINDOW = 50;
    public static final int    MIN_CURVE_TRADES   = 40;

    public LearningValidationReport analyze(DecisionSession session, String assetPair) {
        return analyze(session.memory().outcomes(), session.optimizer().stateSnapshot(), assetPair);
    }

    /** @param assetPair {@code null} analyzes every asset */
    public LearningValidationReport analyze(List<TradeOutcome> outcomes, Map<String, ProviderWeightState> weights,
                                            String assetPair) {
        List<TradeOutcome> selected = assetPair == null
            ? List.copyOf(outcomes)
            : outcomes.stream().filter(o -> assetPair.equals(o.assetPair())).toList();
        String label = assetPair == null ? ALL_ASSETS : assetPair;

        LearningValidationReport report = new LearningValidationReport(selected.size(), label,
            sampleEfficiency(selected), cumulativeRegret(selected), conceptDrift(selected),
            providerSelection(selected, weights), learningCurve(selected));
        log.info("[LearningValidation] asset={} trades={} tradesToTarget={} regret={} drift={} learningDetected={}",
            label, selected.size(), report.sampleEfficiency().tradesToTargetWinRate(),
            report.cumulativeRegret().cumulativeRegret(), report.conceptDrift().severity(),
            report.learningCurve().learningDetected());
        return report;
    }

    // ── sections ───────────────────────────────────────────────────────────

    SampleEfficiency sampleEfficiency(List<TradeOutcome> outcomes) {
        double[] rolling = rollingWinRates(outcomes, EFFICIENCY_WINDOW);
        Integer tradesToTarget = null;
        for (int i = 0; i < rolling.length; i++) {
            if (rolling[i] >= TARGET_WIN_RATE) {
                tradesToTarget = i + EFFICIENCY_WINDOW;
                break;
            }
        }

        double speed = 0.0;
        if (rolling.length >= 2) {
            int k = Math.max(1, Math.min(10, rolling.length / 4));
            double early = mean(rolling, 0, k);
            double late  = mean(rolling, rolling.length - k, rolling.length);
            speed = (late - early) / (outcomes.size() / 100.0);
        }

        double trend = 0.0;
        if (rolling.length >= 3) {
            double[] index = IntStream.range(0, rolling.length).asDoubleStream().toArray();
            double r = new PearsonsCorrelation().correlation(index, rolling);
            trend = Double.isNaN(r) ? 0.0 : r;
        }
        return new SampleEfficiency(tradesToTarget, speed, trend, tradesToTarget != null);
    }

    CumulativeRegret cumulativeRegret(List<TradeOutcome> outcomes) {
        Map<String, DescriptiveStatistics> pnlByProvider = new TreeMap<>();
        for (TradeOutcome outcome : outcomes) {
            leadProvider(outcome).ifPresent(p ->
                pnlByProvider.computeIfAbsent(p, k -> new DescriptiveStatistics()).addValue(outcome.realizedPnl()));
        }
        if (pnlByProvider.isEmpty()) {
            return new CumulativeRegret(0.0, null, 0.0, 0.0);
        }

        String optimal = null;
        double optimalAvg = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, DescriptiveStatistics> e : pnlByProvider.entrySet()) {
            if (e.getValue().getMean() > optimalAvg) {
                optimal = e.getKey();
                optimalAvg = e.getValue().getMean();
            }
        }

        double regret = 0.0;
        for (TradeOutcome outcome : outcomes) {
            if (leadProvider(outcome).isPresent()) {
                regret += optimalAvg - outcome.realizedPnl();
            }
        }
        return new CumulativeRegret(regret, optimal, optimalAvg, regret / outcomes.size());
    }

    ConceptDrift conceptDrift(List<TradeOutcome> outcomes) {
        if (outcomes.size() < MIN_DRIFT_TRADES) {
            return new ConceptDrift(false, 0.0, List.of(), DriftSeverity.LOW);
        }
        int windowSize = outcomes.size() / DRIFT_WINDOWS;
        List<Double> rates = new ArrayList<>();
        DescriptiveStatistics stats = new DescriptiveStatistics();
        for (int i = 0; i < DRIFT_WINDOWS; i++) {
            int end = i < DRIFT_WINDOWS - 1 ? (i + 1) * windowSize : outcomes.size();
            double rate = winRate(outcomes.subList(i * windowSize, end));
            rates.add(rate);
            stats.addValue(rate);
        }
        double score = Math.sqrt(stats.getPopulationVariance());
        return new ConceptDrift(true, score, rates, DriftSeverity.classify(score));
    }

    ProviderSelection providerSelection(List<TradeOutcome> outcomes, Map<String, ProviderWeightState> weights) {
        Map<String, Integer> leads = new TreeMap<>();
        for (TradeOutcome outcome : outcomes) {
            leadProvider(outcome).ifPresent(p -> leads.merge(p, 1, Integer::sum));
        }

        String dominant = null;
        int dominantCount = 0;
        int total = 0;
        for (Map.Entry<String, Integer> e : leads.entrySet()) {
            total += e.getValue();
            if (e.getValue() > dominantCount) {
                dominant = e.getKey();
                dominantCount = e.getValue();
            }
        }
        double exploration = total > 0 ? (total - dominantCount) / (double) total : 0.0;

        double convergence = 0.0;
        if (dominant != null) {
            List<TradeOutcome> recent = outcomes.subList(Math.max(0, outcomes.size() - CONVERGENCE_WINDOW), outcomes.size());
            String d = dominant;
            long recentLeads = recent.stream().filter(o -> leadProvider(o).filter(d::equals).isPresent()).count();
            convergence = recentLeads / (double) recent.size();
        }

        Map<String, Double> means = new TreeMap<>();
        weights.forEach((provider, state) -> means.put(provider, state.expectedValue()));
        return new ProviderSelection(leads, exploration, convergence, dominant, means, normalizedEntropy(means));
    }

    LearningCurve learningCurve(List<TradeOutcome> outcomes) {
        if (outcomes.size() < MIN_CURVE_TRADES) {
            return new LearningCurve(false, 0, 0, 0, 0, 0, 0, false);
        }
        int quartile = outcomes.size() / 4;
        List<TradeOutcome> first = outcomes.subList(0, quartile);
        List<TradeOutcome> last  = outcomes.subList(outcomes.size() - quartile, outcomes.size());

        double firstWin = winRate(first);
        double lastWin  = winRate(last);
        double firstPnl = meanPnl(first);
        double lastPnl  = meanPnl(last);
        double winImprovement = firstWin > 0 ? (lastWin - firstWin) / firstWin * 100.0 : 0.0;
        double pnlImprovement = firstPnl != 0 ? (lastPnl - firstPnl) / Math.abs(firstPnl) * 100.0 : 0.0;
        return new LearningCurve(true, firstWin, firstPnl, lastWin, lastPnl, winImprovement, pnlImprovement,
            winImprovement > 5.0 || pnlImprovement > 10.0);
    }

    // ── helpers ────────────────────────────────────────────────────────────

    static Optional<String> leadProvider(TradeOutcome outcome) {
        TradeAction entry = outcome.positionType() == PositionType.SHORT ? TradeAction.SELL : TradeAction.BUY;
        return outcome.contributingVotes().stream()
            .filter(v -> v.action() == entry)
            .max(Comparator.comparingDouble(ProviderVote::confidence)
                .thenComparing(ProviderVote::providerId, Comparator.reverseOrder()))
            .map(ProviderVote::providerId);
    }

    /** One rate per full window; empty below {@code window} outcomes. */
    static double[] rollingWinRates(List<TradeOutcome> outcomes, int window) {
        if (outcomes.size() < window) {
            return new double[0];
        }
        double[] rates = new double[outcomes.size() - window + 1];
        int wins = 0;
        for (int i = 0; i < outcomes.size(); i++) {
            if (outcomes.get(i).wasProfitable()) wins++;
            if (i >= window && outcomes.get(i - window).wasProfitable()) wins--;
            if (i >= window - 1) {
                rates[i - window + 1] = wins / (double) window;
            }
        }
        return rates;
    }

    private static double normalizedEntropy(Map<String, Double> means) {
        if (means.size() < 2) {
            return 0.0;
        }
        double sum = means.values().stream().mapToDouble(Double::doubleValue).sum();
        double entropy = 0.0;
        for (double m : means.values()) {
            double p = m / sum;
            if (p > 0) entropy -= p * Math.log(p);
        }
        return entropy / Math.log(means.size());
    }

    private static double winRate(List<TradeOutcome> outcomes) {
        if (outcomes.isEmpty()) return 0.0;
        return outcomes.stream().filter(TradeOutcome::wasProfitable).count() / (double) outcomes.size();
    }

    private static double meanPnl(List<TradeOutcome> outcomes) {
        return new DescriptiveStatistics(outcomes.stream().mapToDouble(TradeOutcome::realizedPnl).toArray()).getMean();
    }

    private static double mean(double[] values, int from, int to) {
        double sum = 0.0;
        for (int i = from; i < to; i++) sum += values[i];
        return sum / (to - from);
    }
}
