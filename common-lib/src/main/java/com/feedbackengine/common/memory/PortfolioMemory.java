package com.feedbackengine.common.memory;

import com.feedbackengine.common.exception.ReadOnlyMemoryException;
import com.feedbackengine.common.exception.ValidationException;
import com.feedbackengine.common.model.MarketRegime;
import com.feedbackengine.common.model.PositionType;
import com.feedbackengine.common.model.ProviderVote;
import com.feedbackengine.common.model.TradeAction;
import com.feedbackengine.common.model.TradeOutcome;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Append-only ledger of realized trade outcomes with provider and regime aggregates.
 *
 * <p>Single writer: every mutating method is {@code synchronized}. While read-only,
 * {@link #recordTradeOutcome} raises {@link ReadOnlyMemoryException}; it never silently skips.
 *
 * <p>Temporal isolation in walk-forward runs:
 * <pre>
 *   snap = memory.snapshot()
 *   train (mutates) → setReadonly(true) → test → restore(snap)
 * </pre>
 */
public class PortfolioMemory {

    private static final Logger log = LoggerFactory.getLogger(PortfolioMemory.class);

    private final Clock clock;
    private final List<TradeOutcome> outcomes = new ArrayList<>();
    private final Set<String> tradeIds = new HashSet<>();
    private final Map<String, ProviderPerformance> providerPerformance = new TreeMap<>();
    private final Map<MarketRegime, RegimePerformance> regimePerformance = new EnumMap<>(MarketRegime.class);
    private volatile boolean readonly;

    public PortfolioMemory() {
        this(Clock.systemUTC());
    }

    public PortfolioMemory(Clock clock) {
        this.clock = clock;
    }

    public static PortfolioMemory fromSnapshot(PortfolioMemorySnapshot snapshot) {
        PortfolioMemory memory = new PortfolioMemory();
        memory.restore(snapshot);
        return memory;
    }

    /**
     * Appends one outcome and updates the aggregates.
     *
     * @throws ReadOnlyMemoryException while the memory is read-only
     * @throws ValidationException     on a duplicate trade id
     */
    public synchronized void recordTradeOutcome(TradeOutcome outcome) {
        if (readonly) {
            throw new ReadOnlyMemoryException(outcome.tradeId());
        }
        if (!tradeIds.add(outcome.tradeId())) {
            throw new ValidationException("tradeId", "outcome already recorded: " + outcome.tradeId());
        }
        outcomes.add(outcome);

        boolean profitable = outcome.wasProfitable();
        TradeAction entryAction = outcome.positionType() == PositionType.SHORT ? TradeAction.SELL : TradeAction.BUY;
        for (ProviderVote vote : outcome.contributingVotes()) {
            boolean backed = vote.action() == entryAction;
            providerPerformance.compute(vote.providerId(),
                (id, perf) -> (perf != null ? perf : ProviderPerformance.empty(id))
                    .record(backed == profitable, backed ? outcome.realizedPnl() : 0.0));
        }
        regimePerformance.compute(outcome.regime(),
            (regime, perf) -> (perf != null ? perf : RegimePerformance.empty(regime))
                .record(profitable, outcome.realizedPnl()));

        log.debug("[PortfolioMemory] Recorded tradeId={} asset={} pnl={} total={}",
            outcome.tradeId(), outcome.assetPair(), outcome.realizedPnl(), outcomes.size());
    }

    /**
     * Appends one outcome and flushes the resulting state to {@code store} under the same lock,
     * so saves reach the store in record order.
     */
    public synchronized void recordTradeOutcome(TradeOutcome outcome, PortfolioMemoryStore store) {
        recordTradeOutcome(outcome);
        store.save(snapshot());
    }

    /** Deep, independent copy of the current state. */
    public synchronized PortfolioMemorySnapshot snapshot() {
        return new PortfolioMemorySnapshot(outcomes, providerPerformance, regimePerformance, readonly, clock.instant());
    }

    /** Replaces the live state with the snapshot's contents, read-only flag included. */
    public synchronized void restore(PortfolioMemorySnapshot snapshot) {
        outcomes.clear();
        tradeIds.clear();
        providerPerformance.clear();
        regimePerformance.clear();
        outcomes.addAll(snapshot.outcomes());
        snapshot.outcomes().forEach(o -> tradeIds.add(o.tradeId()));
        providerPerformance.putAll(snapshot.providerPerformance());
        regimePerformance.putAll(snapshot.regimePerformance());
        readonly = snapshot.readonly();
    }

    public void setReadonly(boolean readonly) {
        this.readonly = readonly;
    }

    public boolean isReadonly() {
        return readonly;
    }

    public synchronized List<TradeOutcome> outcomes() {
        return List.copyOf(outcomes);
    }

    public synchronized int size() {
        return outcomes.size();
    }

    public synchronized Map<String, ProviderPerformance> providerPerformance() {
        return Map.copyOf(providerPerformance);
    }

    public synchronized Map<MarketRegime, RegimePerformance> regimePerformance() {
        return Map.copyOf(regimePerformance);
    }

    /** Outcomes closed at or after {@code since}. */
    public synchronized List<TradeOutcome> outcomesSince(Instant since) {
        return outcomes.stream()
            .filter(o -> o.exitTimestamp() != null && !o.exitTimestamp().isBefore(since))
            .toList();
    }

    public synchronized PerformanceSummary performanceSummary() {
        if (outcomes.isEmpty()) return PerformanceSummary.empty();

        int wins = 0;
        double grossProfit = 0.0;
        double grossLoss = 0.0;
        double cumulative = 0.0;
        double peak = 0.0;
        double maxDrawdown = 0.0;
        DescriptiveStatistics returns = new DescriptiveStatistics();
        for (TradeOutcome o : outcomes) {
            double pnl = o.realizedPnl();
            if (pnl > 0) {
                wins++;
                grossProfit += pnl;
            } else {
                grossLoss += -pnl;
            }
            cumulative += pnl;
            peak = Math.max(peak, cumulative);
            maxDrawdown = Math.max(maxDrawdown, peak - cumulative);
            returns.addValue(o.pnlPct());
        }
        int total = outcomes.size();
        double std = returns.getStandardDeviation();
        double sharpe = total > 1 && std > 0 ? returns.getMean() / std : 0.0;
        Double profitFactor = grossLoss > 0 ? grossProfit / grossLoss : null;

        return new PerformanceSummary(total, wins, total - wins, wins / (double) total, cumulative,
            cumulative / total, profitFactor, maxDrawdown, sharpe);
    }
}
