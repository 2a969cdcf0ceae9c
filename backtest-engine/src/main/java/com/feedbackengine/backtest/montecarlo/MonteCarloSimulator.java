package com.feedbackengine.backtest.montecarlo;

import com.feedbackengine.backtest.replay.BacktestReplayEngine;
import com.feedbackengine.backtest.replay.CancellationToken;
import com.feedbackengine.common.exception.ConfigurationException;
import com.feedbackengine.common.memory.PortfolioMemorySnapshot;
import com.feedbackengine.common.model.MarketSnapshot;
import com.feedbackengine.engine.pipeline.DecisionSession;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Replays N perturbed copies of a price path in parallel.
 *
 * <p>Path {@code i} scales every snapshot's prices by {@code 1 + ε}, ε ~ N(0, σ) i.i.d., drawn from
 * a generator seeded with {@code seed + i}. Each path runs on its own session fork: memory restored
 * from one snapshot of the base session, an optimizer copy seeded with {@code seed}, fresh
 * reservations. With σ = 0 every path replays the same input against the same state.
 */
public class MonteCarloSimulator {

    private static final Logger log = LoggerFactory.getLogger(MonteCarloSimulator.class);

    static final double MAX_NOISE_STD = 0.5;

    private final BacktestReplayEngine engine;
    private final int numSimulations;
    private final double priceNoiseStd;
    private final int parallelism;
    private final Clock clock;

    public MonteCarloSimulator(BacktestReplayEngine engine, int numSimulations, double priceNoiseStd,
                               int parallelism, Clock clock) {
        if (numSimulations < 1) {
            throw new ConfigurationException("numSimulations must be >= 1, got " + numSimulations);
        }
        if (!(priceNoiseStd >= 0) || priceNoiseStd > MAX_NOISE_STD) {
            throw new ConfigurationException("priceNoiseStd must be in [0, " + MAX_NOISE_STD + "], got " + priceNoiseStd);
        }
        if (parallelism < 1) {
            throw new ConfigurationException("parallelism must be >= 1, got " + parallelism);
        }
        this.engine         = engine;
        this.numSimulations = numSimulations;
        this.priceNoiseStd  = priceNoiseStd;
        this.parallelism    = parallelism;
        this.clock          = clock;
    }

    public MonteCarloReport simulate(DecisionSession base, List<MarketSnapshot> snapshots, long seed) {
        return simulate(base, snapshots, seed, CancellationToken.none());
    }

    public MonteCarloReport simulate(DecisionSession base, List<MarketSnapshot> snapshots, long seed,
                                     CancellationToken token) {
        BacktestReplayEngine.validateChronology(snapshots);
        PortfolioMemorySnapshot memory = base.memory().snapshot();
        log.info("[MonteCarlo] Starting. session={} paths={} noiseStd={} parallelism={} steps={}",
            base.name(), numSimulations, priceNoiseStd, parallelism, snapshots.size());

        List<Double> finals = Flux.range(0, numSimulations)
            .flatMap(path -> Mono.defer(() -> token.isCancelled()
                    ? Mono.<Double>empty()
                    : Mono.fromCallable(() -> runPath(base, memory, snapshots, seed, path)))
                .subscribeOn(Schedulers.boundedElastic()), parallelism)
            .collectList()
            .block();

        List<Double> completed = finals == null ? List.of() : finals;
        boolean cancelled = completed.size() < numSimulations;
        MonteCarloReport report = MonteCarloReport.of(numSimulations, engine.settings().initialBalance(),
            priceNoiseStd, completed, cancelled);
        log.info("[MonteCarlo] Complete. paths={}/{} p5={} p50={} p95={} var95={} cancelled={}",
            report.completedPaths(), numSimulations, report.p5(), report.p50(), report.p95(),
            report.valueAtRisk95(), cancelled);
        return report;
    }

    private double runPath(DecisionSession base, PortfolioMemorySnapshot memory, List<MarketSnapshot> snapshots,
                           long seed, int path) {
        List<MarketSnapshot> perturbed = perturb(snapshots, priceNoiseStd, new Well19937c(seed + path));
        DecisionSession session = base.fork(base.name() + "-mc-" + path, memory, seed, clock);
        double finalEquity = engine.replay(session, perturbed).finalEquity();
        log.debug("[MonteCarlo] Path done. path={} finalEquity={}", path, finalEquity);
        return finalEquity;
    }

    static List<MarketSnapshot> perturb(List<MarketSnapshot> snapshots, double std, RandomGenerator rng) {
        if (std == 0.0) {
            return snapshots;
        }
        NormalDistribution noise = new NormalDistribution(rng, 0.0, std);
        List<MarketSnapshot> perturbed = new ArrayList<>(snapshots.size());
        for (MarketSnapshot snapshot : snapshots) {
            double factor = Math.max(1.0 + noise.sample(), 1e-6);
            perturbed.add(snapshot.scaledPrices(factor));
        }
        return perturbed;
    }
}
