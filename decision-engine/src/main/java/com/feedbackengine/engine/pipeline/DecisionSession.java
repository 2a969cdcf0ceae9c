package com.feedbackengine.engine.pipeline;

import com.feedbackengine.common.cache.DecisionCache;
import com.feedbackengine.common.memory.PortfolioMemory;
import com.feedbackengine.common.memory.PortfolioMemorySnapshot;
import com.feedbackengine.common.memory.PortfolioMemoryStore;
import com.feedbackengine.common.risk.ExposureReservationManager;
import com.feedbackengine.common.risk.RiskGatekeeper;
import com.feedbackengine.common.weights.ThompsonSamplingWeightOptimizer;
import com.feedbackengine.engine.journal.DecisionJournal;

import java.time.Clock;

/**
 * The mutable state one stream of decisions runs against: weights, memory, exposure
 * reservations, in-flight decisions and per-asset locks.
 *
 * <p>The live engine owns one canonical session. Replay and Monte Carlo paths {@link #fork}
 * private sessions so they never touch canonical state. The decision cache is shared
 * across forks; it is keyed by full market state and thread-safe.
 *
 * @see com.feedbackengine.engine.pipeline.DecisionPipeline
 */
public class DecisionSession {

    private final String name;
    private final ThompsonSamplingWeightOptimizer optimizer;
    private final PortfolioMemory memory;
    private final RiskGatekeeper gatekeeper;
    private final DecisionCache cache;
    private final DecisionJournal journal;
    private final PortfolioMemoryStore memoryStore;
    private final InFlightDecisionRegistry inFlight = new InFlightDecisionRegistry();
    private final AssetLockRegistry locks = new AssetLockRegistry();

    /**
     * @param cache       {@code null} disables caching
     * @param journal     {@code null} disables the decision journal
     * @param memoryStore {@code null} keeps memory in process only
     */
    public DecisionSession(String name, ThompsonSamplingWeightOptimizer optimizer, PortfolioMemory memory,
                           RiskGatekeeper gatekeeper, DecisionCache cache, DecisionJournal journal,
                           PortfolioMemoryStore memoryStore) {
        this.name        = name;
        this.optimizer   = optimizer;
        this.memory      = memory;
        this.gatekeeper  = gatekeeper;
        this.cache       = cache;
        this.journal     = journal;
        this.memoryStore = memoryStore;
    }

    /**
     * Private session seeded from {@code memorySnapshot} with an independent optimizer copy,
     * fresh reservations and no persistence.
     */
    public DecisionSession fork(String forkName, PortfolioMemorySnapshot memorySnapshot, long seed, Clock clock) {
        ExposureReservationManager reservations = new ExposureReservationManager(
            gatekeeper.config().maxExposurePct(), ExposureReservationManager.DEFAULT_TTL, clock);
        return new DecisionSession(forkName, optimizer.copy(seed), PortfolioMemory.fromSnapshot(memorySnapshot),
            new RiskGatekeeper(gatekeeper.config(), reservations, clock), cache, null, null);
    }

    public String name() {
        return name;
    }

    public ThompsonSamplingWeightOptimizer optimizer() {
        return optimizer;
    }

    public PortfolioMemory memory() {
        return memory;
    }

    public RiskGatekeeper gatekeeper() {
        return gatekeeper;
    }

    public DecisionCache cache() {
        return cache;
    }

    public DecisionJournal journal() {
        return journal;
    }

    public PortfolioMemoryStore memoryStore() {
        return memoryStore;
    }

    public InFlightDecisionRegistry inFlight() {
        return inFlight;
    }

    public AssetLockRegistry locks() {
        return locks;
    }
}
