package com.feedbackengine.engine.pipeline;

import com.feedbackengine.common.consensus.EnsembleAggregator;
import com.feedbackengine.common.consensus.EnsembleDraft;
import com.feedbackengine.common.exception.EngineException;
import com.feedbackengine.common.model.Decision;
import com.feedbackengine.common.model.DecisionRecord;
import com.feedbackengine.common.model.ExecutionResult;
import com.feedbackengine.common.model.MarketSnapshot;
import com.feedbackengine.common.model.ProviderVote;
import com.feedbackengine.common.model.RiskContext;
import com.feedbackengine.common.model.RiskRule;
import com.feedbackengine.common.model.RiskVerdict;
import com.feedbackengine.common.risk.PositionSizer;
import com.feedbackengine.common.risk.RiskGatekeeper;
import com.feedbackengine.engine.logger.DecisionFlowLogger;
import com.feedbackengine.engine.provider.ExecutionGateway;
import com.feedbackengine.engine.provider.ProviderPool;
import com.feedbackengine.engine.trace.TraceContextUtil.DecisionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns one market snapshot into a risk-checked decision.
 *
 * <p>Stages, all under the asset's lock:
 * <pre>
 *   cache (replay only) → providers → weights → aggregator → gatekeeper assessment
 *     → sizer → in-flight check → exposure reservation → cache put → journal
 * </pre>
 *
 * <p>{@link EnsembleAggregator} failures ({@code InsufficientProvidersException}) propagate.
 * Risk rejections are returned in {@link DecisionResult#verdict()}; the decision is still built
 * so it can be journaled.
 */
public class DecisionPipeline {

    private static final Logger log = LoggerFactory.getLogger(DecisionPipeline.class);

    static final String CACHED_STRATEGY = "CACHED";

    private final ProviderPool providerPool;
    private final EnsembleAggregator aggregator;
    private final PositionSizer sizer;
    private final DecisionFlowLogger flowLogger;

    public DecisionPipeline(ProviderPool providerPool, EnsembleAggregator aggregator,
                            PositionSizer sizer, DecisionFlowLogger flowLogger) {
        this.providerPool = providerPool;
        this.aggregator   = aggregator;
        this.sizer        = sizer;
        this.flowLogger   = flowLogger;
    }

    public DecisionResult decide(DecisionSession session, DecisionRequest request) {
        String assetPair = request.snapshot().assetPair();
        return session.locks().withLock(assetPair, () -> decideLocked(session, request));
    }

    /**
     * Sends an executable decision to the gateway. A successful fill commits the reservation;
     * a rejection or a gateway failure rolls it back and frees the asset's in-flight slot.
     * Non-executable results are returned unchanged.
     */
    public Decision execute(DecisionSession session, DecisionResult result, ExecutionGateway gateway) {
        Decision decision = result.decision();
        if (!result.isExecutable()) {
            return decision;
        }
        ExecutionResult execution;
        try {
            execution = gateway.execute(decision);
        } catch (RuntimeException e) {
            release(session, decision);
            throw new EngineException("ExecutionGateway",
                "Execution failed. decisionId=" + decision.id() + " asset=" + decision.assetPair(), e);
        }
        if (execution.success()) {
            session.gatekeeper().commit(decision.id());
        } else {
            log.warn("[Pipeline] Execution rejected. decisionId={} asset={} message={}",
                decision.id(), decision.assetPair(), execution.message());
            release(session, decision);
        }
        flowLogger.logStage(DecisionFlowLogger.EXECUTED,
            DecisionContext.of(decision.id(), decision.assetPair(), session.name()));
        return decision.withExecution(execution);
    }

    // ── stages ─────────────────────────────────────────────────────────────

    private DecisionResult decideLocked(DecisionSession session, DecisionRequest request) {
        MarketSnapshot snapshot = request.snapshot();
        RiskContext context     = request.context();
        String assetPair        = snapshot.assetPair();
        String decisionId       = decisionId(request);
        DecisionContext trace   = DecisionContext.of(decisionId, assetPair, session.name());
        flowLogger.logStage(DecisionFlowLogger.REQUEST_RECEIVED, trace);

        // Sampled on every step so the optimizer's random stream is independent of cache state.
        Map<String, Double> weights = session.optimizer().sampleWeights(request.regime());

        boolean useCache = context.isReplay() && session.cache() != null;
        Optional<Decision> cached = useCache ? session.cache().get(snapshot) : Optional.empty();

        EnsembleDraft draft;
        if (cached.isPresent()) {
            draft = fromCached(cached.get());
            flowLogger.logStage(DecisionFlowLogger.CACHE_HIT, trace);
        } else {
            List<ProviderVote> votes = providerPool.collectVotesBlocking(snapshot, trace);
            draft = aggregator.aggregate(assetPair, votes, weights);
            flowLogger.logStage(DecisionFlowLogger.ENSEMBLE_AGGREGATED, trace);
        }

        RiskGatekeeper gatekeeper = session.gatekeeper();
        RiskVerdict assessment = gatekeeper.assess(assetPair, draft.action(), draft.confidence(), context);
        flowLogger.logStage(DecisionFlowLogger.RISK_ASSESSED, trace);

        double correlationFactor = assessment.allow() ? assessment.correlationFactor() : 1.0;
        Decision decision = sizer.decide(decisionId, snapshot.timestamp(), draft, request.balance(),
            snapshot.close(), correlationFactor, snapshot.indicator("atr"));

        boolean riskIncreasing = RiskGatekeeper.isRiskIncreasing(assetPair, decision.action(), context);
        RiskVerdict verdict = checkInFlight(session, decision, riskIncreasing, assessment);
        verdict = gatekeeper.reserve(decision, context, verdict);
        if (verdict.allow() && decision.isActionable() && riskIncreasing
                && !session.inFlight().tryRegister(decision)) {
            gatekeeper.rollback(decision.id());
            verdict = RiskVerdict.deny(RiskRule.IN_FLIGHT,
                "Another decision is in flight for " + assetPair, verdict.warnings());
        }

        if (session.journal() != null) {
            try {
                session.journal().append(DecisionRecord.from(decision, verdict));
            } catch (RuntimeException e) {
                // an unjournaled decision must not hold the asset's slot or exposure
                release(session, decision);
                log.error("[Pipeline] Journal append failed; reservation and in-flight slot released. "
                    + "decisionId={} asset={}", decision.id(), assetPair, e);
                throw e;
            }
        }
        if (useCache && cached.isEmpty()) {
            session.cache().put(snapshot, decision);
        }
        flowLogger.logDecision(decision, verdict, session.name());
        return new DecisionResult(decision, verdict, draft, cached.isPresent());
    }

    private RiskVerdict checkInFlight(DecisionSession session, Decision decision, boolean riskIncreasing,
                                      RiskVerdict assessment) {
        if (!assessment.allow() || !riskIncreasing || !decision.isActionable()) {
            return assessment;
        }
        Optional<Decision> open = session.inFlight().current(decision.assetPair());
        if (open.isEmpty()) {
            return assessment;
        }
        log.warn("[Pipeline] Denied. asset={} rule={} inFlight={}",
            decision.assetPair(), RiskRule.IN_FLIGHT, open.get().id());
        return RiskVerdict.deny(RiskRule.IN_FLIGHT,
            "Decision " + open.get().id() + " already in flight for " + decision.assetPair(),
            assessment.warnings());
    }

    private void release(DecisionSession session, Decision decision) {
        session.gatekeeper().rollback(decision.id());
        session.inFlight().release(decision.assetPair(), decision.id());
    }

    /** Explicit id, else deterministic in replay and random in live mode. */
    static String decisionId(DecisionRequest request) {
        if (request.decisionId() != null) return request.decisionId();
        MarketSnapshot snapshot = request.snapshot();
        if (request.context().isReplay()) {
            return snapshot.assetPair() + "-" + snapshot.timestamp().getEpochSecond();
        }
        return UUID.randomUUID().toString();
    }

    static EnsembleDraft fromCached(Decision cached) {
        return new EnsembleDraft(cached.assetPair(), cached.action(), cached.confidence(),
            cached.aggregationTier(), CACHED_STRATEGY, cached.contributingVotes(), Map.of(), Map.of(),
            null, cached.reasoning(), 0);
    }
}
