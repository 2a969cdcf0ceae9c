package com.feedbackengine.engine.feedback;

import com.feedbackengine.common.memory.PortfolioMemory;
import com.feedbackengine.common.model.PositionType;
import com.feedbackengine.common.model.ProviderVote;
import com.feedbackengine.common.model.TradeAction;
import com.feedbackengine.common.model.TradeOutcome;
import com.feedbackengine.common.weights.ThompsonSamplingWeightOptimizer;
import com.feedbackengine.engine.logger.DecisionFlowLogger;
import com.feedbackengine.engine.pipeline.DecisionSession;
import com.feedbackengine.engine.trace.TraceContextUtil.DecisionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Closes the learning loop for a finished trade: frees the asset's in-flight slot,
 * appends the outcome to portfolio memory and updates provider weights.
 *
 * <p>A provider "won" when its vote agreed with the trade direction and the trade was
 * profitable, or disagreed and the trade lost. While memory is read-only (walk-forward
 * test windows) neither memory nor weights are touched.
 */
@Service
public class OutcomeFeedbackService {

    private static final Logger log = LoggerFactory.getLogger(OutcomeFeedbackService.class);

    private final DecisionFlowLogger flowLogger;

    public OutcomeFeedbackService(DecisionFlowLogger flowLogger) {
        this.flowLogger = flowLogger;
    }

    /** @return {@code true} when memory and weights were updated */
    public boolean recordOutcome(DecisionSession session, TradeOutcome outcome) {
        session.inFlight().release(outcome.assetPair(), outcome.decisionId());

        PortfolioMemory memory = session.memory();
        if (memory.isReadonly()) {
            log.debug("[Feedback] Memory read-only; learning skipped. tradeId={} asset={} pnl={}",
                outcome.tradeId(), outcome.assetPair(), outcome.realizedPnl());
            return false;
        }

        if (session.memoryStore() != null) {
            memory.recordTradeOutcome(outcome, session.memoryStore());
        } else {
            memory.recordTradeOutcome(outcome);
        }
        updateWeights(session.optimizer(), outcome);

        log.info("[Feedback] Outcome recorded. tradeId={} asset={} pnl={} profitable={} regime={}",
            outcome.tradeId(), outcome.assetPair(), outcome.realizedPnl(), outcome.wasProfitable(),
            outcome.regime());
        flowLogger.logStage(DecisionFlowLogger.OUTCOME_RECORDED,
            DecisionContext.of(outcome.decisionId(), outcome.assetPair(), session.name()));
        return true;
    }

    private void updateWeights(ThompsonSamplingWeightOptimizer optimizer, TradeOutcome outcome) {
        TradeAction entryAction = outcome.positionType() == PositionType.SHORT ? TradeAction.SELL : TradeAction.BUY;
        boolean profitable = outcome.wasProfitable();
        for (ProviderVote vote : outcome.contributingVotes()) {
            if (!optimizer.isKnown(vote.providerId())) {
                log.warn("[Feedback] Unknown provider skipped. provider={} tradeId={}",
                    vote.providerId(), outcome.tradeId());
                continue;
            }
            boolean backed = vote.action() == entryAction;
            optimizer.updateWeightsFromOutcome(vote.providerId(), backed == profitable, outcome.regime());
        }
    }
}
