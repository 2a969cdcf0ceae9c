package com.feedbackengine.engine.logger;

import com.feedbackengine.common.model.Decision;
import com.feedbackengine.common.model.RiskVerdict;
import com.feedbackengine.engine.trace.TraceContextUtil;
import com.feedbackengine.engine.trace.TraceContextUtil.DecisionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of a decision's lifecycle. Pure side-effects, no business logic.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}: pipeline entered for an asset</li>
 *   <li>{@link #CACHE_HIT}: cached decision reused, providers skipped</li>
 *   <li>{@link #VOTES_COLLECTED}: provider fan-out completed or timed out</li>
 *   <li>{@link #ENSEMBLE_AGGREGATED}: draft produced by the tiered aggregator</li>
 *   <li>{@link #RISK_ASSESSED}: gatekeeper assessment finished</li>
 *   <li>{@link #DECISION_FINALIZED}: sizing and reservation applied</li>
 *   <li>{@link #EXECUTED}: execution gateway returned</li>
 *   <li>{@link #OUTCOME_RECORDED}: trade outcome fed back to memory and weights</li>
 * </ol>
 */
@Component
public class DecisionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowLogger.class);

    public static final String REQUEST_RECEIVED    = "REQUEST_RECEIVED";
    public static final String CACHE_HIT           = "CACHE_HIT";
    public static final String VOTES_COLLECTED     = "VOTES_COLLECTED";
    public static final String ENSEMBLE_AGGREGATED = "ENSEMBLE_AGGREGATED";
    public static final String RISK_ASSESSED       = "RISK_ASSESSED";
    public static final String DECISION_FINALIZED  = "DECISION_FINALIZED";
    public static final String EXECUTED            = "EXECUTED";
    public static final String OUTCOME_RECORDED    = "OUTCOME_RECORDED";

    /** {@code doOnEach} consumer; fires on {@code onNext} only and reads the decision context from the Reactor Context. */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            logStage(stageName, TraceContextUtil.getDecisionContext(signal.getContextView()));
        };
    }

    public void logStage(String stageName, DecisionContext context) {
        TraceContextUtil.withMdc(context, () ->
            log.info("[DecisionFlow] stage={} decisionId={} asset={} session={}",
                stageName, context.decisionId(), context.assetPair(), context.session())
        );
    }

    /** Compact summary of a finalized decision and its verdict. */
    public void logDecision(Decision decision, RiskVerdict verdict, String session) {
        TraceContextUtil.withMdc(DecisionContext.of(decision.id(), decision.assetPair(), session), () ->
            log.info("[DecisionFlow] stage={} decisionId={} asset={} session={} action={} confidence={} tier={} "
                     + "signalOnly={} size={} allowed={} reason={}",
                     DECISION_FINALIZED, decision.id(), decision.assetPair(), session,
                     decision.action(), decision.confidence(),
                     decision.aggregationTier() != null ? decision.aggregationTier().level() : null,
                     decision.signalOnly(), decision.recommendedPositionSize(),
                     verdict.allow(), verdict.reason())
        );
    }
}
