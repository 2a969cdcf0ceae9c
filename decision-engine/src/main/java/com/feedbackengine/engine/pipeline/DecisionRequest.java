package com.feedbackengine.engine.pipeline;

import com.feedbackengine.common.model.MarketRegime;
import com.feedbackengine.common.model.MarketSnapshot;
import com.feedbackengine.common.model.RiskContext;

/**
 * Input to one pipeline run.
 *
 * @param regime     regime used for weight sampling, {@code UNKNOWN} when not classified
 * @param balance    account balance for sizing; {@code null} yields a signal-only decision
 * @param decisionId explicit id, or {@code null} to derive one
 */
public record DecisionRequest(
    MarketSnapshot snapshot,
    RiskContext context,
    MarketRegime regime,
    Double balance,
    String decisionId
) {

    public DecisionRequest {
        if (snapshot == null) throw new IllegalArgumentException("snapshot must not be null");
        if (context == null) throw new IllegalArgumentException("risk context must not be null");
        regime = regime == null ? MarketRegime.UNKNOWN : regime;
    }

    public static DecisionRequest of(MarketSnapshot snapshot, RiskContext context, MarketRegime regime, Double balance) {
        return new DecisionRequest(snapshot, context, regime, balance, null);
    }
}
