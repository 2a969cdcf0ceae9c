package com.feedbackengine.backtest.replay;

import com.feedbackengine.common.exception.ConfigurationException;
import com.feedbackengine.common.model.Decision;
import com.feedbackengine.common.model.ExecutionResult;
import com.feedbackengine.common.model.PositionType;
import com.feedbackengine.common.model.TradeAction;
import com.feedbackengine.engine.provider.ExecutionGateway;

/**
 * Simulated fills for replay.
 *
 * <pre>
 *   buy fill  = price × (1 + slippage)
 *   sell fill = price × (1 − slippage)
 *   fee       = fill × size × feePct
 * </pre>
 */
public class FillSimulator implements ExecutionGateway {

    private final double slippagePct;
    private final double feePct;

    public FillSimulator(double slippagePct, double feePct) {
        if (!(slippagePct >= 0) || slippagePct >= 1) {
            throw new ConfigurationException("slippagePct must be in [0, 1), got " + slippagePct);
        }
        if (!(feePct >= 0) || feePct >= 1) {
            throw new ConfigurationException("feePct must be in [0, 1), got " + feePct);
        }
        this.slippagePct = slippagePct;
        this.feePct = feePct;
    }

    @Override
    public ExecutionResult execute(Decision decision) {
        if (!decision.isActionable()) {
            return ExecutionResult.rejected("Nothing to fill for " + decision.action(), decision.timestamp());
        }
        double size = decision.recommendedPositionSize();
        double fill = fillPrice(decision.action(), decision.entryPrice());
        return ExecutionResult.filled(fill, fee(fill, size), size, decision.timestamp());
    }

    /** Exit fill for closing a position of {@code type} at {@code price}. */
    public double exitPrice(PositionType type, double price) {
        return fillPrice(type.closingAction(), price);
    }

    public double fee(double fillPrice, double size) {
        return fillPrice * size * feePct;
    }

    private double fillPrice(TradeAction action, double price) {
        return action == TradeAction.BUY ? price * (1 + slippagePct) : price * (1 - slippagePct);
    }
}
