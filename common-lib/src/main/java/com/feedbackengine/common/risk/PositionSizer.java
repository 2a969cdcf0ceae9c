package com.feedbackengine.common.risk;

import com.feedbackengine.common.consensus.EnsembleDraft;
import com.feedbackengine.common.exception.ValidationException;
import com.feedbackengine.common.model.Decision;
import com.feedbackengine.common.model.PositionSizing;
import com.feedbackengine.common.model.PositionType;
import com.feedbackengine.common.model.TradeAction;

import java.time.Instant;

/**
 * Fixed-fractional position sizing.
 *
 * <pre>
 *   base  = balance × riskPct / (entryPrice × stopLossPct)
 *   final = base × correlationFactor × max(0.5, confidence / 100)
 *
 *   balance 10,000, risk 1%, entry 50,000, stop 2%  → base 0.1
 *   confidence 75, factor 1.0                      → final 0.075
 * </pre>
 *
 * <h3>Dynamic stop (optional)</h3>
 * <pre>
 *   stopLossPct = clamp(ATR × atrMultiplier / entryPrice, minStop, maxStop)
 * </pre>
 *
 * <h3>Edge cases</h3>
 * <ul>
 *   <li>balance missing, zero, negative or NaN → signal-only decision (sizing {@code null})</li>
 *   <li>entry price ≤ 0 or NaN → {@link ValidationException}</li>
 *   <li>HOLD → no sizing, not signal-only</li>
 *   <li>riskPct / stopLossPct outside (0, 1] → {@link ValidationException}
 *       (legacy whole-number percentages such as {@code 2} are not reinterpreted)</li>
 * </ul>
 */
public final class PositionSizer {

    public static final double DEFAULT_RISK_PCT = 0.01;
    public static final double DEFAULT_STOP_LOSS_PCT = 0.02;
    public static final double MIN_CONFIDENCE_FACTOR = 0.5;

    private final double riskPct;
    private final double stopLossPct;
    private final boolean dynamicStopLoss;
    private final double atrMultiplier;
    private final double minStopLossPct;
    private final double maxStopLossPct;

    public PositionSizer(double riskPct, double stopLossPct, boolean dynamicStopLoss,
                         double atrMultiplier, double minStopLossPct, double maxStopLossPct) {
        this.riskPct = requireFraction("riskPct", riskPct);
        this.stopLossPct = requireFraction("stopLossPct", stopLossPct);
        this.minStopLossPct = requireFraction("minStopLossPct", minStopLossPct);
        this.maxStopLossPct = requireFraction("maxStopLossPct", maxStopLossPct);
        if (minStopLossPct > maxStopLossPct) {
            throw new ValidationException("minStopLossPct", "must not exceed maxStopLossPct");
        }
        if (!(atrMultiplier > 0)) {
            throw new ValidationException("atrMultiplier", "must be > 0, got " + atrMultiplier);
        }
        this.dynamicStopLoss = dynamicStopLoss;
        this.atrMultiplier = atrMultiplier;
    }

    public static PositionSizer defaults() {
        return new PositionSizer(DEFAULT_RISK_PCT, DEFAULT_STOP_LOSS_PCT, false, 2.0, 0.01, 0.05);
    }

    public double riskPct() {
        return riskPct;
    }

    /** {@code balance × riskPct / (entryPrice × stopLossPct)}. */
    public double baseSize(double balance, double entryPrice, double stopLoss) {
        requireEntryPrice(entryPrice);
        return balance * riskPct / (entryPrice * stopLoss);
    }

    /** Stop-loss fraction for this entry, ATR-derived when enabled and available. */
    public double stopLossPct(double entryPrice, Double atr) {
        if (!dynamicStopLoss || atr == null || !Double.isFinite(atr) || atr <= 0) return stopLossPct;
        double dynamic = atr * atrMultiplier / entryPrice;
        return Math.max(minStopLossPct, Math.min(maxStopLossPct, dynamic));
    }

    /**
     * Sizes a directional trade.
     *
     * @param correlationFactor multiplier in (0, 1] from the correlation step
     */
    public PositionSizing size(TradeAction action, double balance, double entryPrice, double confidence,
                               double correlationFactor, Double atr) {
        requireEntryPrice(entryPrice);
        if (!(correlationFactor > 0) || correlationFactor > 1.0) {
            throw new ValidationException("correlationFactor", "must be in (0, 1], got " + correlationFactor);
        }
        double stop = stopLossPct(entryPrice, atr);
        double base = baseSize(balance, entryPrice, stop);
        double size = base * correlationFactor * Math.max(MIN_CONFIDENCE_FACTOR, confidence / 100.0);
        if (!Double.isFinite(size) || size < 0) {
            throw new ValidationException("positionSize", "computed size is invalid: " + size);
        }
        return new PositionSizing(size, entryPrice, stop, riskPct, stopLossPrice(action, entryPrice, stop));
    }

    /** Turns an ensemble draft into a decision, sized when a usable balance is known. */
    public Decision decide(String decisionId, Instant timestamp, EnsembleDraft draft, Double balance,
                           double entryPrice, double correlationFactor, Double atr) {
        requireEntryPrice(entryPrice);
        boolean usableBalance = balance != null && Double.isFinite(balance) && balance > 0;
        if (!usableBalance) {
            return Decision.signalOnly(decisionId, draft.assetPair(), timestamp, draft.action(),
                draft.confidence(), draft.tier(), draft.votes(), draft.reasoning());
        }
        PositionSizing sizing = draft.action().isDirectional()
            ? size(draft.action(), balance, entryPrice, draft.confidence(), correlationFactor, atr)
            : null;
        return Decision.sized(decisionId, draft.assetPair(), timestamp, draft.action(), draft.confidence(),
            sizing, draft.tier(), draft.votes(), draft.reasoning());
    }

    static Double stopLossPrice(TradeAction action, double entryPrice, double stop) {
        PositionType type = PositionType.fromAction(action);
        if (type == null) return null;
        return type == PositionType.LONG ? entryPrice * (1 - stop) : entryPrice * (1 + stop);
    }

    private static void requireEntryPrice(double entryPrice) {
        if (!Double.isFinite(entryPrice) || entryPrice <= 0) {
            throw new ValidationException("entryPrice", "must be finite and > 0, got " + entryPrice);
        }
    }

    private static double requireFraction(String field, double value) {
        if (!Double.isFinite(value) || value <= 0 || value > 1.0) {
            throw new ValidationException(field, "must be a fraction in (0, 1], got " + value);
        }
        return value;
    }
}
