package com.feedbackengine.common.risk;

import com.feedbackengine.common.model.Decision;
import com.feedbackengine.common.model.Holding;
import com.feedbackengine.common.model.MarketStatus;
import com.feedbackengine.common.model.RiskContext;
import com.feedbackengine.common.model.RiskRule;
import com.feedbackengine.common.model.RiskVerdict;
import com.feedbackengine.common.model.TradeAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Fail-fast risk pipeline. Rejections are {@link RiskVerdict} values, never exceptions.
 *
 * <h3>{@link #assess} (before sizing)</h3>
 * <ol>
 *   <li>Market schedule: always enforced, replay included. Closed markets deny any action;
 *       low-liquidity windows only warn.</li>
 *   <li>Data freshness: live mode only.</li>
 *   <li>Correlation: yields the size factor in [0.5, 1.0]; never denies.</li>
 *   <li>Drawdown / VaR: deny risk-increasing trades past the limits.</li>
 *   <li>Volatility / confidence: deny risk-increasing trades with volatility above the
 *       threshold and confidence below the required level.</li>
 * </ol>
 *
 * <h3>{@link #reserve} (after sizing)</h3>
 * Atomically reserves the decision's notional; over budget denies.
 *
 * <p>A trade is risk-increasing when it is BUY/SELL and does not close an opposite holding.
 */
public class RiskGatekeeper {

    private static final Logger log = LoggerFactory.getLogger(RiskGatekeeper.class);

    private final RiskGatekeeperConfig config;
    private final DataFreshnessValidator freshness;
    private final CorrelationAnalyzer correlation;
    private final ExposureReservationManager reservations;
    private final Clock clock;

    public RiskGatekeeper(RiskGatekeeperConfig config, ExposureReservationManager reservations, Clock clock) {
        this.config = config;
        this.freshness = new DataFreshnessValidator(config.maxDataAge());
        this.correlation = new CorrelationAnalyzer(config.correlationThreshold());
        this.reservations = reservations;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public RiskGatekeeperConfig config() {
        return config;
    }

    public ExposureReservationManager reservations() {
        return reservations;
    }

    /** Runs every pre-sizing step. */
    public RiskVerdict assess(String assetPair, TradeAction action, double confidence, RiskContext context) {
        List<String> warnings = new ArrayList<>();
        Instant evaluationTime = context.isReplay() ? context.evaluationTime() : clock.instant();

        MarketStatus market = MarketSchedule.status(context.assetType(), evaluationTime);
        if (!market.open()) {
            return deny(assetPair, RiskRule.MARKET_SCHEDULE, "Market closed (" + market.session() + ")", warnings);
        }
        if (market.hasWarning()) {
            warnings.add(market.warning());
        }

        if (!context.isReplay()) {
            Optional<String> stale = freshness.check(context.snapshotTimestamp(), evaluationTime);
            if (stale.isPresent()) {
                return deny(assetPair, RiskRule.DATA_FRESHNESS, stale.get(), warnings);
            }
        }

        double factor = correlation.correlationFactor(assetPair, context);
        if (factor < 1.0) {
            warnings.add(String.format("Correlated holdings: size scaled by %.2f", factor));
        }

        if (isRiskIncreasing(assetPair, action, context)) {
            double drawdown = context.performance().trailingDrawdown();
            if (drawdown > config.maxDrawdown()) {
                return deny(assetPair, RiskRule.DRAWDOWN, String.format(
                    "Max drawdown exceeded (%.2f%% > %.2f%%)", drawdown * 100, config.maxDrawdown() * 100), warnings);
            }
            OptionalDouble var = VaRCalculator.historical(context.performance().returns(), config.varConfidence());
            if (var.isPresent() && var.getAsDouble() > config.maxVarPct()) {
                return deny(assetPair, RiskRule.VALUE_AT_RISK, String.format(
                    "VaR limit exceeded (%.2f%% > %.2f%% @ %.0f%% confidence)", var.getAsDouble() * 100,
                    config.maxVarPct() * 100, config.varConfidence() * 100), warnings);
            }
            Double volatility = context.volatility();
            if (volatility != null && volatility > config.volatilityThreshold()
                && confidence < config.minVolatileConfidence()) {
                return deny(assetPair, RiskRule.VOLATILITY_CONFIDENCE,
                    "Volatility/confidence threshold exceeded", warnings);
            }
        }

        log.debug("[RiskGatekeeper] Assessment passed. asset={} action={} session={} factor={}",
            assetPair, action, market.session(), factor);
        return RiskVerdict.allow("Trade approved", warnings, factor);
    }

    /**
     * Reserves exposure for a sized decision. Decisions without notional (HOLD,
     * signal-only) and trades closing an opposite holding pass without a reservation.
     */
    public RiskVerdict reserve(Decision decision, RiskContext context, RiskVerdict assessment) {
        if (!assessment.allow()) return assessment;
        if (!decision.isActionable() || !isRiskIncreasing(decision.assetPair(), decision.action(), context)) {
            return assessment;
        }
        double notional = decision.sizing().notional();
        if (!reservations.reserve(decision.id(), decision.assetPair(), notional, context.exposure())) {
            return deny(decision.assetPair(), RiskRule.EXPOSURE_RESERVATION, String.format(
                "Exposure budget exceeded (requested %.2f, available %.2f)",
                notional, reservations.available(context.exposure())), assessment.warnings());
        }
        return assessment;
    }

    public void commit(String decisionId) {
        reservations.commit(decisionId);
    }

    public void rollback(String decisionId) {
        reservations.rollback(decisionId);
    }

    /** BUY/SELL that does not close an opposite holding. */
    public static boolean isRiskIncreasing(String assetPair, TradeAction action, RiskContext context) {
        if (action == null || !action.isDirectional()) return false;
        Optional<Holding> held = context.holdingFor(assetPair);
        return held.isEmpty() || held.get().positionType().closingAction() != action;
    }

    private RiskVerdict deny(String assetPair, RiskRule rule, String reason, List<String> warnings) {
        log.warn("[RiskGatekeeper] Denied. asset={} rule={} reason={}", assetPair, rule, reason);
        return RiskVerdict.deny(rule, reason, warnings);
    }
}
