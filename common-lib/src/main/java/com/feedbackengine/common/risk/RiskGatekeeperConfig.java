package com.feedbackengine.common.risk;

import com.feedbackengine.common.exception.ConfigurationException;

import java.time.Duration;

/**
 * Limits applied by {@link RiskGatekeeper}. All percentages are fractions.
 *
 * @param maxDrawdown            trailing drawdown above which risk-increasing trades are denied
 * @param maxVarPct              historical VaR above which risk-increasing trades are denied
 * @param maxExposurePct         total notional budget as a fraction of portfolio value
 * @param volatilityThreshold    volatility above which low-confidence trades are denied
 * @param minVolatileConfidence  confidence (0–100) required when volatility is above threshold
 */
public record RiskGatekeeperConfig(
    double maxDrawdown,
    double correlationThreshold,
    double varConfidence,
    double maxVarPct,
    double maxExposurePct,
    Duration maxDataAge,
    double volatilityThreshold,
    double minVolatileConfidence
) {

    public RiskGatekeeperConfig {
        requireFraction("maxDrawdown", maxDrawdown);
        requireFraction("maxVarPct", maxVarPct);
        requireFraction("maxExposurePct", maxExposurePct);
        if (!(correlationThreshold >= 0) || correlationThreshold >= 1.0) {
            throw new ConfigurationException("correlationThreshold must be in [0, 1), got " + correlationThreshold);
        }
        if (!(varConfidence > 0.5) || varConfidence >= 1.0) {
            throw new ConfigurationException("varConfidence must be in (0.5, 1), got " + varConfidence);
        }
        if (maxDataAge == null || maxDataAge.isNegative() || maxDataAge.isZero()) {
            throw new ConfigurationException("maxDataAge must be positive, got " + maxDataAge);
        }
        if (minVolatileConfidence < 0 || minVolatileConfidence > 100) {
            throw new ConfigurationException("minVolatileConfidence must be in [0, 100], got " + minVolatileConfidence);
        }
    }

    public static RiskGatekeeperConfig defaults() {
        return new RiskGatekeeperConfig(0.05, 0.7, 0.95, 0.05, 1.0, Duration.ofMinutes(15), 0.05, 80.0);
    }

    private static void requireFraction(String name, double value) {
        if (!(value > 0) || value > 1.0) {
            throw new ConfigurationException(name + " must be a fraction in (0, 1], got " + value);
        }
    }
}
