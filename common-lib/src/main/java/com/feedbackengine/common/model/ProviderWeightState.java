package com.feedbackengine.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Beta posterior plus per-regime multipliers for one provider.
 *
 * <pre>
 *   prior             Beta(1, 1)
 *   win               alpha + 1, multiplier[regime] × 1.10
 *   loss              beta  + 1, multiplier[regime] × 0.95
 *   multiplier clamp  [0.1, 10.0]
 * </pre>
 */
public record ProviderWeightState(
    @JsonProperty("alpha")             double alpha,
    @JsonProperty("beta")              double beta,
    @JsonProperty("regimeMultipliers") Map<MarketRegime, Double> regimeMultipliers
) {

    public static final double MIN_MULTIPLIER = 0.1;
    public static final double MAX_MULTIPLIER = 10.0;
    public static final double WIN_FACTOR     = 1.1;
    public static final double LOSS_FACTOR    = 0.95;

    public ProviderWeightState {
        if (!(alpha > 0) || !(beta > 0)) {
            throw new IllegalArgumentException("Beta parameters must be > 0, got alpha=" + alpha + " beta=" + beta);
        }
        EnumMap<MarketRegime, Double> copy = new EnumMap<>(MarketRegime.class);
        for (MarketRegime regime : MarketRegime.values()) {
            if (!regime.isTracked()) continue;
            Double value = regimeMultipliers != null ? regimeMultipliers.get(regime) : null;
            copy.put(regime, clamp(value != null ? value : 1.0));
        }
        regimeMultipliers = Collections.unmodifiableMap(copy);
    }

    public static ProviderWeightState prior() {
        return new ProviderWeightState(1.0, 1.0, null);
    }

    /** New state after one realized outcome in {@code regime}. */
    public ProviderWeightState update(boolean won, MarketRegime regime) {
        EnumMap<MarketRegime, Double> next = new EnumMap<>(regimeMultipliers);
        if (regime != null && regime.isTracked()) {
            next.put(regime, clamp(next.get(regime) * (won ? WIN_FACTOR : LOSS_FACTOR)));
        }
        return won
            ? new ProviderWeightState(alpha + 1, beta, next)
            : new ProviderWeightState(alpha, beta + 1, next);
    }

    /** Multiplier for the regime; 1.0 for {@link MarketRegime#UNKNOWN} or {@code null}. */
    public double multiplier(MarketRegime regime) {
        if (regime == null || !regime.isTracked()) return 1.0;
        return regimeMultipliers.getOrDefault(regime, 1.0);
    }

    @JsonIgnore
    public double expectedValue() {
        return alpha / (alpha + beta);
    }

    /** Observed win rate excluding the prior; 0.5 before any outcome. */
    @JsonIgnore
    public double winRate() {
        double observed = (alpha - 1) + (beta - 1);
        return observed > 0 ? (alpha - 1) / observed : 0.5;
    }

    @JsonIgnore
    public int observations() {
        return (int) Math.round((alpha - 1) + (beta - 1));
    }

    private static double clamp(double value) {
        return Math.max(MIN_MULTIPLIER, Math.min(MAX_MULTIPLIER, value));
    }
}
