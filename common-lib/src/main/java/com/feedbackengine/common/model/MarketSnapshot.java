package com.feedbackengine.common.model;

import com.feedbackengine.common.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable OHLCV + indicator view of one asset at one time step.
 *
 * <p>Indicators are copied into a key-sorted map so two snapshots with the same
 * content always serialize identically (required by the decision cache hash).
 */
public record MarketSnapshot(
    @JsonProperty("assetPair")  String assetPair,
    @JsonProperty("timeframe")  String timeframe,
    @JsonProperty("timestamp")  Instant timestamp,
    @JsonProperty("open")       double open,
    @JsonProperty("high")       double high,
    @JsonProperty("low")        double low,
    @JsonProperty("close")      double close,
    @JsonProperty("volume")     double volume,
    @JsonProperty("indicators") Map<String, Double> indicators
) {

    public MarketSnapshot {
        if (assetPair == null || assetPair.isBlank()) {
            throw new ValidationException("assetPair", "must not be blank");
        }
        if (timestamp == null) {
            throw new ValidationException("timestamp", "must not be null for " + assetPair);
        }
        requirePositive("open", open);
        requirePositive("high", high);
        requirePositive("low", low);
        requirePositive("close", close);
        if (high < low) {
            throw new ValidationException("high", "high " + high + " below low " + low + " for " + assetPair);
        }
        if (!Double.isFinite(volume) || volume < 0) {
            throw new ValidationException("volume", "must be finite and >= 0, got " + volume);
        }
        indicators = indicators == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new TreeMap<>(indicators));
    }

    public static MarketSnapshot of(String assetPair, String timeframe, Instant timestamp,
                                    double open, double high, double low, double close,
                                    double volume, Map<String, Double> indicators) {
        return new MarketSnapshot(assetPair, timeframe, timestamp, open, high, low, close, volume, indicators);
    }

    /** Returns the named indicator or {@code null} when absent. */
    public Double indicator(String name) {
        return indicators.get(name);
    }

    /**
     * Copy of this snapshot with every price scaled by {@code factor}. Used by the
     * Monte Carlo simulator to perturb a historical path.
     */
    public MarketSnapshot scaledPrices(double factor) {
        double o = open * factor;
        double h = high * factor;
        double l = low * factor;
        double c = close * factor;
        return new MarketSnapshot(assetPair, timeframe, timestamp, o, Math.max(h, l), Math.min(h, l), c,
            volume, indicators);
    }

    private static void requirePositive(String field, double value) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new ValidationException(field, "must be finite and > 0, got " + value);
        }
    }
}
