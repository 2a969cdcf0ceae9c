package com.feedbackengine.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything the risk pipeline needs besides the decision itself.
 *
 * @param evaluationTime {@code null} in live mode; the historical instant in replay
 * @param correlations   pairwise correlation keyed by asset, then by other asset
 */
public record RiskContext(
    @JsonProperty("assetType")         AssetType assetType,
    @JsonProperty("evaluationTime")    Instant evaluationTime,
    @JsonProperty("snapshotTimestamp") Instant snapshotTimestamp,
    @JsonProperty("performance")       RecentPerformance performance,
    @JsonProperty("holdings")          List<Holding> holdings,
    @JsonProperty("correlations")      Map<String, Map<String, Double>> correlations,
    @JsonProperty("exposure")          ExposureSnapshot exposure,
    @JsonProperty("volatility")        Double volatility
) {

    public RiskContext {
        performance  = performance == null ? RecentPerformance.none() : performance;
        holdings     = holdings == null ? List.of() : List.copyOf(holdings);
        correlations = correlations == null ? Map.of() : Map.copyOf(correlations);
        exposure     = exposure == null ? ExposureSnapshot.unknown() : exposure;
    }

    @JsonIgnore
    public boolean isReplay() {
        return evaluationTime != null;
    }

    public Optional<Holding> holdingFor(String assetPair) {
        return holdings.stream().filter(h -> h.assetPair().equals(assetPair)).findFirst();
    }

    public Double correlation(String assetPair, String other) {
        Map<String, Double> row = correlations.get(assetPair);
        if (row != null && row.containsKey(other)) return row.get(other);
        Map<String, Double> reverse = correlations.get(other);
        return reverse != null ? reverse.get(assetPair) : null;
    }
}
