package com.feedbackengine.common.memory;

import com.feedbackengine.common.model.MarketRegime;
import com.feedbackengine.common.model.TradeOutcome;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Point-in-time copy of {@link PortfolioMemory}. Every element is an immutable record
 * held in an unmodifiable collection, so later mutation of the live memory can never
 * reach a snapshot.
 */
public record PortfolioMemorySnapshot(
    @JsonProperty("outcomes")            List<TradeOutcome> outcomes,
    @JsonProperty("providerPerformance") Map<String, ProviderPerformance> providerPerformance,
    @JsonProperty("regimePerformance")   Map<MarketRegime, RegimePerformance> regimePerformance,
    @JsonProperty("readonly")            boolean readonly,
    @JsonProperty("takenAt")             Instant takenAt
) {

    public PortfolioMemorySnapshot {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        providerPerformance = Collections.unmodifiableMap(
            providerPerformance == null ? new TreeMap<>() : new TreeMap<>(providerPerformance));
        EnumMap<MarketRegime, RegimePerformance> regimes = new EnumMap<>(MarketRegime.class);
        if (regimePerformance != null) regimes.putAll(regimePerformance);
        regimePerformance = Collections.unmodifiableMap(regimes);
    }

    public static PortfolioMemorySnapshot empty() {
        return new PortfolioMemorySnapshot(List.of(), Map.of(), Map.of(), false, Instant.EPOCH);
    }
}
