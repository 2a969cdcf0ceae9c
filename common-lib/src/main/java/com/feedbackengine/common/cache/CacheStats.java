package com.feedbackengine.common.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record CacheStats(
    @JsonProperty("entries")        int entries,
    @JsonProperty("hits")           long hits,
    @JsonProperty("misses")         long misses,
    @JsonProperty("hitRate")        double hitRate,
    @JsonProperty("entriesByAsset") Map<String, Long> entriesByAsset
) {

    public CacheStats {
        entriesByAsset = entriesByAsset == null ? Map.of() : Map.copyOf(entriesByAsset);
    }
}
