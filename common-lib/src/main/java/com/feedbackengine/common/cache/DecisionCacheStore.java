package com.feedbackengine.common.cache;

import com.feedbackengine.common.persistence.JsonFileStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

/**
 * Cached decisions as one JSON object keyed by market-state key, so a later replay
 * over the same history reuses earlier runs' decisions.
 */
public class DecisionCacheStore {

    private final JsonFileStore<TreeMap<String, CachedDecision>> file;

    public DecisionCacheStore(Path path, ObjectMapper mapper, boolean freshStartOnCorruption) {
        this.file = new JsonFileStore<>("DecisionCache", path, mapper,
            new TypeReference<TreeMap<String, CachedDecision>>() {}, freshStartOnCorruption);
    }

    public Path path() {
        return file.path();
    }

    public Map<String, CachedDecision> load() {
        return file.load().<Map<String, CachedDecision>>map(m -> m).orElse(Map.of());
    }

    public void save(Map<String, CachedDecision> entries) {
        file.save(new TreeMap<>(entries));
    }
}
