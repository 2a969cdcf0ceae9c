package com.feedbackengine.common.weights;

import com.feedbackengine.common.model.ProviderWeightState;
import com.feedbackengine.common.persistence.JsonFileStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

/** Weight state as a pretty-printed JSON object keyed by provider id. */
public class JsonFileWeightStateStore implements WeightStateStore {

    private final JsonFileStore<TreeMap<String, ProviderWeightState>> file;

    public JsonFileWeightStateStore(Path path, ObjectMapper mapper, boolean freshStartOnCorruption) {
        this.file = new JsonFileStore<>("WeightOptimizer", path, mapper,
            new TypeReference<TreeMap<String, ProviderWeightState>>() {}, freshStartOnCorruption);
    }

    @Override
    public Map<String, ProviderWeightState> load() {
        return file.load().<Map<String, ProviderWeightState>>map(m -> m).orElse(Map.of());
    }

    @Override
    public void save(Map<String, ProviderWeightState> states) {
        file.save(new TreeMap<>(states));
    }
}
