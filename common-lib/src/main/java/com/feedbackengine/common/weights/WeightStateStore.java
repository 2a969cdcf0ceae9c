package com.feedbackengine.common.weights;

import com.feedbackengine.common.model.ProviderWeightState;

import java.util.Map;

/** Durable home of the optimizer's posterior state. */
public interface WeightStateStore {

    /** Store that keeps nothing; used by throwaway optimizer copies. */
    WeightStateStore NONE = new WeightStateStore() {
        @Override
        public Map<String, ProviderWeightState> load() {
            return Map.of();
        }

        @Override
        public void save(Map<String, ProviderWeightState> states) {
            // nothing to persist
        }
    };

    Map<String, ProviderWeightState> load();

    void save(Map<String, ProviderWeightState> states);
}
