package com.feedbackengine.common.weights;

import com.feedbackengine.common.model.MarketRegime;
import com.feedbackengine.common.model.ProviderWeightState;
import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Learns provider weights with Thompson sampling over Beta posteriors.
 *
 * <h3>Sampling</h3>
 * <pre>
 *   s_i      ~ Beta(alpha_i, beta_i) × multiplier_i[regime]
 *   weight_i = s_i / Σ s
 * </pre>
 * A single provider always gets 1.0; if every sample is zero the weights are equal.
 * Providers are sampled in id order, so a fixed seed reproduces the same weights.
 *
 * <h3>Concurrency</h3>
 * Updates are an atomic read-modify-write per provider ({@link ConcurrentHashMap#compute}).
 * Update, snapshot and flush through the {@link WeightStateStore} happen under one write
 * lock, so saves reach the store in update order and never carry older state than the
 * previous save. Sampling shares one seeded generator and is serialized on it.
 */
public class ThompsonSamplingWeightOptimizer {

    private static final Logger log = LoggerFactory.getLogger(ThompsonSamplingWeightOptimizer.class);

    private final ConcurrentHashMap<String, ProviderWeightState> states = new ConcurrentHashMap<>();
    private final WeightStateStore store;
    private final RandomGenerator random;
    private final Object writeLock = new Object();

    public ThompsonSamplingWeightOptimizer(Collection<String> providerIds, WeightStateStore store, long seed) {
        this.store = store != null ? store : WeightStateStore.NONE;
        this.random = new Well19937c(seed);
        this.states.putAll(this.store.load());
        if (providerIds != null) {
            providerIds.forEach(this::registerProvider);
        }
        log.info("[WeightOptimizer] Initialized. providers={} seed={}", states.size(), seed);
    }

    /** Adds a provider with the Beta(1,1) prior; no-op when already known. */
    public void registerProvider(String providerId) {
        if (providerId == null || providerId.isBlank()) {
            throw new IllegalArgumentException("Provider id must not be blank");
        }
        states.putIfAbsent(providerId, ProviderWeightState.prior());
    }

    public boolean isKnown(String providerId) {
        return providerId != null && states.containsKey(providerId);
    }

    /**
     * Records one realized outcome for {@code providerId} and flushes the state.
     *
     * @throws IllegalArgumentException when the provider was never registered
     */
    public void updateWeightsFromOutcome(String providerId, boolean won, MarketRegime regime) {
        synchronized (writeLock) {
            ProviderWeightState updated = states.computeIfPresent(providerId, (id, state) -> state.update(won, regime));
            if (updated == null) {
                throw new IllegalArgumentException("Unknown provider: " + providerId);
            }
            log.debug("[WeightOptimizer] provider={} won={} regime={} alpha={} beta={}",
                providerId, won, regime, updated.alpha(), updated.beta());
            store.save(stateSnapshot());
        }
    }

    /** One Thompson draw per provider, scaled by the regime multiplier, normalized to 1.0. */
    public Map<String, Double> sampleWeights(MarketRegime regime) {
        TreeMap<String, ProviderWeightState> ordered = new TreeMap<>(states);
        Map<String, Double> weights = new LinkedHashMap<>();
        if (ordered.isEmpty()) return weights;
        if (ordered.size() == 1) {
            weights.put(ordered.firstKey(), 1.0);
            return weights;
        }

        Map<String, Double> samples = new LinkedHashMap<>();
        synchronized (random) {
            for (Map.Entry<String, ProviderWeightState> e : ordered.entrySet()) {
                ProviderWeightState s = e.getValue();
                double draw = new BetaDistribution(random, s.alpha(), s.beta()).sample();
                samples.put(e.getKey(), draw * s.multiplier(regime));
            }
        }
        return normalize(samples);
    }

    /** Deterministic {@code alpha / (alpha + beta)} per provider, normalized to 1.0. */
    public Map<String, Double> expectedWeights() {
        Map<String, Double> expected = new LinkedHashMap<>();
        new TreeMap<>(states).forEach((id, s) -> expected.put(id, s.expectedValue()));
        return normalize(expected);
    }

    /** Observed win rate per provider; 0.5 before any outcome. */
    public Map<String, Double> providerWinRates() {
        Map<String, Double> rates = new LinkedHashMap<>();
        new TreeMap<>(states).forEach((id, s) -> rates.put(id, s.winRate()));
        return rates;
    }

    public ProviderWeightState state(String providerId) {
        return states.get(providerId);
    }

    public Map<String, ProviderWeightState> stateSnapshot() {
        return new TreeMap<>(states);
    }

    /** Independent optimizer with the same posteriors, its own generator and no persistence. */
    public ThompsonSamplingWeightOptimizer copy(long seed) {
        ThompsonSamplingWeightOptimizer copy = new ThompsonSamplingWeightOptimizer(null, WeightStateStore.NONE, seed);
        copy.states.putAll(states);
        return copy;
    }

    /** Replaces the posteriors wholesale, e.g. when restoring after a walk-forward window. */
    public void restore(Map<String, ProviderWeightState> snapshot) {
        synchronized (writeLock) {
            states.clear();
            states.putAll(snapshot);
        }
    }

    private static Map<String, Double> normalize(Map<String, Double> raw) {
        double sum = raw.values().stream().mapToDouble(Double::doubleValue).sum();
        Map<String, Double> out = new LinkedHashMap<>();
        if (sum <= 0 || !Double.isFinite(sum)) {
            raw.keySet().forEach(id -> out.put(id, 1.0 / raw.size()));
        } else {
            raw.forEach((id, v) -> out.put(id, v / sum));
        }
        return out;
    }
}
