package com.feedbackengine.engine.pipeline;

import com.feedbackengine.common.model.Decision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the single open risk-increasing decision per asset pair. An entry lives from
 * approval until its execution fails or its trade outcome is recorded.
 */
public class InFlightDecisionRegistry {

    private static final Logger log = LoggerFactory.getLogger(InFlightDecisionRegistry.class);

    private final ConcurrentHashMap<String, Decision> inFlight = new ConcurrentHashMap<>();

    /** @return {@code false} when another decision is already in flight for the asset */
    public boolean tryRegister(Decision decision) {
        Decision existing = inFlight.putIfAbsent(decision.assetPair(), decision);
        if (existing != null) {
            log.warn("[InFlight] Rejected registration. asset={} decisionId={} inFlight={}",
                decision.assetPair(), decision.id(), existing.id());
            return false;
        }
        return true;
    }

    public Optional<Decision> current(String assetPair) {
        return Optional.ofNullable(inFlight.get(assetPair));
    }

    /** Releases the entry only when it belongs to {@code decisionId}. */
    public boolean release(String assetPair, String decisionId) {
        Decision current = inFlight.get(assetPair);
        return current != null && current.id().equals(decisionId) && inFlight.remove(assetPair, current);
    }

    public int size() {
        return inFlight.size();
    }

    public Map<String, String> decisionIdsByAsset() {
        Map<String, String> ids = new TreeMap<>();
        inFlight.forEach((asset, decision) -> ids.put(asset, decision.id()));
        return ids;
    }

    public void clear() {
        inFlight.clear();
    }
}
