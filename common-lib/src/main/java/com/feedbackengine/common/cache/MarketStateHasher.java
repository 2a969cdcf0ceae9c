package com.feedbackengine.common.cache;

import com.feedbackengine.common.exception.EngineException;
import com.feedbackengine.common.model.MarketSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Cache key for a market state.
 *
 * <pre>
 *   key = assetPair "_" epochSecond "_" hex(SHA-256(assetPair | timestamp | canonicalJson(snapshot)))
 * </pre>
 *
 * Canonical JSON sorts properties and map keys, so equal snapshots always hash equally
 * and any difference in OHLCV or indicators produces a different key.
 */
public final class MarketStateHasher {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .build();

    private MarketStateHasher() {}

    public static String key(MarketSnapshot snapshot) {
        return snapshot.assetPair() + "_" + snapshot.timestamp().getEpochSecond() + "_" + hash(snapshot);
    }

    public static String hash(MarketSnapshot snapshot) {
        try {
            String payload = snapshot.assetPair() + "|" + snapshot.timestamp() + "|"
                + CANONICAL.writeValueAsString(snapshot);
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new EngineException("DecisionCache", "Cannot hash market state for " + snapshot.assetPair(), e);
        }
    }
}
