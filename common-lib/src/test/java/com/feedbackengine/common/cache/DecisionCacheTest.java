package com.feedbackengine.common.cache;

import com.feedbackengine.common.exception.PersistenceException;
import com.feedbackengine.common.model.AggregationTier;
import com.feedbackengine.common.model.Decision;
import com.feedbackengine.common.model.MarketSnapshot;
import com.feedbackengine.common.model.TradeAction;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DecisionCacheTest {

    private static final Instant TS = Instant.parse("2024-01-02T00:00:00Z");

    private static MarketSnapshot snapshot(double close, Map<String, Double> indicators) {
        return MarketSnapshot.of("BTCUSD", "1h", TS, 100, 110, 95, close, 1_000, indicators);
    }

    private static Decision decision(String id) {
        return Decision.signalOnly(id, "BTCUSD", TS, TradeAction.BUY, 70, AggregationTier.MAJORITY, List.of(), "r");
    }

    @Test
    @DisplayName("put then get with the same key returns the identical decision")
    void putGet() {
        DecisionCache cache = new DecisionCache();
        MarketSnapshot snap = snapshot(105, Map.of("rsi", 55.0));
        Decision d = decision("d1");

        assertTrue(cache.put(snap, d));

        assertSame(d, cache.get(snap).orElseThrow());
        assertSame(d, cache.get(DecisionCache.keyFor(snapshot(105, Map.of("rsi", 55.0)))).orElseThrow());
    }

    @Test
    @DisplayName("put is idempotent: the first decision under a key wins")
    void putIfAbsent() {
        DecisionCache cache = new DecisionCache();
        MarketSnapshot snap = snapshot(105, Map.of());

        assertTrue(cache.put(snap, decision("first")));
        assertFalse(cache.put(snap, decision("second")));
        assertEquals("first", cache.get(snap).orElseThrow().id());
    }

    @Test
    @DisplayName("same asset and timestamp but different state → different keys")
    void noPartialKeyCollision() {
        String base = DecisionCache.keyFor(snapshot(105, Map.of("rsi", 55.0)));

        assertNotEquals(base, DecisionCache.keyFor(snapshot(105.0001, Map.of("rsi", 55.0))));
        assertNotEquals(base, DecisionCache.keyFor(snapshot(105, Map.of("rsi", 55.1))));
        assertNotEquals(base, DecisionCache.keyFor(snapshot(105, Map.of("rsi", 55.0, "atr", 2.0))));
        assertTrue(base.startsWith("BTCUSD_" + TS.getEpochSecond() + "_"));
    }

    @Test
    @DisplayName("indicator insertion order does not change the key")
    void canonicalOrdering() {
        LinkedHashMap<String, Double> ab = new LinkedHashMap<>();
        ab.put("a", 1.0);
        ab.put("b", 2.0);
        LinkedHashMap<String, Double> ba = new LinkedHashMap<>();
        ba.put("b", 2.0);
        ba.put("a", 1.0);

        assertEquals(DecisionCache.keyFor(snapshot(105, ab)), DecisionCache.keyFor(snapshot(105, ba)));
    }

    @Test
    @DisplayName("stats count hits, misses and entries per asset")
    void stats() {
        DecisionCache cache = new DecisionCache();
        cache.put("k1", decision("d1"));
        cache.get("k1");
        cache.get("k1");
        cache.get("missing");

        CacheStats stats = cache.stats();
        assertEquals(1, stats.entries());
        assertEquals(2, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(2.0 / 3, stats.hitRate(), 1e-12);
        assertEquals(1L, stats.entriesByAsset().get("BTCUSD"));
    }

    @Test
    @DisplayName("entries cached before the cutoff are evicted")
    void eviction() {
        DecisionCache cache = new DecisionCache(Clock.fixed(TS, ZoneOffset.UTC));
        cache.put("k1", decision("d1"));

        assertEquals(0, cache.evictOlderThan(TS));
        assertEquals(1, cache.evictOlderThan(TS.plusSeconds(1)));
        assertEquals(0, cache.size());
    }

    // ── Persistence ─────────────────────────────────────────────────────

    private static ObjectMapper mapper() {
        return new ObjectMapper().registerModule(new JavaTimeModule());
    }

    @Test
    @DisplayName("a new cache over the same file sees decisions stored by an earlier run")
    void reloadsFromStore(@TempDir Path dir) {
        Path file = dir.resolve("decision_cache.json");
        Clock clock = Clock.fixed(TS, ZoneOffset.UTC);
        MarketSnapshot snap = snapshot(105, Map.of("rsi", 55.0));

        DecisionCache first = new DecisionCache(clock, new DecisionCacheStore(file, mapper(), false));
        assertTrue(first.put(snap, decision("d1")));
        assertTrue(Files.exists(file));

        DecisionCache second = new DecisionCache(clock, new DecisionCacheStore(file, mapper(), false));
        Decision reloaded = second.get(snap).orElseThrow();
        assertEquals("d1", reloaded.id());
        assertEquals(TradeAction.BUY, reloaded.action());
        assertEquals(70.0, reloaded.confidence(), 1e-9);
        assertEquals(1L, second.stats().entriesByAsset().get("BTCUSD"));
    }

    @Test
    @DisplayName("eviction and clearAll are flushed to the store")
    void evictionPersists(@TempDir Path dir) {
        Path file = dir.resolve("decision_cache.json");
        DecisionCache cache = new DecisionCache(Clock.fixed(TS, ZoneOffset.UTC),
            new DecisionCacheStore(file, mapper(), false));
        cache.put("old", decision("d1"));

        DecisionCache later = new DecisionCache(Clock.fixed(TS.plus(Duration.ofDays(100)), ZoneOffset.UTC),
            new DecisionCacheStore(file, mapper(), false));
        later.put("new", decision("d2"));
        assertEquals(1, later.evictOlderThan(Duration.ofDays(90)));
        assertEquals(Set.of("new"), new DecisionCacheStore(file, mapper(), false).load().keySet());

        assertEquals(1, later.clearAll());
        assertTrue(new DecisionCacheStore(file, mapper(), false).load().isEmpty());
    }

    @Test
    @DisplayName("corrupt cache file is fatal unless a fresh start is requested")
    void corruptFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("decision_cache.json");
        Files.writeString(file, "{broken");
        Clock clock = Clock.fixed(TS, ZoneOffset.UTC);

        assertThrows(PersistenceException.class,
            () -> new DecisionCache(clock, new DecisionCacheStore(file, mapper(), false)));
        assertEquals(0, new DecisionCache(clock, new DecisionCacheStore(file, mapper(), true)).size());
    }
}
