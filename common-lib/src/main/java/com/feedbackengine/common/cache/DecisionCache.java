package com.feedbackengine.common.cache;

import com.feedbackengine.common.model.Decision;
import com.feedbackengine.common.model.MarketSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.Collectors;

/**
 * Memoizes decisions by full market-state key so repeated replays over identical
 * history skip provider calls.
 *
 * <p>Reads are lock-free. {@link #put} is {@code putIfAbsent}: the first decision
 * stored under a key wins and later puts are no-ops.
 *
 * <p>With a {@link DecisionCacheStore} the cache is loaded at construction and every
 * mutation (put, eviction, clear) is flushed under one lock, so the file on disk always
 * holds a state the cache actually passed through.
 */
public class DecisionCache {

    private static final Logger log = LoggerFactory.getLogger(DecisionCache.class);

    private final ConcurrentHashMap<String, CachedDecision> entries = new ConcurrentHashMap<>();
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final Clock clock;
    private final DecisionCacheStore store;
    private final Object writeLock = new Object();

    public DecisionCache() {
        this(Clock.systemUTC());
    }

    public DecisionCache(Clock clock) {
        this(clock, null);
    }

    /** @param store {@code null} keeps the cache in process only */
    public DecisionCache(Clock clock, DecisionCacheStore store) {
        this.clock = clock;
        this.store = store;
        if (store != null) {
            entries.putAll(store.load());
            log.info("[DecisionCache] Loaded {} cached decisions from {}", entries.size(), store.path());
        }
    }

    public static String keyFor(MarketSnapshot snapshot) {
        return MarketStateHasher.key(snapshot);
    }

    public Optional<Decision> get(String key) {
        CachedDecision entry = entries.get(key);
        if (entry == null) {
            misses.increment();
            return Optional.empty();
        }
        hits.increment();
        return Optional.of(entry.decision());
    }

    public Optional<Decision> get(MarketSnapshot snapshot) {
        return get(keyFor(snapshot));
    }

    /** @return {@code true} when stored, {@code false} when the key was already present */
    public boolean put(String key, Decision decision) {
        synchronized (writeLock) {
            boolean stored = entries.putIfAbsent(key, new CachedDecision(decision, clock.instant())) == null;
            if (stored) {
                flush();
            }
            return stored;
        }
    }

    public boolean put(MarketSnapshot snapshot, Decision decision) {
        return put(keyFor(snapshot), decision);
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    /** Evicts entries cached before {@code cutoff}. */
    public int evictOlderThan(Instant cutoff) {
        synchronized (writeLock) {
            int before = entries.size();
            entries.values().removeIf(e -> e.cachedAt().isBefore(cutoff));
            int evicted = before - entries.size();
            if (evicted > 0) {
                log.info("[DecisionCache] Evicted {} entries cached before {}", evicted, cutoff);
                flush();
            }
            return evicted;
        }
    }

    /** Evicts entries older than {@code maxAge} relative to the cache clock. */
    public int evictOlderThan(Duration maxAge) {
        return evictOlderThan(clock.instant().minus(maxAge));
    }

    /** Drops every entry and resets the hit counters. @return the number of entries removed */
    public int clearAll() {
        synchronized (writeLock) {
            int removed = entries.size();
            entries.clear();
            hits.reset();
            misses.reset();
            flush();
            log.info("[DecisionCache] Cleared {} cached decisions", removed);
            return removed;
        }
    }

    public int size() {
        return entries.size();
    }

    private void flush() {
        if (store != null) {
            store.save(entries);
        }
    }

    public CacheStats stats() {
        long h = hits.sum();
        long m = misses.sum();
        Map<String, Long> byAsset = entries.values().stream()
            .collect(Collectors.groupingBy(e -> e.decision().assetPair(), TreeMap::new, Collectors.counting()));
        return new CacheStats(entries.size(), h, m, h + m > 0 ? h / (double) (h + m) : 0.0, byAsset);
    }
}
