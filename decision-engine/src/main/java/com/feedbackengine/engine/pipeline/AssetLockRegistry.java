package com.feedbackengine.engine.pipeline;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/** One lock per asset pair: decisions for an asset are serialized, different assets run concurrently. */
public class AssetLockRegistry {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String assetPair, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(assetPair, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked(String assetPair) {
        ReentrantLock lock = locks.get(assetPair);
        return lock != null && lock.isLocked();
    }
}
