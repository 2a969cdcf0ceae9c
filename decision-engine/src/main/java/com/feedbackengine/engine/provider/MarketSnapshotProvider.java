package com.feedbackengine.engine.provider;

import com.feedbackengine.common.model.MarketSnapshot;

import java.time.Instant;
import java.util.List;

/** Source of market snapshots. Replay feeds the pipeline from {@link #history}. */
public interface MarketSnapshotProvider {

    MarketSnapshot latest(String assetPair, String timeframe);

    /** Snapshots in {@code [from, to)}, oldest first. */
    List<MarketSnapshot> history(String assetPair, String timeframe, Instant from, Instant to);
}
