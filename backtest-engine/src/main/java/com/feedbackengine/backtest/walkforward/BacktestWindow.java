package com.feedbackengine.backtest.walkforward;

import com.feedbackengine.common.model.MarketSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * One train/test partition. Test snapshots always start after the last train snapshot.
 *
 * @param index zero-based window number
 */
public record BacktestWindow(int index, List<MarketSnapshot> train, List<MarketSnapshot> test) {

    public BacktestWindow {
        train = List.copyOf(train);
        test  = List.copyOf(test);
    }

    public Instant trainStart() {
        return train.get(0).timestamp();
    }

    public Instant trainEnd() {
        return train.get(train.size() - 1).timestamp();
    }

    public Instant testStart() {
        return test.get(0).timestamp();
    }

    public Instant testEnd() {
        return test.get(test.size() - 1).timestamp();
    }
}
