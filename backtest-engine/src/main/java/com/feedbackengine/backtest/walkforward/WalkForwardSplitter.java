package com.feedbackengine.backtest.walkforward;

import com.feedbackengine.common.exception.ConfigurationException;
import com.feedbackengine.common.model.MarketSnapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * Rolling train/test partitioning over a chronological snapshot series.
 *
 * <pre>
 *   train = floor(windowSize × trainRatio), test = windowSize − train
 *   window k covers [k × step, k × step + windowSize)
 * </pre>
 * Windows whose test range would run past the data are not produced.
 */
public class WalkForwardSplitter {

    private final int windowSize;
    private final double trainRatio;
    private final int step;

    /**
     * @param step snapshots to roll forward between windows; {@code 0} uses the test length
     */
    public WalkForwardSplitter(int windowSize, double trainRatio, int step) {
        if (!(trainRatio > 0) || trainRatio >= 1) {
            throw new ConfigurationException("trainRatio must be in (0, 1), got " + trainRatio);
        }
        int train = (int) Math.floor(windowSize * trainRatio);
        if (train < 1 || windowSize - train < 1) {
            throw new ConfigurationException("windowSize " + windowSize + " too small for trainRatio " + trainRatio);
        }
        if (step < 0) {
            throw new ConfigurationException("step must be >= 0, got " + step);
        }
        this.windowSize = windowSize;
        this.trainRatio = trainRatio;
        this.step = step == 0 ? windowSize - train : step;
    }

    public int trainSize() {
        return (int) Math.floor(windowSize * trainRatio);
    }

    public int testSize() {
        return windowSize - trainSize();
    }

    public int step() {
        return step;
    }

    public List<BacktestWindow> split(List<MarketSnapshot> snapshots) {
        List<BacktestWindow> windows = new ArrayList<>();
        int train = trainSize();
        for (int start = 0; start + windowSize <= snapshots.size(); start += step) {
            windows.add(new BacktestWindow(windows.size(),
                snapshots.subList(start, start + train),
                snapshots.subList(start + train, start + windowSize)));
        }
        return windows;
    }
}
