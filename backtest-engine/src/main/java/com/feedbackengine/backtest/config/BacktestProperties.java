package com.feedbackengine.backtest.config;

import com.feedbackengine.common.exception.ConfigurationException;
import com.feedbackengine.common.model.AssetType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Bound from {@code backtest.*}; the field values are the defaults. */
@Data
@ConfigurationProperties(prefix = "backtest")
public class BacktestProperties {

    private double initialBalance = 10_000.0;
    private AssetType assetType = AssetType.CRYPTO;
    private double slippagePct = 0.0005;
    private double feePct = 0.001;
    private int periodsPerYear = 252;
    private int regimeLookback = 50;

    private WalkForward walkForward = new WalkForward();
    private MonteCarlo monteCarlo = new MonteCarlo();

    @Data
    public static class WalkForward {
        private int windowSize = 200;
        private double trainRatio = 0.7;
        /** 0 rolls forward by the test length. */
        private int step = 0;
    }

    @Data
    public static class MonteCarlo {
        private int numSimulations = 1000;
        private double priceNoiseStd = 0.001;
        private int parallelism = 4;
    }

    public void validate() {
        if (walkForward.windowSize < 2) {
            throw new ConfigurationException("backtest.walk-forward.window-size must be >= 2, got "
                + walkForward.windowSize);
        }
        if (monteCarlo.numSimulations < 1) {
            throw new ConfigurationException("backtest.monte-carlo.num-simulations must be >= 1, got "
                + monteCarlo.numSimulations);
        }
    }
}
