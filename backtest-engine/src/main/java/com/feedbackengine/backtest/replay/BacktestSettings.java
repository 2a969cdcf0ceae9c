package com.feedbackengine.backtest.replay;

import com.feedbackengine.common.exception.ConfigurationException;
import com.feedbackengine.common.model.AssetType;

/**
 * @param regimeLookback trailing closes fed to the regime classifier
 */
public record BacktestSettings(
    double initialBalance,
    AssetType assetType,
    int periodsPerYear,
    int regimeLookback
) {

    public BacktestSettings {
        if (!(initialBalance > 0) || !Double.isFinite(initialBalance)) {
            throw new ConfigurationException("initialBalance must be > 0, got " + initialBalance);
        }
        if (assetType == null) {
            throw new ConfigurationException("assetType must be set");
        }
        if (periodsPerYear <= 0) {
            throw new ConfigurationException("periodsPerYear must be > 0, got " + periodsPerYear);
        }
        if (regimeLookback < 3) {
            throw new ConfigurationException("regimeLookback must be >= 3, got " + regimeLookback);
        }
    }

    public static BacktestSettings crypto(double initialBalance) {
        return new BacktestSettings(initialBalance, AssetType.CRYPTO, 252, 50);
    }
}
