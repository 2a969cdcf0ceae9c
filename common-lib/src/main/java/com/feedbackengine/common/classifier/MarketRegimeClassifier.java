package com.feedbackengine.common.classifier;

import com.feedbackengine.common.model.MarketRegime;

import java.util.List;

/**
 * Pure stateless classifier that maps a trailing close series to a {@link MarketRegime}.
 *
 * <p>Classification rules (evaluated in priority order):
 * <ol>
 *   <li>std-dev of period returns &gt; {@value #VOLATILE_RETURN_STD} → {@link MarketRegime#VOLATILE}</li>
 *   <li>latest close above (or below) both SMA20 and SMA50 → {@link MarketRegime#TRENDING}</li>
 *   <li>otherwise → {@link MarketRegime#RANGING}</li>
 * </ol>
 *
 * <p>Only closes up to the current step may be passed in, so replay never sees the future.
 * No logging. No side-effects.
 */
public final class MarketRegimeClassifier {

    static final double VOLATILE_RETURN_STD = 0.02;
    static final int MIN_CLOSES = 3;

    private MarketRegimeClassifier() {}

    /**
     * @param closes trailing closes, oldest first
     * @return {@link MarketRegime#UNKNOWN} with fewer than {@value #MIN_CLOSES} closes
     */
    public static MarketRegime classify(List<Double> closes) {
        if (closes == null || closes.size() < MIN_CLOSES) {
            return MarketRegime.UNKNOWN;
        }

        if (returnStdDev(closes) > VOLATILE_RETURN_STD) {
            return MarketRegime.VOLATILE;
        }

        double latest = closes.get(closes.size() - 1);
        double sma20 = sma(closes, 20);
        double sma50 = sma(closes, 50);
        boolean above = latest > sma20 && latest > sma50;
        boolean below = latest < sma20 && latest < sma50;
        if (above || below) {
            return MarketRegime.TRENDING;
        }
        return MarketRegime.RANGING;
    }

    /** Population std-dev of simple period returns; 0 with fewer than two closes. */
    public static double returnStdDev(List<Double> closes) {
        int n = closes.size();
        if (n < 2) return 0.0;
        double[] returns = new double[n - 1];
        double mean = 0.0;
        for (int i = 1; i < n; i++) {
            returns[i - 1] = closes.get(i) / closes.get(i - 1) - 1.0;
            mean += returns[i - 1];
        }
        mean /= returns.length;
        double variance = 0.0;
        for (double r : returns) {
            variance += (r - mean) * (r - mean);
        }
        return Math.sqrt(variance / returns.length);
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static double sma(List<Double> closes, int period) {
        int n    = closes.size();
        int from = Math.max(0, n - period);
        double sum   = 0.0;
        int    count = 0;
        for (int i = from; i < n; i++) {
            sum += closes.get(i);
            count++;
        }
        return count > 0 ? sum / count : 0.0;
    }
}
