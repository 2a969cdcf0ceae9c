package com.feedbackengine.backtest.learning;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Whether the feedback loop is actually learning, measured over recorded trade outcomes.
 * Sections that need a minimum history carry {@code sufficientData = false} and zeroed
 * values below it.
 */
public record LearningValidationReport(
    @JsonProperty("totalTradesAnalyzed") int totalTradesAnalyzed,
    @JsonProperty("assetPair")           String assetPair,
    @JsonProperty("sampleEfficiency")    SampleEfficiency sampleEfficiency,
    @JsonProperty("cumulativeRegret")    CumulativeRegret cumulativeRegret,
    @JsonProperty("conceptDrift")        ConceptDrift conceptDrift,
    @JsonProperty("providerSelection")   ProviderSelection providerSelection,
    @JsonProperty("learningCurve")       LearningCurve learningCurve
) {

    /**
     * @param tradesToTargetWinRate trades seen when the rolling win rate first reached the target;
     *                              {@code null} when it never did
     * @param rollingWinRateTrend   Pearson correlation of rolling win rate against time; 0 when undefined
     */
    public record SampleEfficiency(
        @JsonProperty("tradesToTargetWinRate")     Integer tradesToTargetWinRate,
        @JsonProperty("learningSpeedPer100Trades") double learningSpeedPer100Trades,
        @JsonProperty("rollingWinRateTrend")       double rollingWinRateTrend,
        @JsonProperty("achievedTarget")            boolean achievedTarget
    ) {}

    /** Regret against the provider with the best average P&amp;L in hindsight. */
    public record CumulativeRegret(
        @JsonProperty("cumulativeRegret")  double cumulativeRegret,
        @JsonProperty("optimalProvider")   String optimalProvider,
        @JsonProperty("optimalAvgPnl")     double optimalAvgPnl,
        @JsonProperty("avgRegretPerTrade") double avgRegretPerTrade
    ) {}

    public record ConceptDrift(
        @JsonProperty("sufficientData") boolean sufficientData,
        @JsonProperty("driftScore")     double driftScore,
        @JsonProperty("windowWinRates") List<Double> windowWinRates,
        @JsonProperty("severity")       DriftSeverity severity
    ) {

        public ConceptDrift {
            windowWinRates = windowWinRates == null ? List.of() : List.copyOf(windowWinRates);
        }
    }

    /**
     * Exploration against exploitation. Lead counts come from outcomes; posterior means and
     * their normalized entropy (1 = uniform, 0 = one provider holds all weight) come from the
     * optimizer state.
     */
    public record ProviderSelection(
        @JsonProperty("leadCounts")              Map<String, Integer> leadCounts,
        @JsonProperty("explorationRate")         double explorationRate,
        @JsonProperty("exploitationConvergence") double exploitationConvergence,
        @JsonProperty("dominantProvider")        String dominantProvider,
        @JsonProperty("posteriorMeans")          Map<String, Double> posteriorMeans,
        @JsonProperty("weightEntropy")           double weightEntropy
    ) {

        public ProviderSelection {
            leadCounts = leadCounts == null ? Map.of() : Map.copyOf(leadCounts);
            posteriorMeans = posteriorMeans == null ? Map.of() : Map.copyOf(posteriorMeans);
        }
    }

    /** First quartile of trades against the last. */
    public record LearningCurve(
        @JsonProperty("sufficientData")        boolean sufficientData,
        @JsonProperty("firstWinRate")          double firstWinRate,
        @JsonProperty("firstAvgPnl")           double firstAvgPnl,
        @JsonProperty("lastWinRate")           double lastWinRate,
        @JsonProperty("lastAvgPnl")            double lastAvgPnl,
        @JsonProperty("winRateImprovementPct") double winRateImprovementPct,
        @JsonProperty("pnlImprovementPct")     double pnlImprovementPct,
        @JsonProperty("learningDetected")      boolean learningDetected
    ) {}
}
