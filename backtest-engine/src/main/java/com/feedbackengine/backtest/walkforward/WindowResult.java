package com.feedbackengine.backtest.walkforward;

import com.feedbackengine.common.metrics.PerformanceReport;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record WindowResult(
    @JsonProperty("index")            int index,
    @JsonProperty("trainStart")       Instant trainStart,
    @JsonProperty("trainEnd")         Instant trainEnd,
    @JsonProperty("testStart")        Instant testStart,
    @JsonProperty("testEnd")          Instant testEnd,
    @JsonProperty("train")            PerformanceReport train,
    @JsonProperty("test")             PerformanceReport test,
    @JsonProperty("sharpeRatio")      double sharpeRatio,
    @JsonProperty("winRateRatio")     double winRateRatio
) {}
