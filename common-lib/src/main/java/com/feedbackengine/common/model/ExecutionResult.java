package com.feedbackengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** What the execution layer reports back for a finalized decision. */
public record ExecutionResult(
    @JsonProperty("success")    boolean success,
    @JsonProperty("fillPrice")  double fillPrice,
    @JsonProperty("fees")       double fees,
    @JsonProperty("filledSize") double filledSize,
    @JsonProperty("executedAt") Instant executedAt,
    @JsonProperty("message")    String message
) {

    public static ExecutionResult filled(double fillPrice, double fees, double filledSize, Instant executedAt) {
        return new ExecutionResult(true, fillPrice, fees, filledSize, executedAt, "filled");
    }

    public static ExecutionResult rejected(String message, Instant at) {
        return new ExecutionResult(false, 0.0, 0.0, 0.0, at, message);
    }
}
