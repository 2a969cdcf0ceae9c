package com.feedbackengine.common.cache;

import com.feedbackengine.common.model.Decision;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record CachedDecision(
    @JsonProperty("decision") Decision decision,
    @JsonProperty("cachedAt") Instant cachedAt
) {}
