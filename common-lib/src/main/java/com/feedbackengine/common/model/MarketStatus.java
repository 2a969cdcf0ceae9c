package com.feedbackengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Open/closed state and trading session of a market at an instant.
 *
 * @param session human-readable session label ("London", "Overlap", "24/7", "Closed", ...)
 * @param warning non-blocking liquidity note, {@code null} when none
 */
public record MarketStatus(
    @JsonProperty("open")    boolean open,
    @JsonProperty("session") String session,
    @JsonProperty("warning") String warning
) {

    public static MarketStatus open(String session) {
        return new MarketStatus(true, session, null);
    }

    public static MarketStatus closed(String session) {
        return new MarketStatus(false, session, null);
    }

    public boolean hasWarning() {
        return warning != null;
    }
}
