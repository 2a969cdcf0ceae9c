package com.feedbackengine.common.risk;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Rejects live decisions made on stale snapshots. Never consulted in replay.
 */
public final class DataFreshnessValidator {

    /** Tolerated clock skew for snapshots stamped slightly in the future. */
    static final Duration FUTURE_TOLERANCE = Duration.ofSeconds(60);

    private final Duration maxAge;

    public DataFreshnessValidator(Duration maxAge) {
        if (maxAge == null || maxAge.isNegative() || maxAge.isZero()) {
            throw new IllegalArgumentException("maxAge must be positive, got " + maxAge);
        }
        this.maxAge = maxAge;
    }

    /** @return rejection reason, empty when the snapshot is fresh */
    public Optional<String> check(Instant snapshotTimestamp, Instant now) {
        if (snapshotTimestamp == null) {
            return Optional.of("Missing market data timestamp");
        }
        Duration age = Duration.between(snapshotTimestamp, now);
        if (age.compareTo(FUTURE_TOLERANCE.negated()) < 0) {
            return Optional.of("Market data timestamp in the future by " + age.negated().toSeconds() + "s");
        }
        if (age.compareTo(maxAge) > 0) {
            return Optional.of("Stale market data (" + age.toMinutes() + " min old, limit "
                + maxAge.toMinutes() + " min)");
        }
        return Optional.empty();
    }
}
