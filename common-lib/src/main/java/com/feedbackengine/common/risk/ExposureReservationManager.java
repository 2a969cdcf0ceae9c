package com.feedbackengine.common.risk;

import com.feedbackengine.common.model.ExposureSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Atomic notional reservations that keep concurrent decisions from spending the
 * same exposure budget twice.
 *
 * <pre>
 *   available = portfolioValue × maxExposurePct − openNotional − Σ outstanding reservations
 * </pre>
 *
 * <p>Lifecycle: {@code reserve} → {@code commit} (filled) or {@code rollback} (rejected).
 * Reservations older than the TTL are treated as abandoned and cleared before every
 * reserve. All operations are serialized on this instance.
 */
public class ExposureReservationManager {

    private static final Logger log = LoggerFactory.getLogger(ExposureReservationManager.class);

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(300);

    public record Reservation(String decisionId, String assetPair, double notional, Instant reservedAt) {}

    private final Map<String, Reservation> reservations = new LinkedHashMap<>();
    private final double maxExposurePct;
    private final Duration ttl;
    private final Clock clock;

    public ExposureReservationManager(double maxExposurePct, Duration ttl, Clock clock) {
        if (!(maxExposurePct > 0)) {
            throw new IllegalArgumentException("maxExposurePct must be > 0, got " + maxExposurePct);
        }
        this.maxExposurePct = maxExposurePct;
        this.ttl = ttl != null ? ttl : DEFAULT_TTL;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * @return {@code true} when the notional fits the remaining budget and was reserved;
     *         {@code false} on a duplicate decision id, unknown balance or exhausted budget
     */
    public synchronized boolean reserve(String decisionId, String assetPair, double notional,
                                        ExposureSnapshot exposure) {
        clearStale();
        if (reservations.containsKey(decisionId)) {
            log.warn("[ExposureReservation] Duplicate reservation attempt. decisionId={}", decisionId);
            return false;
        }
        if (!Double.isFinite(notional) || notional < 0) {
            throw new IllegalArgumentException("notional must be finite and >= 0, got " + notional);
        }
        double available = available(exposure);
        if (notional > available) {
            log.info("[ExposureReservation] Budget exhausted. asset={} requested={} available={}",
                assetPair, notional, available);
            return false;
        }
        reservations.put(decisionId, new Reservation(decisionId, assetPair, notional, clock.instant()));
        log.debug("[ExposureReservation] Reserved. decisionId={} asset={} notional={}", decisionId, assetPair, notional);
        return true;
    }

    /** Remaining budget; zero when the portfolio value is unknown. */
    public synchronized double available(ExposureSnapshot exposure) {
        if (exposure == null || !exposure.hasUsableBalance()) return 0.0;
        return exposure.portfolioValue() * maxExposurePct - exposure.openNotional() - outstanding();
    }

    /** Removes the reservation once the trade is filled; its notional is then part of open notional. */
    public synchronized Optional<Reservation> commit(String decisionId) {
        Reservation removed = reservations.remove(decisionId);
        if (removed == null) {
            log.warn("[ExposureReservation] Commit for unknown reservation. decisionId={}", decisionId);
        }
        return Optional.ofNullable(removed);
    }

    public synchronized boolean rollback(String decisionId) {
        return reservations.remove(decisionId) != null;
    }

    public synchronized int clearStale() {
        Instant cutoff = clock.instant().minus(ttl);
        int before = reservations.size();
        reservations.values().removeIf(r -> r.reservedAt().isBefore(cutoff));
        int cleared = before - reservations.size();
        if (cleared > 0) {
            log.warn("[ExposureReservation] Cleared {} stale reservation(s) older than {}s", cleared, ttl.toSeconds());
        }
        return cleared;
    }

    public synchronized int clearAll() {
        int count = reservations.size();
        reservations.clear();
        return count;
    }

    public synchronized double outstanding() {
        return reservations.values().stream().mapToDouble(Reservation::notional).sum();
    }

    public synchronized Map<String, Double> reservedByAsset() {
        Map<String, Double> byAsset = new LinkedHashMap<>();
        reservations.values().forEach(r -> byAsset.merge(r.assetPair(), r.notional(), Double::sum));
        return byAsset;
    }

    public synchronized int count() {
        return reservations.size();
    }
}
