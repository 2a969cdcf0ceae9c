package com.feedbackengine.common.risk;

import com.feedbackengine.common.model.ExposureSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ExposureReservationManagerTest {

    private static final ExposureSnapshot PORTFOLIO = new ExposureSnapshot(10_000.0, 2_000.0);

    /** Clock whose instant the test moves forward. */
    private static final class SteppingClock extends Clock {
        private Instant now = Instant.parse("2024-06-12T12:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
        @Override public Instant instant() { return now; }
    }

    private final SteppingClock clock = new SteppingClock();
    private final ExposureReservationManager manager =
        new ExposureReservationManager(0.5, ExposureReservationManager.DEFAULT_TTL, clock);

    @Test
    @DisplayName("budget = value × pct − open notional − outstanding reservations")
    void budget() {
        assertEquals(3_000.0, manager.available(PORTFOLIO), 1e-9);
        assertTrue(manager.reserve("d1", "BTCUSD", 1_000, PORTFOLIO));
        assertEquals(2_000.0, manager.available(PORTFOLIO), 1e-9);
        assertFalse(manager.reserve("d2", "ETHUSD", 2_500, PORTFOLIO));
    }

    @Test
    @DisplayName("duplicate decision id → false")
    void duplicate() {
        assertTrue(manager.reserve("d1", "BTCUSD", 100, PORTFOLIO));
        assertFalse(manager.reserve("d1", "BTCUSD", 100, PORTFOLIO));
        assertEquals(1, manager.count());
    }

    @Test
    @DisplayName("commit removes the reservation and returns it")
    void commit() {
        manager.reserve("d1", "BTCUSD", 500, PORTFOLIO);

        assertEquals(500.0, manager.commit("d1").orElseThrow().notional(), 0.0);
        assertTrue(manager.commit("d1").isEmpty());
        assertEquals(0.0, manager.outstanding(), 0.0);
    }

    @Test
    @DisplayName("reservations older than the TTL are cleared")
    void staleCleared() {
        manager.reserve("d1", "BTCUSD", 2_500, PORTFOLIO);
        clock.advance(Duration.ofSeconds(301));

        assertTrue(manager.reserve("d2", "ETHUSD", 2_500, PORTFOLIO));
        assertEquals(1, manager.count());
        assertEquals(2_500.0, manager.reservedByAsset().get("ETHUSD"), 0.0);
    }

    @Test
    @DisplayName("unknown balance → nothing can be reserved")
    void unknownBalance() {
        assertFalse(manager.reserve("d1", "BTCUSD", 1, ExposureSnapshot.unknown()));
    }

    @Test
    @DisplayName("concurrent reservations never exceed the budget")
    void concurrentNoDoubleSpend() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();
        for (int i = 0; i < 50; i++) {
            String id = "d" + i;
            pool.submit(() -> {
                start.await();
                if (manager.reserve(id, "BTCUSD", 1_000, PORTFOLIO)) granted.incrementAndGet();
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(3, granted.get());
        assertEquals(3_000.0, manager.outstanding(), 1e-9);
    }

    @Test
    @DisplayName("clearAll empties the book")
    void clearAll() {
        manager.reserve("d1", "BTCUSD", 100, PORTFOLIO);
        manager.reserve("d2", "ETHUSD", 100, PORTFOLIO);

        assertEquals(2, manager.clearAll());
        assertEquals(0, manager.count());
    }
}
