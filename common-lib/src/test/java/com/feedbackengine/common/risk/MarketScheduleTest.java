package com.feedbackengine.common.risk;

import com.feedbackengine.common.model.AssetType;
import com.feedbackengine.common.model.MarketStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class MarketScheduleTest {

    private static MarketStatus at(AssetType type, String instant) {
        return MarketSchedule.status(type, Instant.parse(instant));
    }

    @Nested
    @DisplayName("FOREX")
    class ForexTests {

        @Test
        @DisplayName("Saturday → closed")
        void saturdayClosed() {
            assertFalse(at(AssetType.FOREX, "2024-06-15T12:00:00Z").open());
        }

        @Test
        @DisplayName("Friday 17:30 New York → closed")
        void fridayAfterRollover() {
            assertFalse(at(AssetType.FOREX, "2024-06-14T21:30:00Z").open());
        }

        @Test
        @DisplayName("Friday 16:30 New York → still open")
        void fridayBeforeRollover() {
            assertTrue(at(AssetType.FOREX, "2024-06-14T20:30:00Z").open());
        }

        @Test
        @DisplayName("Sunday 16:00 New York → closed; 18:00 → open")
        void sundayReopen() {
            assertFalse(at(AssetType.FOREX, "2024-06-16T20:00:00Z").open());
            assertTrue(at(AssetType.FOREX, "2024-06-16T22:00:00Z").open());
        }

        @Test
        @DisplayName("sessions: London, Overlap, New York, Asian")
        void sessions() {
            assertEquals("London",   at(AssetType.FOREX, "2024-06-12T08:00:00Z").session());
            assertEquals("Overlap",  at(AssetType.FOREX, "2024-06-12T13:00:00Z").session());
            assertEquals("New York", at(AssetType.FOREX, "2024-06-12T18:00:00Z").session());
            assertEquals("Asian",    at(AssetType.FOREX, "2024-06-12T02:00:00Z").session());
        }
    }

    @Nested
    @DisplayName("STOCKS")
    class StockTests {

        @Test
        @DisplayName("09:30–16:00 New York on weekdays")
        void regularHours() {
            assertTrue(at(AssetType.STOCKS, "2024-06-12T14:00:00Z").open());
            assertFalse(at(AssetType.STOCKS, "2024-06-12T13:00:00Z").open());
            assertFalse(at(AssetType.STOCKS, "2024-06-12T20:00:00Z").open());
        }

        @Test
        @DisplayName("weekend → closed")
        void weekend() {
            assertFalse(at(AssetType.STOCKS, "2024-06-15T15:00:00Z").open());
        }
    }

    @Nested
    @DisplayName("CRYPTO")
    class CryptoTests {

        @Test
        @DisplayName("weekend → open with low-liquidity warning")
        void weekendWarning() {
            MarketStatus status = at(AssetType.CRYPTO, "2024-06-15T03:00:00Z");

            assertTrue(status.open());
            assertEquals(MarketSchedule.WEEKEND_LOW_LIQUIDITY, status.warning());
        }

        @Test
        @DisplayName("weekday → open, no warning")
        void weekday() {
            MarketStatus status = at(AssetType.CRYPTO, "2024-06-12T03:00:00Z");

            assertTrue(status.open());
            assertFalse(status.hasWarning());
        }
    }
}
