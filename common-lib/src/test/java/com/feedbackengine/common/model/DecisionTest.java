package com.feedbackengine.common.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DecisionTest {

    private static final Instant TS = Instant.parse("2024-01-02T10:00:00Z");

    private static Decision sizedBuy() {
        return Decision.sized("d1", "BTCUSD", TS, TradeAction.BUY, 75,
            new PositionSizing(0.075, 50_000, 0.02, 0.01, 49_000.0),
            AggregationTier.CONFIGURED_STRATEGY, List.of(), "r");
    }

    @Nested
    @DisplayName("Invariants")
    class InvariantTests {

        @Test
        @DisplayName("confidence outside [0, 100] is rejected")
        void confidenceRange() {
            assertThrows(IllegalArgumentException.class, () -> Decision.signalOnly("d", "BTCUSD", TS,
                TradeAction.BUY, 100.01, AggregationTier.SINGLE_BEST, List.of(), ""));
            assertThrows(IllegalArgumentException.class, () -> Decision.signalOnly("d", "BTCUSD", TS,
                TradeAction.BUY, Double.NaN, AggregationTier.SINGLE_BEST, List.of(), ""));
        }

        @Test
        @DisplayName("signal-only decision cannot carry sizing")
        void signalOnlyHasNoSizing() {
            assertThrows(IllegalArgumentException.class, () -> new Decision("d", "BTCUSD", TS, TradeAction.BUY, 50,
                PositionType.LONG, new PositionSizing(1, 1, 0.02, 0.01, null), AggregationTier.MAJORITY,
                List.of(), true, "", null));
        }

        @Test
        @DisplayName("execution result can be attached exactly once")
        void executionOnce() {
            Decision executed = sizedBuy().withExecution(ExecutionResult.filled(50_010, 3.0, 0.075, TS));

            assertTrue(executed.execution().success());
            assertThrows(IllegalStateException.class,
                () -> executed.withExecution(ExecutionResult.rejected("again", TS)));
        }
    }

    @Nested
    @DisplayName("DecisionRecord JSON")
    class RecordJsonTests {

        private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        @Test
        @DisplayName("signal-only sizing fields are explicit nulls, never zeros")
        void signalOnlyNulls() throws Exception {
            Decision d = Decision.signalOnly("d1", "BTCUSD", TS, TradeAction.SELL, 64,
                AggregationTier.AVERAGE, List.of(), "r");

            JsonNode json = mapper.readTree(mapper.writeValueAsString(
                DecisionRecord.from(d, RiskVerdict.allow("Trade approved", List.of(), 1.0))));

            assertTrue(json.has("recommended_position_size"));
            assertTrue(json.get("recommended_position_size").isNull());
            assertTrue(json.get("entry_price").isNull());
            assertTrue(json.get("stop_loss_percentage").isNull());
            assertTrue(json.get("risk_percentage").isNull());
            assertTrue(json.get("signal_only").asBoolean());
            assertEquals(3, json.get("aggregation_tier").asInt());
            assertEquals("SHORT", json.get("position_type").asText());
            assertEquals("Trade approved", json.get("risk_verdict_reason").asText());
        }

        @Test
        @DisplayName("sized decision writes sizing values")
        void sizedValues() throws Exception {
            JsonNode json = mapper.readTree(mapper.writeValueAsString(DecisionRecord.from(sizedBuy(),
                RiskVerdict.deny(RiskRule.DRAWDOWN, "Max drawdown exceeded", List.of()))));

            assertEquals(0.075, json.get("recommended_position_size").asDouble(), 0.0);
            assertEquals("2024-01-02T10:00:00Z", json.get("timestamp").asText());
            assertFalse(json.get("risk_allowed").asBoolean());
        }
    }
}
