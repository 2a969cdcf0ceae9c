package com.feedbackengine.common.memory;

import com.feedbackengine.common.exception.PersistenceException;
import com.feedbackengine.common.exception.ReadOnlyMemoryException;
import com.feedbackengine.common.exception.ValidationException;
import com.feedbackengine.common.model.MarketRegime;
import com.feedbackengine.common.model.PositionType;
import com.feedbackengine.common.model.ProviderVote;
import com.feedbackengine.common.model.TradeAction;
import com.feedbackengine.common.model.TradeOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PortfolioMemoryTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private final Clock clock = Clock.fixed(T0, ZoneOffset.UTC);

    static TradeOutcome outcome(String id, double entry, double exit, MarketRegime regime) {
        List<ProviderVote> votes = List.of(
            ProviderVote.of("alpha", TradeAction.BUY, 80, "up"),
            ProviderVote.of("beta", TradeAction.SELL, 60, "down"));
        return new TradeOutcome(id, "dec-" + id, "BTCUSD", PositionType.LONG, T0, T0.plusSeconds(3600),
            entry, exit, 1.0, 0.0, exit - entry, regime, votes, "signal");
    }

    // ── Recording ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("recordTradeOutcome()")
    class RecordTests {

        @Test
        @DisplayName("updates provider and regime aggregates")
        void aggregates() {
            PortfolioMemory memory = new PortfolioMemory(clock);
            memory.recordTradeOutcome(outcome("t1", 100, 110, MarketRegime.TRENDING));
            memory.recordTradeOutcome(outcome("t2", 100, 95, MarketRegime.TRENDING));

            ProviderPerformance alpha = memory.providerPerformance().get("alpha");
            ProviderPerformance beta = memory.providerPerformance().get("beta");
            assertEquals(2, alpha.trades());
            assertEquals(1, alpha.correct());
            assertEquals(5.0, alpha.totalPnl(), 1e-9);
            assertEquals(1, beta.correct());
            assertEquals(0.5, memory.regimePerformance().get(MarketRegime.TRENDING).winRate(), 0.0);
        }

        @Test
        @DisplayName("read-only memory always raises, never silently skips")
        void readOnlyRaises() {
            PortfolioMemory memory = new PortfolioMemory(clock);
            memory.setReadonly(true);

            assertThrows(ReadOnlyMemoryException.class,
                () -> memory.recordTradeOutcome(outcome("t1", 100, 110, MarketRegime.RANGING)));
            assertEquals(0, memory.size());
        }

        @Test
        @DisplayName("duplicate trade id is rejected")
        void duplicateRejected() {
            PortfolioMemory memory = new PortfolioMemory(clock);
            memory.recordTradeOutcome(outcome("t1", 100, 110, MarketRegime.RANGING));

            assertThrows(ValidationException.class,
                () -> memory.recordTradeOutcome(outcome("t1", 100, 120, MarketRegime.RANGING)));
        }
    }

    // ── Snapshot / restore ──────────────────────────────────────────────

    @Nested
    @DisplayName("snapshot() / restore()")
    class SnapshotTests {

        @Test
        @DisplayName("mutating live state after a snapshot never affects the snapshot")
        void deepCopy() {
            PortfolioMemory memory = new PortfolioMemory(clock);
            memory.recordTradeOutcome(outcome("t1", 100, 110, MarketRegime.TRENDING));
            PortfolioMemorySnapshot snap = memory.snapshot();

            memory.recordTradeOutcome(outcome("t2", 100, 90, MarketRegime.VOLATILE));

            assertEquals(1, snap.outcomes().size());
            assertEquals(1, snap.providerPerformance().get("alpha").trades());
            assertNull(snap.regimePerformance().get(MarketRegime.VOLATILE));
            assertThrows(UnsupportedOperationException.class, () -> snap.outcomes().clear());
        }

        @Test
        @DisplayName("restore(snapshot()) round-trips exactly")
        void roundTrip() {
            PortfolioMemory memory = new PortfolioMemory(clock);
            memory.recordTradeOutcome(outcome("t1", 100, 110, MarketRegime.TRENDING));
            PortfolioMemorySnapshot snap = memory.snapshot();

            memory.recordTradeOutcome(outcome("t2", 100, 90, MarketRegime.VOLATILE));
            memory.setReadonly(true);
            memory.restore(snap);

            assertEquals(snap, memory.snapshot());
            assertFalse(memory.isReadonly());
            memory.recordTradeOutcome(outcome("t2", 100, 90, MarketRegime.VOLATILE));
            assertEquals(2, memory.size());
        }

        @Test
        @DisplayName("performance summary: win rate, P&L, profit factor, drawdown")
        void summary() {
            PortfolioMemory memory = new PortfolioMemory(clock);
            memory.recordTradeOutcome(outcome("t1", 100, 120, MarketRegime.TRENDING));
            memory.recordTradeOutcome(outcome("t2", 100, 90, MarketRegime.TRENDING));
            memory.recordTradeOutcome(outcome("t3", 100, 105, MarketRegime.TRENDING));

            PerformanceSummary s = memory.performanceSummary();
            assertEquals(3, s.totalTrades());
            assertEquals(2.0 / 3, s.winRate(), 1e-12);
            assertEquals(15.0, s.totalPnl(), 1e-9);
            assertEquals(2.5, s.profitFactor(), 1e-12);
            assertEquals(10.0, s.maxDrawdown(), 1e-9);
        }
    }

    // ── Persistence ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("PortfolioMemoryStore")
    class StoreTests {

        private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

        @Test
        @DisplayName("save then load reproduces the snapshot")
        void saveLoad(@TempDir Path dir) {
            PortfolioMemoryStore store = new PortfolioMemoryStore(dir.resolve("memory.json"), mapper, false);
            PortfolioMemory memory = new PortfolioMemory(clock);
            memory.recordTradeOutcome(outcome("t1", 100, 110, MarketRegime.TRENDING));
            PortfolioMemorySnapshot snap = memory.snapshot();

            store.save(snap);

            assertEquals(snap, store.load().orElseThrow());
            assertEquals(1, store.loadMemory().size());
        }

        @Test
        @DisplayName("corrupt file is fatal unless fresh start is requested")
        void corrupt(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("memory.json");
            Files.writeString(file, "[1, 2");

            assertThrows(PersistenceException.class, () -> new PortfolioMemoryStore(file, mapper, false).load());
            assertEquals(0, new PortfolioMemoryStore(file, mapper, true).loadMemory().size());
        }
    }
}
