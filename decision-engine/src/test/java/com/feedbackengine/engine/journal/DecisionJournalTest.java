package com.feedbackengine.engine.journal;

import com.feedbackengine.common.exception.PersistenceException;
import com.feedbackengine.common.model.AggregationTier;
import com.feedbackengine.common.model.Decision;
import com.feedbackengine.common.model.DecisionRecord;
import com.feedbackengine.common.model.RiskRule;
import com.feedbackengine.common.model.RiskVerdict;
import com.feedbackengine.common.model.TradeAction;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DecisionJournalTest {

    private final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static Decision signalOnly(String id) {
        return Decision.signalOnly(id, "BTCUSD", Instant.parse("2024-06-12T13:00:00Z"), TradeAction.SELL, 65,
            AggregationTier.MAJORITY, List.of(), "majority");
    }

    @Test
    @DisplayName("one JSON line per decision, signal-only sizing written as explicit nulls")
    void appendsLines(@TempDir Path dir) throws Exception {
        DecisionJournal journal = new DecisionJournal(dir.resolve("nested/decisions.jsonl"), mapper);

        journal.append(DecisionRecord.from(signalOnly("d-1"), RiskVerdict.allow("ok", List.of(), 1.0)));
        journal.append(DecisionRecord.from(signalOnly("d-2"),
            RiskVerdict.deny(RiskRule.DRAWDOWN, "drawdown", List.of())));

        List<String> lines = Files.readAllLines(journal.path());
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).contains("\"recommended_position_size\":null"));
        assertTrue(lines.get(0).contains("\"signal_only\":true"));
        assertTrue(lines.get(0).contains("\"timestamp\":\"2024-06-12T13:00:00Z\""));

        List<DecisionRecord> records = journal.readAll();
        assertEquals("d-2", records.get(1).decisionId());
        assertFalse(records.get(1).riskAllowed());
        assertEquals(2, records.get(1).aggregationTier());
    }

    @Test
    @DisplayName("missing file reads as empty")
    void missingFile(@TempDir Path dir) {
        assertTrue(new DecisionJournal(dir.resolve("none.jsonl"), mapper).readAll().isEmpty());
    }

    @Test
    @DisplayName("a corrupt line fails the read")
    void corruptLine(@TempDir Path dir) throws Exception {
        DecisionJournal journal = new DecisionJournal(dir.resolve("decisions.jsonl"), mapper);
        journal.append(DecisionRecord.from(signalOnly("d-1"), RiskVerdict.allow("ok", List.of(), 1.0)));
        Files.writeString(journal.path(), "{not json\n", StandardOpenOption.APPEND);

        assertThrows(PersistenceException.class, journal::readAll);
    }
}
