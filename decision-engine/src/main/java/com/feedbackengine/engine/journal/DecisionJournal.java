package com.feedbackengine.engine.journal;

import com.feedbackengine.common.exception.PersistenceException;
import com.feedbackengine.common.model.DecisionRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only JSON-lines log of every finalized decision ({@link DecisionRecord}).
 * One record per line; nulls written explicitly.
 */
public class DecisionJournal {

    private static final Logger log = LoggerFactory.getLogger(DecisionJournal.class);

    private final Path path;
    private final ObjectMapper mapper;

    public DecisionJournal(Path path, ObjectMapper mapper) {
        this.path   = path;
        this.mapper = mapper;
    }

    public Path path() {
        return path;
    }

    public synchronized void append(DecisionRecord record) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            String line = mapper.writeValueAsString(record) + System.lineSeparator();
            Files.writeString(path, line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new PersistenceException("DecisionJournal", "Cannot append to " + path, e);
        }
        log.debug("[DecisionJournal] Appended decisionId={} asset={}", record.decisionId(), record.assetPair());
    }

    /** Reads every record; an unparseable line fails the whole read. */
    public synchronized List<DecisionRecord> readAll() {
        if (!Files.exists(path)) return List.of();
        List<DecisionRecord> records = new ArrayList<>();
        try {
            int lineNo = 0;
            for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
                lineNo++;
                if (line.isBlank()) continue;
                try {
                    records.add(mapper.readValue(line, DecisionRecord.class));
                } catch (JsonProcessingException e) {
                    throw new PersistenceException("DecisionJournal",
                        "Corrupt journal line " + lineNo + " in " + path, e);
                }
            }
        } catch (IOException e) {
            throw new PersistenceException("DecisionJournal", "Cannot read " + path, e);
        }
        return records;
    }
}
