package com.feedbackengine.common.memory;

import com.feedbackengine.common.persistence.JsonFileStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.Optional;

/** Durable JSON copy of the live portfolio memory. */
public class PortfolioMemoryStore {

    private final JsonFileStore<PortfolioMemorySnapshot> file;

    public PortfolioMemoryStore(Path path, ObjectMapper mapper, boolean freshStartOnCorruption) {
        this.file = new JsonFileStore<>("PortfolioMemory", path, mapper,
            new TypeReference<PortfolioMemorySnapshot>() {}, freshStartOnCorruption);
    }

    public Optional<PortfolioMemorySnapshot> load() {
        return file.load();
    }

    public void save(PortfolioMemorySnapshot snapshot) {
        file.save(snapshot);
    }

    /** Memory restored from disk, or empty memory when nothing was persisted. */
    public PortfolioMemory loadMemory() {
        PortfolioMemory memory = new PortfolioMemory();
        load().ifPresent(memory::restore);
        return memory;
    }
}
