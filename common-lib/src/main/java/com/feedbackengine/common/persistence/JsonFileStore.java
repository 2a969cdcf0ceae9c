package com.feedbackengine.common.persistence;

import com.feedbackengine.common.exception.PersistenceException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * One JSON document on disk, written atomically (temp file + move).
 *
 * <p>A missing file loads as empty. A file that cannot be parsed is fatal
 * ({@link PersistenceException}) unless {@code freshStartOnCorruption} is set, in
 * which case the corrupt file is moved aside and the store loads as empty.
 */
public class JsonFileStore<T> {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStore.class);

    private final String component;
    private final Path path;
    private final ObjectMapper mapper;
    private final TypeReference<T> type;
    private final boolean freshStartOnCorruption;

    public JsonFileStore(String component, Path path, ObjectMapper mapper,
                         TypeReference<T> type, boolean freshStartOnCorruption) {
        this.component = component;
        this.path = path;
        this.mapper = mapper;
        this.type = type;
        this.freshStartOnCorruption = freshStartOnCorruption;
    }

    public Path path() {
        return path;
    }

    public Optional<T> load() {
        if (!Files.exists(path)) {
            log.info("[{}] No persisted state at {}. Starting fresh.", component, path);
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(path.toFile(), type));
        } catch (IOException | RuntimeException e) {
            if (!freshStartOnCorruption) {
                throw new PersistenceException(component, "Corrupted state file " + path
                    + " (set fresh-start-on-corruption to discard it)", e);
            }
            Path aside = path.resolveSibling(path.getFileName() + ".corrupt-" + System.currentTimeMillis());
            log.warn("[{}] Corrupted state file {}. Fresh start requested; moved to {}", component, path, aside, e);
            try {
                Files.move(path, aside, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException moveError) {
                throw new PersistenceException(component, "Cannot move corrupt file " + path, moveError);
            }
            return Optional.empty();
        }
    }

    public synchronized void save(T value) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), value);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new PersistenceException(component, "Cannot write state file " + path, e);
        }
    }
}
