package io.agency.serialization.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agency.core.exception.StorageException;
import io.agency.core.memory.InMemoryMemoryStore;
import io.agency.core.memory.MemoryEntry;
import io.agency.serialization.SnapshotSerializer;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Persistent memory backed by a JSON-lines file.
///
/// Every observation is appended as one line before it becomes visible to
/// {@link #fetchContext}. Existing lines are loaded at construction; lines
/// that cannot be parsed are skipped with a warning. Ranking is inherited from
/// {@link InMemoryMemoryStore}.
///
/// @implNote Thread-safe. Appends are serialized on the store's monitor.
public class FileMemoryStore extends InMemoryMemoryStore {

    private static final Logger logger = Logger.getLogger(FileMemoryStore.class.getName());

    private final Path file;
    private final ObjectMapper mapper;

    /// Opens or creates a memory file.
    ///
    /// @param file JSON-lines file, not null
    /// @throws StorageException if the file exists but cannot be read, or its
    ///     directory cannot be created
    public FileMemoryStore(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.mapper = SnapshotSerializer.createMapper();
        load();
    }

    @Override
    public synchronized void storeObservation(String content, Map<String, String> metadata) {
        Objects.requireNonNull(content, "content must not be null");
        MemoryEntry entry = new MemoryEntry(content, metadata, Instant.now());
        try (BufferedWriter writer =
                Files.newBufferedWriter(
                        file,
                        StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.APPEND)) {
            writer.write(mapper.writeValueAsString(entry));
            writer.newLine();
        } catch (IOException e) {
            throw new StorageException("Failed to append memory entry to " + file, e);
        }
        add(entry);
    }

    private void load() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(file)) {
                return;
            }
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            int skipped = 0;
            for (String line : lines) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    add(mapper.readValue(line, MemoryEntry.class));
                } catch (IOException e) {
                    skipped++;
                }
            }
            if (skipped > 0) {
                logger.warning("Skipped " + skipped + " unreadable memory entries in " + file);
            }
            logger.info("Loaded " + size() + " memory entries from " + file);
        } catch (IOException e) {
            throw new StorageException("Failed to load memory file " + file, e);
        }
    }
}
