package io.agency.core.memory;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/// One stored observation.
///
/// @param content observation text, not null
/// @param metadata free-form attributes (workflow id, step), not null
/// @param createdAt when the observation was stored, not null
public record MemoryEntry(String content, Map<String, String> metadata, Instant createdAt) {

    public MemoryEntry {
        Objects.requireNonNull(content, "content must not be null");
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        createdAt = createdAt != null ? createdAt : Instant.now();
    }
}
