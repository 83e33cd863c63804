package io.agency.core.memory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/// Ephemeral memory ranked by term overlap with the query.
///
/// Entries sharing no term with the query are never returned. Ties go to the
/// most recent entry.
///
/// @implNote Thread-safe. Backed by a {@link CopyOnWriteArrayList}, which suits
/// a store that is read on every reasoning iteration and written once per answer.
public class InMemoryMemoryStore implements MemoryStore {

    private final List<MemoryEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public List<MemoryEntry> fetchContext(String query, int limit) {
        Objects.requireNonNull(query, "query must not be null");
        Set<String> queryTerms = terms(query);
        if (queryTerms.isEmpty() || limit <= 0) {
            return List.of();
        }

        List<Scored> scored = new ArrayList<>();
        for (MemoryEntry entry : entries) {
            long overlap = terms(entry.content()).stream().filter(queryTerms::contains).count();
            if (overlap > 0) {
                scored.add(new Scored(entry, overlap));
            }
        }
        return scored.stream()
                .sorted(
                        Comparator.comparingLong(Scored::score)
                                .thenComparing(s -> s.entry().createdAt())
                                .reversed())
                .limit(limit)
                .map(Scored::entry)
                .toList();
    }

    @Override
    public void storeObservation(String content, Map<String, String> metadata) {
        Objects.requireNonNull(content, "content must not be null");
        entries.add(new MemoryEntry(content, metadata, Instant.now()));
    }

    /// Adds an entry as-is, preserving its timestamp.
    ///
    /// @param entry the entry, not null
    protected void add(MemoryEntry entry) {
        entries.add(entry);
    }

    public int size() {
        return entries.size();
    }

    static Set<String> terms(String text) {
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(t -> t.length() > 2)
                .collect(Collectors.toSet());
    }

    private record Scored(MemoryEntry entry, long score) {}
}
