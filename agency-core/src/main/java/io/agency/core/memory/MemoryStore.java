package io.agency.core.memory;

import java.util.List;
import java.util.Map;

/// Knowledge collaborator consulted by the reasoning loop.
///
/// The engine treats both operations as opaque calls: it neither inspects how
/// context is ranked nor how observations are kept.
///
/// @implNote Implementations must be thread-safe.
///
/// @see InMemoryMemoryStore
public interface MemoryStore {

    /// Returns stored observations relevant to a query, most relevant first.
    ///
    /// @param query free text, not null
    /// @param limit maximum number of entries, positive
    /// @return matching entries, never null (may be empty)
    List<MemoryEntry> fetchContext(String query, int limit);

    /// Stores an observation.
    ///
    /// @param content observation text, not null
    /// @param metadata free-form attributes, not null
    void storeObservation(String content, Map<String, String> metadata);
}
