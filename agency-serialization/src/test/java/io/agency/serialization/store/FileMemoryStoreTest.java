package io.agency.serialization.store;

import static org.assertj.core.api.Assertions.assertThat;

import io.agency.core.memory.MemoryEntry;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileMemoryStoreTest {

    @TempDir Path dir;

    @Test
    void shouldPersistObservationsAcrossInstances() {
        Path file = dir.resolve("memory/observations.jsonl");
        var first = new FileMemoryStore(file);
        first.storeObservation("User: capital of France?\nAssistant: Paris", Map.of("workflow_id", "wf-1"));

        var second = new FileMemoryStore(file);

        assertThat(second.size()).isEqualTo(1);
        var entries = second.fetchContext("France capital", 3);
        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).metadata()).containsEntry("workflow_id", "wf-1");
        assertThat(entries.get(0).content()).endsWith("Paris");
    }

    @Test
    void shouldWriteOneLinePerObservation() throws Exception {
        Path file = dir.resolve("observations.jsonl");
        var store = new FileMemoryStore(file);

        store.storeObservation("first note", Map.of());
        store.storeObservation("second note", Map.of());

        assertThat(Files.readAllLines(file, StandardCharsets.UTF_8)).hasSize(2);
    }

    @Test
    void shouldSkipUnreadableLines() throws Exception {
        Path file = dir.resolve("observations.jsonl");
        new FileMemoryStore(file).storeObservation("valid weather entry", Map.of());
        Files.writeString(file, "{broken\n\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        var reopened = new FileMemoryStore(file);

        assertThat(reopened.size()).isEqualTo(1);
        assertThat(reopened.fetchContext("weather", 5))
                .extracting(MemoryEntry::content)
                .containsExactly("valid weather entry");
    }
}
