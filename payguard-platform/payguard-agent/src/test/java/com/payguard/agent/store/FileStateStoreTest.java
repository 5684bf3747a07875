package com.payguard.agent.store;

import com.payguard.agent.error.PersistenceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FileStateStoreTest {

    @TempDir
    Path directory;

    @Test
    void put_thenGet_returnsDocument() {
        FileStateStore store = new FileStateStore(directory);

        store.put("baseline.active.device-1", "{\"a\":1}");

        assertThat(store.get("baseline.active.device-1")).contains("{\"a\":1}");
    }

    @Test
    void get_missingKey_isEmpty() {
        assertThat(new FileStateStore(directory).get("nothing")).isEmpty();
    }

    @Test
    void put_replacesPreviousValueAndLeavesNoTempFile() throws Exception {
        FileStateStore store = new FileStateStore(directory);

        store.put("k", "one");
        store.put("k", "two");

        assertThat(store.get("k")).contains("two");
        try (var files = Files.list(directory)) {
            assertThat(files.map(p -> p.getFileName().toString()).toList())
                    .noneMatch(name -> name.endsWith(".tmp"));
        }
    }

    @Test
    void documentsSurviveReopening() {
        new FileStateStore(directory).put("alerts.device/with:odd chars", "[]");

        FileStateStore reopened = new FileStateStore(directory);

        assertThat(reopened.get("alerts.device/with:odd chars")).contains("[]");
    }

    @Test
    void remove_deletesDocumentAndIgnoresMissingKey() {
        FileStateStore store = new FileStateStore(directory);
        store.put("k", "v");

        store.remove("k");
        store.remove("k");

        assertThat(store.get("k")).isEmpty();
    }

    @Test
    void constructor_failsWhenDirectoryCannotBeCreated() throws Exception {
        Path file = Files.writeString(directory.resolve("plain-file"), "x");

        assertThatThrownBy(() -> new FileStateStore(file.resolve("sub")))
                .isInstanceOf(PersistenceException.class);
    }

    @Test
    void repository_roundTripsRecordsWithInstants() {
        StateRepository repository = new StateRepository(new FileStateStore(directory));
        Sample sample = new Sample("x", Instant.parse("2026-10-01T10:00:00Z"), List.of("A", "B"));

        repository.write("sample", sample);

        assertThat(repository.read("sample", Sample.class)).contains(sample);
    }

    @Test
    void repository_corruptDocument_raisesPersistenceException() {
        InMemoryStateStore store = new InMemoryStateStore();
        store.put("sample", "{not json");
        StateRepository repository = new StateRepository(store);

        assertThatThrownBy(() -> repository.read("sample", Sample.class))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("sample");
    }

    record Sample(String name, Instant at, List<String> tags) {}
}
