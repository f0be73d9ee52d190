package com.kbase.storage;

import com.kbase.models.BaseKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FileStoreTest {

    @TempDir
    Path dataDir;

    private FileStore store;
    private final StorageConfig issues = StorageConfig.forType("issues", BaseKind.TASKS);
    private final StorageConfig sessions = StorageConfig.forType("sessions", BaseKind.SESSIONS);
    private final StorageConfig dailies = StorageConfig.forType("dailies", BaseKind.DAILIES);

    @BeforeEach
    void setUp() {
        store = new FileStore(dataDir);
    }

    private static StoredDocument doc(String id, String title, String body) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("title", title);
        return new StoredDocument(id, metadata, body);
    }

    @Test
    void savesUnderTypeDirectoryWithPrefix() throws Exception {
        store.save(issues, doc("1", "First", "body"));

        assertTrue(Files.isRegularFile(dataDir.resolve("issues").resolve("issues-1.md")));
        Optional<StoredDocument> loaded = store.load(issues, "1");
        assertTrue(loaded.isPresent());
        assertEquals("First", loaded.get().getMetadata().get("title"));
        assertEquals("body", loaded.get().getBody());
    }

    @Test
    void saveOverwritesExistingFile() throws Exception {
        store.save(issues, doc("1", "First", "old"));
        store.save(issues, doc("1", "Second", "new"));

        StoredDocument loaded = store.load(issues, "1").orElseThrow();
        assertEquals("Second", loaded.getMetadata().get("title"));
        assertEquals("new", loaded.getBody());
        assertEquals(List.of("1"), store.list(issues));
    }

    @Test
    void sessionsArePartitionedByDate() throws Exception {
        String id = "2025-07-28-10.15.30.123";
        store.save(sessions, doc(id, "Morning", ""));
        store.save(dailies, doc("2025-07-28", "Summary", ""));

        assertTrue(Files.isRegularFile(dataDir.resolve("sessions/2025-07-28/sessions-" + id + ".md")));
        assertTrue(Files.isRegularFile(dataDir.resolve("sessions/dailies/dailies-2025-07-28.md")));
        assertEquals(List.of("2025-07-28"), store.listPartitions(sessions));
        assertEquals(List.of(id), store.list(sessions));
        assertEquals(List.of(id), store.list(sessions, "2025-07-28"));
        assertEquals(List.of("2025-07-28"), store.list(dailies));
        assertTrue(store.listPartitions(dailies).isEmpty());
    }

    @Test
    void createExclusiveRefusesExistingFile() throws Exception {
        assertTrue(store.createExclusive(dailies, doc("2025-07-28", "First", "a")));
        assertFalse(store.createExclusive(dailies, doc("2025-07-28", "Second", "b")));

        assertEquals("First", store.load(dailies, "2025-07-28").orElseThrow().getMetadata().get("title"));
    }

    @Test
    void deleteReportsWhetherAFileWasRemoved() throws Exception {
        assertFalse(store.delete(issues, "9"));

        store.save(issues, doc("9", "Nine", ""));
        assertTrue(store.exists(issues, "9"));
        assertTrue(store.delete(issues, "9"));
        assertFalse(store.exists(issues, "9"));
        assertTrue(store.load(issues, "9").isEmpty());
    }

    @Test
    void deletingLastSessionRemovesEmptyPartition() throws Exception {
        String id = "2025-07-28-10.15.30.123";
        store.save(sessions, doc(id, "Morning", ""));
        assertTrue(store.delete(sessions, id));

        assertFalse(Files.exists(dataDir.resolve("sessions/2025-07-28")));
        assertTrue(store.listPartitions(sessions).isEmpty());
    }

    @Test
    void listsNumericIdsInNumericOrder() throws Exception {
        for (String id : new String[] {"10", "2", "1"}) {
            store.save(issues, doc(id, "Item " + id, ""));
        }
        Files.writeString(dataDir.resolve("issues").resolve("notes.txt"), "ignored");

        assertEquals(List.of("1", "2", "10"), store.list(issues));
    }

    @Test
    void listOfMissingDirectoryIsEmpty() throws Exception {
        assertTrue(store.list(issues).isEmpty());
        assertTrue(store.listTopLevelDirectories().isEmpty());
    }

    @Test
    void rejectsPathTraversalIds() {
        assertFalse(FileStore.isValidId("../etc"));
        assertFalse(FileStore.isValidId("a/b"));
        assertFalse(FileStore.isValidId(""));
        assertTrue(FileStore.isValidId("2025-07-28-10.15.30.123"));
        assertThrows(IllegalArgumentException.class, () -> store.save(issues, doc("..", "x", "")));
    }
}
