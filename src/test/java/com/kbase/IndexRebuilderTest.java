package com.kbase;

import com.kbase.models.BaseKind;
import com.kbase.models.CreateItemRequest;
import com.kbase.models.Item;
import com.kbase.models.ItemQuery;
import com.kbase.models.ItemSummary;
import com.kbase.models.Priority;
import com.kbase.models.RebuildReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class IndexRebuilderTest {

    @TempDir
    Path tempDir;

    private KnowledgeBase open(String databaseName) {
        MutableClock clock = new MutableClock(Instant.parse("2025-07-28T10:15:30.123Z"));
        return KnowledgeBase.open(tempDir.resolve("data"), tempDir.resolve(databaseName), clock, ZoneOffset.UTC);
    }

    private Path writeFile(String directory, String fileName, String text) throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("data").resolve(directory));
        return Files.writeString(dir.resolve(fileName), text);
    }

    @Test
    void freshIndexIsRestoredFromFiles() {
        Item issue;
        Item bug;
        Item session;
        Item daily;
        List<ItemSummary> issuesBefore;
        try (KnowledgeBase kb = open("first.db")) {
            kb.types().registerType("bugs", BaseKind.TASKS, "Bug reports");
            issue = kb.items().create(CreateItemRequest.of("issues", "Broken login", "steps")
                .priority(Priority.HIGH).tags(List.of("auth")));
            kb.items().create(CreateItemRequest.of("issues", "Done already", "x").status("Completed"));
            bug = kb.items().create(CreateItemRequest.of("bugs", "Crash on save", "trace")
                .related(List.of(issue.reference())));
            kb.items().create(CreateItemRequest.of("knowledge", "Indexing notes", "fts5 tokenizers"));
            session = kb.items().create(new CreateItemRequest("sessions").title("Pairing")
                .datetime(Instant.parse("2025-07-20T08:05:09.007Z")));
            daily = kb.items().create(new CreateItemRequest("dailies").title("Recap").date("2025-07-20"));
            issuesBefore = kb.items().list(ItemQuery.of("issues").includeClosed(true));
        }

        try (KnowledgeBase kb = open("second.db")) {
            assertFalse(kb.types().typeExists("bugs"));

            RebuildReport report = kb.rebuilder().rebuildAll();

            assertEquals(List.of("bugs"), report.getRegisteredTypes());
            assertTrue(report.getFailedTypes().isEmpty());
            assertEquals(2, report.getSynced("issues"));
            assertEquals(1, report.getSynced("bugs"));
            assertEquals(1, report.getSynced("knowledge"));
            assertEquals(0, report.getSynced("plans"));
            assertEquals(1, report.getSynced("sessions"));
            assertEquals(1, report.getSynced("dailies"));
            assertEquals(6, report.getTotalSynced());

            assertEquals(Optional.of(BaseKind.TASKS), kb.types().baseKindOf("bugs"));
            assertEquals(issuesBefore, kb.items().list(ItemQuery.of("issues").includeClosed(true)));
            assertEquals(bug, kb.items().get("bugs", "1"));
            assertEquals(session, kb.items().get("sessions", session.getId()));
            assertEquals(daily, kb.items().get("dailies", "2025-07-20"));
            assertEquals(1, kb.tags().usageCount("auth"));
            assertEquals(1, kb.index().referencing("issues", issue.getId()).size());
            assertEquals(1, kb.items().search("tokenizers", null, 10, 0).size());

            assertEquals("3", kb.items().create(CreateItemRequest.of("issues", "After rebuild", "x")).getId());
            assertEquals("2", kb.items().create(CreateItemRequest.of("bugs", "Second bug", "x")).getId());
        }
    }

    @Test
    void infersKindOfUnknownDirectories() throws Exception {
        writeFile("chores", "chores-1.md", "---\ntitle: Water plants\npriority: low\nstatus: Open\n---\n\nweekly");
        writeFile("notes", "notes-4.md", "---\ntitle: Reading list\n---\n\nbooks");
        writeFile("journal", "journal-1.md", "---\nbase: tasks\ntitle: Declared\n---\n\nbody");
        Files.createDirectories(tempDir.resolve("data").resolve("empty"));
        writeFile("Bad-Dir", "Bad-Dir-1.md", "---\ntitle: Ignored\n---\n\nbody");

        try (KnowledgeBase kb = open("search.db")) {
            RebuildReport report = kb.rebuilder().rebuildAll();

            assertTrue(report.getRegisteredTypes().containsAll(List.of("chores", "notes", "journal")));
            assertEquals(3, report.getRegisteredTypes().size());
            assertEquals(Optional.of(BaseKind.TASKS), kb.types().baseKindOf("chores"));
            assertEquals(Optional.of(BaseKind.DOCUMENTS), kb.types().baseKindOf("notes"));
            assertEquals(Optional.of(BaseKind.TASKS), kb.types().baseKindOf("journal"));
            assertFalse(kb.types().typeExists("empty"));

            assertEquals(Priority.LOW, kb.items().get("chores", "1").getPriority());
            assertEquals(List.of("4"), List.of(kb.items().list(ItemQuery.of("notes")).get(0).getId()));
            assertEquals("5", kb.items().create(CreateItemRequest.of("notes", "Next", "x")).getId());
        }
    }

    @Test
    void inferKindIsEmptyWithoutItemFiles() throws Exception {
        Files.createDirectories(tempDir.resolve("data").resolve("empty"));
        writeFile("docs2", "readme.txt", "not an item");

        try (KnowledgeBase kb = open("search.db")) {
            assertEquals(Optional.empty(), kb.rebuilder().inferKind("empty"));
            assertEquals(Optional.empty(), kb.rebuilder().inferKind("docs2"));
            assertEquals(Optional.empty(), kb.rebuilder().inferKind("missing"));
        }
    }

    @Test
    void rebuildOfOneTypeReportsItsCount() {
        try (KnowledgeBase kb = open("search.db")) {
            kb.items().create(CreateItemRequest.of("plans", "One", "x"));
            kb.items().create(CreateItemRequest.of("plans", "Two", "x"));

            RebuildReport report = kb.rebuilder().rebuild("plans");

            assertEquals(2, report.getSynced("plans"));
            assertEquals(2, report.getTotalSynced());
            assertTrue(report.getRegisteredTypes().isEmpty());
        }
    }
}
