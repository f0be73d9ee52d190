package com.kbase.index;

import com.kbase.StatusRegistry;
import com.kbase.models.Item;
import com.kbase.models.ItemQuery;
import com.kbase.models.ItemSummary;
import com.kbase.models.Priority;
import com.kbase.models.Status;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ItemIndexTest {

    @TempDir
    Path tempDir;

    private IndexDatabase db;
    private ItemIndex index;
    private StatusRegistry statuses;

    @BeforeEach
    void setUp() {
        db = new IndexDatabase(tempDir.resolve("search.db"));
        db.open();
        index = new ItemIndex(db);
        statuses = new StatusRegistry(db);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private Item task(String type, String id, String title, String statusName) {
        Status status = statuses.byName(statusName).orElseThrow();
        Item item = new Item(type, id);
        item.setTitle(title);
        item.setContent("content of " + title);
        item.setPriority(Priority.HIGH);
        item.setStatus(status.getName());
        item.setStatusId(status.getId());
        item.setCreatedAt("2025-07-01T09:00:00.000Z");
        item.setUpdatedAt("2025-07-0" + id + "T09:00:00.000Z");
        return item;
    }

    private static List<String> ids(List<ItemSummary> summaries) {
        List<String> ids = new ArrayList<>();
        for (ItemSummary summary : summaries) {
            ids.add(summary.getType() + "-" + summary.getId());
        }
        return ids;
    }

    private int countRows(String sql) {
        return db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql); ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
    }

    @Test
    void projectsRowAndReprojectsInPlace() {
        Item item = task("issues", "1", "Login fails", "Open");
        item.setTags(List.of("auth", "bug"));
        index.project(item);

        item.setTitle("Login fails on Safari");
        item.setTags(List.of("auth"));
        index.project(item);

        ItemSummary summary = index.find("issues", "1").orElseThrow();
        assertEquals("Login fails on Safari", summary.getTitle());
        assertEquals(Priority.HIGH, summary.getPriority());
        assertEquals("Open", summary.getStatus());
        assertEquals(List.of("auth"), summary.getTags());
        assertEquals(1, countRows("SELECT COUNT(*) FROM items"));
        assertEquals(1, countRows("SELECT COUNT(*) FROM items_fts"));
        assertEquals(1, countRows("SELECT COUNT(*) FROM item_tags"));
    }

    @Test
    void listExcludesClosedUnlessAsked() {
        index.project(task("issues", "1", "Open one", "Open"));
        index.project(task("issues", "2", "Done one", "Completed"));
        index.project(task("issues", "3", "Reviewing", "Review"));

        assertEquals(List.of("issues-3", "issues-1"), ids(index.list(ItemQuery.of("issues"), false)));
        assertEquals(List.of("issues-3", "issues-2", "issues-1"),
            ids(index.list(ItemQuery.of("issues").includeClosed(true), false)));
        assertEquals(List.of("issues-2"),
            ids(index.list(ItemQuery.of("issues").statuses(List.of("Completed")), false)));
        assertTrue(index.list(ItemQuery.of("issues").statuses(List.of()), false).isEmpty());
        assertEquals(List.of("issues-3"), ids(index.list(ItemQuery.of("issues").limit(1), false)));
    }

    @Test
    void itemsWithoutStatusAreNeverTreatedAsClosed() {
        Item doc = new Item("docs", "1");
        doc.setTitle("Guide");
        doc.setContent("text");
        doc.setUpdatedAt("2025-07-01T00:00:00.000Z");
        index.project(doc);

        assertEquals(List.of("docs-1"), ids(index.list(ItemQuery.of("docs"), false)));
    }

    @Test
    void filtersDateRangeOnUpdatedDayOrStartDate() {
        index.project(task("plans", "1", "Early", "Open"));
        index.project(task("plans", "5", "Later", "Open"));

        assertEquals(List.of("plans-5"),
            ids(index.list(ItemQuery.of("plans").startDate("2025-07-05"), false)));
        assertEquals(List.of("plans-1"),
            ids(index.list(ItemQuery.of("plans").endDate("2025-07-01"), false)));

        Item daily = new Item("dailies", "2025-07-28");
        daily.setTitle("Monday");
        daily.setStartDate("2025-07-28");
        daily.setUpdatedAt("2025-08-02T00:00:00.000Z");
        index.project(daily);
        assertEquals(List.of("dailies-2025-07-28"),
            ids(index.list(ItemQuery.of("dailies").startDate("2025-07-28").endDate("2025-07-28"), true)));
        assertTrue(index.list(ItemQuery.of("dailies").startDate("2025-08-01"), true).isEmpty());
    }

    @Test
    void removeDropsRowAndOutgoingEdgesOnly() {
        Item first = task("issues", "1", "First", "Open");
        first.setTags(List.of("x"));
        first.setRelated(List.of("docs-1"));
        Item second = task("issues", "2", "Second", "Open");
        second.setRelated(List.of("issues-1"));
        index.project(first);
        index.project(second);

        assertTrue(index.remove("issues", "1"));
        assertFalse(index.remove("issues", "1"));

        assertTrue(index.find("issues", "1").isEmpty());
        assertEquals(0, countRows("SELECT COUNT(*) FROM item_tags"));
        assertEquals(0, countRows("SELECT COUNT(*) FROM related_items WHERE source_id = '1'"));
        assertEquals(1, countRows("SELECT COUNT(*) FROM related_items WHERE target_type = 'issues' AND target_id = '1'"));
        assertEquals(1, countRows("SELECT COUNT(*) FROM items_fts"));
    }

    @Test
    void clearTypeLeavesOtherTypes() {
        index.project(task("issues", "1", "Issue", "Open"));
        index.project(task("plans", "1", "Plan", "Open"));

        assertEquals(1, index.clearType("issues"));
        assertEquals(0, index.count("issues"));
        assertEquals(1, index.count("plans"));
        assertEquals(1, countRows("SELECT COUNT(*) FROM items_fts"));
    }

    @Test
    void searchesFullTextAcrossTypes() {
        Item issue = task("issues", "1", "Database migration fails", "Open");
        Item plan = task("plans", "2", "Quarterly roadmap", "Open");
        plan.setContent("Includes the database upgrade");
        index.project(issue);
        index.project(plan);

        assertEquals(List.of("issues-1", "plans-2"), ids(index.search("database", null, 10, 0)));
        assertEquals(List.of("plans-2"), ids(index.search("database", List.of("plans"), 10, 0)));
        assertEquals(List.of("issues-1"), ids(index.search("migration \"fails", null, 10, 0)));
        assertTrue(index.search("   ", null, 10, 0).isEmpty());
    }

    @Test
    void listsByTagAndReferrers() {
        Item a = task("issues", "1", "A", "Open");
        a.setTags(List.of("backend"));
        Item b = task("plans", "2", "B", "Open");
        b.setTags(List.of("backend", "q3"));
        b.setRelated(List.of("issues-1"));
        index.project(a);
        index.project(b);

        assertEquals(List.of("issues-1", "plans-2"), ids(index.listByTag("backend", null)));
        assertEquals(List.of("plans-2"), ids(index.listByTag("backend", List.of("plans"))));
        assertEquals(List.of("plans-2"), ids(index.referencing("issues", "1")));
    }

    @Test
    void quotesSearchTerms() {
        assertEquals("\"a\" \"b\"\"c\"", ItemIndex.toMatchExpression(" a  b\"c "));
        assertEquals("", ItemIndex.toMatchExpression(null));
    }

    @Test
    void searchStillFindsTheRightItemsAfterVacuum() {
        index.project(task("issues", "1", "Alpha cache", "Open"));
        index.project(task("issues", "2", "Beta queue", "Open"));
        index.project(task("issues", "3", "Gamma cache", "Open"));
        index.remove("issues", "1");

        db.query(conn -> {
            try (Statement st = conn.createStatement()) {
                st.execute("VACUUM");
            }
            return null;
        });

        assertEquals(List.of("issues-3"), ids(index.search("cache", null, 10, 0)));
        assertEquals(List.of("issues-2"), ids(index.search("queue", null, 10, 0)));
        assertEquals(0, countRows("SELECT COUNT(*) FROM items_fts f LEFT JOIN items i ON i.row_id = f.rowid"
            + " WHERE i.row_id IS NULL"));
    }

    @Test
    void storesVersionColumn() {
        Item item = task("plans", "1", "Roadmap", "Open");
        item.setVersion("1.2.3");
        index.project(item);
        assertEquals(1, countRows("SELECT COUNT(*) FROM items WHERE version = '1.2.3'"));

        item.setVersion(null);
        index.project(item);
        assertEquals(1, countRows("SELECT COUNT(*) FROM items WHERE version IS NULL"));
    }

    @Test
    void dropsItemTablesWithAnOlderLayout() throws Exception {
        Path oldFile = tempDir.resolve("old.db");
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + oldFile.toAbsolutePath());
             Statement st = conn.createStatement()) {
            st.execute("CREATE TABLE items (type TEXT NOT NULL, id TEXT NOT NULL, title TEXT NOT NULL,"
                + " PRIMARY KEY (type, id))");
            st.execute("INSERT INTO items (type, id, title) VALUES ('issues', '1', 'Stale')");
        }

        try (IndexDatabase old = new IndexDatabase(oldFile)) {
            old.open();
            ItemIndex oldIndex = new ItemIndex(old);
            assertTrue(oldIndex.find("issues", "1").isEmpty());

            oldIndex.project(task("issues", "1", "Fresh", "Open"));
            assertEquals("Fresh", oldIndex.find("issues", "1").orElseThrow().getTitle());
        }
    }
}
