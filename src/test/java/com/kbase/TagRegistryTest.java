package com.kbase;

import com.kbase.index.IndexDatabase;
import com.kbase.models.Tag;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.PreparedStatement;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TagRegistryTest {

    @TempDir
    Path tempDir;

    private IndexDatabase db;
    private TagRegistry tags;

    @BeforeEach
    void setUp() {
        db = new IndexDatabase(tempDir.resolve("search.db"));
        db.open();
        tags = new TagRegistry(db);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private void tagItem(String type, String id, String tag) {
        db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO item_tags(item_type, item_id, tag) VALUES (?, ?, ?)")) {
                ps.setString(1, type);
                ps.setString(2, id);
                ps.setString(3, tag);
                return ps.executeUpdate();
            }
        });
    }

    private static List<String> names(List<Tag> list) {
        List<String> names = new ArrayList<>();
        for (Tag tag : list) {
            names.add(tag.getName());
        }
        return names;
    }

    @Test
    void ensureExistIsIdempotent() {
        tags.ensureExist(List.of("backend", "api"));
        tags.ensureExist(List.of("api", "frontend", " "));

        assertEquals(List.of("api", "backend", "frontend"), names(tags.all()));
    }

    @Test
    void getOrCreateIdIsStable() {
        long first = tags.getOrCreateId("urgent");
        long second = tags.getOrCreateId(" urgent ");
        assertEquals(first, second);
        assertEquals(1, tags.all().size());
    }

    @Test
    void createRejectsDuplicates() {
        Tag created = tags.create("release");
        assertEquals("release", created.getName());
        assertEquals(0, created.getUsageCount());

        KnowledgeBaseException e = assertThrows(KnowledgeBaseException.class, () -> tags.create("release"));
        assertEquals(KnowledgeBaseException.Kind.CONFLICT, e.getKind());
    }

    @Test
    void usageCountFollowsEdges() {
        tags.ensureExist(List.of("backend"));
        tagItem("issues", "1", "backend");
        tagItem("docs", "4", "backend");

        assertEquals(2, tags.usageCount("backend"));
        assertEquals(2, tags.find("backend").orElseThrow().getUsageCount());
    }

    @Test
    void deleteIsBlockedWhileReferenced() {
        tags.ensureExist(List.of("backend"));
        tagItem("issues", "1", "backend");

        KnowledgeBaseException e = assertThrows(KnowledgeBaseException.class, () -> tags.delete("backend"));
        assertEquals(KnowledgeBaseException.Kind.CONFLICT, e.getKind());
        assertTrue(tags.find("backend").isPresent());

        db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM item_tags")) {
                return ps.executeUpdate();
            }
        });
        assertTrue(tags.delete("backend"));
        assertFalse(tags.delete("backend"));
    }

    @Test
    void searchMatchesSubstrings() {
        tags.ensureExist(List.of("backend", "frontend", "docs", "100%_done"));

        assertEquals(List.of("backend", "frontend"), names(tags.search("end")));
        assertEquals(List.of("100%_done"), names(tags.search("%_")));
        assertEquals(4, tags.search("").size());
    }
}
