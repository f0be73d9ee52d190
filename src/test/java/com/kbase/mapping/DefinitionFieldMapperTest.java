package com.kbase.mapping;

import com.kbase.models.BaseKind;
import com.kbase.models.FieldDefinition;
import com.kbase.models.Item;
import com.kbase.models.Priority;
import com.kbase.storage.MarkdownCodec;
import com.kbase.storage.StoredDocument;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefinitionFieldMapperTest {

    private static DefinitionFieldMapper mapper(String type, BaseKind kind) {
        return new DefinitionFieldMapper(type, kind, StandardFields.forKind(kind));
    }

    private static Item task() {
        Item item = new Item("issues", "4");
        item.setTitle("Crash on save");
        item.setContent("Stack trace");
        item.setPriority(Priority.HIGH);
        item.setStatus("In Progress");
        item.setStatusId(2);
        item.setTags(List.of("editor"));
        item.setRelated(List.of("docs-1"));
        item.setCreatedAt("2025-07-01T09:00:00.000Z");
        item.setUpdatedAt("2025-07-02T09:00:00.000Z");
        return item;
    }

    @Test
    void taskMetadataStartsWithBaseAndUsesNumericId() {
        Map<String, Object> metadata = mapper("issues", BaseKind.TASKS).toStorage(task());

        List<String> keys = new ArrayList<>(metadata.keySet());
        assertEquals("base", keys.get(0));
        assertEquals("tasks", metadata.get("base"));
        assertEquals(4L, metadata.get("id"));
        assertEquals("high", metadata.get("priority"));
        assertEquals("In Progress", metadata.get("status"));
        assertEquals(2, metadata.get("status_id"));
        assertFalse(metadata.containsKey("content"));
    }

    @Test
    void roundTripsThroughTheFileFormat() {
        DefinitionFieldMapper mapper = mapper("issues", BaseKind.TASKS);
        Item item = task();

        String text = MarkdownCodec.encode(mapper.toStorage(item), item.getContent());
        Item back = mapper.fromStorage(MarkdownCodec.decode("4", text));

        assertEquals(item, back);
    }

    @Test
    void versionStaysTextThroughTheFileFormat() {
        DefinitionFieldMapper mapper = mapper("docs", BaseKind.DOCUMENTS);
        Item doc = new Item("docs", "1");
        doc.setTitle("Guide");
        doc.setVersion("1.10");

        String text = MarkdownCodec.encode(mapper.toStorage(doc), "");
        assertEquals("1.10", mapper.fromStorage(MarkdownCodec.decode("1", text)).getVersion());

        Item handWritten = mapper.fromStorage(MarkdownCodec.decode("1", "---\ntitle: Guide\nversion: 3\n---\n\n"));
        assertEquals("3", handWritten.getVersion());

        Item session = new Item("sessions", "2025-07-28-10.15.30.123");
        session.setTitle("Pairing");
        session.setVersion("9");
        assertFalse(mapper("sessions", BaseKind.SESSIONS).toStorage(session).containsKey("version"));
    }

    @Test
    void documentsCarryNoWorkflowFields() {
        Item doc = new Item("docs", "1");
        doc.setTitle("Guide");
        doc.setPriority(Priority.LOW);

        Map<String, Object> metadata = mapper("docs", BaseKind.DOCUMENTS).toStorage(doc);
        assertFalse(metadata.containsKey("priority"));
        assertFalse(metadata.containsKey("status"));
        assertEquals("documents", metadata.get("base"));

        Item back = mapper("docs", BaseKind.DOCUMENTS).fromStorage(new StoredDocument("1", metadata, ""));
        assertNull(back.getPriority());
        assertNull(back.getStatus());
    }

    @Test
    void sessionsAndDailiesHaveNoBaseKey() {
        Item session = new Item("sessions", "2025-07-28-10.15.30.123");
        session.setTitle("Pairing");
        assertFalse(mapper("sessions", BaseKind.SESSIONS).toStorage(session).containsKey("base"));
        assertFalse(mapper("dailies", BaseKind.DAILIES).toStorage(new Item("dailies", "2025-07-28")).containsKey("base"));
    }

    @Test
    void derivesSessionDateAndTimeFromIdWhenMissing() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("title", "Old session");

        Item item = mapper("sessions", BaseKind.SESSIONS)
            .fromStorage(new StoredDocument("2024-12-31-23.59.58.001", metadata, ""));

        assertEquals("2024-12-31", item.getStartDate());
        assertEquals("23:59:58", item.getStartTime());
    }

    @Test
    void mergesLegacyRelationKeys() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("title", "Old plan");
        metadata.put("related_tasks", List.of("issues-1", "issues-2"));
        metadata.put("related_documents", List.of("docs-3", "issues-1"));

        Item item = mapper("plans", BaseKind.TASKS).fromStorage(new StoredDocument("9", metadata, "x"));

        assertEquals(List.of("issues-1", "issues-2", "docs-3"), item.getRelated());
        assertEquals(Priority.MEDIUM, item.getPriority());
    }

    @Test
    void writesDefaultsForCustomFields() {
        List<FieldDefinition> fields = new ArrayList<>(StandardFields.forKind(BaseKind.DOCUMENTS));
        fields.add(new FieldDefinition("audience", FieldDefinition.Type.STRING, false, "internal", null));
        fields.add(new FieldDefinition("reviewers", FieldDefinition.Type.TAGS, false, "[\"ann\"]", null));

        Item item = new Item("recipes", "2");
        item.setTitle("Soup");
        Map<String, Object> metadata = new DefinitionFieldMapper("recipes", BaseKind.DOCUMENTS, fields).toStorage(item);

        assertEquals("internal", metadata.get("audience"));
        assertEquals(List.of("ann"), metadata.get("reviewers"));
    }
}
