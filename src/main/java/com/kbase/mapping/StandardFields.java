package com.kbase.mapping;

import com.kbase.models.BaseKind;
import com.kbase.models.FieldDefinition;
import com.kbase.models.FieldDefinition.Type;

import java.util.List;

/**
 * Metadata fields every type of a base kind starts with. Registered types get a copy in {@code type_fields}.
 */
public final class StandardFields {

    private static final FieldDefinition ID_SEQUENCE = new FieldDefinition("id", Type.NUMBER, true, null, "Sequential id");
    private static final FieldDefinition TITLE = new FieldDefinition("title", Type.STRING, true, null, "Title");
    private static final FieldDefinition DESCRIPTION = new FieldDefinition("description", Type.TEXT, false, null, "Short summary");
    private static final FieldDefinition VERSION = new FieldDefinition("version", Type.STRING, false, null, "Version label");
    private static final FieldDefinition TAGS = new FieldDefinition("tags", Type.TAGS, false, "[]", "Tag names");
    private static final FieldDefinition RELATED = new FieldDefinition("related", Type.RELATED, false, "[]", "References as type-id");
    private static final FieldDefinition CREATED_AT = new FieldDefinition("created_at", Type.TIMESTAMP, true, null, "Creation time");
    private static final FieldDefinition UPDATED_AT = new FieldDefinition("updated_at", Type.TIMESTAMP, true, null, "Last update time");

    private static final List<FieldDefinition> TASKS = List.of(
        ID_SEQUENCE,
        TITLE,
        DESCRIPTION,
        new FieldDefinition("priority", Type.PRIORITY, false, "medium", "high, medium or low"),
        new FieldDefinition("status", Type.STATUS, false, "Open", "Workflow status name"),
        new FieldDefinition("status_id", Type.NUMBER, false, null, "Workflow status id"),
        new FieldDefinition("start_date", Type.DATE, false, null, "Planned start"),
        new FieldDefinition("end_date", Type.DATE, false, null, "Planned end"),
        VERSION,
        TAGS,
        RELATED,
        CREATED_AT,
        UPDATED_AT
    );

    private static final List<FieldDefinition> DOCUMENTS = List.of(
        ID_SEQUENCE,
        TITLE,
        DESCRIPTION,
        VERSION,
        TAGS,
        RELATED,
        CREATED_AT,
        UPDATED_AT
    );

    private static final List<FieldDefinition> SESSIONS = List.of(
        new FieldDefinition("id", Type.STRING, true, null, "Timestamp id"),
        TITLE,
        DESCRIPTION,
        new FieldDefinition("start_date", Type.DATE, true, null, "Session date"),
        new FieldDefinition("start_time", Type.TIME, true, null, "Session start time"),
        TAGS,
        RELATED,
        CREATED_AT,
        UPDATED_AT
    );

    private static final List<FieldDefinition> DAILIES = List.of(
        new FieldDefinition("id", Type.DATE, true, null, "Summary date"),
        TITLE,
        DESCRIPTION,
        new FieldDefinition("start_date", Type.DATE, true, null, "Summary date"),
        TAGS,
        RELATED,
        CREATED_AT,
        UPDATED_AT
    );

    private StandardFields() {
    }

    public static List<FieldDefinition> forKind(BaseKind kind) {
        switch (kind) {
            case TASKS:
                return TASKS;
            case DOCUMENTS:
                return DOCUMENTS;
            case SESSIONS:
                return SESSIONS;
            case DAILIES:
                return DAILIES;
            default:
                throw new IllegalArgumentException("Unknown base kind: " + kind);
        }
    }
}
