package com.kbase.models;

import java.util.Locale;
import java.util.Optional;

/**
 * Structural category of an item type. Decides how ids are minted and which fields an item carries.
 */
public enum BaseKind {
    TASKS("tasks", IdStrategy.SEQUENCE, true, true, true),
    DOCUMENTS("documents", IdStrategy.SEQUENCE, true, false, true),
    SESSIONS("sessions", IdStrategy.TIMESTAMP, false, false, false),
    DAILIES("dailies", IdStrategy.DATE, false, false, false);

    public enum IdStrategy {
        SEQUENCE,
        TIMESTAMP,
        DATE
    }

    private final String key;
    private final IdStrategy idStrategy;
    private final boolean contentRequired;
    private final boolean workflow;
    private final boolean registrable;

    BaseKind(String key, IdStrategy idStrategy, boolean contentRequired, boolean workflow, boolean registrable) {
        this.key = key;
        this.idStrategy = idStrategy;
        this.contentRequired = contentRequired;
        this.workflow = workflow;
        this.registrable = registrable;
    }

    public String getKey() {
        return key;
    }

    public IdStrategy getIdStrategy() {
        return idStrategy;
    }

    public boolean isContentRequired() {
        return contentRequired;
    }

    /**
     * True when items of this kind carry priority and a workflow status.
     */
    public boolean hasWorkflow() {
        return workflow;
    }

    /**
     * True when custom types may be registered on top of this kind.
     */
    public boolean isRegistrable() {
        return registrable;
    }

    public boolean isDateKeyed() {
        return idStrategy != IdStrategy.SEQUENCE;
    }

    public static Optional<BaseKind> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (BaseKind kind : values()) {
            if (kind.key.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
