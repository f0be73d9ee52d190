package com.kbase.models;

/**
 * One metadata key a type emits into its files, with the value written when the item has none.
 */
public class FieldDefinition {

    public enum Type {
        STRING,
        TEXT,
        NUMBER,
        DATE,
        TIME,
        TIMESTAMP,
        PRIORITY,
        STATUS,
        TAGS,
        RELATED
    }

    private final String name;
    private final Type type;
    private final boolean required;
    private final String defaultValue;
    private final String description;

    public FieldDefinition(String name, Type type, boolean required, String defaultValue, String description) {
        this.name = name;
        this.type = type;
        this.required = required;
        this.defaultValue = defaultValue;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return name + ":" + type.name().toLowerCase();
    }
}
