package com.kbase.models;

public class TypeDefinition {

    private final String name;
    private final BaseKind baseKind;
    private final long sequenceValue;
    private final String description;

    public TypeDefinition(String name, BaseKind baseKind, long sequenceValue, String description) {
        this.name = name;
        this.baseKind = baseKind;
        this.sequenceValue = sequenceValue;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public BaseKind getBaseKind() {
        return baseKind;
    }

    /**
     * Last value handed out by the type's sequence. Always 0 for date and timestamp keyed kinds.
     */
    public long getSequenceValue() {
        return sequenceValue;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return "TypeDefinition{" + name + ", " + baseKind.getKey() + ", seq=" + sequenceValue + "}";
    }
}
