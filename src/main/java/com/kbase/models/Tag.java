package com.kbase.models;

public class Tag {

    private final long id;
    private final String name;
    private final int usageCount;

    public Tag(long id, String name, int usageCount) {
        this.id = id;
        this.name = name;
        this.usageCount = usageCount;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getUsageCount() {
        return usageCount;
    }

    @Override
    public String toString() {
        return name + " (" + usageCount + ")";
    }
}
