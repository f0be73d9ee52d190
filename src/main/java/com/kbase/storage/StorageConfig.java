package com.kbase.storage;

import com.kbase.models.BaseKind;

/**
 * Where the files of one type live: {@code <baseDir>[/<partition>]/<prefix><id>.md} under the data directory.
 */
public class StorageConfig {

    public static final String EXTENSION = ".md";

    private final String baseDir;
    private final String prefix;
    private final boolean datePartitioned;

    public StorageConfig(String baseDir, String prefix, boolean datePartitioned) {
        this.baseDir = baseDir;
        this.prefix = prefix;
        this.datePartitioned = datePartitioned;
    }

    public static StorageConfig forType(String type, BaseKind kind) {
        if (kind == BaseKind.SESSIONS) {
            return new StorageConfig("sessions", "sessions-", true);
        }
        if (kind == BaseKind.DAILIES) {
            return new StorageConfig("sessions/dailies", "dailies-", false);
        }
        return new StorageConfig(type, type + "-", false);
    }

    public String getBaseDir() {
        return baseDir;
    }

    public String getPrefix() {
        return prefix;
    }

    public boolean isDatePartitioned() {
        return datePartitioned;
    }

    /**
     * Partition directory for an id of a date-partitioned type: the leading {@code YYYY-MM-DD}.
     */
    public String partitionOf(String id) {
        if (!datePartitioned) {
            return null;
        }
        if (id == null || id.length() < 10) {
            throw new IllegalArgumentException("Id is too short to carry a date partition: " + id);
        }
        return id.substring(0, 10);
    }

    public String fileName(String id) {
        return prefix + id + EXTENSION;
    }

    @Override
    public String toString() {
        return "StorageConfig{" + baseDir + ", " + prefix + (datePartitioned ? ", partitioned" : "") + "}";
    }
}
