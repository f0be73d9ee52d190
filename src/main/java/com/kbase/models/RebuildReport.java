package com.kbase.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class RebuildReport {

    private final Map<String, Integer> syncedByType = new LinkedHashMap<>();
    private final List<String> registeredTypes = new ArrayList<>();
    private final List<String> failedTypes = new ArrayList<>();

    public void recordSynced(String type, int count) {
        syncedByType.put(type, count);
    }

    public void recordRegistered(String type) {
        registeredTypes.add(type);
    }

    public void recordFailure(String type) {
        failedTypes.add(type);
    }

    public Map<String, Integer> getSyncedByType() {
        return Collections.unmodifiableMap(syncedByType);
    }

    public int getSynced(String type) {
        return syncedByType.getOrDefault(type, 0);
    }

    public int getTotalSynced() {
        int total = 0;
        for (int count : syncedByType.values()) {
            total += count;
        }
        return total;
    }

    /**
     * Types found on disk without a registry row and registered during the rebuild.
     */
    public List<String> getRegisteredTypes() {
        return Collections.unmodifiableList(registeredTypes);
    }

    public List<String> getFailedTypes() {
        return Collections.unmodifiableList(failedTypes);
    }
}
