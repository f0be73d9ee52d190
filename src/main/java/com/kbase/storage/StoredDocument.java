package com.kbase.storage;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One item file as stored: a flat metadata block plus the free-text body.
 */
public class StoredDocument {

    private final String id;
    private final Map<String, Object> metadata;
    private final String body;

    public StoredDocument(String id, Map<String, Object> metadata, String body) {
        this.id = id;
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
        this.body = body != null ? body : "";
    }

    public String getId() {
        return id;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public String getBody() {
        return body;
    }
}
