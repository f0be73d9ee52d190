package com.kbase.mapping;

import com.kbase.models.Item;
import com.kbase.storage.StoredDocument;

import java.util.Map;

/**
 * Converts between the typed item and the flat metadata block of its file.
 */
public interface FieldMapper {

    /**
     * Metadata block for the item's file. The content goes to the body and is not part of it.
     */
    Map<String, Object> toStorage(Item item);

    /**
     * Reverses {@link #toStorage(Item)}. Status names are taken as stored; relation views are left empty.
     */
    Item fromStorage(StoredDocument doc);
}
