package com.kbase.models;

public class TypeChangeResult {

    private final Item item;
    private final int relatedUpdates;

    public TypeChangeResult(Item item, int relatedUpdates) {
        this.item = item;
        this.relatedUpdates = relatedUpdates;
    }

    /**
     * The item as re-created under its new type.
     */
    public Item getItem() {
        return item;
    }

    public String getNewId() {
        return item.getId();
    }

    /**
     * Number of other items whose references were rewritten to the new id.
     */
    public int getRelatedUpdates() {
        return relatedUpdates;
    }
}
