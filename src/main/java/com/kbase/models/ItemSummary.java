package com.kbase.models;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lightweight list view of an item, read from the secondary index.
 */
public class ItemSummary {

    private String type;
    private String id;
    private String title;
    private String description;
    private Priority priority;
    private String status;
    private List<String> tags = new ArrayList<>();
    private String date;
    private String updatedAt;

    public ItemSummary() {
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Priority getPriority() {
        return priority;
    }

    public void setPriority(Priority priority) {
        this.priority = priority;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    }

    /**
     * Calendar date of a session or daily summary; null for other kinds.
     */
    public String getDate() {
        return date;
    }

    public void setDate(String date) {
        this.date = date;
    }

    public String getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(String updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public String toString() {
        return "ItemSummary{" + type + "-" + id + ", title='" + title + "', status='" + status + "'}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ItemSummary that = (ItemSummary) o;
        return Objects.equals(type, that.type)
            && Objects.equals(id, that.id)
            && Objects.equals(title, that.title)
            && Objects.equals(description, that.description)
            && priority == that.priority
            && Objects.equals(status, that.status)
            && Objects.equals(tags, that.tags)
            && Objects.equals(date, that.date)
            && Objects.equals(updatedAt, that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, id);
    }
}
