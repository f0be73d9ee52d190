package com.kbase.models;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A stored knowledge base item. Single-item reads build it from the Markdown file, so two reads of the
 * same unchanged file compare equal.
 */
public class Item {

    private String type;
    private String id;
    private String title;
    private String description;
    private String content = "";
    private Priority priority;
    private String status;
    private Integer statusId;
    private String startDate;
    private String endDate;
    private String startTime;
    private String version;
    private List<String> tags = new ArrayList<>();
    private List<String> related = new ArrayList<>();
    private List<String> relatedTasks = new ArrayList<>();
    private List<String> relatedDocuments = new ArrayList<>();
    private String createdAt;
    private String updatedAt;

    public Item() {
    }

    public Item(String type, String id) {
        this.type = type;
        this.id = id;
    }

    public Item copy() {
        Item copy = new Item(type, id);
        copy.title = title;
        copy.description = description;
        copy.content = content;
        copy.priority = priority;
        copy.status = status;
        copy.statusId = statusId;
        copy.startDate = startDate;
        copy.endDate = endDate;
        copy.startTime = startTime;
        copy.version = version;
        copy.setTags(tags);
        copy.setRelated(related);
        copy.setRelatedTasks(relatedTasks);
        copy.setRelatedDocuments(relatedDocuments);
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        return copy;
    }

    /**
     * The {@code type-id} string other items use to reference this one.
     */
    public String reference() {
        return type + "-" + id;
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

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content != null ? content : "";
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

    public Integer getStatusId() {
        return statusId;
    }

    public void setStatusId(Integer statusId) {
        this.statusId = statusId;
    }

    public String getStartDate() {
        return startDate;
    }

    public void setStartDate(String startDate) {
        this.startDate = startDate;
    }

    public String getEndDate() {
        return endDate;
    }

    public void setEndDate(String endDate) {
        this.endDate = endDate;
    }

    public String getStartTime() {
        return startTime;
    }

    public void setStartTime(String startTime) {
        this.startTime = startTime;
    }

    /**
     * Free-form version label, e.g. {@code 1.2.3}.
     */
    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    }

    public List<String> getRelated() {
        return related;
    }

    public void setRelated(List<String> related) {
        this.related = related != null ? new ArrayList<>(related) : new ArrayList<>();
    }

    public List<String> getRelatedTasks() {
        return relatedTasks;
    }

    public void setRelatedTasks(List<String> relatedTasks) {
        this.relatedTasks = relatedTasks != null ? new ArrayList<>(relatedTasks) : new ArrayList<>();
    }

    public List<String> getRelatedDocuments() {
        return relatedDocuments;
    }

    public void setRelatedDocuments(List<String> relatedDocuments) {
        this.relatedDocuments = relatedDocuments != null ? new ArrayList<>(relatedDocuments) : new ArrayList<>();
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(String createdAt) {
        this.createdAt = createdAt;
    }

    public String getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(String updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public String toString() {
        return "Item{" +
            "type='" + type + '\'' +
            ", id='" + id + '\'' +
            ", title='" + title + '\'' +
            ", status='" + status + '\'' +
            ", priority=" + priority +
            ", tags=" + tags +
            ", related=" + related +
            ", createdAt='" + createdAt + '\'' +
            ", updatedAt='" + updatedAt + '\'' +
            '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Item item = (Item) o;
        return Objects.equals(type, item.type)
            && Objects.equals(id, item.id)
            && Objects.equals(title, item.title)
            && Objects.equals(description, item.description)
            && Objects.equals(content, item.content)
            && priority == item.priority
            && Objects.equals(status, item.status)
            && Objects.equals(statusId, item.statusId)
            && Objects.equals(startDate, item.startDate)
            && Objects.equals(endDate, item.endDate)
            && Objects.equals(startTime, item.startTime)
            && Objects.equals(version, item.version)
            && Objects.equals(tags, item.tags)
            && Objects.equals(related, item.related)
            && Objects.equals(relatedTasks, item.relatedTasks)
            && Objects.equals(relatedDocuments, item.relatedDocuments)
            && Objects.equals(createdAt, item.createdAt)
            && Objects.equals(updatedAt, item.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, id);
    }
}
