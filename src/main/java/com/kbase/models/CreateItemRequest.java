package com.kbase.models;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Parameters for creating an item. Only {@code type} and {@code title} are always needed; the
 * synchronizer decides which of the rest apply to the type's base kind.
 */
public class CreateItemRequest {

    private final String type;
    private String title;
    private String description;
    private String content;
    private Priority priority;
    private String status;
    private String startDate;
    private String endDate;
    private String version;
    private List<String> tags;
    private List<String> related;
    private List<String> relatedTasks;
    private List<String> relatedDocuments;
    private String id;
    private Instant datetime;
    private String date;

    public CreateItemRequest(String type) {
        this.type = type;
    }

    public static CreateItemRequest of(String type, String title, String content) {
        return new CreateItemRequest(type).title(title).content(content);
    }

    public CreateItemRequest title(String title) {
        this.title = title;
        return this;
    }

    public CreateItemRequest description(String description) {
        this.description = description;
        return this;
    }

    public CreateItemRequest content(String content) {
        this.content = content;
        return this;
    }

    public CreateItemRequest priority(Priority priority) {
        this.priority = priority;
        return this;
    }

    public CreateItemRequest status(String status) {
        this.status = status;
        return this;
    }

    public CreateItemRequest startDate(String startDate) {
        this.startDate = startDate;
        return this;
    }

    public CreateItemRequest endDate(String endDate) {
        this.endDate = endDate;
        return this;
    }

    public CreateItemRequest version(String version) {
        this.version = version;
        return this;
    }

    public CreateItemRequest tags(List<String> tags) {
        this.tags = tags != null ? new ArrayList<>(tags) : null;
        return this;
    }

    public CreateItemRequest related(List<String> related) {
        this.related = related != null ? new ArrayList<>(related) : null;
        return this;
    }

    public CreateItemRequest relatedTasks(List<String> relatedTasks) {
        this.relatedTasks = relatedTasks != null ? new ArrayList<>(relatedTasks) : null;
        return this;
    }

    public CreateItemRequest relatedDocuments(List<String> relatedDocuments) {
        this.relatedDocuments = relatedDocuments != null ? new ArrayList<>(relatedDocuments) : null;
        return this;
    }

    /**
     * Explicit session id; overrides derivation from {@link #datetime(Instant)}.
     */
    public CreateItemRequest id(String id) {
        this.id = id;
        return this;
    }

    /**
     * Instant a session id is derived from, for back-filling past sessions.
     */
    public CreateItemRequest datetime(Instant datetime) {
        this.datetime = datetime;
        return this;
    }

    /**
     * Calendar date of a daily summary; defaults to today.
     */
    public CreateItemRequest date(String date) {
        this.date = date;
        return this;
    }

    public String getType() {
        return type;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getContent() {
        return content;
    }

    public Priority getPriority() {
        return priority;
    }

    public String getStatus() {
        return status;
    }

    public String getStartDate() {
        return startDate;
    }

    public String getEndDate() {
        return endDate;
    }

    public String getVersion() {
        return version;
    }

    public List<String> getTags() {
        return tags;
    }

    public List<String> getRelated() {
        return related;
    }

    public List<String> getRelatedTasks() {
        return relatedTasks;
    }

    public List<String> getRelatedDocuments() {
        return relatedDocuments;
    }

    public String getId() {
        return id;
    }

    public Instant getDatetime() {
        return datetime;
    }

    public String getDate() {
        return date;
    }
}
