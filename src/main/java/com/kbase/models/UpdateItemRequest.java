package com.kbase.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Partial update. A null field is left untouched; an empty string clears an optional text or date field.
 */
public class UpdateItemRequest {

    private final String type;
    private final String id;
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

    public UpdateItemRequest(String type, String id) {
        this.type = type;
        this.id = id;
    }

    public UpdateItemRequest title(String title) {
        this.title = title;
        return this;
    }

    public UpdateItemRequest description(String description) {
        this.description = description;
        return this;
    }

    public UpdateItemRequest content(String content) {
        this.content = content;
        return this;
    }

    public UpdateItemRequest priority(Priority priority) {
        this.priority = priority;
        return this;
    }

    public UpdateItemRequest status(String status) {
        this.status = status;
        return this;
    }

    public UpdateItemRequest startDate(String startDate) {
        this.startDate = startDate;
        return this;
    }

    public UpdateItemRequest endDate(String endDate) {
        this.endDate = endDate;
        return this;
    }

    public UpdateItemRequest version(String version) {
        this.version = version;
        return this;
    }

    public UpdateItemRequest tags(List<String> tags) {
        this.tags = tags != null ? new ArrayList<>(tags) : null;
        return this;
    }

    public UpdateItemRequest related(List<String> related) {
        this.related = related != null ? new ArrayList<>(related) : null;
        return this;
    }

    public UpdateItemRequest relatedTasks(List<String> relatedTasks) {
        this.relatedTasks = relatedTasks != null ? new ArrayList<>(relatedTasks) : null;
        return this;
    }

    public UpdateItemRequest relatedDocuments(List<String> relatedDocuments) {
        this.relatedDocuments = relatedDocuments != null ? new ArrayList<>(relatedDocuments) : null;
        return this;
    }

    public String getType() {
        return type;
    }

    public String getId() {
        return id;
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
}
