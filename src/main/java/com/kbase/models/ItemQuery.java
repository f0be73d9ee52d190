package com.kbase.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Filters for listing one type from the secondary index. Closed statuses are excluded unless asked for.
 */
public class ItemQuery {

    public static final int MAX_LIMIT = 10000;

    private final String type;
    private boolean includeClosed;
    private List<String> statuses;
    private String startDate;
    private String endDate;
    private int limit;

    public ItemQuery(String type) {
        this.type = type;
    }

    public static ItemQuery of(String type) {
        return new ItemQuery(type);
    }

    public ItemQuery includeClosed(boolean includeClosed) {
        this.includeClosed = includeClosed;
        return this;
    }

    /**
     * Restricts results to these status names. An empty list matches nothing.
     */
    public ItemQuery statuses(List<String> statuses) {
        this.statuses = statuses != null ? new ArrayList<>(statuses) : null;
        return this;
    }

    public ItemQuery startDate(String startDate) {
        this.startDate = startDate;
        return this;
    }

    public ItemQuery endDate(String endDate) {
        this.endDate = endDate;
        return this;
    }

    /**
     * Zero or negative means unlimited; values above {@link #MAX_LIMIT} are capped.
     */
    public ItemQuery limit(int limit) {
        this.limit = limit;
        return this;
    }

    public String getType() {
        return type;
    }

    public boolean isIncludeClosed() {
        return includeClosed;
    }

    public List<String> getStatuses() {
        return statuses;
    }

    public String getStartDate() {
        return startDate;
    }

    public String getEndDate() {
        return endDate;
    }

    public int getLimit() {
        return limit;
    }

    public int effectiveLimit() {
        if (limit <= 0) {
            return 0;
        }
        return Math.min(limit, MAX_LIMIT);
    }
}
