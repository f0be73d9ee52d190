package com.kbase;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Field cleaning and validation shared by create, update and type change.
 */
public final class ItemRules {

    public static final int MAX_TITLE_LENGTH = 500;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DATE_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern SESSION_ID_PATTERN =
        Pattern.compile("^\\d{4}-\\d{2}-\\d{2}-\\d{2}\\.\\d{2}\\.\\d{2}\\.\\d{3}$");

    private static final DateTimeFormatter STRICT_DATE =
        DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter STRICT_SESSION_ID =
        DateTimeFormatter.ofPattern("uuuu-MM-dd-HH.mm.ss.SSS").withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private ItemRules() {
    }

    /**
     * Trims the title and collapses inner runs of whitespace to a single space.
     */
    public static String normalizeTitle(String title) {
        if (title == null) {
            throw KnowledgeBaseException.invalid("Title is required");
        }
        String normalized = collapse(title);
        if (normalized.isEmpty()) {
            throw KnowledgeBaseException.invalid("Title cannot be empty");
        }
        if (normalized.length() > MAX_TITLE_LENGTH) {
            throw KnowledgeBaseException.invalid("Title must be " + MAX_TITLE_LENGTH + " characters or less");
        }
        return normalized;
    }

    /**
     * Null and empty both mean no value.
     */
    public static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    /**
     * Validates a calendar date. Null or empty yields null.
     */
    public static String validateDate(String field, String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        if (!DATE_PATTERN.matcher(value).matches()) {
            throw KnowledgeBaseException.invalid("Invalid " + field + ": " + value + ". Expected YYYY-MM-DD");
        }
        try {
            LocalDate.parse(value, STRICT_DATE);
        } catch (DateTimeException e) {
            throw KnowledgeBaseException.invalid("Invalid " + field + ": " + value + " is not a real date");
        }
        return value;
    }

    public static void validateSessionId(String id) {
        if (id == null || !SESSION_ID_PATTERN.matcher(id).matches()) {
            throw KnowledgeBaseException.invalid("Invalid session id: " + id + ". Expected YYYY-MM-DD-HH.MM.SS.mmm");
        }
        try {
            STRICT_SESSION_ID.parse(id);
        } catch (DateTimeException e) {
            throw KnowledgeBaseException.invalid("Invalid session id: " + id + " is not a real date and time");
        }
    }

    public static String sessionId(Instant instant, ZoneId zone) {
        return STRICT_SESSION_ID.format(instant.atZone(zone));
    }

    /**
     * The {@code HH:mm:ss} part of a session id.
     */
    public static String sessionTime(String sessionId) {
        return sessionId.substring(11, 19).replace('.', ':');
    }

    public static String timestamp(Instant instant) {
        return TIMESTAMP.format(instant);
    }

    /**
     * Trims and collapses each tag, dropping empties and duplicates. Order of first appearance is kept.
     */
    public static List<String> cleanTags(Collection<String> tags) {
        Set<String> cleaned = new LinkedHashSet<>();
        if (tags != null) {
            for (String tag : tags) {
                if (tag == null) {
                    continue;
                }
                String value = collapse(tag);
                if (!value.isEmpty()) {
                    cleaned.add(value);
                }
            }
        }
        return new ArrayList<>(cleaned);
    }

    /**
     * Ordered union of reference lists. Each reference must look like {@code type-id}.
     */
    @SafeVarargs
    public static List<String> cleanReferences(Collection<String>... lists) {
        Set<String> cleaned = new LinkedHashSet<>();
        for (Collection<String> list : lists) {
            if (list == null) {
                continue;
            }
            for (String reference : list) {
                String value = reference == null ? "" : reference.trim();
                int dash = value.indexOf('-');
                if (dash <= 0 || dash == value.length() - 1 || WHITESPACE.matcher(value).find()) {
                    throw KnowledgeBaseException.invalid("Invalid related reference: \"" + value
                        + "\". Expected type-id, e.g. issues-1");
                }
                cleaned.add(value);
            }
        }
        return new ArrayList<>(cleaned);
    }

    public static void rejectSelfReference(String reference, Collection<String> related) {
        if (related.contains(reference)) {
            throw KnowledgeBaseException.invalid("Item cannot reference itself: " + reference);
        }
    }

    /**
     * Type part of a {@code type-id} reference.
     */
    public static String referenceType(String reference) {
        int dash = reference.indexOf('-');
        return dash > 0 ? reference.substring(0, dash) : reference;
    }

    private static String collapse(String value) {
        return WHITESPACE.matcher(value.trim()).replaceAll(" ");
    }
}
