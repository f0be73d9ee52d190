package com.kbase.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kbase.models.Item;
import com.kbase.models.ItemQuery;
import com.kbase.models.ItemSummary;
import com.kbase.models.Priority;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Item rows, their full-text shadow and their tag and relation edges.
 */
public class ItemIndex {

    private static final ObjectMapper mapper = new ObjectMapper();

    private static final String SUMMARY_COLUMNS =
        "i.type, i.id, i.title, i.description, i.priority, i.status_name, i.tags, i.start_date, i.updated_at";

    private final IndexDatabase db;

    public ItemIndex(IndexDatabase db) {
        this.db = db;
    }

    /**
     * Writes the item's row, full-text row, tag edges and outgoing relation edges in one transaction.
     */
    public void project(Item item) {
        db.transaction(conn -> {
            upsertRow(conn, item);
            long rowId = rowIdOf(conn, item.getType(), item.getId());

            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM items_fts WHERE rowid = ?")) {
                ps.setLong(1, rowId);
                ps.executeUpdate();
            }
            try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO items_fts(rowid, title, description, content, tags) VALUES (?, ?, ?, ?, ?)")) {
                ps.setLong(1, rowId);
                ps.setString(2, item.getTitle());
                ps.setString(3, item.getDescription() != null ? item.getDescription() : "");
                ps.setString(4, item.getContent());
                ps.setString(5, String.join(" ", item.getTags()));
                ps.executeUpdate();
            }

            replaceTagEdges(conn, item);
            replaceRelationEdges(conn, item);
            return null;
        });
    }

    private void upsertRow(Connection conn, Item item) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
            "INSERT INTO items(type, id, title, description, content, priority, status_id, status_name, "
                + "start_date, end_date, start_time, version, tags, related, created_at, updated_at) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) "
                + "ON CONFLICT(type, id) DO UPDATE SET "
                + "title = excluded.title, description = excluded.description, content = excluded.content, "
                + "priority = excluded.priority, status_id = excluded.status_id, status_name = excluded.status_name, "
                + "start_date = excluded.start_date, end_date = excluded.end_date, start_time = excluded.start_time, "
                + "version = excluded.version, tags = excluded.tags, related = excluded.related, "
                + "created_at = excluded.created_at, updated_at = excluded.updated_at")) {
            ps.setString(1, item.getType());
            ps.setString(2, item.getId());
            ps.setString(3, item.getTitle());
            ps.setString(4, item.getDescription());
            ps.setString(5, item.getContent());
            ps.setString(6, item.getPriority() != null ? item.getPriority().key() : null);
            if (item.getStatusId() != null) {
                ps.setInt(7, item.getStatusId());
            } else {
                ps.setNull(7, Types.INTEGER);
            }
            ps.setString(8, item.getStatus());
            ps.setString(9, item.getStartDate());
            ps.setString(10, item.getEndDate());
            ps.setString(11, item.getStartTime());
            ps.setString(12, item.getVersion());
            ps.setString(13, toJson(item.getTags()));
            ps.setString(14, toJson(item.getRelated()));
            ps.setString(15, item.getCreatedAt());
            ps.setString(16, item.getUpdatedAt());
            ps.executeUpdate();
        }
    }

    private void replaceTagEdges(Connection conn, Item item) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM item_tags WHERE item_type = ? AND item_id = ?")) {
            ps.setString(1, item.getType());
            ps.setString(2, item.getId());
            ps.executeUpdate();
        }
        try (PreparedStatement ps = conn.prepareStatement(
            "INSERT OR IGNORE INTO item_tags(item_type, item_id, tag) VALUES (?, ?, ?)")) {
            for (String tag : item.getTags()) {
                ps.setString(1, item.getType());
                ps.setString(2, item.getId());
                ps.setString(3, tag);
                ps.executeUpdate();
            }
        }
    }

    private void replaceRelationEdges(Connection conn, Item item) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
            "DELETE FROM related_items WHERE source_type = ? AND source_id = ?")) {
            ps.setString(1, item.getType());
            ps.setString(2, item.getId());
            ps.executeUpdate();
        }
        try (PreparedStatement ps = conn.prepareStatement(
            "INSERT OR IGNORE INTO related_items(source_type, source_id, target_type, target_id) VALUES (?, ?, ?, ?)")) {
            for (String reference : item.getRelated()) {
                int dash = reference.indexOf('-');
                if (dash <= 0 || dash == reference.length() - 1) {
                    continue;
                }
                ps.setString(1, item.getType());
                ps.setString(2, item.getId());
                ps.setString(3, reference.substring(0, dash));
                ps.setString(4, reference.substring(dash + 1));
                ps.executeUpdate();
            }
        }
    }

    /**
     * Drops the item's row, full-text row, tag edges and outgoing relation edges. Edges pointing at it stay.
     */
    public boolean remove(String type, String id) {
        return db.transaction(conn -> {
            Long rowId = findRowId(conn, type, id);
            if (rowId != null) {
                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM items_fts WHERE rowid = ?")) {
                    ps.setLong(1, rowId);
                    ps.executeUpdate();
                }
            }
            int removed;
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM items WHERE type = ? AND id = ?")) {
                ps.setString(1, type);
                ps.setString(2, id);
                removed = ps.executeUpdate();
            }
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM item_tags WHERE item_type = ? AND item_id = ?")) {
                ps.setString(1, type);
                ps.setString(2, id);
                ps.executeUpdate();
            }
            try (PreparedStatement ps = conn.prepareStatement(
                "DELETE FROM related_items WHERE source_type = ? AND source_id = ?")) {
                ps.setString(1, type);
                ps.setString(2, id);
                ps.executeUpdate();
            }
            return removed > 0;
        });
    }

    /**
     * Removes every index entry of a type. Returns the number of item rows dropped.
     */
    public int clearType(String type) {
        return db.transaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                "DELETE FROM items_fts WHERE rowid IN (SELECT row_id FROM items WHERE type = ?)")) {
                ps.setString(1, type);
                ps.executeUpdate();
            }
            int removed;
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM items WHERE type = ?")) {
                ps.setString(1, type);
                removed = ps.executeUpdate();
            }
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM item_tags WHERE item_type = ?")) {
                ps.setString(1, type);
                ps.executeUpdate();
            }
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM related_items WHERE source_type = ?")) {
                ps.setString(1, type);
                ps.executeUpdate();
            }
            return removed;
        });
    }

    /**
     * @param dateKeyed filter dates on {@code start_date} instead of the day of {@code updated_at}
     */
    public List<ItemSummary> list(ItemQuery query, boolean dateKeyed) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ").append(SUMMARY_COLUMNS)
            .append(" FROM items i LEFT JOIN statuses s ON s.id = i.status_id WHERE i.type = ?");
        params.add(query.getType());

        List<String> statuses = query.getStatuses();
        if (statuses != null) {
            if (statuses.isEmpty()) {
                sql.append(" AND 0 = 1");
            } else {
                sql.append(" AND i.status_name IN (").append(placeholders(statuses.size())).append(")");
                params.addAll(statuses);
            }
        } else if (!query.isIncludeClosed()) {
            sql.append(" AND (s.is_closed IS NULL OR s.is_closed = 0)");
        }

        String dateColumn = dateKeyed ? "i.start_date" : "substr(i.updated_at, 1, 10)";
        if (query.getStartDate() != null) {
            sql.append(" AND ").append(dateColumn).append(" >= ?");
            params.add(query.getStartDate());
        }
        if (query.getEndDate() != null) {
            sql.append(" AND ").append(dateColumn).append(" <= ?");
            params.add(query.getEndDate());
        }

        sql.append(dateKeyed ? " ORDER BY i.id DESC" : " ORDER BY CAST(i.id AS INTEGER) DESC, i.id DESC");
        int limit = query.effectiveLimit();
        if (limit > 0) {
            sql.append(" LIMIT ?");
            params.add(limit);
        }
        return selectSummaries(sql.toString(), params);
    }

    public Optional<ItemSummary> find(String type, String id) {
        List<ItemSummary> rows = selectSummaries(
            "SELECT " + SUMMARY_COLUMNS + " FROM items i WHERE i.type = ? AND i.id = ?", List.of(type, id));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Items carrying the tag, optionally restricted to some types.
     */
    public List<ItemSummary> listByTag(String tag, Collection<String> types) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ").append(SUMMARY_COLUMNS)
            .append(" FROM items i JOIN item_tags t ON t.item_type = i.type AND t.item_id = i.id WHERE t.tag = ?");
        params.add(tag);
        appendTypeFilter(sql, params, types);
        sql.append(" ORDER BY i.type, i.updated_at DESC");
        return selectSummaries(sql.toString(), params);
    }

    /**
     * Full-text match over title, description, content and tags, best match first.
     */
    public List<ItemSummary> search(String text, Collection<String> types, int limit, int offset) {
        String match = toMatchExpression(text);
        if (match.isEmpty()) {
            return Collections.emptyList();
        }
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ").append(SUMMARY_COLUMNS)
            .append(" FROM items_fts f JOIN items i ON i.row_id = f.rowid WHERE items_fts MATCH ?");
        params.add(match);
        appendTypeFilter(sql, params, types);
        sql.append(" ORDER BY bm25(items_fts) LIMIT ? OFFSET ?");
        params.add(limit > 0 ? Math.min(limit, ItemQuery.MAX_LIMIT) : 20);
        params.add(Math.max(offset, 0));
        return selectSummaries(sql.toString(), params);
    }

    /**
     * Items whose relation edges point at the given item.
     */
    public List<ItemSummary> referencing(String targetType, String targetId) {
        return selectSummaries("SELECT " + SUMMARY_COLUMNS
                + " FROM related_items r JOIN items i ON i.type = r.source_type AND i.id = r.source_id"
                + " WHERE r.target_type = ? AND r.target_id = ? ORDER BY i.type, i.id",
            List.of(targetType, targetId));
    }

    public int count(String type) {
        return db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM items WHERE type = ?")) {
                ps.setString(1, type);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            }
        });
    }

    private List<ItemSummary> selectSummaries(String sql, List<?> params) {
        return db.query(conn -> {
            List<ItemSummary> out = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                bind(ps, params);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(toSummary(rs));
                    }
                }
            }
            return out;
        });
    }

    private ItemSummary toSummary(ResultSet rs) throws SQLException {
        ItemSummary summary = new ItemSummary();
        summary.setType(rs.getString(1));
        summary.setId(rs.getString(2));
        summary.setTitle(rs.getString(3));
        summary.setDescription(rs.getString(4));
        summary.setPriority(Priority.fromKey(rs.getString(5)).orElse(null));
        summary.setStatus(rs.getString(6));
        summary.setTags(fromJson(rs.getString(7)));
        summary.setDate(rs.getString(8));
        summary.setUpdatedAt(rs.getString(9));
        return summary;
    }

    private static void appendTypeFilter(StringBuilder sql, List<Object> params, Collection<String> types) {
        if (types == null || types.isEmpty()) {
            return;
        }
        sql.append(" AND i.type IN (").append(placeholders(types.size())).append(")");
        params.addAll(types);
    }

    private static void bind(PreparedStatement ps, List<?> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object value = params.get(i);
            if (value instanceof Integer) {
                ps.setInt(i + 1, (Integer) value);
            } else {
                ps.setString(i + 1, value != null ? value.toString() : null);
            }
        }
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    /**
     * Quotes every whitespace separated term so user text is never parsed as FTS syntax.
     */
    static String toMatchExpression(String text) {
        if (text == null) {
            return "";
        }
        List<String> terms = new ArrayList<>();
        for (String term : text.trim().split("\\s+")) {
            if (!term.isEmpty()) {
                terms.add("\"" + term.replace("\"", "\"\"") + "\"");
            }
        }
        return String.join(" ", terms);
    }

    private static long rowIdOf(Connection conn, String type, String id) throws SQLException {
        Long rowId = findRowId(conn, type, id);
        if (rowId == null) {
            throw new SQLException("Row vanished after upsert: " + type + "-" + id);
        }
        return rowId;
    }

    private static Long findRowId(Connection conn, String type, String id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT row_id FROM items WHERE type = ? AND id = ?")) {
            ps.setString(1, type);
            ps.setString(2, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : null;
            }
        }
    }

    private static String toJson(List<String> values) throws SQLException {
        try {
            return mapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new SQLException("Cannot serialize " + values, e);
        }
    }

    private static List<String> fromJson(String json) throws SQLException {
        if (json == null || json.isEmpty()) {
            return new ArrayList<>();
        }
        try {
            return mapper.readValue(json, new TypeReference<List<String>>() {});
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt JSON column: " + json, e);
        }
    }
}
