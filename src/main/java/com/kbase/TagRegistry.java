package com.kbase;

import com.kbase.index.IndexDatabase;
import com.kbase.models.Tag;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Known tag names. Usage counts are counted from the item tag edges on every read.
 */
public class TagRegistry {

    private static final String SELECT_WITH_USAGE =
        "SELECT t.id, t.name, (SELECT COUNT(*) FROM item_tags it WHERE it.tag = t.name) AS usage_count FROM tags t";

    private final IndexDatabase db;

    public TagRegistry(IndexDatabase db) {
        this.db = db;
    }

    /**
     * Creates any of the names that are missing. Safe to repeat.
     */
    public void ensureExist(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return;
        }
        db.transaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("INSERT OR IGNORE INTO tags(name) VALUES (?)")) {
                for (String name : names) {
                    if (name == null || name.trim().isEmpty()) {
                        continue;
                    }
                    ps.setString(1, name.trim());
                    ps.executeUpdate();
                }
            }
            return null;
        });
    }

    public long getOrCreateId(String name) {
        String cleaned = requireName(name);
        return db.transaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("INSERT OR IGNORE INTO tags(name) VALUES (?)")) {
                ps.setString(1, cleaned);
                ps.executeUpdate();
            }
            return findId(conn, cleaned);
        });
    }

    /**
     * Explicit creation. A name that already exists is a conflict.
     */
    public Tag create(String name) {
        String cleaned = requireName(name);
        return db.transaction(conn -> {
            if (findIdOrNull(conn, cleaned) != null) {
                throw KnowledgeBaseException.conflict("Tag \"" + cleaned + "\" already exists");
            }
            try (PreparedStatement ps = conn.prepareStatement("INSERT INTO tags(name) VALUES (?)")) {
                ps.setString(1, cleaned);
                ps.executeUpdate();
            }
            return new Tag(findId(conn, cleaned), cleaned, usageOf(conn, cleaned));
        });
    }

    /**
     * Deletes the tag row. Refused with a conflict while any item still carries the tag.
     *
     * @return false when no such tag existed
     */
    public boolean delete(String name) {
        String cleaned = requireName(name);
        return db.transaction(conn -> {
            int usage = usageOf(conn, cleaned);
            if (usage > 0) {
                throw KnowledgeBaseException.conflict("Cannot delete tag \"" + cleaned + "\": it is used by "
                    + usage + (usage == 1 ? " item" : " items"));
            }
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM tags WHERE name = ?")) {
                ps.setString(1, cleaned);
                return ps.executeUpdate() > 0;
            }
        });
    }

    /**
     * Tags whose name contains the pattern, case-insensitively.
     */
    public List<Tag> search(String pattern) {
        String needle = pattern == null ? "" : pattern.trim();
        return select(SELECT_WITH_USAGE + " WHERE t.name LIKE ? ESCAPE '\\' ORDER BY t.name",
            "%" + escapeLike(needle) + "%");
    }

    public List<Tag> all() {
        return select(SELECT_WITH_USAGE + " ORDER BY t.name", null);
    }

    public Optional<Tag> find(String name) {
        List<Tag> tags = select(SELECT_WITH_USAGE + " WHERE t.name = ?", name);
        return tags.isEmpty() ? Optional.empty() : Optional.of(tags.get(0));
    }

    public int usageCount(String name) {
        return db.query(conn -> usageOf(conn, name));
    }

    private List<Tag> select(String sql, String param) {
        return db.query(conn -> {
            List<Tag> out = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                if (param != null) {
                    ps.setString(1, param);
                }
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new Tag(rs.getLong(1), rs.getString(2), rs.getInt(3)));
                    }
                }
            }
            return out;
        });
    }

    private static int usageOf(Connection conn, String name) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM item_tags WHERE tag = ?")) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    private static long findId(Connection conn, String name) throws SQLException {
        Long id = findIdOrNull(conn, name);
        if (id == null) {
            throw new SQLException("Tag row missing after insert: " + name);
        }
        return id;
    }

    private static Long findIdOrNull(Connection conn, String name) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT id FROM tags WHERE name = ?")) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : null;
            }
        }
    }

    private static String requireName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw KnowledgeBaseException.invalid("Tag name is required");
        }
        return name.trim();
    }

    private static String escapeLike(String text) {
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
