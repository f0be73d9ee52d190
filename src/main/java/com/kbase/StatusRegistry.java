package com.kbase;

import com.kbase.index.IndexDatabase;
import com.kbase.models.Status;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Workflow statuses referenced by task items. Deleting a status does not check for items that use it.
 */
public class StatusRegistry {

    public static final String DEFAULT_STATUS = "Open";

    private final IndexDatabase db;

    public StatusRegistry(IndexDatabase db) {
        this.db = db;
    }

    public List<Status> all() {
        return select("SELECT id, name, is_closed FROM statuses ORDER BY id", null);
    }

    public Optional<Status> byId(int id) {
        List<Status> rows = select("SELECT id, name, is_closed FROM statuses WHERE id = ?", id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<Status> byName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        List<Status> rows = select("SELECT id, name, is_closed FROM statuses WHERE name = ?", name);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Status create(String name, boolean closed) {
        String cleaned = name == null ? "" : name.trim();
        if (cleaned.isEmpty()) {
            throw KnowledgeBaseException.invalid("Status name is required");
        }
        return db.transaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM statuses WHERE name = ?")) {
                ps.setString(1, cleaned);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        throw KnowledgeBaseException.invalid("Status \"" + cleaned + "\" already exists");
                    }
                }
            }
            try (PreparedStatement ps = conn.prepareStatement("INSERT INTO statuses(name, is_closed) VALUES (?, ?)")) {
                ps.setString(1, cleaned);
                ps.setInt(2, closed ? 1 : 0);
                ps.executeUpdate();
            }
            try (PreparedStatement ps = conn.prepareStatement("SELECT id FROM statuses WHERE name = ?")) {
                ps.setString(1, cleaned);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        throw new SQLException("Status row missing after insert: " + cleaned);
                    }
                    return new Status(rs.getInt(1), cleaned, closed);
                }
            }
        });
    }

    /**
     * Renames and reflags a status. Item rows keep the name they were written with.
     */
    public boolean update(int id, String name, boolean closed) {
        String cleaned = name == null ? "" : name.trim();
        if (cleaned.isEmpty()) {
            throw KnowledgeBaseException.invalid("Status name is required");
        }
        return db.transaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM statuses WHERE name = ? AND id <> ?")) {
                ps.setString(1, cleaned);
                ps.setInt(2, id);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        throw KnowledgeBaseException.invalid("Status \"" + cleaned + "\" already exists");
                    }
                }
            }
            try (PreparedStatement ps = conn.prepareStatement("UPDATE statuses SET name = ?, is_closed = ? WHERE id = ?")) {
                ps.setString(1, cleaned);
                ps.setInt(2, closed ? 1 : 0);
                ps.setInt(3, id);
                return ps.executeUpdate() > 0;
            }
        });
    }

    public boolean delete(int id) {
        return db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM statuses WHERE id = ?")) {
                ps.setInt(1, id);
                return ps.executeUpdate() > 0;
            }
        });
    }

    public Set<Integer> closedIds() {
        Set<Integer> ids = new LinkedHashSet<>();
        for (Status status : all()) {
            if (status.isClosed()) {
                ids.add(status.getId());
            }
        }
        return ids;
    }

    private List<Status> select(String sql, Object param) {
        return db.query(conn -> {
            List<Status> out = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                if (param instanceof Integer) {
                    ps.setInt(1, (Integer) param);
                } else if (param != null) {
                    ps.setString(1, param.toString());
                }
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new Status(rs.getInt(1), rs.getString(2), rs.getInt(3) != 0));
                    }
                }
            }
            return out;
        });
    }
}
