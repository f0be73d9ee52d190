package com.kbase;

import com.kbase.index.IndexDatabase;
import com.kbase.mapping.StandardFields;
import com.kbase.models.BaseKind;
import com.kbase.models.FieldDefinition;
import com.kbase.models.TypeDefinition;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Known item types. Registry types are rows of the {@code sequences} table; sessions and dailies are built in.
 */
public class TypeRegistry {

    public static final String SESSIONS = "sessions";
    public static final String DAILIES = "dailies";

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-z][a-z0-9_]*$");
    private static final int MAX_NAME_LENGTH = 50;

    private final IndexDatabase db;
    private final Map<String, List<FieldDefinition>> fieldCache = new ConcurrentHashMap<>();

    public TypeRegistry(IndexDatabase db) {
        this.db = db;
    }

    public boolean typeExists(String name) {
        return baseKindOf(name).isPresent();
    }

    public Optional<BaseKind> baseKindOf(String name) {
        return getType(name).map(TypeDefinition::getBaseKind);
    }

    public Optional<TypeDefinition> getType(String name) {
        if (name == null) {
            return Optional.empty();
        }
        if (SESSIONS.equals(name)) {
            return Optional.of(new TypeDefinition(SESSIONS, BaseKind.SESSIONS, 0, "Work sessions"));
        }
        if (DAILIES.equals(name)) {
            return Optional.of(new TypeDefinition(DAILIES, BaseKind.DAILIES, 0, "Daily summaries"));
        }
        return db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                "SELECT type, base_type, current_value, description FROM sequences WHERE type = ?")) {
                ps.setString(1, name);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? toDefinition(rs) : Optional.<TypeDefinition>empty();
                }
            }
        });
    }

    /**
     * Registry types by name, followed by sessions and dailies.
     */
    public List<TypeDefinition> listTypes() {
        List<TypeDefinition> types = db.query(conn -> {
            List<TypeDefinition> out = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(
                "SELECT type, base_type, current_value, description FROM sequences ORDER BY type")) {
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        toDefinition(rs).ifPresent(out::add);
                    }
                }
            }
            return out;
        });
        getType(SESSIONS).ifPresent(types::add);
        getType(DAILIES).ifPresent(types::add);
        return types;
    }

    public TypeDefinition registerType(String name, BaseKind kind, String description) {
        validateName(name);
        if (kind == null || !kind.isRegistrable()) {
            throw KnowledgeBaseException.invalid("Base type must be tasks or documents, got: "
                + (kind != null ? kind.getKey() : null));
        }
        db.transaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM sequences WHERE type = ?")) {
                ps.setString(1, name);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        throw KnowledgeBaseException.invalid("Type \"" + name + "\" already exists");
                    }
                }
            }
            try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO sequences(type, current_value, base_type, description) VALUES (?, 0, ?, ?)")) {
                ps.setString(1, name);
                ps.setString(2, kind.getKey());
                ps.setString(3, description);
                ps.executeUpdate();
            }
            IndexDatabase.insertFieldDefinitions(conn, name, StandardFields.forKind(kind));
            return null;
        });
        fieldCache.remove(name);
        log("Registered type " + name + " (" + kind.getKey() + ")");
        return new TypeDefinition(name, kind, 0, description);
    }

    public boolean updateDescription(String name, String description) {
        return db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("UPDATE sequences SET description = ? WHERE type = ?")) {
                ps.setString(1, description);
                ps.setString(2, name);
                return ps.executeUpdate() > 0;
            }
        });
    }

    /**
     * Drops the registry row and field definitions. Callers check that no items remain.
     */
    public boolean unregisterType(String name) {
        boolean removed = db.transaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM type_fields WHERE type = ?")) {
                ps.setString(1, name);
                ps.executeUpdate();
            }
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM sequences WHERE type = ?")) {
                ps.setString(1, name);
                return ps.executeUpdate() > 0;
            }
        });
        fieldCache.remove(name);
        return removed;
    }

    /**
     * Increments and returns the type's sequence in a single statement.
     */
    public long nextSequenceValue(String name) {
        Long value = db.transaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE sequences SET current_value = current_value + 1 WHERE type = ? RETURNING current_value")) {
                ps.setString(1, name);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getLong(1) : null;
                }
            }
        });
        if (value == null) {
            throw KnowledgeBaseException.internal("No sequence for type " + name, null);
        }
        return value;
    }

    /**
     * Moves the sequence up to {@code value}. Never lowers it.
     */
    public void raiseSequenceTo(String name, long value) {
        db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE sequences SET current_value = MAX(current_value, ?) WHERE type = ?")) {
                ps.setLong(1, value);
                ps.setString(2, name);
                return ps.executeUpdate();
            }
        });
    }

    /**
     * Field definitions of a type, loaded once and cached.
     */
    public List<FieldDefinition> fieldsOf(String name) {
        List<FieldDefinition> cached = fieldCache.get(name);
        if (cached != null) {
            return cached;
        }
        BaseKind kind = baseKindOf(name)
            .orElseThrow(() -> KnowledgeBaseException.invalid("Unknown type: " + name));
        List<FieldDefinition> fields = kind.isRegistrable() ? loadFields(name) : List.of();
        if (fields.isEmpty()) {
            fields = StandardFields.forKind(kind);
        }
        fields = Collections.unmodifiableList(fields);
        fieldCache.put(name, fields);
        return fields;
    }

    private List<FieldDefinition> loadFields(String name) {
        return db.query(conn -> {
            List<FieldDefinition> out = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(
                "SELECT field_name, field_type, required, default_value, description FROM type_fields "
                    + "WHERE type = ? ORDER BY position")) {
                ps.setString(1, name);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        FieldDefinition.Type fieldType;
                        try {
                            fieldType = FieldDefinition.Type.valueOf(rs.getString(2));
                        } catch (IllegalArgumentException e) {
                            logWarning("Unknown field type " + rs.getString(2) + " on " + name + "." + rs.getString(1));
                            fieldType = FieldDefinition.Type.STRING;
                        }
                        out.add(new FieldDefinition(rs.getString(1), fieldType, rs.getInt(3) != 0,
                            rs.getString(4), rs.getString(5)));
                    }
                }
            }
            return out;
        });
    }

    public static boolean isValidName(String name) {
        return name != null && name.length() <= MAX_NAME_LENGTH && NAME_PATTERN.matcher(name).matches()
            && !SESSIONS.equals(name) && !DAILIES.equals(name);
    }

    public static void validateName(String name) {
        if (name == null || name.isEmpty()) {
            throw KnowledgeBaseException.invalid("Type name is required");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw KnowledgeBaseException.invalid("Type name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw KnowledgeBaseException.invalid("Type name must start with a lowercase letter and contain only "
                + "lowercase letters, digits and underscores: " + name);
        }
        if (SESSIONS.equals(name) || DAILIES.equals(name)) {
            throw KnowledgeBaseException.invalid("Type name is reserved: " + name);
        }
    }

    private Optional<TypeDefinition> toDefinition(ResultSet rs) throws SQLException {
        String name = rs.getString(1);
        Optional<BaseKind> kind = BaseKind.fromKey(rs.getString(2));
        if (kind.isEmpty()) {
            logWarning("Ignoring type " + name + " with unknown base type " + rs.getString(2));
            return Optional.empty();
        }
        return Optional.of(new TypeDefinition(name, kind.get(), rs.getLong(3), rs.getString(4)));
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[TypeRegistry] " + message);
        } else {
            System.out.println("[TypeRegistry] " + message);
        }
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[TypeRegistry] " + message);
        } else {
            System.out.println("[TypeRegistry] " + message);
        }
    }
}
