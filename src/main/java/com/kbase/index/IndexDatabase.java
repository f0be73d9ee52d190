package com.kbase.index;

import com.kbase.AppLogger;
import com.kbase.KnowledgeBaseException;
import com.kbase.mapping.StandardFields;
import com.kbase.models.BaseKind;
import com.kbase.models.FieldDefinition;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The SQLite secondary index. Owns the single JDBC connection; all access is serialized on this object.
 */
public class IndexDatabase implements AutoCloseable {

    /**
     * Work against the open connection.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection conn) throws SQLException;
    }

    private static final String[][] DEFAULT_STATUSES = {
        {"Open", "0"},
        {"In Progress", "0"},
        {"Review", "0"},
        {"Completed", "1"},
        {"Closed", "1"},
        {"On Hold", "0"},
        {"Cancelled", "1"}
    };

    private static final Map<String, BaseKind> BUILT_IN_TYPES = new LinkedHashMap<>();

    static {
        BUILT_IN_TYPES.put("issues", BaseKind.TASKS);
        BUILT_IN_TYPES.put("plans", BaseKind.TASKS);
        BUILT_IN_TYPES.put("docs", BaseKind.DOCUMENTS);
        BUILT_IN_TYPES.put("knowledge", BaseKind.DOCUMENTS);
    }

    private final Path dbFile;
    private Connection conn;

    public IndexDatabase(Path dbFile) {
        this.dbFile = dbFile;
    }

    public static Map<String, BaseKind> builtInTypes() {
        return BUILT_IN_TYPES;
    }

    public synchronized void open() {
        try {
            Path parent = dbFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw KnowledgeBaseException.internal("Cannot create index directory for " + dbFile, e);
        }
        try {
            conn = DriverManager.getConnection("jdbc:sqlite:" + dbFile.toAbsolutePath());
            try (Statement st = conn.createStatement()) {
                st.execute("PRAGMA journal_mode=WAL");
                st.execute("PRAGMA busy_timeout=5000");
            }
            createSchema();
            seed();
            log("Opened index at " + dbFile.toAbsolutePath());
        } catch (SQLException e) {
            throw KnowledgeBaseException.internal("Failed to open index " + dbFile + ": " + e.getMessage(), e);
        }
    }

    private void createSchema() throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("CREATE TABLE IF NOT EXISTS statuses ("
                + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                + "name TEXT NOT NULL UNIQUE, "
                + "is_closed INTEGER NOT NULL DEFAULT 0)");
            st.execute("CREATE TABLE IF NOT EXISTS tags ("
                + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                + "name TEXT NOT NULL UNIQUE)");
            st.execute("CREATE TABLE IF NOT EXISTS sequences ("
                + "type TEXT PRIMARY KEY, "
                + "current_value INTEGER NOT NULL DEFAULT 0, "
                + "base_type TEXT NOT NULL, "
                + "description TEXT)");
            st.execute("CREATE TABLE IF NOT EXISTS type_fields ("
                + "type TEXT NOT NULL, "
                + "field_name TEXT NOT NULL, "
                + "field_type TEXT NOT NULL, "
                + "required INTEGER NOT NULL DEFAULT 0, "
                + "default_value TEXT, "
                + "description TEXT, "
                + "position INTEGER NOT NULL, "
                + "PRIMARY KEY (type, field_name))");
            dropOutdatedItemsTable(st);
            // row_id is declared so VACUUM keeps it stable; items_fts rows are keyed by it
            st.execute("CREATE TABLE IF NOT EXISTS items ("
                + "row_id INTEGER PRIMARY KEY, "
                + "type TEXT NOT NULL, "
                + "id TEXT NOT NULL, "
                + "title TEXT NOT NULL, "
                + "description TEXT, "
                + "content TEXT, "
                + "priority TEXT, "
                + "status_id INTEGER, "
                + "status_name TEXT, "
                + "start_date TEXT, "
                + "end_date TEXT, "
                + "start_time TEXT, "
                + "version TEXT, "
                + "tags TEXT NOT NULL DEFAULT '[]', "
                + "related TEXT NOT NULL DEFAULT '[]', "
                + "created_at TEXT, "
                + "updated_at TEXT, "
                + "UNIQUE (type, id))");
            st.execute("CREATE INDEX IF NOT EXISTS idx_items_type_updated ON items(type, updated_at)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_items_type_start ON items(type, start_date)");
            st.execute("CREATE VIRTUAL TABLE IF NOT EXISTS items_fts USING fts5("
                + "title, description, content, tags, tokenize='unicode61')");
            st.execute("CREATE TABLE IF NOT EXISTS item_tags ("
                + "item_type TEXT NOT NULL, "
                + "item_id TEXT NOT NULL, "
                + "tag TEXT NOT NULL, "
                + "PRIMARY KEY (item_type, item_id, tag))");
            st.execute("CREATE INDEX IF NOT EXISTS idx_item_tags_tag ON item_tags(tag)");
            st.execute("CREATE TABLE IF NOT EXISTS related_items ("
                + "source_type TEXT NOT NULL, "
                + "source_id TEXT NOT NULL, "
                + "target_type TEXT NOT NULL, "
                + "target_id TEXT NOT NULL, "
                + "PRIMARY KEY (source_type, source_id, target_type, target_id))");
            st.execute("CREATE INDEX IF NOT EXISTS idx_related_target ON related_items(target_type, target_id)");
        }
    }

    /**
     * Drops an items table from an older layout together with the rows derived from it. The files are
     * untouched; a rebuild repopulates the index.
     */
    private void dropOutdatedItemsTable(Statement st) throws SQLException {
        boolean exists = false;
        boolean current = false;
        boolean hasVersion = false;
        try (ResultSet rs = st.executeQuery("PRAGMA table_info(items)")) {
            while (rs.next()) {
                exists = true;
                String column = rs.getString("name");
                if ("row_id".equals(column)) {
                    current = true;
                } else if ("version".equals(column)) {
                    hasVersion = true;
                }
            }
        }
        if (!exists || (current && hasVersion)) {
            return;
        }
        logWarning("Index at " + dbFile + " uses an older items layout; dropping item rows, run rebuild");
        st.execute("DROP TABLE IF EXISTS items_fts");
        st.execute("DROP TABLE IF EXISTS items");
        st.execute("DROP TABLE IF EXISTS item_tags");
        st.execute("DROP TABLE IF EXISTS related_items");
    }

    private void seed() throws SQLException {
        conn.setAutoCommit(false);
        try {
            boolean empty;
            try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM statuses")) {
                empty = rs.next() && rs.getInt(1) == 0;
            }
            if (empty) {
                try (PreparedStatement ps = conn.prepareStatement("INSERT INTO statuses(name, is_closed) VALUES (?, ?)")) {
                    for (String[] status : DEFAULT_STATUSES) {
                        ps.setString(1, status[0]);
                        ps.setInt(2, Integer.parseInt(status[1]));
                        ps.executeUpdate();
                    }
                }
            }
            for (Map.Entry<String, BaseKind> entry : BUILT_IN_TYPES.entrySet()) {
                try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT OR IGNORE INTO sequences(type, current_value, base_type, description) VALUES (?, 0, ?, ?)")) {
                    ps.setString(1, entry.getKey());
                    ps.setString(2, entry.getValue().getKey());
                    ps.setString(3, "Built-in " + entry.getValue().getKey() + " type");
                    ps.executeUpdate();
                }
                insertFieldDefinitions(conn, entry.getKey(), StandardFields.forKind(entry.getValue()));
            }
            conn.commit();
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    /**
     * Inserts field definitions for a type, keeping rows that already exist.
     */
    public static void insertFieldDefinitions(Connection conn, String type, List<FieldDefinition> fields) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
            "INSERT OR IGNORE INTO type_fields(type, field_name, field_type, required, default_value, description, position) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?)")) {
            int position = 0;
            for (FieldDefinition field : fields) {
                ps.setString(1, type);
                ps.setString(2, field.getName());
                ps.setString(3, field.getType().name());
                ps.setInt(4, field.isRequired() ? 1 : 0);
                ps.setString(5, field.getDefaultValue());
                ps.setString(6, field.getDescription());
                ps.setInt(7, position++);
                ps.executeUpdate();
            }
        }
    }

    /**
     * Runs a single read or autocommitted write.
     */
    public synchronized <T> T query(SqlWork<T> work) {
        ensureOpen();
        try {
            return work.apply(conn);
        } catch (SQLException e) {
            throw KnowledgeBaseException.internal("Index query failed: " + e.getMessage(), e);
        }
    }

    /**
     * Runs the work in one transaction, rolled back on any exception.
     */
    public synchronized <T> T transaction(SqlWork<T> work) {
        ensureOpen();
        try {
            conn.setAutoCommit(false);
            try {
                T result = work.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw KnowledgeBaseException.internal("Index transaction failed: " + e.getMessage(), e);
        }
    }

    public Path getDbFile() {
        return dbFile;
    }

    private void ensureOpen() {
        if (conn == null) {
            throw new IllegalStateException("Index database is not open");
        }
    }

    private void rollbackQuietly() {
        try {
            conn.rollback();
        } catch (SQLException e) {
            logWarning("Rollback failed: " + e.getMessage());
        }
    }

    @Override
    public synchronized void close() {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (SQLException e) {
            logWarning("Failed to close index: " + e.getMessage());
        } finally {
            conn = null;
        }
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[IndexDatabase] " + message);
        } else {
            System.out.println("[IndexDatabase] " + message);
        }
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[IndexDatabase] " + message);
        } else {
            System.out.println("[IndexDatabase] " + message);
        }
    }
}
