package com.kbase;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Map;

/**
 * Application configuration handling platform-specific paths and settings.
 *
 * <p>Later sources win: built-in defaults, the JSON settings file, the {@code KBASE_DATA_DIR} environment
 * variable, then command-line arguments.</p>
 */
public class AppConfig {

    private static final String APP_NAME = "kbase";
    public static final String DATA_DIR_ENV = "KBASE_DATA_DIR";
    public static final String DEFAULT_DB_NAME = "search.db";

    private final Path dataDirectory;
    private final Path databasePath;
    private final ZoneId zone;
    private final Path logPath;
    private final boolean consoleEnabled;
    private final String rebuildType;

    private AppConfig(Path dataDirectory, Path databasePath, ZoneId zone, Path logPath,
                      boolean consoleEnabled, String rebuildType) {
        this.dataDirectory = dataDirectory;
        this.databasePath = databasePath;
        this.zone = zone;
        this.logPath = logPath;
        this.consoleEnabled = consoleEnabled;
        this.rebuildType = rebuildType;
    }

    public Path getDataDirectory() {
        return dataDirectory;
    }

    public Path getDatabasePath() {
        return databasePath;
    }

    /**
     * Zone used to derive session ids and the default date of daily summaries.
     */
    public ZoneId getZone() {
        return zone;
    }

    public Path getLogPath() {
        return logPath;
    }

    public boolean isConsoleEnabled() {
        return consoleEnabled;
    }

    /**
     * Single type to rebuild, or null for all of them.
     */
    public String getRebuildType() {
        return rebuildType;
    }

    /**
     * Get the default data directory based on the operating system.
     * Windows: %USERPROFILE%\Documents\kbase\data
     * macOS: ~/Documents/kbase/data
     * Linux: ~/.kbase/data
     */
    public static Path getDefaultDataDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String documents = System.getenv("USERPROFILE");
            if (documents == null) {
                documents = userHome;
            }
            return Paths.get(documents, "Documents", APP_NAME, "data");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Documents", APP_NAME, "data");
        } else {
            return Paths.get(userHome, "." + APP_NAME, "data");
        }
    }

    /**
     * Get the configuration directory based on the operating system.
     * Windows: %APPDATA%\kbase
     * macOS: ~/Library/Application Support/kbase
     * Linux: ~/.config/kbase
     */
    public static Path getConfigDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME);
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Application Support", APP_NAME);
        } else {
            return Paths.get(userHome, ".config", APP_NAME);
        }
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\kbase\logs
     * macOS: ~/Library/Logs/kbase
     * Linux: ~/.local/share/kbase/logs
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            return getConfigDirectory().resolve("logs");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Logs", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
        }
    }

    public static Path getLogFilePath() {
        return getLogDirectory().resolve("kbase.log");
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private final ObjectMapper mapper = new ObjectMapper();
        private Path dataDirectory = null;
        private Path databasePath = null;
        private String zone = null;
        private Path logPath = null;
        private Path settingsFile = null;
        private boolean consoleEnabled = false;
        private String rebuildType = null;
        private Map<String, String> environment = System.getenv();

        public Builder dataDirectory(String path) {
            if (path != null && !path.isEmpty()) {
                this.dataDirectory = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder databasePath(String path) {
            if (path != null && !path.isEmpty()) {
                this.databasePath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder zone(String zone) {
            if (zone != null && !zone.isEmpty()) {
                this.zone = zone;
            }
            return this;
        }

        public Builder logPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.logPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder settingsFile(Path settingsFile) {
            this.settingsFile = settingsFile;
            return this;
        }

        public Builder consoleEnabled(boolean consoleEnabled) {
            this.consoleEnabled = consoleEnabled;
            return this;
        }

        public Builder rebuildType(String type) {
            this.rebuildType = type;
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            this.environment = environment;
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                // Handle --name=value or --name value
                if (arg.startsWith("--data-dir=")) {
                    dataDirectory(arg.substring("--data-dir=".length()));
                } else if ("--data-dir".equals(arg) && i + 1 < args.length) {
                    dataDirectory(args[++i]);
                } else if (arg.startsWith("--db=")) {
                    databasePath(arg.substring("--db=".length()));
                } else if ("--db".equals(arg) && i + 1 < args.length) {
                    databasePath(args[++i]);
                } else if (arg.startsWith("--zone=")) {
                    zone(arg.substring("--zone=".length()));
                } else if ("--zone".equals(arg) && i + 1 < args.length) {
                    zone(args[++i]);
                } else if (arg.startsWith("--log=")) {
                    logPath(arg.substring("--log=".length()));
                } else if ("--log".equals(arg) && i + 1 < args.length) {
                    logPath(args[++i]);
                } else if (arg.startsWith("--config=")) {
                    settingsFile(Paths.get(arg.substring("--config=".length())));
                } else if ("--config".equals(arg) && i + 1 < args.length) {
                    settingsFile(Paths.get(args[++i]));
                } else if (arg.startsWith("--type=")) {
                    rebuildType(arg.substring("--type=".length()));
                } else if ("--type".equals(arg) && i + 1 < args.length) {
                    rebuildType(args[++i]);
                } else if ("--console".equals(arg)) {
                    this.consoleEnabled = true;
                }
            }
            return this;
        }

        public AppConfig build() throws IOException {
            Path settingsPath = settingsFile != null ? settingsFile : getConfigDirectory().resolve("settings.json");
            JsonNode settings = Files.isRegularFile(settingsPath) ? mapper.readTree(settingsPath.toFile()) : null;

            Path data = dataDirectory;
            if (data == null && environment != null) {
                String fromEnv = environment.get(DATA_DIR_ENV);
                if (fromEnv != null && !fromEnv.isEmpty()) {
                    data = Paths.get(fromEnv).toAbsolutePath().normalize();
                }
            }
            if (data == null) {
                String fromSettings = text(settings, "dataDirectory");
                data = fromSettings != null
                    ? Paths.get(fromSettings).toAbsolutePath().normalize()
                    : getDefaultDataDirectory();
            }

            Path db = databasePath;
            if (db == null) {
                String fromSettings = text(settings, "databasePath");
                db = fromSettings != null
                    ? Paths.get(fromSettings).toAbsolutePath().normalize()
                    : data.resolve(DEFAULT_DB_NAME);
            }

            String zoneId = zone != null ? zone : text(settings, "zone");
            ZoneId resolvedZone;
            try {
                resolvedZone = zoneId != null ? ZoneId.of(zoneId) : ZoneId.systemDefault();
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Invalid zone: " + zoneId, e);
            }

            Path log = logPath != null ? logPath : getLogFilePath();
            return new AppConfig(data, db, resolvedZone, log, consoleEnabled, rebuildType);
        }

        private static String text(JsonNode settings, String field) {
            if (settings == null) {
                return null;
            }
            JsonNode node = settings.get(field);
            if (node == null || node.isNull() || node.asText().isEmpty()) {
                return null;
            }
            return node.asText();
        }
    }
}
