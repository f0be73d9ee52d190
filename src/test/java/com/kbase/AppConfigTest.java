package com.kbase;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @TempDir
    Path tempDir;

    private Path settings(String json) throws Exception {
        return Files.writeString(tempDir.resolve("settings.json"), json);
    }

    private AppConfig.Builder builder(Path settingsFile) {
        return new AppConfig.Builder()
            .settingsFile(settingsFile)
            .environment(Map.of());
    }

    @Test
    void argumentsOverrideEverything() throws Exception {
        Path settingsFile = settings("{\"dataDirectory\": \"" + json(tempDir.resolve("from-settings")) + "\","
            + " \"zone\": \"UTC\"}");
        Path argDir = tempDir.resolve("from-args");

        AppConfig config = builder(settingsFile)
            .environment(Map.of(AppConfig.DATA_DIR_ENV, tempDir.resolve("from-env").toString()))
            .parseArgs(new String[]{
                "--data-dir", argDir.toString(),
                "--db=" + tempDir.resolve("custom.db"),
                "--zone", "Europe/Paris",
                "--type=plans",
                "--console"})
            .build();

        assertEquals(argDir.toAbsolutePath().normalize(), config.getDataDirectory());
        assertEquals(tempDir.resolve("custom.db").toAbsolutePath().normalize(), config.getDatabasePath());
        assertEquals(ZoneId.of("Europe/Paris"), config.getZone());
        assertEquals("plans", config.getRebuildType());
        assertTrue(config.isConsoleEnabled());
    }

    @Test
    void environmentBeatsSettingsFile() throws Exception {
        Path settingsFile = settings("{\"dataDirectory\": \"" + json(tempDir.resolve("from-settings")) + "\"}");
        Path envDir = tempDir.resolve("from-env");

        AppConfig config = builder(settingsFile)
            .environment(Map.of(AppConfig.DATA_DIR_ENV, envDir.toString()))
            .build();

        assertEquals(envDir.toAbsolutePath().normalize(), config.getDataDirectory());
        assertEquals(envDir.toAbsolutePath().normalize().resolve(AppConfig.DEFAULT_DB_NAME), config.getDatabasePath());
    }

    @Test
    void readsSettingsFile() throws Exception {
        Path dataDir = tempDir.resolve("kb");
        Path db = tempDir.resolve("elsewhere").resolve("index.db");
        Path settingsFile = settings("{\"dataDirectory\": \"" + json(dataDir) + "\","
            + " \"databasePath\": \"" + json(db) + "\","
            + " \"zone\": \"Asia/Tokyo\"}");

        AppConfig config = builder(settingsFile).build();

        assertEquals(dataDir.toAbsolutePath().normalize(), config.getDataDirectory());
        assertEquals(db.toAbsolutePath().normalize(), config.getDatabasePath());
        assertEquals(ZoneId.of("Asia/Tokyo"), config.getZone());
        assertNull(config.getRebuildType());
        assertFalse(config.isConsoleEnabled());
    }

    @Test
    void fallsBackToDefaultsWithoutSettings() throws Exception {
        AppConfig config = builder(tempDir.resolve("missing.json")).build();

        assertEquals(AppConfig.getDefaultDataDirectory(), config.getDataDirectory());
        assertEquals(AppConfig.getDefaultDataDirectory().resolve("search.db"), config.getDatabasePath());
        assertEquals(ZoneId.systemDefault(), config.getZone());
        assertEquals(AppConfig.getLogFilePath(), config.getLogPath());
    }

    @Test
    void emptySettingValuesAreIgnored() throws Exception {
        Path settingsFile = settings("{\"dataDirectory\": \"\", \"zone\": null}");

        AppConfig config = builder(settingsFile)
            .parseArgs(new String[]{"--data-dir=" + tempDir.resolve("d")})
            .build();

        assertEquals(tempDir.resolve("d").toAbsolutePath().normalize(), config.getDataDirectory());
        assertEquals(ZoneId.systemDefault(), config.getZone());
    }

    @Test
    void rejectsUnknownZone() throws Exception {
        AppConfig.Builder builder = builder(tempDir.resolve("missing.json"))
            .parseArgs(new String[]{"--zone", "Mars/Olympus"});

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    private static String json(Path path) {
        return path.toAbsolutePath().toString().replace("\\", "\\\\");
    }
}
