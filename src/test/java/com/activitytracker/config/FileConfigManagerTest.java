package com.activitytracker.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileConfigManagerTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteDefaultsWhenFileIsMissing() throws IOException {
        Path configFile = tempDir.resolve("nested").resolve("config.json");
        try (FileConfigManager manager = new FileConfigManager()) {
            AppConfig config = manager.load(configFile);

            assertTrue(Files.exists(configFile));
            assertEquals(2, config.samplingIntervalSeconds());
            assertEquals(600, config.idleThresholdSeconds());
            assertTrue(config.autoClassifyNewSessions());
            assertTrue(config.passiveMediaAppIds().contains("com.spotify.client"));
            assertEquals(config, manager.load(configFile));
        }
    }

    @Test
    void shouldFillMissingValuesWithDefaults() throws IOException {
        Path configFile = tempDir.resolve("config.json");
        Path database = tempDir.resolve("data").resolve("custom.db");
        Files.writeString(configFile, """
                {
                  "samplingIntervalSeconds": 5,
                  "idleThresholdSeconds": -1,
                  "storage": { "databasePath": "%s" },
                  "logging": { "level": "debug" },
                  "suggestions": { "minActivities": 4, "ignoredDomains": ["Acme.com"] },
                  "passiveMediaAppIds": [" VLC.exe ", "", "vlc.exe"],
                  "somethingUnknown": true
                }
                """.formatted(database.toString().replace("\\", "\\\\")));
        try (FileConfigManager manager = new FileConfigManager()) {
            AppConfig config = manager.load(configFile);

            assertEquals(5, config.samplingIntervalSeconds());
            assertEquals(600, config.idleThresholdSeconds());
            assertEquals(database.toAbsolutePath().normalize().toString(), config.storage().databasePath());
            assertEquals("WAL", config.storage().journalMode());
            assertEquals("DEBUG", config.logging().level());
            assertEquals(4, config.suggestions().minActivities());
            assertEquals(List.of("vlc.exe"), config.passiveMediaAppIds());
            assertEquals(1, config.suggestions().minApps());
            assertEquals(List.of("acme.com"), config.suggestions().ignoredDomains());
        }
    }

    @Test
    void shouldRejectMalformedJson() throws IOException {
        Path configFile = tempDir.resolve("config.json");
        Files.writeString(configFile, "{ \"samplingIntervalSeconds\": ");
        try (FileConfigManager manager = new FileConfigManager()) {
            IOException ex = assertThrows(IOException.class, () -> manager.load(configFile));
            assertTrue(ex.getMessage().contains("Malformed configuration file"));
        }
    }

    @Test
    void shouldRoundTripSavedConfiguration() throws IOException {
        Path configFile = tempDir.resolve("config.json");
        AppConfig custom = AppConfig.create(3, 120, false,
                StorageConfig.forDatabase(tempDir.resolve("a.db")), null, SuggestionConfig.defaults(),
                List.of("spotify.exe"));
        try (FileConfigManager manager = new FileConfigManager()) {
            manager.save(configFile, custom);
            AppConfig loaded = manager.load(configFile);

            assertEquals(custom, loaded);
            assertFalse(loaded.autoClassifyNewSessions());
            assertFalse(Files.exists(tempDir.resolve("config.json.tmp")));
        }
    }
}
