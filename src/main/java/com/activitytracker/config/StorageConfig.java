package com.activitytracker.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.activitytracker.util.PathUtils;

import java.nio.file.Path;
import java.util.Objects;

public record StorageConfig(
        String databasePath,
        String journalMode,
        Integer busyTimeoutMillis
) {

    private static final String DEFAULT_DB_NAME = "activity.db";
    private static final String DEFAULT_JOURNAL_MODE = "WAL";
    private static final int DEFAULT_BUSY_TIMEOUT_MILLIS = 5000;

    @JsonCreator
    public StorageConfig(
            @JsonProperty("databasePath") String databasePath,
            @JsonProperty("journalMode") String journalMode,
            @JsonProperty("busyTimeoutMillis") Integer busyTimeoutMillis
    ) {
        this.databasePath = databasePath;
        this.journalMode = journalMode;
        this.busyTimeoutMillis = busyTimeoutMillis;
    }

    public StorageConfig withDefaults(Path dataRoot) {
        Objects.requireNonNull(dataRoot, "dataRoot");
        Path resolvedDb = PathUtils.resolveOrDefault(databasePath, dataRoot.resolve(DEFAULT_DB_NAME));
        String resolvedJournalMode = (journalMode == null || journalMode.isBlank())
                ? DEFAULT_JOURNAL_MODE
                : journalMode.trim();
        int resolvedTimeout = (busyTimeoutMillis == null || busyTimeoutMillis < 0)
                ? DEFAULT_BUSY_TIMEOUT_MILLIS
                : busyTimeoutMillis;
        return new StorageConfig(resolvedDb.toString(), resolvedJournalMode, resolvedTimeout);
    }

    public static StorageConfig defaults(Path dataRoot) {
        return new StorageConfig(
                dataRoot.resolve(DEFAULT_DB_NAME).toString(),
                DEFAULT_JOURNAL_MODE,
                DEFAULT_BUSY_TIMEOUT_MILLIS);
    }

    /**
     * Configuration for a database file at an explicit location, used by tools and tests.
     */
    public static StorageConfig forDatabase(Path databaseFile) {
        return new StorageConfig(databaseFile.toAbsolutePath().toString(), DEFAULT_JOURNAL_MODE, DEFAULT_BUSY_TIMEOUT_MILLIS);
    }
}
