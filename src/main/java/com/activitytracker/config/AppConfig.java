package com.activitytracker.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.activitytracker.util.PathUtils;
import org.apache.commons.lang3.StringUtils;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

public record AppConfig(
        int samplingIntervalSeconds,
        int idleThresholdSeconds,
        boolean autoClassifyNewSessions,
        StorageConfig storage,
        LoggingConfig logging,
        SuggestionConfig suggestions,
        List<String> passiveMediaAppIds
) {

    private static final int DEFAULT_SAMPLING_INTERVAL_SECONDS = 2;
    private static final int DEFAULT_IDLE_THRESHOLD_SECONDS = 600;
    // App ids (bundle ids or executable names) whose sessions survive the idle threshold.
    private static final List<String> DEFAULT_PASSIVE_MEDIA_APP_IDS = List.of(
            "virtual.youtube", "com.spotify.client", "com.apple.music", "com.apple.tv",
            "com.apple.preview", "com.apple.ibooksx", "com.apple.ibooks", "com.readdle.pdfexpert-mac",
            "com.adobe.reader", "com.adobe.acrobat.pro",
            "spotify.exe", "vlc.exe", "wmplayer.exe", "acrord32.exe", "acrobat.exe");

    @JsonCreator
    public static AppConfig create(
            @JsonProperty("samplingIntervalSeconds") Integer samplingIntervalSeconds,
            @JsonProperty("idleThresholdSeconds") Integer idleThresholdSeconds,
            @JsonProperty("autoClassifyNewSessions") Boolean autoClassifyNewSessions,
            @JsonProperty("storage") StorageConfig storage,
            @JsonProperty("logging") LoggingConfig logging,
            @JsonProperty("suggestions") SuggestionConfig suggestions,
            @JsonProperty("passiveMediaAppIds") List<String> passiveMediaAppIds
    ) {
        int sampling = (samplingIntervalSeconds == null || samplingIntervalSeconds <= 0)
                ? DEFAULT_SAMPLING_INTERVAL_SECONDS
                : samplingIntervalSeconds;
        int idleThreshold = (idleThresholdSeconds == null || idleThresholdSeconds <= 0)
                ? DEFAULT_IDLE_THRESHOLD_SECONDS
                : idleThresholdSeconds;
        boolean autoClassify = autoClassifyNewSessions == null || autoClassifyNewSessions;

        Path root = PathUtils.defaultDataRoot();
        StorageConfig resolvedStorage = storage == null
                ? StorageConfig.defaults(root)
                : storage.withDefaults(root);
        LoggingConfig resolvedLogging = logging == null
                ? LoggingConfig.defaults(root)
                : logging.withDefaults(root);
        SuggestionConfig resolvedSuggestions = suggestions == null
                ? SuggestionConfig.defaults()
                : suggestions.withDefaults();
        List<String> passiveMedia = passiveMediaAppIds == null
                ? DEFAULT_PASSIVE_MEDIA_APP_IDS
                : normalizeAppIds(passiveMediaAppIds);

        return new AppConfig(
                sampling,
                idleThreshold,
                autoClassify,
                resolvedStorage,
                resolvedLogging,
                resolvedSuggestions,
                passiveMedia
        );
    }

    public static AppConfig defaults() {
        Path root = PathUtils.defaultDataRoot();
        return new AppConfig(
                DEFAULT_SAMPLING_INTERVAL_SECONDS,
                DEFAULT_IDLE_THRESHOLD_SECONDS,
                true,
                StorageConfig.defaults(root),
                LoggingConfig.defaults(root),
                SuggestionConfig.defaults(),
                DEFAULT_PASSIVE_MEDIA_APP_IDS
        );
    }

    private static List<String> normalizeAppIds(List<String> entries) {
        return entries.stream()
                .filter(StringUtils::isNotBlank)
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
    }
}
