package com.activitytracker.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Thresholds for the suggestion engine. A token group must reach both {@code minActivities}
 * and {@code minApps} before it is proposed as a project. Window titles of the
 * {@code designToolAppIds} apps are read as design file names.
 */
public record SuggestionConfig(
        Integer minActivities,
        Integer minApps,
        Integer minTokenLength,
        List<String> ignoredDomains,
        List<String> designToolAppIds
) {

    private static final int DEFAULT_MIN_ACTIVITIES = 2;
    private static final int DEFAULT_MIN_APPS = 1;
    private static final int DEFAULT_MIN_TOKEN_LENGTH = 3;
    private static final List<String> DEFAULT_IGNORED_DOMAINS = List.of(
            "google.com", "github.com", "stackoverflow.com", "apple.com",
            "youtube.com", "twitter.com", "x.com", "reddit.com",
            "localhost", "127.0.0.1", "chatgpt.com", "claude.ai");
    private static final List<String> DEFAULT_DESIGN_TOOL_APP_IDS = List.of(
            "com.figma.desktop", "figma.exe", "com.bohemiancoding.sketch3");

    @JsonCreator
    public SuggestionConfig(
            @JsonProperty("minActivities") Integer minActivities,
            @JsonProperty("minApps") Integer minApps,
            @JsonProperty("minTokenLength") Integer minTokenLength,
            @JsonProperty("ignoredDomains") List<String> ignoredDomains,
            @JsonProperty("designToolAppIds") List<String> designToolAppIds
    ) {
        this.minActivities = minActivities;
        this.minApps = minApps;
        this.minTokenLength = minTokenLength;
        this.ignoredDomains = ignoredDomains;
        this.designToolAppIds = designToolAppIds;
    }

    public SuggestionConfig withDefaults() {
        int activities = (minActivities == null || minActivities <= 0) ? DEFAULT_MIN_ACTIVITIES : minActivities;
        int apps = (minApps == null || minApps <= 0) ? DEFAULT_MIN_APPS : minApps;
        int tokenLength = (minTokenLength == null || minTokenLength <= 0) ? DEFAULT_MIN_TOKEN_LENGTH : minTokenLength;
        List<String> domains = ignoredDomains == null ? DEFAULT_IGNORED_DOMAINS : normalize(ignoredDomains);
        List<String> designTools = designToolAppIds == null ? DEFAULT_DESIGN_TOOL_APP_IDS : normalize(designToolAppIds);
        return new SuggestionConfig(activities, apps, tokenLength, domains, designTools);
    }

    private static List<String> normalize(List<String> entries) {
        return entries.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .map(s -> s.toLowerCase(Locale.ROOT))
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
    }

    public static SuggestionConfig defaults() {
        return new SuggestionConfig(DEFAULT_MIN_ACTIVITIES, DEFAULT_MIN_APPS, DEFAULT_MIN_TOKEN_LENGTH, DEFAULT_IGNORED_DOMAINS,
                DEFAULT_DESIGN_TOOL_APP_IDS);
    }
}
