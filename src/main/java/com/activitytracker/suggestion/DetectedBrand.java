package com.activitytracker.suggestion;

import java.util.List;
import java.util.Objects;

/**
 * Detected projects whose tokens share the same leading word.
 */
public record DetectedBrand(
        String rootToken,
        String suggestedName,
        List<DetectedProject> projects,
        int totalActivities,
        int totalSeconds,
        List<String> apps
) {

    public DetectedBrand {
        Objects.requireNonNull(rootToken, "rootToken");
        Objects.requireNonNull(suggestedName, "suggestedName");
        projects = List.copyOf(projects);
        apps = List.copyOf(apps);
    }
}
