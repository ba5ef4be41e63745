package com.activitytracker.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

public record TimelineEntry(
        long activityId,
        Instant timestamp,
        String appName,
        String windowTitle,
        Optional<String> url,
        Optional<String> extraContext,
        int durationSeconds,
        Optional<Long> projectId
) {

    public TimelineEntry {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(appName, "appName");
        Objects.requireNonNull(windowTitle, "windowTitle");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(extraContext, "extraContext");
        Objects.requireNonNull(projectId, "projectId");
    }
}
