package com.activitytracker.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * One merged usage session. {@code id} is {@code 0} until the record has been inserted.
 */
public record ActivityRecord(
        long id,
        Instant timestamp,
        String appName,
        String appId,
        String windowTitle,
        Optional<String> url,
        Optional<String> extraContext,
        int durationSeconds,
        LocalDate date,
        Optional<Long> projectId,
        Optional<ProjectSource> projectSource
) {

    public ActivityRecord {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(appName, "appName");
        Objects.requireNonNull(appId, "appId");
        Objects.requireNonNull(windowTitle, "windowTitle");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(extraContext, "extraContext");
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(projectId, "projectId");
        Objects.requireNonNull(projectSource, "projectSource");
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("durationSeconds must be >= 0");
        }
    }

    public static ActivityRecord unsaved(Instant timestamp,
                                         LocalDate date,
                                         String appName,
                                         String appId,
                                         String windowTitle,
                                         Optional<String> url,
                                         Optional<String> extraContext,
                                         int durationSeconds) {
        return new ActivityRecord(0L, timestamp, appName, appId, windowTitle, url, extraContext,
                durationSeconds, date, Optional.empty(), Optional.empty());
    }

    public ActivityRecord withId(long newId) {
        return new ActivityRecord(newId, timestamp, appName, appId, windowTitle, url, extraContext,
                durationSeconds, date, projectId, projectSource);
    }

    public ActivityRecord withProject(long newProjectId, ProjectSource source) {
        return new ActivityRecord(id, timestamp, appName, appId, windowTitle, url, extraContext,
                durationSeconds, date, Optional.of(newProjectId), Optional.of(source));
    }

    public boolean isAssigned() {
        return projectId.isPresent();
    }
}
