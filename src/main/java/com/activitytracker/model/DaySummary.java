package com.activitytracker.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated usage of one calendar day.
 *
 * @param wallClockSeconds      span from the first activity start to the end of the last activity
 * @param activeTrackingSeconds sum of record durations; idle gaps are not included
 * @param firstActivity         local {@code HH:mm} of the first activity
 * @param lastActivity          local {@code HH:mm} at which the last activity ended
 */
public record DaySummary(
        LocalDate date,
        int totalSeconds,
        List<AppSummary> apps,
        int wallClockSeconds,
        int activeTrackingSeconds,
        Optional<String> firstActivity,
        Optional<String> lastActivity
) {

    public DaySummary {
        Objects.requireNonNull(date, "date");
        apps = List.copyOf(apps);
        Objects.requireNonNull(firstActivity, "firstActivity");
        Objects.requireNonNull(lastActivity, "lastActivity");
    }

    public static DaySummary empty(LocalDate date) {
        return new DaySummary(date, 0, List.of(), 0, 0, Optional.empty(), Optional.empty());
    }

    public boolean hasActivity() {
        return totalSeconds > 0;
    }
}
