package com.activitytracker.events;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Published once per local-midnight rollover observed by the session merger.
 *
 * @param completedDate the day that just ended
 * @param newDate       the day the triggering heartbeat belongs to
 */
public record DayChangedEvent(LocalDate completedDate, LocalDate newDate) {

    public DayChangedEvent {
        Objects.requireNonNull(completedDate, "completedDate");
        Objects.requireNonNull(newDate, "newDate");
    }

    /**
     * The completed date as {@code YYYY-MM-DD}.
     */
    public String completedDateKey() {
        return completedDate.toString();
    }
}
