package com.activitytracker.model;

import java.time.LocalDate;
import java.util.Objects;

public record DayBreakdown(LocalDate date, int totalSeconds) {

    public DayBreakdown {
        Objects.requireNonNull(date, "date");
    }
}
