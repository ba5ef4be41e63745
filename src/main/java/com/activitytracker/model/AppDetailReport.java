package com.activitytracker.model;

import java.util.List;
import java.util.Objects;

public record AppDetailReport(
        String appName,
        int totalSeconds,
        List<DayBreakdown> days,
        List<WindowDetail> topWindows
) {

    public AppDetailReport {
        Objects.requireNonNull(appName, "appName");
        days = List.copyOf(days);
        topWindows = List.copyOf(topWindows);
    }
}
