package com.activitytracker.model;

import java.util.Objects;

public record AppBreakdownEntry(String appName, int seconds) {

    public AppBreakdownEntry {
        Objects.requireNonNull(appName, "appName");
    }
}
