package com.activitytracker.model;

import java.util.List;
import java.util.Objects;

public record AppSummary(
        String appName,
        String appId,
        int totalSeconds,
        List<WindowDetail> windows
) {

    public AppSummary {
        Objects.requireNonNull(appName, "appName");
        Objects.requireNonNull(appId, "appId");
        windows = List.copyOf(windows);
    }
}
