package com.activitytracker.model;

import java.util.List;
import java.util.Objects;

public record ProjectSummary(
        long projectId,
        String projectName,
        long brandId,
        String brandName,
        String color,
        int totalSeconds,
        List<AppBreakdownEntry> appBreakdown
) {

    public ProjectSummary {
        Objects.requireNonNull(projectName, "projectName");
        Objects.requireNonNull(brandName, "brandName");
        Objects.requireNonNull(color, "color");
        appBreakdown = List.copyOf(appBreakdown);
    }
}
