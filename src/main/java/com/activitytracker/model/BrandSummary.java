package com.activitytracker.model;

import java.util.List;
import java.util.Objects;

public record BrandSummary(
        long brandId,
        String brandName,
        String color,
        int totalSeconds,
        List<ProjectSummary> projects
) {

    public BrandSummary {
        Objects.requireNonNull(brandName, "brandName");
        Objects.requireNonNull(color, "color");
        projects = List.copyOf(projects);
    }
}
