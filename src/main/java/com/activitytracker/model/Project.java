package com.activitytracker.model;

import java.util.Objects;

public record Project(
        long id,
        long brandId,
        String name,
        String color,
        int sortOrder
) {

    public Project {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(color, "color");
    }
}
