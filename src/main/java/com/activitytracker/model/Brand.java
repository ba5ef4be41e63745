package com.activitytracker.model;

import java.util.Objects;

public record Brand(
        long id,
        String name,
        String color,
        int sortOrder
) {

    public Brand {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(color, "color");
    }
}
