package com.activitytracker.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * How an activity received its project id.
 */
public enum ProjectSource {
    AUTO_RULE("autoRule"),
    MANUAL("manual");

    private final String wireName;

    ProjectSource(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ProjectSource> fromWireName(String value) {
        return Arrays.stream(values())
                .filter(source -> source.wireName.equals(value))
                .findFirst();
    }
}
