package com.activitytracker.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Time spent in one (title, URL, extra context) combination, possibly across several sessions.
 */
public record WindowDetail(
        String windowTitle,
        Optional<String> url,
        Optional<String> extraContext,
        int totalSeconds,
        List<Long> activityIds
) {

    public WindowDetail {
        Objects.requireNonNull(windowTitle, "windowTitle");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(extraContext, "extraContext");
        activityIds = List.copyOf(activityIds);
    }
}
