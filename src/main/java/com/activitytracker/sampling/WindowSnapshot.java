package com.activitytracker.sampling;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * What the OS sensor reports about the foreground window at one instant.
 *
 * @param appId stable application identifier (bundle id, executable path)
 */
public record WindowSnapshot(
        Instant timestamp,
        String appName,
        String appId,
        String windowTitle,
        Optional<String> url,
        Optional<String> extraContext
) {

    public WindowSnapshot {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(appName, "appName");
        Objects.requireNonNull(appId, "appId");
        Objects.requireNonNull(windowTitle, "windowTitle");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(extraContext, "extraContext");
    }
}
