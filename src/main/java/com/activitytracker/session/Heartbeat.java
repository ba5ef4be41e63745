package com.activitytracker.session;

import com.activitytracker.sampling.WindowSnapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One periodic sample of the foreground window plus the time since the last user input.
 */
public record Heartbeat(
        Instant timestamp,
        String appName,
        String appId,
        String windowTitle,
        Optional<String> url,
        Optional<String> extraContext,
        long idleSeconds
) {

    public Heartbeat {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(appName, "appName");
        Objects.requireNonNull(appId, "appId");
        Objects.requireNonNull(windowTitle, "windowTitle");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(extraContext, "extraContext");
        if (idleSeconds < 0) {
            throw new IllegalArgumentException("idleSeconds must be >= 0");
        }
    }

    public static Heartbeat of(WindowSnapshot snapshot, Duration idle) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(idle, "idle");
        return new Heartbeat(snapshot.timestamp(), snapshot.appName(), snapshot.appId(), snapshot.windowTitle(),
                snapshot.url(), snapshot.extraContext(), Math.max(0, idle.toSeconds()));
    }

    public SessionIdentity identity() {
        return new SessionIdentity(appName, windowTitle, url, extraContext);
    }
}
