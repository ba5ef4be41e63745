package com.activitytracker.session;

import java.util.Objects;
import java.util.Optional;

/**
 * What makes two heartbeats part of the same session. Compared field for field, case-sensitively.
 */
public record SessionIdentity(
        String appName,
        String windowTitle,
        Optional<String> url,
        Optional<String> extraContext
) {

    public SessionIdentity {
        Objects.requireNonNull(appName, "appName");
        Objects.requireNonNull(windowTitle, "windowTitle");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(extraContext, "extraContext");
    }
}
