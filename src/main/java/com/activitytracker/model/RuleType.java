package com.activitytracker.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The activity field a {@link ProjectRule} inspects.
 */
public enum RuleType {
    /** Last path segment of the extra context (working directory). */
    TERMINAL_FOLDER("terminalFolder"),
    /** Host of the URL; literal patterns also match subdomains. */
    URL_DOMAIN("urlDomain"),
    /** Path component of the URL. */
    URL_PATH("urlPath"),
    PAGE_TITLE("pageTitle"),
    /** Extra context, or the URL when no extra context was captured. */
    DESIGN_FILE("designFile"),
    /** Stable application identifier. */
    BUNDLE_ID("bundleId"),
    WINDOW_TITLE("windowTitle");

    private final String wireName;

    RuleType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<RuleType> fromWireName(String value) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(value))
                .findFirst();
    }
}
