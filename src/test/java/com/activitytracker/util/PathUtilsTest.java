package com.activitytracker.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PathUtilsTest {

    @Test
    void shouldExpandPercentEnvironmentVariables() {
        String appData = System.getenv("APPDATA");
        if (appData == null) {
            return;
        }
        Path resolved = PathUtils.resolve("%APPDATA%/ActivityTracker");
        assertTrue(resolved.toString().contains("ActivityTracker"));
        assertTrue(resolved.startsWith(Path.of(appData).toAbsolutePath().normalize()));
    }

    @Test
    void shouldExpandLeadingTildeToUserHome() {
        String home = System.getProperty("user.home");
        assertEquals(home + "/data", PathUtils.expand("~/data"));
        assertEquals("${NOT_A_REAL_VARIABLE_42}/x", PathUtils.expand("${NOT_A_REAL_VARIABLE_42}/x"));
    }

    @Test
    void shouldFallBackToDefaultForBlankCandidate() {
        Path fallback = Path.of("fallback.db");
        assertEquals(fallback.toAbsolutePath().normalize(), PathUtils.resolveOrDefault("  ", fallback));
    }

    @Test
    void shouldSplitFolderPathsWithEitherSeparator() {
        assertEquals(List.of("Users", "dev", "acme"), PathUtils.segments("/Users/dev//acme/"));
        assertEquals(List.of("C:", "work", "acme"), PathUtils.segments("C:\\work\\acme"));
        assertTrue(PathUtils.segments("   ").isEmpty());
        assertEquals(Optional.of("acme"), PathUtils.lastSegment("~/dev/acme"));
        assertEquals(Optional.empty(), PathUtils.lastSegment("/"));
    }
}
