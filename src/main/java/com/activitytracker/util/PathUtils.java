package com.activitytracker.util;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.SystemUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class PathUtils {

    private static final Pattern PERCENT_ENV_PATTERN = Pattern.compile("%([A-Za-z0-9_]+)%");
    private static final Pattern BRACE_ENV_PATTERN = Pattern.compile("\\$\\{([^}]+)}");

    private static final String WINDOWS_APP_DIR = "ActivityTracker";
    private static final String UNIX_APP_DIR = "activity-tracker";

    private PathUtils() {
    }

    public static Path resolve(String path) {
        Objects.requireNonNull(path, "path");
        String expanded = expand(path);
        return Paths.get(expanded).toAbsolutePath().normalize();
    }

    public static Path resolveOrDefault(String candidate, Path defaultPath) {
        Objects.requireNonNull(defaultPath, "defaultPath");
        if (StringUtils.isBlank(candidate)) {
            return defaultPath.toAbsolutePath().normalize();
        }
        return resolve(candidate);
    }

    /**
     * Expands {@code %VAR%}, {@code ${VAR}} and a leading {@code ~}. Unknown variables are left as-is.
     */
    public static String expand(String path) {
        Objects.requireNonNull(path, "path");
        String trimmed = path.trim();
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        String resolved = replaceEnv(trimmed, PERCENT_ENV_PATTERN);
        resolved = replaceEnv(resolved, BRACE_ENV_PATTERN);
        if (resolved.startsWith("~")) {
            String home = System.getProperty("user.home");
            if (StringUtils.isNotBlank(home)) {
                resolved = home + resolved.substring(1);
            }
        }
        return resolved;
    }

    /**
     * Per-user directory holding the database and logs.
     */
    public static Path defaultDataRoot() {
        String home = System.getProperty("user.home");
        if (SystemUtils.IS_OS_WINDOWS) {
            String appData = lookupEnv("APPDATA");
            return StringUtils.isBlank(appData)
                    ? Paths.get(home, WINDOWS_APP_DIR)
                    : Paths.get(appData, WINDOWS_APP_DIR);
        }
        if (SystemUtils.IS_OS_MAC) {
            return Paths.get(home, "Library", "Application Support", WINDOWS_APP_DIR);
        }
        String xdgData = lookupEnv("XDG_DATA_HOME");
        return StringUtils.isBlank(xdgData)
                ? Paths.get(home, ".local", "share", UNIX_APP_DIR)
                : Paths.get(xdgData, UNIX_APP_DIR);
    }

    public static Path defaultConfigFile() {
        String home = System.getProperty("user.home");
        if (SystemUtils.IS_OS_WINDOWS) {
            return defaultDataRoot().resolve("config.json");
        }
        String xdgConfig = lookupEnv("XDG_CONFIG_HOME");
        Path configDir = StringUtils.isBlank(xdgConfig)
                ? Paths.get(home, ".config", UNIX_APP_DIR)
                : Paths.get(xdgConfig, UNIX_APP_DIR);
        return configDir.resolve("config.json");
    }

    /**
     * Splits a reported folder path (terminal working directory, document path) into its
     * non-empty segments. Both separators are accepted.
     */
    public static List<String> segments(String folderPath) {
        if (StringUtils.isBlank(folderPath)) {
            return List.of();
        }
        return Arrays.stream(folderPath.trim().replace('\\', '/').split("/"))
                .filter(StringUtils::isNotBlank)
                .toList();
    }

    public static Optional<String> lastSegment(String folderPath) {
        List<String> segments = segments(folderPath);
        return segments.isEmpty() ? Optional.empty() : Optional.of(segments.get(segments.size() - 1));
    }

    private static String replaceEnv(String input, Pattern pattern) {
        Matcher matcher = pattern.matcher(input);
        StringBuilder buffer = new StringBuilder();
        while (matcher.find()) {
            String key = matcher.group(1);
            String value = lookupEnv(key);
            if (value == null) {
                value = matcher.group(0);
            }
            matcher.appendReplacement(buffer, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(buffer);
        return buffer.toString();
    }

    private static String lookupEnv(String key) {
        Map<String, String> env = System.getenv();
        String direct = env.get(key);
        if (direct != null) {
            return direct;
        }
        String upper = env.get(key.toUpperCase(Locale.ROOT));
        if (upper != null) {
            return upper;
        }
        return env.get(key.toLowerCase(Locale.ROOT));
    }
}
