package com.activitytracker.rules;

import com.activitytracker.model.ActivityRecord;
import com.activitytracker.model.RuleType;
import com.activitytracker.util.PathUtils;
import com.activitytracker.util.UrlParts;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Optional;

/**
 * Evaluates a single rule against a single activity.
 */
public final class RuleMatcher {

    private RuleMatcher() {
    }

    /**
     * The value a rule of the given type inspects, or empty when the activity does not carry it.
     */
    public static Optional<String> field(RuleType type, ActivityRecord record) {
        return switch (type) {
            case TERMINAL_FOLDER -> record.extraContext().flatMap(PathUtils::lastSegment);
            case URL_DOMAIN -> record.url().flatMap(UrlParts::host);
            case URL_PATH -> record.url().flatMap(UrlParts::path);
            case PAGE_TITLE, WINDOW_TITLE -> nonBlank(record.windowTitle());
            case DESIGN_FILE -> record.extraContext().filter(StringUtils::isNotBlank)
                    .or(() -> nonBlank(record.windowTitle()));
            case BUNDLE_ID -> nonBlank(record.appId());
        };
    }

    public static boolean matches(CompiledRule compiled, ActivityRecord record) {
        RuleType type = compiled.rule().ruleType();
        Optional<String> field = field(type, record);
        if (field.isEmpty()) {
            return false;
        }
        if (compiled.regex().isPresent()) {
            return compiled.regex().get().matcher(field.get()).find();
        }
        String pattern = compiled.rule().pattern().trim().toLowerCase(Locale.ROOT);
        String value = field.get().toLowerCase(Locale.ROOT);
        return switch (type) {
            case URL_DOMAIN -> matchesDomain(pattern, value);
            case TERMINAL_FOLDER -> matchesFolder(pattern, value, record);
            case BUNDLE_ID -> value.equals(pattern);
            case URL_PATH, PAGE_TITLE, WINDOW_TITLE, DESIGN_FILE -> value.contains(pattern);
        };
    }

    /**
     * {@code acme.com} matches {@code acme.com} and any subdomain of it, never {@code notacme.com}.
     */
    static boolean matchesDomain(String pattern, String host) {
        String domain = StringUtils.removeStart(pattern, "www.");
        if (domain.isEmpty()) {
            return false;
        }
        return host.equals(domain) || host.endsWith("." + domain);
    }

    private static boolean matchesFolder(String pattern, String lastSegment, ActivityRecord record) {
        String trimmed = StringUtils.strip(pattern.replace('\\', '/'), "/");
        if (trimmed.isEmpty()) {
            return false;
        }
        if (!trimmed.contains("/")) {
            return lastSegment.equals(trimmed);
        }
        String path = String.join("/", PathUtils.segments(record.extraContext().orElse("")))
                .toLowerCase(Locale.ROOT);
        return path.equals(trimmed) || path.endsWith("/" + trimmed);
    }

    private static Optional<String> nonBlank(String value) {
        return StringUtils.isBlank(value) ? Optional.empty() : Optional.of(value);
    }
}
