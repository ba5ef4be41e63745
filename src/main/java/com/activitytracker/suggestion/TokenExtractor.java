package com.activitytracker.suggestion;

import com.activitytracker.config.SuggestionConfig;
import com.activitytracker.model.ActivityRecord;
import com.activitytracker.model.RuleType;
import com.activitytracker.rules.RuleMatcher;
import com.activitytracker.util.PathUtils;
import com.activitytracker.util.UrlParts;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Derives at most one {@link CandidateToken} per activity. Design tools yield their file name.
 * For other apps the sources are tried in order: URL host, folder-style extra context, window
 * title prefix.
 */
public class TokenExtractor {

    private static final Pattern WORD_SEPARATORS = Pattern.compile("[\\s\\-_./\\\\]+");
    private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");
    private static final List<String> TITLE_SEPARATORS = List.of(" — ", " – ", " - ", " | ");

    private static final Set<String> SECOND_LEVEL_SUFFIXES = Set.of("co", "com", "org", "net", "ac", "gov", "edu");

    private static final Set<String> GENERIC_FOLDERS = Set.of(
            "src", "app", "apps", "lib", "libs", "source", "sources", "packages", "pkg",
            "cmd", "internal", "main", "build", "dist", "test", "tests", "docs");

    private static final Set<String> HOME_ROOTS = Set.of("users", "home");

    private static final Set<String> WEB_SCHEMES = Set.of("http", "https");

    private static final Set<String> STOP_WORDS = Set.of(
            "untitled", "home", "unknown", "new", "new tab", "inbox", "settings", "preferences",
            "welcome", "start", "index", "desktop", "downloads", "documents", "library", "tmp");

    private final int minTokenLength;
    private final List<String> ignoredDomains;
    private final List<String> designToolAppIds;

    public TokenExtractor(SuggestionConfig config) {
        SuggestionConfig resolved = Objects.requireNonNull(config, "config").withDefaults();
        this.minTokenLength = resolved.minTokenLength();
        this.ignoredDomains = resolved.ignoredDomains();
        this.designToolAppIds = resolved.designToolAppIds();
    }

    public Optional<CandidateToken> extract(ActivityRecord record) {
        Objects.requireNonNull(record, "record");
        if (isDesignTool(record.appId())) {
            return fromDesignFile(record);
        }
        Optional<CandidateToken> fromUrl = record.url().flatMap(this::fromUrl);
        if (fromUrl.isPresent()) {
            return fromUrl;
        }
        Optional<CandidateToken> fromFolder = record.extraContext().flatMap(this::fromFolder);
        if (fromFolder.isPresent()) {
            return fromFolder;
        }
        return fromTitle(record.windowTitle(), record.appName());
    }

    Optional<CandidateToken> fromUrl(String url) {
        Optional<String> scheme = UrlParts.scheme(url);
        if (scheme.isPresent() && !WEB_SCHEMES.contains(scheme.get())) {
            return Optional.empty();
        }
        Optional<String> parsed = UrlParts.host(url);
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        String host = StringUtils.removeStart(parsed.get(), "www.");
        if (host.isEmpty() || !host.contains(".") || IPV4.matcher(host).matches() || isIgnored(host)) {
            return Optional.empty();
        }
        List<String> labels = Arrays.asList(host.split("\\."));
        int secondLevel = labels.size() - 2;
        if (labels.size() >= 3
                && labels.get(labels.size() - 1).length() == 2
                && SECOND_LEVEL_SUFFIXES.contains(labels.get(labels.size() - 2))) {
            secondLevel--;
        }
        List<String> words = new ArrayList<>();
        if (secondLevel < 0) {
            words.add(host);
        } else {
            words.add(labels.get(secondLevel));
            words.addAll(labels.subList(0, secondLevel));
        }
        return keyword(String.join(" ", words))
                .map(token -> new CandidateToken(token, RuleType.URL_DOMAIN, host));
    }

    Optional<CandidateToken> fromFolder(String extraContext) {
        String trimmed = extraContext.trim();
        if (!(trimmed.contains("/") || trimmed.contains("\\") || trimmed.startsWith("~"))) {
            return Optional.empty();
        }
        List<String> segments = PathUtils.segments(trimmed).stream()
                .filter(segment -> !segment.equals("~"))
                .toList();
        if (segments.isEmpty()) {
            return Optional.empty();
        }
        if (segments.size() <= 2 && HOME_ROOTS.contains(segments.get(0).toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        String last = segments.get(segments.size() - 1);
        String ruleValue = last;
        if ((GENERIC_FOLDERS.contains(last.toLowerCase(Locale.ROOT)) || last.length() < minTokenLength)
                && segments.size() >= 2) {
            ruleValue = segments.get(segments.size() - 2) + "/" + last;
        }
        String folder = ruleValue;
        return keyword(folder).map(token -> new CandidateToken(token, RuleType.TERMINAL_FOLDER, folder));
    }

    /**
     * The file name a design tool shows, taken from the same field a design-file rule inspects.
     * A trailing {@code " - <tool>"} suffix and unsaved-change markers are dropped.
     */
    Optional<CandidateToken> fromDesignFile(ActivityRecord record) {
        Optional<String> field = RuleMatcher.field(RuleType.DESIGN_FILE, record);
        if (field.isEmpty()) {
            return Optional.empty();
        }
        String value = field.get();
        int cut = firstSeparator(value);
        String fileName = StringUtils.remove(cut < 0 ? value : value.substring(0, cut), '*').trim();
        if (fileName.isEmpty() || fileName.equalsIgnoreCase(record.appName())) {
            return Optional.empty();
        }
        return keyword(fileName).map(token -> new CandidateToken(token, RuleType.DESIGN_FILE, fileName));
    }

    Optional<CandidateToken> fromTitle(String windowTitle, String appName) {
        if (StringUtils.isBlank(windowTitle)) {
            return Optional.empty();
        }
        int cut = firstSeparator(windowTitle);
        if (cut < 0) {
            return Optional.empty();
        }
        String prefix = windowTitle.substring(0, cut).trim();
        if (prefix.isEmpty() || prefix.equalsIgnoreCase(appName)) {
            return Optional.empty();
        }
        return keyword(prefix).map(token -> new CandidateToken(token, RuleType.WINDOW_TITLE, prefix));
    }

    /**
     * Lower-cases, splits on separators and joins with single spaces. Rejects stop words and
     * keywords whose leading word is shorter than the minimum token length.
     */
    Optional<String> keyword(String raw) {
        String normalized = String.join(" ", Arrays.stream(WORD_SEPARATORS.split(raw.toLowerCase(Locale.ROOT)))
                .filter(StringUtils::isNotEmpty)
                .toList());
        if (normalized.isEmpty() || STOP_WORDS.contains(normalized)) {
            return Optional.empty();
        }
        int space = normalized.indexOf(' ');
        String root = space < 0 ? normalized : normalized.substring(0, space);
        if (root.length() < minTokenLength || STOP_WORDS.contains(root)) {
            return Optional.empty();
        }
        return Optional.of(normalized);
    }

    private static int firstSeparator(String title) {
        int cut = -1;
        for (String separator : TITLE_SEPARATORS) {
            int index = title.indexOf(separator);
            if (index > 0 && (cut < 0 || index < cut)) {
                cut = index;
            }
        }
        return cut;
    }

    private boolean isDesignTool(String appId) {
        String id = StringUtils.defaultString(appId).toLowerCase(Locale.ROOT);
        for (String tool : designToolAppIds) {
            if (id.equals(tool) || id.endsWith("\\" + tool) || id.endsWith("/" + tool)) {
                return true;
            }
        }
        return false;
    }

    private boolean isIgnored(String host) {
        for (String domain : ignoredDomains) {
            if (host.equals(domain) || host.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }
}
