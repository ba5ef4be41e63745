package com.activitytracker.util;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient host/path extraction for URLs reported by browsers. Browsers sometimes report a URL
 * without a scheme, so no {@link java.net.URI} parsing is attempted.
 */
public final class UrlParts {

    private static final Pattern SCHEME = Pattern.compile("^([a-zA-Z][a-zA-Z0-9+.-]*):");
    // host:port without a scheme, as in "localhost:3000/app"
    private static final Pattern HOST_AND_PORT = Pattern.compile("^[^:/?#\\s]+:\\d+([/?#].*)?$");

    private UrlParts() {
    }

    /**
     * @return the lower-cased scheme, or empty when the value has none
     */
    public static Optional<String> scheme(String url) {
        if (StringUtils.isBlank(url)) {
            return Optional.empty();
        }
        String trimmed = url.trim();
        if (HOST_AND_PORT.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        Matcher matcher = SCHEME.matcher(trimmed);
        return matcher.find() ? Optional.of(matcher.group(1).toLowerCase(Locale.ROOT)) : Optional.empty();
    }

    /**
     * @return the lower-cased host without port, user info or trailing dot
     */
    public static Optional<String> host(String url) {
        String authority = authority(url);
        if (authority.isEmpty()) {
            return Optional.empty();
        }
        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            authority = authority.substring(at + 1);
        }
        int colon = authority.indexOf(':');
        if (colon >= 0) {
            authority = authority.substring(0, colon);
        }
        String host = StringUtils.removeEnd(authority.toLowerCase(Locale.ROOT), ".");
        if (host.isEmpty() || StringUtils.containsWhitespace(host)) {
            return Optional.empty();
        }
        return Optional.of(host);
    }

    /**
     * @return the path component, or empty when the URL has none
     */
    public static Optional<String> path(String url) {
        String rest = afterScheme(url);
        int slash = rest.indexOf('/');
        int end = firstIndexOf(rest, '?', '#');
        if (slash < 0 || (end >= 0 && end < slash)) {
            return Optional.empty();
        }
        String path = end >= 0 ? rest.substring(slash, end) : rest.substring(slash);
        return path.isEmpty() ? Optional.empty() : Optional.of(path);
    }

    private static String authority(String url) {
        String rest = afterScheme(url);
        int end = firstIndexOf(rest, '/', '?', '#');
        return (end >= 0 ? rest.substring(0, end) : rest).trim();
    }

    /**
     * The part after {@code scheme://}. Values with a scheme but no authority ({@code about:blank},
     * {@code mailto:bob@acme.com}) have nothing after it.
     */
    private static String afterScheme(String url) {
        if (StringUtils.isBlank(url)) {
            return "";
        }
        String trimmed = url.trim();
        Optional<String> scheme = scheme(trimmed);
        if (scheme.isEmpty()) {
            return trimmed;
        }
        String rest = trimmed.substring(scheme.get().length() + 1);
        return rest.startsWith("//") ? rest.substring(2) : "";
    }

    private static int firstIndexOf(String value, char... chars) {
        int best = -1;
        for (char c : chars) {
            int index = value.indexOf(c);
            if (index >= 0 && (best < 0 || index < best)) {
                best = index;
            }
        }
        return best;
    }
}
