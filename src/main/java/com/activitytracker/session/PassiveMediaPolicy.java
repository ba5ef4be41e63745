package com.activitytracker.session;

import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Decides whether a session is passive consumption (video, music, documents) that keeps running
 * while the user gives no input.
 * <p>
 * An app id matches an entry when it equals it or, for executable paths, ends with it as the last
 * path segment. Window titles naming a PDF document match regardless of the app.
 */
public final class PassiveMediaPolicy {

    private static final PassiveMediaPolicy NONE = new PassiveMediaPolicy(List.of(), false);
    private static final List<String> PDF_TITLE_MARKERS = List.of(".pdf -", ".pdf —", ".pdf –");

    private final List<String> appIds;
    private final boolean pdfTitles;

    private PassiveMediaPolicy(List<String> appIds, boolean pdfTitles) {
        this.appIds = appIds;
        this.pdfTitles = pdfTitles;
    }

    public static PassiveMediaPolicy of(List<String> appIds) {
        Objects.requireNonNull(appIds, "appIds");
        List<String> normalized = appIds.stream()
                .filter(StringUtils::isNotBlank)
                .map(id -> id.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
        return new PassiveMediaPolicy(normalized, true);
    }

    public static PassiveMediaPolicy none() {
        return NONE;
    }

    public boolean isPassive(String appId, String windowTitle) {
        String id = StringUtils.defaultString(appId).toLowerCase(Locale.ROOT);
        for (String entry : appIds) {
            if (id.equals(entry) || id.endsWith("\\" + entry) || id.endsWith("/" + entry)) {
                return true;
            }
        }
        if (!pdfTitles) {
            return false;
        }
        String title = StringUtils.defaultString(windowTitle).trim().toLowerCase(Locale.ROOT);
        if (title.endsWith(".pdf")) {
            return true;
        }
        for (String marker : PDF_TITLE_MARKERS) {
            if (title.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
