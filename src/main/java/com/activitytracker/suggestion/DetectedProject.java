package com.activitytracker.suggestion;

import java.util.List;
import java.util.Objects;

/**
 * A group of unassigned activities sharing one token, proposed as a project.
 *
 * @param token durable key; passing it to {@link SuggestionEngine#dismiss(String)} suppresses this group
 */
public record DetectedProject(
        String token,
        String suggestedName,
        int activityCount,
        int totalSeconds,
        List<String> apps,
        List<Long> activityIds,
        List<SuggestedRule> suggestedRules
) {

    public DetectedProject {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(suggestedName, "suggestedName");
        apps = List.copyOf(apps);
        activityIds = List.copyOf(activityIds);
        suggestedRules = List.copyOf(suggestedRules);
    }
}
