package com.activitytracker.model;

import java.util.Comparator;
import java.util.Objects;

public record ProjectRule(
        long id,
        long projectId,
        RuleType ruleType,
        String pattern,
        boolean regex,
        int priority
) {

    /**
     * Evaluation order: lower priority first, rule id breaks ties.
     */
    public static final Comparator<ProjectRule> EVALUATION_ORDER = Comparator
            .comparingInt(ProjectRule::priority)
            .thenComparingLong(ProjectRule::id);

    public ProjectRule {
        Objects.requireNonNull(ruleType, "ruleType");
        Objects.requireNonNull(pattern, "pattern");
    }
}
