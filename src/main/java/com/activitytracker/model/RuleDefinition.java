package com.activitytracker.model;

import java.util.Objects;

/**
 * A rule that has not been persisted yet.
 */
public record RuleDefinition(
        RuleType ruleType,
        String pattern,
        boolean regex,
        int priority
) {

    public RuleDefinition {
        Objects.requireNonNull(ruleType, "ruleType");
        Objects.requireNonNull(pattern, "pattern");
    }

    public static RuleDefinition literal(RuleType ruleType, String pattern) {
        return new RuleDefinition(ruleType, pattern, false, 0);
    }

    public static RuleDefinition regex(RuleType ruleType, String pattern) {
        return new RuleDefinition(ruleType, pattern, true, 0);
    }
}
