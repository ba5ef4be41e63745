package com.activitytracker.suggestion;

import com.activitytracker.model.RuleDefinition;
import com.activitytracker.model.RuleType;

import java.util.Objects;

public record SuggestedRule(RuleType ruleType, String pattern, boolean regex) {

    public SuggestedRule {
        Objects.requireNonNull(ruleType, "ruleType");
        Objects.requireNonNull(pattern, "pattern");
    }

    public static SuggestedRule literal(RuleType ruleType, String pattern) {
        return new SuggestedRule(ruleType, pattern, false);
    }

    public RuleDefinition toDefinition() {
        return new RuleDefinition(ruleType, pattern, regex, 0);
    }
}
