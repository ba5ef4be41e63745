package com.activitytracker.rules;

import com.activitytracker.model.ProjectRule;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A rule with its regular expression compiled once per cache load.
 */
public record CompiledRule(ProjectRule rule, Optional<Pattern> regex) {

    public CompiledRule {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(regex, "regex");
    }

    /**
     * @throws java.util.regex.PatternSyntaxException if a regex rule does not compile
     */
    public static CompiledRule compile(ProjectRule rule) {
        Optional<Pattern> regex = rule.regex()
                ? Optional.of(Pattern.compile(rule.pattern()))
                : Optional.empty();
        return new CompiledRule(rule, regex);
    }

    public long projectId() {
        return rule.projectId();
    }
}
