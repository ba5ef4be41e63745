package com.activitytracker.suggestion;

import com.activitytracker.model.RuleType;

import java.util.Objects;

/**
 * The clustering key derived from one activity, plus the field value a rule would match on.
 *
 * @param token     normalized keyword, words separated by single spaces
 * @param ruleType  most specific rule type for {@code ruleValue}
 * @param ruleValue observed value as it appeared on the activity (host, folder, title prefix)
 */
public record CandidateToken(String token, RuleType ruleType, String ruleValue) {

    public CandidateToken {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(ruleType, "ruleType");
        Objects.requireNonNull(ruleValue, "ruleValue");
        if (token.isBlank()) {
            throw new IllegalArgumentException("token must not be blank");
        }
    }

    /**
     * First word of the token; detected projects sharing a root form one brand.
     */
    public String root() {
        int space = token.indexOf(' ');
        return space < 0 ? token : token.substring(0, space);
    }
}
