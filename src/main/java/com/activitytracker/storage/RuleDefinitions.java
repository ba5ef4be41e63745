package com.activitytracker.storage;

import com.activitytracker.model.RuleDefinition;
import com.activitytracker.model.RuleType;
import com.activitytracker.util.UrlParts;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks a rule before it is stored and brings its pattern into the form the matcher expects.
 */
public final class RuleDefinitions {

    private RuleDefinitions() {
    }

    /**
     * Trims the pattern and reduces a literal domain pattern given as a URL ({@code https://acme.com/})
     * to its host.
     *
     * @throws ValidationException for blank patterns, regular expressions that do not compile and
     *                             domain patterns without a host
     */
    public static RuleDefinition normalize(RuleDefinition definition) throws ValidationException {
        Objects.requireNonNull(definition, "definition");
        String pattern = definition.pattern().trim();
        if (pattern.isEmpty()) {
            throw new ValidationException("Rule pattern must not be blank");
        }
        if (definition.regex()) {
            try {
                Pattern.compile(pattern);
            } catch (PatternSyntaxException ex) {
                throw new ValidationException("Invalid regular expression '" + pattern + "': " + ex.getDescription(), ex);
            }
        } else if (definition.ruleType() == RuleType.URL_DOMAIN) {
            Optional<String> host = UrlParts.host(pattern);
            if (host.isEmpty()) {
                throw new ValidationException("Domain pattern '" + pattern + "' does not name a host");
            }
            pattern = host.get();
        }
        return new RuleDefinition(definition.ruleType(), pattern, definition.regex(), definition.priority());
    }
}
