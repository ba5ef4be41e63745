package com.activitytracker.suggestion;

import com.activitytracker.config.SuggestionConfig;
import com.activitytracker.model.ActivityRecord;
import com.activitytracker.model.Brand;
import com.activitytracker.model.Project;
import com.activitytracker.model.ProjectRule;
import com.activitytracker.model.ProjectSource;
import com.activitytracker.model.RuleDefinition;
import com.activitytracker.model.RuleType;
import com.activitytracker.rules.CompiledRule;
import com.activitytracker.rules.RuleEngine;
import com.activitytracker.rules.RuleMatcher;
import com.activitytracker.storage.ActivityStore;
import com.activitytracker.storage.RuleDefinitions;
import com.activitytracker.storage.StorageException;
import com.activitytracker.storage.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Proposes brands, projects and rules from unassigned activities.
 * <p>
 * {@link #detect()} only reads; on unchanged data it returns the same groups, names and order.
 */
public class SuggestionEngine {

    private static final Logger log = LoggerFactory.getLogger(SuggestionEngine.class);

    private static final Comparator<DetectedProject> PROJECT_ORDER = Comparator
            .comparingInt(DetectedProject::activityCount).reversed()
            .thenComparing(DetectedProject::token);

    private static final Comparator<DetectedBrand> BRAND_ORDER = Comparator
            .comparingInt(DetectedBrand::totalActivities).reversed()
            .thenComparing(DetectedBrand::rootToken);

    private final ActivityStore store;
    private final RuleEngine ruleEngine;
    private final TokenExtractor extractor;
    private final int minActivities;
    private final int minApps;

    public SuggestionEngine(ActivityStore store, SuggestionConfig config, RuleEngine ruleEngine) {
        this.store = Objects.requireNonNull(store, "store");
        this.ruleEngine = Objects.requireNonNull(ruleEngine, "ruleEngine");
        SuggestionConfig resolved = Objects.requireNonNull(config, "config").withDefaults();
        this.extractor = new TokenExtractor(resolved);
        this.minActivities = resolved.minActivities();
        this.minApps = resolved.minApps();
    }

    public List<DetectedBrand> detect() throws StorageException {
        List<ActivityRecord> unassigned = store.queryUnassignedRecords(Optional.empty());
        if (unassigned.isEmpty()) {
            return List.of();
        }
        Set<String> dismissed = store.dismissedTokens();
        Set<String> existingRules = store.loadAllProjectRules().stream()
                .map(rule -> ruleKey(rule.ruleType(), rule.pattern()))
                .collect(Collectors.toSet());

        Map<String, TokenGroup> groups = new TreeMap<>();
        for (ActivityRecord record : unassigned) {
            Optional<CandidateToken> candidate = extractor.extract(record);
            if (candidate.isEmpty() || dismissed.contains(candidate.get().token())) {
                continue;
            }
            groups.computeIfAbsent(candidate.get().token(), TokenGroup::new).add(record, candidate.get());
        }

        Map<String, List<DetectedProject>> byRoot = new TreeMap<>();
        for (TokenGroup group : groups.values()) {
            if (group.activityIds.size() < minActivities || group.apps.size() < minApps) {
                continue;
            }
            List<SuggestedRule> rules = group.rules.values().stream()
                    .filter(rule -> !existingRules.contains(ruleKey(rule.ruleType(), rule.pattern())))
                    .toList();
            if (rules.isEmpty()) {
                continue;
            }
            String root = group.root();
            byRoot.computeIfAbsent(root, r -> new ArrayList<>()).add(new DetectedProject(
                    group.token,
                    projectName(group.token, root),
                    group.activityIds.size(),
                    group.totalSeconds,
                    List.copyOf(group.apps),
                    group.activityIds,
                    rules));
        }

        List<DetectedBrand> brands = new ArrayList<>();
        for (Map.Entry<String, List<DetectedProject>> entry : byRoot.entrySet()) {
            List<DetectedProject> projects = new ArrayList<>(entry.getValue());
            projects.sort(PROJECT_ORDER);
            Set<String> apps = new TreeSet<>();
            int activities = 0;
            int seconds = 0;
            for (DetectedProject project : projects) {
                apps.addAll(project.apps());
                activities += project.activityCount();
                seconds += project.totalSeconds();
            }
            brands.add(new DetectedBrand(entry.getKey(), capitalize(entry.getKey()), projects, activities, seconds,
                    List.copyOf(apps)));
        }
        brands.sort(BRAND_ORDER);
        log.debug("Detected {} brand suggestion(s) from {} unassigned activities", brands.size(), unassigned.size());
        return brands;
    }

    /**
     * Creates the brand and project when no case-insensitive match exists, then accepts the rules
     * into that project. The rules are checked first, so a rejected rule creates nothing.
     *
     * @return number of activities assigned
     */
    public int accept(String brandName, String projectName, List<SuggestedRule> rules)
            throws StorageException, ValidationException {
        validate(rules);
        Optional<Brand> existingBrand = store.findBrandByName(brandName);
        Brand brand = existingBrand.isPresent() ? existingBrand.get() : store.insertBrand(brandName, null);
        Optional<Project> existingProject = store.findProjectByName(brand.id(), projectName);
        Project project = existingProject.isPresent()
                ? existingProject.get()
                : store.insertProject(brand.id(), projectName, null);
        return accept(project.id(), rules);
    }

    /**
     * Inserts the rules the project does not have yet, then assigns the unassigned activities those
     * rules match. Already assigned activities are left alone.
     *
     * @return number of activities assigned
     */
    public int accept(long projectId, List<SuggestedRule> rules) throws StorageException, ValidationException {
        Objects.requireNonNull(rules, "rules");
        Project project = store.findProject(projectId)
                .orElseThrow(() -> new ValidationException("Unknown project id " + projectId));
        List<RuleDefinition> definitions = validate(rules);

        Map<String, ProjectRule> projectRules = new LinkedHashMap<>();
        for (ProjectRule existing : store.loadAllProjectRules()) {
            if (existing.projectId() == projectId) {
                projectRules.putIfAbsent(ruleKey(existing.ruleType(), existing.pattern()), existing);
            }
        }
        List<CompiledRule> accepted = new ArrayList<>();
        for (RuleDefinition rule : definitions) {
            String key = ruleKey(rule.ruleType(), rule.pattern());
            ProjectRule stored = projectRules.get(key);
            if (stored == null) {
                stored = store.insertRule(projectId, rule);
                projectRules.put(key, stored);
            }
            accepted.add(CompiledRule.compile(stored));
        }
        ruleEngine.reloadRules();

        Map<Long, Long> assignments = new LinkedHashMap<>();
        for (ActivityRecord record : store.queryUnassignedRecords(Optional.empty())) {
            for (CompiledRule rule : accepted) {
                if (RuleMatcher.matches(rule, record)) {
                    assignments.put(record.id(), projectId);
                    break;
                }
            }
        }
        int assigned = store.assignUnassigned(assignments, ProjectSource.AUTO_RULE);
        log.info("Accepted {} rule(s) into project '{}', {} activities assigned", accepted.size(), project.name(), assigned);
        return assigned;
    }

    public void dismiss(String token) throws StorageException, ValidationException {
        store.dismissToken(token);
        log.info("Dismissed suggestion '{}'", token);
    }

    public void dismissBrand(DetectedBrand brand) throws StorageException, ValidationException {
        Objects.requireNonNull(brand, "brand");
        for (DetectedProject project : brand.projects()) {
            dismiss(project.token());
        }
    }

    /**
     * @return whether the token had been dismissed
     */
    public boolean restore(String token) throws StorageException {
        return store.restoreToken(token);
    }

    private static List<RuleDefinition> validate(List<SuggestedRule> rules) throws ValidationException {
        Objects.requireNonNull(rules, "rules");
        List<RuleDefinition> definitions = new ArrayList<>(rules.size());
        for (SuggestedRule rule : rules) {
            definitions.add(RuleDefinitions.normalize(rule.toDefinition()));
        }
        return definitions;
    }

    static String projectName(String token, String root) {
        if (token.equals(root)) {
            return capitalize(root);
        }
        return capitalize(token.substring(root.length()).trim());
    }

    static String capitalize(String words) {
        return Arrays.stream(words.split(" "))
                .filter(word -> !word.isEmpty())
                .map(word -> word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1))
                .collect(Collectors.joining(" "));
    }

    private static String ruleKey(RuleType type, String pattern) {
        return type.wireName() + ":" + pattern.trim().toLowerCase(Locale.ROOT);
    }

    private static final class TokenGroup {
        private final String token;
        private final List<Long> activityIds = new ArrayList<>();
        private final Set<String> apps = new TreeSet<>();
        private final Map<String, SuggestedRule> rules = new TreeMap<>();
        private int totalSeconds;

        private TokenGroup(String token) {
            this.token = token;
        }

        void add(ActivityRecord record, CandidateToken candidate) {
            activityIds.add(record.id());
            apps.add(record.appName());
            totalSeconds += record.durationSeconds();
            rules.putIfAbsent(ruleKey(candidate.ruleType(), candidate.ruleValue()),
                    SuggestedRule.literal(candidate.ruleType(), candidate.ruleValue()));
        }

        String root() {
            int space = token.indexOf(' ');
            return space < 0 ? token : token.substring(0, space);
        }
    }
}
