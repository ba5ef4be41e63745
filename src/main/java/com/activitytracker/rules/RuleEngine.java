package com.activitytracker.rules;

import com.activitytracker.model.ActivityRecord;
import com.activitytracker.model.ProjectRule;
import com.activitytracker.model.ProjectSource;
import com.activitytracker.model.RuleDefinition;
import com.activitytracker.storage.ActivityStore;
import com.activitytracker.storage.StorageException;
import com.activitytracker.storage.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Deterministic project assignment: the first rule, by priority then id, whose field matches
 * decides the project. An activity no rule matches stays unassigned.
 */
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final ActivityStore store;
    private final RuleCache ruleCache;

    public RuleEngine(ActivityStore store) {
        this.store = Objects.requireNonNull(store, "store");
        this.ruleCache = new RuleCache(store);
    }

    public RuleCache ruleCache() {
        return ruleCache;
    }

    public Optional<Long> match(ActivityRecord record) throws StorageException {
        return matchingRule(record).map(ProjectRule::projectId);
    }

    public Optional<ProjectRule> matchingRule(ActivityRecord record) throws StorageException {
        Objects.requireNonNull(record, "record");
        return firstMatch(ruleCache.rules(), record);
    }

    /**
     * Assigns every unassigned activity that a rule matches. Assigned activities are never touched,
     * so a repeated call on unchanged data returns {@code 0}.
     *
     * @return number of activities newly assigned
     */
    public int autoAssignUnclassified() throws StorageException {
        return autoAssign(Optional.empty());
    }

    public int autoAssignUnclassified(LocalDate date) throws StorageException {
        return autoAssign(Optional.of(Objects.requireNonNull(date, "date")));
    }

    private int autoAssign(Optional<LocalDate> date) throws StorageException {
        List<CompiledRule> rules = ruleCache.reload();
        if (rules.isEmpty()) {
            return 0;
        }
        Map<Long, Long> assignments = new LinkedHashMap<>();
        for (ActivityRecord record : store.queryUnassignedRecords(date)) {
            firstMatch(rules, record).ifPresent(rule -> assignments.put(record.id(), rule.projectId()));
        }
        if (assignments.isEmpty()) {
            return 0;
        }
        int assigned = store.assignUnassigned(assignments, ProjectSource.AUTO_RULE);
        log.info("Auto-assigned {} activit{} ({})", assigned, assigned == 1 ? "y" : "ies",
                date.map(LocalDate::toString).orElse("all dates"));
        return assigned;
    }

    public void reloadRules() throws StorageException {
        ruleCache.invalidate();
        ruleCache.reload();
    }

    /**
     * Manually assigns the activities to a project, bypassing matching. When a rule is given it is
     * stored first, so an invalid rule leaves every assignment unchanged.
     *
     * @return number of activities updated
     */
    public int classify(Collection<Long> activityIds, long projectId, Optional<RuleDefinition> rule)
            throws StorageException, ValidationException {
        Objects.requireNonNull(activityIds, "activityIds");
        Objects.requireNonNull(rule, "rule");
        if (rule.isPresent()) {
            insertRule(projectId, rule.get());
        }
        int updated = store.assignProject(activityIds, projectId, ProjectSource.MANUAL);
        log.info("Classified {} activit{} into project {}", updated, updated == 1 ? "y" : "ies", projectId);
        return updated;
    }

    public ProjectRule insertRule(long projectId, RuleDefinition definition) throws StorageException, ValidationException {
        ProjectRule rule = store.insertRule(projectId, definition);
        reloadRules();
        return rule;
    }

    public void deleteRule(long ruleId) throws StorageException, ValidationException {
        store.deleteRule(ruleId);
        reloadRules();
    }

    public void deleteProject(long projectId) throws StorageException, ValidationException {
        store.deleteProject(projectId);
        reloadRules();
    }

    public void deleteBrand(long brandId) throws StorageException, ValidationException {
        store.deleteBrand(brandId);
        reloadRules();
    }

    private static Optional<ProjectRule> firstMatch(List<CompiledRule> rules, ActivityRecord record) {
        for (CompiledRule rule : rules) {
            if (RuleMatcher.matches(rule, record)) {
                return Optional.of(rule.rule());
            }
        }
        return Optional.empty();
    }
}
