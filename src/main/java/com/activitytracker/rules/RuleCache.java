package com.activitytracker.rules;

import com.activitytracker.model.ProjectRule;
import com.activitytracker.storage.ActivityStore;
import com.activitytracker.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.PatternSyntaxException;

/**
 * Compiled snapshot of every project rule, in evaluation order. Owned by {@link RuleEngine}
 * and shared by reference with the session merger and the suggestion engine.
 */
public class RuleCache {

    private static final Logger log = LoggerFactory.getLogger(RuleCache.class);

    private static final Comparator<CompiledRule> EVALUATION_ORDER =
            Comparator.comparing(CompiledRule::rule, ProjectRule.EVALUATION_ORDER);

    private final ActivityStore store;
    private volatile List<CompiledRule> snapshot;

    public RuleCache(ActivityStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * The current snapshot, loading it first if it was invalidated.
     */
    public List<CompiledRule> rules() throws StorageException {
        List<CompiledRule> current = snapshot;
        return current != null ? current : reload();
    }

    public void invalidate() {
        snapshot = null;
    }

    public synchronized List<CompiledRule> reload() throws StorageException {
        List<ProjectRule> stored = store.loadAllProjectRules();
        List<CompiledRule> compiled = new ArrayList<>(stored.size());
        for (ProjectRule rule : stored) {
            try {
                compiled.add(CompiledRule.compile(rule));
            } catch (PatternSyntaxException ex) {
                log.warn("Skipping rule {} with invalid pattern '{}': {}", rule.id(), rule.pattern(), ex.getDescription());
            }
        }
        compiled.sort(EVALUATION_ORDER);
        List<CompiledRule> loaded = List.copyOf(compiled);
        snapshot = loaded;
        log.debug("Loaded {} project rule(s)", loaded.size());
        return loaded;
    }
}
