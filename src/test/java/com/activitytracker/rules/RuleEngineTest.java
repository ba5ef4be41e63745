package com.activitytracker.rules;

import com.activitytracker.config.StorageConfig;
import com.activitytracker.model.ActivityRecord;
import com.activitytracker.model.Brand;
import com.activitytracker.model.Project;
import com.activitytracker.model.ProjectRule;
import com.activitytracker.model.ProjectSource;
import com.activitytracker.model.RuleDefinition;
import com.activitytracker.model.RuleType;
import com.activitytracker.storage.StorageException;
import com.activitytracker.storage.ValidationException;
import com.activitytracker.storage.sqlite.SqliteActivityStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuleEngineTest {

    @TempDir
    Path tempDir;

    private SqliteActivityStore store;
    private RuleEngine engine;
    private Project website;

    @BeforeEach
    void setUp() throws Exception {
        store = new SqliteActivityStore(StorageConfig.forDatabase(tempDir.resolve("rules.db")));
        engine = new RuleEngine(store);
        Brand acme = store.insertBrand("Acme", null);
        website = store.insertProject(acme.id(), "Website", null);
    }

    @AfterEach
    void tearDown() throws StorageException {
        store.close();
    }

    @Test
    void shouldAssignMatchingActivitiesOnceAndBeIdempotent() throws Exception {
        List<Long> matching = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            matching.add(store.insert(browser(i, "https://" + (i % 2 == 0 ? "" : "app.") + "acme.com/page")));
        }
        long other = store.insert(browser(20, "https://globex.com"));
        engine.insertRule(website.id(), RuleDefinition.literal(RuleType.URL_DOMAIN, "acme.com"));

        assertEquals(10, engine.autoAssignUnclassified());
        assertEquals(0, engine.autoAssignUnclassified());

        for (long id : matching) {
            ActivityRecord record = store.findActivity(id).orElseThrow();
            assertEquals(Optional.of(website.id()), record.projectId());
            assertEquals(Optional.of(ProjectSource.AUTO_RULE), record.projectSource());
        }
        assertFalse(store.findActivity(other).orElseThrow().isAssigned());
    }

    @Test
    void shouldNeverOverrideManualAssignment() throws Exception {
        Project api = store.insertProject(website.brandId(), "API", null);
        long id = store.insert(browser(0, "https://acme.com"));
        engine.classify(List.of(id), api.id(), Optional.empty());
        engine.insertRule(website.id(), RuleDefinition.literal(RuleType.URL_DOMAIN, "acme.com"));

        assertEquals(0, engine.autoAssignUnclassified());
        ActivityRecord record = store.findActivity(id).orElseThrow();
        assertEquals(Optional.of(api.id()), record.projectId());
        assertEquals(Optional.of(ProjectSource.MANUAL), record.projectSource());
    }

    @Test
    void shouldPickFirstRuleByPriorityThenId() throws Exception {
        Project api = store.insertProject(website.brandId(), "API", null);
        Project docs = store.insertProject(website.brandId(), "Docs", null);
        engine.insertRule(website.id(), new RuleDefinition(RuleType.URL_DOMAIN, "acme.com", false, 5));
        engine.insertRule(api.id(), new RuleDefinition(RuleType.URL_PATH, "/api", false, 1));
        engine.insertRule(docs.id(), new RuleDefinition(RuleType.URL_PATH, "/api/docs", false, 1));

        assertEquals(Optional.of(api.id()), engine.match(browser(0, "https://acme.com/api/docs/intro")));
        assertEquals(Optional.of(website.id()), engine.match(browser(0, "https://acme.com/pricing")));
        assertEquals(Optional.of(api.id()), engine.match(browser(0, "https://globex.com/api")));
    }

    @Test
    void shouldLeaveActivityUnassignedWhenNoRuleMatches() throws Exception {
        engine.insertRule(website.id(), RuleDefinition.literal(RuleType.URL_DOMAIN, "acme.com"));

        assertTrue(engine.match(browser(0, "https://globex.com")).isEmpty());
        assertTrue(engine.matchingRule(titled(0, "acme.com")).isEmpty());
    }

    @Test
    void shouldTreatRegexCaseSensitively() throws Exception {
        engine.insertRule(website.id(), RuleDefinition.regex(RuleType.WINDOW_TITLE, "ACME-\\d+"));

        assertEquals(Optional.of(website.id()), engine.match(titled(0, "Fix ACME-12 login")));
        assertTrue(engine.match(titled(0, "Fix acme-12 login")).isEmpty());
    }

    @Test
    void shouldStoreRuleAndAssignManuallyOnClassify() throws Exception {
        long first = store.insert(titled(0, "Acme roadmap"));
        long second = store.insert(titled(1, "Acme budget"));
        long later = store.insert(titled(2, "Acme hiring"));

        int updated = engine.classify(List.of(first, second), website.id(),
                Optional.of(RuleDefinition.literal(RuleType.WINDOW_TITLE, "acme")));

        assertEquals(2, updated);
        assertEquals(Optional.of(ProjectSource.MANUAL), store.findActivity(first).orElseThrow().projectSource());
        assertEquals(1, store.loadAllProjectRules().size());
        assertEquals(1, engine.autoAssignUnclassified());
        assertEquals(Optional.of(ProjectSource.AUTO_RULE), store.findActivity(later).orElseThrow().projectSource());
    }

    @Test
    void shouldRejectInvalidRuleWithoutChangingAssignments() throws Exception {
        long id = store.insert(titled(0, "Acme roadmap"));

        assertThrows(ValidationException.class, () -> engine.classify(List.of(id), website.id(),
                Optional.of(RuleDefinition.regex(RuleType.WINDOW_TITLE, "(acme"))));

        assertFalse(store.findActivity(id).orElseThrow().isAssigned());
        assertTrue(store.loadAllProjectRules().isEmpty());
    }

    @Test
    void shouldRefreshCacheWhenRulesChange() throws Exception {
        ActivityRecord record = browser(0, "https://acme.com");
        assertTrue(engine.match(record).isEmpty());

        ProjectRule rule = engine.insertRule(website.id(), RuleDefinition.literal(RuleType.URL_DOMAIN, "acme.com"));
        assertEquals(Optional.of(website.id()), engine.match(record));

        engine.deleteRule(rule.id());
        assertTrue(engine.match(record).isEmpty());

        engine.insertRule(website.id(), RuleDefinition.literal(RuleType.URL_DOMAIN, "acme.com"));
        engine.deleteProject(website.id());
        assertTrue(engine.match(record).isEmpty());
        assertTrue(engine.ruleCache().rules().isEmpty());
    }

    @Test
    void shouldLimitAutoAssignToGivenDate() throws Exception {
        long today = store.insert(browser(0, "https://acme.com"));
        Instant yesterdayAt = Instant.parse("2024-01-14T10:00:00Z");
        long yesterday = store.insert(ActivityRecord.unsaved(yesterdayAt, LocalDate.of(2024, 1, 14), "Firefox",
                "firefox", "Page", Optional.of("https://acme.com"), Optional.empty(), 2));
        engine.insertRule(website.id(), RuleDefinition.literal(RuleType.URL_DOMAIN, "acme.com"));

        assertEquals(1, engine.autoAssignUnclassified(LocalDate.of(2024, 1, 15)));
        assertTrue(store.findActivity(today).orElseThrow().isAssigned());
        assertFalse(store.findActivity(yesterday).orElseThrow().isAssigned());
    }

    private static ActivityRecord browser(int offset, String url) {
        Instant at = Instant.parse("2024-01-15T10:00:00Z").plusSeconds(offset * 10L);
        return ActivityRecord.unsaved(at, LocalDate.ofInstant(at, ZoneOffset.UTC), "Firefox", "firefox", "Page",
                Optional.of(url), Optional.empty(), 2);
    }

    private static ActivityRecord titled(int offset, String title) {
        Instant at = Instant.parse("2024-01-15T10:00:00Z").plusSeconds(offset * 10L);
        return ActivityRecord.unsaved(at, LocalDate.ofInstant(at, ZoneOffset.UTC), "Notes", "notes", title,
                Optional.empty(), Optional.empty(), 2);
    }
}
