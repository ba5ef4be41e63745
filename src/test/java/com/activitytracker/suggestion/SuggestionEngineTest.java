package com.activitytracker.suggestion;

import com.activitytracker.config.StorageConfig;
import com.activitytracker.config.SuggestionConfig;
import com.activitytracker.model.ActivityRecord;
import com.activitytracker.model.Brand;
import com.activitytracker.model.Project;
import com.activitytracker.model.ProjectRule;
import com.activitytracker.model.ProjectSource;
import com.activitytracker.model.RuleDefinition;
import com.activitytracker.model.RuleType;
import com.activitytracker.rules.RuleEngine;
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
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SuggestionEngineTest {

    @TempDir
    Path tempDir;

    private SqliteActivityStore store;
    private RuleEngine ruleEngine;
    private SuggestionEngine engine;
    private int sequence;

    @BeforeEach
    void setUp() throws StorageException {
        store = new SqliteActivityStore(StorageConfig.forDatabase(tempDir.resolve("suggest.db")));
        ruleEngine = new RuleEngine(store);
        engine = new SuggestionEngine(store, SuggestionConfig.defaults(), ruleEngine);
    }

    @AfterEach
    void tearDown() throws StorageException {
        store.close();
    }

    @Test
    void shouldProposeProjectFromRepeatedTerminalFolder() throws Exception {
        for (int i = 0; i < 5; i++) {
            terminal("~/projects/saasbridge");
        }
        terminal("~/projects/other-thing");

        List<DetectedBrand> brands = engine.detect();

        assertEquals(1, brands.size());
        DetectedBrand brand = brands.get(0);
        assertEquals("saasbridge", brand.rootToken());
        assertEquals("Saasbridge", brand.suggestedName());
        assertEquals(1, brand.projects().size());
        DetectedProject project = brand.projects().get(0);
        assertEquals("Saasbridge", project.suggestedName());
        assertEquals(5, project.activityCount());
        assertEquals(10, project.totalSeconds());
        assertEquals(List.of("Terminal"), project.apps());
        assertEquals(List.of(SuggestedRule.literal(RuleType.TERMINAL_FOLDER, "saasbridge")), project.suggestedRules());
    }

    @Test
    void shouldGroupTokensSharingRootUnderOneBrand() throws Exception {
        browser("https://acme.com/home");
        browser("https://www.acme.com/pricing");
        browser("https://docs.acme.com/start");
        browser("https://docs.acme.com/api");
        browser("https://docs.acme.com/faq");
        browser("https://initech.io/a");
        browser("https://initech.io/b");

        List<DetectedBrand> brands = engine.detect();

        assertEquals(List.of("acme", "initech"), brands.stream().map(DetectedBrand::rootToken).toList());
        DetectedBrand acme = brands.get(0);
        assertEquals(5, acme.totalActivities());
        assertEquals(List.of("acme docs", "acme"), acme.projects().stream().map(DetectedProject::token).toList());
        assertEquals("Docs", acme.projects().get(0).suggestedName());
        assertEquals("Acme", acme.projects().get(1).suggestedName());
    }

    @Test
    void shouldReturnSameSuggestionsOnUnchangedData() throws Exception {
        browser("https://acme.com/home");
        browser("https://acme.com/pricing");
        terminal("/work/initech");
        terminal("/work/initech");

        List<DetectedBrand> first = engine.detect();
        List<DetectedBrand> second = engine.detect();

        assertEquals(first, second);
        assertEquals(2, first.size());
    }

    @Test
    void shouldNotProposeDismissedTokenAgainUntilRestored() throws Exception {
        for (int i = 0; i < 3; i++) {
            terminal("~/projects/saasbridge");
        }
        engine.dismissBrand(engine.detect().get(0));

        assertTrue(engine.detect().isEmpty());
        assertTrue(engine.restore("saasbridge"));
        assertEquals(1, engine.detect().size());
    }

    @Test
    void shouldCreateTaxonomyAndAssignActivitiesOnAccept() throws Exception {
        for (int i = 0; i < 5; i++) {
            terminal("~/projects/saasbridge");
        }
        long unrelated = terminal("/work/initech");
        DetectedProject project = engine.detect().get(0).projects().get(0);

        int assigned = engine.accept("Saasbridge", project.suggestedName(), project.suggestedRules());

        assertEquals(5, assigned);
        Brand brand = store.findBrandByName("saasbridge").orElseThrow();
        Project created = store.findProjectByName(brand.id(), "Saasbridge").orElseThrow();
        for (long id : project.activityIds()) {
            ActivityRecord record = store.findActivity(id).orElseThrow();
            assertEquals(Optional.of(created.id()), record.projectId());
            assertEquals(Optional.of(ProjectSource.AUTO_RULE), record.projectSource());
        }
        assertFalse(store.findActivity(unrelated).orElseThrow().isAssigned());
        assertEquals(Optional.of(created.id()),
                ruleEngine.match(store.findActivity(project.activityIds().get(0)).orElseThrow()));
        assertTrue(engine.detect().isEmpty());
    }

    @Test
    void shouldReuseExistingProjectRuleOnRepeatedAccept() throws Exception {
        Brand brand = store.insertBrand("Acme", null);
        Project project = store.insertProject(brand.id(), "Website", null);
        List<SuggestedRule> rules = List.of(SuggestedRule.literal(RuleType.URL_DOMAIN, "acme.com"));
        browser("https://acme.com/a");

        assertEquals(1, engine.accept(project.id(), rules));
        browser("https://acme.com/b");
        assertEquals(1, engine.accept(project.id(), rules));

        List<ProjectRule> stored = store.loadAllProjectRules();
        assertEquals(1, stored.size());
        assertEquals(project.id(), stored.get(0).projectId());
    }

    @Test
    void shouldRejectAcceptIntoUnknownProjectOrWithInvalidRegex() throws Exception {
        Brand brand = store.insertBrand("Acme", null);
        Project project = store.insertProject(brand.id(), "Website", null);

        assertThrows(ValidationException.class,
                () -> engine.accept(999, List.of(SuggestedRule.literal(RuleType.URL_DOMAIN, "acme.com"))));
        assertThrows(ValidationException.class,
                () -> engine.accept(project.id(), List.of(new SuggestedRule(RuleType.WINDOW_TITLE, "[acme", true))));
        assertTrue(store.loadAllProjectRules().isEmpty());
    }

    @Test
    void shouldProposeAndAcceptDesignFileRule() throws Exception {
        design("Acme Landing Page – Figma");
        design("Acme Landing Page – Figma");
        design("Acme Landing Page* – Figma");
        browser("https://www.figma.com/files/recent");

        DetectedBrand brand = engine.detect().get(0);
        DetectedProject project = brand.projects().get(0);

        assertEquals("acme", brand.rootToken());
        assertEquals("Landing Page", project.suggestedName());
        assertEquals(3, project.activityCount());
        assertEquals(List.of(SuggestedRule.literal(RuleType.DESIGN_FILE, "Acme Landing Page")), project.suggestedRules());
        assertEquals(3, engine.accept("Acme", project.suggestedName(), project.suggestedRules()));
    }

    @Test
    void shouldCreateNothingWhenAnAcceptedRuleIsRejected() throws Exception {
        List<SuggestedRule> rules = List.of(
                SuggestedRule.literal(RuleType.URL_DOMAIN, "globex.com"),
                SuggestedRule.literal(RuleType.URL_DOMAIN, "about:blank"));

        assertThrows(ValidationException.class, () -> engine.accept("Globex", "Website", rules));

        assertTrue(store.findBrandByName("Globex").isEmpty());
        assertTrue(store.allProjects().isEmpty());
        assertTrue(store.loadAllProjectRules().isEmpty());
    }

    @Test
    void shouldDropSuggestionAlreadyCoveredByExistingRule() throws Exception {
        Brand brand = store.insertBrand("Acme", null);
        Project project = store.insertProject(brand.id(), "Website", null);
        store.insertRule(project.id(), RuleDefinition.literal(RuleType.URL_DOMAIN, "ACME.com"));
        browser("https://acme.com/a");
        browser("https://acme.com/b");

        assertTrue(engine.detect().isEmpty());
    }

    @Test
    void shouldRespectMinimumActivityAndAppCounts() throws Exception {
        SuggestionEngine strict = new SuggestionEngine(store, new SuggestionConfig(3, 2, null, null, null), ruleEngine);
        terminal("/work/initech");
        terminal("/work/initech");
        terminal("/work/initech");

        assertTrue(strict.detect().isEmpty());

        insert("Code", "editor", Optional.empty(), Optional.of("/work/initech"));

        assertEquals(List.of("Code", "Terminal"), strict.detect().get(0).apps());
    }

    @Test
    void shouldNameProjectsFromTokenSuffix() {
        assertEquals("Acme", SuggestionEngine.projectName("acme", "acme"));
        assertEquals("Web App", SuggestionEngine.projectName("acme web app", "acme"));
        assertEquals("Quarterly Plan", SuggestionEngine.capitalize("quarterly  plan"));
    }

    private long terminal(String folder) throws StorageException {
        return insert("Terminal", "zsh", Optional.empty(), Optional.of(folder));
    }

    private long design(String title) throws StorageException {
        Instant at = Instant.parse("2024-01-15T10:00:00Z").plusSeconds(sequence++ * 10L);
        return store.insert(ActivityRecord.unsaved(at, LocalDate.ofInstant(at, ZoneOffset.UTC), "Figma",
                "com.figma.Desktop", title, Optional.empty(), Optional.empty(), 2));
    }

    private long browser(String url) throws StorageException {
        return insert("Firefox", "Page", Optional.of(url), Optional.empty());
    }

    private long insert(String app, String title, Optional<String> url, Optional<String> extraContext)
            throws StorageException {
        Instant at = Instant.parse("2024-01-15T10:00:00Z").plusSeconds(sequence++ * 10L);
        return store.insert(ActivityRecord.unsaved(at, LocalDate.ofInstant(at, ZoneOffset.UTC), app,
                app.toLowerCase(), title, url, extraContext, 2));
    }
}
