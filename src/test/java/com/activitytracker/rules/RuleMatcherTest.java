package com.activitytracker.rules;

import com.activitytracker.model.ActivityRecord;
import com.activitytracker.model.ProjectRule;
import com.activitytracker.model.RuleType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuleMatcherTest {

    @Test
    void shouldMatchDomainAndSubdomainsOnly() {
        CompiledRule rule = literal(RuleType.URL_DOMAIN, "www.acme.com");

        assertTrue(RuleMatcher.matches(rule, browser("https://acme.com/pricing")));
        assertTrue(RuleMatcher.matches(rule, browser("https://APP.Acme.com:8443/login")));
        assertFalse(RuleMatcher.matches(rule, browser("https://notacme.com")));
        assertFalse(RuleMatcher.matches(rule, browser("https://acme.com.evil.io")));
    }

    @Test
    void shouldCompareTerminalFolderByLastSegment() {
        CompiledRule rule = literal(RuleType.TERMINAL_FOLDER, "SaasBridge");

        assertTrue(RuleMatcher.matches(rule, terminal("/Users/dev/projects/saasbridge")));
        assertTrue(RuleMatcher.matches(rule, terminal("C:\\work\\saasbridge\\")));
        assertFalse(RuleMatcher.matches(rule, terminal("/Users/dev/saasbridge/src")));
        assertFalse(RuleMatcher.matches(rule, terminal("/Users/dev/saasbridge-old")));
    }

    @Test
    void shouldMatchMultiSegmentFolderPatternAtPathEnd() {
        CompiledRule rule = literal(RuleType.TERMINAL_FOLDER, "acme/src");

        assertTrue(RuleMatcher.matches(rule, terminal("/home/dev/acme/src")));
        assertFalse(RuleMatcher.matches(rule, terminal("/home/dev/notacme/src")));
    }

    @Test
    void shouldMatchTitleLiteralsCaseInsensitively() {
        CompiledRule rule = literal(RuleType.WINDOW_TITLE, "Quarterly Report");

        assertTrue(RuleMatcher.matches(rule, titled("Draft - quarterly report.docx")));
        assertFalse(RuleMatcher.matches(rule, titled("Annual report")));
    }

    @Test
    void shouldApplyRegexCaseSensitively() {
        CompiledRule rule = CompiledRule.compile(new ProjectRule(1, 1, RuleType.WINDOW_TITLE, "^JIRA-\\d+", true, 0));

        assertTrue(RuleMatcher.matches(rule, titled("JIRA-142 fix login")));
        assertFalse(RuleMatcher.matches(rule, titled("jira-142 fix login")));
    }

    @Test
    void shouldNotMatchWhenFieldIsMissing() {
        assertFalse(RuleMatcher.matches(literal(RuleType.URL_DOMAIN, "acme.com"), titled("acme.com")));
        assertFalse(RuleMatcher.matches(literal(RuleType.TERMINAL_FOLDER, "acme"), titled("acme")));
    }

    @Test
    void shouldExtractFieldsPerRuleType() {
        ActivityRecord record = ActivityRecord.unsaved(Instant.parse("2024-01-15T10:00:00Z"), LocalDate.of(2024, 1, 15),
                "Figma", "com.figma.Desktop", "Homepage", Optional.of("https://www.figma.com/file/abc?node=1"),
                Optional.empty(), 2);

        assertEquals(Optional.of("www.figma.com"), RuleMatcher.field(RuleType.URL_DOMAIN, record));
        assertEquals(Optional.of("/file/abc"), RuleMatcher.field(RuleType.URL_PATH, record));
        assertEquals(Optional.of("Homepage"), RuleMatcher.field(RuleType.DESIGN_FILE, record));
        assertEquals(Optional.of("com.figma.Desktop"), RuleMatcher.field(RuleType.BUNDLE_ID, record));
        assertEquals(Optional.empty(), RuleMatcher.field(RuleType.TERMINAL_FOLDER, record));
        assertTrue(RuleMatcher.matches(literal(RuleType.BUNDLE_ID, "COM.FIGMA.DESKTOP"), record));
        assertFalse(RuleMatcher.matches(literal(RuleType.BUNDLE_ID, "com.figma"), record));
    }

    @Test
    void shouldPreferExtraContextForDesignFiles() {
        ActivityRecord record = ActivityRecord.unsaved(Instant.parse("2024-01-15T10:00:00Z"), LocalDate.of(2024, 1, 15),
                "Figma", "figma.exe", "Figma", Optional.empty(), Optional.of("Acme Landing Page"), 2);

        assertEquals(Optional.of("Acme Landing Page"), RuleMatcher.field(RuleType.DESIGN_FILE, record));
        assertTrue(RuleMatcher.matches(literal(RuleType.DESIGN_FILE, "landing page"), record));
        assertTrue(RuleMatcher.matches(literal(RuleType.DESIGN_FILE, "Homepage"), titled("Homepage – Figma")));
    }

    private static CompiledRule literal(RuleType type, String pattern) {
        return CompiledRule.compile(new ProjectRule(1, 1, type, pattern, false, 0));
    }

    private static ActivityRecord browser(String url) {
        return ActivityRecord.unsaved(Instant.parse("2024-01-15T10:00:00Z"), LocalDate.of(2024, 1, 15),
                "Firefox", "firefox", "Page", Optional.of(url), Optional.empty(), 2);
    }

    private static ActivityRecord terminal(String folder) {
        return ActivityRecord.unsaved(Instant.parse("2024-01-15T10:00:00Z"), LocalDate.of(2024, 1, 15),
                "Terminal", "terminal", "zsh", Optional.empty(), Optional.of(folder), 2);
    }

    private static ActivityRecord titled(String title) {
        return ActivityRecord.unsaved(Instant.parse("2024-01-15T10:00:00Z"), LocalDate.of(2024, 1, 15),
                "Word", "word", title, Optional.empty(), Optional.empty(), 2);
    }
}
