package com.activitytracker.storage.sqlite;

import com.activitytracker.model.ActivityRecord;
import com.activitytracker.model.AppSummary;
import com.activitytracker.model.BrandSummary;
import com.activitytracker.model.DaySummary;
import com.activitytracker.storage.sqlite.DaySummaryAssembler.ProjectTimeRow;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaySummaryAssemblerTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 15);

    @Test
    void shouldDropAppsWithoutTimeAndOrderByTotal() {
        List<ActivityRecord> records = List.of(
                record(1, "2024-01-15T09:00:00Z", "Slack", "general", 30),
                record(2, "2024-01-15T09:01:00Z", "Code", "main.rs", 30),
                record(3, "2024-01-15T09:02:00Z", "Zoom", "Meeting", 0),
                record(4, "2024-01-15T09:03:00Z", "Code", "lib.rs", 10));

        DaySummary summary = DaySummaryAssembler.daySummary(DAY, records, ZoneOffset.UTC);

        assertEquals(List.of("Code", "Slack"), summary.apps().stream().map(AppSummary::appName).toList());
        assertEquals(70, summary.totalSeconds());
        assertEquals(List.of(2L), summary.apps().get(0).windows().get(0).activityIds());
    }

    @Test
    void shouldFormatFirstAndLastActivityInGivenZone() {
        List<ActivityRecord> records = List.of(
                record(1, "2024-01-15T08:30:00Z", "Code", "main.rs", 60),
                record(2, "2024-01-15T16:45:00Z", "Code", "main.rs", 900));

        DaySummary summary = DaySummaryAssembler.daySummary(DAY, records, ZoneId.of("Europe/Berlin"));

        assertEquals(Optional.of("09:30"), summary.firstActivity());
        assertEquals(Optional.of("18:00"), summary.lastActivity());
        assertEquals(8 * 3600 + 30 * 60, summary.wallClockSeconds());
        assertEquals(960, summary.activeTrackingSeconds());
    }

    @Test
    void shouldSkipProjectRowsWithoutTime() {
        List<ProjectTimeRow> rows = List.of(
                new ProjectTimeRow(1, "Acme", "#111111", 10, "Website", "#aaaaaa", "Code", 0),
                new ProjectTimeRow(2, "Globex", "#222222", 20, "Portal", "#bbbbbb", "Code", 30),
                new ProjectTimeRow(2, "Globex", "#222222", 21, "Billing", "#cccccc", "Firefox", 30),
                new ProjectTimeRow(2, "Globex", "#222222", 21, "Billing", "#cccccc", "Code", 5));

        List<BrandSummary> brands = DaySummaryAssembler.brandSummaries(rows);

        assertEquals(1, brands.size());
        assertEquals(65, brands.get(0).totalSeconds());
        assertEquals("Billing", brands.get(0).projects().get(0).projectName());
        assertEquals("Firefox", brands.get(0).projects().get(0).appBreakdown().get(0).appName());
        assertTrue(DaySummaryAssembler.brandSummaries(List.of()).isEmpty());
    }

    private static ActivityRecord record(long id, String timestamp, String app, String title, int duration) {
        return ActivityRecord.unsaved(Instant.parse(timestamp), DAY, app, app.toLowerCase(), title,
                Optional.empty(), Optional.empty(), duration).withId(id);
    }
}
