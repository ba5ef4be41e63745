package com.activitytracker.storage.sqlite;

import com.activitytracker.model.ActivityRecord;
import com.activitytracker.model.AppBreakdownEntry;
import com.activitytracker.model.AppDetailReport;
import com.activitytracker.model.AppSummary;
import com.activitytracker.model.BrandSummary;
import com.activitytracker.model.DayBreakdown;
import com.activitytracker.model.DaySummary;
import com.activitytracker.model.ProjectSummary;
import com.activitytracker.model.WindowDetail;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Folds activity rows into the aggregate views returned by the store.
 */
public final class DaySummaryAssembler {

    private static final DateTimeFormatter CLOCK_LABEL = DateTimeFormatter.ofPattern("HH:mm");

    private static final Comparator<WindowDetail> WINDOW_ORDER = Comparator
            .comparingInt(WindowDetail::totalSeconds).reversed()
            .thenComparing(WindowDetail::windowTitle);

    private static final Comparator<AppSummary> APP_ORDER = Comparator
            .comparingInt(AppSummary::totalSeconds).reversed()
            .thenComparing(AppSummary::appName);

    private DaySummaryAssembler() {
    }

    /**
     * @param records every activity dated {@code date}
     * @param zone    zone used for the first/last activity labels
     */
    public static DaySummary daySummary(LocalDate date, List<ActivityRecord> records, ZoneId zone) {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(zone, "zone");
        if (records.isEmpty()) {
            return DaySummary.empty(date);
        }

        Map<String, AppAccumulator> byApp = new LinkedHashMap<>();
        Instant first = null;
        Instant lastEnd = null;
        int total = 0;
        for (ActivityRecord record : records) {
            byApp.computeIfAbsent(record.appName(), name -> new AppAccumulator(name, record.appId()))
                    .add(record);
            total += record.durationSeconds();
            Instant end = record.timestamp().plusSeconds(record.durationSeconds());
            if (first == null || record.timestamp().isBefore(first)) {
                first = record.timestamp();
            }
            if (lastEnd == null || end.isAfter(lastEnd)) {
                lastEnd = end;
            }
        }

        List<AppSummary> apps = new ArrayList<>();
        for (AppAccumulator accumulator : byApp.values()) {
            if (accumulator.totalSeconds > 0) {
                apps.add(accumulator.toSummary());
            }
        }
        apps.sort(APP_ORDER);

        int wallClock = (int) Duration.between(first, lastEnd).toSeconds();
        return new DaySummary(date, total, apps, wallClock, total,
                Optional.of(CLOCK_LABEL.format(first.atZone(zone))),
                Optional.of(CLOCK_LABEL.format(lastEnd.atZone(zone))));
    }

    /**
     * @param records every activity of the application, any date
     */
    public static AppDetailReport appDetail(String appName, List<ActivityRecord> records, int topWindowLimit) {
        Objects.requireNonNull(appName, "appName");
        Objects.requireNonNull(records, "records");
        Map<LocalDate, Integer> byDate = new TreeMap<>(Comparator.reverseOrder());
        Map<WindowKey, WindowAccumulator> windows = new LinkedHashMap<>();
        int total = 0;
        for (ActivityRecord record : records) {
            total += record.durationSeconds();
            byDate.merge(record.date(), record.durationSeconds(), Integer::sum);
            windows.computeIfAbsent(WindowKey.of(record), WindowAccumulator::new).add(record);
        }

        List<DayBreakdown> days = new ArrayList<>();
        byDate.forEach((date, seconds) -> days.add(new DayBreakdown(date, seconds)));

        List<WindowDetail> topWindows = windows.values().stream()
                .map(WindowAccumulator::toDetail)
                .sorted(WINDOW_ORDER)
                .limit(topWindowLimit)
                .toList();
        return new AppDetailReport(appName, total, days, topWindows);
    }

    /**
     * One (project, application) row of assigned time.
     */
    public record ProjectTimeRow(
            long brandId,
            String brandName,
            String brandColor,
            long projectId,
            String projectName,
            String projectColor,
            String appName,
            int seconds
    ) {
    }

    /**
     * Groups assigned time by brand and project. Brands and projects without time are dropped.
     */
    public static List<BrandSummary> brandSummaries(List<ProjectTimeRow> rows) {
        Objects.requireNonNull(rows, "rows");
        Map<Long, BrandAccumulator> brands = new LinkedHashMap<>();
        for (ProjectTimeRow row : rows) {
            if (row.seconds() <= 0) {
                continue;
            }
            brands.computeIfAbsent(row.brandId(), id -> new BrandAccumulator(row))
                    .add(row);
        }
        return brands.values().stream()
                .map(BrandAccumulator::toSummary)
                .sorted(Comparator.comparingInt(BrandSummary::totalSeconds).reversed()
                        .thenComparing(BrandSummary::brandName))
                .toList();
    }

    private record WindowKey(String title, Optional<String> url, Optional<String> extraContext) {

        static WindowKey of(ActivityRecord record) {
            return new WindowKey(record.windowTitle(), record.url(), record.extraContext());
        }
    }

    private static final class AppAccumulator {
        private final String appName;
        private final String appId;
        private final Map<WindowKey, WindowAccumulator> windows = new LinkedHashMap<>();
        private int totalSeconds;

        private AppAccumulator(String appName, String appId) {
            this.appName = appName;
            this.appId = appId;
        }

        void add(ActivityRecord record) {
            totalSeconds += record.durationSeconds();
            windows.computeIfAbsent(WindowKey.of(record), WindowAccumulator::new).add(record);
        }

        AppSummary toSummary() {
            List<WindowDetail> details = windows.values().stream()
                    .map(WindowAccumulator::toDetail)
                    .sorted(WINDOW_ORDER)
                    .toList();
            return new AppSummary(appName, appId, totalSeconds, details);
        }
    }

    private static final class BrandAccumulator {
        private final long brandId;
        private final String brandName;
        private final String color;
        private final Map<Long, ProjectAccumulator> projects = new LinkedHashMap<>();

        private BrandAccumulator(ProjectTimeRow row) {
            this.brandId = row.brandId();
            this.brandName = row.brandName();
            this.color = row.brandColor();
        }

        void add(ProjectTimeRow row) {
            projects.computeIfAbsent(row.projectId(), id -> new ProjectAccumulator(row))
                    .apps.merge(row.appName(), row.seconds(), Integer::sum);
        }

        BrandSummary toSummary() {
            List<ProjectSummary> summaries = projects.values().stream()
                    .map(project -> project.toSummary(brandId, brandName))
                    .sorted(Comparator.comparingInt(ProjectSummary::totalSeconds).reversed()
                            .thenComparing(ProjectSummary::projectName))
                    .toList();
            int total = summaries.stream().mapToInt(ProjectSummary::totalSeconds).sum();
            return new BrandSummary(brandId, brandName, color, total, summaries);
        }
    }

    private static final class ProjectAccumulator {
        private final long projectId;
        private final String projectName;
        private final String color;
        private final Map<String, Integer> apps = new LinkedHashMap<>();

        private ProjectAccumulator(ProjectTimeRow row) {
            this.projectId = row.projectId();
            this.projectName = row.projectName();
            this.color = row.projectColor();
        }

        ProjectSummary toSummary(long brandId, String brandName) {
            List<AppBreakdownEntry> breakdown = apps.entrySet().stream()
                    .map(entry -> new AppBreakdownEntry(entry.getKey(), entry.getValue()))
                    .sorted(Comparator.comparingInt(AppBreakdownEntry::seconds).reversed()
                            .thenComparing(AppBreakdownEntry::appName))
                    .toList();
            int total = breakdown.stream().mapToInt(AppBreakdownEntry::seconds).sum();
            return new ProjectSummary(projectId, projectName, brandId, brandName, color, total, breakdown);
        }
    }

    private static final class WindowAccumulator {
        private final WindowKey key;
        private final List<Long> activityIds = new ArrayList<>();
        private int totalSeconds;

        private WindowAccumulator(WindowKey key) {
            this.key = key;
        }

        void add(ActivityRecord record) {
            totalSeconds += record.durationSeconds();
            activityIds.add(record.id());
        }

        WindowDetail toDetail() {
            return new WindowDetail(key.title(), key.url(), key.extraContext(), totalSeconds, activityIds);
        }
    }
}
