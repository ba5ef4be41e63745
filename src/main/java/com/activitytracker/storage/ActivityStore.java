package com.activitytracker.storage;

import com.activitytracker.model.ActivityRecord;
import com.activitytracker.model.AppBreakdownEntry;
import com.activitytracker.model.AppDetailReport;
import com.activitytracker.model.Brand;
import com.activitytracker.model.BrandSummary;
import com.activitytracker.model.DayBreakdown;
import com.activitytracker.model.DaySummary;
import com.activitytracker.model.Project;
import com.activitytracker.model.ProjectRule;
import com.activitytracker.model.ProjectSource;
import com.activitytracker.model.RuleDefinition;
import com.activitytracker.model.TimelineEntry;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Activities, the brand/project/rule taxonomy and the dismissed suggestion tokens.
 * <p>
 * Durations and timestamps are written only through {@link ActivityWriter}; every other write
 * touches project assignment or the taxonomy.
 */
public interface ActivityStore extends ActivityWriter, AutoCloseable {

    String DEFAULT_COLOR = "#6366f1";

    // activities

    Optional<ActivityRecord> findActivity(long activityId) throws StorageException;

    /**
     * Sets the project on the given activities regardless of their current assignment.
     *
     * @return number of rows changed
     */
    int assignProject(Collection<Long> activityIds, long projectId, ProjectSource source)
            throws StorageException, ValidationException;

    /**
     * Assigns each activity id to its mapped project, skipping activities that already carry one.
     *
     * @return number of rows changed
     */
    int assignUnassigned(Map<Long, Long> projectByActivity, ProjectSource source) throws StorageException;

    int clearProjectAssignment(Collection<Long> activityIds) throws StorageException;

    // aggregation

    DaySummary queryDay(LocalDate date) throws StorageException;

    /**
     * The seven days ending today. Days without activity are omitted.
     */
    List<DaySummary> queryWeek() throws StorageException;

    /**
     * Day one of the month up to its last day or today, whichever is earlier. Days without
     * activity are omitted.
     */
    List<DaySummary> queryMonth(YearMonth month) throws StorageException;

    default List<DaySummary> queryMonth(int year, int month) throws StorageException {
        return queryMonth(YearMonth.of(year, month));
    }

    /**
     * Inclusive range; days without activity are omitted.
     */
    List<DaySummary> queryDays(LocalDate from, LocalDate to) throws StorageException;

    /**
     * Most recent dates with tracked time, newest first.
     */
    List<DayBreakdown> queryRecentDates(int limit) throws StorageException;

    List<AppBreakdownEntry> queryTopApps(LocalDate date, int limit) throws StorageException;

    AppDetailReport queryApp(String appName) throws StorageException;

    List<TimelineEntry> queryTimeline(LocalDate date) throws StorageException;

    List<BrandSummary> queryDayByProject(LocalDate date) throws StorageException;

    /**
     * Unassigned activities of the date, longest first.
     */
    List<ActivityRecord> queryUnassignedActivities(LocalDate date) throws StorageException;

    /**
     * Unassigned activities of one date, or of all dates when {@code date} is empty, in
     * timestamp order.
     */
    List<ActivityRecord> queryUnassignedRecords(Optional<LocalDate> date) throws StorageException;

    // taxonomy snapshots

    List<Brand> allBrands() throws StorageException;

    List<Project> allProjects() throws StorageException;

    List<ProjectRule> loadAllProjectRules() throws StorageException;

    Optional<Brand> findBrand(long brandId) throws StorageException;

    Optional<Brand> findBrandByName(String name) throws StorageException;

    Optional<Project> findProject(long projectId) throws StorageException;

    Optional<Project> findProjectByName(long brandId, String name) throws StorageException;

    // taxonomy commands

    /**
     * @param color {@code #rgb} or {@code #rrggbb}; {@code null} selects {@link #DEFAULT_COLOR}
     */
    Brand insertBrand(String name, String color) throws StorageException, ValidationException;

    Brand updateBrand(long brandId, Optional<String> name, Optional<String> color)
            throws StorageException, ValidationException;

    /**
     * Deletes the brand with its projects and their rules. Activities assigned to those projects
     * are kept and become unassigned.
     */
    void deleteBrand(long brandId) throws StorageException, ValidationException;

    /**
     * Moves every project of {@code sourceBrandId} under {@code targetBrandId} and deletes the
     * source brand. Project ids and rules are unchanged.
     */
    void mergeBrand(long sourceBrandId, long targetBrandId) throws StorageException, ValidationException;

    Project insertProject(long brandId, String name, String color) throws StorageException, ValidationException;

    Project updateProject(long projectId, Optional<String> name, Optional<String> color, Optional<Long> brandId)
            throws StorageException, ValidationException;

    void deleteProject(long projectId) throws StorageException, ValidationException;

    ProjectRule insertRule(long projectId, RuleDefinition definition) throws StorageException, ValidationException;

    void deleteRule(long ruleId) throws StorageException, ValidationException;

    // dismissed suggestion tokens

    void dismissToken(String token) throws StorageException, ValidationException;

    Set<String> dismissedTokens() throws StorageException;

    /**
     * @return whether the token had been dismissed
     */
    boolean restoreToken(String token) throws StorageException;

    @Override
    void close() throws StorageException;
}
