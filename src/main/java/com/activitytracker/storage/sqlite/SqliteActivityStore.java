package com.activitytracker.storage.sqlite;

import com.activitytracker.config.StorageConfig;
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
import com.activitytracker.model.RuleType;
import com.activitytracker.model.TimelineEntry;
import com.activitytracker.storage.ActivityStore;
import com.activitytracker.storage.RuleDefinitions;
import com.activitytracker.storage.StorageException;
import com.activitytracker.storage.ValidationException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * SQLite-backed {@link ActivityStore}.
 * <p>
 * Writes go through a single connection guarded by {@code writeLock}; every write call is one
 * transaction. Queries use a second, query-only connection under its own lock so that long scans
 * do not hold up the sampler (WAL journal).
 */
public class SqliteActivityStore implements ActivityStore {

    private static final Logger log = LoggerFactory.getLogger(SqliteActivityStore.class);

    private static final int TOP_WINDOW_LIMIT = 20;
    private static final Pattern COLOR_PATTERN = Pattern.compile("^#(?:[0-9a-fA-F]{3}|[0-9a-fA-F]{6})$");

    private static final String ACTIVITY_COLUMNS = """
            id, timestamp, app_name, app_id, window_title, url, extra_context,
            duration_seconds, date, project_id, project_source
            """;

    private final Path databasePath;
    private final Clock clock;
    private final Object writeLock = new Object();
    private final Object readLock = new Object();
    private final Connection writeConnection;
    private final Connection readConnection;

    public SqliteActivityStore(StorageConfig config) throws StorageException {
        this(config, Clock.systemDefaultZone());
    }

    public SqliteActivityStore(StorageConfig config, Clock clock) throws StorageException {
        Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        try {
            this.databasePath = Path.of(config.databasePath()).toAbsolutePath();
            if (databasePath.getParent() != null) {
                Files.createDirectories(databasePath.getParent());
            }
            String url = "jdbc:sqlite:" + databasePath;
            int busyTimeout = config.busyTimeoutMillis() == null ? 5000 : config.busyTimeoutMillis();

            this.writeConnection = DriverManager.getConnection(url);
            configurePragma(writeConnection, config.journalMode(), busyTimeout);
            writeConnection.setAutoCommit(false);
            createSchema(writeConnection);
            writeConnection.commit();

            this.readConnection = DriverManager.getConnection(url);
            configurePragma(readConnection, null, busyTimeout);
            try (Statement statement = readConnection.createStatement()) {
                statement.execute("PRAGMA query_only=ON");
            }
        } catch (Exception ex) {
            throw new StorageException("Failed to initialise SQLite activity store", ex);
        }
        log.info("Activity store opened at {}", databasePath);
    }

    public Path databasePath() {
        return databasePath;
    }

    // ---------------------------------------------------------------- activities

    @Override
    public long insert(ActivityRecord record) throws StorageException {
        Objects.requireNonNull(record, "record");
        return write("insert activity", connection -> {
            try (PreparedStatement statement = connection.prepareStatement("""
                    INSERT INTO activities
                        (timestamp, app_name, app_id, window_title, url, extra_context,
                         duration_seconds, date, project_id, project_source)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """)) {
                statement.setLong(1, record.timestamp().toEpochMilli());
                statement.setString(2, record.appName());
                statement.setString(3, record.appId());
                statement.setString(4, record.windowTitle());
                setOptionalString(statement, 5, record.url());
                setOptionalString(statement, 6, record.extraContext());
                statement.setInt(7, record.durationSeconds());
                statement.setString(8, record.date().toString());
                if (record.projectId().isPresent()) {
                    statement.setLong(9, record.projectId().get());
                } else {
                    statement.setNull(9, Types.INTEGER);
                }
                setOptionalString(statement, 10, record.projectSource().map(ProjectSource::wireName));
                statement.executeUpdate();
                return lastInsertId(connection);
            }
        });
    }

    @Override
    public void updateDuration(long activityId, int durationSeconds) throws StorageException {
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("durationSeconds must be >= 0");
        }
        int updated = write("update activity duration", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "UPDATE activities SET duration_seconds = ? WHERE id = ?")) {
                statement.setInt(1, durationSeconds);
                statement.setLong(2, activityId);
                return statement.executeUpdate();
            }
        });
        if (updated == 0) {
            throw new StorageException("Activity " + activityId + " does not exist");
        }
    }

    @Override
    public Optional<ActivityRecord> findActivity(long activityId) throws StorageException {
        return read("find activity", connection -> {
            List<ActivityRecord> rows = selectActivities(connection,
                    "WHERE id = ?", statement -> statement.setLong(1, activityId));
            return rows.stream().findFirst();
        });
    }

    @Override
    public int assignProject(Collection<Long> activityIds, long projectId, ProjectSource source)
            throws StorageException, ValidationException {
        Objects.requireNonNull(activityIds, "activityIds");
        Objects.requireNonNull(source, "source");
        return validatedWrite("assign project", connection -> {
            requireProject(connection, projectId);
            if (activityIds.isEmpty()) {
                return 0;
            }
            try (PreparedStatement statement = connection.prepareStatement(
                    "UPDATE activities SET project_id = ?, project_source = ? WHERE id = ?")) {
                for (Long activityId : activityIds) {
                    statement.setLong(1, projectId);
                    statement.setString(2, source.wireName());
                    statement.setLong(3, activityId);
                    statement.addBatch();
                }
                return sum(statement.executeBatch());
            }
        });
    }

    @Override
    public int assignUnassigned(Map<Long, Long> projectByActivity, ProjectSource source) throws StorageException {
        Objects.requireNonNull(projectByActivity, "projectByActivity");
        Objects.requireNonNull(source, "source");
        if (projectByActivity.isEmpty()) {
            return 0;
        }
        return write("assign unassigned activities", connection -> {
            try (PreparedStatement statement = connection.prepareStatement("""
                    UPDATE activities SET project_id = ?, project_source = ?
                    WHERE id = ? AND project_id IS NULL
                    """)) {
                for (Map.Entry<Long, Long> entry : projectByActivity.entrySet()) {
                    statement.setLong(1, entry.getValue());
                    statement.setString(2, source.wireName());
                    statement.setLong(3, entry.getKey());
                    statement.addBatch();
                }
                return sum(statement.executeBatch());
            }
        });
    }

    @Override
    public int clearProjectAssignment(Collection<Long> activityIds) throws StorageException {
        Objects.requireNonNull(activityIds, "activityIds");
        if (activityIds.isEmpty()) {
            return 0;
        }
        return write("clear project assignment", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "UPDATE activities SET project_id = NULL, project_source = NULL WHERE id = ?")) {
                for (Long activityId : activityIds) {
                    statement.setLong(1, activityId);
                    statement.addBatch();
                }
                return sum(statement.executeBatch());
            }
        });
    }

    // ---------------------------------------------------------------- aggregation

    @Override
    public DaySummary queryDay(LocalDate date) throws StorageException {
        Objects.requireNonNull(date, "date");
        List<ActivityRecord> rows = read("query day", connection -> selectActivities(connection,
                "WHERE date = ? ORDER BY timestamp, id", statement -> statement.setString(1, date.toString())));
        return DaySummaryAssembler.daySummary(date, rows, clock.getZone());
    }

    @Override
    public List<DaySummary> queryWeek() throws StorageException {
        LocalDate today = LocalDate.now(clock);
        return queryDays(today.minusDays(6), today);
    }

    @Override
    public List<DaySummary> queryMonth(YearMonth month) throws StorageException {
        Objects.requireNonNull(month, "month");
        LocalDate today = LocalDate.now(clock);
        LocalDate start = month.atDay(1);
        if (start.isAfter(today)) {
            return List.of();
        }
        LocalDate end = month.atEndOfMonth().isAfter(today) ? today : month.atEndOfMonth();
        return queryDays(start, end);
    }

    @Override
    public List<DaySummary> queryDays(LocalDate from, LocalDate to) throws StorageException {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (from.isAfter(to)) {
            return List.of();
        }
        List<ActivityRecord> rows = read("query days", connection -> selectActivities(connection,
                "WHERE date BETWEEN ? AND ? ORDER BY date, timestamp, id", statement -> {
                    statement.setString(1, from.toString());
                    statement.setString(2, to.toString());
                }));
        Map<LocalDate, List<ActivityRecord>> byDate = new LinkedHashMap<>();
        for (ActivityRecord row : rows) {
            byDate.computeIfAbsent(row.date(), d -> new ArrayList<>()).add(row);
        }
        List<DaySummary> summaries = new ArrayList<>();
        for (Map.Entry<LocalDate, List<ActivityRecord>> entry : byDate.entrySet()) {
            DaySummary summary = DaySummaryAssembler.daySummary(entry.getKey(), entry.getValue(), clock.getZone());
            if (summary.hasActivity()) {
                summaries.add(summary);
            }
        }
        return summaries;
    }

    @Override
    public List<DayBreakdown> queryRecentDates(int limit) throws StorageException {
        if (limit <= 0) {
            return List.of();
        }
        return read("query recent dates", connection -> {
            try (PreparedStatement statement = connection.prepareStatement("""
                    SELECT date, SUM(duration_seconds) AS total
                    FROM activities
                    GROUP BY date
                    HAVING total > 0
                    ORDER BY date DESC
                    LIMIT ?
                    """)) {
                statement.setInt(1, limit);
                List<DayBreakdown> result = new ArrayList<>();
                try (ResultSet rs = statement.executeQuery()) {
                    while (rs.next()) {
                        result.add(new DayBreakdown(LocalDate.parse(rs.getString("date")), rs.getInt("total")));
                    }
                }
                return result;
            }
        });
    }

    @Override
    public List<AppBreakdownEntry> queryTopApps(LocalDate date, int limit) throws StorageException {
        Objects.requireNonNull(date, "date");
        if (limit <= 0) {
            return List.of();
        }
        return read("query top apps", connection -> {
            try (PreparedStatement statement = connection.prepareStatement("""
                    SELECT app_name, SUM(duration_seconds) AS total
                    FROM activities
                    WHERE date = ?
                    GROUP BY app_name
                    HAVING total > 0
                    ORDER BY total DESC, app_name
                    LIMIT ?
                    """)) {
                statement.setString(1, date.toString());
                statement.setInt(2, limit);
                List<AppBreakdownEntry> result = new ArrayList<>();
                try (ResultSet rs = statement.executeQuery()) {
                    while (rs.next()) {
                        result.add(new AppBreakdownEntry(rs.getString("app_name"), rs.getInt("total")));
                    }
                }
                return result;
            }
        });
    }

    @Override
    public AppDetailReport queryApp(String appName) throws StorageException {
        Objects.requireNonNull(appName, "appName");
        List<ActivityRecord> rows = read("query app", connection -> selectActivities(connection,
                "WHERE app_name = ? ORDER BY timestamp, id", statement -> statement.setString(1, appName)));
        return DaySummaryAssembler.appDetail(appName, rows, TOP_WINDOW_LIMIT);
    }

    @Override
    public List<TimelineEntry> queryTimeline(LocalDate date) throws StorageException {
        Objects.requireNonNull(date, "date");
        List<ActivityRecord> rows = read("query timeline", connection -> selectActivities(connection,
                "WHERE date = ? ORDER BY timestamp, id", statement -> statement.setString(1, date.toString())));
        return rows.stream()
                .map(row -> new TimelineEntry(row.id(), row.timestamp(), row.appName(), row.windowTitle(),
                        row.url(), row.extraContext(), row.durationSeconds(), row.projectId()))
                .toList();
    }

    @Override
    public List<BrandSummary> queryDayByProject(LocalDate date) throws StorageException {
        Objects.requireNonNull(date, "date");
        List<DaySummaryAssembler.ProjectTimeRow> rows = read("query day by project", connection -> {
            try (PreparedStatement statement = connection.prepareStatement("""
                    SELECT b.id AS brand_id, b.name AS brand_name, b.color AS brand_color,
                           p.id AS project_id, p.name AS project_name, p.color AS project_color,
                           a.app_name, SUM(a.duration_seconds) AS seconds
                    FROM activities a
                    JOIN projects p ON p.id = a.project_id
                    JOIN brands b ON b.id = p.brand_id
                    WHERE a.date = ?
                    GROUP BY p.id, a.app_name
                    """)) {
                statement.setString(1, date.toString());
                List<DaySummaryAssembler.ProjectTimeRow> result = new ArrayList<>();
                try (ResultSet rs = statement.executeQuery()) {
                    while (rs.next()) {
                        result.add(new DaySummaryAssembler.ProjectTimeRow(
                                rs.getLong("brand_id"),
                                rs.getString("brand_name"),
                                rs.getString("brand_color"),
                                rs.getLong("project_id"),
                                rs.getString("project_name"),
                                rs.getString("project_color"),
                                rs.getString("app_name"),
                                rs.getInt("seconds")));
                    }
                }
                return result;
            }
        });
        return DaySummaryAssembler.brandSummaries(rows);
    }

    @Override
    public List<ActivityRecord> queryUnassignedActivities(LocalDate date) throws StorageException {
        Objects.requireNonNull(date, "date");
        return read("query unassigned activities", connection -> selectActivities(connection,
                "WHERE date = ? AND project_id IS NULL ORDER BY duration_seconds DESC, id",
                statement -> statement.setString(1, date.toString())));
    }

    @Override
    public List<ActivityRecord> queryUnassignedRecords(Optional<LocalDate> date) throws StorageException {
        Objects.requireNonNull(date, "date");
        return read("query unassigned records", connection -> {
            if (date.isPresent()) {
                return selectActivities(connection,
                        "WHERE date = ? AND project_id IS NULL ORDER BY timestamp, id",
                        statement -> statement.setString(1, date.get().toString()));
            }
            return selectActivities(connection, "WHERE project_id IS NULL ORDER BY timestamp, id", statement -> {
            });
        });
    }

    // ---------------------------------------------------------------- taxonomy snapshots

    @Override
    public List<Brand> allBrands() throws StorageException {
        return read("load brands", connection -> selectBrands(connection, "ORDER BY sort_order, id", statement -> {
        }));
    }

    @Override
    public List<Project> allProjects() throws StorageException {
        return read("load projects", connection -> selectProjects(connection,
                "ORDER BY brand_id, sort_order, id", statement -> {
                }));
    }

    @Override
    public List<ProjectRule> loadAllProjectRules() throws StorageException {
        return read("load project rules", connection -> selectRules(connection, "ORDER BY priority, id"));
    }

    @Override
    public Optional<Brand> findBrand(long brandId) throws StorageException {
        return read("find brand", connection -> selectBrand(connection, brandId));
    }

    @Override
    public Optional<Brand> findBrandByName(String name) throws StorageException {
        if (StringUtils.isBlank(name)) {
            return Optional.empty();
        }
        return read("find brand by name", connection -> selectBrandByName(connection, name.trim()));
    }

    @Override
    public Optional<Project> findProject(long projectId) throws StorageException {
        return read("find project", connection -> selectProject(connection, projectId));
    }

    @Override
    public Optional<Project> findProjectByName(long brandId, String name) throws StorageException {
        if (StringUtils.isBlank(name)) {
            return Optional.empty();
        }
        return read("find project by name", connection -> selectProjectByName(connection, brandId, name.trim()));
    }

    // ---------------------------------------------------------------- taxonomy commands

    @Override
    public Brand insertBrand(String name, String color) throws StorageException, ValidationException {
        String brandName = requireName(name, "Brand name");
        String brandColor = normalizeColor(color);
        return validatedWrite("insert brand", connection -> {
            if (selectBrandByName(connection, brandName).isPresent()) {
                throw new ValidationException("Brand '" + brandName + "' already exists");
            }
            int sortOrder = count(connection, "SELECT COUNT(*) FROM brands", statement -> {
            });
            try (PreparedStatement statement = connection.prepareStatement(
                    "INSERT INTO brands (name, color, sort_order) VALUES (?, ?, ?)")) {
                statement.setString(1, brandName);
                statement.setString(2, brandColor);
                statement.setInt(3, sortOrder);
                statement.executeUpdate();
                Brand brand = new Brand(lastInsertId(connection), brandName, brandColor, sortOrder);
                log.info("Created brand '{}' (id {})", brand.name(), brand.id());
                return brand;
            }
        });
    }

    @Override
    public Brand updateBrand(long brandId, Optional<String> name, Optional<String> color)
            throws StorageException, ValidationException {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(color, "color");
        String newName = name.isPresent() ? requireName(name.get(), "Brand name") : null;
        String newColor = color.isPresent() ? normalizeColor(color.get()) : null;
        return validatedWrite("update brand", connection -> {
            Brand existing = requireBrand(connection, brandId);
            String resolvedName = newName == null ? existing.name() : newName;
            String resolvedColor = newColor == null ? existing.color() : newColor;
            Optional<Brand> clash = selectBrandByName(connection, resolvedName);
            if (clash.isPresent() && clash.get().id() != brandId) {
                throw new ValidationException("Brand '" + resolvedName + "' already exists");
            }
            try (PreparedStatement statement = connection.prepareStatement(
                    "UPDATE brands SET name = ?, color = ? WHERE id = ?")) {
                statement.setString(1, resolvedName);
                statement.setString(2, resolvedColor);
                statement.setLong(3, brandId);
                statement.executeUpdate();
            }
            return new Brand(brandId, resolvedName, resolvedColor, existing.sortOrder());
        });
    }

    @Override
    public void deleteBrand(long brandId) throws StorageException, ValidationException {
        validatedWrite("delete brand", connection -> {
            Brand brand = requireBrand(connection, brandId);
            int cleared = execute(connection, """
                    UPDATE activities SET project_id = NULL, project_source = NULL
                    WHERE project_id IN (SELECT id FROM projects WHERE brand_id = ?)
                    """, brandId);
            execute(connection, "DELETE FROM project_rules WHERE project_id IN (SELECT id FROM projects WHERE brand_id = ?)",
                    brandId);
            execute(connection, "DELETE FROM projects WHERE brand_id = ?", brandId);
            execute(connection, "DELETE FROM brands WHERE id = ?", brandId);
            log.info("Deleted brand '{}' (id {}); {} activities unassigned", brand.name(), brandId, cleared);
            return null;
        });
    }

    @Override
    public void mergeBrand(long sourceBrandId, long targetBrandId) throws StorageException, ValidationException {
        if (sourceBrandId == targetBrandId) {
            throw new ValidationException("Cannot merge a brand into itself");
        }
        validatedWrite("merge brands", connection -> {
            Brand source = requireBrand(connection, sourceBrandId);
            Brand target = requireBrand(connection, targetBrandId);
            List<Project> moving = selectProjects(connection, "WHERE brand_id = ? ORDER BY sort_order, id",
                    statement -> statement.setLong(1, sourceBrandId));
            for (Project project : moving) {
                if (selectProjectByName(connection, targetBrandId, project.name()).isPresent()) {
                    throw new ValidationException("Brand '" + target.name() + "' already has a project named '"
                            + project.name() + "'");
                }
            }
            int offset = count(connection, "SELECT COUNT(*) FROM projects WHERE brand_id = ?",
                    statement -> statement.setLong(1, targetBrandId));
            try (PreparedStatement statement = connection.prepareStatement(
                    "UPDATE projects SET brand_id = ?, sort_order = sort_order + ? WHERE brand_id = ?")) {
                statement.setLong(1, targetBrandId);
                statement.setInt(2, offset);
                statement.setLong(3, sourceBrandId);
                statement.executeUpdate();
            }
            execute(connection, "DELETE FROM brands WHERE id = ?", sourceBrandId);
            log.info("Merged brand '{}' into '{}' ({} projects moved)", source.name(), target.name(), moving.size());
            return null;
        });
    }

    @Override
    public Project insertProject(long brandId, String name, String color) throws StorageException, ValidationException {
        String projectName = requireName(name, "Project name");
        String projectColor = normalizeColor(color);
        return validatedWrite("insert project", connection -> {
            Brand brand = requireBrand(connection, brandId);
            if (selectProjectByName(connection, brandId, projectName).isPresent()) {
                throw new ValidationException("Brand '" + brand.name() + "' already has a project named '"
                        + projectName + "'");
            }
            int sortOrder = count(connection, "SELECT COUNT(*) FROM projects WHERE brand_id = ?",
                    statement -> statement.setLong(1, brandId));
            try (PreparedStatement statement = connection.prepareStatement(
                    "INSERT INTO projects (brand_id, name, color, sort_order) VALUES (?, ?, ?, ?)")) {
                statement.setLong(1, brandId);
                statement.setString(2, projectName);
                statement.setString(3, projectColor);
                statement.setInt(4, sortOrder);
                statement.executeUpdate();
                Project project = new Project(lastInsertId(connection), brandId, projectName, projectColor, sortOrder);
                log.info("Created project '{}' under '{}' (id {})", projectName, brand.name(), project.id());
                return project;
            }
        });
    }

    @Override
    public Project updateProject(long projectId, Optional<String> name, Optional<String> color, Optional<Long> brandId)
            throws StorageException, ValidationException {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(brandId, "brandId");
        String newName = name.isPresent() ? requireName(name.get(), "Project name") : null;
        String newColor = color.isPresent() ? normalizeColor(color.get()) : null;
        return validatedWrite("update project", connection -> {
            Project existing = requireProject(connection, projectId);
            long targetBrandId = brandId.orElse(existing.brandId());
            Brand targetBrand = requireBrand(connection, targetBrandId);
            String resolvedName = newName == null ? existing.name() : newName;
            String resolvedColor = newColor == null ? existing.color() : newColor;
            Optional<Project> clash = selectProjectByName(connection, targetBrandId, resolvedName);
            if (clash.isPresent() && clash.get().id() != projectId) {
                throw new ValidationException("Brand '" + targetBrand.name() + "' already has a project named '"
                        + resolvedName + "'");
            }
            int sortOrder = targetBrandId == existing.brandId()
                    ? existing.sortOrder()
                    : count(connection, "SELECT COUNT(*) FROM projects WHERE brand_id = ?",
                    statement -> statement.setLong(1, targetBrandId));
            try (PreparedStatement statement = connection.prepareStatement(
                    "UPDATE projects SET brand_id = ?, name = ?, color = ?, sort_order = ? WHERE id = ?")) {
                statement.setLong(1, targetBrandId);
                statement.setString(2, resolvedName);
                statement.setString(3, resolvedColor);
                statement.setInt(4, sortOrder);
                statement.setLong(5, projectId);
                statement.executeUpdate();
            }
            return new Project(projectId, targetBrandId, resolvedName, resolvedColor, sortOrder);
        });
    }

    @Override
    public void deleteProject(long projectId) throws StorageException, ValidationException {
        validatedWrite("delete project", connection -> {
            Project project = requireProject(connection, projectId);
            int cleared = execute(connection,
                    "UPDATE activities SET project_id = NULL, project_source = NULL WHERE project_id = ?", projectId);
            execute(connection, "DELETE FROM project_rules WHERE project_id = ?", projectId);
            execute(connection, "DELETE FROM projects WHERE id = ?", projectId);
            log.info("Deleted project '{}' (id {}); {} activities unassigned", project.name(), projectId, cleared);
            return null;
        });
    }

    @Override
    public ProjectRule insertRule(long projectId, RuleDefinition definition) throws StorageException, ValidationException {
        RuleDefinition normalized = RuleDefinitions.normalize(definition);
        String pattern = normalized.pattern();
        return validatedWrite("insert rule", connection -> {
            requireProject(connection, projectId);
            try (PreparedStatement statement = connection.prepareStatement("""
                    INSERT INTO project_rules (project_id, rule_type, pattern, is_regex, priority)
                    VALUES (?, ?, ?, ?, ?)
                    """)) {
                statement.setLong(1, projectId);
                statement.setString(2, definition.ruleType().wireName());
                statement.setString(3, pattern);
                statement.setInt(4, definition.regex() ? 1 : 0);
                statement.setInt(5, definition.priority());
                statement.executeUpdate();
                ProjectRule rule = new ProjectRule(lastInsertId(connection), projectId, definition.ruleType(), pattern,
                        definition.regex(), definition.priority());
                log.debug("Inserted rule {}", rule);
                return rule;
            }
        });
    }

    @Override
    public void deleteRule(long ruleId) throws StorageException, ValidationException {
        validatedWrite("delete rule", connection -> {
            if (execute(connection, "DELETE FROM project_rules WHERE id = ?", ruleId) == 0) {
                throw new ValidationException("Unknown rule id " + ruleId);
            }
            return null;
        });
    }

    // ---------------------------------------------------------------- dismissed tokens

    @Override
    public void dismissToken(String token) throws StorageException, ValidationException {
        if (StringUtils.isBlank(token)) {
            throw new ValidationException("Suggestion token must not be blank");
        }
        write("dismiss suggestion token", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "INSERT OR IGNORE INTO dismissed_suggestions (token) VALUES (?)")) {
                statement.setString(1, token);
                return statement.executeUpdate();
            }
        });
    }

    @Override
    public Set<String> dismissedTokens() throws StorageException {
        return read("load dismissed tokens", connection -> {
            Set<String> tokens = new TreeSet<>();
            try (Statement statement = connection.createStatement();
                 ResultSet rs = statement.executeQuery("SELECT token FROM dismissed_suggestions")) {
                while (rs.next()) {
                    tokens.add(rs.getString("token"));
                }
            }
            return tokens;
        });
    }

    @Override
    public boolean restoreToken(String token) throws StorageException {
        if (StringUtils.isBlank(token)) {
            return false;
        }
        int removed = write("restore suggestion token", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "DELETE FROM dismissed_suggestions WHERE token = ?")) {
                statement.setString(1, token);
                return statement.executeUpdate();
            }
        });
        return removed > 0;
    }

    @Override
    public void close() throws StorageException {
        synchronized (readLock) {
            closeQuietly(readConnection, "read");
        }
        synchronized (writeLock) {
            closeQuietly(writeConnection, "write");
        }
        log.info("Activity store closed");
    }

    // ---------------------------------------------------------------- transaction plumbing

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection connection) throws SQLException;
    }

    @FunctionalInterface
    private interface ValidatedWork<T> {
        T run(Connection connection) throws SQLException, ValidationException;
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement statement) throws SQLException;
    }

    private <T> T read(String action, SqlWork<T> work) throws StorageException {
        synchronized (readLock) {
            try {
                return work.run(readConnection);
            } catch (SQLException ex) {
                throw new StorageException("Failed to " + action, ex);
            }
        }
    }

    private <T> T write(String action, SqlWork<T> work) throws StorageException {
        synchronized (writeLock) {
            try {
                T result = work.run(writeConnection);
                writeConnection.commit();
                return result;
            } catch (SQLException ex) {
                rollback();
                throw new StorageException("Failed to " + action, ex);
            } catch (RuntimeException ex) {
                rollback();
                throw ex;
            }
        }
    }

    private <T> T validatedWrite(String action, ValidatedWork<T> work) throws StorageException, ValidationException {
        synchronized (writeLock) {
            try {
                T result = work.run(writeConnection);
                writeConnection.commit();
                return result;
            } catch (SQLException ex) {
                rollback();
                throw new StorageException("Failed to " + action, ex);
            } catch (ValidationException | RuntimeException ex) {
                rollback();
                throw ex;
            }
        }
    }

    private void rollback() {
        try {
            writeConnection.rollback();
        } catch (SQLException rollbackEx) {
            log.warn("SQLite rollback failed", rollbackEx);
        }
    }

    private static void closeQuietly(Connection connection, String label) {
        try {
            if (connection != null) {
                connection.close();
            }
        } catch (SQLException ex) {
            log.debug("Failed to close SQLite {} connection", label, ex);
        }
    }

    // ---------------------------------------------------------------- row access

    private static List<ActivityRecord> selectActivities(Connection connection, String clause, Binder binder)
            throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT " + ACTIVITY_COLUMNS + " FROM activities " + clause)) {
            binder.bind(statement);
            List<ActivityRecord> result = new ArrayList<>();
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    result.add(mapActivity(rs));
                }
            }
            return result;
        }
    }

    private static ActivityRecord mapActivity(ResultSet rs) throws SQLException {
        long projectId = rs.getLong("project_id");
        Optional<Long> project = rs.wasNull() ? Optional.empty() : Optional.of(projectId);
        Optional<ProjectSource> source = Optional.ofNullable(rs.getString("project_source"))
                .flatMap(ProjectSource::fromWireName);
        return new ActivityRecord(
                rs.getLong("id"),
                Instant.ofEpochMilli(rs.getLong("timestamp")),
                rs.getString("app_name"),
                rs.getString("app_id"),
                rs.getString("window_title"),
                Optional.ofNullable(rs.getString("url")),
                Optional.ofNullable(rs.getString("extra_context")),
                rs.getInt("duration_seconds"),
                LocalDate.parse(rs.getString("date")),
                project,
                source);
    }

    private static List<Brand> selectBrands(Connection connection, String clause, Binder binder) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT id, name, color, sort_order FROM brands " + clause)) {
            binder.bind(statement);
            List<Brand> result = new ArrayList<>();
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    result.add(new Brand(rs.getLong("id"), rs.getString("name"), rs.getString("color"),
                            rs.getInt("sort_order")));
                }
            }
            return result;
        }
    }

    private static Optional<Brand> selectBrand(Connection connection, long brandId) throws SQLException {
        return selectBrands(connection, "WHERE id = ?", statement -> statement.setLong(1, brandId))
                .stream().findFirst();
    }

    private static Optional<Brand> selectBrandByName(Connection connection, String name) throws SQLException {
        return selectBrands(connection, "WHERE name = ? COLLATE NOCASE", statement -> statement.setString(1, name))
                .stream().findFirst();
    }

    private static List<Project> selectProjects(Connection connection, String clause, Binder binder)
            throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT id, brand_id, name, color, sort_order FROM projects " + clause)) {
            binder.bind(statement);
            List<Project> result = new ArrayList<>();
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    result.add(new Project(rs.getLong("id"), rs.getLong("brand_id"), rs.getString("name"),
                            rs.getString("color"), rs.getInt("sort_order")));
                }
            }
            return result;
        }
    }

    private static Optional<Project> selectProject(Connection connection, long projectId) throws SQLException {
        return selectProjects(connection, "WHERE id = ?", statement -> statement.setLong(1, projectId))
                .stream().findFirst();
    }

    private static Optional<Project> selectProjectByName(Connection connection, long brandId, String name)
            throws SQLException {
        return selectProjects(connection, "WHERE brand_id = ? AND name = ? COLLATE NOCASE", statement -> {
            statement.setLong(1, brandId);
            statement.setString(2, name);
        }).stream().findFirst();
    }

    private static List<ProjectRule> selectRules(Connection connection, String clause) throws SQLException {
        List<ProjectRule> result = new ArrayList<>();
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(
                     "SELECT id, project_id, rule_type, pattern, is_regex, priority FROM project_rules " + clause)) {
            while (rs.next()) {
                String typeName = rs.getString("rule_type");
                Optional<RuleType> type = RuleType.fromWireName(typeName);
                if (type.isEmpty()) {
                    log.warn("Skipping rule {} with unknown type '{}'", rs.getLong("id"), typeName);
                    continue;
                }
                result.add(new ProjectRule(rs.getLong("id"), rs.getLong("project_id"), type.get(),
                        rs.getString("pattern"), rs.getInt("is_regex") != 0, rs.getInt("priority")));
            }
        }
        return result;
    }

    private static Brand requireBrand(Connection connection, long brandId) throws SQLException, ValidationException {
        return selectBrand(connection, brandId)
                .orElseThrow(() -> new ValidationException("Unknown brand id " + brandId));
    }

    private static Project requireProject(Connection connection, long projectId)
            throws SQLException, ValidationException {
        return selectProject(connection, projectId)
                .orElseThrow(() -> new ValidationException("Unknown project id " + projectId));
    }

    private static int count(Connection connection, String sql, Binder binder) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            binder.bind(statement);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    private static int execute(Connection connection, String sql, long id) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, id);
            return statement.executeUpdate();
        }
    }

    private static long lastInsertId(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery("SELECT last_insert_rowid()")) {
            if (!rs.next()) {
                throw new SQLException("No id generated");
            }
            return rs.getLong(1);
        }
    }

    private static void setOptionalString(PreparedStatement statement, int index, Optional<String> value)
            throws SQLException {
        if (value.isPresent()) {
            statement.setString(index, value.get());
        } else {
            statement.setNull(index, Types.VARCHAR);
        }
    }

    private static int sum(int[] updateCounts) {
        int total = 0;
        for (int count : updateCounts) {
            if (count > 0) {
                total += count;
            }
        }
        return total;
    }

    private static String requireName(String name, String label) throws ValidationException {
        if (StringUtils.isBlank(name)) {
            throw new ValidationException(label + " must not be blank");
        }
        return name.trim();
    }

    private static String normalizeColor(String color) throws ValidationException {
        if (StringUtils.isBlank(color)) {
            return DEFAULT_COLOR;
        }
        String trimmed = color.trim();
        if (!COLOR_PATTERN.matcher(trimmed).matches()) {
            throw new ValidationException("Invalid color '" + color + "', expected #rgb or #rrggbb");
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    // ---------------------------------------------------------------- schema

    private void configurePragma(Connection connection, String journalMode, int busyTimeoutMillis)
            throws SQLException {
        try (Statement statement = connection.createStatement()) {
            if (StringUtils.isNotBlank(journalMode)) {
                statement.execute("PRAGMA journal_mode=" + journalMode.trim().toUpperCase(Locale.ROOT));
            }
            statement.execute("PRAGMA synchronous=NORMAL");
            statement.execute("PRAGMA busy_timeout=" + Math.max(0, busyTimeoutMillis));
            statement.execute("PRAGMA foreign_keys=ON");
        }
    }

    private void createSchema(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("""
                    CREATE TABLE IF NOT EXISTS brands (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        name TEXT NOT NULL COLLATE NOCASE UNIQUE,
                        color TEXT NOT NULL DEFAULT '#6366f1',
                        sort_order INTEGER NOT NULL DEFAULT 0,
                        created_at TEXT NOT NULL DEFAULT (datetime('now'))
                    )
                    """);
            statement.execute("""
                    CREATE TABLE IF NOT EXISTS projects (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        brand_id INTEGER NOT NULL REFERENCES brands(id) ON DELETE CASCADE,
                        name TEXT NOT NULL COLLATE NOCASE,
                        color TEXT NOT NULL DEFAULT '#6366f1',
                        sort_order INTEGER NOT NULL DEFAULT 0,
                        created_at TEXT NOT NULL DEFAULT (datetime('now')),
                        UNIQUE (brand_id, name)
                    )
                    """);
            statement.execute("""
                    CREATE TABLE IF NOT EXISTS project_rules (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        project_id INTEGER NOT NULL REFERENCES projects(id) ON DELETE CASCADE,
                        rule_type TEXT NOT NULL,
                        pattern TEXT NOT NULL,
                        is_regex INTEGER NOT NULL DEFAULT 0,
                        priority INTEGER NOT NULL DEFAULT 0,
                        created_at TEXT NOT NULL DEFAULT (datetime('now'))
                    )
                    """);
            statement.execute("""
                    CREATE TABLE IF NOT EXISTS activities (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        timestamp INTEGER NOT NULL,
                        app_name TEXT NOT NULL,
                        app_id TEXT NOT NULL,
                        window_title TEXT NOT NULL,
                        url TEXT,
                        extra_context TEXT,
                        duration_seconds INTEGER NOT NULL DEFAULT 0,
                        date TEXT NOT NULL,
                        project_id INTEGER REFERENCES projects(id) ON DELETE SET NULL,
                        project_source TEXT
                    )
                    """);
            statement.execute("""
                    CREATE TABLE IF NOT EXISTS dismissed_suggestions (
                        token TEXT PRIMARY KEY,
                        dismissed_at TEXT NOT NULL DEFAULT (datetime('now'))
                    )
                    """);
            statement.execute("CREATE INDEX IF NOT EXISTS idx_activities_date ON activities(date)");
            statement.execute("CREATE INDEX IF NOT EXISTS idx_activities_app ON activities(app_name)");
            statement.execute("CREATE INDEX IF NOT EXISTS idx_activities_project ON activities(project_id)");
        }
    }
}
