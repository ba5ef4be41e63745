package com.activitytracker.lifecycle;

import com.activitytracker.config.AppConfig;
import com.activitytracker.config.ConfigManager;
import com.activitytracker.events.DayChangedEvent;
import com.activitytracker.events.EventChannel;
import com.activitytracker.events.Subscription;
import com.activitytracker.logging.LoggingConfigurator;
import com.activitytracker.model.ActivityRecord;
import com.activitytracker.model.DaySummary;
import com.activitytracker.rules.RuleEngine;
import com.activitytracker.sampling.ForegroundSampler;
import com.activitytracker.sampling.IdleDetector;
import com.activitytracker.sampling.SamplingException;
import com.activitytracker.sampling.WindowSnapshot;
import com.activitytracker.session.Heartbeat;
import com.activitytracker.session.PassiveMediaPolicy;
import com.activitytracker.session.SessionMerger;
import com.activitytracker.storage.ActivityStore;
import com.activitytracker.storage.StorageException;
import com.activitytracker.storage.sqlite.SqliteActivityStore;
import com.activitytracker.suggestion.SuggestionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orchestrates sampling, session merging, persistence and day-rollover classification.
 * <p>
 * The {@code sampler} thread is the only caller of the session merger. Day-change reactions run
 * on the {@code maintenance} thread.
 */
public class ActivityTrackerService implements ActivityTrackerApplication {

    private static final Logger log = LoggerFactory.getLogger(ActivityTrackerService.class);

    private final Path configPath;
    private final ConfigManager configManager;
    private final ForegroundSampler sampler;
    private final IdleDetector idleDetector;
    private final ZoneId zone;
    private final Clock clock;
    private final EventChannel<DayChangedEvent> dayChanges = new EventChannel<>("day-changed");

    private volatile AppConfig config;
    private ActivityStore store;
    private RuleEngine ruleEngine;
    private volatile SuggestionEngine suggestionEngine;
    private volatile SessionMerger merger;
    private Subscription daySubscription;

    private ScheduledExecutorService samplingExecutor;
    private ExecutorService maintenanceExecutor;

    private final Object tickLock = new Object();
    private final AtomicBoolean trackingActive = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public ActivityTrackerService(Path configPath,
                                  ConfigManager configManager,
                                  ForegroundSampler sampler,
                                  IdleDetector idleDetector) {
        this(configPath, configManager, sampler, idleDetector, ZoneId.systemDefault());
    }

    public ActivityTrackerService(Path configPath,
                                  ConfigManager configManager,
                                  ForegroundSampler sampler,
                                  IdleDetector idleDetector,
                                  ZoneId zone) {
        this.configPath = configPath.toAbsolutePath().normalize();
        this.configManager = Objects.requireNonNull(configManager, "configManager");
        this.sampler = Objects.requireNonNull(sampler, "sampler");
        this.idleDetector = Objects.requireNonNull(idleDetector, "idleDetector");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.clock = Clock.system(zone);
    }

    @Override
    public void start() throws Exception {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        this.config = configManager.load(configPath);
        LoggingConfigurator.apply(config.logging());
        log.info("Starting activity tracker");

        this.store = new SqliteActivityStore(config.storage(), clock);
        this.ruleEngine = new RuleEngine(store);
        this.suggestionEngine = new SuggestionEngine(store, config.suggestions(), ruleEngine);
        this.merger = createMerger(config);

        this.maintenanceExecutor = Executors.newSingleThreadExecutor(new NamedThreadFactory("maintenance"));
        this.daySubscription = dayChanges.subscribe(event -> maintenanceExecutor.execute(
                () -> safeExecute(() -> onDayCompleted(event), "day rollover")));
        maintenanceExecutor.execute(() -> safeExecute(this::classifyBacklog, "startup classification"));

        this.trackingActive.set(true);
        scheduleSamplingExecutor();
        configManager.registerListener(newConfig -> {
            if (samplingExecutor != null && !samplingExecutor.isShutdown()) {
                samplingExecutor.execute(() -> safeExecute(() -> applyConfigReload(newConfig), "config reload"));
            }
        });
        try {
            configManager.startWatching(configPath);
        } catch (Exception ex) {
            log.warn("Failed to start configuration watcher", ex);
        }
    }

    private SessionMerger createMerger(AppConfig configuration) {
        Optional<RuleEngine> classifier = configuration.autoClassifyNewSessions()
                ? Optional.of(ruleEngine)
                : Optional.empty();
        return new SessionMerger(store, configuration.samplingIntervalSeconds(),
                configuration.idleThresholdSeconds(), zone, dayChanges, classifier,
                PassiveMediaPolicy.of(configuration.passiveMediaAppIds()));
    }

    private void scheduleSamplingExecutor() {
        if (samplingExecutor != null) {
            samplingExecutor.shutdownNow();
        }
        this.samplingExecutor = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("sampler"));
        long intervalMillis = Math.max(1, config.samplingIntervalSeconds()) * 1000L;
        samplingExecutor.scheduleAtFixedRate(
                () -> safeExecute(this::performSamplingTick, "sampling tick"),
                0,
                intervalMillis,
                TimeUnit.MILLISECONDS
        );
    }

    void performSamplingTick() {
        synchronized (tickLock) {
            if (!trackingActive.get()) {
                return;
            }
            try {
                Optional<WindowSnapshot> snapshot = sampler.sample();
                Duration idle = idleDetector.timeSinceLastInput();
                if (snapshot.isEmpty()) {
                    merger.observe(clock.instant());
                    return;
                }
                merger.process(Heartbeat.of(snapshot.get(), idle));
            } catch (SamplingException ex) {
                log.warn("Sampling failed: {}", ex.getMessage());
            }
        }
    }

    private void onDayCompleted(DayChangedEvent event) {
        try {
            int assigned = ruleEngine.autoAssignUnclassified(event.completedDate());
            DaySummary summary = store.queryDay(event.completedDate());
            log.info("Day {} complete: {} tracked in {} app(s), {} activities classified on rollover",
                    event.completedDateKey(), formatSeconds(summary.totalSeconds()), summary.apps().size(), assigned);
        } catch (StorageException ex) {
            log.error("Failed to finish day {}", event.completedDateKey(), ex);
        }
    }

    private void classifyBacklog() {
        try {
            ruleEngine.autoAssignUnclassified(LocalDate.now(zone));
        } catch (StorageException ex) {
            log.warn("Startup classification failed: {}", ex.getMessage());
        }
    }

    private void applyConfigReload(AppConfig newConfig) {
        AppConfig previous = this.config;
        this.config = newConfig;
        if (previous.equals(newConfig)) {
            log.debug("Configuration reload detected but no changes applied.");
            return;
        }
        log.info("Configuration reloaded from {}", configPath);

        try {
            LoggingConfigurator.apply(newConfig.logging());
        } catch (IOException ex) {
            log.warn("Failed to apply logging configuration after reload", ex);
        }

        boolean samplingIntervalChanged = newConfig.samplingIntervalSeconds() != previous.samplingIntervalSeconds();
        boolean mergerChanged = samplingIntervalChanged
                || newConfig.idleThresholdSeconds() != previous.idleThresholdSeconds()
                || newConfig.autoClassifyNewSessions() != previous.autoClassifyNewSessions()
                || !newConfig.passiveMediaAppIds().equals(previous.passiveMediaAppIds());
        if (mergerChanged) {
            merger.closeSession();
            this.merger = createMerger(newConfig);
        }

        if (!previous.suggestions().equals(newConfig.suggestions())) {
            this.suggestionEngine = new SuggestionEngine(store, newConfig.suggestions(), ruleEngine);
        }

        if (samplingIntervalChanged) {
            scheduleSamplingExecutor();
            log.info("Sampling interval updated to {} second(s)", newConfig.samplingIntervalSeconds());
        }

        if (!previous.storage().equals(newConfig.storage())) {
            log.warn("Storage configuration changed; please restart the application to apply.");
        }
    }

    private void safeExecute(Runnable runnable, String taskName) {
        try {
            runnable.run();
        } catch (Throwable ex) {
            log.error("Error executing {}", taskName, ex);
        }
    }

    @Override
    public void pause() {
        synchronized (tickLock) {
            if (trackingActive.compareAndSet(true, false)) {
                merger.closeSession();
                log.info("Tracking paused");
            }
        }
    }

    @Override
    public void resume() {
        if (trackingActive.compareAndSet(false, true)) {
            log.info("Tracking resumed");
        }
    }

    public boolean isTracking() {
        return trackingActive.get();
    }

    public Optional<ActivityRecord> currentSession() {
        SessionMerger current = merger;
        return current == null ? Optional.empty() : current.currentSession();
    }

    public ActivityStore store() {
        return store;
    }

    public RuleEngine ruleEngine() {
        return ruleEngine;
    }

    public SuggestionEngine suggestionEngine() {
        return suggestionEngine;
    }

    public EventChannel<DayChangedEvent> dayChanges() {
        return dayChanges;
    }

    @Override
    public void stop() throws Exception {
        if (!started.get() || !stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Stopping activity tracker");
        trackingActive.set(false);
        if (samplingExecutor != null) {
            samplingExecutor.shutdownNow();
            samplingExecutor.awaitTermination(5, TimeUnit.SECONDS);
        }
        if (merger != null) {
            merger.closeSession();
        }
        if (daySubscription != null) {
            daySubscription.cancel();
        }
        if (maintenanceExecutor != null) {
            maintenanceExecutor.shutdown();
            if (!maintenanceExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                maintenanceExecutor.shutdownNow();
            }
        }
        sampler.close();
        if (store != null) {
            store.close();
        }
        configManager.close();
    }

    @Override
    public void close() throws Exception {
        stop();
    }

    private static String formatSeconds(int seconds) {
        return String.format("%dh %02dm", seconds / 3600, (seconds % 3600) / 60);
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private int counter = 0;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public synchronized Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + "-" + counter++);
            thread.setDaemon(true);
            return thread;
        }
    }
}
