package com.activitytracker.session;

import com.activitytracker.events.DayChangedEvent;
import com.activitytracker.events.EventChannel;
import com.activitytracker.model.ActivityRecord;
import com.activitytracker.model.ProjectSource;
import com.activitytracker.rules.RuleEngine;
import com.activitytracker.storage.ActivityWriter;
import com.activitytracker.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns the heartbeat stream into activity records.
 * <p>
 * At most one session is open. A heartbeat with the open session's identity extends it by one
 * sampling interval; any other heartbeat closes it and opens a new one. Idle heartbeats close the
 * session without opening another, unless the open session is passive media, and a session never
 * spans two local dates. Store failures are logged and swallowed here so the sampling loop keeps
 * running.
 */
public class SessionMerger {

    private static final Logger log = LoggerFactory.getLogger(SessionMerger.class);

    private final ActivityWriter writer;
    private final int intervalSeconds;
    private final int idleThresholdSeconds;
    private final ZoneId zone;
    private final EventChannel<DayChangedEvent> dayChanges;
    private final Optional<RuleEngine> ruleEngine;
    private final PassiveMediaPolicy passiveMedia;

    private OpenSession open;
    private LocalDate lastObservedDate;

    public SessionMerger(ActivityWriter writer,
                         int intervalSeconds,
                         int idleThresholdSeconds,
                         ZoneId zone,
                         EventChannel<DayChangedEvent> dayChanges,
                         Optional<RuleEngine> ruleEngine) {
        this(writer, intervalSeconds, idleThresholdSeconds, zone, dayChanges, ruleEngine, PassiveMediaPolicy.none());
    }

    public SessionMerger(ActivityWriter writer,
                         int intervalSeconds,
                         int idleThresholdSeconds,
                         ZoneId zone,
                         EventChannel<DayChangedEvent> dayChanges,
                         Optional<RuleEngine> ruleEngine,
                         PassiveMediaPolicy passiveMedia) {
        this.writer = Objects.requireNonNull(writer, "writer");
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("intervalSeconds must be > 0");
        }
        if (idleThresholdSeconds <= 0) {
            throw new IllegalArgumentException("idleThresholdSeconds must be > 0");
        }
        this.intervalSeconds = intervalSeconds;
        this.idleThresholdSeconds = idleThresholdSeconds;
        this.zone = Objects.requireNonNull(zone, "zone");
        this.dayChanges = Objects.requireNonNull(dayChanges, "dayChanges");
        this.ruleEngine = Objects.requireNonNull(ruleEngine, "ruleEngine");
        this.passiveMedia = Objects.requireNonNull(passiveMedia, "passiveMedia");
    }

    public synchronized void process(Heartbeat heartbeat) {
        Objects.requireNonNull(heartbeat, "heartbeat");
        LocalDate date = LocalDate.ofInstant(heartbeat.timestamp(), zone);
        handleDateChange(date);

        if (heartbeat.idleSeconds() >= idleThresholdSeconds && !openSessionIsPassive()) {
            if (open != null) {
                log.debug("Idle for {}s, closing session {}", heartbeat.idleSeconds(), open.record.id());
                closeOpenSession();
            }
            return;
        }

        SessionIdentity identity = heartbeat.identity();
        if (open != null && open.identity.equals(identity)) {
            extend();
            return;
        }
        if (open != null) {
            closeOpenSession();
        }
        openSession(heartbeat, identity, date);
    }

    /**
     * Advances the merger's clock without a heartbeat, for ticks where no window can be
     * attributed. Closes the open session and publishes a pending day change.
     */
    public synchronized void observe(Instant now) {
        Objects.requireNonNull(now, "now");
        handleDateChange(LocalDate.ofInstant(now, zone));
        if (open != null) {
            closeOpenSession();
        }
    }

    /**
     * Finalises the open session, if any. The merger is Idle afterwards.
     */
    public synchronized void closeSession() {
        if (open != null) {
            closeOpenSession();
        }
    }

    /**
     * The open session with its current duration.
     */
    public synchronized Optional<ActivityRecord> currentSession() {
        if (open == null) {
            return Optional.empty();
        }
        ActivityRecord record = open.record;
        return Optional.of(new ActivityRecord(record.id(), record.timestamp(), record.appName(), record.appId(),
                record.windowTitle(), record.url(), record.extraContext(), open.durationSeconds, record.date(),
                record.projectId(), record.projectSource()));
    }

    private boolean openSessionIsPassive() {
        return open != null && passiveMedia.isPassive(open.record.appId(), open.record.windowTitle());
    }

    private void handleDateChange(LocalDate date) {
        if (open != null && !open.record.date().equals(date)) {
            log.debug("Session {} reached the end of {}", open.record.id(), open.record.date());
            closeOpenSession();
        }
        if (lastObservedDate == null) {
            lastObservedDate = date;
            return;
        }
        if (date.isAfter(lastObservedDate)) {
            DayChangedEvent event = new DayChangedEvent(lastObservedDate, date);
            lastObservedDate = date;
            log.info("Day changed: {} -> {}", event.completedDate(), event.newDate());
            dayChanges.publish(event);
        }
    }

    private void extend() {
        open.durationSeconds += intervalSeconds;
        try {
            writer.updateDuration(open.record.id(), open.durationSeconds);
            open.dirty = false;
        } catch (StorageException ex) {
            open.dirty = true;
            log.warn("Failed to extend activity {} to {}s: {}", open.record.id(), open.durationSeconds, ex.getMessage());
        }
    }

    private void openSession(Heartbeat heartbeat, SessionIdentity identity, LocalDate date) {
        ActivityRecord record = ActivityRecord.unsaved(heartbeat.timestamp(), date, heartbeat.appName(),
                heartbeat.appId(), heartbeat.windowTitle(), heartbeat.url(), heartbeat.extraContext(), intervalSeconds);
        if (ruleEngine.isPresent()) {
            try {
                Optional<Long> projectId = ruleEngine.get().match(record);
                if (projectId.isPresent()) {
                    record = record.withProject(projectId.get(), ProjectSource.AUTO_RULE);
                }
            } catch (StorageException ex) {
                log.warn("Rule lookup failed, recording activity unassigned: {}", ex.getMessage());
            }
        }
        try {
            long id = writer.insert(record);
            open = new OpenSession(identity, record.withId(id));
            log.debug("Opened session {} for {} - {}", id, record.appName(), record.windowTitle());
        } catch (StorageException ex) {
            open = null;
            log.error("Failed to record activity for {}", record.appName(), ex);
        }
    }

    private void closeOpenSession() {
        OpenSession closing = open;
        open = null;
        if (!closing.dirty) {
            return;
        }
        try {
            writer.updateDuration(closing.record.id(), closing.durationSeconds);
        } catch (StorageException ex) {
            log.error("Failed to finalise activity {} at {}s", closing.record.id(), closing.durationSeconds, ex);
        }
    }

    private static final class OpenSession {
        private final SessionIdentity identity;
        private final ActivityRecord record;
        private int durationSeconds;
        private boolean dirty;

        private OpenSession(SessionIdentity identity, ActivityRecord record) {
            this.identity = identity;
            this.record = record;
            this.durationSeconds = record.durationSeconds();
        }
    }
}
