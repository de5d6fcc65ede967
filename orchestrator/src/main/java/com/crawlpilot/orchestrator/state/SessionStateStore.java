package com.crawlpilot.orchestrator.state;

import com.crawlpilot.orchestrator.model.CrawlError;
import com.crawlpilot.orchestrator.model.SessionMetadata;
import com.crawlpilot.orchestrator.model.SessionState;
import com.crawlpilot.orchestrator.model.SessionStatistics;
import com.crawlpilot.orchestrator.model.SessionStatus;
import com.crawlpilot.orchestrator.model.SessionStatusValue;
import com.crawlpilot.orchestrator.model.StepNames;
import com.crawlpilot.orchestrator.step.StepResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * In-memory registry of crawl sessions.
 *
 * The only object mutated by concurrently running sessions. Each session
 * lives in its own {@link SessionRecord}; mutators lock that record, and
 * readers get an immutable {@link SessionState} copy taken under the same
 * lock, so a status read never sees a half-applied update.
 *
 * <p>Mutators never throw on an unknown session id: the call is logged and
 * ignored, because a session may be swept by {@link #cleanupExpired} while
 * a late step still reports in.
 */
@Component
public class SessionStateStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStateStore.class);

    public static final String INITIALIZING = "initializing";
    public static final String COMPLETED    = "completed";
    public static final String FAILED       = "failed";

    private final Map<String, SessionRecord> sessions = new ConcurrentHashMap<>();
    private final Clock                    clock;
    private final long                     maxAgeMs;
    private final ScheduledExecutorService sweeper;

    public SessionStateStore(
            Clock clock,
            @Value("${crawlpilot.session.max-age-ms:86400000}") long maxAgeMs,
            @Value("${crawlpilot.session.cleanup-interval-ms:3600000}") long cleanupIntervalMs) {
        this.clock    = clock;
        this.maxAgeMs = maxAgeMs;
        this.sweeper  = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-sweeper");
            t.setDaemon(true);
            return t;
        });
        sweeper.scheduleAtFixedRate(this::sweep, cleanupIntervalMs, cleanupIntervalMs, TimeUnit.MILLISECONDS);
        log.info("Session store started (maxAge={}ms, cleanupInterval={}ms)", maxAgeMs, cleanupIntervalMs);
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    public String createSession(String url) {
        String id = UUID.randomUUID().toString();
        sessions.put(id, new SessionRecord(id, url, clock.instant()));
        log.info("Created session {} for {}", id, url);
        return id;
    }

    public Optional<SessionState> getSession(String sessionId) {
        SessionRecord rec = find(sessionId);
        return rec == null ? Optional.empty() : Optional.of(rec.snapshot());
    }

    /** Mark the session terminal. The current step becomes "completed" or "failed". */
    public void completeSession(String sessionId, boolean success) {
        mutate(sessionId, "completeSession", rec -> {
            rec.currentStep = success ? COMPLETED : FAILED;
            Instant now = clock.instant();
            rec.stepTimestamps.put(rec.currentStep, now);
            rec.endTime = now;
        });
        log.info("Session {} {}", sessionId, success ? "completed" : "failed");
    }

    public boolean removeSession(String sessionId) {
        boolean removed = sessionId != null && sessions.remove(sessionId) != null;
        if (removed) {
            log.info("Removed session {}", sessionId);
        }
        return removed;
    }

    // ------------------------------------------------------------------
    // Mutators (no-op on unknown id)
    // ------------------------------------------------------------------

    public void updateCurrentStep(String sessionId, String stepName) {
        mutate(sessionId, "updateCurrentStep", rec -> {
            rec.currentStep = stepName;
            rec.stepTimestamps.put(stepName, clock.instant());
        });
    }

    public void updateStepResult(String sessionId, String stepName, StepResult result) {
        mutate(sessionId, "updateStepResult", rec -> rec.stepResults.put(stepName, result));
    }

    public void addError(String sessionId, CrawlError error) {
        mutate(sessionId, "addError", rec -> rec.errors.add(error));
    }

    public void updateMetadata(String sessionId, SessionMetadata partial) {
        mutate(sessionId, "updateMetadata", rec -> rec.metadata = rec.metadata.merge(partial));
    }

    // ------------------------------------------------------------------
    // Status queries
    // ------------------------------------------------------------------

    public Optional<SessionStatus> getStatus(String sessionId) {
        return getSession(sessionId).map(this::toStatus);
    }

    /** All known sessions, most recently started first. */
    public List<SessionStatus> listStatuses() {
        return sessions.values().stream()
                .map(SessionRecord::snapshot)
                .sorted(Comparator.comparing(SessionState::startTime).reversed())
                .map(this::toStatus)
                .toList();
    }

    public SessionStatistics statistics() {
        int active = 0, completed = 0, failed = 0, total = 0;
        for (SessionRecord rec : sessions.values()) {
            total++;
            switch (deriveStatus(rec.snapshot())) {
                case COMPLETED          -> completed++;
                case FAILED             -> failed++;
                case PENDING, RUNNING   -> active++;
            }
        }
        return new SessionStatistics(total, active, completed, failed);
    }

    public static SessionStatusValue deriveStatus(SessionState s) {
        if (COMPLETED.equals(s.currentStep())) return SessionStatusValue.COMPLETED;
        if (FAILED.equals(s.currentStep()) || !s.errors().isEmpty()) return SessionStatusValue.FAILED;
        if (INITIALIZING.equals(s.currentStep())) return SessionStatusValue.PENDING;
        return SessionStatusValue.RUNNING;
    }

    /** Share of canonical steps with a recorded result, as a rounded percentage. */
    public static int progress(SessionState s) {
        long done = StepNames.CANONICAL.stream()
                .filter(s.stepResults()::containsKey)
                .count();
        return (int) Math.round(done * 100.0 / StepNames.CANONICAL.size());
    }

    private SessionStatus toStatus(SessionState s) {
        Instant end = s.endTime();
        long duration = Duration.between(s.startTime(), end != null ? end : clock.instant()).toMillis();
        String lastError = s.errors().isEmpty() ? null : s.errors().get(s.errors().size() - 1).message();
        return new SessionStatus(s.sessionId(), s.url(), deriveStatus(s), s.currentStep(),
                progress(s), s.startTime(), end, duration, lastError);
    }

    // ------------------------------------------------------------------
    // Expiry
    // ------------------------------------------------------------------

    /**
     * Drop sessions started more than {@code maxAgeMs} ago.
     *
     * @return number of sessions removed
     */
    public int cleanupExpired(long maxAgeMs) {
        Instant cutoff = clock.instant().minusMillis(maxAgeMs);
        int removed = 0;
        for (Map.Entry<String, SessionRecord> e : sessions.entrySet()) {
            if (e.getValue().startTime.isBefore(cutoff) && sessions.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Cleaned up {} expired session(s)", removed);
        }
        return removed;
    }

    /** Stop the sweeper and forget every session. */
    @PreDestroy
    public void destroy() {
        sweeper.shutdownNow();
        sessions.clear();
        log.info("Session store destroyed");
    }

    // ConcurrentHashMap rejects null keys.
    private SessionRecord find(String sessionId) {
        return sessionId == null ? null : sessions.get(sessionId);
    }

    private void sweep() {
        try {
            cleanupExpired(maxAgeMs);
        } catch (Exception e) {
            // Keep the schedule alive; an escaping exception would cancel it.
            log.error("Session cleanup failed", e);
        }
    }

    private void mutate(String sessionId, String op, Consumer<SessionRecord> change) {
        SessionRecord rec = find(sessionId);
        if (rec == null) {
            log.warn("{} ignored: unknown session {}", op, sessionId);
            return;
        }
        synchronized (rec) {
            change.accept(rec);
        }
    }

    // ------------------------------------------------------------------
    // Per-session mutable record
    // ------------------------------------------------------------------

    private static final class SessionRecord {
        final String  sessionId;
        final String  url;
        final Instant startTime;

        final Map<String, StepResult> stepResults    = new LinkedHashMap<>();
        final Map<String, Instant>    stepTimestamps = new LinkedHashMap<>();
        final List<CrawlError>        errors         = new ArrayList<>();

        String          currentStep = INITIALIZING;
        Instant         endTime;
        SessionMetadata metadata    = SessionMetadata.initial();

        SessionRecord(String sessionId, String url, Instant startTime) {
            this.sessionId = sessionId;
            this.url       = url;
            this.startTime = startTime;
            stepTimestamps.put(INITIALIZING, startTime);
        }

        synchronized SessionState snapshot() {
            return new SessionState(sessionId, url, startTime, endTime, currentStep,
                    Collections.unmodifiableMap(new LinkedHashMap<>(stepResults)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(stepTimestamps)),
                    List.copyOf(errors), metadata);
        }
    }
}
