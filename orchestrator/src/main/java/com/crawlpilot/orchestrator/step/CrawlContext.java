package com.crawlpilot.orchestrator.step;

import com.crawlpilot.orchestrator.model.CancellationToken;
import com.crawlpilot.orchestrator.model.CrawlOptions;
import com.crawlpilot.orchestrator.model.SessionMetadata;
import com.crawlpilot.orchestrator.state.SessionStateStore;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Runtime context threaded through every step of one session.
 *
 * Owned by the session's thread. Steps read earlier results from it and
 * push derived metadata to the store through it; nothing session-local lives
 * anywhere else.
 */
public final class CrawlContext {

    private final String            sessionId;
    private final String            url;
    private final CrawlOptions      options;
    private final SessionStateStore store;
    private final CancellationToken token;
    private final Instant           startTime;

    private final Map<String, StepResult> stepResults = new LinkedHashMap<>();
    private String currentStep;

    public CrawlContext(String sessionId, String url, CrawlOptions options,
                        SessionStateStore store, CancellationToken token, Instant startTime) {
        this.sessionId = sessionId;
        this.url       = url;
        this.options   = options;
        this.store     = store;
        this.token     = token;
        this.startTime = startTime;
    }

    public String sessionId()          { return sessionId; }
    public String url()                { return url; }
    public CrawlOptions options()      { return options; }
    public CancellationToken token()   { return token; }
    public Instant startTime()         { return startTime; }
    public String currentStep()        { return currentStep; }

    public void setCurrentStep(String stepName) {
        this.currentStep = stepName;
    }

    /** Keep the latest attempt's result for {@code stepName}. */
    public void record(String stepName, StepResult result) {
        stepResults.put(stepName, result);
    }

    public Optional<StepResult> result(String stepName) {
        return Optional.ofNullable(stepResults.get(stepName));
    }

    public Map<String, StepResult> stepResults() {
        return Collections.unmodifiableMap(stepResults);
    }

    public void recordMetadata(SessionMetadata partial) {
        store.updateMetadata(sessionId, partial);
    }
}
