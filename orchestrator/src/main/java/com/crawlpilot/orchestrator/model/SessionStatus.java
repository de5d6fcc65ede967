package com.crawlpilot.orchestrator.model;

import java.time.Instant;

/**
 * Status view of one session, as returned by the status query.
 *
 * @param progress   percentage (0-100) of canonical steps that have a result
 * @param endTime    null while the session is still active
 * @param durationMs time since start, or total time once terminal
 * @param lastError  message of the most recent recorded error, or null
 */
public record SessionStatus(
        String             sessionId,
        String             url,
        SessionStatusValue status,
        String             currentStep,
        int                progress,
        Instant            startTime,
        Instant            endTime,
        long               durationMs,
        String             lastError
) {}
