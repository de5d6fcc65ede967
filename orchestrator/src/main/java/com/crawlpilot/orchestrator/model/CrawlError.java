package com.crawlpilot.orchestrator.model;

import java.time.Instant;

/**
 * One error recorded against a session.
 *
 * @param retryable true when the error came from a retryable step that was skipped
 */
public record CrawlError(
        String  message,
        String  stepName,
        String  sessionId,
        boolean retryable,
        Instant timestamp
) {}
