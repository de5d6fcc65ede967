package com.crawlpilot.orchestrator.model;

import com.crawlpilot.orchestrator.step.StepResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of a session held by the SessionStateStore.
 * All collections are immutable.
 */
public record SessionState(
        String                  sessionId,
        String                  url,
        Instant                 startTime,
        Instant                 endTime,
        String                  currentStep,
        Map<String, StepResult> stepResults,
        Map<String, Instant>    stepTimestamps,
        List<CrawlError>        errors,
        SessionMetadata         metadata
) {}
