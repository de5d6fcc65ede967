package com.crawlpilot.orchestrator.step;

/**
 * Execution constraints the orchestrator applies around a step.
 *
 * @param retryable false means a single failed attempt aborts the session
 * @param timeoutMs wall-clock limit handed to the backend call
 */
public record StepPolicy(boolean retryable, long timeoutMs) {

    public static StepPolicy fatal(long timeoutMs) {
        return new StepPolicy(false, timeoutMs);
    }

    public static StepPolicy retryable(long timeoutMs) {
        return new StepPolicy(true, timeoutMs);
    }
}
