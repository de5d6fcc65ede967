package com.crawlpilot.orchestrator.model;

/**
 * Derived status of a crawl session.
 *
 * Transitions:
 *   PENDING → RUNNING   (first step started)
 *   RUNNING → COMPLETED (session finished with usable content)
 *   any     → FAILED    (fatal step, error recorded, or no usable content)
 */
public enum SessionStatusValue {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
