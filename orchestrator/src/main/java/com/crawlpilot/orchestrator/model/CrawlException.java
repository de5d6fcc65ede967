package com.crawlpilot.orchestrator.model;

/**
 * A failure that ends a crawl session (or rejects its input).
 *
 * Unchecked: it travels from deep inside the step sequence up to
 * CrawlOrchestrator.run(), which turns it into a failed CrawlResult.
 * Retryable step failures never become a CrawlException; they are
 * recorded on the session and the sequence moves on.
 */
public class CrawlException extends RuntimeException {

    public enum Kind { VALIDATION, FATAL_STEP, AGGREGATION, CANCELLED, DEADLINE_EXCEEDED, INTERNAL }

    private final Kind   kind;
    private final String stepName;
    private final String reason;

    public CrawlException(Kind kind, String message) {
        this(kind, null, message);
    }

    public CrawlException(Kind kind, String stepName, String message) {
        super("[" + kind + "] " + message);
        this.kind     = kind;
        this.stepName = stepName;
        this.reason   = message;
    }

    public CrawlException(Kind kind, String stepName, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind     = kind;
        this.stepName = stepName;
        this.reason   = message;
    }

    public Kind getKind() { return kind; }

    /** Step that was running when the session ended, or null. */
    public String getStepName() { return stepName; }

    /** The message without the kind prefix; this is what ends up in CrawlResult.error. */
    public String getReason() { return reason; }
}
