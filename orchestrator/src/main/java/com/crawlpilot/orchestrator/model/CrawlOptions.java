package com.crawlpilot.orchestrator.model;

/**
 * Resolved options for one crawl session.
 *
 * @param outputFormat        format the result handler writes
 * @param saveImages          forwarded to the content pipeline
 * @param cleanContent        forwarded to the content pipeline
 * @param timeoutMs           navigation timeout
 * @param retryAttempts       attempts per retryable step (at least 1)
 * @param delayBetweenStepsMs pause between consecutive steps
 */
public record CrawlOptions(
        OutputFormat outputFormat,
        boolean      saveImages,
        boolean      cleanContent,
        long         timeoutMs,
        int          retryAttempts,
        long         delayBetweenStepsMs
) {
    public static final CrawlOptions DEFAULTS =
            new CrawlOptions(OutputFormat.MARKDOWN, true, true, 30_000, 3, 1_000);

    public CrawlOptions {
        if (outputFormat == null) outputFormat = OutputFormat.MARKDOWN;
        if (timeoutMs <= 0) {
            throw new CrawlException(CrawlException.Kind.VALIDATION,
                    "timeoutMs must be positive, got " + timeoutMs);
        }
        if (retryAttempts < 1) {
            throw new CrawlException(CrawlException.Kind.VALIDATION,
                    "retryAttempts must be at least 1, got " + retryAttempts);
        }
        if (delayBetweenStepsMs < 0) {
            throw new CrawlException(CrawlException.Kind.VALIDATION,
                    "delayBetweenStepsMs must not be negative, got " + delayBetweenStepsMs);
        }
    }

    public CrawlOptions withRetryAttempts(int attempts) {
        return new CrawlOptions(outputFormat, saveImages, cleanContent, timeoutMs, attempts, delayBetweenStepsMs);
    }

    public CrawlOptions withDelayBetweenStepsMs(long delayMs) {
        return new CrawlOptions(outputFormat, saveImages, cleanContent, timeoutMs, retryAttempts, delayMs);
    }
}
