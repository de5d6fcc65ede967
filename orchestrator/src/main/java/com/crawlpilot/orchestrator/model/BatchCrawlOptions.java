package com.crawlpilot.orchestrator.model;

/**
 * Options for a batch crawl.
 *
 * @param crawl           options applied to every session in the batch
 * @param concurrentLimit sessions run at the same time (1-5)
 * @param delaySeconds    pause between groups (0-60)
 * @param stopOnError     skip the remaining groups once a group had a failure
 */
public record BatchCrawlOptions(
        CrawlOptions crawl,
        int          concurrentLimit,
        int          delaySeconds,
        boolean      stopOnError
) {
    public static final int MAX_URLS        = 50;
    public static final int MAX_CONCURRENCY = 5;

    public BatchCrawlOptions {
        if (crawl == null) crawl = CrawlOptions.DEFAULTS;
        if (concurrentLimit < 1 || concurrentLimit > MAX_CONCURRENCY) {
            throw new CrawlException(CrawlException.Kind.VALIDATION,
                    "concurrentLimit must be between 1 and " + MAX_CONCURRENCY + ", got " + concurrentLimit);
        }
        if (delaySeconds < 0 || delaySeconds > 60) {
            throw new CrawlException(CrawlException.Kind.VALIDATION,
                    "delaySeconds must be between 0 and 60, got " + delaySeconds);
        }
    }

    public static BatchCrawlOptions defaults(CrawlOptions crawl) {
        return new BatchCrawlOptions(crawl, 2, 5, false);
    }
}
