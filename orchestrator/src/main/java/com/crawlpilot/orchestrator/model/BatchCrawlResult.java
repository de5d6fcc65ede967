package com.crawlpilot.orchestrator.model;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a batch crawl.
 *
 * @param skippedCount URLs never attempted because stopOnError cut the batch short
 */
public record BatchCrawlResult(
        boolean           success,
        int               totalCount,
        int               successCount,
        int               failedCount,
        int               skippedCount,
        List<CrawlResult> results,
        Instant           startTime,
        Instant           endTime,
        long              durationMs,
        long              averageDurationMs,
        AggregatedStats   stats
) {
    public record AggregatedStats(
            int    totalImages,
            long   totalContentSize,
            int    successRate,
            long   fastestCrawlMs,
            long   slowestCrawlMs) {}
}
