package com.crawlpilot.orchestrator.api.dto;

import com.crawlpilot.orchestrator.model.BatchCrawlOptions;
import com.crawlpilot.orchestrator.model.CrawlOptions;
import com.crawlpilot.orchestrator.model.OutputFormat;

import java.util.List;

/**
 * Request body for POST /crawls/batch.
 *
 * Defaults: concurrentLimit 2, delaySeconds 5, stopOnError false.
 */
public record BatchCrawlRequest(
        List<String> urls,
        Integer      concurrentLimit,
        Integer      delaySeconds,
        Boolean      stopOnError,
        OutputFormat outputFormat,
        Boolean      saveImages,
        Boolean      cleanContent,
        Long         timeoutMs,
        Integer      retryAttempts,
        Long         delayBetweenStepsMs
) {
    public BatchCrawlOptions toOptions(CrawlOptions defaults) {
        CrawlOptions crawl = new CrawlRequest(null, outputFormat, saveImages, cleanContent,
                timeoutMs, retryAttempts, delayBetweenStepsMs).toOptions(defaults);
        return new BatchCrawlOptions(
                crawl,
                concurrentLimit != null ? concurrentLimit : 2,
                delaySeconds    != null ? delaySeconds    : 5,
                stopOnError     != null && stopOnError);
    }
}
