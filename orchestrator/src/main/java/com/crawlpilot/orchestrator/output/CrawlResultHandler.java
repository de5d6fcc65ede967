package com.crawlpilot.orchestrator.output;

import com.crawlpilot.orchestrator.model.CrawlOptions;
import com.crawlpilot.orchestrator.model.CrawlResult;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Receives every successful {@link CrawlResult} before it is returned.
 *
 * Implementations must not throw: a persistence failure is reported as an
 * empty Optional and never fails the crawl.
 */
public interface CrawlResultHandler {

    /** @return where the result was stored, if anywhere */
    Optional<Path> handle(CrawlResult result, CrawlOptions options);
}
