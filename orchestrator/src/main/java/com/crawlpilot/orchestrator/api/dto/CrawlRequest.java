package com.crawlpilot.orchestrator.api.dto;

import com.crawlpilot.orchestrator.model.CrawlOptions;
import com.crawlpilot.orchestrator.model.OutputFormat;

/**
 * Request body for POST /crawls.
 *
 * Only url is required; every other field falls back to the configured
 * default options.
 */
public record CrawlRequest(
        String       url,
        OutputFormat outputFormat,
        Boolean      saveImages,
        Boolean      cleanContent,
        Long         timeoutMs,
        Integer      retryAttempts,
        Long         delayBetweenStepsMs
) {
    /** @throws com.crawlpilot.orchestrator.model.CrawlException VALIDATION on out-of-range values */
    public CrawlOptions toOptions(CrawlOptions defaults) {
        return new CrawlOptions(
                outputFormat        != null ? outputFormat        : defaults.outputFormat(),
                saveImages          != null ? saveImages          : defaults.saveImages(),
                cleanContent        != null ? cleanContent        : defaults.cleanContent(),
                timeoutMs           != null ? timeoutMs           : defaults.timeoutMs(),
                retryAttempts       != null ? retryAttempts       : defaults.retryAttempts(),
                delayBetweenStepsMs != null ? delayBetweenStepsMs : defaults.delayBetweenStepsMs());
    }
}
