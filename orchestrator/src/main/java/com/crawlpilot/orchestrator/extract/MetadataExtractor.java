package com.crawlpilot.orchestrator.extract;

/**
 * Pulls article facts out of captured page HTML.
 *
 * Implementations must be pure: the same HTML always yields the same
 * {@link ArticleMetadata}, and missing facts come back as the documented
 * fallbacks rather than null.
 */
public interface MetadataExtractor {

    String UNKNOWN_TITLE  = "unknown title";
    String UNKNOWN_AUTHOR = "unknown author";

    ArticleMetadata extract(String html);
}
