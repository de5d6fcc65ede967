package com.crawlpilot.orchestrator.model;

import java.time.Instant;
import java.util.List;

/**
 * Terminal artifact of a crawl session.
 *
 * @param filePath set once the result handler has persisted the result; empty otherwise
 * @param error    null on success
 */
public record CrawlResult(
        boolean         success,
        String          url,
        String          title,
        String          author,
        String          publishTime,
        String          content,
        List<ImageInfo> images,
        String          filePath,
        Instant         crawlTime,
        long            durationMs,
        String          sessionId,
        String          error
) {
    public CrawlResult {
        images = images == null ? List.of() : List.copyOf(images);
        if (filePath == null) filePath = "";
    }

    public static CrawlResult failed(String url, String sessionId, String error,
                                     Instant crawlTime, long durationMs) {
        return new CrawlResult(false, url, "", "", "", "", List.of(), "",
                crawlTime, durationMs, sessionId, error);
    }

    public CrawlResult withFilePath(String path) {
        return new CrawlResult(success, url, title, author, publishTime, content, images,
                path, crawlTime, durationMs, sessionId, error);
    }
}
