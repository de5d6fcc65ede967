package com.crawlpilot.orchestrator.model;

/**
 * An image referenced by the crawled page. localPath and size stay empty
 * until the content pipeline downloads the file.
 */
public record ImageInfo(
        String originalUrl,
        String localPath,
        String filename,
        long   size,
        String mimeType
) {
    public static ImageInfo remote(String originalUrl, String filename, String mimeType) {
        return new ImageInfo(originalUrl, "", filename, 0, mimeType);
    }
}
