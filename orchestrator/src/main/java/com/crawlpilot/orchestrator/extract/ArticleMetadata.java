package com.crawlpilot.orchestrator.extract;

import com.crawlpilot.orchestrator.model.ImageInfo;

import java.util.List;

/**
 * @param publishTime normalized yyyy-MM-dd, or "" when none was found
 * @param wordCount   length of the visible text
 */
public record ArticleMetadata(
        String          title,
        String          author,
        String          publishTime,
        List<ImageInfo> images,
        int             wordCount
) {
    public ArticleMetadata {
        images = images == null ? List.of() : List.copyOf(images);
    }
}
