package com.crawlpilot.orchestrator.service;

import com.crawlpilot.orchestrator.extract.ArticleMetadata;
import com.crawlpilot.orchestrator.extract.MetadataExtractor;
import com.crawlpilot.orchestrator.model.CrawlResult;
import com.crawlpilot.orchestrator.model.StepNames;
import com.crawlpilot.orchestrator.step.CrawlContext;
import com.crawlpilot.orchestrator.step.StepResult;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Folds a finished session's step results into a {@link CrawlResult}.
 *
 * Pure: reads only the context's step results, options, url, session id
 * and start time, plus the {@code finishedAt} it is handed. Calling it twice
 * gives equal results. Image references are dropped when saveImages is off.
 */
@Component
public class CrawlResultAssembler {

    public static final String NO_USABLE_CONTENT = "no usable content";

    private final MetadataExtractor extractor;

    public CrawlResultAssembler(MetadataExtractor extractor) {
        this.extractor = extractor;
    }

    public CrawlResult assemble(CrawlContext ctx, Instant finishedAt) {
        long durationMs = Duration.between(ctx.startTime(), finishedAt).toMillis();
        Optional<StepResult> snapshot = ctx.result(StepNames.FINAL_SNAPSHOT)
                .filter(StepResult::success);
        String content = snapshot.map(StepResult::contentAsString).orElse("");
        if (content.isBlank()) {
            return CrawlResult.failed(ctx.url(), ctx.sessionId(), NO_USABLE_CONTENT, finishedAt, durationMs);
        }

        ArticleMetadata meta = extractor.extract(content);
        return new CrawlResult(
                true,
                ctx.url(),
                meta.title(),
                meta.author(),
                meta.publishTime(),
                content,
                ctx.options().saveImages() ? meta.images() : List.of(),
                "",
                finishedAt,
                durationMs,
                ctx.sessionId(),
                null);
    }
}
