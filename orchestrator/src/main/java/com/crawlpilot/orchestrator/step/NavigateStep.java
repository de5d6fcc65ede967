package com.crawlpilot.orchestrator.step;

import com.crawlpilot.orchestrator.backend.BrowserBackend;
import com.crawlpilot.orchestrator.model.StepNames;

/**
 * Loads the article URL. Not retryable: if the page never loads there is
 * nothing for the later steps to work on.
 */
public final class NavigateStep extends CrawlStep {

    private final ArticleUrlPolicy urlPolicy;

    public NavigateStep(BrowserBackend backend, ArticleUrlPolicy urlPolicy, long timeoutMs) {
        super(backend, StepNames.NAVIGATE, "Navigate to the article page", StepPolicy.fatal(timeoutMs));
        this.urlPolicy = urlPolicy;
    }

    @Override
    public StepType type() {
        return StepType.NAVIGATE;
    }

    @Override
    protected boolean preExecute(CrawlContext ctx) {
        return urlPolicy.matches(ctx.url());
    }

    @Override
    protected StepResult execute(CrawlContext ctx) {
        return fromBackend(backend.navigate(ctx.sessionId(), ctx.url(), timeoutMs()));
    }
}
