package com.crawlpilot.orchestrator.step;

import com.crawlpilot.orchestrator.backend.BrowserBackend;
import com.crawlpilot.orchestrator.backend.dto.ScreenshotRequest;
import com.crawlpilot.orchestrator.model.StepNames;

public final class ScreenshotStep extends CrawlStep {

    public ScreenshotStep(BrowserBackend backend, long timeoutMs) {
        super(backend, StepNames.SCREENSHOT, "Take a full-page screenshot", StepPolicy.retryable(timeoutMs));
    }

    public static ScreenshotStep fullPage(BrowserBackend backend) {
        return new ScreenshotStep(backend, 10_000);
    }

    @Override
    public StepType type() {
        return StepType.SCREENSHOT;
    }

    @Override
    protected StepResult execute(CrawlContext ctx) {
        return fromBackend(backend.screenshot(ctx.sessionId(), ScreenshotRequest.fullPagePng(timeoutMs())));
    }
}
