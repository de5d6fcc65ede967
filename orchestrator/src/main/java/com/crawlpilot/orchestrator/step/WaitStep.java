package com.crawlpilot.orchestrator.step;

import com.crawlpilot.orchestrator.backend.BrowserBackend;
import com.crawlpilot.orchestrator.backend.dto.WaitCondition;
import com.crawlpilot.orchestrator.model.StepNames;

/** Waits until a selector becomes visible. */
public final class WaitStep extends CrawlStep {

    public static final String PAGE_CONTENT_SELECTOR = ".rich_media_content";
    public static final String ARTICLE_BODY_SELECTOR = "#js_content";

    private final String selector;

    public WaitStep(BrowserBackend backend, String name, String description,
                    String selector, long timeoutMs) {
        super(backend, name, description, StepPolicy.retryable(timeoutMs));
        this.selector = selector;
    }

    public static WaitStep forPageLoad(BrowserBackend backend) {
        return new WaitStep(backend, StepNames.WAIT_PAGE_LOAD,
                "Wait for the page content to render", PAGE_CONTENT_SELECTOR, 15_000);
    }

    public static WaitStep forContentLoad(BrowserBackend backend) {
        return new WaitStep(backend, StepNames.WAIT_CONTENT_LOAD,
                "Wait for the expanded article body", ARTICLE_BODY_SELECTOR, 10_000);
    }

    public String selector() {
        return selector;
    }

    @Override
    public StepType type() {
        return StepType.WAIT;
    }

    @Override
    protected StepResult execute(CrawlContext ctx) {
        return fromBackend(backend.waitFor(ctx.sessionId(), WaitCondition.visible(selector, timeoutMs())));
    }
}
