package com.crawlpilot.orchestrator.step;

import com.crawlpilot.orchestrator.backend.BrowserBackend;
import com.crawlpilot.orchestrator.model.CrawlOptions;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the canonical step sequence for an article crawl.
 *
 * Only navigate depends on the session's options (its timeout); the other
 * steps are built once and shared.
 */
@Component
public class StepCatalog {

    private final BrowserBackend   backend;
    private final ArticleUrlPolicy urlPolicy;
    private final List<CrawlStep>  afterNavigate;

    public StepCatalog(BrowserBackend backend, ArticleUrlPolicy urlPolicy) {
        this.backend   = backend;
        this.urlPolicy = urlPolicy;
        this.afterNavigate = List.of(
                WaitStep.forPageLoad(backend),
                new SnapshotStep(backend, SnapshotStep.Phase.INITIAL),
                ClickStep.forExpandButton(backend),
                WaitStep.forContentLoad(backend),
                new SnapshotStep(backend, SnapshotStep.Phase.FINAL),
                ScreenshotStep.fullPage(backend));
    }

    public NavigateStep navigate(long timeoutMs) {
        return new NavigateStep(backend, urlPolicy, timeoutMs);
    }

    /** The full seven-step plan, navigate first. */
    public List<CrawlStep> canonicalPlan(CrawlOptions options) {
        CrawlStep[] plan = new CrawlStep[afterNavigate.size() + 1];
        plan[0] = navigate(options.timeoutMs());
        for (int i = 0; i < afterNavigate.size(); i++) {
            plan[i + 1] = afterNavigate.get(i);
        }
        return List.of(plan);
    }

    public ArticleUrlPolicy urlPolicy() {
        return urlPolicy;
    }
}
