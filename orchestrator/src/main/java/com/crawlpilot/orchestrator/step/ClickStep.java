package com.crawlpilot.orchestrator.step;

import com.crawlpilot.orchestrator.backend.BackendResult;
import com.crawlpilot.orchestrator.backend.BrowserBackend;
import com.crawlpilot.orchestrator.backend.dto.WaitCondition;
import com.crawlpilot.orchestrator.model.StepNames;

import java.util.Map;

/**
 * Clicks an element.
 *
 * In optional mode a missing target or a failed click is not an error: the
 * step first probes for the element for {@link #PROBE_TIMEOUT_MS} and reports
 * success with {@code skipped=true} if it is absent, and a click that fails is
 * reported as success with {@value #OPTIONAL_FAILURE} {@code click_failed_optional}.
 */
public final class ClickStep extends CrawlStep {

    public static final String EXPAND_SELECTOR  = ".rich_media_js";
    public static final long   PROBE_TIMEOUT_MS = 2_000;
    public static final String OPTIONAL_FAILURE = "optionalFailure";

    private final String  selector;
    private final boolean optional;

    public ClickStep(BrowserBackend backend, String name, String description,
                     String selector, boolean optional, long timeoutMs) {
        super(backend, name, description, StepPolicy.retryable(timeoutMs));
        this.selector = selector;
        this.optional = optional;
    }

    public static ClickStep forExpandButton(BrowserBackend backend) {
        return new ClickStep(backend, StepNames.CLICK_EXPAND,
                "Click the expand-full-text control", EXPAND_SELECTOR, true, 5_000);
    }

    public String selector()  { return selector; }
    public boolean optional() { return optional; }

    @Override
    public StepType type() {
        return StepType.CLICK;
    }

    @Override
    protected StepResult execute(CrawlContext ctx) {
        if (optional) {
            BackendResult probe = backend.waitFor(ctx.sessionId(),
                    WaitCondition.visible(selector, PROBE_TIMEOUT_MS));
            if (probe == null || !probe.success()) {
                return success(null, Map.of(
                        "skipped", true,
                        "reason",  "element_not_found"));
            }
        }
        StepResult clicked = fromBackend(backend.click(ctx.sessionId(), selector, timeoutMs()));
        if (!clicked.success() && optional) {
            return success(null, Map.of(
                    OPTIONAL_FAILURE, "click_failed_optional",
                    "clickError", clicked.error() != null ? clicked.error() : ""));
        }
        return clicked;
    }
}
