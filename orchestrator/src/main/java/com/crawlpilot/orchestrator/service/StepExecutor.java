package com.crawlpilot.orchestrator.service;

import com.crawlpilot.orchestrator.model.CrawlOptions;
import com.crawlpilot.orchestrator.state.SessionStateStore;
import com.crawlpilot.orchestrator.step.CrawlContext;
import com.crawlpilot.orchestrator.step.CrawlStep;
import com.crawlpilot.orchestrator.step.StepResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Runs one step with its retry policy and records every attempt.
 *
 * Each attempt is timed and counted:
 * <pre>
 *   crawlpilot.step.duration{step}
 *   crawlpilot.step.calls{step, status="success|failure"}
 * </pre>
 *
 * A failed attempt is followed by a linear backoff of
 * {@code attempt × baseDelay}, except after the last one.
 */
@Component
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private final SessionStateStore store;
    private final MeterRegistry     meterRegistry;
    private final long              baseDelayMs;

    public StepExecutor(SessionStateStore store,
                        MeterRegistry meterRegistry,
                        @Value("${crawlpilot.retry.base-delay-ms:2000}") long baseDelayMs) {
        this.store         = store;
        this.meterRegistry = meterRegistry;
        this.baseDelayMs   = baseDelayMs;
    }

    /**
     * @param result   the last attempt's result
     * @param attempts how many attempts were made
     */
    public record StepOutcome(StepResult result, int attempts) {}

    public int maxAttempts(CrawlStep step, CrawlOptions options) {
        return step.retryable() ? options.retryAttempts() : 1;
    }

    /** Sum of backoff delays a step can spend when every attempt fails. */
    public long worstCaseBackoffMs(int attempts) {
        long total = 0;
        for (int attempt = 1; attempt < attempts; attempt++) {
            total += attempt * baseDelayMs;
        }
        return total;
    }

    public StepOutcome execute(CrawlStep step, CrawlContext ctx) {
        int maxAttempts = maxAttempts(step, ctx.options());
        String previousStep = MDC.get("step");
        MDC.put("step", step.name());
        try {
            StepResult result = null;
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                ctx.token().throwIfCancelled();
                ctx.setCurrentStep(step.name());
                store.updateCurrentStep(ctx.sessionId(), step.name());

                if (attempt == 1) {
                    log.debug("Starting step '{}': {}", step.name(), step.description());
                }
                result = timedRun(step, ctx);
                ctx.record(step.name(), result);
                store.updateStepResult(ctx.sessionId(), step.name(), result);

                if (result.success()) {
                    log.debug("Step '{}' succeeded on attempt {}/{}", step.name(), attempt, maxAttempts);
                    return new StepOutcome(result, attempt);
                }
                log.warn("Step '{}' failed on attempt {}/{}: {}",
                        step.name(), attempt, maxAttempts, result.error());
                if (attempt < maxAttempts) {
                    ctx.token().sleep(Duration.ofMillis(attempt * baseDelayMs));
                }
            }
            return new StepOutcome(result, maxAttempts);
        } finally {
            if (previousStep != null) {
                MDC.put("step", previousStep);
            } else {
                MDC.remove("step");
            }
        }
    }

    private StepResult timedRun(CrawlStep step, CrawlContext ctx) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "failure";
        try {
            StepResult result = step.run(ctx);
            if (result.success()) status = "success";
            return result;
        } finally {
            sample.stop(meterRegistry.timer("crawlpilot.step.duration", "step", step.name()));
            meterRegistry.counter("crawlpilot.step.calls", "step", step.name(), "status", status).increment();
        }
    }
}
