package com.crawlpilot.orchestrator.service;

import com.crawlpilot.orchestrator.backend.BrowserBackend;
import com.crawlpilot.orchestrator.model.CancellationToken;
import com.crawlpilot.orchestrator.model.CrawlError;
import com.crawlpilot.orchestrator.model.CrawlException;
import com.crawlpilot.orchestrator.model.CrawlOptions;
import com.crawlpilot.orchestrator.model.CrawlResult;
import com.crawlpilot.orchestrator.model.SessionMetadata;
import com.crawlpilot.orchestrator.model.StepNames;
import com.crawlpilot.orchestrator.output.CrawlResultHandler;
import com.crawlpilot.orchestrator.state.SessionStateStore;
import com.crawlpilot.orchestrator.step.ArticleUrlPolicy;
import com.crawlpilot.orchestrator.step.ClickStep;
import com.crawlpilot.orchestrator.step.CrawlContext;
import com.crawlpilot.orchestrator.step.CrawlStep;
import com.crawlpilot.orchestrator.step.StepCatalog;
import com.crawlpilot.orchestrator.step.StepResult;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives one crawl session from URL to {@link CrawlResult}.
 *
 * <p>Session lifecycle:
 * <ol>
 *   <li>Create the session in the store and register its cancel token.</li>
 *   <li>Plan the canonical step list.</li>
 *   <li>Run the plan in order. A failed non-retryable step aborts the
 *       session; a retryable step that runs out of attempts is recorded as
 *       an error and the sequence moves on.</li>
 *   <li>After each step every {@link ReplanRule} may narrow the remaining
 *       plan. The tail is swapped for a new list, never edited in place.</li>
 *   <li>Assemble the result, hand it to the {@link CrawlResultHandler} and
 *       mark the session terminal.</li>
 * </ol>
 *
 * <p>When the backend drives one shared page, sessions run one at a time.
 * A session waiting for the page can still be cancelled.
 *
 * {@link #run} never throws: every failure inside a session comes back as a
 * CrawlResult with success=false, and the session is always terminal when
 * it returns.
 */
@Service
public class CrawlOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CrawlOrchestrator.class);

    // How often a session queued for the page re-checks its cancel token.
    static final long PAGE_LOCK_POLL_MS = 200;

    private final StepCatalog          catalog;
    private final StepExecutor         stepExecutor;
    private final List<ReplanRule>     replanRules;
    private final CrawlResultAssembler assembler;
    private final CrawlResultHandler   resultHandler;
    private final SessionStateStore    store;
    private final BrowserBackend       backend;
    private final MeterRegistry        meterRegistry;
    private final Clock                clock;
    private final CrawlOptions         defaultOptions;
    private final boolean              enforceDeadline;

    // Held for a whole session when the backend drives a single shared page.
    private final ReentrantLock pageLock = new ReentrantLock(true);

    private final Map<String, CancellationToken> activeTokens = new ConcurrentHashMap<>();

    public CrawlOrchestrator(StepCatalog catalog,
                             StepExecutor stepExecutor,
                             List<ReplanRule> replanRules,
                             CrawlResultAssembler assembler,
                             CrawlResultHandler resultHandler,
                             SessionStateStore store,
                             BrowserBackend backend,
                             MeterRegistry meterRegistry,
                             Clock clock,
                             CrawlOptions defaultOptions,
                             @Value("${crawlpilot.session.enforce-deadline:true}") boolean enforceDeadline) {
        this.catalog         = catalog;
        this.stepExecutor    = stepExecutor;
        this.replanRules     = List.copyOf(replanRules);
        this.assembler       = assembler;
        this.resultHandler   = resultHandler;
        this.store           = store;
        this.backend         = backend;
        this.meterRegistry   = meterRegistry;
        this.clock           = clock;
        this.defaultOptions  = defaultOptions;
        this.enforceDeadline = enforceDeadline;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    public CrawlResult run(String url) {
        return run(url, defaultOptions);
    }

    public CrawlResult run(String url, CrawlOptions options) {
        CrawlOptions opts = options != null ? options : defaultOptions;
        String sessionId = store.createSession(url);
        CancellationToken token = new CancellationToken();
        activeTokens.put(sessionId, token);

        MDC.put("sessionId", sessionId);
        MDC.put("url", url);
        CrawlContext ctx = null;
        boolean locked = false;
        try {
            validateUrl(url);
            if (backend.sharedPage()) {
                acquirePage(token);
                locked = true;
            }
            ctx = new CrawlContext(sessionId, url, opts, store, token, clock.instant());
            List<CrawlStep> plan = plan(url, opts);
            log.info("Starting crawl with {} planned step(s)", plan.size());

            executeSequence(plan, ctx, deadlineFor(plan, opts, ctx.startTime()));
            return finish(ctx, opts);

        } catch (CrawlException e) {
            log.warn("Crawl session ended: {}", e.getMessage());
            return fail(sessionId, url, ctx, e.getStepName(), e.getReason(), outcomeTag(e.getKind()));
        } catch (RuntimeException e) {
            log.error("Unexpected error in crawl session", e);
            String step = ctx != null ? ctx.currentStep() : null;
            return fail(sessionId, url, ctx, step, "unexpected error: " + e.getMessage(),
                    outcomeTag(CrawlException.Kind.INTERNAL));
        } finally {
            activeTokens.remove(sessionId);
            if (ctx != null && !ctx.stepResults().isEmpty()) {
                closeBackendSession(sessionId);
            }
            if (locked) {
                pageLock.unlock();
            }
            MDC.remove("sessionId");
            MDC.remove("url");
        }
    }

    /**
     * Signal an active session to stop at its next step, attempt or delay.
     *
     * @return false if no active session has this id
     */
    public boolean cancel(String sessionId) {
        CancellationToken token = activeTokens.get(sessionId);
        if (token == null) {
            return false;
        }
        log.info("Cancelling session {}", sessionId);
        token.cancel();
        return true;
    }

    public CrawlOptions defaultOptions() {
        return defaultOptions;
    }

    /** The canonical seven-step plan for {@code url}. */
    public List<CrawlStep> plan(String url, CrawlOptions options) {
        return catalog.canonicalPlan(options);
    }

    /**
     * @throws CrawlException VALIDATION if the URL is malformed or not an article URL
     */
    public void validateUrl(String url) {
        if (!ArticleUrlPolicy.isWellFormed(url)) {
            throw new CrawlException(CrawlException.Kind.VALIDATION, "malformed url: " + url);
        }
        ArticleUrlPolicy policy = catalog.urlPolicy();
        if (!policy.matches(url)) {
            throw new CrawlException(CrawlException.Kind.VALIDATION,
                    "unsupported url (expected https://" + policy.host() + policy.pathPrefix() + "...): " + url);
        }
    }

    private void acquirePage(CancellationToken token) {
        try {
            while (!pageLock.tryLock(PAGE_LOCK_POLL_MS, TimeUnit.MILLISECONDS)) {
                token.throwIfCancelled();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrawlException(CrawlException.Kind.CANCELLED, null, "session interrupted", e);
        }
    }

    // ------------------------------------------------------------------
    // Sequencing
    // ------------------------------------------------------------------

    void executeSequence(List<CrawlStep> plan, CrawlContext ctx, Instant deadline) {
        List<CrawlStep> current = plan;
        int index = 0;
        while (index < current.size()) {
            CrawlStep step = current.get(index);
            ctx.token().throwIfCancelled();
            if (deadline != null && clock.instant().isAfter(deadline)) {
                if (!step.retryable() || !hasFinalContent(ctx)) {
                    throw new CrawlException(CrawlException.Kind.DEADLINE_EXCEEDED, step.name(),
                            "session deadline exceeded");
                }
                // Content is already captured; drop the best-effort tail.
                log.warn("Session deadline exceeded, skipping step '{}'", step.name());
                store.addError(ctx.sessionId(), new CrawlError(
                        "step '" + step.name() + "' skipped: session deadline exceeded",
                        step.name(), ctx.sessionId(), true, clock.instant()));
                index++;
                continue;
            }

            StepExecutor.StepOutcome outcome = stepExecutor.execute(step, ctx);
            StepResult result = outcome.result();
            if (!result.success()) {
                if (!step.retryable()) {
                    throw new CrawlException(CrawlException.Kind.FATAL_STEP, step.name(),
                            "step '" + step.name() + "' failed: " + result.error());
                }
                log.warn("Step '{}' gave up after {} attempt(s), continuing: {}",
                        step.name(), outcome.attempts(), result.error());
                store.addError(ctx.sessionId(), new CrawlError(
                        "step '" + step.name() + "' failed after " + outcome.attempts()
                                + " attempt(s): " + result.error(),
                        step.name(), ctx.sessionId(), true, clock.instant()));
            }

            current = replan(current, index, step, result, ctx);
            index++;

            if (index < current.size() && ctx.options().delayBetweenStepsMs() > 0) {
                ctx.token().sleep(Duration.ofMillis(ctx.options().delayBetweenStepsMs()));
            }
        }
    }

    private static boolean hasFinalContent(CrawlContext ctx) {
        return ctx.result(StepNames.FINAL_SNAPSHOT).map(StepResult::success).orElse(false);
    }

    /** Returns {@code current} or a new list whose tail after {@code index} has been narrowed. */
    private List<CrawlStep> replan(List<CrawlStep> current, int index, CrawlStep finished,
                                   StepResult result, CrawlContext ctx) {
        List<CrawlStep> remaining = current.subList(index + 1, current.size());
        boolean changed = false;
        for (ReplanRule rule : replanRules) {
            if (rule.appliesAfter(finished, result, ctx)) {
                List<CrawlStep> narrowed = rule.apply(remaining, ctx);
                if (!narrowed.equals(remaining)) {
                    log.info("Re-plan rule '{}' after '{}': {} -> {} remaining step(s)",
                            rule.name(), finished.name(), remaining.size(), narrowed.size());
                    remaining = narrowed;
                    changed = true;
                }
            }
        }
        if (!changed) {
            return current;
        }
        List<CrawlStep> next = new ArrayList<>(current.subList(0, index + 1));
        next.addAll(remaining);
        return List.copyOf(next);
    }

    /**
     * Latest instant a step may start: every step timing out on every
     * attempt including the backend's request slack, plus backoff, click
     * probes and the inter-step delays.
     */
    Instant deadlineFor(List<CrawlStep> plan, CrawlOptions options, Instant start) {
        if (!enforceDeadline) {
            return null;
        }
        long budgetMs = 0;
        for (CrawlStep step : plan) {
            int attempts = stepExecutor.maxAttempts(step, options);
            long perAttempt = step.timeoutMs() + backend.requestSlackMs();
            if (step instanceof ClickStep click && click.optional()) {
                perAttempt += ClickStep.PROBE_TIMEOUT_MS + backend.requestSlackMs();
            }
            budgetMs += perAttempt * attempts + stepExecutor.worstCaseBackoffMs(attempts);
        }
        budgetMs += Math.max(0, plan.size() - 1) * options.delayBetweenStepsMs();
        return start.plusMillis(budgetMs);
    }

    // ------------------------------------------------------------------
    // Completion
    // ------------------------------------------------------------------

    private CrawlResult finish(CrawlContext ctx, CrawlOptions options) {
        CrawlResult assembled = assembler.assemble(ctx, clock.instant());
        if (!assembled.success()) {
            throw new CrawlException(CrawlException.Kind.AGGREGATION, null, assembled.error());
        }
        CrawlResult result = resultHandler.handle(assembled, options)
                .map(path -> assembled.withFilePath(path.toString()))
                .orElse(assembled);
        store.updateMetadata(ctx.sessionId(),
                SessionMetadata.article(result.title(), result.author(), result.publishTime()));
        store.completeSession(ctx.sessionId(), true);
        countSession("success");
        log.info("Crawl succeeded in {} ms: '{}'", result.durationMs(), result.title());
        return result;
    }

    private CrawlResult fail(String sessionId, String url, CrawlContext ctx, String stepName,
                             String error, String outcome) {
        Instant now = clock.instant();
        store.addError(sessionId, new CrawlError(error, stepName, sessionId, false, now));
        store.completeSession(sessionId, false);
        countSession(outcome);
        long durationMs = ctx != null ? Duration.between(ctx.startTime(), now).toMillis() : 0;
        return CrawlResult.failed(url, sessionId, error, now, durationMs);
    }

    private void closeBackendSession(String sessionId) {
        try {
            backend.closeSession(sessionId);
        } catch (RuntimeException e) {
            log.warn("Could not close backend page for session {}: {}", sessionId, e.getMessage());
        }
    }

    private void countSession(String outcome) {
        meterRegistry.counter("crawlpilot.sessions", "outcome", outcome).increment();
    }

    private static String outcomeTag(CrawlException.Kind kind) {
        return switch (kind) {
            case VALIDATION        -> "rejected";
            case CANCELLED         -> "cancelled";
            case DEADLINE_EXCEEDED -> "deadline_exceeded";
            case FATAL_STEP, AGGREGATION, INTERNAL -> "failure";
        };
    }
}
