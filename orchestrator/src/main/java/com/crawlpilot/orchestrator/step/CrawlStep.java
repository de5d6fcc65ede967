package com.crawlpilot.orchestrator.step;

import com.crawlpilot.orchestrator.backend.BackendResult;
import com.crawlpilot.orchestrator.backend.BrowserBackend;
import com.crawlpilot.orchestrator.model.CrawlException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One discrete backend operation plus its retry and timeout policy.
 *
 * The set of step kinds is closed; {@link #type()} gives callers an enum they
 * can switch over exhaustively. Instances are immutable and may be shared
 * between sessions.
 *
 * <p>{@link #run} is the only entry point. It wraps the three hooks:
 * <ol>
 *   <li>{@link #preExecute} gates the call; false yields PRECONDITION_FAILED.</li>
 *   <li>{@link #execute} performs the backend call.</li>
 *   <li>{@link #postExecute} may enrich the result; it runs on success and failure.</li>
 * </ol>
 * Every failure comes back as a {@code StepResult} with success=false. Only
 * {@link CrawlException} (cancellation) escapes.
 */
public abstract sealed class CrawlStep
        permits NavigateStep, WaitStep, SnapshotStep, ClickStep, ScreenshotStep {

    protected final BrowserBackend backend;

    private final String     name;
    private final String     description;
    private final StepPolicy policy;

    protected CrawlStep(BrowserBackend backend, String name, String description, StepPolicy policy) {
        this.backend     = backend;
        this.name        = name;
        this.description = description;
        this.policy      = policy;
    }

    public String name()        { return name; }
    public String description() { return description; }
    public StepPolicy policy()  { return policy; }
    public boolean retryable()  { return policy.retryable(); }
    public long timeoutMs()     { return policy.timeoutMs(); }

    public abstract StepType type();

    protected abstract StepResult execute(CrawlContext ctx);

    protected boolean preExecute(CrawlContext ctx) {
        return true;
    }

    protected StepResult postExecute(CrawlContext ctx, StepResult result) {
        return result;
    }

    public final StepResult run(CrawlContext ctx) {
        StepResult result;
        try {
            if (!preExecute(ctx)) {
                result = failure("precondition failed for step '" + name + "'",
                        FailureReason.PRECONDITION_FAILED);
            } else {
                result = execute(ctx);
            }
            return postExecute(ctx, result);
        } catch (CrawlException e) {
            throw e;
        } catch (RuntimeException e) {
            return failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(),
                    FailureReason.EXCEPTION);
        }
    }

    // ------------------------------------------------------------------
    // Helpers for subclasses
    // ------------------------------------------------------------------

    /** Backend metadata first; the step's own stamp always wins. */
    protected StepResult success(Object data, Map<String, Object> extra) {
        Map<String, Object> meta = new LinkedHashMap<>();
        if (extra != null) {
            meta.putAll(extra);
        }
        meta.remove(StepResult.FAILURE_REASON);
        meta.putAll(stamp());
        return new StepResult(true, data, null, meta);
    }

    protected StepResult failure(String error, FailureReason reason) {
        Map<String, Object> meta = stamp();
        meta.put(StepResult.FAILURE_REASON, reason);
        return new StepResult(false, null, error, meta);
    }

    /** Map a backend answer onto a stamped StepResult. */
    protected StepResult fromBackend(BackendResult r) {
        if (r == null) {
            return failure("backend returned no result", FailureReason.BACKEND_FAILURE);
        }
        if (!r.success()) {
            String error = r.error() != null ? r.error() : name + " failed";
            return failure(error, FailureReason.BACKEND_FAILURE);
        }
        return success(r.data(), r.metadata());
    }

    private Map<String, Object> stamp() {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(StepResult.STEP_NAME, name);
        meta.put(StepResult.TIMESTAMP, Instant.now());
        return meta;
    }

    @Override
    public String toString() {
        return type() + "(" + name + ")";
    }
}
