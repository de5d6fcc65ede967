package com.crawlpilot.orchestrator.backend;

import com.crawlpilot.orchestrator.backend.dto.ScreenshotRequest;
import com.crawlpilot.orchestrator.backend.dto.WaitCondition;

/**
 * The remote browser-automation capability a crawl session drives.
 *
 * Every call carries the owning session id so that implementations can keep
 * one page per session. Implementations report failure either by returning
 * {@code success=false} or by throwing {@link BackendException}; the step
 * layer treats both the same way.
 */
public interface BrowserBackend {

    BackendResult navigate(String sessionId, String url, long timeoutMs);

    /** Waits for {@code condition.selector()}, or for a fixed delay when the selector is null. */
    BackendResult waitFor(String sessionId, WaitCondition condition);

    /** Serialized page content, optionally restricted to {@code selector}. */
    BackendResult snapshot(String sessionId, String selector, long timeoutMs);

    BackendResult click(String sessionId, String selector, long timeoutMs);

    BackendResult screenshot(String sessionId, ScreenshotRequest request);

    /** Releases whatever the backend holds for the session. */
    default void closeSession(String sessionId) {}

    /**
     * True when the backend only exposes one implicit page, so sessions
     * must not overlap.
     */
    default boolean sharedPage() {
        return false;
    }

    /** Wall-clock time a call may take beyond its own timeout. */
    default long requestSlackMs() {
        return 0;
    }
}
