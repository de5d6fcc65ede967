package com.crawlpilot.orchestrator.model;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancel signal for one session.
 *
 * The orchestrator checks it before every step attempt, and every delay in
 * the session waits on it through {@link #sleep}, so a cancel wakes a
 * sleeping session immediately.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CrawlException(CrawlException.Kind.CANCELLED, "session cancelled");
        }
    }

    /**
     * Sleep for {@code duration} unless cancelled first.
     *
     * @throws CrawlException CANCELLED if the token fires or the thread is interrupted
     */
    public void sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            throwIfCancelled();
            return;
        }
        try {
            if (cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new CrawlException(CrawlException.Kind.CANCELLED, "session cancelled");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrawlException(CrawlException.Kind.CANCELLED, null, "session interrupted", e);
        }
    }
}
