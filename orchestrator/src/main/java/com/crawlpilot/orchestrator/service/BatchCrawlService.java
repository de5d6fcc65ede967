package com.crawlpilot.orchestrator.service;

import com.crawlpilot.orchestrator.model.BatchCrawlOptions;
import com.crawlpilot.orchestrator.model.BatchCrawlResult;
import com.crawlpilot.orchestrator.model.CrawlException;
import com.crawlpilot.orchestrator.model.CrawlResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Crawls a list of URLs in groups.
 *
 * The list is cut into groups of at most {@code concurrentLimit} URLs. Each
 * group runs on a fixed worker pool and is awaited before the next one
 * starts, with {@code delaySeconds} in between. With {@code stopOnError} set,
 * a group containing a failure ends the batch and the remaining URLs are
 * reported as skipped.
 */
@Service
public class BatchCrawlService {

    private static final Logger log = LoggerFactory.getLogger(BatchCrawlService.class);

    private final CrawlOrchestrator orchestrator;
    private final Clock             clock;
    private final ExecutorService   workers;

    public BatchCrawlService(CrawlOrchestrator orchestrator,
                             Clock clock,
                             @Value("${crawlpilot.batch.worker-count:5}") int workerCount) {
        this.orchestrator = orchestrator;
        this.clock        = clock;
        AtomicInteger seq = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(workerCount, r -> {
            Thread t = new Thread(r, "crawl-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public BatchCrawlResult crawlBatch(List<String> urls, BatchCrawlOptions options) {
        validate(urls);
        Instant start = clock.instant();
        List<List<String>> groups = chunk(urls, options.concurrentLimit());
        log.info("Batch of {} URL(s) in {} group(s), concurrency {}",
                urls.size(), groups.size(), options.concurrentLimit());

        List<CrawlResult> results = new ArrayList<>(urls.size());
        for (int g = 0; g < groups.size(); g++) {
            List<CrawlResult> groupResults = runGroup(groups.get(g), options);
            results.addAll(groupResults);

            boolean groupFailed = groupResults.stream().anyMatch(r -> !r.success());
            if (groupFailed && options.stopOnError()) {
                log.warn("Stopping batch after group {}/{}: a crawl failed and stopOnError is set",
                        g + 1, groups.size());
                break;
            }
            if (g < groups.size() - 1 && options.delaySeconds() > 0) {
                pause(options.delaySeconds());
            }
        }

        Instant end = clock.instant();
        BatchCrawlResult result = summarize(urls.size(), results, start, end);
        log.info("Batch finished: {} succeeded, {} failed, {} skipped",
                result.successCount(), result.failedCount(), result.skippedCount());
        return result;
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private List<CrawlResult> runGroup(List<String> group, BatchCrawlOptions options) {
        List<Future<CrawlResult>> futures = new ArrayList<>(group.size());
        for (String url : group) {
            futures.add(workers.submit(() -> orchestrator.run(url, options.crawl())));
        }
        List<CrawlResult> results = new ArrayList<>(group.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(await(futures.get(i), group.get(i)));
        }
        return results;
    }

    private CrawlResult await(Future<CrawlResult> future, String url) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new CrawlException(CrawlException.Kind.CANCELLED, null, "batch interrupted", e);
        } catch (ExecutionException e) {
            // run() reports failures as results, so this is a bug in the worker itself.
            log.error("Crawl worker failed for {}", url, e.getCause());
            return CrawlResult.failed(url, null, "unexpected error: " + e.getCause().getMessage(),
                    clock.instant(), 0);
        }
    }

    private static void pause(int seconds) {
        try {
            TimeUnit.SECONDS.sleep(seconds);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrawlException(CrawlException.Kind.CANCELLED, null, "batch interrupted", e);
        }
    }

    static void validate(List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            throw new CrawlException(CrawlException.Kind.VALIDATION, "at least one URL is required");
        }
        if (urls.size() > BatchCrawlOptions.MAX_URLS) {
            throw new CrawlException(CrawlException.Kind.VALIDATION,
                    "at most " + BatchCrawlOptions.MAX_URLS + " URLs per batch, got " + urls.size());
        }
        if (urls.stream().anyMatch(u -> u == null || u.isBlank())) {
            throw new CrawlException(CrawlException.Kind.VALIDATION, "URLs must not be blank");
        }
    }

    static List<List<String>> chunk(List<String> urls, int size) {
        List<List<String>> groups = new ArrayList<>();
        for (int i = 0; i < urls.size(); i += size) {
            groups.add(List.copyOf(urls.subList(i, Math.min(i + size, urls.size()))));
        }
        return groups;
    }

    static BatchCrawlResult summarize(int total, List<CrawlResult> results, Instant start, Instant end) {
        List<CrawlResult> ok = results.stream().filter(CrawlResult::success).toList();
        int failed = results.size() - ok.size();
        long average = results.isEmpty() ? 0
                : Math.round(results.stream().mapToLong(CrawlResult::durationMs).average().orElse(0));

        BatchCrawlResult.AggregatedStats stats = new BatchCrawlResult.AggregatedStats(
                ok.stream().mapToInt(r -> r.images().size()).sum(),
                ok.stream().mapToLong(r -> r.content().length()).sum(),
                (int) Math.round(ok.size() * 100.0 / total),
                ok.stream().mapToLong(CrawlResult::durationMs).min().orElse(0),
                ok.stream().mapToLong(CrawlResult::durationMs).max().orElse(0));

        return new BatchCrawlResult(
                !ok.isEmpty(),
                total,
                ok.size(),
                failed,
                total - results.size(),
                List.copyOf(results),
                start,
                end,
                Duration.between(start, end).toMillis(),
                average,
                stats);
    }
}
