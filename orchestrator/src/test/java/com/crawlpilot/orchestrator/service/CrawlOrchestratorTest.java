package com.crawlpilot.orchestrator.service;

import com.crawlpilot.orchestrator.MutableClock;
import com.crawlpilot.orchestrator.backend.BackendException;
import com.crawlpilot.orchestrator.backend.BackendResult;
import com.crawlpilot.orchestrator.backend.BrowserBackend;
import com.crawlpilot.orchestrator.backend.dto.WaitCondition;
import com.crawlpilot.orchestrator.extract.MetadataExtractor;
import com.crawlpilot.orchestrator.extract.RegexMetadataExtractor;
import com.crawlpilot.orchestrator.model.CancellationToken;
import com.crawlpilot.orchestrator.model.CrawlError;
import com.crawlpilot.orchestrator.model.CrawlOptions;
import com.crawlpilot.orchestrator.model.CrawlResult;
import com.crawlpilot.orchestrator.model.OutputFormat;
import com.crawlpilot.orchestrator.model.SessionState;
import com.crawlpilot.orchestrator.model.SessionStatus;
import com.crawlpilot.orchestrator.model.SessionStatusValue;
import com.crawlpilot.orchestrator.model.StepNames;
import com.crawlpilot.orchestrator.output.CrawlResultHandler;
import com.crawlpilot.orchestrator.state.SessionStateStore;
import com.crawlpilot.orchestrator.step.ArticleUrlPolicy;
import com.crawlpilot.orchestrator.step.CrawlContext;
import com.crawlpilot.orchestrator.step.CrawlStep;
import com.crawlpilot.orchestrator.step.StepCatalog;
import com.crawlpilot.orchestrator.step.StepResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CrawlOrchestrator.
 *
 * The browser backend is a Mockito mock; everything else (catalog, executor,
 * store, re-plan rule, assembler, extractor) is real. No Spring context.
 */
@ExtendWith(MockitoExtension.class)
class CrawlOrchestratorTest {

    static final String URL = "https://mp.weixin.qq.com/s/abc";

    static final String PLAIN_PAGE = "<div class=\"rich_media_content\"><p>short article</p></div>";
    static final String COLLAPSED_PAGE =
            "<div class=\"rich_media_content\"><p>teaser</p><a class=\"rich_media_js\">展开全文</a></div>";
    static final String FINAL_PAGE =
            "<h1 id=\"activity-name\">Hello</h1><div id=\"js_content\"><p>body text</p></div>";

    static final CrawlOptions OPTIONS = new CrawlOptions(OutputFormat.MARKDOWN, true, true, 30_000, 3, 0);

    @Mock BrowserBackend     backend;
    @Mock CrawlResultHandler resultHandler;

    MutableClock      clock;
    SessionStateStore store;
    CrawlOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        store = new SessionStateStore(clock, Duration.ofHours(24).toMillis(), Duration.ofHours(1).toMillis());
        orchestrator = orchestrator(new RegexMetadataExtractor(), true);

        lenient().when(backend.navigate(anyString(), anyString(), anyLong())).thenReturn(BackendResult.ok(null));
        lenient().when(backend.waitFor(anyString(), any())).thenReturn(BackendResult.ok(null));
        lenient().when(backend.click(anyString(), anyString(), anyLong())).thenReturn(BackendResult.ok(null));
        lenient().when(backend.screenshot(anyString(), any())).thenReturn(BackendResult.ok("iVBORw0KGgo="));
        lenient().when(resultHandler.handle(any(), any())).thenReturn(Optional.empty());
    }

    @AfterEach
    void tearDown() {
        store.destroy();
    }

    private CrawlOrchestrator orchestrator(MetadataExtractor extractor, boolean enforceDeadline) {
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        StepCatalog catalog = new StepCatalog(backend, new ArticleUrlPolicy("mp.weixin.qq.com", "/s/"));
        return new CrawlOrchestrator(
                catalog,
                new StepExecutor(store, meters, 0),
                List.of(new NoExpandControlRule()),
                new CrawlResultAssembler(extractor),
                resultHandler,
                store,
                backend,
                meters,
                clock,
                OPTIONS,
                enforceDeadline);
    }

    private static WaitCondition selector(String css) {
        return argThat(c -> c != null && css.equals(c.selector()));
    }

    // ------------------------------------------------------------------
    // Happy paths and adaptive pruning
    // ------------------------------------------------------------------

    @Test
    void run_noExpandMarker_skipsClickAndContentWait() {
        when(backend.snapshot(anyString(), any(), anyLong()))
                .thenReturn(BackendResult.ok(PLAIN_PAGE), BackendResult.ok(FINAL_PAGE));

        CrawlResult result = orchestrator.run(URL, OPTIONS);

        assertThat(result.success()).isTrue();
        assertThat(result.title()).isEqualTo("Hello");
        assertThat(result.error()).isNull();
        verify(backend, never()).click(anyString(), anyString(), anyLong());
        verify(backend, never()).waitFor(anyString(), selector("#js_content"));
        verify(backend, never()).waitFor(anyString(), selector(".rich_media_js"));
        verify(backend, times(2)).snapshot(anyString(), any(), anyLong());
        verify(backend).screenshot(anyString(), any());
    }

    @Test
    void run_expandMarkerPresent_clicksAndWaitsForContent() {
        when(backend.snapshot(anyString(), any(), anyLong()))
                .thenReturn(BackendResult.ok(COLLAPSED_PAGE), BackendResult.ok(FINAL_PAGE));

        CrawlResult result = orchestrator.run(URL, OPTIONS);

        assertThat(result.success()).isTrue();
        verify(backend).click(anyString(), eq(".rich_media_js"), anyLong());
        verify(backend).waitFor(anyString(), selector("#js_content"));

        SessionState session = store.getSession(result.sessionId()).orElseThrow();
        assertThat(session.stepResults()).containsKeys(StepNames.CLICK_EXPAND, StepNames.WAIT_CONTENT_LOAD);
        assertThat(session.metadata().hasExpandButton()).isTrue();
        assertThat(store.getStatus(result.sessionId()).orElseThrow().progress()).isEqualTo(100);
    }

    @Test
    void run_stepsAreAttemptedInPlanOrder_navigateFirst() {
        when(backend.snapshot(anyString(), any(), anyLong()))
                .thenReturn(BackendResult.ok(PLAIN_PAGE), BackendResult.ok(FINAL_PAGE));

        orchestrator.run(URL, OPTIONS);

        InOrder order = inOrder(backend);
        order.verify(backend).navigate(anyString(), eq(URL), eq(30_000L));
        order.verify(backend).waitFor(anyString(), selector(".rich_media_content"));
        order.verify(backend).snapshot(anyString(), any(), anyLong());
        order.verify(backend).snapshot(anyString(), any(), anyLong());
        order.verify(backend).screenshot(anyString(), any());
        order.verify(backend).closeSession(anyString());
    }

    @Test
    void run_success_passesResultToHandlerAndRecordsFilePath() {
        when(backend.snapshot(anyString(), any(), anyLong()))
                .thenReturn(BackendResult.ok(PLAIN_PAGE), BackendResult.ok(FINAL_PAGE));
        when(resultHandler.handle(any(), eq(OPTIONS))).thenReturn(Optional.of(Path.of("out", "x.md")));

        CrawlResult result = orchestrator.run(URL, OPTIONS);

        assertThat(result.filePath()).isEqualTo(Path.of("out", "x.md").toString());
        SessionState session = store.getSession(result.sessionId()).orElseThrow();
        assertThat(session.metadata().title()).isEqualTo("Hello");
        assertThat(session.currentStep()).isEqualTo(SessionStateStore.COMPLETED);
    }

    // ------------------------------------------------------------------
    // Failure handling
    // ------------------------------------------------------------------

    @Test
    void run_navigateThrows_abortsBeforeAnyOtherStep() {
        when(backend.navigate(anyString(), anyString(), anyLong()))
                .thenThrow(new BackendException("navigate " + URL + " failed: Timeout 30000ms exceeded"));

        CrawlResult result = orchestrator.run(URL, OPTIONS);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("Timeout 30000ms exceeded");
        assertThat(store.getStatus(result.sessionId()).orElseThrow().status())
                .isEqualTo(SessionStatusValue.FAILED);
        // Navigate is not retryable: exactly one attempt, nothing after it.
        verify(backend, times(1)).navigate(anyString(), anyString(), anyLong());
        verify(backend, never()).waitFor(anyString(), any());
        verify(backend, never()).snapshot(anyString(), any(), anyLong());
        verify(backend, never()).click(anyString(), anyString(), anyLong());
        verify(backend, never()).screenshot(anyString(), any());
    }

    @Test
    void run_navigateReturnsFailure_abortsWithBackendError() {
        when(backend.navigate(anyString(), anyString(), anyLong()))
                .thenReturn(BackendResult.failed("net::ERR_NAME_NOT_RESOLVED"));

        CrawlResult result = orchestrator.run(URL, OPTIONS);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("net::ERR_NAME_NOT_RESOLVED");
        verify(backend, never()).snapshot(anyString(), any(), anyLong());
    }

    @Test
    void run_retryableStepAlwaysFails_attemptsExactlyRetryLimitThenContinues() {
        when(backend.waitFor(anyString(), selector(".rich_media_content")))
                .thenReturn(BackendResult.failed("selector not visible"));
        when(backend.snapshot(anyString(), any(), anyLong()))
                .thenReturn(BackendResult.ok(PLAIN_PAGE), BackendResult.ok(FINAL_PAGE));

        CrawlResult result = orchestrator.run(URL, OPTIONS);

        verify(backend, times(3)).waitFor(anyString(), selector(".rich_media_content"));
        verify(backend, times(2)).snapshot(anyString(), any(), anyLong());
        verify(backend).screenshot(anyString(), any());

        // The wait failure is recorded but does not fail the session.
        assertThat(result.success()).isTrue();
        List<CrawlError> errors = store.getSession(result.sessionId()).orElseThrow().errors();
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).stepName()).isEqualTo(StepNames.WAIT_PAGE_LOAD);
        assertThat(errors.get(0).retryable()).isTrue();
        assertThat(store.getStatus(result.sessionId()).orElseThrow().status())
                .isEqualTo(SessionStatusValue.COMPLETED);
    }

    @Test
    void run_retryAttemptsOption_boundsAttempts() {
        when(backend.waitFor(anyString(), selector(".rich_media_content")))
                .thenReturn(BackendResult.failed("selector not visible"));
        when(backend.snapshot(anyString(), any(), anyLong()))
                .thenReturn(BackendResult.ok(PLAIN_PAGE), BackendResult.ok(FINAL_PAGE));

        orchestrator.run(URL, OPTIONS.withRetryAttempts(5));

        verify(backend, times(5)).waitFor(anyString(), selector(".rich_media_content"));
    }

    @Test
    void run_finalSnapshotFails_reportsNoUsableContent() {
        when(backend.snapshot(anyString(), any(), anyLong()))
                .thenReturn(BackendResult.ok(PLAIN_PAGE), BackendResult.failed("page crashed"));

        CrawlResult result = orchestrator.run(URL, OPTIONS);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("no usable content");
        assertThat(store.getStatus(result.sessionId()).orElseThrow().status())
                .isEqualTo(SessionStatusValue.FAILED);
        verify(resultHandler, never()).handle(any(), any());
    }

    @Test
    void run_extractorThrows_caughtAndSessionFailed() {
        MetadataExtractor broken = html -> { throw new IllegalStateException("boom"); };
        CrawlOrchestrator withBrokenExtractor = orchestrator(broken, true);
        when(backend.snapshot(anyString(), any(), anyLong()))
                .thenReturn(BackendResult.ok(PLAIN_PAGE), BackendResult.ok(FINAL_PAGE));

        CrawlResult result = withBrokenExtractor.run(URL, OPTIONS);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("boom");
        SessionState session = store.getSession(result.sessionId()).orElseThrow();
        assertThat(session.errors()).extracting(CrawlError::message).anyMatch(m -> m.contains("boom"));
        assertThat(session.currentStep()).isEqualTo(SessionStateStore.FAILED);
    }

    @Test
    void run_unsupportedUrl_rejectedBeforeAnyBackendCall() {
        CrawlResult result = orchestrator.run("https://example.com/s/abc", OPTIONS);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("unsupported url");
        assertThat(store.getStatus(result.sessionId()).orElseThrow().status())
                .isEqualTo(SessionStatusValue.FAILED);
        verifyNoInteractions(backend);
    }

    @Test
    void run_malformedUrl_rejected() {
        CrawlResult result = orchestrator.run("not a url", OPTIONS);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("malformed url");
        verifyNoInteractions(backend);
    }

    // ------------------------------------------------------------------
    // Terminal state
    // ------------------------------------------------------------------

    @Test
    void run_alwaysLeavesSessionTerminal() {
        when(backend.snapshot(anyString(), any(), anyLong()))
                .thenReturn(BackendResult.ok(PLAIN_PAGE), BackendResult.ok(FINAL_PAGE));
        CrawlResult ok = orchestrator.run(URL, OPTIONS);

        when(backend.navigate(anyString(), anyString(), anyLong())).thenReturn(BackendResult.failed("down"));
        CrawlResult failed = orchestrator.run(URL, OPTIONS);

        assertThat(store.getStatus(ok.sessionId()).orElseThrow().status().isTerminal()).isTrue();
        assertThat(store.getStatus(failed.sessionId()).orElseThrow().status().isTerminal()).isTrue();
        assertThat(store.getStatus(ok.sessionId()).orElseThrow().endTime()).isNotNull();
    }

    // ------------------------------------------------------------------
    // Cancellation and deadline
    // ------------------------------------------------------------------

    @Test
    void cancel_duringNavigate_stopsBeforeNextStep() {
        when(backend.navigate(anyString(), anyString(), anyLong())).thenAnswer(inv -> {
            assertThat(orchestrator.cancel(inv.getArgument(0))).isTrue();
            return BackendResult.ok(null);
        });

        CrawlResult result = orchestrator.run(URL, OPTIONS);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("session cancelled");
        assertThat(store.getStatus(result.sessionId()).orElseThrow().status())
                .isEqualTo(SessionStatusValue.FAILED);
        verify(backend, never()).waitFor(anyString(), any());
        verify(backend).closeSession(result.sessionId());
    }

    @Test
    void cancel_unknownOrFinishedSession_returnsFalse() {
        assertThat(orchestrator.cancel("no-such-session")).isFalse();

        when(backend.snapshot(anyString(), any(), anyLong()))
                .thenReturn(BackendResult.ok(PLAIN_PAGE), BackendResult.ok(FINAL_PAGE));
        CrawlResult result = orchestrator.run(URL, OPTIONS);
        assertThat(orchestrator.cancel(result.sessionId())).isFalse();
    }

    @Test
    void run_pastSessionDeadline_abortsBeforeNextStep() {
        when(backend.navigate(anyString(), anyString(), anyLong())).thenAnswer(inv -> {
            clock.advance(Duration.ofHours(1));
            return BackendResult.ok(null);
        });

        CrawlResult result = orchestrator.run(URL, OPTIONS);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("session deadline exceeded");
        verify(backend, never()).waitFor(anyString(), any());
    }

    @Test
    void run_deadlinePassedAfterFinalSnapshot_keepsArticleAndSkipsScreenshot() {
        when(backend.snapshot(anyString(), any(), anyLong()))
                .thenReturn(BackendResult.ok(PLAIN_PAGE))
                .thenAnswer(inv -> {
                    clock.advance(Duration.ofMinutes(10));
                    return BackendResult.ok(FINAL_PAGE);
                });

        CrawlResult result = orchestrator.run(URL, OPTIONS);

        assertThat(result.success()).isTrue();
        assertThat(result.title()).isEqualTo("Hello");
        verify(backend, never()).screenshot(anyString(), any());

        List<CrawlError> errors = store.getSession(result.sessionId()).orElseThrow().errors();
        assertThat(errors).singleElement().satisfies(e -> {
            assertThat(e.stepName()).isEqualTo(StepNames.SCREENSHOT);
            assertThat(e.message()).contains("session deadline exceeded");
            assertThat(e.retryable()).isTrue();
        });
        assertThat(store.getStatus(result.sessionId()).orElseThrow().status())
                .isEqualTo(SessionStatusValue.COMPLETED);
    }

    @Test
    void deadlineFor_includesBackendRequestSlack() {
        when(backend.requestSlackMs()).thenReturn(10_000L);
        List<CrawlStep> plan = orchestrator.plan(URL, OPTIONS);
        Instant start = Instant.parse("2024-05-01T10:00:00Z");

        long withSlack = Duration.between(start, orchestrator.deadlineFor(plan, OPTIONS, start)).toMillis();

        // 1 navigate attempt + 3 attempts for each of the 6 retryable steps, plus one probe per click attempt.
        long withoutSlack = 30_000 + 3 * (15_000 + 10_000 + 15_000 + 15_000 + 7_000 + 10_000);
        assertThat(withSlack).isEqualTo(withoutSlack + (1 + 3 * 6 + 3) * 10_000L);
    }

    @Test
    void run_deadlineDisabled_slowSessionStillCompletes() {
        CrawlOrchestrator lenientDeadline = orchestrator(new RegexMetadataExtractor(), false);
        when(backend.navigate(anyString(), anyString(), anyLong())).thenAnswer(inv -> {
            clock.advance(Duration.ofHours(1));
            return BackendResult.ok(null);
        });
        when(backend.snapshot(anyString(), any(), anyLong()))
                .thenReturn(BackendResult.ok(PLAIN_PAGE), BackendResult.ok(FINAL_PAGE));

        assertThat(lenientDeadline.run(URL, OPTIONS).success()).isTrue();
    }

    @Test
    void deadlineFor_coversEveryAttemptBackoffAndDelay() {
        CrawlOptions opts = OPTIONS.withDelayBetweenStepsMs(1_000);
        List<CrawlStep> plan = orchestrator.plan(URL, opts);
        Instant start = Instant.parse("2024-05-01T10:00:00Z");

        Instant deadline = orchestrator.deadlineFor(plan, opts, start);

        // navigate 30s x1, waits 15s+10s x3, snapshots 15s x2 x3, click (5s+2s probe) x3,
        // screenshot 10s x3, six inter-step delays of 1s; base delay is 0 here.
        long expected = 30_000 + 3 * (15_000 + 10_000 + 15_000 + 15_000 + 7_000 + 10_000) + 6 * 1_000;
        assertThat(Duration.between(start, deadline).toMillis()).isEqualTo(expected);
    }

    // ------------------------------------------------------------------
    // Shared page
    // ------------------------------------------------------------------

    @Test
    void sharedPage_concurrentSessionsNeverOverlap() throws Exception {
        when(backend.sharedPage()).thenReturn(true);
        AtomicInteger onPage = new AtomicInteger();
        AtomicInteger maxOnPage = new AtomicInteger();
        when(backend.navigate(anyString(), anyString(), anyLong())).thenAnswer(inv -> {
            maxOnPage.accumulateAndGet(onPage.incrementAndGet(), Math::max);
            Thread.sleep(50);
            return BackendResult.ok(null);
        });
        doAnswer(inv -> {
            onPage.decrementAndGet();
            return null;
        }).when(backend).closeSession(anyString());
        when(backend.snapshot(anyString(), any(), anyLong())).thenReturn(BackendResult.ok(FINAL_PAGE));

        ExecutorService pool = Executors.newFixedThreadPool(3);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<CrawlResult>> runs = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                runs.add(pool.submit(() -> {
                    start.await();
                    return orchestrator.run(URL, OPTIONS);
                }));
            }
            start.countDown();
            for (Future<CrawlResult> run : runs) {
                assertThat(run.get(10, TimeUnit.SECONDS).success()).isTrue();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxOnPage.get()).isEqualTo(1);
        verify(backend, times(3)).navigate(anyString(), anyString(), anyLong());
    }

    @Test
    void sharedPage_cancelWhileQueued_returnsWithoutTouchingThePage() throws Exception {
        when(backend.sharedPage()).thenReturn(true);
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicReference<String> holder = new AtomicReference<>();
        when(backend.navigate(anyString(), anyString(), anyLong())).thenAnswer(inv -> {
            holder.set(inv.getArgument(0));
            holding.countDown();
            release.await(10, TimeUnit.SECONDS);
            return BackendResult.ok(null);
        });
        when(backend.snapshot(anyString(), any(), anyLong())).thenReturn(BackendResult.ok(FINAL_PAGE));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<CrawlResult> first = pool.submit(() -> orchestrator.run(URL, OPTIONS));
            assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();
            Future<CrawlResult> second = pool.submit(() -> orchestrator.run(URL, OPTIONS));

            String queuedId = cancelOtherSession(holder.get());
            CrawlResult cancelled = second.get(5, TimeUnit.SECONDS);

            assertThat(first.isDone()).isFalse();
            assertThat(cancelled.sessionId()).isEqualTo(queuedId);
            assertThat(cancelled.success()).isFalse();
            assertThat(cancelled.error()).isEqualTo("session cancelled");
            assertThat(store.getStatus(queuedId).orElseThrow().status()).isEqualTo(SessionStatusValue.FAILED);

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS).success()).isTrue();
            verify(backend, times(1)).navigate(anyString(), anyString(), anyLong());
            verify(backend, never()).closeSession(queuedId);
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    /** Cancels the first session other than {@code running} once it is registered. */
    private String cancelOtherSession(String running) throws InterruptedException {
        long until = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < until) {
            for (SessionStatus s : store.listStatuses()) {
                if (!s.sessionId().equals(running) && orchestrator.cancel(s.sessionId())) {
                    return s.sessionId();
                }
            }
            Thread.sleep(10);
        }
        throw new AssertionError("second session never started");
    }

    // ------------------------------------------------------------------
    // Planning and aggregation
    // ------------------------------------------------------------------

    @Test
    void plan_isCanonicalSevenSteps() {
        assertThat(orchestrator.plan(URL, OPTIONS)).extracting(CrawlStep::name).containsExactly(
                StepNames.NAVIGATE,
                StepNames.WAIT_PAGE_LOAD,
                StepNames.INITIAL_SNAPSHOT,
                StepNames.CLICK_EXPAND,
                StepNames.WAIT_CONTENT_LOAD,
                StepNames.FINAL_SNAPSHOT,
                StepNames.SCREENSHOT);
    }

    @Test
    void assemble_sameInputsTwice_givesEqualResults() {
        CrawlResultAssembler assembler = new CrawlResultAssembler(new RegexMetadataExtractor());
        Instant start = Instant.parse("2024-05-01T10:00:00Z");
        CrawlContext ctx = new CrawlContext("s-1", URL, OPTIONS, store, new CancellationToken(), start);
        ctx.record(StepNames.FINAL_SNAPSHOT, new StepResult(true, FINAL_PAGE, null, Map.of()));
        Instant finishedAt = start.plusSeconds(12);

        CrawlResult first  = assembler.assemble(ctx, finishedAt);
        CrawlResult second = assembler.assemble(ctx, finishedAt);

        assertThat(first).isEqualTo(second);
        assertThat(first.durationMs()).isEqualTo(12_000);
        assertThat(first.title()).isEqualTo("Hello");
    }

    @Test
    void assemble_saveImagesOff_dropsImageReferences() {
        CrawlResultAssembler assembler = new CrawlResultAssembler(new RegexMetadataExtractor());
        Instant start = Instant.parse("2024-05-01T10:00:00Z");
        String page = FINAL_PAGE + "<img data-src=\"https://mmbiz.qpic.cn/a?wx_fmt=png\">";
        CrawlOptions noImages = new CrawlOptions(OutputFormat.MARKDOWN, false, true, 30_000, 3, 0);

        CrawlContext with = new CrawlContext("s-1", URL, OPTIONS, store, new CancellationToken(), start);
        with.record(StepNames.FINAL_SNAPSHOT, new StepResult(true, page, null, Map.of()));
        CrawlContext without = new CrawlContext("s-2", URL, noImages, store, new CancellationToken(), start);
        without.record(StepNames.FINAL_SNAPSHOT, new StepResult(true, page, null, Map.of()));

        assertThat(assembler.assemble(with, start).images()).hasSize(1);
        assertThat(assembler.assemble(without, start).images()).isEmpty();
    }
}
