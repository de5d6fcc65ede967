package com.crawlpilot.orchestrator.api;

import com.crawlpilot.orchestrator.api.dto.BatchCrawlRequest;
import com.crawlpilot.orchestrator.api.dto.CrawlRequest;
import com.crawlpilot.orchestrator.model.BatchCrawlOptions;
import com.crawlpilot.orchestrator.model.BatchCrawlResult;
import com.crawlpilot.orchestrator.model.CrawlException;
import com.crawlpilot.orchestrator.model.CrawlOptions;
import com.crawlpilot.orchestrator.model.CrawlResult;
import com.crawlpilot.orchestrator.model.SessionStatistics;
import com.crawlpilot.orchestrator.model.SessionStatus;
import com.crawlpilot.orchestrator.service.BatchCrawlService;
import com.crawlpilot.orchestrator.service.CrawlOrchestrator;
import com.crawlpilot.orchestrator.state.SessionStateStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * REST API for crawl sessions.
 *
 * POST   /crawls                      : crawl one article (blocks until done)
 * POST   /crawls/batch                : crawl a list of articles in groups
 * GET    /crawls/sessions             : status of every known session, newest first
 * GET    /crawls/sessions/statistics  : session counts by state
 * GET    /crawls/sessions/{id}        : status of one session
 * POST   /crawls/sessions/{id}/cancel : stop an active session
 * DELETE /crawls/sessions/{id}        : forget a session
 */
@RestController
@RequestMapping("/crawls")
public class CrawlController {

    private final CrawlOrchestrator orchestrator;
    private final BatchCrawlService batchService;
    private final SessionStateStore store;

    public CrawlController(CrawlOrchestrator orchestrator,
                           BatchCrawlService batchService,
                           SessionStateStore store) {
        this.orchestrator = orchestrator;
        this.batchService = batchService;
        this.store        = store;
    }

    /**
     * Crawl one article.
     *
     * Example:
     *   curl -X POST http://localhost:8080/crawls \
     *     -H "Content-Type: application/json" \
     *     -d '{"url":"https://mp.weixin.qq.com/s/abc","outputFormat":"JSON"}'
     *
     * A crawl that fails still answers 200 with success=false; 400 is only
     * for requests rejected before any page is touched.
     */
    @PostMapping
    public CrawlResult crawl(@RequestBody CrawlRequest req) {
        CrawlOptions options;
        try {
            orchestrator.validateUrl(req.url());
            options = req.toOptions(orchestrator.defaultOptions());
        } catch (CrawlException e) {
            throw badRequest(e);
        }
        return orchestrator.run(req.url(), options);
    }

    @PostMapping("/batch")
    public BatchCrawlResult crawlBatch(@RequestBody BatchCrawlRequest req) {
        try {
            BatchCrawlOptions options = req.toOptions(orchestrator.defaultOptions());
            return batchService.crawlBatch(req.urls(), options);
        } catch (CrawlException e) {
            if (e.getKind() == CrawlException.Kind.VALIDATION) {
                throw badRequest(e);
            }
            throw e;
        }
    }

    @GetMapping("/sessions")
    public List<SessionStatus> listSessions() {
        return store.listStatuses();
    }

    @GetMapping("/sessions/statistics")
    public SessionStatistics statistics() {
        return store.statistics();
    }

    /** Returns 404 if the session is unknown or already swept. */
    @GetMapping("/sessions/{id}")
    public SessionStatus getSession(@PathVariable String id) {
        return store.getStatus(id)
                .orElseThrow(() -> notFound(id));
    }

    /**
     * HTTP 202: cancel signal delivered; the session stops at its next step
     * HTTP 404: no active session with this id
     */
    @PostMapping("/sessions/{id}/cancel")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable String id) {
        if (!orchestrator.cancel(id)) {
            throw notFound(id);
        }
        return ResponseEntity.accepted().body(Map.of("sessionId", id, "status", "cancelling"));
    }

    @DeleteMapping("/sessions/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        if (!store.removeSession(id)) {
            throw notFound(id);
        }
        return ResponseEntity.noContent().build();
    }

    private static ResponseStatusException notFound(String id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + id);
    }

    private static ResponseStatusException badRequest(CrawlException e) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getReason(), e);
    }
}
