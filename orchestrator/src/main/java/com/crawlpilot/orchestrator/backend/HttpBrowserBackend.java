package com.crawlpilot.orchestrator.backend;

import com.crawlpilot.orchestrator.backend.dto.ScreenshotRequest;
import com.crawlpilot.orchestrator.backend.dto.WaitCondition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP client for the remote browser-automation service.
 *
 * Each backend operation maps to one POST /browser/{op} endpoint that takes
 * a JSON body and answers with a {@link BackendResult}. Uses
 * java.net.http.HttpClient directly so every header and byte on the wire is
 * explicit.
 *
 * Called from the session's own thread, so blocking I/O is fine here.
 */
@Component
public class HttpBrowserBackend implements BrowserBackend {

    private static final Logger log = LoggerFactory.getLogger(HttpBrowserBackend.class);

    // Extra wall-clock time on top of the browser-side timeout.
    private static final Duration REQUEST_SLACK = Duration.ofSeconds(10);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final boolean      sharedPage;

    public HttpBrowserBackend(
            @Value("${crawlpilot.backend.base-url}") String baseUrl,
            @Value("${crawlpilot.backend.shared-page:true}") boolean sharedPage,
            ObjectMapper objectMapper) {
        this.baseUrl    = baseUrl;
        this.sharedPage = sharedPage;
        this.json       = objectMapper;
        this.http       = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // Page operations
    // ------------------------------------------------------------------

    @Override
    public BackendResult navigate(String sessionId, String url, long timeoutMs) {
        log.info("Navigating session '{}' to {}", sessionId, url);
        Map<String, Object> body = Map.of(
                "session_id", sessionId,
                "url",        url,
                "wait_until", "domcontentloaded",
                "timeout_ms", timeoutMs);
        return call("/browser/navigate", body, "navigate " + url, timeoutMs);
    }

    @Override
    public BackendResult waitFor(String sessionId, WaitCondition condition) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("session_id", sessionId);
        if (condition.selector() != null) {
            body.put("selector", condition.selector());
            body.put("state",    condition.state());
        }
        body.put("timeout_ms", condition.timeoutMs());
        return call("/browser/wait_for", body,
                "waitFor " + condition.selector(), condition.timeoutMs());
    }

    @Override
    public BackendResult snapshot(String sessionId, String selector, long timeoutMs) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("session_id", sessionId);
        body.put("full_page",  true);
        if (selector != null) {
            body.put("selector", selector);
        }
        body.put("timeout_ms", timeoutMs);
        return call("/browser/snapshot", body, "snapshot", timeoutMs);
    }

    @Override
    public BackendResult click(String sessionId, String selector, long timeoutMs) {
        Map<String, Object> body = Map.of(
                "session_id", sessionId,
                "selector",   selector,
                "button",     "left",
                "timeout_ms", timeoutMs);
        return call("/browser/click", body, "click " + selector, timeoutMs);
    }

    @Override
    public BackendResult screenshot(String sessionId, ScreenshotRequest request) {
        Map<String, Object> body = Map.of(
                "session_id", sessionId,
                "full_page",  request.fullPage(),
                "type",       request.format(),
                "timeout_ms", request.timeoutMs());
        return call("/browser/screenshot", body, "screenshot", request.timeoutMs());
    }

    /**
     * Close the page the backend holds for this session.
     *
     * @throws BackendException if the backend rejects the request
     */
    @Override
    public void closeSession(String sessionId) {
        log.debug("Closing backend page for session '{}'", sessionId);
        post("/browser/close", toJson(Map.of("session_id", sessionId)),
                "closeSession " + sessionId, Duration.ofSeconds(30));
    }

    @Override
    public boolean sharedPage() {
        return sharedPage;
    }

    @Override
    public long requestSlackMs() {
        return REQUEST_SLACK.toMillis();
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    /** POST and decode the response as a BackendResult. */
    private BackendResult call(String path, Map<String, Object> body, String opName, long timeoutMs) {
        String respBody = post(path, toJson(body), opName,
                Duration.ofMillis(timeoutMs).plus(REQUEST_SLACK));
        try {
            return json.readValue(respBody, BackendResult.class);
        } catch (JsonProcessingException e) {
            throw new BackendException("Failed to parse " + opName + " response", e);
        }
    }

    /** POST with an explicit timeout; returns response body as String. */
    private String post(String path, String jsonBody, String opName, Duration timeout) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new BackendException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (BackendException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new BackendException(opName + " failed: " + e.getMessage(), e);
        }
    }

    /** Serialize obj to JSON string; throws BackendException on failure. */
    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new BackendException("JSON serialization failed", e);
        }
    }
}
