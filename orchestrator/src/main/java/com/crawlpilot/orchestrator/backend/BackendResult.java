package com.crawlpilot.orchestrator.backend;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one backend operation: {success, data?, error?, metadata?}.
 *
 * Also the JSON shape returned by every /browser/* endpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BackendResult(
        boolean success,
        Object data,
        String error,
        Map<String, Object> metadata
) {
    public BackendResult {
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static BackendResult ok(Object data) {
        return new BackendResult(true, data, null, Map.of());
    }

    public static BackendResult ok(Object data, Map<String, Object> metadata) {
        return new BackendResult(true, data, null, metadata);
    }

    public static BackendResult failed(String error) {
        return new BackendResult(false, null, error, Map.of());
    }
}
