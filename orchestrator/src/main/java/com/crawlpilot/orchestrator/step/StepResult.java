package com.crawlpilot.orchestrator.step;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one step attempt.
 *
 * @param data     backend payload (page HTML for snapshots), may be null
 * @param error    null on success
 * @param metadata always carries stepName and timestamp once stamped by {@link CrawlStep}
 */
public record StepResult(
        boolean             success,
        Object              data,
        String              error,
        Map<String, Object> metadata
) {
    public static final String STEP_NAME      = "stepName";
    public static final String TIMESTAMP      = "timestamp";
    public static final String FAILURE_REASON = "failureReason";

    public StepResult {
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /** Copy with {@code extra} merged over the existing metadata. */
    public StepResult withMetadata(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putAll(extra);
        return new StepResult(success, data, error, merged);
    }

    public Optional<FailureReason> failureReason() {
        Object reason = metadata.get(FAILURE_REASON);
        return reason instanceof FailureReason fr ? Optional.of(fr) : Optional.empty();
    }

    /** The data payload as a String, or "" if there is none. */
    public String contentAsString() {
        if (data == null) return "";
        if (data instanceof String s) return s;
        if (data instanceof Map<?, ?> map) {
            Object content = map.get("content");
            if (content == null) content = map.get("html");
            return content == null ? "" : content.toString();
        }
        return data.toString();
    }

    /** True when the metadata entry {@code key} is Boolean.TRUE. */
    public boolean flag(String key) {
        return Boolean.TRUE.equals(metadata.get(key));
    }
}
