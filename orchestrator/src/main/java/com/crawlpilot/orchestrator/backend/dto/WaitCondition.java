package com.crawlpilot.orchestrator.backend.dto;

/**
 * What a wait step blocks on.
 *
 * @param selector  CSS selector to wait for; null means "just wait timeoutMs"
 * @param state     "visible" | "hidden" | "attached" | "detached"
 * @param timeoutMs upper bound for the wait
 */
public record WaitCondition(String selector, String state, long timeoutMs) {

    public static WaitCondition visible(String selector, long timeoutMs) {
        return new WaitCondition(selector, "visible", timeoutMs);
    }
}
