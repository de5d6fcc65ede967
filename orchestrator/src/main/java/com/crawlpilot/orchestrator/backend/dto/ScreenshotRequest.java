package com.crawlpilot.orchestrator.backend.dto;

/**
 * Options for a screenshot call.
 *
 * @param fullPage  capture the whole scrollable page instead of the viewport
 * @param format    "png" | "jpeg"
 * @param timeoutMs upper bound for the capture
 */
public record ScreenshotRequest(boolean fullPage, String format, long timeoutMs) {

    public static ScreenshotRequest fullPagePng(long timeoutMs) {
        return new ScreenshotRequest(true, "png", timeoutMs);
    }
}
