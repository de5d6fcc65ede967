package com.crawlpilot.orchestrator.step;

/** Kind of backend operation a step performs. */
public enum StepType {
    NAVIGATE,
    WAIT,
    SNAPSHOT,
    CLICK,
    SCREENSHOT
}
