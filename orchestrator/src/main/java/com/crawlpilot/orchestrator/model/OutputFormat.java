package com.crawlpilot.orchestrator.model;

public enum OutputFormat {
    MARKDOWN,
    JSON
}
