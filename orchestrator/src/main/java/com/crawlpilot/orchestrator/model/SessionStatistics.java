package com.crawlpilot.orchestrator.model;

public record SessionStatistics(int total, int active, int completed, int failed) {}
