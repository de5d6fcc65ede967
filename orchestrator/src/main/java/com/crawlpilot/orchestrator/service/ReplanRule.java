package com.crawlpilot.orchestrator.service;

import com.crawlpilot.orchestrator.step.CrawlContext;
import com.crawlpilot.orchestrator.step.CrawlStep;
import com.crawlpilot.orchestrator.step.StepResult;

import java.util.List;

/**
 * Narrows the remaining plan based on what a finished step produced.
 *
 * Rules are Spring beans; the orchestrator consults every one of them after
 * each step. {@link #apply} must be a pure filter returning a new list.
 */
public interface ReplanRule {

    String name();

    boolean appliesAfter(CrawlStep finished, StepResult result, CrawlContext ctx);

    List<CrawlStep> apply(List<CrawlStep> remaining, CrawlContext ctx);
}
