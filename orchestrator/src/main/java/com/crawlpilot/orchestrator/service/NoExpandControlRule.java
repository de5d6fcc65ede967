package com.crawlpilot.orchestrator.service;

import com.crawlpilot.orchestrator.model.StepNames;
import com.crawlpilot.orchestrator.step.CrawlContext;
import com.crawlpilot.orchestrator.step.CrawlStep;
import com.crawlpilot.orchestrator.step.SnapshotStep;
import com.crawlpilot.orchestrator.step.StepResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Drops the expand click and the content-load wait when the initial
 * capture shows no expand control.
 */
@Component
public class NoExpandControlRule implements ReplanRule {

    @Override
    public String name() {
        return "no-expand-control";
    }

    @Override
    public boolean appliesAfter(CrawlStep finished, StepResult result, CrawlContext ctx) {
        return StepNames.INITIAL_SNAPSHOT.equals(finished.name())
                && result.success()
                && !result.flag(SnapshotStep.HAS_EXPAND_BUTTON);
    }

    @Override
    public List<CrawlStep> apply(List<CrawlStep> remaining, CrawlContext ctx) {
        return remaining.stream()
                .filter(step -> !isExpandRelated(step.name()))
                .toList();
    }

    private static boolean isExpandRelated(String stepName) {
        return stepName.contains("click")
                || stepName.contains("expand")
                || stepName.equals(StepNames.WAIT_CONTENT_LOAD);
    }
}
