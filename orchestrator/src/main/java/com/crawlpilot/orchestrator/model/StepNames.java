package com.crawlpilot.orchestrator.model;

import java.util.List;

/**
 * Names of the steps in the canonical crawl plan.
 */
public final class StepNames {

    public static final String NAVIGATE          = "navigate";
    public static final String WAIT_PAGE_LOAD    = "wait_page_load";
    public static final String INITIAL_SNAPSHOT  = "initial_snapshot";
    public static final String CLICK_EXPAND      = "click_expand";
    public static final String WAIT_CONTENT_LOAD = "wait_content_load";
    public static final String FINAL_SNAPSHOT    = "final_snapshot";
    public static final String SCREENSHOT        = "screenshot";

    /**
     * Steps counted towards session progress. wait_content_load is left out
     * because it only runs when an expand control exists.
     */
    public static final List<String> CANONICAL = List.of(
            NAVIGATE,
            WAIT_PAGE_LOAD,
            INITIAL_SNAPSHOT,
            CLICK_EXPAND,
            FINAL_SNAPSHOT,
            SCREENSHOT
    );

    private StepNames() {}
}
