package com.crawlpilot.orchestrator.step;

import com.crawlpilot.orchestrator.backend.BrowserBackend;
import com.crawlpilot.orchestrator.model.SessionMetadata;
import com.crawlpilot.orchestrator.model.StepNames;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Captures the page HTML and annotates the result with what it found.
 *
 * <p>Result metadata added on success: hasExpandButton, hasImages,
 * textLength, imageCount. The initial capture also records hasExpandButton
 * on the session; the final one records the word and image counts.
 */
public final class SnapshotStep extends CrawlStep {

    public enum Phase { INITIAL, FINAL }

    public static final String HAS_EXPAND_BUTTON = "hasExpandButton";
    public static final String HAS_IMAGES        = "hasImages";
    public static final String TEXT_LENGTH       = "textLength";
    public static final String IMAGE_COUNT       = "imageCount";

    /** Substrings that betray a collapsed article with an expand control. */
    public static final List<String> EXPAND_MARKERS = List.of(
            "展开全文",
            "rich_media_js",
            "show more",
            "data-action=\"expand\"");

    private static final Pattern IMG_TAG = Pattern.compile("<img\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG     = Pattern.compile("<[^>]*>");

    private final Phase phase;

    public SnapshotStep(BrowserBackend backend, Phase phase) {
        super(backend,
                phase == Phase.INITIAL ? StepNames.INITIAL_SNAPSHOT : StepNames.FINAL_SNAPSHOT,
                phase == Phase.INITIAL ? "Capture the page before expanding" : "Capture the final article",
                StepPolicy.retryable(15_000));
        this.phase = phase;
    }

    public Phase phase() {
        return phase;
    }

    @Override
    public StepType type() {
        return StepType.SNAPSHOT;
    }

    @Override
    protected StepResult execute(CrawlContext ctx) {
        return fromBackend(backend.snapshot(ctx.sessionId(), null, timeoutMs()));
    }

    @Override
    protected StepResult postExecute(CrawlContext ctx, StepResult result) {
        if (!result.success()) {
            return result;
        }
        String html = result.contentAsString();
        boolean expandable = hasExpandMarker(html);
        int images = countImages(html);
        int textLength = visibleText(html).length();

        switch (phase) {
            case INITIAL -> ctx.recordMetadata(SessionMetadata.expandFlag(expandable));
            case FINAL   -> ctx.recordMetadata(SessionMetadata.counts(textLength, images));
        }
        return result.withMetadata(Map.of(
                HAS_EXPAND_BUTTON, expandable,
                HAS_IMAGES,        images > 0,
                TEXT_LENGTH,       textLength,
                IMAGE_COUNT,       images));
    }

    // ------------------------------------------------------------------
    // Page analysis
    // ------------------------------------------------------------------

    public static boolean hasExpandMarker(String html) {
        if (html == null || html.isEmpty()) return false;
        String lower = html.toLowerCase(Locale.ROOT);
        return EXPAND_MARKERS.stream().anyMatch(m -> lower.contains(m.toLowerCase(Locale.ROOT)));
    }

    static int countImages(String html) {
        Matcher m = IMG_TAG.matcher(html);
        int count = 0;
        while (m.find()) count++;
        return count;
    }

    static String visibleText(String html) {
        return TAG.matcher(html).replaceAll(" ").replaceAll("\\s+", " ").trim();
    }
}
