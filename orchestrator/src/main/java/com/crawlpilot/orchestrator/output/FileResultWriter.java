package com.crawlpilot.orchestrator.output;

import com.crawlpilot.orchestrator.model.CrawlOptions;
import com.crawlpilot.orchestrator.model.CrawlResult;
import com.crawlpilot.orchestrator.model.OutputFormat;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Writes each result to {@code <output-dir>/<sessionId>.md} or {@code .json}.
 *
 * The Markdown file is a front-matter-style header followed by the raw page
 * content; turning that HTML into real Markdown belongs to the content
 * pipeline.
 */
@Component
public class FileResultWriter implements CrawlResultHandler {

    private static final Logger log = LoggerFactory.getLogger(FileResultWriter.class);

    private final Path         outputDir;
    private final ObjectMapper json;

    public FileResultWriter(@Value("${crawlpilot.output.dir:./crawled_articles}") String outputDir,
                            ObjectMapper objectMapper) {
        this.outputDir = Path.of(outputDir);
        this.json      = objectMapper;
    }

    @Override
    public Optional<Path> handle(CrawlResult result, CrawlOptions options) {
        OutputFormat format = options.outputFormat();
        Path target = outputDir.resolve(result.sessionId() + (format == OutputFormat.JSON ? ".json" : ".md"));
        try {
            Files.createDirectories(outputDir);
            String body = switch (format) {
                case JSON     -> json.writerWithDefaultPrettyPrinter().writeValueAsString(result);
                case MARKDOWN -> markdown(result);
            };
            Files.writeString(target, body, StandardCharsets.UTF_8);
            log.info("Saved session {} to {}", result.sessionId(), target);
            return Optional.of(target);
        } catch (IOException e) {
            log.warn("Could not save session {} to {}: {}", result.sessionId(), target, e.getMessage());
            return Optional.empty();
        }
    }

    static String markdown(CrawlResult r) {
        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(r.title()).append("\n\n");
        sb.append("- author: ").append(r.author()).append('\n');
        if (!r.publishTime().isEmpty()) {
            sb.append("- published: ").append(r.publishTime()).append('\n');
        }
        sb.append("- source: ").append(r.url()).append('\n');
        sb.append("- crawled: ").append(r.crawlTime()).append("\n\n");
        sb.append(r.content()).append('\n');
        return sb.toString();
    }
}
