package com.crawlpilot.orchestrator.config;

import com.crawlpilot.orchestrator.model.CrawlOptions;
import com.crawlpilot.orchestrator.model.OutputFormat;
import com.crawlpilot.orchestrator.step.ArticleUrlPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Beans built from {@code crawlpilot.*} properties.
 *
 * See application.yml for the defaults.
 */
@Configuration
public class CrawlConfiguration {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    ArticleUrlPolicy articleUrlPolicy(
            @Value("${crawlpilot.url.host:mp.weixin.qq.com}") String host,
            @Value("${crawlpilot.url.path-prefix:/s/}") String pathPrefix) {
        return new ArticleUrlPolicy(host, pathPrefix);
    }

    /** Options used when a request leaves a field out. */
    @Bean
    CrawlOptions defaultCrawlOptions(
            @Value("${crawlpilot.crawl.output-format:MARKDOWN}") OutputFormat outputFormat,
            @Value("${crawlpilot.crawl.default-timeout-ms:30000}") long timeoutMs,
            @Value("${crawlpilot.crawl.retry-attempts:3}") int retryAttempts,
            @Value("${crawlpilot.crawl.delay-between-steps-ms:1000}") long delayBetweenStepsMs) {
        return new CrawlOptions(outputFormat, true, true, timeoutMs, retryAttempts, delayBetweenStepsMs);
    }
}
