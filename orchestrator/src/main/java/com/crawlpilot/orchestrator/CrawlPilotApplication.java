package com.crawlpilot.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CrawlPilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrawlPilotApplication.class, args);
    }
}
