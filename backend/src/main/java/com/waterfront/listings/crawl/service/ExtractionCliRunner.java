package com.waterfront.listings.crawl.service;

import com.waterfront.listings.config.CrawlerProperties;
import com.waterfront.listings.crawl.model.ExtractionRunRequest;
import com.waterfront.listings.crawl.model.ExtractionRunSummary;
import com.waterfront.listings.crawl.persistence.ListingPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

@Component
public class ExtractionCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ExtractionCliRunner.class);

    private final CrawlerProperties properties;
    private final ExtractionRunService extractionRunService;
    private final ConfigurableApplicationContext applicationContext;

    public ExtractionCliRunner(
        CrawlerProperties properties,
        ExtractionRunService extractionRunService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.extractionRunService = extractionRunService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        CrawlerProperties.Cli cli = properties.getCli();
        List<String> urls = Arrays.stream(cli.getUrls().split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
        String searchUrl = cli.getSearchUrl().isBlank() ? null : cli.getSearchUrl().trim();

        ExtractionRunRequest request = new ExtractionRunRequest(
            searchUrl,
            urls,
            null,
            cli.getLimit() > 0 ? cli.getLimit() : null,
            cli.isReprocessCache()
        );

        int exitCode = 0;
        try {
            ExtractionRunSummary summary = extractionRunService.run(request);
            log.info(
                "Extraction run {} finished with status {} ({} stored, {} failed, {} skipped)",
                summary.runId(),
                summary.status(),
                summary.stored(),
                summary.failed(),
                summary.skipped()
            );
        } catch (ListingPersistenceException e) {
            log.error("Extraction run aborted: listing store unavailable", e);
            exitCode = 1;
        }

        if (cli.isExitAfterRun()) {
            int finalExitCode = exitCode;
            int code = SpringApplication.exit(applicationContext, () -> finalExitCode);
            System.exit(code);
        }
    }
}
