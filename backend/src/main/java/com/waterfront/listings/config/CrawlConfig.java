package com.waterfront.listings.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.waterfront.listings.crawl.http.DirectFetchGateway;
import com.waterfront.listings.crawl.http.PageFetchGateway;
import com.waterfront.listings.crawl.http.ZyteFetchGateway;
import com.waterfront.listings.crawl.resolve.FieldDefinitions;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class CrawlConfig {

    @Bean(name = "crawlExecutor", destroyMethod = "shutdown")
    public ExecutorService crawlExecutor(CrawlerProperties properties) {
        return Executors.newFixedThreadPool(properties.getGlobalConcurrency());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(CrawlerProperties properties) {
        int size = Math.max(4, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "fetchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService fetchExecutor(CrawlerProperties properties) {
        return Executors.newFixedThreadPool(properties.getGlobalConcurrency());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public FieldDefinitions fieldDefinitions() {
        return FieldDefinitions.defaults();
    }

    @Bean
    public PageFetchGateway pageFetchGateway(
        CrawlerProperties properties,
        ObjectMapper objectMapper,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        return switch (properties.getGateway().getMode()) {
            case "direct" -> new DirectFetchGateway(properties, httpExecutor);
            case "zyte" -> new ZyteFetchGateway(properties, objectMapper, httpExecutor);
            default -> throw new IllegalStateException(
                "Unknown crawler.gateway.mode: " + properties.getGateway().getMode()
            );
        };
    }
}
