package com.waterfront.listings.config;

import com.waterfront.listings.crawl.search.CrawlLimits;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrawlerPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("waterfront-listings/0.1"));
    }

    @Test
    void concurrencyAndTimeoutAreClamped() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setGlobalConcurrency(0);
        properties.setRequestTimeoutSeconds(-5);
        assertEquals(1, properties.getGlobalConcurrency());
        assertEquals(1, properties.getRequestTimeoutSeconds());
    }

    @Test
    void searchLimitsNeverGoNegative() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getSearch().setMaxPages(-1);
        properties.getSearch().setMaxEmptyPages(0);
        properties.getSearch().setPageDelayMs(-250);

        CrawlLimits limits = CrawlLimits.from(properties.getSearch());
        assertEquals(0, limits.maxPages());
        assertEquals(1, limits.maxEmptyPages());
        assertEquals(0, properties.getSearch().getPageDelayMs());
        assertFalse(limits.pageLimitReached(10_000));
    }

    @Test
    void gatewayModeIsNormalized() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getGateway().setMode(" Direct ");
        assertEquals("direct", properties.getGateway().getMode());
        properties.getGateway().setMode(null);
        assertEquals("zyte", properties.getGateway().getMode());
    }

    @Test
    void cacheIsDisabledWithoutDirectory() {
        CrawlerProperties properties = new CrawlerProperties();
        assertFalse(properties.getCache().isEnabled());
        properties.getCache().setDir("data/cache");
        assertTrue(properties.getCache().isEnabled());
    }
}
