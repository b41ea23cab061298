package com.waterfront.listings.crawl.service;

import com.waterfront.listings.config.CrawlerProperties;
import com.waterfront.listings.crawl.model.ExtractionRunRequest;
import com.waterfront.listings.crawl.persistence.ListingPersistenceException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ExtractionCliRunnerTest {
    private final ExtractionRunService extractionRunService = mock(ExtractionRunService.class);
    private final ConfigurableApplicationContext context = mock(ConfigurableApplicationContext.class);

    @Test
    void doesNothingUnlessEnabled() {
        CrawlerProperties properties = new CrawlerProperties();

        new ExtractionCliRunner(properties, extractionRunService, context).run(new DefaultApplicationArguments());

        verifyNoInteractions(extractionRunService);
    }

    @Test
    void buildsRunRequestFromCliSettings() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getCli().setRun(true);
        properties.getCli().setExitAfterRun(false);
        properties.getCli().setSearchUrl(" https://www.zillow.com/naples-fl/waterfront/ ");
        properties.getCli().setUrls("https://www.zillow.com/homedetails/1_zpid/, ,https://www.zillow.com/homedetails/2_zpid/");
        properties.getCli().setLimit(25);

        new ExtractionCliRunner(properties, extractionRunService, context).run(new DefaultApplicationArguments());

        ArgumentCaptor<ExtractionRunRequest> captor = ArgumentCaptor.forClass(ExtractionRunRequest.class);
        verify(extractionRunService).run(captor.capture());
        ExtractionRunRequest request = captor.getValue();
        assertThat(request.searchUrl()).isEqualTo("https://www.zillow.com/naples-fl/waterfront/");
        assertThat(request.urls()).isEqualTo(List.of(
            "https://www.zillow.com/homedetails/1_zpid/",
            "https://www.zillow.com/homedetails/2_zpid/"
        ));
        assertThat(request.maxProperties()).isEqualTo(25);
        assertThat(request.reprocessRequested()).isFalse();
    }

    @Test
    void storeFailureIsLoggedNotThrown() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getCli().setRun(true);
        properties.getCli().setExitAfterRun(false);
        properties.getCli().setReprocessCache(true);
        when(extractionRunService.run(any(ExtractionRunRequest.class)))
            .thenThrow(new ListingPersistenceException("7", "Failed to store listing 7", new IllegalStateException("down")));

        assertThatCode(() -> new ExtractionCliRunner(properties, extractionRunService, context).run(new DefaultApplicationArguments()))
            .doesNotThrowAnyException();
    }
}
