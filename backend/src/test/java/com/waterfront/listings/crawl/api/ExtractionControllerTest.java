package com.waterfront.listings.crawl.api;

import com.waterfront.listings.crawl.model.ExtractionRunRequest;
import com.waterfront.listings.crawl.model.ExtractionRunStatus;
import com.waterfront.listings.crawl.model.ExtractionRunSummary;
import com.waterfront.listings.crawl.persistence.ListingJdbcRepository;
import com.waterfront.listings.crawl.persistence.ListingPersistenceException;
import com.waterfront.listings.crawl.report.CompletionReport;
import com.waterfront.listings.crawl.service.ActiveExtractionRunException;
import com.waterfront.listings.crawl.service.ExtractionRunService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExtractionControllerTest {

    @Mock
    private ExtractionRunService extractionRunService;
    @Mock
    private ListingJdbcRepository repository;

    @Test
    void runRequestIsPassedThrough() {
        ExtractionRunSummary summary = summary();
        when(extractionRunService.run(any(ExtractionRunRequest.class))).thenReturn(summary);
        ExtractionController controller = new ExtractionController(extractionRunService, repository);

        ExtractionRunSummary result = controller.runExtraction(new ExtractionApiRunRequest(
            "https://www.zillow.com/naples-fl/waterfront/",
            List.of(),
            3,
            50,
            null
        ));

        assertSame(summary, result);
        ArgumentCaptor<ExtractionRunRequest> captor = ArgumentCaptor.forClass(ExtractionRunRequest.class);
        verify(extractionRunService).run(captor.capture());
        assertEquals(Integer.valueOf(3), captor.getValue().maxPages());
        assertEquals(Integer.valueOf(50), captor.getValue().maxProperties());
    }

    @Test
    void runWithNothingToDoIsRejected() {
        ExtractionController controller = new ExtractionController(extractionRunService, repository);

        ResponseStatusException ex = assertThrows(
            ResponseStatusException.class,
            () -> controller.runExtraction(new ExtractionApiRunRequest(" ", null, null, null, false))
        );
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        assertThrows(ResponseStatusException.class, () -> controller.runExtraction(null));
        verifyNoInteractions(extractionRunService);
    }

    @Test
    void latestIsNotFoundBeforeFirstRun() {
        when(extractionRunService.latest()).thenReturn(Optional.empty());
        ExtractionController controller = new ExtractionController(extractionRunService, repository);

        assertEquals(HttpStatus.NOT_FOUND, controller.latestExtraction().getStatusCode());
    }

    @Test
    void runIsLookedUpById() {
        ExtractionRunSummary summary = summary();
        when(extractionRunService.find("run-1")).thenReturn(Optional.of(summary));
        when(extractionRunService.find("run-2")).thenReturn(Optional.empty());
        ExtractionController controller = new ExtractionController(extractionRunService, repository);

        ResponseEntity<ExtractionRunSummary> found = controller.extraction("run-1");
        assertEquals(HttpStatus.OK, found.getStatusCode());
        assertSame(summary, found.getBody());
        assertEquals(HttpStatus.NOT_FOUND, controller.extraction("run-2").getStatusCode());
    }

    @Test
    void listingCountIncludesRunState() {
        when(repository.countListings()).thenReturn(12L);
        when(repository.countWaterfrontListings()).thenReturn(7L);
        when(extractionRunService.isRunning()).thenReturn(true);
        ExtractionController controller = new ExtractionController(extractionRunService, repository);

        Map<String, Object> counts = controller.listingCount();

        assertEquals(12L, counts.get("listings"));
        assertEquals(7L, counts.get("waterfront"));
        assertEquals(true, counts.get("runActive"));
    }

    @Test
    void handlerMapsRunConflictsAndStoreFailures() {
        ExtractionExceptionHandler handler = new ExtractionExceptionHandler();

        ResponseEntity<Map<String, String>> conflict = handler.handleActiveRun(
            new ActiveExtractionRunException("An extraction run is already in progress")
        );
        assertEquals(HttpStatus.CONFLICT, conflict.getStatusCode());
        assertEquals("active_extraction_run", conflict.getBody().get("error"));

        ResponseEntity<Map<String, String>> unavailable = handler.handlePersistence(
            new ListingPersistenceException("99", "Failed to store listing 99", new IllegalStateException("down"))
        );
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, unavailable.getStatusCode());
        assertEquals("99", unavailable.getBody().get("zpid"));
    }

    private static ExtractionRunSummary summary() {
        Instant now = Instant.parse("2025-03-01T12:00:00Z");
        return new ExtractionRunSummary(
            "run-1", ExtractionRunStatus.COMPLETED, now, now, null, null,
            0, 0, 0, 0, 0, 0, 0, 0, 0, 0, List.of(), null, CompletionReport.empty("test")
        );
    }
}
