package com.waterfront.listings.crawl.api;

import com.waterfront.listings.crawl.model.ExtractionRunRequest;
import com.waterfront.listings.crawl.model.ExtractionRunSummary;
import com.waterfront.listings.crawl.persistence.ListingJdbcRepository;
import com.waterfront.listings.crawl.service.ExtractionRunService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class ExtractionController {
    private final ExtractionRunService extractionRunService;
    private final ListingJdbcRepository repository;

    public ExtractionController(ExtractionRunService extractionRunService, ListingJdbcRepository repository) {
        this.extractionRunService = extractionRunService;
        this.repository = repository;
    }

    @PostMapping("/extraction/run")
    public ExtractionRunSummary runExtraction(@RequestBody(required = false) ExtractionApiRunRequest request) {
        ExtractionRunRequest runRequest = request == null
            ? new ExtractionRunRequest(null, null, null, null, null)
            : new ExtractionRunRequest(
                request.searchUrl(),
                request.urls(),
                request.maxPages(),
                request.maxProperties(),
                request.reprocessCache()
            );
        if (!runRequest.hasSearchUrl() && runRequest.urls().isEmpty() && !runRequest.reprocessRequested()) {
            throw new ResponseStatusException(BAD_REQUEST, "searchUrl, urls or reprocessCache is required");
        }
        return extractionRunService.run(runRequest);
    }

    @GetMapping("/extraction/latest")
    public ResponseEntity<ExtractionRunSummary> latestExtraction() {
        return extractionRunService.latest()
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    // Run ids are UUIDs, which keeps "run" and "latest" out of this mapping.
    @GetMapping("/extraction/{runId:[0-9a-fA-F-]{36}}")
    public ResponseEntity<ExtractionRunSummary> extraction(@PathVariable String runId) {
        return extractionRunService.find(runId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/listings/count")
    public Map<String, Object> listingCount() {
        Map<String, Object> counts = new LinkedHashMap<>();
        counts.put("listings", repository.countListings());
        counts.put("waterfront", repository.countWaterfrontListings());
        counts.put("runActive", extractionRunService.isRunning());
        return counts;
    }
}
