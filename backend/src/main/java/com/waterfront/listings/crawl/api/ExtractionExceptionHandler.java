package com.waterfront.listings.crawl.api;

import com.waterfront.listings.crawl.persistence.ListingPersistenceException;
import com.waterfront.listings.crawl.service.ActiveExtractionRunException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ExtractionExceptionHandler {

  @ExceptionHandler(ActiveExtractionRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveExtractionRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_extraction_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(ListingPersistenceException.class)
  public ResponseEntity<Map<String, String>> handlePersistence(ListingPersistenceException ex) {
    String zpid = ex.getZpid() == null ? "" : ex.getZpid();
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "listing_store_unavailable", "zpid", zpid, "message", String.valueOf(ex.getMessage())));
  }
}
