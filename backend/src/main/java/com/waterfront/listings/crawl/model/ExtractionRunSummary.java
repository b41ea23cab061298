package com.waterfront.listings.crawl.model;

import com.waterfront.listings.crawl.report.CompletionReport;
import com.waterfront.listings.crawl.search.StopReason;

import java.time.Instant;
import java.util.List;

public record ExtractionRunSummary(
    String runId,
    ExtractionRunStatus status,
    Instant startedAt,
    Instant finishedAt,
    String searchUrl,
    StopReason stopReason,
    int pagesVisited,
    int discovered,
    int knownSkipped,
    int scheduled,
    int inserted,
    int updated,
    int unchanged,
    int failed,
    int skipped,
    int waterfront,
    List<String> failedUrls,
    String errorMessage,
    CompletionReport completion
) {
    public ExtractionRunSummary {
        failedUrls = failedUrls == null ? List.of() : List.copyOf(failedUrls);
    }

    public int stored() {
        return inserted + updated + unchanged;
    }
}
