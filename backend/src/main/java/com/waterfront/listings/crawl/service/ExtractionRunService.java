package com.waterfront.listings.crawl.service;

import com.waterfront.listings.config.CrawlerProperties;
import com.waterfront.listings.crawl.model.ExtractionRunRequest;
import com.waterfront.listings.crawl.model.ExtractionRunStatus;
import com.waterfront.listings.crawl.model.ExtractionRunSummary;
import com.waterfront.listings.crawl.model.ListingOutcome;
import com.waterfront.listings.crawl.model.ListingRecord;
import com.waterfront.listings.crawl.persistence.DedupIndex;
import com.waterfront.listings.crawl.persistence.DedupIndexStore;
import com.waterfront.listings.crawl.persistence.ListingPersistenceException;
import com.waterfront.listings.crawl.report.CompletionReport;
import com.waterfront.listings.crawl.report.CompletionTracker;
import com.waterfront.listings.crawl.report.RunArtifactWriter;
import com.waterfront.listings.crawl.resolve.FieldDefinitions;
import com.waterfront.listings.crawl.search.CrawlFrontierResult;
import com.waterfront.listings.crawl.search.CrawlLimits;
import com.waterfront.listings.crawl.search.SearchPaginationCrawler;
import com.waterfront.listings.crawl.search.StopReason;
import com.waterfront.listings.crawl.util.ListingUrls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs one extraction end to end: discover URLs, fan listing tasks out on the crawl executor,
 * collect outcomes and write the run artifacts. Only one run is active at a time.
 *
 * <p>A {@link ListingPersistenceException} from any listing aborts the run. Tasks that have not
 * started are skipped, and tasks already running are waited for before the summary is written and
 * the run is released. The summary is marked {@link ExtractionRunStatus#ABORTED} and the exception
 * is rethrown to the caller.
 */
@Service
public class ExtractionRunService {
    private static final Logger log = LoggerFactory.getLogger(ExtractionRunService.class);
    private static final int MAX_FAILED_URLS_IN_SUMMARY = 10;
    private static final int MAX_RECENT_RUNS = 20;

    private final CrawlerProperties properties;
    private final SearchPaginationCrawler crawler;
    private final ListingProcessor processor;
    private final DedupIndexStore dedupIndexStore;
    private final CacheSnapshotStore cacheSnapshots;
    private final RunArtifactWriter artifactWriter;
    private final FieldDefinitions definitions;
    private final ExecutorService crawlExecutor;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<ExtractionRunSummary> latest = new AtomicReference<>();
    private final Map<String, ExtractionRunSummary> recent = new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, ExtractionRunSummary> eldest) {
            return size() > MAX_RECENT_RUNS;
        }
    };

    public ExtractionRunService(
        CrawlerProperties properties,
        SearchPaginationCrawler crawler,
        ListingProcessor processor,
        DedupIndexStore dedupIndexStore,
        CacheSnapshotStore cacheSnapshots,
        RunArtifactWriter artifactWriter,
        FieldDefinitions definitions,
        @Qualifier("crawlExecutor") ExecutorService crawlExecutor
    ) {
        this.properties = properties;
        this.crawler = crawler;
        this.processor = processor;
        this.dedupIndexStore = dedupIndexStore;
        this.cacheSnapshots = cacheSnapshots;
        this.artifactWriter = artifactWriter;
        this.definitions = definitions;
        this.crawlExecutor = crawlExecutor;
    }

    public ExtractionRunSummary run(ExtractionRunRequest request) {
        if (!running.compareAndSet(false, true)) {
            throw new ActiveExtractionRunException("An extraction run is already in progress");
        }
        try {
            return execute(request == null ? new ExtractionRunRequest(null, null, null, null, null) : request);
        } finally {
            running.set(false);
        }
    }

    public Optional<ExtractionRunSummary> latest() {
        return Optional.ofNullable(latest.get());
    }

    /**
     * Summary of one of the most recent runs, looked up by run id.
     */
    public Optional<ExtractionRunSummary> find(String runId) {
        if (runId == null) {
            return Optional.empty();
        }
        synchronized (recent) {
            return Optional.ofNullable(recent.get(runId));
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private ExtractionRunSummary execute(ExtractionRunRequest request) {
        RunState state = new RunState(UUID.randomUUID().toString(), Instant.now(), request.searchUrl());
        DedupIndex index = dedupIndexStore.load();
        CompletionTracker tracker = new CompletionTracker(definitions.version(), definitions.trackedFields());

        List<Supplier<ProcessedListing>> tasks = new ArrayList<>();
        if (request.reprocessRequested()) {
            List<Path> snapshots = cacheSnapshots.list();
            state.discovered = snapshots.size();
            for (Path snapshot : snapshots) {
                tasks.add(() -> processor.reprocess(snapshot, tracker, index));
            }
            log.info("Run {} reprocessing {} cache snapshots", state.runId, snapshots.size());
        } else {
            List<String> urls = discover(request, index, state);
            for (String url : urls) {
                tasks.add(() -> processor.process(url, tracker, index));
            }
        }
        state.scheduled = tasks.size();

        ListingPersistenceException fatal = null;
        List<CompletableFuture<ProcessedListing>> futures = new ArrayList<>();
        AtomicBoolean aborting = new AtomicBoolean(false);
        for (Supplier<ProcessedListing> task : tasks) {
            futures.add(CompletableFuture.supplyAsync(
                () -> aborting.get() ? null : task.get(),
                crawlExecutor
            ));
        }

        // Every future is joined, so no listing task outlives the run once it has aborted.
        for (CompletableFuture<ProcessedListing> future : futures) {
            try {
                ProcessedListing processed = future.join();
                if (processed != null) {
                    state.collect(processed);
                }
            } catch (CompletionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof ListingPersistenceException persistence) {
                    if (fatal == null) {
                        fatal = persistence;
                        aborting.set(true);
                        log.error("Run {} aborted: listing store rejected {}", state.runId, persistence.getZpid(), persistence);
                    } else {
                        log.warn("Run {}: listing store also rejected {}", state.runId, persistence.getZpid());
                    }
                } else {
                    state.failed++;
                    log.warn("Listing task failed in run {}", state.runId, e);
                }
            }
        }

        CompletionReport completion = tracker.report();
        ExtractionRunSummary summary = state.toSummary(
            fatal == null ? ExtractionRunStatus.COMPLETED : ExtractionRunStatus.ABORTED,
            fatal == null ? null : fatal.getMessage(),
            completion
        );
        latest.set(summary);
        synchronized (recent) {
            recent.put(summary.runId(), summary);
        }
        dedupIndexStore.writeSnapshot(index);
        artifactWriter.write(summary, state.records);
        logSummary(summary);

        if (fatal != null) {
            throw fatal;
        }
        return summary;
    }

    private List<String> discover(ExtractionRunRequest request, DedupIndex index, RunState state) {
        // Keyed by listing id so two URL spellings of one listing are extracted once.
        Map<String, String> urls = new LinkedHashMap<>();
        if (request.hasSearchUrl()) {
            CrawlLimits limits = CrawlLimits.from(properties.getSearch())
                .withOverrides(request.maxPages(), request.maxProperties());
            CrawlFrontierResult frontier = crawler.crawl(request.searchUrl().trim(), limits, index);
            for (String url : frontier.urls()) {
                urls.putIfAbsent(dedupKey(url), url);
            }
            state.pagesVisited = frontier.pagesVisited();
            state.knownSkipped = frontier.knownSkipped();
            state.stopReason = frontier.stopReason();
        }
        // Explicitly requested URLs are re-extracted even when already stored, and replace a crawled
        // URL for the same listing.
        for (String url : request.urls()) {
            String canonical = ListingUrls.canonicalDetailUrl(url);
            if (canonical != null) {
                urls.put(dedupKey(canonical), canonical);
            }
        }
        state.discovered = urls.size();

        List<String> scheduled = new ArrayList<>(urls.values());
        Integer maxProperties = request.maxProperties();
        if (maxProperties != null && maxProperties > 0 && scheduled.size() > maxProperties) {
            scheduled = new ArrayList<>(scheduled.subList(0, maxProperties));
        }
        log.info("Run {} discovered {} listing URLs, scheduling {}", state.runId, urls.size(), scheduled.size());
        return scheduled;
    }

    private static String dedupKey(String url) {
        String zpid = ListingUrls.zpidOf(url);
        return zpid == null ? url : zpid;
    }

    private void logSummary(ExtractionRunSummary summary) {
        log.info(
            "Run {} {}: discovered={} scheduled={} inserted={} updated={} unchanged={} failed={} skipped={} waterfront={}",
            summary.runId(),
            summary.status(),
            summary.discovered(),
            summary.scheduled(),
            summary.inserted(),
            summary.updated(),
            summary.unchanged(),
            summary.failed(),
            summary.skipped(),
            summary.waterfront()
        );
        if (summary.completion() != null && summary.completion().processed() > 0) {
            log.info("\n{}", summary.completion().render());
        }
    }

    private static final class RunState {
        private final String runId;
        private final Instant startedAt;
        private final String searchUrl;
        private final List<ListingRecord> records = new ArrayList<>();
        private final List<String> failedUrls = new ArrayList<>();
        private StopReason stopReason;
        private int pagesVisited;
        private int discovered;
        private int knownSkipped;
        private int scheduled;
        private int inserted;
        private int updated;
        private int unchanged;
        private int failed;
        private int skipped;
        private int waterfront;

        private RunState(String runId, Instant startedAt, String searchUrl) {
            this.runId = runId;
            this.startedAt = startedAt;
            this.searchUrl = searchUrl;
        }

        private void collect(ProcessedListing processed) {
            ListingOutcome outcome = processed.outcome();
            switch (outcome.status()) {
                case INSERTED -> inserted++;
                case UPDATED -> updated++;
                case UNCHANGED -> unchanged++;
                case SKIPPED -> skipped++;
                case FAILED -> {
                    failed++;
                    if (failedUrls.size() < MAX_FAILED_URLS_IN_SUMMARY) {
                        failedUrls.add(outcome.url());
                    }
                }
            }
            if (outcome.waterfront()) {
                waterfront++;
            }
            if (processed.record() != null) {
                records.add(processed.record());
            }
        }

        private ExtractionRunSummary toSummary(ExtractionRunStatus status, String errorMessage, CompletionReport completion) {
            return new ExtractionRunSummary(
                runId,
                status,
                startedAt,
                Instant.now(),
                searchUrl,
                stopReason,
                pagesVisited,
                discovered,
                knownSkipped,
                scheduled,
                inserted,
                updated,
                unchanged,
                failed,
                skipped,
                waterfront,
                failedUrls,
                errorMessage,
                completion
            );
        }
    }
}
