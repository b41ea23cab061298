package com.waterfront.listings.crawl.service;

import com.waterfront.listings.crawl.http.BoundedFetcher;
import com.waterfront.listings.crawl.listing.ListingRecordBuilder;
import com.waterfront.listings.crawl.model.FetchResult;
import com.waterfront.listings.crawl.model.ListingOutcome;
import com.waterfront.listings.crawl.model.ListingRecord;
import com.waterfront.listings.crawl.payload.ListingPayload;
import com.waterfront.listings.crawl.payload.PayloadExtractionException;
import com.waterfront.listings.crawl.payload.PayloadLocator;
import com.waterfront.listings.crawl.persistence.DedupIndex;
import com.waterfront.listings.crawl.persistence.ListingJdbcRepository;
import com.waterfront.listings.crawl.persistence.ListingPersistenceException;
import com.waterfront.listings.crawl.persistence.UpsertResult;
import com.waterfront.listings.crawl.report.CompletionTracker;
import com.waterfront.listings.crawl.util.ListingUrls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Fetch, locate, build and store for a single listing. Fetch and extraction problems end as a
 * failed or skipped outcome; {@link ListingPersistenceException} always propagates.
 */
@Service
public class ListingProcessor {
    private static final Logger log = LoggerFactory.getLogger(ListingProcessor.class);

    private final BoundedFetcher fetcher;
    private final PayloadLocator payloadLocator;
    private final ListingRecordBuilder recordBuilder;
    private final ListingJdbcRepository repository;
    private final CacheSnapshotStore cacheSnapshots;

    public ListingProcessor(
        BoundedFetcher fetcher,
        PayloadLocator payloadLocator,
        ListingRecordBuilder recordBuilder,
        ListingJdbcRepository repository,
        CacheSnapshotStore cacheSnapshots
    ) {
        this.fetcher = fetcher;
        this.payloadLocator = payloadLocator;
        this.recordBuilder = recordBuilder;
        this.repository = repository;
        this.cacheSnapshots = cacheSnapshots;
    }

    public ProcessedListing process(String url, CompletionTracker tracker, DedupIndex index) {
        FetchResult result = fetcher.fetch(url);
        if (!result.isSuccessful()) {
            log.warn("Fetch failed for {} ({}): {}", url, result.errorCode(), result.errorMessage());
            return ProcessedListing.of(ListingOutcome.failed(url, result.errorCode()));
        }

        ListingPayload payload;
        try {
            payload = payloadLocator.locate(result.content());
        } catch (PayloadExtractionException e) {
            log.warn("Skipping {} ({}): {}", url, e.reasonCode(), e.getMessage());
            return ProcessedListing.of(ListingOutcome.skipped(url, ListingUrls.zpidOf(url), e.reasonCode()));
        }
        return buildAndStore(payload, url, tracker, index, true);
    }

    /**
     * Rebuilds and stores a listing from a cache snapshot written by an earlier run.
     */
    public ProcessedListing reprocess(Path snapshot, CompletionTracker tracker, DedupIndex index) {
        String zpid = CacheSnapshotStore.zpidOf(snapshot);
        String sourceUrl = ListingUrls.MARKETPLACE_ORIGIN + "/homedetails/" + zpid + "_zpid/";
        ListingPayload payload;
        try {
            payload = payloadLocator.fromCacheSnapshot(cacheSnapshots.read(snapshot));
        } catch (IOException e) {
            log.warn("Unreadable cache snapshot {}", snapshot, e);
            return ProcessedListing.of(ListingOutcome.failed(sourceUrl, "io_error"));
        } catch (PayloadExtractionException e) {
            log.warn("Skipping cache snapshot {} ({}): {}", snapshot, e.reasonCode(), e.getMessage());
            return ProcessedListing.of(ListingOutcome.skipped(sourceUrl, zpid, e.reasonCode()));
        }
        return buildAndStore(payload, sourceUrl, tracker, index, false);
    }

    private ProcessedListing buildAndStore(
        ListingPayload payload,
        String url,
        CompletionTracker tracker,
        DedupIndex index,
        boolean snapshotCache
    ) {
        ListingRecord record;
        try {
            record = recordBuilder.build(payload, url);
        } catch (PayloadExtractionException e) {
            log.warn("Skipping {} ({}): {}", url, e.reasonCode(), e.getMessage());
            return ProcessedListing.of(ListingOutcome.skipped(url, ListingUrls.zpidOf(url), e.reasonCode()));
        } catch (RuntimeException e) {
            log.warn("Record build failed for {}", url, e);
            return ProcessedListing.of(ListingOutcome.failed(url, "build_error"));
        }

        if (snapshotCache) {
            cacheSnapshots.write(record.zpid(), payload.cache());
        }

        UpsertResult upsert = repository.upsert(record);
        tracker.record(record);
        tracker.recordStored();
        index.add(record.zpid());

        ListingOutcome.Status status = switch (upsert.action()) {
            case INSERT -> ListingOutcome.Status.INSERTED;
            case UPDATE -> ListingOutcome.Status.UPDATED;
            case NO_CHANGE -> ListingOutcome.Status.UNCHANGED;
        };
        boolean waterfront = record.summary().waterfront();
        log.info("Listing {} {} (waterfront={}, type={}, photos={})",
            record.zpid(), status, waterfront, record.summary().waterfrontType(), upsert.photosWritten());
        return new ProcessedListing(new ListingOutcome(url, record.zpid(), status, null, waterfront), record);
    }
}
