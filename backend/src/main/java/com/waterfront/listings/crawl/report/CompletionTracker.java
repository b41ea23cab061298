package com.waterfront.listings.crawl.report;

import com.waterfront.listings.crawl.model.ListingRecord;
import com.waterfront.listings.crawl.resolve.FieldResolution;
import com.waterfront.listings.crawl.resolve.ResolutionSource;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Run-scoped counters of how often each tracked field was found, and by which source. Listing
 * workers record concurrently.
 */
public class CompletionTracker {
    private final String definitionsVersion;
    private final List<String> trackedFields;
    private final LongAdder processed = new LongAdder();
    private final LongAdder stored = new LongAdder();
    private final Map<String, LongAdder> found = new ConcurrentHashMap<>();
    private final Map<String, Map<ResolutionSource, LongAdder>> bySource = new ConcurrentHashMap<>();

    public CompletionTracker(String definitionsVersion, List<String> trackedFields) {
        this.definitionsVersion = definitionsVersion;
        this.trackedFields = List.copyOf(trackedFields);
        for (String field : this.trackedFields) {
            found.put(field, new LongAdder());
            bySource.put(field, new ConcurrentHashMap<>());
        }
    }

    public void record(ListingRecord record) {
        processed.increment();
        Map<String, FieldResolution> resolutions = record.resolutions();
        for (String field : trackedFields) {
            FieldResolution resolution = resolutions.get(field);
            if (resolution == null || !resolution.found()) {
                continue;
            }
            found.get(field).increment();
            bySource.get(field).computeIfAbsent(resolution.source(), key -> new LongAdder()).increment();
        }
    }

    public void recordStored() {
        stored.increment();
    }

    public long processed() {
        return processed.sum();
    }

    public CompletionReport report() {
        long total = processed.sum();
        List<FieldCompletion> rows = new ArrayList<>();
        Map<ResolutionSource, Long> sourceTotals = new EnumMap<>(ResolutionSource.class);
        double percentSum = 0.0;
        for (String field : trackedFields) {
            long fieldFound = found.get(field).sum();
            double percent = total == 0 ? 0.0 : fieldFound * 100.0 / total;
            Map<ResolutionSource, Long> sources = new LinkedHashMap<>();
            bySource.get(field).forEach((source, count) -> {
                sources.put(source, count.sum());
                sourceTotals.merge(source, count.sum(), Long::sum);
            });
            rows.add(new FieldCompletion(field, fieldFound, total, percent, CompletionBucket.forPercent(percent), sources));
            percentSum += percent;
        }
        rows.sort(Comparator.comparingDouble(FieldCompletion::percent).reversed()
            .thenComparing(FieldCompletion::field));
        double overall = trackedFields.isEmpty() ? 0.0 : percentSum / trackedFields.size();
        return new CompletionReport(definitionsVersion, total, stored.sum(), rows, overall, sourceTotals);
    }
}
