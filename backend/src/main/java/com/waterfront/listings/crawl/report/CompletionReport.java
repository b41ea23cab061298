package com.waterfront.listings.crawl.report;

import com.waterfront.listings.crawl.resolve.ResolutionSource;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Field-by-field completion of one run, ordered from best to worst covered.
 */
public record CompletionReport(
    String definitionsVersion,
    long processed,
    long stored,
    List<FieldCompletion> fields,
    double overallPercent,
    Map<ResolutionSource, Long> sourceTotals
) {
    public CompletionReport {
        fields = fields == null ? List.of() : List.copyOf(fields);
        sourceTotals = sourceTotals == null ? Map.of() : Map.copyOf(sourceTotals);
    }

    public static CompletionReport empty(String definitionsVersion) {
        return new CompletionReport(definitionsVersion, 0, 0, List.of(), 0.0, Map.of());
    }

    public long countIn(CompletionBucket bucket) {
        return fields.stream().filter(field -> field.bucket() == bucket).count();
    }

    public FieldCompletion field(String name) {
        for (FieldCompletion field : fields) {
            if (field.field().equals(name)) {
                return field;
            }
        }
        return null;
    }

    public String render() {
        String rule = "=".repeat(80);
        StringBuilder out = new StringBuilder();
        out.append(rule).append('\n')
            .append("FIELD COMPLETION REPORT (definitions ").append(definitionsVersion).append(")\n")
            .append(rule).append('\n')
            .append("Listings processed: ").append(processed).append('\n');
        if (processed == 0) {
            out.append("No listings processed.\n");
            return out.toString();
        }
        double storedPercent = stored * 100.0 / processed;
        out.append(String.format(Locale.ROOT, "Stored: %d/%d (%.1f%%)%n", stored, processed, storedPercent));

        for (CompletionBucket bucket : CompletionBucket.values()) {
            List<FieldCompletion> inBucket = fields.stream().filter(field -> field.bucket() == bucket).toList();
            if (inBucket.isEmpty()) {
                continue;
            }
            out.append('\n').append(bucket.name()).append(" (").append(bucket.label()).append("): ")
                .append(inBucket.size()).append(" fields\n");
            for (FieldCompletion field : inBucket) {
                out.append(String.format(Locale.ROOT, "  %-22s %5.1f%%  (%d/%d)%n",
                    field.field(), field.percent(), field.found(), field.total()));
            }
        }

        out.append('\n').append("Fields tracked: ").append(fields.size()).append('\n');
        out.append(String.format(Locale.ROOT, "Overall completion: %.1f%%%n", overallPercent));
        if (!sourceTotals.isEmpty()) {
            out.append("Values by source:");
            for (ResolutionSource source : ResolutionSource.values()) {
                Long count = sourceTotals.get(source);
                if (count != null && count > 0) {
                    out.append(' ').append(source.name()).append('=').append(count);
                }
            }
            out.append('\n');
        }
        return out.toString();
    }
}
