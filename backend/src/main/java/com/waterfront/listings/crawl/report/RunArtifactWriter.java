package com.waterfront.listings.crawl.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.waterfront.listings.config.CrawlerProperties;
import com.waterfront.listings.crawl.model.ExtractionRunSummary;
import com.waterfront.listings.crawl.model.ListingRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

/**
 * Writes the operator-facing outputs of a run: the combined records, the run summary and the
 * field completion report. Files are never overwritten.
 */
@Component
public class RunArtifactWriter {
    private static final Logger log = LoggerFactory.getLogger(RunArtifactWriter.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss")
        .withZone(ZoneId.systemDefault());

    private final CrawlerProperties properties;
    private final ObjectMapper objectMapper;

    public RunArtifactWriter(CrawlerProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public Optional<RunArtifacts> write(ExtractionRunSummary summary, List<ListingRecord> records) {
        if (!properties.getOutput().isWriteArtifacts()) {
            return Optional.empty();
        }
        String ts = TIMESTAMP.format(summary.startedAt());
        Path dir = Path.of(properties.getOutput().getDir());
        try {
            Files.createDirectories(dir);
            Path combined = dir.resolve("combined_" + ts + ".json");
            Path runSummary = dir.resolve("run_summary_" + ts + ".json");
            Path report = dir.resolve("field_completion_report_" + ts + ".txt");

            try (Writer writer = newFile(combined)) {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(writer, records);
            }
            try (Writer writer = newFile(runSummary)) {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(writer, summary);
            }
            String rendered = summary.completion() == null ? "" : summary.completion().render();
            try (Writer writer = newFile(report)) {
                writer.write(rendered);
            }
            log.info("Run artifacts written to {} ({} records)", dir, records.size());
            return Optional.of(new RunArtifacts(combined, runSummary, report));
        } catch (FileAlreadyExistsException e) {
            log.warn("Run artifacts for {} already exist in {}; leaving them untouched", ts, dir);
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Failed to write run artifacts to {}", dir, e);
            return Optional.empty();
        }
    }

    private Writer newFile(Path path) throws IOException {
        return Files.newBufferedWriter(path, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    }

    public record RunArtifacts(Path combined, Path runSummary, Path completionReport) {
    }
}
