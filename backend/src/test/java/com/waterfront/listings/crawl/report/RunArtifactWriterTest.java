package com.waterfront.listings.crawl.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.waterfront.listings.config.CrawlerProperties;
import com.waterfront.listings.crawl.model.ExtractionRunStatus;
import com.waterfront.listings.crawl.model.ExtractionRunSummary;
import com.waterfront.listings.crawl.model.ListingRecord;
import com.waterfront.listings.crawl.search.StopReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.waterfront.listings.crawl.ListingRecordFixtures.waterfrontListing;
import static org.assertj.core.api.Assertions.assertThat;

class RunArtifactWriterTest {
    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private CrawlerProperties properties;
    private RunArtifactWriter writer;

    @BeforeEach
    void setUp() {
        properties = new CrawlerProperties();
        properties.getOutput().setDir(tempDir.resolve("runs").toString());
        writer = new RunArtifactWriter(properties, objectMapper);
    }

    @Test
    void writesCombinedRecordsSummaryAndReport() throws Exception {
        List<ListingRecord> records = List.of(waterfrontListing("11", 450_000L), waterfrontListing("12", 520_000L));
        CompletionTracker tracker = new CompletionTracker("test-1", List.of("zpid", "price"));
        records.forEach(tracker::record);

        Optional<RunArtifactWriter.RunArtifacts> artifacts = writer.write(summary(tracker.report()), records);

        assertThat(artifacts).isPresent();
        assertThat(artifacts.get().combined().getFileName().toString()).startsWith("combined_").endsWith(".json");
        JsonNode combined = objectMapper.readTree(artifacts.get().combined().toFile());
        assertThat(combined).hasSize(2);
        assertThat(combined.get(0).path("summary").path("zpid").asText()).isEqualTo("11");
        assertThat(combined.get(0).path("detail").path("extractedFields").path("reso_has_dock").asBoolean()).isTrue();

        JsonNode runSummary = objectMapper.readTree(artifacts.get().runSummary().toFile());
        assertThat(runSummary.path("status").asText()).isEqualTo("COMPLETED");
        assertThat(runSummary.path("inserted").asInt()).isEqualTo(2);

        String report = Files.readString(artifacts.get().completionReport(), StandardCharsets.UTF_8);
        assertThat(report).contains("Listings processed: 2");
    }

    @Test
    void neverOverwritesAnEarlierRunsArtifacts() throws Exception {
        ExtractionRunSummary summary = summary(CompletionReport.empty("test-1"));
        RunArtifactWriter.RunArtifacts first = writer.write(summary, List.of(waterfrontListing("11", 1L))).orElseThrow();
        String original = Files.readString(first.combined(), StandardCharsets.UTF_8);

        Optional<RunArtifactWriter.RunArtifacts> second = writer.write(summary, List.of());

        assertThat(second).isEmpty();
        assertThat(Files.readString(first.combined(), StandardCharsets.UTF_8)).isEqualTo(original);
    }

    @Test
    void disabledOutputWritesNothing() {
        properties.getOutput().setWriteArtifacts(false);

        assertThat(writer.write(summary(CompletionReport.empty("test-1")), List.of())).isEmpty();
        assertThat(tempDir.resolve("runs")).doesNotExist();
    }

    private static ExtractionRunSummary summary(CompletionReport completion) {
        Instant startedAt = Instant.parse("2025-03-01T12:00:00Z");
        return new ExtractionRunSummary(
            "run-1",
            ExtractionRunStatus.COMPLETED,
            startedAt,
            startedAt.plusSeconds(90),
            "https://www.zillow.com/fort-lauderdale-fl/waterfront/",
            StopReason.EMPTY_STREAK,
            6,
            2,
            0,
            2,
            2,
            0,
            0,
            0,
            0,
            2,
            List.of(),
            null,
            completion
        );
    }
}
