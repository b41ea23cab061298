package com.waterfront.listings.crawl.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.waterfront.listings.config.CrawlerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessResourceFailureException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DedupIndexStoreTest {
    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ListingJdbcRepository repository;
    private CrawlerProperties properties;
    private DedupIndexStore store;
    private Path snapshot;

    @BeforeEach
    void setUp() {
        repository = mock(ListingJdbcRepository.class);
        properties = new CrawlerProperties();
        snapshot = tempDir.resolve("state").resolve("existing_zpids.json");
        properties.getDedup().setSnapshotPath(snapshot.toString());
        store = new DedupIndexStore(repository, properties, objectMapper);
    }

    @Test
    void loadsFromListingStore() {
        when(repository.findExistingZpids()).thenReturn(Set.of("1", "2"));

        DedupIndex index = store.load();

        assertThat(index.snapshot()).containsExactly("1", "2");
    }

    @Test
    void fallsBackToSnapshotWhenStoreIsDown() throws Exception {
        Files.createDirectories(snapshot.getParent());
        Files.writeString(snapshot, "[\"501\", \"502\"]", StandardCharsets.UTF_8);
        when(repository.findExistingZpids()).thenThrow(new DataAccessResourceFailureException("connection refused"));

        DedupIndex index = store.load();

        assertThat(index.contains("501")).isTrue();
        assertThat(index.size()).isEqualTo(2);
    }

    @Test
    void missingOrCorruptSnapshotYieldsEmptyIndex() throws Exception {
        when(repository.findExistingZpids()).thenThrow(new DataAccessResourceFailureException("down"));
        assertThat(store.load().size()).isZero();

        Files.createDirectories(snapshot.getParent());
        Files.writeString(snapshot, "{not a list", StandardCharsets.UTF_8);
        assertThat(store.load().size()).isZero();
    }

    @Test
    void writesSortedSnapshotAndSkipsWhenDisabled() throws Exception {
        store.writeSnapshot(new DedupIndex(Set.of("9", "3")));

        assertThat(objectMapper.readValue(snapshot.toFile(), String[].class)).containsExactly("3", "9");

        Files.delete(snapshot);
        properties.getDedup().setWriteSnapshot(false);
        store.writeSnapshot(new DedupIndex(Set.of("4")));
        assertThat(snapshot).doesNotExist();
    }
}
