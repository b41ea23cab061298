package com.waterfront.listings.crawl.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.waterfront.listings.config.CrawlerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads the dedup index from the listing store, falling back to the JSON snapshot file when the
 * store cannot be queried, and writes the snapshot back after a run.
 */
@Component
public class DedupIndexStore {
    private static final Logger log = LoggerFactory.getLogger(DedupIndexStore.class);
    private static final TypeReference<List<String>> ZPID_LIST = new TypeReference<>() {};

    private final ListingJdbcRepository repository;
    private final CrawlerProperties properties;
    private final ObjectMapper objectMapper;

    public DedupIndexStore(ListingJdbcRepository repository, CrawlerProperties properties, ObjectMapper objectMapper) {
        this.repository = repository;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public DedupIndex load() {
        try {
            DedupIndex index = new DedupIndex(repository.findExistingZpids());
            log.info("Loaded {} existing listing ids from the listing store", index.size());
            return index;
        } catch (DataAccessException e) {
            log.warn("Listing store unavailable for dedup index; falling back to snapshot file", e);
        }
        return loadSnapshot();
    }

    DedupIndex loadSnapshot() {
        Path path = snapshotPath();
        if (path == null || !Files.isRegularFile(path)) {
            log.warn("No dedup snapshot found at {}; starting with an empty index", path);
            return new DedupIndex();
        }
        try {
            List<String> zpids = objectMapper.readValue(path.toFile(), ZPID_LIST);
            DedupIndex index = new DedupIndex(zpids);
            log.info("Loaded {} existing listing ids from {}", index.size(), path);
            return index;
        } catch (IOException e) {
            log.error("Unreadable dedup snapshot at {}; starting with an empty index", path, e);
            return new DedupIndex();
        }
    }

    public void writeSnapshot(DedupIndex index) {
        Path path = snapshotPath();
        if (path == null || !properties.getDedup().isWriteSnapshot()) {
            return;
        }
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), index.snapshot());
            log.info("Wrote {} listing ids to dedup snapshot {}", index.size(), path);
        } catch (IOException e) {
            log.warn("Failed to write dedup snapshot {}", path, e);
        }
    }

    private Path snapshotPath() {
        String configured = properties.getDedup().getSnapshotPath();
        if (configured == null || configured.isBlank()) {
            return null;
        }
        return Path.of(configured.trim());
    }
}
