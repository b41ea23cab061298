package com.waterfront.listings.crawl.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.waterfront.listings.config.CrawlerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Keeps the located listing cache of each page as {@code {zpid}_cache.json} under
 * {@code crawler.cache.dir}, so records can be rebuilt later without fetching again.
 */
@Component
public class CacheSnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(CacheSnapshotStore.class);
    static final String SUFFIX = "_cache.json";

    private final CrawlerProperties properties;
    private final ObjectMapper objectMapper;

    public CacheSnapshotStore(CrawlerProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public boolean isEnabled() {
        return properties.getCache().isEnabled();
    }

    public void write(String zpid, JsonNode cache) {
        if (!isEnabled() || zpid == null || cache == null || cache.isMissingNode()) {
            return;
        }
        Path target = directory().resolve(zpid + SUFFIX);
        try {
            Files.createDirectories(directory());
            objectMapper.writeValue(target.toFile(), cache);
        } catch (IOException e) {
            log.warn("Failed to write cache snapshot {}", target, e);
        }
    }

    public List<Path> list() {
        if (!isEnabled() || !Files.isDirectory(directory())) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory())) {
            return files
                .filter(path -> path.getFileName().toString().endsWith(SUFFIX))
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to list cache snapshots in " + directory(), e);
        }
    }

    public String read(Path snapshot) throws IOException {
        return Files.readString(snapshot, StandardCharsets.UTF_8);
    }

    public static String zpidOf(Path snapshot) {
        String name = snapshot.getFileName().toString();
        return name.endsWith(SUFFIX) ? name.substring(0, name.length() - SUFFIX.length()) : null;
    }

    private Path directory() {
        return Path.of(properties.getCache().getDir().trim());
    }
}
