package com.waterfront.listings.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "waterfront-listings/0.1 (+contact)";

    private String userAgent;
    private int globalConcurrency = 5;
    private int requestTimeoutSeconds = 30;
    private Gateway gateway = new Gateway();
    private Search search = new Search();
    private Dedup dedup = new Dedup();
    private Output output = new Output();
    private Cache cache = new Cache();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public Gateway getGateway() {
        return gateway;
    }

    public void setGateway(Gateway gateway) {
        this.gateway = gateway;
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    public Dedup getDedup() {
        return dedup;
    }

    public void setDedup(Dedup dedup) {
        this.dedup = dedup;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Gateway {
        private String mode = "zyte";
        private String endpoint = "https://api.zyte.com/v1/extract";
        private String apiKey = "";

        public String getMode() {
            return mode == null || mode.isBlank() ? "zyte" : mode.trim().toLowerCase();
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKey() {
            return apiKey == null ? "" : apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }
    }

    public static class Search {
        private String baseUrl = "https://www.zillow.com";
        private int maxPages = 0;
        private int maxProperties = 0;
        private int maxEmptyPages = 5;
        private int emptyPageGrace = 3;
        private long pageDelayMs = 1000;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        /**
         * Zero means no page limit; the empty-page streak still ends the crawl.
         */
        public int getMaxPages() {
            return Math.max(0, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(0, maxPages);
        }

        public int getMaxProperties() {
            return Math.max(0, maxProperties);
        }

        public void setMaxProperties(int maxProperties) {
            this.maxProperties = Math.max(0, maxProperties);
        }

        public int getMaxEmptyPages() {
            return Math.max(1, maxEmptyPages);
        }

        public void setMaxEmptyPages(int maxEmptyPages) {
            this.maxEmptyPages = Math.max(1, maxEmptyPages);
        }

        public int getEmptyPageGrace() {
            return Math.max(0, emptyPageGrace);
        }

        public void setEmptyPageGrace(int emptyPageGrace) {
            this.emptyPageGrace = Math.max(0, emptyPageGrace);
        }

        public long getPageDelayMs() {
            return Math.max(0, pageDelayMs);
        }

        public void setPageDelayMs(long pageDelayMs) {
            this.pageDelayMs = Math.max(0, pageDelayMs);
        }
    }

    public static class Dedup {
        private String snapshotPath = "data/existing_zpids.json";
        private boolean writeSnapshot = true;

        public String getSnapshotPath() {
            return snapshotPath;
        }

        public void setSnapshotPath(String snapshotPath) {
            this.snapshotPath = snapshotPath;
        }

        public boolean isWriteSnapshot() {
            return writeSnapshot;
        }

        public void setWriteSnapshot(boolean writeSnapshot) {
            this.writeSnapshot = writeSnapshot;
        }
    }

    public static class Output {
        private String dir = "data/runs";
        private boolean writeArtifacts = true;

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }

        public boolean isWriteArtifacts() {
            return writeArtifacts;
        }

        public void setWriteArtifacts(boolean writeArtifacts) {
            this.writeArtifacts = writeArtifacts;
        }
    }

    public static class Cache {
        private String dir = "";

        public String getDir() {
            return dir == null ? "" : dir.trim();
        }

        public void setDir(String dir) {
            this.dir = dir;
        }

        public boolean isEnabled() {
            return !getDir().isEmpty();
        }
    }

    public static class Cli {
        private boolean run;
        private String searchUrl = "";
        private String urls = "";
        private int limit = 0;
        private boolean reprocessCache;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getSearchUrl() {
            return searchUrl == null ? "" : searchUrl;
        }

        public void setSearchUrl(String searchUrl) {
            this.searchUrl = searchUrl;
        }

        public String getUrls() {
            return urls == null ? "" : urls;
        }

        public void setUrls(String urls) {
            this.urls = urls;
        }

        public int getLimit() {
            return Math.max(0, limit);
        }

        public void setLimit(int limit) {
            this.limit = Math.max(0, limit);
        }

        public boolean isReprocessCache() {
            return reprocessCache;
        }

        public void setReprocessCache(boolean reprocessCache) {
            this.reprocessCache = reprocessCache;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
