package com.waterfront.listings.crawl.http;

import com.waterfront.listings.config.CrawlerProperties;
import com.waterfront.listings.crawl.model.FetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Gates every page fetch of a run: at most {@code crawler.global-concurrency} gateway calls are in
 * flight, and each is abandoned after {@code crawler.request-timeout-seconds}. Failures come back
 * as {@link FetchResult} error codes; nothing is retried here.
 */
@Service
public class BoundedFetcher {
    private static final Logger log = LoggerFactory.getLogger(BoundedFetcher.class);

    private final PageFetchGateway gateway;
    private final ExecutorService fetchExecutor;
    private final Semaphore globalLimiter;
    private final int maxConcurrent;
    private final long timeoutMillis;

    @Autowired
    public BoundedFetcher(
        CrawlerProperties properties,
        PageFetchGateway gateway,
        @Qualifier("fetchExecutor") ExecutorService fetchExecutor
    ) {
        this(gateway, fetchExecutor, properties.getGlobalConcurrency(), properties.getRequestTimeoutSeconds() * 1000L);
    }

    BoundedFetcher(PageFetchGateway gateway, ExecutorService fetchExecutor, int maxConcurrent, long timeoutMillis) {
        this.gateway = gateway;
        this.fetchExecutor = fetchExecutor;
        this.maxConcurrent = Math.max(1, maxConcurrent);
        this.globalLimiter = new Semaphore(this.maxConcurrent);
        this.timeoutMillis = Math.max(1, timeoutMillis);
    }

    public FetchResult fetch(String url) {
        Instant startedAt = Instant.now();
        try {
            globalLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.error(url, startedAt, "interrupted", "Interrupted waiting for a fetch slot");
        }

        // The permit belongs to whichever side claims the task first: the worker once it starts,
        // or this thread if the task is cancelled before it ever ran.
        AtomicBoolean claimed = new AtomicBoolean(false);
        Future<FetchResult> future;
        try {
            future = fetchExecutor.submit(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    return null;
                }
                try {
                    return gateway.fetch(url);
                } finally {
                    globalLimiter.release();
                }
            });
        } catch (RuntimeException e) {
            globalLimiter.release();
            return FetchResult.error(url, startedAt, "http_error", e.getMessage());
        }

        try {
            FetchResult result = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
            if (result == null) {
                return FetchResult.error(url, startedAt, "http_error", "Gateway returned no result");
            }
            return result;
        } catch (TimeoutException e) {
            abandon(future, claimed);
            log.debug("Fetch timed out after {}ms: {}", timeoutMillis, url);
            return FetchResult.error(url, startedAt, "timeout", "Fetch exceeded " + timeoutMillis + "ms");
        } catch (InterruptedException e) {
            abandon(future, claimed);
            Thread.currentThread().interrupt();
            return FetchResult.error(url, startedAt, "interrupted", e.getMessage());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return FetchResult.error(url, startedAt, "http_error", cause.getMessage());
        }
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public int inFlight() {
        return maxConcurrent - globalLimiter.availablePermits();
    }

    private void abandon(Future<FetchResult> future, AtomicBoolean claimed) {
        future.cancel(true);
        if (claimed.compareAndSet(false, true)) {
            globalLimiter.release();
        }
    }
}
