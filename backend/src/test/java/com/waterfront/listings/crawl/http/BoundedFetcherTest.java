package com.waterfront.listings.crawl.http;

import com.waterfront.listings.crawl.model.FetchResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class BoundedFetcherTest {
    private ExecutorService fetchExecutor;
    private ExecutorService callers;

    @AfterEach
    void tearDown() {
        if (fetchExecutor != null) {
            fetchExecutor.shutdownNow();
        }
        if (callers != null) {
            callers.shutdownNow();
        }
    }

    @Test
    void neverExceedsConfiguredConcurrency() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        PageFetchGateway gateway = url -> {
            Instant startedAt = Instant.now();
            int now = active.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(40);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                active.decrementAndGet();
            }
            return FetchResult.success(url, 200, "ok", startedAt);
        };
        fetchExecutor = Executors.newFixedThreadPool(6);
        callers = Executors.newFixedThreadPool(6);
        BoundedFetcher fetcher = new BoundedFetcher(gateway, fetchExecutor, 2, 5_000);

        List<Future<FetchResult>> results = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            String url = "https://www.zillow.com/homedetails/x/" + i + "_zpid/";
            results.add(callers.submit(() -> fetcher.fetch(url)));
        }
        for (Future<FetchResult> result : results) {
            assertThat(result.get(10, TimeUnit.SECONDS).isSuccessful()).isTrue();
        }

        assertThat(peak.get()).isBetween(1, 2);
        assertThat(fetcher.inFlight()).isZero();
        assertThat(fetcher.maxConcurrent()).isEqualTo(2);
    }

    @Test
    void slowGatewayCallTimesOutAndFreesItsSlot() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        PageFetchGateway gateway = url -> {
            Instant startedAt = Instant.now();
            if (url.contains("slow")) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return FetchResult.error(url, startedAt, "interrupted", "cancelled");
                }
            }
            return FetchResult.success(url, 200, "ok", startedAt);
        };
        fetchExecutor = Executors.newFixedThreadPool(2);
        BoundedFetcher fetcher = new BoundedFetcher(gateway, fetchExecutor, 1, 100);

        FetchResult timedOut = fetcher.fetch("https://www.zillow.com/slow");
        assertThat(timedOut.errorCode()).isEqualTo("timeout");
        assertThat(timedOut.isSuccessful()).isFalse();

        FetchResult next = fetcher.fetch("https://www.zillow.com/fast");
        assertThat(next.isSuccessful()).isTrue();
        release.countDown();
    }

    @Test
    void gatewayExceptionBecomesErrorResult() {
        PageFetchGateway gateway = url -> {
            throw new IllegalStateException("boom");
        };
        fetchExecutor = Executors.newSingleThreadExecutor();
        BoundedFetcher fetcher = new BoundedFetcher(gateway, fetchExecutor, 1, 1_000);

        FetchResult result = fetcher.fetch("https://www.zillow.com/homedetails/x/1_zpid/");

        assertThat(result.errorCode()).isEqualTo("http_error");
        assertThat(result.errorMessage()).isEqualTo("boom");
        assertThat(fetcher.inFlight()).isZero();
    }
}
