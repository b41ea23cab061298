package com.waterfront.listings.crawl.http;

import com.waterfront.listings.config.CrawlerProperties;
import com.waterfront.listings.crawl.model.FetchResult;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;

abstract class AbstractHttpFetchGateway implements PageFetchGateway {
    protected final CrawlerProperties properties;
    protected final HttpClient client;

    protected AbstractHttpFetchGateway(CrawlerProperties properties, ExecutorService httpExecutor) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    @Override
    public FetchResult fetch(String url) {
        Instant startedAt = Instant.now();
        URI target = normalizeUri(url);
        if (target == null || target.getHost() == null) {
            return FetchResult.error(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        try {
            HttpRequest request = buildRequest(target)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .build();
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                return new FetchResult(
                    url,
                    response.statusCode(),
                    null,
                    Instant.now(),
                    Duration.between(startedAt, Instant.now()),
                    "http_error",
                    "HTTP " + response.statusCode()
                );
            }
            byte[] body = response.body();
            String content = decode(url, body == null ? "" : new String(body, StandardCharsets.UTF_8));
            return FetchResult.success(url, response.statusCode(), content, startedAt);
        } catch (GatewayResponseException e) {
            return FetchResult.error(url, startedAt, "gateway_error", e.getMessage());
        } catch (HttpTimeoutException e) {
            return FetchResult.error(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return FetchResult.error(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.error(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return FetchResult.error(url, startedAt, "http_error", e.getMessage());
        }
    }

    /**
     * Builds the outbound request for the listing URL; the timeout is applied by the caller.
     */
    protected abstract HttpRequest.Builder buildRequest(URI target);

    /**
     * Turns the response body into page content.
     */
    protected abstract String decode(String requestedUrl, String responseBody);

    protected String userAgent() {
        return CrawlerProperties.normalizeUserAgent(properties.getUserAgent());
    }

    private URI normalizeUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }

    static class GatewayResponseException extends RuntimeException {
        GatewayResponseException(String message) {
            super(message);
        }
    }
}
