package com.waterfront.listings.crawl.http;

import com.waterfront.listings.config.CrawlerProperties;

import java.net.URI;
import java.net.http.HttpRequest;
import java.util.concurrent.ExecutorService;

/**
 * Plain GET against the marketplace. Mostly useful locally and against test servers.
 */
public class DirectFetchGateway extends AbstractHttpFetchGateway {

    public DirectFetchGateway(CrawlerProperties properties, ExecutorService httpExecutor) {
        super(properties, httpExecutor);
    }

    @Override
    protected HttpRequest.Builder buildRequest(URI target) {
        return HttpRequest.newBuilder(target)
            .header("User-Agent", userAgent())
            .header("Accept", "text/html,application/xhtml+xml")
            .header("Accept-Language", "en-US,en;q=0.8")
            .GET();
    }

    @Override
    protected String decode(String requestedUrl, String responseBody) {
        return responseBody;
    }
}
