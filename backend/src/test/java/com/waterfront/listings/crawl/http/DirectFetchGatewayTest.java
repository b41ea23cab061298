package com.waterfront.listings.crawl.http;

import com.waterfront.listings.config.CrawlerProperties;
import com.waterfront.listings.crawl.model.FetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class DirectFetchGatewayTest {
    private MockWebServer server;
    private ExecutorService executor;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void returnsPageBodyAndSendsConfiguredUserAgent() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setBody("<html>search</html>"));
        server.start();
        DirectFetchGateway gateway = gateway("waterfront-test/1.0");

        FetchResult result = gateway.fetch(server.url("/homes/for_sale/").toString());

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.content()).isEqualTo("<html>search</html>");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getHeader("User-Agent")).isEqualTo("waterfront-test/1.0");
    }

    @Test
    void nonSuccessStatusIsReportedNotThrown() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(403).setBody("blocked"));
        server.start();
        DirectFetchGateway gateway = gateway(null);

        FetchResult result = gateway.fetch(server.url("/homedetails/x/1_zpid/").toString());

        assertThat(result.statusCode()).isEqualTo(403);
        assertThat(result.errorCode()).isEqualTo("http_error");
        assertThat(result.content()).isNull();
    }

    private DirectFetchGateway gateway(String userAgent) {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setUserAgent(userAgent);
        properties.setRequestTimeoutSeconds(5);
        executor = Executors.newFixedThreadPool(2);
        return new DirectFetchGateway(properties, executor);
    }
}
