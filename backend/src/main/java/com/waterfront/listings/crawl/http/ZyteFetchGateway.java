package com.waterfront.listings.crawl.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.waterfront.listings.config.CrawlerProperties;

import java.net.URI;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.concurrent.ExecutorService;

/**
 * Fetches pages through the Zyte extract API. The listing URL travels in the JSON body and the
 * page comes back base64-encoded in {@code httpResponseBody}.
 */
public class ZyteFetchGateway extends AbstractHttpFetchGateway {
    private final ObjectMapper objectMapper;

    public ZyteFetchGateway(CrawlerProperties properties, ObjectMapper objectMapper, ExecutorService httpExecutor) {
        super(properties, httpExecutor);
        this.objectMapper = objectMapper;
    }

    @Override
    protected HttpRequest.Builder buildRequest(URI target) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("url", target.toString());
        body.put("httpResponseBody", true);
        String credentials = properties.getGateway().getApiKey() + ":";
        String authorization = "Basic " + Base64.getEncoder()
            .encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
        return HttpRequest.newBuilder(URI.create(properties.getGateway().getEndpoint()))
            .header("Authorization", authorization)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .header("User-Agent", userAgent())
            .POST(HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8));
    }

    @Override
    protected String decode(String requestedUrl, String responseBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new GatewayResponseException("Gateway response is not JSON for " + requestedUrl);
        }
        JsonNode encoded = root == null ? null : root.get("httpResponseBody");
        if (encoded == null || !encoded.isTextual()) {
            throw new GatewayResponseException("Gateway response missing httpResponseBody for " + requestedUrl);
        }
        try {
            return new String(Base64.getDecoder().decode(encoded.asText()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new GatewayResponseException("Gateway body is not valid base64 for " + requestedUrl);
        }
    }
}
