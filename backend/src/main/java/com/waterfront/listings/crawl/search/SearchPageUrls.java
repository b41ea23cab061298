package com.waterfront.listings.crawl.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the URL of result page N for a search URL. Searches that carry a
 * {@code searchQueryState} JSON parameter get {@code pagination.currentPage} set inside it;
 * anything else gets a plain {@code page=N} parameter.
 */
class SearchPageUrls {
    private static final Logger log = LoggerFactory.getLogger(SearchPageUrls.class);
    private static final String STATE_PARAM = "searchQueryState";

    private final ObjectMapper objectMapper;

    SearchPageUrls(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    String pageUrl(String searchUrl, int page) {
        if (page <= 1) {
            return searchUrl;
        }
        int queryStart = searchUrl.indexOf('?');
        if (queryStart >= 0) {
            String base = searchUrl.substring(0, queryStart);
            String query = searchUrl.substring(queryStart + 1);
            String withState = withStatePage(base, query, page);
            if (withState != null) {
                return withState;
            }
        }
        return appendPageParam(searchUrl, page);
    }

    private String withStatePage(String base, String query, int page) {
        List<String> rebuilt = new ArrayList<>();
        boolean updated = false;
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            if (!updated && STATE_PARAM.equals(name) && eq >= 0) {
                String state = paginatedState(URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8), page);
                if (state == null) {
                    return null;
                }
                rebuilt.add(STATE_PARAM + "=" + URLEncoder.encode(state, StandardCharsets.UTF_8));
                updated = true;
            } else {
                rebuilt.add(pair);
            }
        }
        return updated ? base + "?" + String.join("&", rebuilt) : null;
    }

    private String paginatedState(String stateJson, int page) {
        try {
            JsonNode state = objectMapper.readTree(stateJson);
            if (!(state instanceof ObjectNode stateObject)) {
                return null;
            }
            JsonNode pagination = stateObject.path("pagination");
            ObjectNode paginationObject = pagination instanceof ObjectNode existing
                ? existing
                : stateObject.putObject("pagination");
            paginationObject.put("currentPage", page);
            return objectMapper.writeValueAsString(stateObject);
        } catch (JsonProcessingException e) {
            log.warn("Unparsable {} in search URL; falling back to page parameter", STATE_PARAM);
            return null;
        }
    }

    private String appendPageParam(String searchUrl, int page) {
        String separator = searchUrl.contains("?") ? "&" : "?";
        return searchUrl + separator + "page=" + page;
    }
}
