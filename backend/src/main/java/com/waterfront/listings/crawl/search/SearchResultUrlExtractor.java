package com.waterfront.listings.crawl.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.waterfront.listings.crawl.payload.PayloadLocator;
import com.waterfront.listings.crawl.util.ListingUrls;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls listing detail URLs out of a search-results page. The embedded search state is read
 * first; the two text patterns are only tried when the previous tier found nothing.
 */
@Component
public class SearchResultUrlExtractor {
    private static final Pattern DETAIL_URL_PATTERN = Pattern.compile(
        "https://www\\.zillow\\.com/homedetails/((?:[^/\"'\\s<>]+/)?\\d+)_zpid/"
    );
    private static final Pattern DETAIL_HREF_PATTERN = Pattern.compile("href=\"([^\"]*homedetails[^\"]*)\"");
    private static final String[] DETAIL_URL_KEYS = {"detailUrl", "hdpUrl", "hdpUrlNew"};
    private static final String[] ALTERNATE_RESULT_KEYS = {"searchResults", "listResults", "results", "properties"};

    private final PayloadLocator payloadLocator;

    public SearchResultUrlExtractor(PayloadLocator payloadLocator) {
        this.payloadLocator = payloadLocator;
    }

    public ExtractedUrls extract(String html) {
        if (html == null || html.isBlank()) {
            return new ExtractedUrls(List.of(), Tier.NONE);
        }
        List<String> structured = fromSearchState(html);
        if (!structured.isEmpty()) {
            return new ExtractedUrls(structured, Tier.SEARCH_STATE);
        }
        List<String> pattern = fromDetailUrlPattern(html);
        if (!pattern.isEmpty()) {
            return new ExtractedUrls(pattern, Tier.DETAIL_URL_PATTERN);
        }
        List<String> hrefs = fromDetailHrefs(html);
        if (!hrefs.isEmpty()) {
            return new ExtractedUrls(hrefs, Tier.DETAIL_HREF_PATTERN);
        }
        return new ExtractedUrls(List.of(), Tier.NONE);
    }

    private List<String> fromSearchState(String html) {
        Optional<JsonNode> state = payloadLocator.locateSearchState(html);
        if (state.isEmpty()) {
            return List.of();
        }
        JsonNode cat1 = state.get().path("cat1");
        JsonNode results = cat1.path("searchResults").path("listResults");
        if (!results.isArray() || results.isEmpty()) {
            results = alternateResults(cat1);
        }
        Set<String> urls = new LinkedHashSet<>();
        for (JsonNode item : results) {
            for (String key : DETAIL_URL_KEYS) {
                JsonNode value = item.path(key);
                if (value.isTextual() && !value.textValue().isBlank()) {
                    // Building and community cards carry non-detail links.
                    if (ListingUrls.isDetailUrl(value.textValue())) {
                        urls.add(ListingUrls.canonicalDetailUrl(value.textValue()));
                    }
                    break;
                }
            }
        }
        return new ArrayList<>(urls);
    }

    private JsonNode alternateResults(JsonNode cat1) {
        for (String key : ALTERNATE_RESULT_KEYS) {
            JsonNode candidate = cat1.path(key);
            if (candidate.isArray() && !candidate.isEmpty()) {
                return candidate;
            }
            if (candidate.isObject() && candidate.path("listResults").isArray() && !candidate.path("listResults").isEmpty()) {
                return candidate.path("listResults");
            }
        }
        return cat1.path("searchResults").path("listResults");
    }

    private List<String> fromDetailUrlPattern(String html) {
        Set<String> urls = new LinkedHashSet<>();
        Matcher matcher = DETAIL_URL_PATTERN.matcher(html);
        while (matcher.find()) {
            urls.add(ListingUrls.MARKETPLACE_ORIGIN + "/homedetails/" + matcher.group(1) + "_zpid/");
        }
        return new ArrayList<>(urls);
    }

    private List<String> fromDetailHrefs(String html) {
        Set<String> urls = new LinkedHashSet<>();
        Matcher matcher = DETAIL_HREF_PATTERN.matcher(html);
        while (matcher.find()) {
            String href = matcher.group(1);
            if (!href.startsWith("/") && !href.startsWith("http")) {
                continue;
            }
            urls.add(ListingUrls.canonicalDetailUrl(href));
        }
        return new ArrayList<>(urls);
    }

    public enum Tier {
        SEARCH_STATE,
        DETAIL_URL_PATTERN,
        DETAIL_HREF_PATTERN,
        NONE
    }

    public record ExtractedUrls(List<String> urls, Tier tier) {
        public ExtractedUrls {
            urls = List.copyOf(urls);
        }
    }
}
