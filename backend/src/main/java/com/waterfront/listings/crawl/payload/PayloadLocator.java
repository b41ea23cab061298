package com.waterfront.listings.crawl.payload;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the {@code __NEXT_DATA__} block of a marketplace page and the listing cache nested in it.
 */
@Component
public class PayloadLocator {
    private static final Pattern NEXT_DATA_PATTERN = Pattern.compile(
        "<script[^>]*id=\"__NEXT_DATA__\"[^>]*>(.*?)</script>",
        Pattern.DOTALL
    );
    private static final String[] CACHE_PATH = {"props", "pageProps", "componentProps", "gdpClientCache"};

    private final ObjectMapper objectMapper;

    public PayloadLocator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws PayloadNotFoundException if the page has no parsable {@code __NEXT_DATA__} block
     * @throws CacheNotFoundException   if the block has no usable listing cache
     */
    public ListingPayload locate(String html) {
        String rawText = nextDataText(html)
            .orElseThrow(() -> new PayloadNotFoundException("Page has no __NEXT_DATA__ script"));
        JsonNode nextData = readTree(rawText);
        if (nextData == null) {
            throw new PayloadNotFoundException("__NEXT_DATA__ script is not valid JSON");
        }

        JsonNode cacheNode = nextData;
        for (String segment : CACHE_PATH) {
            cacheNode = cacheNode.path(segment);
        }
        JsonNode cache;
        if (cacheNode.isTextual()) {
            cache = readTree(cacheNode.textValue());
            if (cache == null) {
                throw new CacheNotFoundException("gdpClientCache is not parsable JSON");
            }
        } else if (cacheNode.isObject()) {
            cache = cacheNode;
        } else {
            throw new CacheNotFoundException("Payload has no props.pageProps.componentProps.gdpClientCache");
        }
        if (!cache.isObject() || cache.isEmpty()) {
            throw new CacheNotFoundException("gdpClientCache is empty");
        }
        return new ListingPayload(nextData, cache, rawText, clean(rawText), html);
    }

    /**
     * Rebuilds a payload from a stored cache snapshot; there is no page text to fall back on.
     */
    public ListingPayload fromCacheSnapshot(String cacheJson) {
        JsonNode cache = readTree(cacheJson);
        if (cache == null || !cache.isObject()) {
            throw new CacheNotFoundException("Cache snapshot is not a JSON object");
        }
        return new ListingPayload(null, cache, cacheJson, clean(cacheJson), null);
    }

    /**
     * The search-results state of a search page, when the page embeds one.
     */
    public Optional<JsonNode> locateSearchState(String html) {
        Optional<String> text = nextDataText(html);
        if (text.isEmpty()) {
            return Optional.empty();
        }
        JsonNode nextData = readTree(text.get());
        if (nextData == null) {
            return Optional.empty();
        }
        JsonNode props = nextData.path("props");
        JsonNode state = props.path("pageProps").path("searchPageState");
        if (state.isMissingNode() || state.isNull()) {
            state = props.path("initialState").path("searchPageState");
        }
        if (state.isMissingNode() || state.isNull()) {
            return Optional.empty();
        }
        if (state.isTextual()) {
            return Optional.ofNullable(readTree(state.textValue()));
        }
        return Optional.of(state);
    }

    static String clean(String rawText) {
        if (rawText == null) {
            return null;
        }
        return rawText.replace("\\\"", "\"").replace("\\\\", "\\");
    }

    private Optional<String> nextDataText(String html) {
        if (html == null || html.isBlank()) {
            return Optional.empty();
        }
        Document document = Jsoup.parse(html);
        Element script = document.selectFirst("script#__NEXT_DATA__");
        if (script != null) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                payload = script.html();
            }
            if (payload != null && !payload.isBlank()) {
                return Optional.of(payload.trim());
            }
        }
        Matcher matcher = NEXT_DATA_PATTERN.matcher(html);
        if (matcher.find() && !matcher.group(1).isBlank()) {
            return Optional.of(matcher.group(1).trim());
        }
        return Optional.empty();
    }

    private JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
