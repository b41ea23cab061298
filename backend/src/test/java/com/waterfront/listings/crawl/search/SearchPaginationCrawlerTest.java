package com.waterfront.listings.crawl.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.waterfront.listings.crawl.http.BoundedFetcher;
import com.waterfront.listings.crawl.model.FetchResult;
import com.waterfront.listings.crawl.payload.PayloadLocator;
import com.waterfront.listings.crawl.persistence.DedupIndex;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.waterfront.listings.crawl.ListingPageFixtures.detailUrl;
import static com.waterfront.listings.crawl.ListingPageFixtures.searchPageWithUrls;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SearchPaginationCrawlerTest {
    private static final String SEARCH_URL = "https://www.zillow.com/fort-lauderdale-fl/waterfront/";
    private static final Pattern PAGE_PARAM = Pattern.compile("[?&]page=(\\d+)");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<Integer, List<String>> pages = new HashMap<>();
    private final List<Long> pauses = new ArrayList<>();
    private BoundedFetcher fetcher;

    @BeforeEach
    void setUp() {
        fetcher = mock(BoundedFetcher.class);
        when(fetcher.fetch(anyString())).thenAnswer(invocation -> {
            String url = invocation.getArgument(0);
            List<String> zpids = pages.getOrDefault(pageOf(url), List.of());
            String[] urls = zpids.stream().map(zpid -> detailUrl(zpid)).toArray(String[]::new);
            return FetchResult.success(url, 200, searchPageWithUrls(urls), Instant.now());
        });
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void repeatedListingCountsOnceAndOneNewListingKeepsTheStreakAlive() {
        pages.put(1, List.of("123", "200"));
        pages.put(2, List.of("123"));
        pages.put(3, List.of("123", "124"));

        CrawlFrontierResult result = crawler(0).crawl(SEARCH_URL, new CrawlLimits(0, 0, 5, 3), new DedupIndex());

        assertThat(result.urls()).containsExactly(detailUrl("123"), detailUrl("200"), detailUrl("124"));
        assertThat(result.stopReason()).isEqualTo(StopReason.EMPTY_STREAK);
        // Pages 4 through 8 are empty.
        assertThat(result.pagesVisited()).isEqualTo(8);
    }

    @Test
    void stopsAfterConfiguredRunOfEmptyPages() {
        CrawlFrontierResult result = crawler(0).crawl(SEARCH_URL, new CrawlLimits(0, 0, 5, 3), new DedupIndex());

        assertThat(result.urls()).isEmpty();
        assertThat(result.pagesVisited()).isEqualTo(5);
        assertThat(result.stopReason()).isEqualTo(StopReason.EMPTY_STREAK);
        verify(fetcher, times(5)).fetch(anyString());
    }

    @Test
    void alreadyStoredListingsAreNeverReturned() {
        pages.put(1, List.of("100", "200"));
        pages.put(2, List.of("300", "200"));
        DedupIndex index = new DedupIndex(List.of("200"));

        CrawlFrontierResult result = crawler(0).crawl(SEARCH_URL, new CrawlLimits(0, 0, 2, 0), index);

        assertThat(result.urls()).containsExactly(detailUrl("100"), detailUrl("300"));
        assertThat(result.urls()).noneMatch(url -> url.contains("/200_zpid/"));
        assertThat(result.knownSkipped()).isEqualTo(1);
    }

    @Test
    void allKnownPagesExtendTheStreakOnlyPastTheGraceWindow() {
        for (int page = 1; page <= 10; page++) {
            pages.put(page, List.of("900"));
        }
        DedupIndex index = new DedupIndex(List.of("900"));

        CrawlFrontierResult withGrace = crawler(0).crawl(SEARCH_URL, new CrawlLimits(0, 0, 2, 3), index);
        CrawlFrontierResult withoutGrace = crawler(0).crawl(SEARCH_URL, new CrawlLimits(0, 0, 2, 0), index);

        assertThat(withGrace.pagesVisited()).isEqualTo(5);
        assertThat(withoutGrace.pagesVisited()).isEqualTo(2);
        assertThat(withGrace.urls()).isEmpty();
    }

    @Test
    void honoursPageLimit() {
        for (int page = 1; page <= 10; page++) {
            pages.put(page, List.of(Integer.toString(1000 + page)));
        }

        CrawlFrontierResult result = crawler(0).crawl(SEARCH_URL, new CrawlLimits(2, 0, 5, 3), new DedupIndex());

        assertThat(result.stopReason()).isEqualTo(StopReason.PAGE_LIMIT);
        assertThat(result.pagesVisited()).isEqualTo(2);
        assertThat(result.urls()).hasSize(2);
    }

    @Test
    void honoursPropertyLimitMidPage() {
        pages.put(1, List.of("1", "2", "3", "4", "5"));

        CrawlFrontierResult result = crawler(0).crawl(SEARCH_URL, new CrawlLimits(0, 3, 5, 3), new DedupIndex());

        assertThat(result.stopReason()).isEqualTo(StopReason.PROPERTY_LIMIT);
        assertThat(result.urls()).containsExactly(detailUrl("1"), detailUrl("2"), detailUrl("3"));
        assertThat(result.pagesVisited()).isEqualTo(1);
    }

    @Test
    void failedFetchesCountAsEmptyPages() {
        doAnswer(invocation -> FetchResult.error(invocation.getArgument(0), Instant.now(), "timeout", "slow"))
            .when(fetcher).fetch(anyString());

        CrawlFrontierResult result = crawler(0).crawl(SEARCH_URL, new CrawlLimits(0, 0, 3, 0), new DedupIndex());

        assertThat(result.stopReason()).isEqualTo(StopReason.EMPTY_STREAK);
        assertThat(result.pagesVisited()).isEqualTo(3);
    }

    @Test
    void pausesBetweenPagesButNotBeforeTheFirst() {
        for (int page = 1; page <= 3; page++) {
            pages.put(page, List.of(Integer.toString(50 + page)));
        }

        crawler(250).crawl(SEARCH_URL, new CrawlLimits(3, 0, 5, 3), new DedupIndex());

        assertThat(pauses).containsExactly(250L, 250L);
    }

    @Test
    void interruptedPauseEndsTheCrawl() {
        pages.put(1, List.of("1"));
        SearchPaginationCrawler crawler = new SearchPaginationCrawler(
            fetcher,
            new SearchResultUrlExtractor(new PayloadLocator(objectMapper)),
            objectMapper,
            100,
            millis -> {
                throw new InterruptedException("shutdown");
            }
        );

        CrawlFrontierResult result = crawler.crawl(SEARCH_URL, new CrawlLimits(0, 0, 5, 3), new DedupIndex());

        assertThat(result.stopReason()).isEqualTo(StopReason.INTERRUPTED);
        assertThat(result.pagesVisited()).isEqualTo(1);
        assertThat(result.urls()).containsExactly(detailUrl("1"));
    }

    private SearchPaginationCrawler crawler(long pageDelayMs) {
        return new SearchPaginationCrawler(
            fetcher,
            new SearchResultUrlExtractor(new PayloadLocator(objectMapper)),
            objectMapper,
            pageDelayMs,
            pauses::add
        );
    }

    private static int pageOf(String url) {
        Matcher matcher = PAGE_PARAM.matcher(url);
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : 1;
    }
}
