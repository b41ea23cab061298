package com.waterfront.listings.crawl.http;

import com.waterfront.listings.crawl.model.FetchResult;

/**
 * Supplies decoded page content for a URL. Transport failures are reported through
 * {@link FetchResult#errorCode()} rather than thrown.
 */
public interface PageFetchGateway {

    FetchResult fetch(String url);
}
