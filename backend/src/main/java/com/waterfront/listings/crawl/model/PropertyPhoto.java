package com.waterfront.listings.crawl.model;

public record PropertyPhoto(int position, String url, String caption) {
}
