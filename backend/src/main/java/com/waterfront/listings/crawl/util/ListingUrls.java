package com.waterfront.listings.crawl.util;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ListingUrls {
    public static final String MARKETPLACE_ORIGIN = "https://www.zillow.com";

    private static final Pattern ZPID_IN_URL = Pattern.compile("/(\\d+)_zpid");

    private ListingUrls() {
    }

    /**
     * Returns the numeric listing id embedded in a detail URL, or null when the URL carries none.
     */
    public static String zpidOf(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        Matcher matcher = ZPID_IN_URL.matcher(url);
        return matcher.find() ? matcher.group(1) : null;
    }

    public static String absolutize(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String trimmed = url.trim();
        if (trimmed.startsWith("//")) {
            return "https:" + trimmed;
        }
        if (trimmed.startsWith("/")) {
            return MARKETPLACE_ORIGIN + trimmed;
        }
        return trimmed;
    }

    /**
     * Absolute detail URL without query string or fragment, so the same listing linked two ways
     * compares equal.
     */
    public static String canonicalDetailUrl(String url) {
        String absolute = absolutize(url);
        if (absolute == null) {
            return null;
        }
        int cut = absolute.length();
        int query = absolute.indexOf('?');
        int fragment = absolute.indexOf('#');
        if (query >= 0) {
            cut = Math.min(cut, query);
        }
        if (fragment >= 0) {
            cut = Math.min(cut, fragment);
        }
        return absolute.substring(0, cut);
    }

    public static boolean isDetailUrl(String url) {
        return url != null && url.toLowerCase(Locale.ROOT).contains("/homedetails/");
    }
}
