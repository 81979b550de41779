package com.sitelens.crawl.model;

import java.util.List;

/**
 * One scrape request: each URL is fetched once, or followed through its "next page" links when
 * pagination is enabled. {@code maxPages} of 0 means no page limit per URL.
 */
public record ScrapeConfig(
    List<String> urls,
    boolean enablePagination,
    int maxPages,
    double rate,
    AutoSelectors customSelectors
) {
    public ScrapeConfig {
        urls = urls == null
            ? List.of()
            : urls.stream().filter(url -> url != null && !url.isBlank()).map(String::trim).toList();
    }

    public void validate() {
        if (urls.isEmpty()) {
            throw new IllegalArgumentException("at least one URL is required");
        }
        if (maxPages < 0) {
            throw new IllegalArgumentException("maxPages must be >= 0");
        }
        if (!(rate > 0) || Double.isInfinite(rate)) {
            throw new IllegalArgumentException("rate must be a positive number");
        }
    }

    public int pageLimit() {
        if (!enablePagination) {
            return 1;
        }
        return maxPages == 0 ? Integer.MAX_VALUE : maxPages;
    }

    public long delayMillis() {
        return Math.round(1000.0 / rate);
    }
}
