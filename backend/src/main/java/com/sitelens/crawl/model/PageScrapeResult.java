package com.sitelens.crawl.model;

import java.time.Instant;

public record PageScrapeResult(
    String url,
    int depth,
    Instant scrapedAt,
    PageContent content
) {
}
