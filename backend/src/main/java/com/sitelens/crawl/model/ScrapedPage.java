package com.sitelens.crawl.model;

import java.time.Instant;

public record ScrapedPage(
    String url,
    int pageNumber,
    Instant scrapedAt,
    PageContent content
) {
}
