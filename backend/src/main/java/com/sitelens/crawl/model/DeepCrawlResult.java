package com.sitelens.crawl.model;

import java.time.Instant;
import java.util.List;

public record DeepCrawlResult(
    String sessionId,
    Instant startTime,
    Instant endTime,
    DeepCrawlConfig config,
    List<PageScrapeResult> pageResults,
    List<CrawlNode> crawlTree,
    int totalPagesCrawled,
    int totalLinksDiscovered,
    int totalLinksFiltered,
    List<String> domainsVisited,
    List<String> errors,
    CrawlStatus status
) {
}
