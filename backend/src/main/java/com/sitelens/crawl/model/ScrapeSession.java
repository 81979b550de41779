package com.sitelens.crawl.model;

import java.time.Instant;
import java.util.List;

public record ScrapeSession(
    String id,
    Instant startTime,
    Instant endTime,
    ScrapeConfig config,
    List<ScrapedPage> results,
    int totalPagesScraped,
    int totalLinksFound,
    int totalImagesFound,
    List<String> errors
) {
    public ScrapeSession {
        results = results == null ? List.of() : List.copyOf(results);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
