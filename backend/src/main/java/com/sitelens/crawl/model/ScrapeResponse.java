package com.sitelens.crawl.model;

public record ScrapeResponse(
    boolean success,
    String message,
    ScrapeSession session
) {
}
