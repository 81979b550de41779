package com.sitelens.crawl.api;

public record AnalyzeApiRequest(
    String url,
    Integer minContentLength,
    Boolean detectComments,
    Boolean debugMode
) {
}
