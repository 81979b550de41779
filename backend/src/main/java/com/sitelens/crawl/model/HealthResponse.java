package com.sitelens.crawl.model;

public record HealthResponse(
    String status,
    String version
) {
}
