package com.sitelens.crawl.model;

public record ExtractionPlan(
    String url,
    String domain,
    PlanSource source,
    String profileId,
    String mainContentSelector,
    String titleSelector,
    String commentsSelector,
    ExtractionMode extractionMode,
    double confidence
) {
}
