package com.sitelens.crawl.model;

public record ProfileStats(
    long totalProfiles,
    long distinctDomains,
    long totalUses,
    double avgConfidence,
    double avgSuccessRate
) {
}
