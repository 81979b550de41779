package com.sitelens.crawl.model;

import java.util.List;

public record DebugInfo(
    int totalElements,
    int analyzedSections,
    long processingTimeMs,
    List<ScoringDetail> scoringDetails
) {
}
