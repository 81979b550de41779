package com.sitelens.crawl.model;

public record Section(
    String selector,
    SectionType sectionType,
    double score,
    double confidence,
    SectionStats stats,
    String preview,
    String xpath
) {
}
