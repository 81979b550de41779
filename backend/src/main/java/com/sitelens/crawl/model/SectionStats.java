package com.sitelens.crawl.model;

public record SectionStats(
    int textLength,
    int wordCount,
    int linkCount,
    int imageCount,
    int paragraphCount,
    int headingCount,
    double densityScore,
    double linkDensity,
    int elementCount
) {
}
