package com.sitelens.crawl.model;

public record Recommendations(
    String bestMainContent,
    String bestTitle,
    String bestComments,
    ExtractionMode suggestedMode,
    ConfidenceLevel confidenceLevel
) {
}
