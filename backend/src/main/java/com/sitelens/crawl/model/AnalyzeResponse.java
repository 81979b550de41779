package com.sitelens.crawl.model;

public record AnalyzeResponse(
    boolean success,
    String message,
    StructureAnalysis analysis,
    String savedProfileId
) {
    public static AnalyzeResponse failure(String message) {
        return new AnalyzeResponse(false, message, null, null);
    }
}
