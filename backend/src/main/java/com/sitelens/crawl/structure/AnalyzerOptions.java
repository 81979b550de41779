package com.sitelens.crawl.structure;

public record AnalyzerOptions(
    int minContentLength,
    boolean detectComments,
    boolean debugMode
) {
    public static final int DEFAULT_MIN_CONTENT_LENGTH = 200;

    public AnalyzerOptions {
        minContentLength = Math.max(0, minContentLength);
    }

    public static AnalyzerOptions defaults() {
        return new AnalyzerOptions(DEFAULT_MIN_CONTENT_LENGTH, true, false);
    }

    public static AnalyzerOptions of(Integer minContentLength, Boolean detectComments, Boolean debugMode, int fallbackMinLength) {
        return new AnalyzerOptions(
            minContentLength == null ? fallbackMinLength : minContentLength,
            detectComments == null || detectComments,
            debugMode != null && debugMode
        );
    }
}
