package com.sitelens.crawl.model;

import java.time.Instant;

public record SiteProfile(
    String id,
    String domain,
    String pattern,
    String mainContentSelector,
    String titleSelector,
    String commentsSelector,
    ExtractionMode extractionMode,
    double confidence,
    int useCount,
    double successRate,
    Instant createdAt,
    Instant lastUsed,
    String notes
) {
    public static final double FEEDBACK_WEIGHT = 0.3;

    /**
     * Exponential moving average of the success rate, weighting the newest observation by
     * {@link #FEEDBACK_WEIGHT}.
     */
    public static double nextSuccessRate(double current, boolean success) {
        double observation = success ? 1.0 : 0.0;
        double next = FEEDBACK_WEIGHT * observation + (1.0 - FEEDBACK_WEIGHT) * current;
        return Math.min(1.0, Math.max(0.0, next));
    }

    public SiteProfile withUsage(boolean success, Instant usedAt) {
        return new SiteProfile(
            id,
            domain,
            pattern,
            mainContentSelector,
            titleSelector,
            commentsSelector,
            extractionMode,
            confidence,
            useCount + 1,
            nextSuccessRate(successRate, success),
            createdAt,
            usedAt,
            notes
        );
    }
}
