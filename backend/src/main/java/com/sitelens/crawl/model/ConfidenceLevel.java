package com.sitelens.crawl.model;

public enum ConfidenceLevel {
    VERY_HIGH,
    HIGH,
    MEDIUM,
    LOW,
    VERY_LOW;

    public static ConfidenceLevel fromTopScore(Double score) {
        if (score == null) {
            return VERY_LOW;
        }
        if (score > 0.8) {
            return VERY_HIGH;
        }
        if (score > 0.6) {
            return HIGH;
        }
        if (score > 0.4) {
            return MEDIUM;
        }
        return LOW;
    }
}
