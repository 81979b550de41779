package com.sitelens.crawl.model;

import java.util.Map;

public record ScoringDetail(
    String selector,
    double rawScore,
    Map<String, Double> adjustments,
    double finalScore
) {
}
