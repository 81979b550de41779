package com.sitelens.crawl.model;

import java.util.List;
import java.util.Objects;

public record DeepCrawlConfig(
    List<String> startUrls,
    int maxDepth,
    int maxPages,
    boolean stayInDomain,
    boolean stayInSubdomain,
    List<String> includePatterns,
    List<String> excludePatterns,
    double rate,
    AutoSelectors customSelectors,
    boolean filterNavigation,
    int minContentLength
) {
    public DeepCrawlConfig {
        startUrls = withoutNulls(startUrls);
        includePatterns = withoutNulls(includePatterns);
        excludePatterns = withoutNulls(excludePatterns);
    }

    public void validate() {
        boolean hasStartUrl = startUrls.stream().anyMatch(url -> url != null && !url.isBlank());
        if (!hasStartUrl) {
            throw new IllegalArgumentException("at least one start URL is required");
        }
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0");
        }
        if (maxPages < 1) {
            throw new IllegalArgumentException("maxPages must be >= 1");
        }
        if (!(rate > 0) || Double.isInfinite(rate)) {
            throw new IllegalArgumentException("rate must be a positive number");
        }
    }

    public long delayMillis() {
        return Math.round(1000.0 / rate);
    }

    private static List<String> withoutNulls(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).toList();
    }
}
