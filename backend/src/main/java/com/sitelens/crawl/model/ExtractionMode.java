package com.sitelens.crawl.model;

import java.util.Locale;

public enum ExtractionMode {
    ARTICLE,
    PRODUCT,
    FORUM,
    LIST_PAGE,
    DOCUMENTATION,
    GENERIC;

    public static ExtractionMode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return GENERIC;
        }
        try {
            return ExtractionMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return GENERIC;
        }
    }
}
