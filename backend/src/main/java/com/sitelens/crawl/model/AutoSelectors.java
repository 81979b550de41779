package com.sitelens.crawl.model;

import java.util.List;

/**
 * Ordered CSS selector lists used for single-page content extraction.
 * Any list left null falls back to the built-in defaults.
 */
public record AutoSelectors(
    List<String> title,
    List<String> content,
    List<String> links,
    List<String> images,
    List<String> metadata
) {
    private static final AutoSelectors DEFAULTS = new AutoSelectors(
        List.of("h1", "h2", "title", "meta[property='og:title']", ".title", "#title"),
        List.of("article", "main", "p", ".content", ".article-body", ".post-content", "[role='main']"),
        List.of("a[href]", "nav a", ".nav-link"),
        List.of("img[src]", "picture img", "[data-src]"),
        List.of(
            "meta[name='description']",
            "meta[property='og:description']",
            "meta[name='keywords']",
            "meta[name='author']"
        )
    );

    public static AutoSelectors defaults() {
        return DEFAULTS;
    }

    public AutoSelectors withDefaults() {
        return new AutoSelectors(
            title == null ? DEFAULTS.title() : title,
            content == null ? DEFAULTS.content() : content,
            links == null ? DEFAULTS.links() : links,
            images == null ? DEFAULTS.images() : images,
            metadata == null ? DEFAULTS.metadata() : metadata
        );
    }
}
