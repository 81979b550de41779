package com.sitelens.crawl.model;

public record ImageData(
    String src,
    String alt,
    String title
) {
}
