package com.sitelens.crawl.model;

public record LinkData(
    String text,
    String href,
    boolean external
) {
}
