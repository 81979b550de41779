package com.sitelens.crawl.model;

public record CrawlItem(
    String url,
    int depth,
    String parentUrl
) {
    public static CrawlItem seed(String url) {
        return new CrawlItem(url, 0, null);
    }

    public CrawlItem child(String childUrl) {
        return new CrawlItem(childUrl, depth + 1, url);
    }
}
