package com.sitelens.crawl.model;

import java.util.List;

public record CrawlNode(
    String url,
    int depth,
    String parent,
    List<String> children,
    boolean scraped,
    String error
) {
    public CrawlNode {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static CrawlNode scraped(CrawlItem item, List<String> children) {
        return new CrawlNode(item.url(), item.depth(), item.parentUrl(), children, true, null);
    }

    public static CrawlNode failed(CrawlItem item, String error) {
        return new CrawlNode(item.url(), item.depth(), item.parentUrl(), List.of(), false, error);
    }
}
