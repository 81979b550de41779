package com.sitelens.crawl.model;

public enum CrawlStatus {
    RUNNING,
    COMPLETED,
    PARTIALLY_COMPLETED,
    FAILED
}
