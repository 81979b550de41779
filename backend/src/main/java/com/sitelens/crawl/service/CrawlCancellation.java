package com.sitelens.crawl.service;

/**
 * Cooperative stop signal for a running crawl, checked at every loop iteration and after every
 * politeness delay.
 */
public class CrawlCancellation {
    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
