package com.sitelens.crawl.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancels a CLI crawl on JVM shutdown and holds the shutdown until the crawl loop has returned,
 * so the partial result is still logged.
 */
class CrawlShutdownHook implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(CrawlShutdownHook.class);

    private final CrawlCancellation cancellation;
    private final Duration grace;
    private final CountDownLatch finished = new CountDownLatch(1);

    CrawlShutdownHook(CrawlCancellation cancellation, Duration grace) {
        this.cancellation = cancellation;
        this.grace = grace;
    }

    @Override
    public void run() {
        cancellation.cancel();
        try {
            if (!finished.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Crawl did not stop within {}s of shutdown", grace.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for crawl to stop");
        }
    }

    void finished() {
        finished.countDown();
    }
}
