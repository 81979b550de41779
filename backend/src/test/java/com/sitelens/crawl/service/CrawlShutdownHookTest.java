package com.sitelens.crawl.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class CrawlShutdownHookTest {

    @Test
    void hookCancelsAndWaitsForCrawlToFinish() throws Exception {
        CrawlCancellation cancellation = new CrawlCancellation();
        CrawlShutdownHook hook = new CrawlShutdownHook(cancellation, Duration.ofSeconds(30));
        Thread shutdown = new Thread(hook, "test-shutdown");

        shutdown.start();
        shutdown.join(300);

        assertThat(cancellation.isCancelled()).isTrue();
        assertThat(shutdown.isAlive()).isTrue();

        hook.finished();
        shutdown.join(TimeUnit.SECONDS.toMillis(5));

        assertThat(shutdown.isAlive()).isFalse();
    }

    @Test
    void hookReturnsImmediatelyWhenCrawlAlreadyFinished() throws Exception {
        CrawlCancellation cancellation = new CrawlCancellation();
        CrawlShutdownHook hook = new CrawlShutdownHook(cancellation, Duration.ofSeconds(30));
        hook.finished();

        long started = System.nanoTime();
        hook.run();

        assertThat(cancellation.isCancelled()).isTrue();
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    void hookGivesUpAfterGracePeriod() {
        CrawlCancellation cancellation = new CrawlCancellation();
        CrawlShutdownHook hook = new CrawlShutdownHook(cancellation, Duration.ofMillis(50));

        hook.run();

        assertThat(cancellation.isCancelled()).isTrue();
    }
}
