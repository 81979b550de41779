package com.sitelens.crawl.service;

import com.sitelens.config.CrawlerProperties;
import com.sitelens.crawl.model.CrawlNode;
import com.sitelens.crawl.model.DeepCrawlResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

@Component
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final CrawlerProperties properties;
    private final DeepCrawlService deepCrawlService;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        CrawlerProperties properties,
        DeepCrawlService deepCrawlService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.deepCrawlService = deepCrawlService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        List<String> startUrls = Arrays.stream(properties.getCli().getStartUrls().split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
        if (startUrls.isEmpty()) {
            log.warn("CLI crawl requested but sitelens.cli.start-urls is empty");
            return;
        }

        CrawlCancellation cancellation = new CrawlCancellation();
        CrawlShutdownHook hook = new CrawlShutdownHook(
            cancellation,
            Duration.ofSeconds(properties.getCli().getShutdownGraceSeconds())
        );
        Thread shutdownHook = new Thread(hook, "sitelens-crawl-cancel");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        try {
            DeepCrawlResult result = deepCrawlService.crawl(properties.getDeep().toCrawlConfig(startUrls), cancellation);
            logResult(result);
        } finally {
            hook.finished();
            removeShutdownHook(shutdownHook);
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    private void logResult(DeepCrawlResult result) {
        log.info(
            "Crawl {} completed with status {}: pages={}, linksDiscovered={}, linksFiltered={}, domains={}",
            result.sessionId(),
            result.status(),
            result.totalPagesCrawled(),
            result.totalLinksDiscovered(),
            result.totalLinksFiltered(),
            result.domainsVisited()
        );
        for (CrawlNode node : result.crawlTree()) {
            log.info("  depth={} scraped={} {}{}", node.depth(), node.scraped(), node.url(),
                node.error() == null ? "" : " (" + node.error() + ")");
        }
    }

    private void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down; crawl cancel hook left registered");
        }
    }
}
