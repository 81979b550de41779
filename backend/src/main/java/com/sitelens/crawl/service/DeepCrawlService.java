package com.sitelens.crawl.service;

import com.sitelens.crawl.extract.PageContentExtractor;
import com.sitelens.crawl.http.PageFetcher;
import com.sitelens.crawl.model.CrawlItem;
import com.sitelens.crawl.model.CrawlNode;
import com.sitelens.crawl.model.CrawlStatus;
import com.sitelens.crawl.model.DeepCrawlConfig;
import com.sitelens.crawl.model.DeepCrawlResult;
import com.sitelens.crawl.model.HttpFetchResult;
import com.sitelens.crawl.model.LinkData;
import com.sitelens.crawl.model.PageContent;
import com.sitelens.crawl.model.PageScrapeResult;
import com.sitelens.crawl.util.LinkFilter;
import com.sitelens.crawl.util.Sleeper;
import com.sitelens.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Breadth-first crawl over a FIFO frontier. One URL is fetched at a time and every processed URL is
 * followed by a politeness delay of {@code 1/rate} seconds, applied globally across hosts.
 */
@Service
public class DeepCrawlService {
    private static final Logger log = LoggerFactory.getLogger(DeepCrawlService.class);
    static final String CANCELLED_ERROR = "crawl cancelled";

    private final PageFetcher pageFetcher;
    private final PageContentExtractor contentExtractor;
    private final Sleeper sleeper;

    public DeepCrawlService(
        PageFetcher pageFetcher,
        PageContentExtractor contentExtractor,
        Sleeper sleeper
    ) {
        this.pageFetcher = pageFetcher;
        this.contentExtractor = contentExtractor;
        this.sleeper = sleeper;
    }

    public DeepCrawlResult crawl(DeepCrawlConfig config) {
        return crawl(config, new CrawlCancellation());
    }

    public DeepCrawlResult crawl(DeepCrawlConfig config, CrawlCancellation cancellation) {
        config.validate();
        CrawlCancellation token = cancellation == null ? new CrawlCancellation() : cancellation;
        String sessionId = UUID.randomUUID().toString();
        Instant startTime = Instant.now();
        LinkFilter linkFilter = LinkFilter.forConfig(config);
        FrontierState state = new FrontierState();

        for (String startUrl : config.startUrls()) {
            String normalized = UrlNormalizer.normalize(startUrl);
            if (normalized == null) {
                CrawlItem invalid = CrawlItem.seed(startUrl);
                state.fail(invalid, "invalid start URL");
                continue;
            }
            state.queue.addLast(CrawlItem.seed(normalized));
        }
        log.info(
            "Deep crawl {} started: seeds={}, maxDepth={}, maxPages={}, rate={}",
            sessionId,
            state.queue.size(),
            config.maxDepth(),
            config.maxPages(),
            config.rate()
        );

        long delayMillis = config.delayMillis();
        while (state.pagesCrawled < config.maxPages()) {
            if (token.isCancelled()) {
                state.errors.add(CANCELLED_ERROR);
                log.info("Deep crawl {} cancelled after {} pages", sessionId, state.pagesCrawled);
                break;
            }
            CrawlItem item = state.queue.pollFirst();
            if (item == null) {
                break;
            }
            if (!state.visited.add(item.url())) {
                continue;
            }

            process(item, config, linkFilter, state);

            if (state.queue.isEmpty() || state.pagesCrawled >= config.maxPages()) {
                continue;
            }
            try {
                sleeper.sleep(delayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                token.cancel();
            }
        }

        CrawlStatus status = resolveStatus(state.pagesCrawled, state.errors.size(), config.maxPages());
        Set<String> domains = new TreeSet<>();
        for (String url : state.visited) {
            String host = UrlNormalizer.host(url);
            if (host != null) {
                domains.add(host);
            }
        }
        log.info(
            "Deep crawl {} finished with status {}: pages={}, linksDiscovered={}, linksFiltered={}, errors={}",
            sessionId,
            status,
            state.pagesCrawled,
            state.linksDiscovered,
            state.linksFiltered,
            state.errors.size()
        );
        return new DeepCrawlResult(
            sessionId,
            startTime,
            Instant.now(),
            config,
            List.copyOf(state.pageResults),
            List.copyOf(state.crawlTree),
            state.pagesCrawled,
            state.linksDiscovered,
            state.linksFiltered,
            List.copyOf(domains),
            List.copyOf(state.errors),
            status
        );
    }

    static CrawlStatus resolveStatus(int pagesCrawled, int errorCount, int maxPages) {
        if (pagesCrawled == 0) {
            return CrawlStatus.FAILED;
        }
        if (errorCount > 0 && pagesCrawled < maxPages) {
            return CrawlStatus.PARTIALLY_COMPLETED;
        }
        return CrawlStatus.COMPLETED;
    }

    private void process(CrawlItem item, DeepCrawlConfig config, LinkFilter linkFilter, FrontierState state) {
        try {
            HttpFetchResult fetched = pageFetcher.fetch(item.url());
            if (fetched == null || !fetched.isSuccessful()) {
                state.fail(item, fetched == null ? "no response" : fetched.failureMessage());
                return;
            }
            String pageUrl = fetched.finalUrlOrRequested();
            PageContent content = contentExtractor.extract(fetched.body(), pageUrl, config.customSelectors());
            List<LinkData> links = content.links();
            state.linksDiscovered += links.size();

            List<String> enqueued = new ArrayList<>();
            if (item.depth() < config.maxDepth()) {
                Set<String> accepted = new LinkedHashSet<>();
                for (LinkData link : links) {
                    String resolved = linkFilter.resolve(link.href(), pageUrl);
                    if (resolved != null && linkFilter.shouldCrawl(resolved, item.url())) {
                        accepted.add(resolved);
                    }
                }
                state.linksFiltered += links.size() - accepted.size();
                for (String url : accepted) {
                    if (!state.visited.contains(url)) {
                        state.queue.addLast(item.child(url));
                        enqueued.add(url);
                    }
                }
            }

            state.pageResults.add(new PageScrapeResult(item.url(), item.depth(), Instant.now(), content));
            state.pagesCrawled++;
            state.crawlTree.add(CrawlNode.scraped(item, enqueued));
            log.debug("Crawled {} at depth {} ({} links, {} enqueued)", item.url(), item.depth(), links.size(), enqueued.size());
        } catch (RuntimeException e) {
            state.fail(item, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    /**
     * Mutable state of one crawl run, owned by the calling thread for the duration of the run.
     */
    private static final class FrontierState {
        private final Deque<CrawlItem> queue = new ArrayDeque<>();
        private final Set<String> visited = new HashSet<>();
        private final List<PageScrapeResult> pageResults = new ArrayList<>();
        private final List<CrawlNode> crawlTree = new ArrayList<>();
        private final List<String> errors = new ArrayList<>();
        private int pagesCrawled;
        private int linksDiscovered;
        private int linksFiltered;

        private void fail(CrawlItem item, String message) {
            errors.add(item.url() + ": " + message);
            crawlTree.add(CrawlNode.failed(item, message));
            log.warn("Failed to crawl {} at depth {}: {}", item.url(), item.depth(), message);
        }
    }
}
