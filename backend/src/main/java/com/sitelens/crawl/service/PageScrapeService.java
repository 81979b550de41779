package com.sitelens.crawl.service;

import com.sitelens.crawl.extract.PageContentExtractor;
import com.sitelens.crawl.http.PageFetcher;
import com.sitelens.crawl.model.HttpFetchResult;
import com.sitelens.crawl.model.PageContent;
import com.sitelens.crawl.model.ScrapeConfig;
import com.sitelens.crawl.model.ScrapeResponse;
import com.sitelens.crawl.model.ScrapeSession;
import com.sitelens.crawl.model.ScrapedPage;
import com.sitelens.crawl.session.ScrapeSessionStore;
import com.sitelens.crawl.util.PaginationLinks;
import com.sitelens.crawl.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Fetch-and-extract for a list of URLs, optionally following each URL's "next page" chain.
 * Every finished session is kept in the {@link ScrapeSessionStore}.
 */
@Service
public class PageScrapeService {
    private static final Logger log = LoggerFactory.getLogger(PageScrapeService.class);

    private final PageFetcher pageFetcher;
    private final PageContentExtractor contentExtractor;
    private final Sleeper sleeper;
    private final ScrapeSessionStore sessionStore;

    public PageScrapeService(
        PageFetcher pageFetcher,
        PageContentExtractor contentExtractor,
        Sleeper sleeper,
        ScrapeSessionStore sessionStore
    ) {
        this.pageFetcher = pageFetcher;
        this.contentExtractor = contentExtractor;
        this.sleeper = sleeper;
        this.sessionStore = sessionStore;
    }

    public ScrapeResponse scrape(ScrapeConfig config) {
        config.validate();
        String sessionId = UUID.randomUUID().toString();
        Instant startTime = Instant.now();
        log.info(
            "Scrape session {} started: urls={}, pagination={}, maxPages={}",
            sessionId,
            config.urls().size(),
            config.enablePagination(),
            config.maxPages()
        );

        SessionState state = new SessionState(config.delayMillis());
        for (String url : config.urls()) {
            if (state.interrupted) {
                state.errors.add("Failed to scrape " + url + ": interrupted");
                continue;
            }
            scrapeChain(url, config, state);
        }

        int links = state.results.stream().mapToInt(page -> page.content().links().size()).sum();
        int images = state.results.stream().mapToInt(page -> page.content().images().size()).sum();
        ScrapeSession session = new ScrapeSession(
            sessionId,
            startTime,
            Instant.now(),
            config,
            state.results,
            state.results.size(),
            links,
            images,
            state.errors
        );
        sessionStore.save(session);
        log.info(
            "Scrape session {} finished: pages={}, links={}, images={}, errors={}",
            sessionId,
            session.totalPagesScraped(),
            links,
            images,
            session.errors().size()
        );

        if (session.totalPagesScraped() == 0) {
            String reason = session.errors().isEmpty() ? "no pages scraped" : session.errors().get(0);
            return new ScrapeResponse(false, "Scraping failed: " + reason, session);
        }
        String message = "Successfully scraped " + session.totalPagesScraped() + " pages with "
            + links + " links and " + images + " images";
        return new ScrapeResponse(true, message, session);
    }

    public List<ScrapeSession> sessions() {
        return sessionStore.findAll();
    }

    public ScrapeSession session(String id) {
        return sessionStore.findById(id);
    }

    public int clearSessions() {
        return sessionStore.clear();
    }

    private void scrapeChain(String startUrl, ScrapeConfig config, SessionState state) {
        Set<String> visited = new HashSet<>();
        String currentUrl = startUrl;
        int limit = config.pageLimit();
        int pageNumber = 0;
        while (currentUrl != null && pageNumber < limit && visited.add(currentUrl)) {
            pageNumber++;
            if (!state.pace(sleeper)) {
                state.errors.add("Failed to scrape " + currentUrl + ": interrupted");
                return;
            }
            log.debug("Page {} of {}: {}", pageNumber, limit == Integer.MAX_VALUE ? "unlimited" : limit, currentUrl);

            HttpFetchResult fetched = pageFetcher.fetch(currentUrl);
            if (fetched == null || !fetched.isSuccessful()) {
                String reason = fetched == null ? "no response" : fetched.failureMessage();
                log.warn("Scrape failed for {}: {}", currentUrl, reason);
                state.errors.add("Failed to scrape " + currentUrl + ": " + reason);
                return;
            }
            String baseUrl = fetched.finalUrlOrRequested();
            PageContent content = contentExtractor.extract(fetched.body(), baseUrl, config.customSelectors());
            state.results.add(new ScrapedPage(currentUrl, pageNumber, Instant.now(), content));
            visited.add(baseUrl);

            currentUrl = config.enablePagination() ? PaginationLinks.findNextPage(content.links(), baseUrl) : null;
        }
    }

    private static final class SessionState {
        private final long delayMillis;
        private final List<ScrapedPage> results = new ArrayList<>();
        private final List<String> errors = new ArrayList<>();
        private boolean fetchedAny;
        private boolean interrupted;

        private SessionState(long delayMillis) {
            this.delayMillis = delayMillis;
        }

        /**
         * Waits one politeness interval before every fetch after the first.
         */
        private boolean pace(Sleeper sleeper) {
            if (!fetchedAny) {
                fetchedAny = true;
                return true;
            }
            try {
                sleeper.sleep(delayMillis);
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                return false;
            }
        }
    }
}
