package com.sitelens.crawl.session;

import com.sitelens.config.CrawlerProperties;
import com.sitelens.crawl.model.ScrapeSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory history of finished scrape sessions, oldest first. Holds at most
 * {@code sitelens.max-stored-sessions} entries and is lost on restart.
 */
@Component
public class ScrapeSessionStore {
    private static final Logger log = LoggerFactory.getLogger(ScrapeSessionStore.class);

    private final int capacity;
    private final Map<String, ScrapeSession> sessions = new LinkedHashMap<>();

    public ScrapeSessionStore(CrawlerProperties properties) {
        this.capacity = properties.getMaxStoredSessions();
    }

    public synchronized void save(ScrapeSession session) {
        sessions.put(session.id(), session);
        Iterator<String> oldest = sessions.keySet().iterator();
        while (sessions.size() > capacity && oldest.hasNext()) {
            String evicted = oldest.next();
            oldest.remove();
            log.debug("Evicted scrape session {}", evicted);
        }
    }

    public synchronized List<ScrapeSession> findAll() {
        return new ArrayList<>(sessions.values());
    }

    public synchronized ScrapeSession findById(String id) {
        return sessions.get(id);
    }

    public synchronized int clear() {
        int removed = sessions.size();
        sessions.clear();
        return removed;
    }
}
