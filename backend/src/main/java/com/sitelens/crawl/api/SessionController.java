package com.sitelens.crawl.api;

import com.sitelens.crawl.model.ScrapeSession;
import com.sitelens.crawl.service.PageScrapeService;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {
    private final PageScrapeService pageScrapeService;

    public SessionController(PageScrapeService pageScrapeService) {
        this.pageScrapeService = pageScrapeService;
    }

    @GetMapping
    public List<ScrapeSession> list() {
        return pageScrapeService.sessions();
    }

    @GetMapping("/{id}")
    public ScrapeSession get(@PathVariable("id") String id) {
        ScrapeSession session = pageScrapeService.session(id);
        if (session == null) {
            throw new ResponseStatusException(NOT_FOUND, "Session not found: " + id);
        }
        return session;
    }

    @DeleteMapping
    public Map<String, Object> clearAll() {
        int removed = pageScrapeService.clearSessions();
        return Map.of("message", "All sessions cleared", "deleted", removed);
    }
}
