package com.sitelens.crawl;

import com.sitelens.crawl.model.ExtractionMode;
import com.sitelens.crawl.model.PageContent;
import com.sitelens.crawl.model.ScrapeConfig;
import com.sitelens.crawl.model.ScrapeSession;
import com.sitelens.crawl.model.ScrapedPage;
import com.sitelens.crawl.model.SiteProfile;
import com.sitelens.crawl.persistence.SiteProfileJdbcRepository;
import com.sitelens.crawl.session.ScrapeSessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.WebApplicationContext;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.hamcrest.Matchers.closeTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class CrawlApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private SiteProfileJdbcRepository repository;

    @Autowired
    private ScrapeSessionStore sessionStore;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void healthReportsVersion() throws Exception {
        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"))
            .andExpect(jsonPath("$.version").isNotEmpty());
    }

    @Test
    void profilesListIsEmptyAfterClear() throws Exception {
        repository.clearAll();

        mockMvc.perform(get("/api/profiles"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray())
            .andExpect(jsonPath("$.length()").value(0));

        mockMvc.perform(get("/api/profiles/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalProfiles").value(0));
    }

    @Test
    void profileLifecycleThroughApi() throws Exception {
        repository.clearAll();
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        String id = UUID.randomUUID().toString();
        repository.insert(new SiteProfile(
            id, "docs.example.com", null, "main", "h1, h2, title", null,
            ExtractionMode.DOCUMENTATION, 0.8, 0, 1.0, now, now, null
        ));

        mockMvc.perform(get("/api/profiles/" + id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.domain").value("docs.example.com"))
            .andExpect(jsonPath("$.extractionMode").value("DOCUMENTATION"));

        mockMvc.perform(get("/api/profiles/domain/Docs.Example.com"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(id));

        mockMvc.perform(get("/api/profiles/domain/docs.example.com:8080"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(id));

        mockMvc.perform(get("/api/profiles").param("mode", "documentation"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1));

        mockMvc.perform(post("/api/profiles/" + id + "/feedback").param("success", "false"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.useCount").value(1))
            .andExpect(jsonPath("$.successRate").value(closeTo(0.7, 1e-9)));

        mockMvc.perform(delete("/api/profiles/" + id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.deleted").value(1));

        mockMvc.perform(get("/api/profiles/" + id))
            .andExpect(status().isNotFound());
    }

    @Test
    void unknownProfileIsNotFound() throws Exception {
        String id = UUID.randomUUID().toString();

        mockMvc.perform(get("/api/profiles/" + id)).andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/profiles/" + id)).andExpect(status().isNotFound());
        mockMvc.perform(post("/api/profiles/" + id + "/feedback").param("success", "true"))
            .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/profiles/domain/nothing-here.example.com")).andExpect(status().isNotFound());
    }

    @Test
    void deepCrawlRequiresStartUrls() throws Exception {
        mockMvc.perform(post("/api/deep-crawl").contentType(MediaType.APPLICATION_JSON).content("{}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void invalidCrawlConfigIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/deep-crawl")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"startUrls\":[\"https://example.com/\"],\"maxDepth\":-1}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));
    }

    @Test
    void nullListEntriesDoNotBreakCrawlRequests() throws Exception {
        mockMvc.perform(post("/api/deep-crawl")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"startUrls\":[null,\"https://example.com/\"],\"excludePatterns\":[null],\"maxDepth\":-1}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("maxDepth must be >= 0"));
    }

    @Test
    void scrapeWithoutUrlsIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/scrape")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"urls\":[null,\" \"],\"enablePagination\":true}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("at least one URL is required"));
    }

    @Test
    void sessionHistoryThroughApi() throws Exception {
        sessionStore.clear();
        Instant now = Instant.now();
        String id = UUID.randomUUID().toString();
        sessionStore.save(new ScrapeSession(
            id,
            now,
            now,
            new ScrapeConfig(List.of("https://shop.example.com/list"), true, 3, 2.0, null),
            List.of(new ScrapedPage("https://shop.example.com/list", 1, now, PageContent.empty())),
            1,
            0,
            0,
            List.of()
        ));

        mockMvc.perform(get("/api/sessions"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].id").value(id));

        mockMvc.perform(get("/api/sessions/" + id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalPagesScraped").value(1))
            .andExpect(jsonPath("$.config.enablePagination").value(true))
            .andExpect(jsonPath("$.results[0].pageNumber").value(1));

        mockMvc.perform(get("/api/sessions/" + UUID.randomUUID()))
            .andExpect(status().isNotFound());

        mockMvc.perform(delete("/api/sessions"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.deleted").value(1));

        mockMvc.perform(get("/api/sessions"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void planWithoutHostIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/plan").param("url", "nowhere"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));
    }

    @Test
    void deepCrawlIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/deep-crawl"))
            .andExpect(status().isMethodNotAllowed());
    }
}
