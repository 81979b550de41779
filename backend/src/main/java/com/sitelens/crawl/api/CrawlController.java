package com.sitelens.crawl.api;

import com.sitelens.config.CrawlerProperties;
import com.sitelens.crawl.model.AnalyzeResponse;
import com.sitelens.crawl.model.DeepCrawlResult;
import com.sitelens.crawl.model.ExtractionPlan;
import com.sitelens.crawl.model.HealthResponse;
import com.sitelens.crawl.model.ScrapeResponse;
import com.sitelens.crawl.service.DeepCrawlService;
import com.sitelens.crawl.service.PageScrapeService;
import com.sitelens.crawl.service.StructureAnalysisService;
import com.sitelens.crawl.structure.AnalyzerOptions;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class CrawlController {
    private final PageScrapeService pageScrapeService;
    private final DeepCrawlService deepCrawlService;
    private final StructureAnalysisService structureAnalysisService;
    private final CrawlerProperties crawlerProperties;

    public CrawlController(
        PageScrapeService pageScrapeService,
        DeepCrawlService deepCrawlService,
        StructureAnalysisService structureAnalysisService,
        CrawlerProperties crawlerProperties
    ) {
        this.pageScrapeService = pageScrapeService;
        this.deepCrawlService = deepCrawlService;
        this.structureAnalysisService = structureAnalysisService;
        this.crawlerProperties = crawlerProperties;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("ok", crawlerProperties.getVersion());
    }

    @PostMapping("/scrape")
    public ScrapeResponse scrape(@RequestBody(required = false) ScrapeApiRequest request) {
        if (request == null) {
            throw new ResponseStatusException(BAD_REQUEST, "urls is required");
        }
        return pageScrapeService.scrape(request.toConfig(crawlerProperties.getDeep().getRate()));
    }

    @PostMapping("/deep-crawl")
    public DeepCrawlResult deepCrawl(@RequestBody(required = false) DeepCrawlApiRequest request) {
        if (request == null || request.startUrls() == null || request.startUrls().isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "startUrls is required");
        }
        return deepCrawlService.crawl(request.toConfig(crawlerProperties.getDeep()));
    }

    @PostMapping("/analyze")
    public AnalyzeResponse analyze(@RequestBody AnalyzeApiRequest request) {
        AnalyzerOptions options = AnalyzerOptions.of(
            request.minContentLength(),
            request.detectComments(),
            request.debugMode(),
            crawlerProperties.getAnalysis().getMinContentLength()
        );
        return structureAnalysisService.analyze(request.url(), options);
    }

    @GetMapping("/plan")
    public ExtractionPlan plan(@RequestParam(name = "url") String url) {
        return structureAnalysisService.planFor(url);
    }
}
