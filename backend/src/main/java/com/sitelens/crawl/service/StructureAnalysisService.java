package com.sitelens.crawl.service;

import com.sitelens.config.CrawlerProperties;
import com.sitelens.crawl.http.PageFetcher;
import com.sitelens.crawl.model.AnalyzeResponse;
import com.sitelens.crawl.model.ExtractionMode;
import com.sitelens.crawl.model.ExtractionPlan;
import com.sitelens.crawl.model.HttpFetchResult;
import com.sitelens.crawl.model.PlanSource;
import com.sitelens.crawl.model.Recommendations;
import com.sitelens.crawl.model.Section;
import com.sitelens.crawl.model.SiteProfile;
import com.sitelens.crawl.model.StructureAnalysis;
import com.sitelens.crawl.structure.AnalyzerOptions;
import com.sitelens.crawl.structure.StructureAnalyzer;
import com.sitelens.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class StructureAnalysisService {
    private static final Logger log = LoggerFactory.getLogger(StructureAnalysisService.class);

    private final PageFetcher pageFetcher;
    private final StructureAnalyzer structureAnalyzer;
    private final SiteProfileService profileService;
    private final CrawlerProperties properties;

    public StructureAnalysisService(
        PageFetcher pageFetcher,
        StructureAnalyzer structureAnalyzer,
        SiteProfileService profileService,
        CrawlerProperties properties
    ) {
        this.pageFetcher = pageFetcher;
        this.structureAnalyzer = structureAnalyzer;
        this.profileService = profileService;
        this.properties = properties;
    }

    public AnalyzerOptions defaultOptions() {
        return new AnalyzerOptions(properties.getAnalysis().getMinContentLength(), true, false);
    }

    /**
     * Fetches and analyzes a page. A confident result is saved as a profile on a best-effort basis.
     */
    public AnalyzeResponse analyze(String url, AnalyzerOptions options) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        String target = url.trim();
        HttpFetchResult fetched = pageFetcher.fetch(target);
        if (fetched == null || !fetched.isSuccessful()) {
            String message = fetched == null ? "no response" : fetched.failureMessage();
            log.warn("Analysis fetch failed for {}: {}", target, message);
            return AnalyzeResponse.failure(message);
        }

        AnalyzerOptions effective = options == null ? defaultOptions() : options;
        StructureAnalysis analysis = structureAnalyzer.analyze(fetched.body(), target, effective);
        String savedProfileId = autoSave(analysis);
        String message = "Analysis complete: " + analysis.sections().size() + " sections";
        return new AnalyzeResponse(true, message, analysis, savedProfileId);
    }

    /**
     * Selectors for a URL, taken from a stored profile when one is confident enough and from a fresh
     * analysis otherwise.
     */
    public ExtractionPlan planFor(String url) {
        String domain = UrlNormalizer.host(url);
        if (domain == null) {
            throw new IllegalArgumentException("Cannot derive a domain from URL: " + url);
        }
        SiteProfile profile = profileService.getByDomain(domain);
        double minConfidence = properties.getAnalysis().getProfileMinConfidence();
        if (profile != null && profile.confidence() >= minConfidence) {
            log.debug("Using profile {} for {}", profile.id(), domain);
            return new ExtractionPlan(
                url,
                domain,
                PlanSource.PROFILE,
                profile.id(),
                profile.mainContentSelector(),
                profile.titleSelector(),
                profile.commentsSelector(),
                profile.extractionMode(),
                profile.confidence()
            );
        }

        AnalyzeResponse response = analyze(url, defaultOptions());
        if (!response.success() || response.analysis() == null) {
            return new ExtractionPlan(url, domain, PlanSource.ANALYSIS, null, null, null, null, ExtractionMode.GENERIC, 0.0);
        }
        Recommendations recommendations = response.analysis().recommendations();
        return new ExtractionPlan(
            url,
            domain,
            PlanSource.ANALYSIS,
            response.savedProfileId(),
            recommendations.bestMainContent(),
            recommendations.bestTitle(),
            recommendations.bestComments(),
            recommendations.suggestedMode(),
            SiteProfileService.profileConfidence(response.analysis())
        );
    }

    private String autoSave(StructureAnalysis analysis) {
        Section top = analysis.topSection();
        if (analysis.recommendations().bestMainContent() == null || top == null) {
            return null;
        }
        if (top.score() < properties.getAnalysis().getAutoSaveThreshold()) {
            return null;
        }
        try {
            return profileService.saveFromAnalysis(analysis).id();
        } catch (RuntimeException e) {
            log.warn("Auto-save of profile for {} failed: {}", analysis.url(), e.getMessage());
            return null;
        }
    }
}
