package com.sitelens.crawl.service;

import com.sitelens.crawl.model.ExtractionMode;
import com.sitelens.crawl.model.ProfileStats;
import com.sitelens.crawl.model.Recommendations;
import com.sitelens.crawl.model.Section;
import com.sitelens.crawl.model.SiteProfile;
import com.sitelens.crawl.model.StructureAnalysis;
import com.sitelens.crawl.persistence.SiteProfileStore;
import com.sitelens.crawl.util.DomainNames;
import com.sitelens.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

@Service
public class SiteProfileService {
    private static final Logger log = LoggerFactory.getLogger(SiteProfileService.class);

    private final SiteProfileStore store;

    public SiteProfileService(SiteProfileStore store) {
        this.store = store;
    }

    /**
     * Distills an analysis into a new profile row. Earlier profiles for the same domain are kept.
     */
    public SiteProfile saveFromAnalysis(StructureAnalysis analysis) {
        String domain = UrlNormalizer.host(analysis.url());
        if (domain == null) {
            throw new IllegalArgumentException("Cannot derive a domain from URL: " + analysis.url());
        }
        Recommendations recommendations = analysis.recommendations();
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        SiteProfile profile = new SiteProfile(
            UUID.randomUUID().toString(),
            domain,
            null,
            recommendations.bestMainContent(),
            recommendations.bestTitle(),
            recommendations.bestComments(),
            recommendations.suggestedMode(),
            profileConfidence(analysis),
            0,
            1.0,
            now,
            now,
            null
        );
        store.insert(profile);
        log.info(
            "Saved profile {} for {} (mode={}, confidence={})",
            profile.id(),
            domain,
            profile.extractionMode(),
            String.format("%.2f", profile.confidence())
        );
        return profile;
    }

    /**
     * {@code min(1, 0.7 * topScore + 0.2 * hasMainContent + 0.1 * hasTitle)}, or 0 without sections.
     */
    public static double profileConfidence(StructureAnalysis analysis) {
        Section top = analysis.topSection();
        if (top == null) {
            return 0.0;
        }
        Recommendations recommendations = analysis.recommendations();
        double confidence = top.score() * 0.7;
        if (recommendations != null && recommendations.bestMainContent() != null) {
            confidence += 0.2;
        }
        if (recommendations != null && recommendations.bestTitle() != null) {
            confidence += 0.1;
        }
        return Math.min(1.0, confidence);
    }

    public SiteProfile getByDomain(String domain) {
        String normalized = DomainNames.normalizeDomain(domain);
        if (normalized == null) {
            return null;
        }
        return store.findByDomain(normalized);
    }

    public SiteProfile getById(String id) {
        return store.findById(id);
    }

    public List<SiteProfile> getAll() {
        return store.findAll();
    }

    public List<SiteProfile> getByMode(ExtractionMode mode) {
        return store.findByMode(mode);
    }

    public SiteProfile recordFeedback(String id, boolean success) {
        SiteProfile updated = store.updateUsage(id, success);
        if (updated == null) {
            log.warn("Feedback for unknown profile {}", id);
            return null;
        }
        log.debug(
            "Profile {} feedback success={}: useCount={}, successRate={}",
            id,
            success,
            updated.useCount(),
            updated.successRate()
        );
        return updated;
    }

    public boolean delete(String id) {
        return store.delete(id);
    }

    public int clearAll() {
        int removed = store.clearAll();
        log.info("Cleared {} profiles", removed);
        return removed;
    }

    public ProfileStats stats() {
        return store.stats();
    }
}
