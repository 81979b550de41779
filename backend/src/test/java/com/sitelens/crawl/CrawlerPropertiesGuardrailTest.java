package com.sitelens.crawl;

import com.sitelens.config.CrawlerProperties;
import com.sitelens.crawl.model.DeepCrawlConfig;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrawlerPropertiesGuardrailTest {

    @Test
    void userAgentsFallBackToBuiltInRotation() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setUserAgents(Arrays.asList("   ", null));
        assertEquals(5, properties.getUserAgents().size());
        assertTrue(properties.getUserAgents().get(0).startsWith("Mozilla/5.0"));
    }

    @Test
    void concurrencyTimeoutsAndRetriesAreClamped() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setGlobalConcurrency(0);
        properties.setRequestTimeoutSeconds(-5);
        properties.setRequestMaxRetries(-1);
        assertEquals(1, properties.getGlobalConcurrency());
        assertEquals(1, properties.getRequestTimeoutSeconds());
        assertEquals(0, properties.getRequestMaxRetries());
    }

    @Test
    void retryPolicyAndHistorySettingsAreSanitised() {
        CrawlerProperties properties = new CrawlerProperties();
        assertTrue(properties.getRequestRetryStatuses().isEmpty());
        assertTrue(properties.isRequestRetryOnNetworkErrors());
        assertTrue(properties.isRequestRetryJitter());

        properties.setRequestRetryStatuses(Arrays.asList(429, null, 403));
        properties.setRequestRetryNetworkDelayMs(-1);
        properties.setMaxStoredSessions(0);
        properties.getCli().setShutdownGraceSeconds(-4);
        assertEquals(List.of(429, 403), properties.getRequestRetryStatuses());
        assertEquals(0, properties.getRequestRetryNetworkDelayMs());
        assertEquals(1, properties.getMaxStoredSessions());
        assertEquals(0, properties.getCli().getShutdownGraceSeconds());

        properties.setRequestRetryStatuses(null);
        assertTrue(properties.getRequestRetryStatuses().isEmpty());
    }

    @Test
    void deepCrawlDefaultsMatchDocumentedValues() {
        CrawlerProperties.Deep deep = new CrawlerProperties().getDeep();
        DeepCrawlConfig config = deep.toCrawlConfig(List.of("https://example.com"));

        assertEquals(2, config.maxDepth());
        assertEquals(50, config.maxPages());
        assertTrue(config.stayInDomain());
        assertFalse(config.stayInSubdomain());
        assertTrue(config.includePatterns().isEmpty());
        assertEquals(List.of("\\.pdf$", "\\.zip$", "\\.jpg$", "\\.png$", "\\.gif$", "#.*$"), config.excludePatterns());
        assertEquals(2.0, config.rate());
        assertTrue(config.filterNavigation());
        assertEquals(200, config.minContentLength());
        assertEquals(500L, config.delayMillis());
    }

    @Test
    void invalidRateAndPageBudgetAreClamped() {
        CrawlerProperties.Deep deep = new CrawlerProperties.Deep();
        deep.setRate(0);
        deep.setMaxPages(0);
        deep.setMaxDepth(-3);
        assertEquals(2.0, deep.getRate());
        assertEquals(1, deep.getMaxPages());
        assertEquals(0, deep.getMaxDepth());
    }

    @Test
    void analysisThresholdsStayWithinUnitInterval() {
        CrawlerProperties.Analysis analysis = new CrawlerProperties.Analysis();
        analysis.setAutoSaveThreshold(1.7);
        analysis.setProfileMinConfidence(-0.2);
        assertEquals(1.0, analysis.getAutoSaveThreshold());
        assertEquals(0.0, analysis.getProfileMinConfidence());
    }
}
