package com.sitelens.crawl.api;

import com.sitelens.config.CrawlerProperties;
import com.sitelens.crawl.model.AutoSelectors;
import com.sitelens.crawl.model.DeepCrawlConfig;

import java.util.List;

public record DeepCrawlApiRequest(
    List<String> startUrls,
    Integer maxDepth,
    Integer maxPages,
    Boolean stayInDomain,
    Boolean stayInSubdomain,
    List<String> includePatterns,
    List<String> excludePatterns,
    Double rate,
    AutoSelectors customSelectors,
    Boolean filterNavigation,
    Integer minContentLength
) {
    public DeepCrawlConfig toConfig(CrawlerProperties.Deep defaults) {
        return new DeepCrawlConfig(
            startUrls,
            maxDepth == null ? defaults.getMaxDepth() : maxDepth,
            maxPages == null ? defaults.getMaxPages() : maxPages,
            stayInDomain == null ? defaults.isStayInDomain() : stayInDomain,
            stayInSubdomain == null ? defaults.isStayInSubdomain() : stayInSubdomain,
            includePatterns == null ? defaults.getIncludePatterns() : includePatterns,
            excludePatterns == null ? defaults.getExcludePatterns() : excludePatterns,
            rate == null ? defaults.getRate() : rate,
            customSelectors,
            filterNavigation == null ? defaults.isFilterNavigation() : filterNavigation,
            minContentLength == null ? defaults.getMinContentLength() : minContentLength
        );
    }
}
