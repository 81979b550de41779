package com.sitelens.crawl.api;

import com.sitelens.crawl.model.AutoSelectors;
import com.sitelens.crawl.model.ScrapeConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of {@code POST /api/scrape}. {@code url} is accepted as a shorthand for a one-element
 * {@code urls} list.
 */
public record ScrapeApiRequest(
    String url,
    List<String> urls,
    Boolean enablePagination,
    Integer maxPages,
    Double rate,
    AutoSelectors selectors
) {
    public ScrapeConfig toConfig(double defaultRate) {
        List<String> targets = new ArrayList<>();
        if (url != null) {
            targets.add(url);
        }
        if (urls != null) {
            targets.addAll(urls);
        }
        return new ScrapeConfig(
            targets,
            enablePagination != null && enablePagination,
            maxPages == null ? 0 : maxPages,
            rate == null ? defaultRate : rate,
            selectors
        );
    }
}
