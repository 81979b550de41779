package com.sitelens.crawl.util;

import com.sitelens.crawl.model.DeepCrawlConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Crawl eligibility for discovered links. Patterns are compiled once per filter; a pattern that
 * fails to compile is logged and never matches.
 */
public class LinkFilter {
    private static final Logger log = LoggerFactory.getLogger(LinkFilter.class);

    private final boolean stayInDomain;
    private final boolean stayInSubdomain;
    private final boolean includeConfigured;
    private final List<Pattern> includePatterns;
    private final List<Pattern> excludePatterns;

    public LinkFilter(
        boolean stayInDomain,
        boolean stayInSubdomain,
        List<String> includePatterns,
        List<String> excludePatterns
    ) {
        this.stayInDomain = stayInDomain;
        this.stayInSubdomain = stayInSubdomain;
        this.includeConfigured = includePatterns != null
            && includePatterns.stream().anyMatch(pattern -> pattern != null && !pattern.isBlank());
        this.includePatterns = compileAll(includePatterns);
        this.excludePatterns = compileAll(excludePatterns);
    }

    public static LinkFilter forConfig(DeepCrawlConfig config) {
        return new LinkFilter(
            config.stayInDomain(),
            config.stayInSubdomain(),
            config.includePatterns(),
            config.excludePatterns()
        );
    }

    public String resolve(String href, String pageUrl) {
        return UrlNormalizer.resolve(href, pageUrl);
    }

    public boolean shouldCrawl(String url, String baseUrl) {
        String host = UrlNormalizer.host(url);
        if (host == null) {
            return false;
        }
        String baseHost = UrlNormalizer.host(baseUrl);
        if (stayInDomain && baseHost != null
            && !Objects.equals(DomainNames.registrableDomain(host), DomainNames.registrableDomain(baseHost))) {
            return false;
        }
        if (stayInSubdomain && baseHost != null && !host.equals(baseHost)) {
            return false;
        }
        for (Pattern pattern : excludePatterns) {
            if (pattern.matcher(url).find()) {
                return false;
            }
        }
        if (includeConfigured) {
            for (Pattern pattern : includePatterns) {
                if (pattern.matcher(url).find()) {
                    return true;
                }
            }
            return false;
        }
        return true;
    }

    private static List<Pattern> compileAll(List<String> patterns) {
        List<Pattern> compiled = new ArrayList<>();
        if (patterns == null) {
            return compiled;
        }
        for (String raw : patterns) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            try {
                compiled.add(Pattern.compile(raw));
            } catch (PatternSyntaxException e) {
                log.warn("Ignoring malformed link pattern {}: {}", raw, e.getDescription());
            }
        }
        return List.copyOf(compiled);
    }
}
