package com.sitelens.crawl.extract;

import com.sitelens.crawl.model.AutoSelectors;
import com.sitelens.crawl.model.ImageData;
import com.sitelens.crawl.model.LinkData;
import com.sitelens.crawl.model.PageContent;
import com.sitelens.crawl.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fixed-selector extraction of a single page: title, text blocks, links, images and meta tags.
 */
@Component
public class PageContentExtractor {
    private static final Logger log = LoggerFactory.getLogger(PageContentExtractor.class);
    private static final int MIN_BLOCK_LENGTH = 10;

    public PageContent extract(String html, String pageUrl) {
        return extract(html, pageUrl, AutoSelectors.defaults());
    }

    public PageContent extract(String html, String pageUrl, AutoSelectors selectors) {
        if (html == null || html.isBlank()) {
            return PageContent.empty();
        }
        AutoSelectors effective = selectors == null ? AutoSelectors.defaults() : selectors.withDefaults();
        Document document = Jsoup.parse(html, pageUrl == null ? "" : pageUrl);
        return new PageContent(
            detectTitle(document, effective.title()),
            detectContent(document, effective.content()),
            detectLinks(document, effective.links(), pageUrl),
            detectImages(document, effective.images()),
            detectMetadata(document, effective.metadata())
        );
    }

    private String detectTitle(Document document, List<String> selectors) {
        for (String css : selectors) {
            Element element = select(document, css).first();
            if (element == null) {
                continue;
            }
            String value = css.startsWith("meta") ? element.attr("content") : element.text();
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private List<String> detectContent(Document document, List<String> selectors) {
        Set<String> seen = new LinkedHashSet<>();
        for (String css : selectors) {
            for (Element element : select(document, css)) {
                String text = element.text().trim();
                if (text.length() > MIN_BLOCK_LENGTH) {
                    seen.add(text);
                }
            }
        }
        return List.copyOf(seen);
    }

    private List<LinkData> detectLinks(Document document, List<String> selectors, String pageUrl) {
        String pageHost = UrlNormalizer.host(pageUrl);
        Map<String, LinkData> links = new LinkedHashMap<>();
        for (String css : selectors) {
            for (Element element : select(document, css)) {
                if (!element.hasAttr("href")) {
                    continue;
                }
                String href = element.attr("href");
                String absolute = element.absUrl("href");
                if (absolute.isEmpty()) {
                    absolute = href;
                }
                if (links.containsKey(absolute)) {
                    continue;
                }
                String text = element.text().trim();
                String linkHost = UrlNormalizer.host(absolute);
                boolean external = pageHost != null && linkHost != null && !Objects.equals(pageHost, linkHost);
                links.put(absolute, new LinkData(text.isEmpty() ? href : text, absolute, external));
            }
        }
        return List.copyOf(links.values());
    }

    private List<ImageData> detectImages(Document document, List<String> selectors) {
        Map<String, ImageData> images = new LinkedHashMap<>();
        for (String css : selectors) {
            for (Element element : select(document, css)) {
                String attribute = element.hasAttr("src") ? "src" : element.hasAttr("data-src") ? "data-src" : null;
                if (attribute == null) {
                    continue;
                }
                String absolute = element.absUrl(attribute);
                if (absolute.isEmpty()) {
                    absolute = element.attr(attribute);
                }
                images.putIfAbsent(absolute, new ImageData(
                    absolute,
                    element.hasAttr("alt") ? element.attr("alt") : null,
                    element.hasAttr("title") ? element.attr("title") : null
                ));
            }
        }
        return List.copyOf(images.values());
    }

    private Map<String, String> detectMetadata(Document document, List<String> selectors) {
        Map<String, String> metadata = new LinkedHashMap<>();
        for (String css : selectors) {
            for (Element element : select(document, css)) {
                if (!element.hasAttr("content")) {
                    continue;
                }
                String key = element.hasAttr("name")
                    ? element.attr("name")
                    : element.hasAttr("property") ? element.attr("property") : "unknown";
                metadata.put(key.toLowerCase(Locale.ROOT), element.attr("content"));
            }
        }
        return metadata;
    }

    private Elements select(Document document, String css) {
        if (css == null || css.isBlank()) {
            return new Elements();
        }
        try {
            return document.select(css);
        } catch (Selector.SelectorParseException | IllegalArgumentException e) {
            log.debug("Skipping malformed selector {}: {}", css, e.getMessage());
            return new Elements();
        }
    }
}
