package com.sitelens.crawl.util;

import com.sitelens.crawl.model.LinkData;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Finds the "next page" link of a paginated listing. Links are checked in document order; the
 * first one that is labelled like a pager link or that points at the same host and path with a
 * page query parameter wins.
 */
public final class PaginationLinks {
    private static final List<String> NEXT_KEYWORDS = List.of("next", "next page", "→", "»", "›");

    private PaginationLinks() {
    }

    public static String findNextPage(List<LinkData> links, String currentUrl) {
        if (links == null || currentUrl == null) {
            return null;
        }
        URI current = parse(currentUrl);
        for (LinkData link : links) {
            String href = link.href();
            if (href == null || href.isBlank()) {
                continue;
            }
            String text = link.text() == null ? "" : link.text().toLowerCase(Locale.ROOT);
            boolean labelledNext = NEXT_KEYWORDS.stream().anyMatch(text::contains);
            if (labelledNext && !link.external() && !href.equals(currentUrl)) {
                return href;
            }
            if (current != null && (href.contains("page=") || href.contains("p=")) && samePage(current, parse(href))) {
                return href;
            }
        }
        return null;
    }

    private static boolean samePage(URI current, URI candidate) {
        if (candidate == null || current.getHost() == null || candidate.getHost() == null) {
            return false;
        }
        return current.getHost().equalsIgnoreCase(candidate.getHost())
            && Objects.equals(path(current), path(candidate));
    }

    private static String path(URI uri) {
        String path = uri.getPath();
        return path == null || path.isEmpty() ? "/" : path;
    }

    private static URI parse(String value) {
        try {
            return new URI(value.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
