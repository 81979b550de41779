package com.sitelens.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Canonical URL form used for visited-set comparison: lowercase scheme and host, no default port,
 * no fragment, non-empty path with duplicate slashes collapsed. The query string is kept verbatim.
 */
public final class UrlNormalizer {

    private UrlNormalizer() {
    }

    public static String normalize(String url) {
        URI uri = safeUri(url);
        if (uri == null || !isHttp(uri.getScheme()) || uri.getHost() == null || uri.getHost().isBlank()) {
            return null;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        boolean defaultPort = port == -1
            || ("http".equals(scheme) && port == 80)
            || ("https".equals(scheme) && port == 443);

        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        } else {
            path = path.replaceAll("/{2,}", "/");
        }

        StringBuilder builder = new StringBuilder();
        builder.append(scheme).append("://");
        if (uri.getRawUserInfo() != null) {
            builder.append(uri.getRawUserInfo()).append('@');
        }
        builder.append(host);
        if (!defaultPort) {
            builder.append(':').append(port);
        }
        builder.append(path);
        if (uri.getRawQuery() != null) {
            builder.append('?').append(uri.getRawQuery());
        }
        return builder.toString();
    }

    /**
     * Joins {@code href} against {@code pageUrl} and normalizes the result. Returns null for blank,
     * non-http(s) or unparseable links.
     */
    public static String resolve(String href, String pageUrl) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String candidate = href.trim().replace(" ", "%20");
        String lower = candidate.toLowerCase(Locale.ROOT);
        if (lower.startsWith("javascript:")
            || lower.startsWith("mailto:")
            || lower.startsWith("tel:")
            || lower.startsWith("data:")) {
            return null;
        }
        URI reference = safeUri(candidate);
        if (reference == null) {
            return null;
        }
        if (reference.isAbsolute()) {
            return normalize(candidate);
        }
        URI base = safeUri(normalize(pageUrl));
        if (base == null) {
            return null;
        }
        try {
            return normalize(base.resolve(reference).toString());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public static String host(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        return uri.getHost().toLowerCase(Locale.ROOT);
    }

    private static boolean isHttp(String scheme) {
        return "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
    }

    private static URI safeUri(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new URI(value.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
