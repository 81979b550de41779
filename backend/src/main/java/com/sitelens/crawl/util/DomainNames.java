package com.sitelens.crawl.util;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class DomainNames {
    private static final Set<String> GENERIC_SECOND_LEVEL = Set.of(
        "co", "com", "org", "net", "ac", "gov", "edu", "ne", "or", "go"
    );
    private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

    private DomainNames() {
    }

    /**
     * Best-effort registrable domain: the last two labels of the host, or the last three when the
     * host ends in a generic second-level label under a two-letter country code ({@code co.uk}).
     */
    public static String registrableDomain(String host) {
        if (host == null || host.isBlank()) {
            return null;
        }
        String value = host.trim().toLowerCase(Locale.ROOT);
        if (value.endsWith(".")) {
            value = value.substring(0, value.length() - 1);
        }
        if (value.contains(":") || value.startsWith("[") || IPV4.matcher(value).matches()) {
            return value;
        }
        String[] labels = value.split("\\.");
        if (labels.length <= 2) {
            return value;
        }
        String tld = labels[labels.length - 1];
        String secondLevel = labels[labels.length - 2];
        if (tld.length() == 2 && GENERIC_SECOND_LEVEL.contains(secondLevel)) {
            return labels[labels.length - 3] + "." + secondLevel + "." + tld;
        }
        return secondLevel + "." + tld;
    }

    public static String normalizeDomain(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith("http://") || value.startsWith("https://")) {
            return UrlNormalizer.host(value);
        }
        int slash = value.indexOf('/');
        if (slash >= 0) {
            value = value.substring(0, slash);
        }
        value = stripPort(value);
        return value.isBlank() ? null : value;
    }

    private static String stripPort(String value) {
        if (value.startsWith("[")) {
            int close = value.indexOf(']');
            return close >= 0 ? value.substring(0, close + 1) : value;
        }
        int colon = value.indexOf(':');
        if (colon >= 0 && colon == value.lastIndexOf(':')) {
            return value.substring(0, colon);
        }
        return value;
    }
}
