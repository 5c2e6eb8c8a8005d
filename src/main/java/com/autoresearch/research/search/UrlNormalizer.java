package com.autoresearch.research.search;

import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Dedup key for source URLs: scheme, {@code www.}, fragment, trailing slash and tracking parameters are ignored, the
 * remaining query parameters are sorted.
 */
public final class UrlNormalizer {

    private UrlNormalizer() {
    }

    public static String normalize(String url) {
        if (!StringUtils.hasText(url)) {
            return "";
        }
        String trimmed = url.trim();
        try {
            URI uri = new URI(trimmed.contains("://") ? trimmed : "https://" + trimmed);
            String host = uri.getHost();
            if (host == null) {
                return fallback(trimmed);
            }
            host = host.toLowerCase(Locale.ROOT);
            if (host.startsWith("www.")) {
                host = host.substring(4);
            }
            StringBuilder normalized = new StringBuilder(host);
            if (uri.getPort() > 0 && uri.getPort() != 80 && uri.getPort() != 443) {
                normalized.append(':').append(uri.getPort());
            }
            String path = uri.getRawPath() == null ? "" : uri.getRawPath();
            while (path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }
            normalized.append(path);
            String query = normalizeQuery(uri.getRawQuery());
            if (!query.isEmpty()) {
                normalized.append('?').append(query);
            }
            return normalized.toString();
        } catch (URISyntaxException ex) {
            return fallback(trimmed);
        }
    }

    private static String normalizeQuery(String rawQuery) {
        if (!StringUtils.hasText(rawQuery)) {
            return "";
        }
        return Arrays.stream(rawQuery.split("&"))
                .filter(StringUtils::hasText)
                .filter(param -> !isTracking(param))
                .sorted()
                .collect(Collectors.joining("&"));
    }

    private static boolean isTracking(String param) {
        String name = param.toLowerCase(Locale.ROOT);
        return name.startsWith("utm_") || name.startsWith("fbclid") || name.startsWith("gclid")
                || name.startsWith("ref=") || name.startsWith("mc_eid");
    }

    private static String fallback(String url) {
        String lowered = url.toLowerCase(Locale.ROOT).replaceFirst("^[a-z]+://", "").replaceFirst("^www\\.", "");
        int fragment = lowered.indexOf('#');
        if (fragment >= 0) {
            lowered = lowered.substring(0, fragment);
        }
        while (lowered.endsWith("/")) {
            lowered = lowered.substring(0, lowered.length() - 1);
        }
        return lowered;
    }
}
