package com.newsrelay.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class UrlNormalizer {
    private static final Set<String> TRACKING_PARAMS = Set.of(
            "fbclid", "gclid", "yclid", "dclid", "msclkid", "mc_cid", "mc_eid", "igshid", "_openstat", "ref_src"
    );

    private UrlNormalizer() {
    }

    public static String normalize(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.trim();
        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            return trimmed;
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            return trimmed;
        }

        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        StringBuilder normalized = new StringBuilder(scheme).append("://").append(host);
        int port = uri.getPort();
        if (port != -1 && !isDefaultPort(scheme, port)) {
            normalized.append(':').append(port);
        }
        normalized.append(normalizePath(uri.getRawPath()));

        String query = normalizeQuery(uri.getRawQuery());
        if (!query.isEmpty()) {
            normalized.append('?').append(query);
        }
        return normalized.toString();
    }

    public static String urlHash(String url) {
        return HashingUtils.sha256(normalize(url));
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
    }

    private static String normalizePath(String rawPath) {
        if (rawPath == null || rawPath.isEmpty()) {
            return "/";
        }
        String path = rawPath;
        while (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path;
    }

    private static String normalizeQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return "";
        }
        List<String[]> kept = new ArrayList<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            String value = eq >= 0 ? pair.substring(eq + 1) : null;
            if (isTracking(key)) {
                continue;
            }
            kept.add(new String[]{key, value});
        }
        kept.sort(Comparator.<String[], String>comparing(entry -> entry[0])
                .thenComparing(entry -> entry[1] == null ? "" : entry[1]));
        List<String> parts = new ArrayList<>(kept.size());
        for (String[] entry : kept) {
            parts.add(entry[1] == null ? entry[0] : entry[0] + "=" + entry[1]);
        }
        return String.join("&", parts);
    }

    private static boolean isTracking(String key) {
        String lowered = key.toLowerCase(Locale.ROOT);
        return lowered.startsWith("utm_") || TRACKING_PARAMS.contains(lowered);
    }
}
