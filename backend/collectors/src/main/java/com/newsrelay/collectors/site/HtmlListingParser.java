package com.newsrelay.collectors.site;

import com.newsrelay.core.util.HtmlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class HtmlListingParser {
    private static final Pattern ARTICLE_PATH = Pattern.compile(
            "(/20\\d{2}/\\d{2}/\\d{2}/)|(/news/.+)|(/article/.+)|(/\\d{5,})|(-\\d{4,}(\\.html?)?/?$)|(\\.s?html?$)"
    );
    private static final Pattern SKIPPED_PATH = Pattern.compile(
            "/(tag|tags|author|authors|search|login|subscribe|rss|video|photo|gallery)(/|$)"
    );

    private HtmlListingParser() {
    }

    public static List<String> articleLinks(Document listing, String linkSelector, int max) {
        Set<String> links = new LinkedHashSet<>();
        if (linkSelector != null && !linkSelector.isBlank()) {
            for (Element anchor : listing.select(linkSelector)) {
                Element link = anchor.hasAttr("href") ? anchor : anchor.selectFirst("a[href]");
                if (link == null) {
                    continue;
                }
                String href = link.absUrl("href");
                if (href.startsWith("http://") || href.startsWith("https://")) {
                    links.add(href);
                }
            }
        } else {
            String host = hostOf(listing.location());
            for (String href : HtmlUtils.extractLinks(listing)) {
                if (host != null && host.equals(hostOf(href)) && looksLikeArticle(href)) {
                    links.add(stripFragment(href));
                }
            }
        }
        List<String> picked = new ArrayList<>(links);
        return picked.size() > max ? List.copyOf(picked.subList(0, max)) : List.copyOf(picked);
    }

    static boolean looksLikeArticle(String url) {
        String path = pathOf(url).toLowerCase(Locale.ROOT);
        if (path.isEmpty() || "/".equals(path) || SKIPPED_PATH.matcher(path).find()) {
            return false;
        }
        return ARTICLE_PATH.matcher(path).find();
    }

    private static String hostOf(String url) {
        try {
            String host = URI.create(url).getHost();
            if (host == null) {
                return null;
            }
            String lowered = host.toLowerCase(Locale.ROOT);
            return lowered.startsWith("www.") ? lowered.substring(4) : lowered;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String pathOf(String url) {
        try {
            String path = URI.create(url).getPath();
            return path == null ? "" : path;
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    private static String stripFragment(String url) {
        int hash = url.indexOf('#');
        return hash < 0 ? url : url.substring(0, hash);
    }
}
