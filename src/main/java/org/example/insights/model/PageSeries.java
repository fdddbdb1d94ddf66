package org.example.insights.model;

import java.util.List;

/**
 * Published pages of one recap in reading order. The first URL is the canonical link.
 */
public record PageSeries(List<String> urls) {

    public PageSeries {
        if (urls == null || urls.isEmpty()) {
            throw new IllegalArgumentException("Page series must contain at least one URL");
        }
        urls = List.copyOf(urls);
    }

    public static PageSeries single(String url) {
        return new PageSeries(List.of(url));
    }

    public String canonicalUrl() {
        return urls.get(0);
    }

    public int size() {
        return urls.size();
    }

    public boolean isMultiPage() {
        return urls.size() > 1;
    }
}
