package org.example.insights.service;

import org.example.insights.config.TelegraphProperties;
import org.example.insights.model.ContentPage;
import org.example.insights.model.PageSeries;
import org.example.insights.telegraph.TelegraphApi;
import org.example.insights.telegraph.TelegraphNodeFormatter;
import org.example.insights.telegraph.TelegraphPage;
import org.jsoup.nodes.Entities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Publishes recap documents to Telegraph, splitting them into cross-linked page series when they
 * exceed the content budget.
 */
@Service
public class TelegraphPublishingService {

    private static final Logger log = LoggerFactory.getLogger(TelegraphPublishingService.class);

    static final String DELETED_PAGE_TITLE = "Deleted";
    static final String DELETED_PAGE_HTML = "<p>This page has been deleted</p>";

    private final TelegraphApi telegraphApi;
    private final TelegraphNodeFormatter formatter;
    private final ContentPaginator paginator;
    private final TelegraphProperties properties;
    private final Sleeper sleeper;

    @Autowired
    public TelegraphPublishingService(
            TelegraphApi telegraphApi,
            TelegraphNodeFormatter formatter,
            ContentPaginator paginator,
            TelegraphProperties properties) {
        this(telegraphApi, formatter, paginator, properties, Sleeper.THREAD_SLEEP);
    }

    TelegraphPublishingService(
            TelegraphApi telegraphApi,
            TelegraphNodeFormatter formatter,
            ContentPaginator paginator,
            TelegraphProperties properties,
            Sleeper sleeper) {
        this.telegraphApi = telegraphApi;
        this.formatter = formatter;
        this.paginator = paginator;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    /**
     * Publishes {@code html} as one page when it fits, otherwise as a page series.
     */
    public PageSeries publish(String title, String html) {
        int limit = properties.getPageSizeLimit() - properties.getSafetyBuffer();
        if (formatter.serializedSize(html) <= limit) {
            return PageSeries.single(createPage(title, html).url());
        }
        return createPageSeries(title, html);
    }

    public TelegraphPage createPage(String title, String html) {
        String accessToken = requireAccessToken();
        return withRetries("create Telegraph page '" + title + "'",
                () -> telegraphApi.createPage(accessToken, title, properties.getAuthorName(), formatter.toNodes(html)));
    }

    public TelegraphPage editPage(String url, String title, String html) {
        String accessToken = requireAccessToken();
        String path = pathFromUrl(url);
        return withRetries("edit Telegraph page " + path,
                () -> telegraphApi.editPage(accessToken, path, title, properties.getAuthorName(), formatter.toNodes(html)));
    }

    /**
     * Telegraph has no delete endpoint, so the page content is replaced with a deletion notice.
     */
    public void deletePage(String url) {
        editPage(url, DELETED_PAGE_TITLE, DELETED_PAGE_HTML);
        log.info("Blanked Telegraph page {}", url);
    }

    /**
     * Creates every page of the paginated document, then edits each one to prepend a series index.
     * Index edits that fail are logged and leave that page without cross-links.
     */
    public PageSeries createPageSeries(String title, String html) {
        List<ContentPage> pages = paginator.paginate(html, title, properties.getPageSizeLimit());
        if (pages.size() == 1) {
            return PageSeries.single(createPage(title, pages.get(0).html()).url());
        }

        List<String> urls = new ArrayList<>(pages.size());
        for (int i = 0; i < pages.size(); i++) {
            if (i > 0) {
                pause(properties.getPageCreateInterval().toMillis());
            }
            ContentPage page = pages.get(i);
            TelegraphPage created = createPage(page.title(), page.html());
            urls.add(created.url());
            log.info("Created Telegraph page {}/{} for '{}': {}", page.partNumber(), pages.size(), title, created.url());
        }

        // Give freshly created pages time to settle before editing them.
        pause(properties.getPageCreateInterval().toMillis() * 2);

        for (int i = 0; i < pages.size(); i++) {
            if (i > 0) {
                pause(properties.getPageCreateInterval().toMillis());
            }
            ContentPage page = pages.get(i);
            String indexedHtml = withIndex(page.html(), urls, i);
            if (indexedHtml == null) {
                log.warn("Series index does not fit on page {} of '{}', leaving it without cross-links",
                        page.partNumber(), title);
                continue;
            }
            try {
                editPage(urls.get(i), page.title(), indexedHtml);
            } catch (TelegraphPublishingException e) {
                log.warn("Failed to add series index to page {} of '{}': {}", page.partNumber(), title, e.getMessage());
            }
        }
        return new PageSeries(urls);
    }

    /**
     * Returns the page with the full index prepended, the compact previous/next index when the full one
     * overflows, or null when neither fits.
     */
    String withIndex(String pageHtml, List<String> urls, int currentIndex) {
        String full = fullIndex(urls, currentIndex) + pageHtml;
        if (formatter.serializedSize(full) <= properties.getPageSizeLimit()) {
            return full;
        }
        String compact = compactIndex(urls, currentIndex) + pageHtml;
        if (formatter.serializedSize(compact) <= properties.getPageSizeLimit()) {
            return compact;
        }
        return null;
    }

    static String fullIndex(List<String> urls, int currentIndex) {
        StringBuilder html = new StringBuilder("<p><strong>Series pages:</strong></p><ul>");
        for (int i = 0; i < urls.size(); i++) {
            html.append("<li>");
            if (i == currentIndex) {
                html.append("<strong>Part ").append(i + 1).append(" (this page)</strong>");
            } else {
                html.append("<a href=\"").append(Entities.escape(urls.get(i))).append("\">Part ")
                        .append(i + 1).append("</a>");
            }
            html.append("</li>");
        }
        html.append("</ul><hr>");
        return html.toString();
    }

    static String compactIndex(List<String> urls, int currentIndex) {
        StringBuilder html = new StringBuilder("<p>");
        if (currentIndex > 0) {
            html.append("<a href=\"").append(Entities.escape(urls.get(currentIndex - 1))).append("\">Previous: Part ")
                    .append(currentIndex).append("</a>");
        }
        if (currentIndex > 0 && currentIndex < urls.size() - 1) {
            html.append(" | ");
        }
        if (currentIndex < urls.size() - 1) {
            html.append("<a href=\"").append(Entities.escape(urls.get(currentIndex + 1))).append("\">Next: Part ")
                    .append(currentIndex + 2).append("</a>");
        }
        html.append("</p><hr>");
        return html.toString();
    }

    static String pathFromUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Telegraph page URL is required");
        }
        String trimmed = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }

    private String requireAccessToken() {
        String accessToken = properties.getAccessToken();
        if (accessToken == null || accessToken.isBlank()) {
            throw new TelegraphPublishingException("Telegraph access token is not configured");
        }
        return accessToken;
    }

    private TelegraphPage withRetries(String description, Supplier<TelegraphPage> call) {
        try {
            return Retries.call(description, properties.getMaxRetries(), properties.getRetryDelay(), sleeper, call);
        } catch (Retries.RetriesExhaustedException e) {
            throw new TelegraphPublishingException("Failed to " + description, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TelegraphPublishingException("Interrupted while trying to " + description, e);
        }
    }

    private void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TelegraphPublishingException("Interrupted while pacing Telegraph requests", e);
        }
    }
}
