package org.example.insights.service;

import org.example.insights.config.TelegraphProperties;
import org.example.insights.model.ContentPage;
import org.example.insights.telegraph.TelegraphNodeFormatter;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Entities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a recap document into pages that each fit the Telegraph content budget.
 * Sizes are measured on the serialized node JSON that is actually sent.
 */
@Service
public class ContentPaginator {

    private static final Logger log = LoggerFactory.getLogger(ContentPaginator.class);

    static final String SPLIT_NOTICE_HEADER = "<p><em>Note: content split into multiple pages</em></p><hr>";
    static final String CONTINUES_FOOTER = "<hr><p><em>(this page is split content, continues on the next page)</em></p>";
    static final String END_FOOTER = "<hr><p><em>(end of series)</em></p>";

    private final TelegraphNodeFormatter formatter;
    private final int safetyBuffer;

    public ContentPaginator(TelegraphNodeFormatter formatter, TelegraphProperties properties) {
        this.formatter = formatter;
        this.safetyBuffer = Math.max(0, properties.getSafetyBuffer());
    }

    /**
     * Paginates {@code html}. Each returned page serializes to at most {@code byteBudget} minus the safety buffer.
     */
    public List<ContentPage> paginate(String html, String documentTitle, int byteBudget) {
        String source = html == null ? "" : html;
        String title = documentTitle == null ? "" : documentTitle;
        int limit = byteBudget - safetyBuffer;
        if (limit <= 0) {
            throw new IllegalArgumentException("Byte budget " + byteBudget + " leaves no room after safety buffer " + safetyBuffer);
        }

        List<String> sourceBlocks = formatter.topLevelBlocks(source);
        if (formatter.serializedSize(source) <= limit) {
            return List.of(new ContentPage(1, title, source, sourceBlocks));
        }

        List<List<String>> pageBlocks = new ArrayList<>();
        List<String> current = new ArrayList<>();
        for (String block : sourceBlocks) {
            int partNumber = pageBlocks.size() + 1;
            List<String> candidate = new ArrayList<>(current);
            candidate.add(block);
            if (fits(candidate, partNumber, title, limit)) {
                current = candidate;
                continue;
            }

            if (!current.isEmpty()) {
                pageBlocks.add(current);
                current = new ArrayList<>();
                partNumber = pageBlocks.size() + 1;
                if (fits(List.of(block), partNumber, title, limit)) {
                    current.add(block);
                    continue;
                }
            }

            log.warn("Block of {} bytes exceeds the page budget of {} bytes, splitting its text across pages",
                    formatter.serializedSize(block), limit);
            List<String> chunks = hardSplit(block, partNumber, title, limit);
            for (int i = 0; i < chunks.size() - 1; i++) {
                pageBlocks.add(List.of(chunks.get(i)));
            }
            current.add(chunks.get(chunks.size() - 1));
        }
        if (!current.isEmpty()) {
            pageBlocks.add(current);
        }

        List<ContentPage> pages = new ArrayList<>(pageBlocks.size());
        for (int i = 0; i < pageBlocks.size(); i++) {
            int partNumber = i + 1;
            boolean last = i == pageBlocks.size() - 1;
            List<String> blocks = pageBlocks.get(i);
            String pageHtml = header(partNumber, title) + String.join("", blocks) + (last ? END_FOOTER : CONTINUES_FOOTER);
            pages.add(new ContentPage(partNumber, partTitle(title, partNumber), pageHtml, blocks));
        }
        log.info("Paginated '{}' into {} pages (limit {} bytes)", title, pages.size(), limit);
        return pages;
    }

    public static String partTitle(String title, int partNumber) {
        return title + " (Part " + partNumber + ")";
    }

    static String header(int partNumber, String title) {
        if (partNumber == 1) {
            return SPLIT_NOTICE_HEADER;
        }
        return "<p><em>" + Entities.escape(title) + " (continued, part " + partNumber + ")</em></p><hr>";
    }

    private boolean fits(List<String> blocks, int partNumber, String title, int limit) {
        String body = String.join("", blocks);
        String header = header(partNumber, title);
        // The footer is only known once the last page closes, so measure against the longer one.
        int withContinues = formatter.serializedSize(header + body + CONTINUES_FOOTER);
        int withEnd = formatter.serializedSize(header + body + END_FOOTER);
        return Math.max(withContinues, withEnd) <= limit;
    }

    private List<String> hardSplit(String block, int partNumber, String title, int limit) {
        int[] codePoints = Jsoup.parseBodyFragment(block).body().text().codePoints().toArray();
        List<String> chunks = new ArrayList<>();
        int start = 0;
        int page = partNumber;
        while (start < codePoints.length) {
            int length = largestFittingLength(codePoints, start, page, title, limit);
            if (length == 0) {
                throw new IllegalArgumentException("Page budget of " + limit + " bytes cannot hold any text");
            }
            chunks.add(paragraph(new String(codePoints, start, length)));
            start += length;
            page++;
        }
        if (chunks.isEmpty()) {
            chunks.add(paragraph(""));
        }
        return chunks;
    }

    private int largestFittingLength(int[] codePoints, int start, int partNumber, String title, int limit) {
        int low = 0;
        int high = codePoints.length - start;
        while (low < high) {
            int mid = low + (high - low + 1) / 2;
            String chunk = paragraph(new String(codePoints, start, mid));
            if (fits(List.of(chunk), partNumber, title, limit)) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }

    private static String paragraph(String text) {
        return "<p>" + Entities.escape(text) + "</p>";
    }
}
