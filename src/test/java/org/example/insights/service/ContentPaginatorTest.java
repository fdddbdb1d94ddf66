package org.example.insights.service;

import org.example.insights.config.TelegraphProperties;
import org.example.insights.model.ContentPage;
import org.example.insights.telegraph.TelegraphNodeFormatter;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContentPaginatorTest {

    private static final int BUDGET = 3000;
    private static final int SAFETY = 200;

    private final TelegraphNodeFormatter formatter = new TelegraphNodeFormatter();
    private ContentPaginator paginator;

    @BeforeEach
    void setUp() {
        TelegraphProperties properties = new TelegraphProperties();
        properties.setSafetyBuffer(SAFETY);
        paginator = new ContentPaginator(formatter, properties);
    }

    @Test
    void paginate_documentThatFits_returnsSinglePageUnchanged() {
        String html = "<h2>Topic</h2><p>Short recap.</p>";

        List<ContentPage> pages = paginator.paginate(html, "Team recap", BUDGET);

        assertEquals(1, pages.size());
        assertEquals(html, pages.get(0).html());
        assertEquals("Team recap", pages.get(0).title());
        assertEquals(List.of("<h2>Topic</h2>", "<p>Short recap.</p>"), pages.get(0).blocks());
    }

    @Test
    void paginate_oversizedDocument_splitsAtBlockBoundariesWithinBudget() {
        StringBuilder html = new StringBuilder();
        for (int i = 0; i < 40; i++) {
            html.append("<p>Paragraph ").append(i).append(": ").append("word ".repeat(40)).append("</p>");
        }

        List<ContentPage> pages = paginator.paginate(html.toString(), "Team recap", BUDGET);

        assertTrue(pages.size() > 1);
        List<String> reassembled = new ArrayList<>();
        for (ContentPage page : pages) {
            assertTrue(formatter.serializedSize(page.html()) <= BUDGET - SAFETY,
                    "page " + page.partNumber() + " exceeds budget");
            assertEquals("Team recap (Part " + page.partNumber() + ")", page.title());
            reassembled.addAll(page.blocks());
        }
        assertEquals(formatter.topLevelBlocks(html.toString()), reassembled);

        assertTrue(pages.get(0).html().startsWith(ContentPaginator.SPLIT_NOTICE_HEADER));
        assertTrue(pages.get(1).html().contains("(continued, part 2)"));
        assertTrue(pages.get(0).html().endsWith(ContentPaginator.CONTINUES_FOOTER));
        assertTrue(pages.get(pages.size() - 1).html().endsWith(ContentPaginator.END_FOOTER));
    }

    @Test
    void paginate_blockLargerThanAPage_hardSplitsItsTextWithoutLoss() {
        String text = "abcdefghij".repeat(1000);
        String html = "<p>Intro</p><p><b>" + text + "</b></p><p>Outro</p>";

        List<ContentPage> pages = paginator.paginate(html, "Long", BUDGET);

        assertTrue(pages.size() >= 4);
        StringBuilder body = new StringBuilder();
        for (ContentPage page : pages) {
            assertTrue(formatter.serializedSize(page.html()) <= BUDGET - SAFETY);
            for (String block : page.blocks()) {
                body.append(Jsoup.parseBodyFragment(block).body().text());
            }
        }
        assertEquals("Intro" + text + "Outro", body.toString());
    }

    @Test
    void paginate_multiByteText_measuresEncodedSize() {
        String paragraph = "<p>" + "привет ".repeat(60) + "</p>";
        String html = paragraph.repeat(10);

        List<ContentPage> pages = paginator.paginate(html, "Cyrillic", BUDGET);

        assertTrue(pages.size() > 1);
        for (ContentPage page : pages) {
            assertTrue(formatter.serializedSize(page.html()) <= BUDGET - SAFETY);
        }
    }

    @Test
    void paginate_budgetSmallerThanSafetyBuffer_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> paginator.paginate("<p>x</p>", "t", SAFETY));
    }
}
