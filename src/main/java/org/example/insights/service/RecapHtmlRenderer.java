package org.example.insights.service;

import org.example.insights.telegram.TelegramHtml;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders topic summaries into the HTML document published as a recap page.
 */
@Component
public class RecapHtmlRenderer {

    private static final DateTimeFormatter RANGE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm z");

    public String render(List<String> summaries, ZonedDateTime from, ZonedDateTime to, String modelName) {
        StringBuilder html = new StringBuilder();
        html.append("<p><small>Messages from ")
                .append(TelegramHtml.escape(RANGE_FORMAT.format(from)))
                .append(" to ")
                .append(TelegramHtml.escape(RANGE_FORMAT.format(to)))
                .append("</small></p><hr>");

        for (String summary : summaries) {
            html.append(renderSummary(summary));
        }

        if (modelName != null && !modelName.isBlank()) {
            html.append("<hr><p><em>Generated by ").append(TelegramHtml.escape(modelName)).append("</em></p>");
        }
        return html.toString();
    }

    /**
     * Summaries are already HTML-escaped Telegram text; heading lines become section titles and
     * every other non-blank line a paragraph.
     */
    String renderSummary(String summary) {
        List<String> blocks = new ArrayList<>();
        for (String rawLine : summary.split("\n")) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith("## ")) {
                blocks.add("<h2>" + line.substring(3).trim() + "</h2>");
            } else {
                blocks.add("<p>" + line + "</p>");
            }
        }
        return String.join("", blocks);
    }
}
