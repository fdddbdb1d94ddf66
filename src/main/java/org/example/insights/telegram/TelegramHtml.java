package org.example.insights.telegram;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for Telegram's HTML parse mode.
 */
public final class TelegramHtml {

    private static final Pattern MARKDOWN_TITLE = Pattern.compile("(?m)^#{1,6}\\s+(.+?)\\s*$");

    private TelegramHtml() {
    }

    public static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    public static String escapeAttribute(String text) {
        return escape(text).replace("\"", "&quot;");
    }

    /**
     * Rewrites markdown heading lines ({@code ## Title}) as bold lines.
     */
    public static String markdownTitlesToBold(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        Matcher matcher = MARKDOWN_TITLE.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(result, Matcher.quoteReplacement("<b>" + matcher.group(1) + "</b>"));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    public static String link(String url, String text) {
        return "<a href=\"" + escapeAttribute(url) + "\">" + escape(text) + "</a>";
    }

    /**
     * Public link to a message in a supergroup, or null for chats without public message links.
     */
    public static String messageLink(long chatId, int messageId) {
        String id = String.valueOf(chatId);
        if (!id.startsWith("-100")) {
            return null;
        }
        return "https://t.me/c/" + id.substring(4) + "/" + messageId;
    }
}
