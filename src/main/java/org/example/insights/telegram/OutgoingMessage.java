package org.example.insights.telegram;

import java.util.List;

/**
 * An HTML-formatted message with an optional single row of inline buttons.
 */
public record OutgoingMessage(
        long chatId,
        String htmlText,
        List<InlineButton> buttons
) {
    public OutgoingMessage {
        buttons = buttons == null ? List.of() : List.copyOf(buttons);
    }

    public static OutgoingMessage html(long chatId, String htmlText) {
        return new OutgoingMessage(chatId, htmlText, List.of());
    }

    public record InlineButton(String text, String callbackData) {
    }
}
