package org.example.insights.telegram;

import org.example.insights.model.ChatInfo;
import org.example.insights.model.ChatMemberStatus;

/**
 * Messaging operations recap delivery depends on. Every method throws {@link ChatPlatformException}
 * when the platform call fails.
 */
public interface ChatPlatform {

    /**
     * @return the id the platform assigned to the sent message
     */
    int sendMessage(OutgoingMessage message);

    void editMessage(long chatId, int messageId, String htmlText);

    void deleteMessage(long chatId, int messageId);

    void pinMessage(long chatId, int messageId);

    void unpinMessage(long chatId, int messageId);

    ChatInfo getChat(long chatId);

    ChatMemberStatus getChatMember(long chatId, long userId);

    void answerCallback(String callbackQueryId, String text);
}
