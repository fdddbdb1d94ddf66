package org.example.insights.telegram;

import org.example.insights.model.ChatInfo;
import org.example.insights.model.ChatMemberStatus;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.groupadministration.GetChat;
import org.telegram.telegrambots.meta.api.methods.groupadministration.GetChatMember;
import org.telegram.telegrambots.meta.api.methods.pinnedmessages.PinChatMessage;
import org.telegram.telegrambots.meta.api.methods.pinnedmessages.UnpinChatMessage;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.DeleteMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.chatmember.ChatMember;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.List;

@Component
public class TelegramChatPlatform implements ChatPlatform {

    private static final String PARSE_MODE_HTML = "HTML";

    private final AbsSender sender;

    public TelegramChatPlatform(AbsSender sender) {
        this.sender = sender;
    }

    @Override
    public int sendMessage(OutgoingMessage message) {
        SendMessage.SendMessageBuilder builder = SendMessage.builder()
                .chatId(String.valueOf(message.chatId()))
                .text(message.htmlText())
                .parseMode(PARSE_MODE_HTML);
        if (!message.buttons().isEmpty()) {
            List<InlineKeyboardButton> row = message.buttons().stream()
                    .map(button -> InlineKeyboardButton.builder()
                            .text(button.text())
                            .callbackData(button.callbackData())
                            .build())
                    .toList();
            builder.replyMarkup(InlineKeyboardMarkup.builder().keyboardRow(row).build());
        }
        try {
            Message sent = sender.execute(builder.build());
            return sent.getMessageId();
        } catch (TelegramApiException e) {
            throw new ChatPlatformException("Failed to send message to chat " + message.chatId(), e);
        }
    }

    @Override
    public void editMessage(long chatId, int messageId, String htmlText) {
        EditMessageText edit = EditMessageText.builder()
                .chatId(String.valueOf(chatId))
                .messageId(messageId)
                .text(htmlText)
                .parseMode(PARSE_MODE_HTML)
                .build();
        try {
            sender.execute(edit);
        } catch (TelegramApiException e) {
            throw new ChatPlatformException("Failed to edit message " + messageId + " in chat " + chatId, e);
        }
    }

    @Override
    public void deleteMessage(long chatId, int messageId) {
        try {
            sender.execute(new DeleteMessage(String.valueOf(chatId), messageId));
        } catch (TelegramApiException e) {
            throw new ChatPlatformException("Failed to delete message " + messageId + " in chat " + chatId, e);
        }
    }

    @Override
    public void pinMessage(long chatId, int messageId) {
        PinChatMessage pin = PinChatMessage.builder()
                .chatId(String.valueOf(chatId))
                .messageId(messageId)
                .disableNotification(true)
                .build();
        try {
            sender.execute(pin);
        } catch (TelegramApiException e) {
            throw new ChatPlatformException("Failed to pin message " + messageId + " in chat " + chatId, e);
        }
    }

    @Override
    public void unpinMessage(long chatId, int messageId) {
        UnpinChatMessage unpin = UnpinChatMessage.builder()
                .chatId(String.valueOf(chatId))
                .messageId(messageId)
                .build();
        try {
            sender.execute(unpin);
        } catch (TelegramApiException e) {
            throw new ChatPlatformException("Failed to unpin message " + messageId + " in chat " + chatId, e);
        }
    }

    @Override
    public ChatInfo getChat(long chatId) {
        try {
            Chat chat = sender.execute(GetChat.builder().chatId(String.valueOf(chatId)).build());
            return new ChatInfo(chat.getId(), chat.getType(), chat.getTitle());
        } catch (TelegramApiException e) {
            throw new ChatPlatformException("Failed to get chat " + chatId, e);
        }
    }

    @Override
    public ChatMemberStatus getChatMember(long chatId, long userId) {
        GetChatMember request = GetChatMember.builder()
                .chatId(String.valueOf(chatId))
                .userId(userId)
                .build();
        try {
            ChatMember member = sender.execute(request);
            return ChatMemberStatus.fromTelegram(member.getStatus());
        } catch (TelegramApiException e) {
            throw new ChatPlatformException("Failed to get member " + userId + " of chat " + chatId, e);
        }
    }

    @Override
    public void answerCallback(String callbackQueryId, String text) {
        AnswerCallbackQuery answer = AnswerCallbackQuery.builder()
                .callbackQueryId(callbackQueryId)
                .text(text)
                .build();
        try {
            sender.execute(answer);
        } catch (TelegramApiException e) {
            throw new ChatPlatformException("Failed to answer callback " + callbackQueryId, e);
        }
    }
}
