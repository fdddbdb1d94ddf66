package org.example.insights.telegram;

import org.example.insights.entity.RecapOptionsEntity;
import org.example.insights.model.RecapConfigAction;
import org.example.insights.service.ChatHistoryService;
import org.example.insights.service.RecapOptionsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Handles updates relevant to recaps: records chat history, applies settings callbacks
 * and drops subscriptions of members who leave.
 */
@Component
public class TelegramUpdateHandler {

    private static final Logger log = LoggerFactory.getLogger(TelegramUpdateHandler.class);

    private final ChatHistoryService historyService;
    private final RecapOptionsService optionsService;
    private final ChatPlatform chatPlatform;

    public TelegramUpdateHandler(
            ChatHistoryService historyService,
            RecapOptionsService optionsService,
            ChatPlatform chatPlatform) {
        this.historyService = historyService;
        this.optionsService = optionsService;
        this.chatPlatform = chatPlatform;
    }

    @EventListener
    public void onUpdate(Update update) {
        try {
            if (update.hasCallbackQuery()) {
                handleCallback(update.getCallbackQuery());
            } else if (update.hasMessage()) {
                handleMessage(update.getMessage());
            }
        } catch (RuntimeException e) {
            log.error("Failed to handle update {}", update.getUpdateId(), e);
        }
    }

    void handleMessage(Message message) {
        long chatId = message.getChatId();
        User leftMember = message.getLeftChatMember();
        if (leftMember != null) {
            if (optionsService.unsubscribe(chatId, leftMember.getId())) {
                log.info("Removed recap subscription of user {} who left chat {}", leftMember.getId(), chatId);
            }
            return;
        }

        String text = message.hasText() ? message.getText() : message.getCaption();
        if (text == null || text.isBlank() || text.startsWith("/")) {
            return;
        }
        User from = message.getFrom();
        if (from != null && Boolean.TRUE.equals(from.getIsBot())) {
            return;
        }
        Optional<RecapOptionsEntity> options = optionsService.findOptions(chatId);
        if (options.isEmpty() || !options.get().isEnabled()) {
            return;
        }

        Integer replyTo = message.getReplyToMessage() == null ? null : message.getReplyToMessage().getMessageId();
        LocalDateTime sentAt = message.getDate() == null
                ? LocalDateTime.now()
                : LocalDateTime.ofInstant(Instant.ofEpochSecond(message.getDate()), ZoneId.systemDefault());
        historyService.record(
                chatId,
                message.getChat() == null ? null : message.getChat().getTitle(),
                message.getMessageId(),
                from == null ? null : from.getId(),
                fullName(from),
                text,
                replyTo,
                sentAt);
    }

    void handleCallback(CallbackQuery callback) {
        Optional<RecapConfigAction> decoded = RecapCallbackCodec.decode(callback.getData());
        if (decoded.isEmpty()) {
            return;
        }
        RecapConfigAction action = decoded.get();
        long pressedBy = callback.getFrom().getId();
        if (pressedBy != action.fromId()) {
            answer(callback, "This button belongs to someone else");
            return;
        }
        try {
            optionsService.apply(action);
            answer(callback, action instanceof RecapConfigAction.Unsubscribe ? "Unsubscribed" : "Saved");
        } catch (IllegalArgumentException e) {
            answer(callback, e.getMessage());
        }
    }

    private void answer(CallbackQuery callback, String text) {
        try {
            chatPlatform.answerCallback(callback.getId(), text);
        } catch (ChatPlatformException e) {
            log.warn("Failed to answer callback {}: {}", callback.getId(), e.getMessage());
        }
    }

    private static String fullName(User user) {
        if (user == null) {
            return null;
        }
        String lastName = user.getLastName();
        return lastName == null || lastName.isBlank() ? user.getFirstName() : user.getFirstName() + " " + lastName;
    }
}
