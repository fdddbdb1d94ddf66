package org.example.insights.service;

import org.example.insights.entity.SentMessageEntity;
import org.example.insights.repository.SentMessageRepository;
import org.example.insights.telegram.ChatPlatform;
import org.example.insights.telegram.ChatPlatformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Records sent recap messages and moves the chat's pin to the newest one.
 * A chat has at most one record marked pinned.
 */
@Service
public class PinnedMessageService {

    private static final Logger log = LoggerFactory.getLogger(PinnedMessageService.class);

    private final SentMessageRepository sentMessageRepository;
    private final ChatPlatform chatPlatform;

    public PinnedMessageService(SentMessageRepository sentMessageRepository, ChatPlatform chatPlatform) {
        this.sentMessageRepository = sentMessageRepository;
        this.chatPlatform = chatPlatform;
    }

    public SentMessageEntity recordSent(long chatId, int messageId, String text) {
        return sentMessageRepository.save(new SentMessageEntity(chatId, messageId, text, false));
    }

    /**
     * Unpins the previously pinned recap messages, pins {@code messageId} and records it.
     * When the pinned lookup fails the message is recorded unpinned.
     */
    @Transactional
    public SentMessageEntity recordAndPin(long chatId, int messageId, String text) {
        List<SentMessageEntity> previouslyPinned;
        try {
            previouslyPinned = sentMessageRepository.findByChatIdAndPinnedTrueOrderBySentAtDesc(chatId);
        } catch (RuntimeException e) {
            log.warn("Failed to look up pinned recap messages of chat {}, skipping pin: {}", chatId, e.getMessage());
            return recordSent(chatId, messageId, text);
        }

        for (SentMessageEntity previous : previouslyPinned) {
            try {
                chatPlatform.unpinMessage(chatId, previous.getMessageId());
            } catch (ChatPlatformException e) {
                log.warn("Failed to unpin message {} in chat {}: {}", previous.getMessageId(), chatId, e.getMessage());
            }
            previous.setPinned(false);
        }
        if (!previouslyPinned.isEmpty()) {
            sentMessageRepository.saveAll(previouslyPinned);
        }

        boolean pinned = false;
        try {
            chatPlatform.pinMessage(chatId, messageId);
            pinned = true;
        } catch (ChatPlatformException e) {
            log.warn("Failed to pin message {} in chat {}: {}", messageId, chatId, e.getMessage());
        }
        return sentMessageRepository.save(new SentMessageEntity(chatId, messageId, text, pinned));
    }
}
