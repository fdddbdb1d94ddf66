package org.example.insights.service;

import org.example.insights.entity.ChatHistoryEntity;
import org.example.insights.repository.ChatHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Service
public class ChatHistoryService {

    private static final Logger log = LoggerFactory.getLogger(ChatHistoryService.class);

    private final ChatHistoryRepository chatHistoryRepository;
    private final int retentionDays;

    public ChatHistoryService(
            ChatHistoryRepository chatHistoryRepository,
            @Value("${recap.history.retention-days:7}") int retentionDays) {
        this.chatHistoryRepository = chatHistoryRepository;
        this.retentionDays = retentionDays;
    }

    /**
     * Horizon of an automatic recap window for the given number of recaps per day.
     */
    public static int horizonHours(int ratesPerDay) {
        return switch (ratesPerDay) {
            case 4 -> 6;
            case 3 -> 8;
            case 2 -> 12;
            default -> 6;
        };
    }

    @Transactional
    public ChatHistoryEntity record(
            long chatId,
            String chatTitle,
            int messageId,
            Long userId,
            String fullName,
            String text,
            Integer replyToMessageId,
            LocalDateTime sentAt) {
        ChatHistoryEntity entity = new ChatHistoryEntity(chatId, messageId, userId, fullName, text, sentAt);
        entity.setChatTitle(chatTitle);
        entity.setReplyToMessageId(replyToMessageId);
        return chatHistoryRepository.save(entity);
    }

    /**
     * Messages of the last {@code hours} hours, oldest first.
     */
    @Transactional(readOnly = true)
    public List<ChatHistoryEntity> findWindow(long chatId, int hours) {
        LocalDateTime since = LocalDateTime.now().minusHours(hours);
        return chatHistoryRepository.findByChatIdAndSentAtGreaterThanEqualOrderBySentAtAsc(chatId, since);
    }

    @Scheduled(cron = "${recap.history.prune-cron:0 30 3 * * *}")
    public void pruneExpiredHistory() {
        if (retentionDays <= 0) {
            return;
        }
        int deleted = chatHistoryRepository.deleteOlderThan(LocalDateTime.now().minusDays(retentionDays));
        if (deleted > 0) {
            log.info("Pruned {} chat history rows older than {} days", deleted, retentionDays);
        }
    }
}
