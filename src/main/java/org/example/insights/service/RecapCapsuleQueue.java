package org.example.insights.service;

import org.example.insights.entity.RecapCapsuleEntity;
import org.example.insights.repository.RecapCapsuleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Database-backed queue of pending auto-recap fires, one capsule per chat.
 * Timestamps are UTC.
 */
@Service
public class RecapCapsuleQueue {

    private static final Logger log = LoggerFactory.getLogger(RecapCapsuleQueue.class);

    private final RecapCapsuleRepository capsuleRepository;
    private final String leaseOwner = "capsule-" + UUID.randomUUID();

    public RecapCapsuleQueue(RecapCapsuleRepository capsuleRepository) {
        this.capsuleRepository = capsuleRepository;
    }

    /**
     * Sets the chat's pending fire to {@code dueAtUtc}, replacing any earlier one and releasing its lease.
     */
    public void schedule(long chatId, LocalDateTime dueAtUtc) {
        if (capsuleRepository.rearm(chatId, dueAtUtc) > 0) {
            log.debug("Re-armed recap capsule for chat {} at {}", chatId, dueAtUtc);
            return;
        }
        try {
            capsuleRepository.save(new RecapCapsuleEntity(chatId, dueAtUtc));
            log.debug("Armed recap capsule for chat {} at {}", chatId, dueAtUtc);
        } catch (DataIntegrityViolationException e) {
            // Another instance inserted the capsule concurrently.
            capsuleRepository.rearm(chatId, dueAtUtc);
        }
    }

    public void cancel(long chatId) {
        if (capsuleRepository.deleteByChatId(chatId) > 0) {
            log.info("Cancelled recap capsule for chat {}", chatId);
        }
    }

    /**
     * Claims every capsule that is due and not leased by a live claim.
     *
     * @return chat ids this instance now holds the lease for
     */
    public List<Long> claimDue(LocalDateTime nowUtc, Duration leaseDuration) {
        List<Long> claimed = new ArrayList<>();
        LocalDateTime leaseExpiresAt = nowUtc.plus(leaseDuration);
        for (Long chatId : capsuleRepository.findDueChatIds(nowUtc)) {
            if (capsuleRepository.claimFireLease(chatId, nowUtc, leaseExpiresAt, leaseOwner) == 1) {
                claimed.add(chatId);
            }
        }
        return claimed;
    }

    public boolean isScheduled(long chatId) {
        return capsuleRepository.existsByChatId(chatId);
    }

    public Optional<LocalDateTime> nextDueAt(long chatId) {
        return capsuleRepository.findByChatId(chatId).map(RecapCapsuleEntity::getDueAt);
    }

    public long pendingCount() {
        return capsuleRepository.count();
    }
}
