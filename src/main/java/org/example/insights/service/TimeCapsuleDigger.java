package org.example.insights.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Polls the capsule queue and hands each claimed capsule to the {@link CapsuleHandler}.
 */
@Service
public class TimeCapsuleDigger {

    private static final Logger log = LoggerFactory.getLogger(TimeCapsuleDigger.class);

    private final RecapCapsuleQueue capsuleQueue;
    private final CapsuleHandler handler;
    private final RecapScheduleCalculator scheduleCalculator;
    private final Duration leaseDuration;

    public TimeCapsuleDigger(
            RecapCapsuleQueue capsuleQueue,
            CapsuleHandler handler,
            RecapScheduleCalculator scheduleCalculator,
            @Value("${recap.capsules.lease-seconds:300}") long leaseSeconds) {
        this.capsuleQueue = capsuleQueue;
        this.handler = handler;
        this.scheduleCalculator = scheduleCalculator;
        this.leaseDuration = Duration.ofSeconds(leaseSeconds);
    }

    @Scheduled(fixedDelayString = "${recap.capsules.poll-interval-ms:15000}", initialDelayString = "${recap.capsules.initial-delay-ms:10000}")
    public void dig() {
        List<Long> claimed;
        try {
            claimed = capsuleQueue.claimDue(scheduleCalculator.nowUtc(), leaseDuration);
        } catch (RuntimeException e) {
            log.error("Failed to claim due recap capsules", e);
            return;
        }
        for (Long chatId : claimed) {
            try {
                handler.onFire(chatId);
            } catch (RuntimeException e) {
                log.error("Capsule handler failed for chat {}", chatId, e);
            }
        }
    }
}
