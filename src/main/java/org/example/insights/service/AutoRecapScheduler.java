package org.example.insights.service;

import jakarta.annotation.PreDestroy;
import org.example.insights.config.AutoRecapProperties;
import org.example.insights.entity.AutoRecapSendMode;
import org.example.insights.entity.RecapOptionsEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Fires auto recaps from claimed time capsules. Every firing re-arms the chat's next capsule,
 * whatever the outcome, and hands the run to a bounded worker pool.
 */
@Service
public class AutoRecapScheduler implements CapsuleHandler {

    private static final Logger log = LoggerFactory.getLogger(AutoRecapScheduler.class);

    private final RecapOptionsService optionsService;
    private final RecapCapsuleQueue capsuleQueue;
    private final RecapScheduleCalculator scheduleCalculator;
    private final RecapGenerationService generationService;
    private final RecapMetricsService metricsService;
    private final AutoRecapProperties properties;
    private final ExecutorService workers;
    private final Sleeper sleeper;
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    @Autowired
    public AutoRecapScheduler(
            RecapOptionsService optionsService,
            RecapCapsuleQueue capsuleQueue,
            RecapScheduleCalculator scheduleCalculator,
            RecapGenerationService generationService,
            RecapMetricsService metricsService,
            AutoRecapProperties properties) {
        this(optionsService, capsuleQueue, scheduleCalculator, generationService, metricsService, properties,
                Executors.newFixedThreadPool(Math.max(1, properties.getMaxConcurrentRuns()), new RecapWorkerThreadFactory()),
                Sleeper.THREAD_SLEEP);
    }

    AutoRecapScheduler(
            RecapOptionsService optionsService,
            RecapCapsuleQueue capsuleQueue,
            RecapScheduleCalculator scheduleCalculator,
            RecapGenerationService generationService,
            RecapMetricsService metricsService,
            AutoRecapProperties properties,
            ExecutorService workers,
            Sleeper sleeper) {
        this.optionsService = optionsService;
        this.capsuleQueue = capsuleQueue;
        this.scheduleCalculator = scheduleCalculator;
        this.generationService = generationService;
        this.metricsService = metricsService;
        this.properties = properties;
        this.workers = workers;
        this.sleeper = sleeper;
    }

    /**
     * Arms the chat's capsule for its next slot.
     */
    public void schedule(long chatId) {
        int ratesPerDay = optionsService.findOptions(chatId)
                .map(RecapOptionsEntity::effectiveRatesPerDay)
                .orElse(RecapOptionsEntity.DEFAULT_RATES_PER_DAY);
        capsuleQueue.schedule(chatId, scheduleCalculator.nextDueAtUtc(ratesPerDay));
    }

    /**
     * Runs on the capsule poller thread, so it only hands the firing to a worker and re-arms.
     * Store reads and their retry waits happen on the worker.
     */
    @Override
    public void onFire(long chatId) {
        MDC.put(RecapGenerationService.MDC_CHAT_ID, String.valueOf(chatId));
        metricsService.recordFiring();
        try {
            if (!properties.isEnabled()) {
                metricsService.recordFiringSkipped();
                log.debug("Auto recaps are disabled, skipping chat {}", chatId);
            } else {
                submit(chatId, () -> fire(chatId));
            }
        } catch (RuntimeException e) {
            log.error("Auto recap firing failed for chat {}", chatId, e);
        } finally {
            try {
                schedule(chatId);
            } catch (RuntimeException e) {
                log.error("Failed to re-arm auto recap for chat {}", chatId, e);
            }
            MDC.remove(RecapGenerationService.MDC_CHAT_ID);
        }
    }

    private void fire(long chatId) {
        MDC.put(RecapGenerationService.MDC_CHAT_ID, String.valueOf(chatId));
        try {
            boolean enabled = readWithRetries("read recap switch of chat " + chatId,
                    () -> optionsService.isEnabled(chatId));
            if (!enabled) {
                metricsService.recordFiringSkipped();
                log.info("Auto recap disabled for chat {}, skipping", chatId);
                return;
            }
            Optional<RecapOptionsEntity> options = readWithRetries("read recap options of chat " + chatId,
                    () -> optionsService.findOptions(chatId));
            List<Long> subscribers = readWithRetries("read recap subscribers of chat " + chatId,
                    () -> optionsService.findSubscriberIds(chatId));

            RecapOptionsEntity chatOptions = options.orElse(null);
            if (chatOptions != null
                    && chatOptions.getSendMode() == AutoRecapSendMode.ONLY_PRIVATE_SUBSCRIPTIONS
                    && subscribers.isEmpty()) {
                metricsService.recordFiringSkipped();
                log.info("Chat {} only delivers to private subscribers and has none, skipping", chatId);
                return;
            }

            generationService.generateAndDeliver(chatId, chatOptions, subscribers);
        } catch (Retries.RetriesExhaustedException e) {
            metricsService.recordFiringSkipped();
            log.error("Aborting auto recap firing for chat {}: {}", chatId, e.getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while firing auto recap for chat {}", chatId);
        } finally {
            MDC.remove(RecapGenerationService.MDC_CHAT_ID);
        }
    }

    /**
     * Queues an on-demand recap for {@code chatId}, delivered to {@code replyChatId}.
     *
     * @return false when a run for the chat is already in flight
     */
    public boolean triggerOnDemand(long chatId, int hours, String requesterName, long replyChatId) {
        if (!RecapGenerationService.ON_DEMAND_HOURS.contains(hours)) {
            throw new IllegalArgumentException("Unsupported recap horizon: " + hours + " hours");
        }
        return submit(chatId, () -> generationService.generateForRequester(chatId, hours, requesterName, replyChatId));
    }

    @EventListener(ApplicationReadyEvent.class)
    public void scheduleOnStartup() {
        if (!properties.isEnabled()) {
            log.info("Auto recaps are disabled");
            return;
        }
        int armed = 0;
        for (Long chatId : optionsService.findEnabledChatIds()) {
            try {
                if (!capsuleQueue.isScheduled(chatId)) {
                    schedule(chatId);
                    armed++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to arm auto recap for chat {} on startup", chatId, e);
            }
        }
        log.info("Armed {} auto recap capsules on startup", armed);

        Long testChatId = properties.getTestChatId();
        if (testChatId != null) {
            log.info("Running startup recap for test chat {}", testChatId);
            RecapOptionsEntity options = optionsService.findOptions(testChatId).orElse(null);
            List<Long> subscribers = optionsService.findSubscriberIds(testChatId);
            submit(testChatId, () -> generationService.generateAndDeliver(testChatId, options, subscribers));
        }
    }

    @EventListener
    public void onScheduleChanged(RecapScheduleChangedEvent event) {
        if (event.enabled()) {
            schedule(event.chatId());
        } else {
            capsuleQueue.cancel(event.chatId());
        }
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public boolean isInFlight(long chatId) {
        return inFlight.contains(chatId);
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }

    private boolean submit(long chatId, Runnable run) {
        if (!inFlight.add(chatId)) {
            log.info("A recap run for chat {} is already in flight, not starting another", chatId);
            return false;
        }
        try {
            workers.submit(() -> {
                try {
                    run.run();
                } catch (RuntimeException e) {
                    log.error("Recap run for chat {} failed", chatId, e);
                } finally {
                    inFlight.remove(chatId);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.remove(chatId);
            log.error("Recap worker pool rejected run for chat {}", chatId, e);
            return false;
        }
    }

    private <T> T readWithRetries(String description, Supplier<T> read) throws InterruptedException {
        return Retries.call(
                description,
                properties.getStoreReadAttempts(),
                properties.getStoreReadRetryDelay(),
                sleeper,
                read);
    }

    private static final class RecapWorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger nextThreadId = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "recap-worker-" + nextThreadId.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
