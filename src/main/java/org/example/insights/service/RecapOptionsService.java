package org.example.insights.service;

import org.example.insights.entity.AutoRecapSubscriberEntity;
import org.example.insights.entity.RecapOptionsEntity;
import org.example.insights.model.RecapConfigAction;
import org.example.insights.repository.AutoRecapSubscriberRepository;
import org.example.insights.repository.RecapOptionsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Per-chat recap options and private-delivery subscriptions.
 */
@Service
public class RecapOptionsService {

    private static final Logger log = LoggerFactory.getLogger(RecapOptionsService.class);

    static final Set<Integer> SUPPORTED_RATES = Set.of(2, 3, 4);

    private final RecapOptionsRepository optionsRepository;
    private final AutoRecapSubscriberRepository subscriberRepository;
    private final ApplicationEventPublisher eventPublisher;

    public RecapOptionsService(
            RecapOptionsRepository optionsRepository,
            AutoRecapSubscriberRepository subscriberRepository,
            ApplicationEventPublisher eventPublisher) {
        this.optionsRepository = optionsRepository;
        this.subscriberRepository = subscriberRepository;
        this.eventPublisher = eventPublisher;
    }

    @Transactional(readOnly = true)
    public Optional<RecapOptionsEntity> findOptions(long chatId) {
        return optionsRepository.findById(chatId);
    }

    @Transactional(readOnly = true)
    public boolean isEnabled(long chatId) {
        return optionsRepository.findById(chatId).map(RecapOptionsEntity::isEnabled).orElse(false);
    }

    @Transactional(readOnly = true)
    public List<Long> findEnabledChatIds() {
        return optionsRepository.findByEnabledTrue().stream()
                .map(RecapOptionsEntity::getChatId)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countEnabledChats() {
        return optionsRepository.countByEnabledTrue();
    }

    @Transactional(readOnly = true)
    public List<Long> findSubscriberIds(long chatId) {
        return subscriberRepository.findByChatIdOrderByCreatedAtAsc(chatId).stream()
                .map(AutoRecapSubscriberEntity::getUserId)
                .toList();
    }

    @Transactional
    public RecapOptionsEntity getOrCreate(long chatId, String chatTitle) {
        RecapOptionsEntity options = optionsRepository.findById(chatId)
                .orElseGet(() -> new RecapOptionsEntity(chatId));
        if (chatTitle != null && !chatTitle.isBlank()) {
            options.setChatTitle(chatTitle);
        }
        return optionsRepository.save(options);
    }

    /**
     * @return true when a new subscription was stored
     */
    @Transactional
    public boolean subscribe(long chatId, long userId) {
        if (subscriberRepository.existsByChatIdAndUserId(chatId, userId)) {
            return false;
        }
        try {
            subscriberRepository.save(new AutoRecapSubscriberEntity(chatId, userId));
        } catch (DataIntegrityViolationException e) {
            return false;
        }
        log.info("User {} subscribed to recaps of chat {}", userId, chatId);
        return true;
    }

    /**
     * @return true when a subscription existed and was removed
     */
    @Transactional
    public boolean unsubscribe(long chatId, long userId) {
        boolean removed = subscriberRepository.deleteByChatIdAndUserId(chatId, userId) > 0;
        if (removed) {
            log.info("User {} unsubscribed from recaps of chat {}", userId, chatId);
        }
        return removed;
    }

    /**
     * Applies a configuration action and returns the resulting options.
     * Changes to the switch or the rate re-arm the chat's schedule.
     */
    @Transactional
    public RecapOptionsEntity apply(RecapConfigAction action) {
        RecapOptionsEntity options = optionsRepository.findById(action.chatId())
                .orElseGet(() -> new RecapOptionsEntity(action.chatId()));
        boolean scheduleChanged = false;

        if (action instanceof RecapConfigAction.Toggle toggle) {
            scheduleChanged = options.isEnabled() != toggle.enabled();
            options.setEnabled(toggle.enabled());
        } else if (action instanceof RecapConfigAction.AssignMode assignMode) {
            if (assignMode.mode() == null) {
                throw new IllegalArgumentException("Send mode is required");
            }
            options.setSendMode(assignMode.mode());
        } else if (action instanceof RecapConfigAction.SelectRates selectRates) {
            if (!SUPPORTED_RATES.contains(selectRates.ratesPerDay())) {
                throw new IllegalArgumentException("Unsupported recaps per day: " + selectRates.ratesPerDay());
            }
            scheduleChanged = options.effectiveRatesPerDay() != selectRates.ratesPerDay();
            options.setRatesPerDay(selectRates.ratesPerDay());
        } else if (action instanceof RecapConfigAction.TogglePin togglePin) {
            options.setPinEnabled(togglePin.pinEnabled());
        } else if (action instanceof RecapConfigAction.Unsubscribe unsubscribe) {
            unsubscribe(unsubscribe.chatId(), unsubscribe.fromId());
            return options;
        }
        // Complete only persists the options as they are.

        RecapOptionsEntity saved = optionsRepository.save(options);
        log.info("Applied {} to chat {}", action.getClass().getSimpleName(), action.chatId());
        if (scheduleChanged) {
            eventPublisher.publishEvent(new RecapScheduleChangedEvent(saved.getChatId(), saved.isEnabled()));
        }
        return saved;
    }
}
