package org.example.insights.service;

import org.example.insights.config.DeliveryProperties;
import org.example.insights.config.SendRateLimiter;
import org.example.insights.entity.AutoRecapSendMode;
import org.example.insights.entity.RecapOptionsEntity;
import org.example.insights.model.ChatInfo;
import org.example.insights.model.ChatMemberStatus;
import org.example.insights.model.DeliveryReport;
import org.example.insights.model.DeliveryTarget;
import org.example.insights.model.PageSeries;
import org.example.insights.model.RecapBatch;
import org.example.insights.model.RecapConfigAction;
import org.example.insights.model.RecapDeliveryRequest;
import org.example.insights.telegram.ChatPlatform;
import org.example.insights.telegram.ChatPlatformException;
import org.example.insights.telegram.OutgoingMessage;
import org.example.insights.telegram.RecapCallbackCodec;
import org.example.insights.telegram.TelegramHtml;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Sends recap links to the group and to private subscribers who are still members of the chat.
 * A failed send for one target never stops delivery to the others.
 */
@Service
public class RecapDeliveryService {

    private static final Logger log = LoggerFactory.getLogger(RecapDeliveryService.class);

    static final String UNSUBSCRIBE_BUTTON_TEXT = "Unsubscribe";

    private final ChatPlatform chatPlatform;
    private final SendRateLimiter sendRateLimiter;
    private final RecapOptionsService optionsService;
    private final PinnedMessageService pinnedMessageService;
    private final RecapMetricsService metricsService;
    private final DeliveryProperties properties;
    private final Sleeper sleeper;

    @Autowired
    public RecapDeliveryService(
            ChatPlatform chatPlatform,
            SendRateLimiter sendRateLimiter,
            RecapOptionsService optionsService,
            PinnedMessageService pinnedMessageService,
            RecapMetricsService metricsService,
            DeliveryProperties properties) {
        this(chatPlatform, sendRateLimiter, optionsService, pinnedMessageService, metricsService, properties,
                Sleeper.THREAD_SLEEP);
    }

    RecapDeliveryService(
            ChatPlatform chatPlatform,
            SendRateLimiter sendRateLimiter,
            RecapOptionsService optionsService,
            PinnedMessageService pinnedMessageService,
            RecapMetricsService metricsService,
            DeliveryProperties properties,
            Sleeper sleeper) {
        this.chatPlatform = chatPlatform;
        this.sendRateLimiter = sendRateLimiter;
        this.optionsService = optionsService;
        this.pinnedMessageService = pinnedMessageService;
        this.metricsService = metricsService;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    public DeliveryReport deliver(RecapDeliveryRequest request) throws InterruptedException {
        RevalidatedTargets resolved = resolveTargets(request);
        List<DeliveryTarget> targets = resolved.targets();
        List<RecapBatch> batches = request.batches();
        boolean pinEnabled = !request.isOnDemand()
                && request.options() != null
                && request.options().isPinEnabled();

        int sent = 0;
        int failed = 0;
        for (int i = 0; i < batches.size(); i++) {
            RecapBatch batch = batches.get(i);
            for (DeliveryTarget target : targets) {
                String text = composeMessage(request, batch, i, batches.size(), target);
                OutgoingMessage message = target.isGroup()
                        ? OutgoingMessage.html(target.chatId(), text)
                        : new OutgoingMessage(target.chatId(), text, List.of(unsubscribeButton(request.chat().id(), target.chatId())));
                int messageId;
                try {
                    sendRateLimiter.acquire();
                    messageId = chatPlatform.sendMessage(message);
                } catch (ChatPlatformException e) {
                    failed++;
                    metricsService.recordSendFailure();
                    log.warn("Failed to send recap batch {}/{} of chat {} to {} {}: {}",
                            i + 1, batches.size(), request.chat().id(), target.kind(), target.chatId(), e.getMessage());
                    continue;
                }
                sent++;
                metricsService.recordMessageSent();

                try {
                    if (target.isGroup() && i == 0 && pinEnabled) {
                        pinnedMessageService.recordAndPin(target.chatId(), messageId, text);
                    } else {
                        pinnedMessageService.recordSent(target.chatId(), messageId, text);
                    }
                } catch (RuntimeException e) {
                    log.error("Failed to record sent recap message {} in chat {}", messageId, target.chatId(), e);
                }
            }
        }

        log.info("Delivered {} recap batches of chat {} to {} targets: sent={}, failed={}, revoked={}",
                batches.size(), request.chat().id(), targets.size(), sent, failed, resolved.revoked());
        return new DeliveryReport(targets.size(), sent, failed, resolved.revoked());
    }

    /**
     * Builds the target list. Subscribers whose membership lookup fails are dropped for this run only;
     * subscribers who are no longer members are unsubscribed and notified.
     */
    RevalidatedTargets resolveTargets(RecapDeliveryRequest request) throws InterruptedException {
        List<DeliveryTarget> targets = new ArrayList<>();
        if (request.isOnDemand()) {
            targets.add(DeliveryTarget.group(request.replyChatId()));
            return new RevalidatedTargets(targets, 0);
        }

        RecapOptionsEntity options = request.options();
        if (options == null || options.getSendMode() == AutoRecapSendMode.PUBLICLY) {
            targets.add(DeliveryTarget.group(request.chat().id()));
        }

        int revoked = 0;
        for (Long userId : request.subscriberIds()) {
            ChatMemberStatus status;
            try {
                status = chatPlatform.getChatMember(request.chat().id(), userId);
            } catch (ChatPlatformException e) {
                log.warn("Failed to check membership of subscriber {} in chat {}, skipping this run: {}",
                        userId, request.chat().id(), e.getMessage());
                continue;
            }
            if (status.isRecapEligible()) {
                targets.add(DeliveryTarget.privateSubscriber(userId));
                continue;
            }
            revokeSubscription(request.chat(), userId, status);
            revoked++;
        }
        return new RevalidatedTargets(targets, revoked);
    }

    private void revokeSubscription(ChatInfo chat, long userId, ChatMemberStatus status) throws InterruptedException {
        log.info("Subscriber {} of chat {} has status {}, removing subscription", userId, chat.id(), status);
        metricsService.recordSubscriberRevoked();
        try {
            Retries.call(
                    "unsubscribe user " + userId + " from chat " + chat.id(),
                    properties.getUnsubscribeMaxAttempts(),
                    properties.getUnsubscribeRetryDelay(),
                    sleeper,
                    () -> optionsService.unsubscribe(chat.id(), userId));
        } catch (Retries.RetriesExhaustedException e) {
            log.error("Giving up unsubscribing user {} from chat {}", userId, chat.id(), e.getCause());
        }

        String notice = "You have been unsubscribed from the recaps of <b>" + TelegramHtml.escape(chatTitle(chat))
                + "</b> because you are no longer a member of that chat.";
        try {
            sendRateLimiter.acquire();
            chatPlatform.sendMessage(OutgoingMessage.html(userId, notice));
        } catch (ChatPlatformException e) {
            log.warn("Failed to notify user {} about removed subscription: {}", userId, e.getMessage());
        }
    }

    String composeMessage(RecapDeliveryRequest request, RecapBatch batch, int index, int total, DeliveryTarget target) {
        StringBuilder text = new StringBuilder();
        if (!target.isGroup()) {
            text.append("This is the recap you subscribed to for <b>")
                    .append(TelegramHtml.escape(chatTitle(request.chat())))
                    .append("</b>\n\n");
        }
        if (request.isOnDemand() && request.requesterName() != null && !request.requesterName().isBlank()) {
            text.append("Recap requested by <b>").append(TelegramHtml.escape(request.requesterName())).append("</b>\n\n");
        }

        PageSeries pages = batch.pageSeries();
        text.append("<b>").append(TelegramHtml.link(pages.canonicalUrl(), batch.pageTitle())).append("</b>");
        if (total > 1) {
            text.append(" (").append(index + 1).append('/').append(total).append(')');
        }
        if (pages.isMultiPage()) {
            List<String> partLinks = new ArrayList<>();
            for (int part = 0; part < pages.size(); part++) {
                partLinks.add(TelegramHtml.link(pages.urls().get(part), "Part " + (part + 1)));
            }
            text.append("\nPages: ").append(String.join(" | ", partLinks));
        }

        if (batch.condensedSummary() != null && !batch.condensedSummary().isBlank()) {
            text.append("\n\n").append(TelegramHtml.escape(batch.condensedSummary()));
        }
        if (target.isGroup() && request.chat().isPlainGroup()) {
            text.append("\n\n<i>Tip: links to messages are disabled in recaps because this chat is a basic group. "
                    + "Upgrade it to a supergroup to enable them.</i>");
        }
        text.append(request.isOnDemand() ? "\n\n#recap" : "\n\n#recap #recap_auto");
        return text.toString();
    }

    private static OutgoingMessage.InlineButton unsubscribeButton(long chatId, long userId) {
        return new OutgoingMessage.InlineButton(
                UNSUBSCRIBE_BUTTON_TEXT,
                RecapCallbackCodec.encode(new RecapConfigAction.Unsubscribe(chatId, userId)));
    }

    private static String chatTitle(ChatInfo chat) {
        return chat.title() == null || chat.title().isBlank() ? String.valueOf(chat.id()) : chat.title();
    }

    record RevalidatedTargets(List<DeliveryTarget> targets, int revoked) {
    }
}
