package org.example.insights.service;

import org.example.insights.config.AutoRecapProperties;
import org.example.insights.entity.ChatHistoryEntity;
import org.example.insights.entity.RecapOptionsEntity;
import org.example.insights.model.ChatInfo;
import org.example.insights.model.DeliveryReport;
import org.example.insights.model.PageSeries;
import org.example.insights.model.RecapBatch;
import org.example.insights.model.RecapDeliveryRequest;
import org.example.insights.model.SummarizationResult;
import org.example.insights.model.TopicSummaries;
import org.example.insights.telegram.ChatPlatform;
import org.example.insights.telegram.MessageBatchSplitter;
import org.example.insights.telegram.TelegramHtml;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One recap run: load the window, summarize, publish pages, deliver links.
 */
@Service
public class RecapGenerationService {

    private static final Logger log = LoggerFactory.getLogger(RecapGenerationService.class);

    public static final Set<Integer> ON_DEMAND_HOURS = Set.of(1, 2, 4, 6, 12, 24);
    static final String MDC_CHAT_ID = "chatId";

    private final ChatPlatform chatPlatform;
    private final ChatHistoryService historyService;
    private final ChatHistorySummarizer summarizer;
    private final RecapHtmlRenderer htmlRenderer;
    private final TelegraphPublishingService publishingService;
    private final RecapDeliveryService deliveryService;
    private final RecapMetricsService metricsService;
    private final ZoneId zoneId;

    public RecapGenerationService(
            ChatPlatform chatPlatform,
            ChatHistoryService historyService,
            ChatHistorySummarizer summarizer,
            RecapHtmlRenderer htmlRenderer,
            TelegraphPublishingService publishingService,
            RecapDeliveryService deliveryService,
            RecapMetricsService metricsService,
            AutoRecapProperties properties) {
        this.chatPlatform = chatPlatform;
        this.historyService = historyService;
        this.summarizer = summarizer;
        this.htmlRenderer = htmlRenderer;
        this.publishingService = publishingService;
        this.deliveryService = deliveryService;
        this.metricsService = metricsService;
        this.zoneId = ZoneId.of(properties.getZoneId());
    }

    /**
     * Scheduled recap for the chat's configured horizon, delivered to the group and/or subscribers.
     *
     * @return the delivery report, empty when the run was skipped or failed
     */
    public Optional<DeliveryReport> generateAndDeliver(long chatId, RecapOptionsEntity options, List<Long> subscriberIds) {
        int ratesPerDay = options == null ? RecapOptionsEntity.DEFAULT_RATES_PER_DAY : options.effectiveRatesPerDay();
        int hours = ChatHistoryService.horizonHours(ratesPerDay);
        return run(chatId, hours, "auto", (chat, result, batches) -> RecapDeliveryRequest.scheduled(
                chat, hours, options, subscriberIds, result.logId(), summarizer.getModelName(), batches));
    }

    /**
     * On-demand recap of the last {@code hours} hours, delivered only to {@code replyChatId} and never pinned.
     */
    public Optional<DeliveryReport> generateForRequester(long chatId, int hours, String requesterName, long replyChatId) {
        if (!ON_DEMAND_HOURS.contains(hours)) {
            throw new IllegalArgumentException("Unsupported recap horizon: " + hours + " hours");
        }
        return run(chatId, hours, "on-demand", (chat, result, batches) -> RecapDeliveryRequest.onDemand(
                chat, hours, result.logId(), summarizer.getModelName(), batches, replyChatId, requesterName));
    }

    private Optional<DeliveryReport> run(long chatId, int hours, String kind, RequestFactory requestFactory) {
        MDC.put(MDC_CHAT_ID, String.valueOf(chatId));
        long startedAt = System.currentTimeMillis();
        try {
            ChatInfo chat = chatPlatform.getChat(chatId);
            List<ChatHistoryEntity> window = historyService.findWindow(chatId, hours);
            TopicSummaries topics = summarizer.summarize(chat, window);
            String condensed = summarizer.condense(chatId, window, topics.summaries(), hours);
            SummarizationResult result = new SummarizationResult(topics.logId(), topics.summaries(), condensed);

            List<RecapBatch> batches = publishBatches(chat, hours, result);
            if (batches.isEmpty()) {
                log.warn("No recap pages could be published for chat {}, nothing to deliver", chatId);
                metricsService.recordRunFailed(System.currentTimeMillis() - startedAt);
                return Optional.empty();
            }

            DeliveryReport report = deliveryService.deliver(requestFactory.create(chat, result, batches));
            metricsService.recordRunCompleted(System.currentTimeMillis() - startedAt);
            log.info("Completed {} recap for chat {} over {} hours in {} ms",
                    kind, chatId, hours, System.currentTimeMillis() - startedAt);
            return Optional.of(report);
        } catch (RecapSkippedException e) {
            metricsService.recordRunSkipped();
            log.info("Skipped {} recap for chat {}: {}", kind, chatId, e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metricsService.recordRunFailed(System.currentTimeMillis() - startedAt);
            log.warn("Interrupted during {} recap for chat {}", kind, chatId);
            return Optional.empty();
        } catch (RuntimeException e) {
            metricsService.recordRunFailed(System.currentTimeMillis() - startedAt);
            log.error("Failed {} recap for chat {}", kind, chatId, e);
            return Optional.empty();
        } finally {
            MDC.remove(MDC_CHAT_ID);
        }
    }

    /**
     * Splits the summaries into message-sized batches and publishes one page series per batch.
     * A batch whose publication fails is dropped.
     */
    List<RecapBatch> publishBatches(ChatInfo chat, int hours, SummarizationResult result) {
        List<String> summaries = result.topicSummaries();
        List<String> telegramTexts = summaries.stream().map(TelegramHtml::markdownTitlesToBold).toList();
        List<List<String>> textBatches = MessageBatchSplitter.split(telegramTexts, MessageBatchSplitter.TELEGRAM_MESSAGE_LIMIT);

        ZonedDateTime to = ZonedDateTime.now(zoneId);
        ZonedDateTime from = to.minusHours(hours);
        String baseTitle = pageTitle(chat, hours);

        List<RecapBatch> batches = new ArrayList<>();
        int offset = 0;
        for (int i = 0; i < textBatches.size(); i++) {
            int size = textBatches.get(i).size();
            List<String> batchSummaries = summaries.subList(offset, offset + size);
            offset += size;

            String title = textBatches.size() > 1 ? baseTitle + " (" + (i + 1) + "/" + textBatches.size() + ")" : baseTitle;
            String html = htmlRenderer.render(batchSummaries, from, to, summarizer.getModelName());
            try {
                PageSeries pages = publishingService.publish(title, html);
                metricsService.recordPagesPublished(pages.size());
                batches.add(new RecapBatch(title, pages, result.condensedSummary()));
            } catch (TelegraphPublishingException e) {
                metricsService.recordPublishFailure();
                log.warn("Failed to publish recap batch {}/{} of chat {}: {}",
                        i + 1, textBatches.size(), chat.id(), e.getMessage());
            }
        }
        return batches;
    }

    static String pageTitle(ChatInfo chat, int hours) {
        String chatTitle = chat.title() == null || chat.title().isBlank() ? "Chat" : chat.title();
        return chatTitle + " recap, past " + hours + " hours";
    }

    @FunctionalInterface
    private interface RequestFactory {
        RecapDeliveryRequest create(ChatInfo chat, SummarizationResult result, List<RecapBatch> batches);
    }
}
