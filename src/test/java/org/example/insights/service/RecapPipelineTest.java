package org.example.insights.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.insights.config.AutoRecapProperties;
import org.example.insights.config.DeliveryProperties;
import org.example.insights.config.SendRateLimiter;
import org.example.insights.config.TelegraphProperties;
import org.example.insights.entity.AutoRecapSendMode;
import org.example.insights.entity.ChatHistoryEntity;
import org.example.insights.entity.RecapOptionsEntity;
import org.example.insights.entity.SentMessageEntity;
import org.example.insights.model.ChatInfo;
import org.example.insights.repository.AutoRecapSubscriberRepository;
import org.example.insights.repository.ChatHistoryRepository;
import org.example.insights.repository.RecapCapsuleRepository;
import org.example.insights.repository.RecapLogRepository;
import org.example.insights.repository.RecapOptionsRepository;
import org.example.insights.repository.SentMessageRepository;
import org.example.insights.service.llm.LlmProvider;
import org.example.insights.telegram.ChatPlatform;
import org.example.insights.telegram.OutgoingMessage;
import org.example.insights.telegraph.TelegraphApi;
import org.example.insights.telegraph.TelegraphNodeFormatter;
import org.example.insights.telegraph.TelegraphPage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Runs a capsule firing through the real scheduler, summarizer, paginator, publisher, delivery and pin
 * bookkeeping against the JPA store. Only the chat platform, Telegraph and the language models are stubbed.
 */
@DataJpaTest
class RecapPipelineTest {

    private static final long CHAT_ID = -1001234567890L;
    private static final ChatInfo CHAT = new ChatInfo(CHAT_ID, "supergroup", "Engineering");
    private static final LocalDateTime NEXT_SLOT = LocalDateTime.of(2026, 10, 19, 18, 0);
    private static final String PAGE_URL = "https://telegra.ph/Engineering-recap-10-19";

    @Autowired
    private ChatHistoryRepository chatHistoryRepository;

    @Autowired
    private RecapLogRepository recapLogRepository;

    @Autowired
    private RecapOptionsRepository optionsRepository;

    @Autowired
    private AutoRecapSubscriberRepository subscriberRepository;

    @Autowired
    private SentMessageRepository sentMessageRepository;

    @Autowired
    private RecapCapsuleRepository capsuleRepository;

    private ChatPlatform chatPlatform;
    private TelegraphApi telegraphApi;
    private LlmProvider summarizationProvider;
    private LlmProvider condenseProvider;
    private RecapMetricsService metricsService;
    private RecapCapsuleQueue capsuleQueue;
    private AutoRecapScheduler scheduler;

    @BeforeEach
    void setUp() {
        chatPlatform = mock(ChatPlatform.class);
        telegraphApi = mock(TelegraphApi.class);
        summarizationProvider = mock(LlmProvider.class);
        condenseProvider = mock(LlmProvider.class);
        metricsService = new RecapMetricsService();
        List<Long> sleeps = new ArrayList<>();
        Sleeper sleeper = sleeps::add;

        TelegraphProperties telegraphProperties = new TelegraphProperties();
        telegraphProperties.setAccessToken("test-telegraph-token");
        telegraphProperties.setPageCreateInterval(Duration.ZERO);
        TelegraphNodeFormatter formatter = new TelegraphNodeFormatter();
        TelegraphPublishingService publishingService = new TelegraphPublishingService(telegraphApi, formatter,
                new ContentPaginator(formatter, telegraphProperties), telegraphProperties, sleeper);

        ChatHistorySummarizer summarizer = new ChatHistorySummarizer(summarizationProvider, condenseProvider,
                recapLogRepository, new ObjectMapper(), 6, 24000, 3, Duration.ofSeconds(5), sleeper);
        RecapOptionsService optionsService = new RecapOptionsService(optionsRepository, subscriberRepository, event -> { });
        SendRateLimiter unlimited = new SendRateLimiter() {
            @Override
            public void acquire() {
            }

            @Override
            public boolean tryAcquire() {
                return true;
            }
        };
        RecapDeliveryService deliveryService = new RecapDeliveryService(chatPlatform, unlimited, optionsService,
                new PinnedMessageService(sentMessageRepository, chatPlatform), metricsService,
                new DeliveryProperties(), sleeper);

        AutoRecapProperties properties = new AutoRecapProperties();
        RecapGenerationService generationService = new RecapGenerationService(chatPlatform,
                new ChatHistoryService(chatHistoryRepository, 7), summarizer, new RecapHtmlRenderer(),
                publishingService, deliveryService, metricsService, properties);

        Clock clock = Clock.fixed(Instant.parse("2026-10-19T14:00:00Z"), ZoneOffset.UTC);
        capsuleQueue = new RecapCapsuleQueue(capsuleRepository);
        scheduler = new AutoRecapScheduler(optionsService, capsuleQueue,
                new RecapScheduleCalculator(clock, ZoneId.of("UTC")), generationService, metricsService,
                properties, new DirectExecutor(), sleeper);

        when(chatPlatform.getChat(CHAT_ID)).thenReturn(CHAT);
    }

    @Test
    void onFire_sixRecentMessages_publishesDeliversAndMovesPin() {
        saveOptions(AutoRecapSendMode.PUBLICLY, true);
        saveMessages(6);
        sentMessageRepository.save(new SentMessageEntity(CHAT_ID, 400, "previous recap", true));
        when(summarizationProvider.generate(anyString(), anyString(), any())).thenReturn("""
                {"topics": [{
                  "topicName": "Release plan",
                  "sinceId": 100,
                  "participantsNamesWithoutUsername": ["Ann", "Bob"],
                  "discussion": [{"point": "Ship on Friday", "keyIds": [101]}],
                  "conclusion": "Release on Friday"
                }]}
                """);
        when(summarizationProvider.getModelName()).thenReturn("gpt-4o-mini");
        when(condenseProvider.generate(anyString(), anyString(), any())).thenReturn("🚀 Friday release agreed");
        when(telegraphApi.createPage(eq("test-telegraph-token"), anyString(), anyString(), any(JsonNode.class)))
                .thenReturn(new TelegraphPage("Engineering-recap-10-19", PAGE_URL, "Engineering recap"));
        when(chatPlatform.sendMessage(any(OutgoingMessage.class))).thenReturn(501);

        scheduler.onFire(CHAT_ID);

        verify(telegraphApi, times(1)).createPage(anyString(), anyString(), anyString(), any(JsonNode.class));
        verify(telegraphApi, never()).editPage(anyString(), anyString(), anyString(), anyString(), any(JsonNode.class));

        ArgumentCaptor<OutgoingMessage> sent = ArgumentCaptor.forClass(OutgoingMessage.class);
        verify(chatPlatform, times(1)).sendMessage(sent.capture());
        OutgoingMessage groupMessage = sent.getValue();
        assertEquals(CHAT_ID, groupMessage.chatId());
        assertTrue(groupMessage.htmlText().contains("<a href=\"" + PAGE_URL + "\">"));
        assertTrue(groupMessage.htmlText().contains("🚀 Friday release agreed"));

        verify(chatPlatform).unpinMessage(CHAT_ID, 400);
        verify(chatPlatform).pinMessage(CHAT_ID, 501);
        List<SentMessageEntity> pinned = sentMessageRepository.findByChatIdAndPinnedTrueOrderBySentAtDesc(CHAT_ID);
        assertEquals(1, pinned.size());
        assertEquals(501, pinned.get(0).getMessageId());

        assertEquals(1, recapLogRepository.count());
        assertEquals(Optional.of(NEXT_SLOT), capsuleQueue.nextDueAt(CHAT_ID));
        assertEquals(0, scheduler.inFlightCount());
    }

    @Test
    void onFire_threeMessages_skipsWithoutPublishingAndRearms() {
        saveOptions(AutoRecapSendMode.PUBLICLY, true);
        saveMessages(3);

        scheduler.onFire(CHAT_ID);

        verifyNoInteractions(telegraphApi, summarizationProvider, condenseProvider);
        verify(chatPlatform, never()).sendMessage(any(OutgoingMessage.class));
        assertEquals(0, recapLogRepository.count());
        assertEquals(1L, metricsService.snapshot().get("runsSkipped"));
        assertEquals(Optional.of(NEXT_SLOT), capsuleQueue.nextDueAt(CHAT_ID));
    }

    private void saveOptions(AutoRecapSendMode mode, boolean pinEnabled) {
        RecapOptionsEntity options = new RecapOptionsEntity(CHAT_ID);
        options.setEnabled(true);
        options.setSendMode(mode);
        options.setPinEnabled(pinEnabled);
        options.setRatesPerDay(4);
        optionsRepository.save(options);
    }

    private void saveMessages(int count) {
        LocalDateTime now = LocalDateTime.now();
        for (int i = 0; i < count; i++) {
            chatHistoryRepository.save(new ChatHistoryEntity(CHAT_ID, 100 + i, 7L + i, "User " + i,
                    "message " + i, now.minusMinutes(30L - i)));
        }
    }

    /**
     * Runs submitted work on the calling thread.
     */
    private static final class DirectExecutor extends AbstractExecutorService {
        private boolean shutdown;

        @Override
        public void execute(Runnable command) {
            command.run();
        }

        @Override
        public void shutdown() {
            shutdown = true;
        }

        @Override
        public List<Runnable> shutdownNow() {
            shutdown = true;
            return List.of();
        }

        @Override
        public boolean isShutdown() {
            return shutdown;
        }

        @Override
        public boolean isTerminated() {
            return shutdown;
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) {
            return true;
        }
    }
}
