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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RecapDeliveryServiceTest {

    private static final long CHAT_ID = -1001234567890L;
    private static final ChatInfo SUPERGROUP = new ChatInfo(CHAT_ID, "supergroup", "Engineering");

    @Mock
    private ChatPlatform chatPlatform;

    @Mock
    private SendRateLimiter sendRateLimiter;

    @Mock
    private RecapOptionsService optionsService;

    @Mock
    private PinnedMessageService pinnedMessageService;

    @Mock
    private RecapMetricsService metricsService;

    private final List<Long> sleeps = new ArrayList<>();
    private final AtomicInteger nextMessageId = new AtomicInteger(100);
    private RecapDeliveryService service;

    @BeforeEach
    void setUp() {
        DeliveryProperties properties = new DeliveryProperties();
        properties.setUnsubscribeMaxAttempts(5);
        properties.setUnsubscribeRetryDelay(Duration.ofSeconds(10));
        service = new RecapDeliveryService(chatPlatform, sendRateLimiter, optionsService, pinnedMessageService,
                metricsService, properties, sleeps::add);
    }

    @Test
    void deliver_publicModeWithSubscribers_sendsEveryBatchToGroupAndMembers() throws InterruptedException {
        RecapOptionsEntity options = options(AutoRecapSendMode.PUBLICLY, true);
        when(chatPlatform.getChatMember(CHAT_ID, 7L)).thenReturn(ChatMemberStatus.MEMBER);
        stubSends();

        DeliveryReport report = service.deliver(RecapDeliveryRequest.scheduled(
                SUPERGROUP, 6, options, List.of(7L), "log-1", "gpt-4o-mini", twoBatches()));

        assertEquals(2, report.targets());
        assertEquals(4, report.messagesSent());
        assertEquals(0, report.sendFailures());
        verify(sendRateLimiter, times(4)).acquire();
        verify(pinnedMessageService).recordAndPin(eq(CHAT_ID), eq(100), anyString());
        verify(pinnedMessageService, times(3)).recordSent(anyLong(), anyInt(), anyString());

        ArgumentCaptor<OutgoingMessage> sent = ArgumentCaptor.forClass(OutgoingMessage.class);
        verify(chatPlatform, times(4)).sendMessage(sent.capture());
        OutgoingMessage groupMessage = sent.getAllValues().get(0);
        assertEquals(CHAT_ID, groupMessage.chatId());
        assertTrue(groupMessage.htmlText().contains("<a href=\"https://telegra.ph/Recap-1\">Engineering recap (1/2)</a>"));
        assertTrue(groupMessage.htmlText().contains(" (1/2)"));
        assertTrue(groupMessage.htmlText().endsWith("#recap #recap_auto"));
        assertTrue(groupMessage.buttons().isEmpty());

        OutgoingMessage privateMessage = sent.getAllValues().get(1);
        assertEquals(7L, privateMessage.chatId());
        assertTrue(privateMessage.htmlText().startsWith("This is the recap you subscribed to for <b>Engineering</b>"));
        assertEquals(RecapCallbackCodec.encode(new RecapConfigAction.Unsubscribe(CHAT_ID, 7L)),
                privateMessage.buttons().get(0).callbackData());
    }

    @Test
    void deliver_privateOnlyMode_skipsGroupAndDoesNotPin() throws InterruptedException {
        RecapOptionsEntity options = options(AutoRecapSendMode.ONLY_PRIVATE_SUBSCRIPTIONS, true);
        when(chatPlatform.getChatMember(CHAT_ID, 7L)).thenReturn(ChatMemberStatus.ADMINISTRATOR);
        stubSends();

        DeliveryReport report = service.deliver(RecapDeliveryRequest.scheduled(
                SUPERGROUP, 6, options, List.of(7L), "log-1", "gpt-4o-mini", oneBatch()));

        assertEquals(1, report.targets());
        verify(pinnedMessageService, never()).recordAndPin(anyLong(), anyInt(), anyString());
        verify(pinnedMessageService).recordSent(eq(7L), eq(100), anyString());
    }

    @Test
    void deliver_subscriberWhoLeft_isUnsubscribedAndNotified() throws InterruptedException {
        RecapOptionsEntity options = options(AutoRecapSendMode.ONLY_PRIVATE_SUBSCRIPTIONS, false);
        when(chatPlatform.getChatMember(CHAT_ID, 7L)).thenReturn(ChatMemberStatus.LEFT);
        when(optionsService.unsubscribe(CHAT_ID, 7L))
                .thenThrow(new IllegalStateException("db busy"))
                .thenReturn(true);
        stubSends();

        DeliveryReport report = service.deliver(RecapDeliveryRequest.scheduled(
                SUPERGROUP, 6, options, List.of(7L), "log-1", "gpt-4o-mini", oneBatch()));

        assertEquals(0, report.targets());
        assertEquals(1, report.subscribersRevoked());
        assertEquals(List.of(10_000L), sleeps);
        verify(metricsService).recordSubscriberRevoked();

        ArgumentCaptor<OutgoingMessage> sent = ArgumentCaptor.forClass(OutgoingMessage.class);
        verify(chatPlatform).sendMessage(sent.capture());
        assertEquals(7L, sent.getValue().chatId());
        assertTrue(sent.getValue().htmlText().contains("no longer a member"));
    }

    @Test
    void deliver_membershipLookupFailure_skipsSubscriberForThisRunOnly() throws InterruptedException {
        RecapOptionsEntity options = options(AutoRecapSendMode.PUBLICLY, false);
        when(chatPlatform.getChatMember(CHAT_ID, 7L)).thenThrow(new ChatPlatformException("timeout"));
        stubSends();

        DeliveryReport report = service.deliver(RecapDeliveryRequest.scheduled(
                SUPERGROUP, 6, options, List.of(7L), "log-1", "gpt-4o-mini", oneBatch()));

        assertEquals(1, report.targets());
        assertEquals(0, report.subscribersRevoked());
        verifyNoInteractions(optionsService);
    }

    @Test
    void deliver_sendFailure_continuesWithOtherTargets() throws InterruptedException {
        RecapOptionsEntity options = options(AutoRecapSendMode.PUBLICLY, false);
        when(chatPlatform.getChatMember(CHAT_ID, 7L)).thenReturn(ChatMemberStatus.MEMBER);
        when(chatPlatform.sendMessage(any(OutgoingMessage.class)))
                .thenThrow(new ChatPlatformException("bot was kicked"))
                .thenReturn(200);

        DeliveryReport report = service.deliver(RecapDeliveryRequest.scheduled(
                SUPERGROUP, 6, options, List.of(7L), "log-1", "gpt-4o-mini", oneBatch()));

        assertEquals(1, report.messagesSent());
        assertEquals(1, report.sendFailures());
        verify(metricsService).recordSendFailure();
        verify(pinnedMessageService).recordSent(eq(7L), eq(200), anyString());
    }

    @Test
    void deliver_onDemand_repliesOnlyToRequestingChat() throws InterruptedException {
        stubSends();

        DeliveryReport report = service.deliver(RecapDeliveryRequest.onDemand(
                SUPERGROUP, 2, "log-1", "gpt-4o-mini", oneBatch(), 7L, "Ann"));

        assertEquals(1, report.targets());
        ArgumentCaptor<OutgoingMessage> sent = ArgumentCaptor.forClass(OutgoingMessage.class);
        verify(chatPlatform).sendMessage(sent.capture());
        assertEquals(7L, sent.getValue().chatId());
        assertTrue(sent.getValue().htmlText().startsWith("Recap requested by <b>Ann</b>"));
        assertTrue(sent.getValue().htmlText().endsWith("#recap"));
        assertFalse(sent.getValue().htmlText().contains("#recap_auto"));
        verify(pinnedMessageService, never()).recordAndPin(anyLong(), anyInt(), anyString());
        verify(chatPlatform, never()).getChatMember(anyLong(), anyLong());
    }

    @Test
    void composeMessage_multiPagePlainGroup_listsPartsAndTip() {
        ChatInfo group = new ChatInfo(-42L, "group", "Friends");
        RecapBatch batch = new RecapBatch("Friends recap",
                new PageSeries(List.of("https://telegra.ph/A", "https://telegra.ph/B")), "🍕 Pizza night");
        RecapDeliveryRequest request = RecapDeliveryRequest.scheduled(
                group, 6, options(AutoRecapSendMode.PUBLICLY, false), List.of(), "log-1", "m", List.of(batch));

        String text = service.composeMessage(request, batch, 0, 1,
                DeliveryTarget.group(-42L));

        assertTrue(text.contains("Pages: <a href=\"https://telegra.ph/A\">Part 1</a> | <a href=\"https://telegra.ph/B\">Part 2</a>"));
        assertTrue(text.contains("🍕 Pizza night"));
        assertTrue(text.contains("basic group"));
        assertFalse(text.contains("(1/1)"));
    }

    @Test
    void composeMessage_fallbackHighlightWithEntities_isEscapedOnce() {
        String highlight = ChatHistorySummarizer.fallbackHighlight(
                "## Q&amp;A session\n<b>Discussion:</b>\n• Tom &amp; Jerry &lt;3");
        RecapBatch batch = new RecapBatch("Engineering recap", PageSeries.single("https://telegra.ph/Recap-1"), highlight);
        RecapDeliveryRequest request = RecapDeliveryRequest.scheduled(
                SUPERGROUP, 6, options(AutoRecapSendMode.PUBLICLY, false), List.of(), "log-1", "m", List.of(batch));

        String text = service.composeMessage(request, batch, 0, 1, DeliveryTarget.group(CHAT_ID));

        assertTrue(text.contains("\n\nQ&amp;A session: Tom &amp; Jerry &lt;3\n\n"));
        assertFalse(text.contains("&amp;amp;"));
        assertFalse(text.contains("&amp;lt;"));
    }

    private void stubSends() {
        when(chatPlatform.sendMessage(any(OutgoingMessage.class))).thenAnswer(invocation -> nextMessageId.getAndIncrement());
    }

    private static RecapOptionsEntity options(AutoRecapSendMode mode, boolean pinEnabled) {
        RecapOptionsEntity options = new RecapOptionsEntity(CHAT_ID);
        options.setEnabled(true);
        options.setSendMode(mode);
        options.setPinEnabled(pinEnabled);
        return options;
    }

    private static List<RecapBatch> oneBatch() {
        return List.of(new RecapBatch("Engineering recap", PageSeries.single("https://telegra.ph/Recap-1"),
                "🚀 Friday release agreed"));
    }

    private static List<RecapBatch> twoBatches() {
        return List.of(
                new RecapBatch("Engineering recap (1/2)", PageSeries.single("https://telegra.ph/Recap-1"), "🚀 Release"),
                new RecapBatch("Engineering recap (2/2)", PageSeries.single("https://telegra.ph/Recap-2"), "🚀 Release"));
    }
}
