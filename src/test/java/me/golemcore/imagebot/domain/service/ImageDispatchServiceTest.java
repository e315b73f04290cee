package me.golemcore.imagebot.domain.service;

import me.golemcore.imagebot.domain.model.DispatchOutcome;
import me.golemcore.imagebot.domain.model.Message;
import me.golemcore.imagebot.domain.model.RateLimitResult;
import me.golemcore.imagebot.domain.model.UsageRecord;
import me.golemcore.imagebot.infrastructure.config.BotProperties;
import me.golemcore.imagebot.infrastructure.i18n.MessageService;
import me.golemcore.imagebot.port.inbound.ChannelPort;
import me.golemcore.imagebot.port.outbound.ImageGenerationPort;
import me.golemcore.imagebot.port.outbound.LedgerPersistenceException;
import me.golemcore.imagebot.port.outbound.ProviderRequestRejectedException;
import me.golemcore.imagebot.ratelimit.UsageRateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ImageDispatchServiceTest {

    private static final long IDENTITY = 99L;
    private static final String USER_CHAT = "100";
    private static final String OPERATOR_CHAT = "-500";
    private static final String PROMPT = "a red fox";
    private static final String IMAGE_URL = "https://images.example.com/fox.png";
    private static final Instant NOW = Instant.parse("2024-05-01T08:00:00Z");

    private UsageRateLimiter rateLimiter;
    private ImageGenerationPort imagePort;
    private ChannelPort channelPort;
    private ImageDispatchService service;

    @BeforeEach
    void setUp() {
        rateLimiter = mock(UsageRateLimiter.class);
        imagePort = mock(ImageGenerationPort.class);
        channelPort = mock(ChannelPort.class);
        when(channelPort.sendMessage(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(channelPort.sendMessage(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.completedFuture(null));
        when(channelPort.sendPhoto(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));

        BotProperties properties = new BotProperties();
        properties.getOperator().setChatId(OPERATOR_CHAT);

        OperatorNotificationService operator = new OperatorNotificationService(channelPort, properties);
        service = new ImageDispatchService(rateLimiter, imagePort, channelPort, operator, new MessageService(),
                properties);
    }

    private static Message origin(boolean group) {
        return Message.builder()
                .channelType("telegram")
                .chatId(USER_CHAT)
                .senderId("1")
                .groupChat(group)
                .build();
    }

    private void admit() {
        when(rateLimiter.tryAcquire(anyLong(), anyString(), anyBoolean(), any()))
                .thenReturn(RateLimitResult.allowed(UsageRecord.builder().prompt(PROMPT).build()));
    }

    @Test
    void tooSoonRoundsWaitUpAndSkipsProvider() {
        when(rateLimiter.tryAcquire(anyLong(), anyString(), anyBoolean(), any()))
                .thenReturn(RateLimitResult.tooSoon(Duration.ofMillis(500)));

        DispatchOutcome outcome = service.admitAndDispatch(IDENTITY, PROMPT, origin(false), NOW);

        assertEquals(DispatchOutcome.Kind.TOO_SOON, outcome.getKind());
        assertEquals(Duration.ofMillis(500), outcome.getRetryAfter());
        verify(channelPort).sendMessage(USER_CHAT,
                "You can send one request every 60 seconds. Please try again in 1 seconds.");
        verifyNoInteractions(imagePort);
    }

    @Test
    void quotaExceededNamesDailyLimit() {
        when(rateLimiter.tryAcquire(anyLong(), anyString(), anyBoolean(), any()))
                .thenReturn(RateLimitResult.quotaExceeded());

        DispatchOutcome outcome = service.admitAndDispatch(IDENTITY, PROMPT, origin(false), NOW);

        assertEquals(DispatchOutcome.Kind.QUOTA_EXCEEDED, outcome.getKind());
        verify(channelPort).sendMessage(USER_CHAT,
                "You have reached the limit of 5 images per day. Please try again tomorrow.");
        verifyNoInteractions(imagePort);
    }

    @Test
    void emptyPromptAsksForPrompt() {
        when(rateLimiter.tryAcquire(anyLong(), anyString(), anyBoolean(), any()))
                .thenReturn(RateLimitResult.promptRequired());

        DispatchOutcome outcome = service.admitAndDispatch(IDENTITY, null, origin(false), NOW);

        assertEquals(DispatchOutcome.Kind.PROMPT_REQUIRED, outcome.getKind());
        verify(rateLimiter).tryAcquire(IDENTITY, "", false, NOW);
        verify(channelPort).sendMessage(USER_CHAT, "What image should I generate?");
        verifyNoInteractions(imagePort);
    }

    @Test
    void promptIsTrimmedBeforeAdmission() {
        when(rateLimiter.tryAcquire(anyLong(), anyString(), anyBoolean(), any()))
                .thenReturn(RateLimitResult.quotaExceeded());

        service.admitAndDispatch(IDENTITY, "   " + PROMPT + "\n", origin(true), NOW);

        verify(rateLimiter).tryAcquire(IDENTITY, PROMPT, true, NOW);
    }

    @Test
    void flaggedPromptIsBlockedAndNeverGenerated() {
        admit();
        when(imagePort.checkModeration(PROMPT))
                .thenReturn(new ImageGenerationPort.ModerationResult(true, List.of("violence")));

        DispatchOutcome outcome = service.admitAndDispatch(IDENTITY, PROMPT, origin(false), NOW);

        assertEquals(DispatchOutcome.Kind.BLOCKED, outcome.getKind());
        assertEquals(PROMPT, outcome.getPrompt());
        verify(imagePort, never()).generateImage(anyString(), anyInt(), anyLong());
        verify(channelPort).sendMessage(USER_CHAT,
                "This prompt doesn't comply with the provider's content policy.");
        verify(channelPort).sendMessage(OPERATOR_CHAT,
                "This prompt doesn't comply with the provider's content policy:\n" + PROMPT);
    }

    @Test
    void generatedImageGoesToRequesterAndOperator() {
        admit();
        when(imagePort.checkModeration(PROMPT)).thenReturn(ImageGenerationPort.ModerationResult.clean());
        when(imagePort.generateImage(PROMPT, 256, IDENTITY))
                .thenReturn(new ImageGenerationPort.GeneratedImage(IMAGE_URL));

        DispatchOutcome outcome = service.admitAndDispatch(IDENTITY, PROMPT, origin(false), NOW);

        assertEquals(DispatchOutcome.Kind.DELIVERED, outcome.getKind());
        assertEquals(IMAGE_URL, outcome.getImageUrl());
        verify(channelPort).showTyping(USER_CHAT);
        verify(channelPort).sendPhoto(USER_CHAT, IMAGE_URL, PROMPT);
        verify(channelPort).sendPhoto(OPERATOR_CHAT, IMAGE_URL, "single user: " + PROMPT);
    }

    @Test
    void groupRequestIsTaggedForOperator() {
        admit();
        when(imagePort.checkModeration(PROMPT)).thenReturn(ImageGenerationPort.ModerationResult.clean());
        when(imagePort.generateImage(PROMPT, 256, IDENTITY))
                .thenReturn(new ImageGenerationPort.GeneratedImage(IMAGE_URL));

        service.admitAndDispatch(IDENTITY, PROMPT, origin(true), NOW);

        verify(channelPort).sendPhoto(OPERATOR_CHAT, IMAGE_URL, "group: " + PROMPT);
    }

    @Test
    void providerRejectionIsReportedVerbatim() {
        admit();
        when(imagePort.checkModeration(PROMPT)).thenReturn(ImageGenerationPort.ModerationResult.clean());
        when(imagePort.generateImage(PROMPT, 256, IDENTITY)).thenThrow(new ProviderRequestRejectedException(
                ProviderRequestRejectedException.Reason.INVALID_REQUEST, 400, "Rejected by safety system"));

        DispatchOutcome outcome = service.admitAndDispatch(IDENTITY, PROMPT, origin(false), NOW);

        assertEquals(DispatchOutcome.Kind.PROVIDER_ERROR, outcome.getKind());
        assertEquals("Rejected by safety system", outcome.getMessage());
        verify(channelPort).sendMessage(USER_CHAT, "Rejected by safety system");
        verify(channelPort).sendMessage(OPERATOR_CHAT, PROMPT + "\nRejected by safety system");
    }

    @Test
    void moderationRateLimitIsProviderError() {
        admit();
        when(imagePort.checkModeration(PROMPT)).thenThrow(new ProviderRequestRejectedException(
                ProviderRequestRejectedException.Reason.RATE_LIMITED, 429, "Rate limit reached"));

        DispatchOutcome outcome = service.admitAndDispatch(IDENTITY, PROMPT, origin(false), NOW);

        assertEquals(DispatchOutcome.Kind.PROVIDER_ERROR, outcome.getKind());
        verify(imagePort, never()).generateImage(anyString(), anyInt(), anyLong());
    }

    @Test
    void unclassifiedProviderErrorPropagates() {
        admit();
        when(imagePort.checkModeration(PROMPT)).thenReturn(ImageGenerationPort.ModerationResult.clean());
        when(imagePort.generateImage(PROMPT, 256, IDENTITY)).thenThrow(new IllegalStateException("HTTP 401"));

        assertThrows(IllegalStateException.class,
                () -> service.admitAndDispatch(IDENTITY, PROMPT, origin(false), NOW));
        verify(channelPort, never()).sendPhoto(anyString(), anyString(), anyString());
    }

    @Test
    void ledgerFailurePropagatesBeforeProviderCall() {
        when(rateLimiter.tryAcquire(anyLong(), anyString(), anyBoolean(), any()))
                .thenThrow(new LedgerPersistenceException("disk full", null));

        assertThrows(LedgerPersistenceException.class,
                () -> service.admitAndDispatch(IDENTITY, PROMPT, origin(false), NOW));
        verifyNoInteractions(imagePort);
    }

    @Test
    void operatorNoticesSkippedWithoutOperatorChat() {
        BotProperties properties = new BotProperties();
        OperatorNotificationService operator = new OperatorNotificationService(channelPort, properties);
        service = new ImageDispatchService(rateLimiter, imagePort, channelPort, operator, new MessageService(),
                properties);
        admit();
        when(imagePort.checkModeration(PROMPT)).thenReturn(ImageGenerationPort.ModerationResult.clean());
        when(imagePort.generateImage(PROMPT, 256, IDENTITY))
                .thenReturn(new ImageGenerationPort.GeneratedImage(IMAGE_URL));

        service.admitAndDispatch(IDENTITY, PROMPT, origin(false), NOW);

        ArgumentCaptor<String> chats = ArgumentCaptor.forClass(String.class);
        verify(channelPort).sendPhoto(chats.capture(), eq(IMAGE_URL), anyString());
        assertEquals(USER_CHAT, chats.getValue());
    }

    @Test
    void ceilSecondsRoundsUpPartialSeconds() {
        assertEquals(0, ImageDispatchService.ceilSeconds(Duration.ZERO));
        assertEquals(1, ImageDispatchService.ceilSeconds(Duration.ofNanos(1)));
        assertEquals(59, ImageDispatchService.ceilSeconds(Duration.ofSeconds(59)));
        assertEquals(60, ImageDispatchService.ceilSeconds(Duration.ofMillis(59_001)));
    }
}
