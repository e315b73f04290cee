package me.golemcore.imagebot.domain.service;

import me.golemcore.imagebot.domain.model.ConversationState;
import me.golemcore.imagebot.domain.model.DispatchOutcome;
import me.golemcore.imagebot.domain.model.Message;
import me.golemcore.imagebot.infrastructure.config.BotProperties;
import me.golemcore.imagebot.infrastructure.i18n.MessageService;
import me.golemcore.imagebot.port.inbound.ChannelPort;
import me.golemcore.imagebot.port.outbound.LedgerPersistenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ConversationServiceTest {

    private static final Instant FIXED_INSTANT = Instant.parse("2024-05-01T08:00:00Z");
    private static final String CHAT_ID = "100";
    private static final String SENDER = "7";

    private ImageDispatchService dispatchService;
    private IdentityHashService identityHashService;
    private OperatorNotificationService operatorNotifications;
    private ChannelPort channelPort;
    private ConversationService service;

    @BeforeEach
    void setUp() {
        dispatchService = mock(ImageDispatchService.class);
        operatorNotifications = mock(OperatorNotificationService.class);
        channelPort = mock(ChannelPort.class);
        when(channelPort.sendMessage(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));

        BotProperties properties = new BotProperties();
        identityHashService = new IdentityHashService(properties);
        Clock clock = Clock.fixed(FIXED_INSTANT, ZoneOffset.UTC);

        service = new ConversationService(dispatchService, identityHashService, operatorNotifications, channelPort,
                new MessageService(), properties, clock);
    }

    private static Message command(String sender, String name, String... args) {
        return Message.builder()
                .channelType("telegram")
                .chatId(CHAT_ID)
                .senderId(sender)
                .content("/" + name)
                .command(name)
                .commandArgs(List.of(args))
                .build();
    }

    private static Message text(String sender, String content) {
        return Message.builder()
                .channelType("telegram")
                .chatId(CHAT_ID)
                .senderId(sender)
                .content(content)
                .build();
    }

    private void dispatchReturns(DispatchOutcome outcome) {
        when(dispatchService.admitAndDispatch(anyLong(), any(), any(), any())).thenReturn(outcome);
    }

    @Test
    void startSendsGreetingWithLimits() {
        Optional<DispatchOutcome> outcome = service.handle(command(SENDER, "start"));

        assertTrue(outcome.isEmpty());
        ArgumentCaptor<String> greeting = ArgumentCaptor.forClass(String.class);
        verify(channelPort).sendMessage(eq(CHAT_ID), greeting.capture());
        assertTrue(greeting.getValue().contains("one request every 60 seconds"));
        assertTrue(greeting.getValue().contains("at most 5 images per day"));
        assertEquals(ConversationState.AWAITING_COMMAND, service.getState(command(SENDER, "start")));
    }

    @Test
    void plainTextIsIgnoredWhileAwaitingCommand() {
        Optional<DispatchOutcome> outcome = service.handle(text(SENDER, "a red fox"));

        assertTrue(outcome.isEmpty());
        verifyNoInteractions(dispatchService);
    }

    @Test
    void generateWithArgsDispatchesJoinedPrompt() {
        dispatchReturns(DispatchOutcome.delivered("https://x/y.png", "a red fox"));

        Optional<DispatchOutcome> outcome = service.handle(command(SENDER, "generate", "a", "red", "fox"));

        assertEquals(DispatchOutcome.Kind.DELIVERED, outcome.orElseThrow().getKind());
        verify(dispatchService).admitAndDispatch(eq(identityHashService.hash(SENDER)), eq("a red fox"), any(),
                eq(FIXED_INSTANT));
        assertEquals(ConversationState.AWAITING_COMMAND, service.getState(text(SENDER, "")));
    }

    @Test
    void generateWithoutArgsAwaitsPromptThenDispatchesText() {
        dispatchReturns(DispatchOutcome.promptRequired());
        service.handle(command(SENDER, "generate"));
        assertEquals(ConversationState.AWAITING_PROMPT, service.getState(text(SENDER, "")));

        dispatchReturns(DispatchOutcome.delivered("https://x/y.png", "a red fox"));
        service.handle(text(SENDER, "a red fox"));

        verify(dispatchService).admitAndDispatch(anyLong(), eq("a red fox"), any(), any());
        assertEquals(ConversationState.AWAITING_COMMAND, service.getState(text(SENDER, "")));
    }

    @Test
    void rejectionsOtherThanPromptRequiredReturnToAwaitingCommand() {
        dispatchReturns(DispatchOutcome.promptRequired());
        service.handle(command(SENDER, "generate"));

        dispatchReturns(DispatchOutcome.quotaExceeded());
        service.handle(text(SENDER, "a red fox"));

        assertEquals(ConversationState.AWAITING_COMMAND, service.getState(text(SENDER, "")));
    }

    @Test
    void cancelReturnsToAwaitingCommand() {
        dispatchReturns(DispatchOutcome.promptRequired());
        service.handle(command(SENDER, "generate"));

        service.handle(command(SENDER, "cancel"));
        service.handle(text(SENDER, "ignored now"));

        assertEquals(ConversationState.AWAITING_COMMAND, service.getState(text(SENDER, "")));
        verify(dispatchService, never()).admitAndDispatch(anyLong(), eq("ignored now"), any(), any());
    }

    @Test
    void startWhileAwaitingPromptResetsConversation() {
        dispatchReturns(DispatchOutcome.promptRequired());
        service.handle(command(SENDER, "generate"));

        service.handle(command(SENDER, "start"));

        assertEquals(ConversationState.AWAITING_COMMAND, service.getState(text(SENDER, "")));
    }

    @Test
    void fatalErrorIsReportedAndStateKept() {
        dispatchReturns(DispatchOutcome.promptRequired());
        service.handle(command(SENDER, "generate"));
        LedgerPersistenceException failure = new LedgerPersistenceException("disk full", null);
        when(dispatchService.admitAndDispatch(anyLong(), eq("a red fox"), any(), any())).thenThrow(failure);

        Optional<DispatchOutcome> outcome = service.handle(text(SENDER, "a red fox"));

        assertEquals(DispatchOutcome.Kind.INTERNAL_ERROR, outcome.orElseThrow().getKind());
        verify(operatorNotifications).reportFailure(failure);
        assertEquals(ConversationState.AWAITING_PROMPT, service.getState(text(SENDER, "")));
    }

    @Test
    void unknownCommandIsIgnored() {
        Optional<DispatchOutcome> outcome = service.handle(command(SENDER, "help"));

        assertTrue(outcome.isEmpty());
        verifyNoInteractions(dispatchService, channelPort);
    }

    @Test
    void conversationsAreKeptPerSender() {
        dispatchReturns(DispatchOutcome.promptRequired());
        service.handle(command(SENDER, "generate"));

        service.handle(text("8", "someone else talking"));

        assertEquals(ConversationState.AWAITING_PROMPT, service.getState(text(SENDER, "")));
        assertEquals(ConversationState.AWAITING_COMMAND, service.getState(text("8", "")));
        verify(dispatchService, never()).admitAndDispatch(anyLong(), eq("someone else talking"), any(), any());
    }

    @Test
    void onlyConversationsAwaitingPromptAreRetained() {
        dispatchReturns(DispatchOutcome.promptRequired());
        service.handle(command(SENDER, "generate"));
        service.handle(command("8", "start"));
        service.handle(text("9", "hello"));

        assertEquals(1, service.activeConversations());

        service.handle(command(SENDER, "cancel"));

        assertEquals(0, service.activeConversations());
        assertEquals(ConversationState.AWAITING_COMMAND, service.getState(text(SENDER, "")));
    }
}
