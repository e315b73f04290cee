package me.golemcore.imagebot.domain.service;

import me.golemcore.imagebot.infrastructure.config.BotProperties;
import me.golemcore.imagebot.port.inbound.ChannelPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class OperatorNotificationServiceTest {

    private static final String OPERATOR_CHAT = "-1001";

    private ChannelPort channelPort;
    private BotProperties properties;
    private OperatorNotificationService service;

    @BeforeEach
    void setUp() {
        channelPort = mock(ChannelPort.class);
        when(channelPort.sendMessage(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(channelPort.sendMessage(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.completedFuture(null));
        properties = new BotProperties();
        properties.getOperator().setChatId(OPERATOR_CHAT);
        service = new OperatorNotificationService(channelPort, properties);
    }

    @Test
    void sendTextGoesToOperatorChat() {
        service.sendText("hello").join();

        verify(channelPort).sendMessage(OPERATOR_CHAT, "hello");
    }

    @Test
    void noticesAreSkippedWithoutOperatorChat() {
        properties.getOperator().setChatId(" ");

        service.sendText("hello").join();
        service.sendPhoto("https://x/y.png", "caption").join();
        service.reportFailure(new IllegalStateException("boom"));

        assertFalse(service.isConfigured());
        verifyNoInteractions(channelPort);
    }

    @Test
    void failureReportIsEscapedHtml() {
        service.reportFailure(new IllegalStateException("bad <tag> & more"));

        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        verify(channelPort).sendMessage(eq(OPERATOR_CHAT), text.capture(),
                eq(Map.of(ChannelPort.HINT_PARSE_MODE, "HTML")));
        String report = text.getValue();
        assertTrue(report.startsWith("An exception was raised while handling an update\n<pre>"));
        assertTrue(report.contains("bad &lt;tag&gt; &amp; more"));
        assertTrue(report.endsWith("</pre>"));
    }

    @Test
    void longTraceIsTruncatedBeforeClosingTag() {
        String report = OperatorNotificationService.formatFailure(new IllegalStateException("x".repeat(10_000)));

        assertEquals(4090 + "</pre>".length(), report.length());
        assertTrue(report.endsWith("</pre>"));
    }

    @Test
    void truncationNeverSplitsAnEntity() {
        String report = OperatorNotificationService.formatFailure(
                new IllegalStateException("x".repeat(200) + "&".repeat(2000) + "<init>".repeat(200)));

        assertTrue(report.length() <= 4090 + "</pre>".length());
        assertTrue(report.endsWith("&amp;</pre>"), report.substring(report.length() - 20));
    }

    @Test
    void truncationKeepsEntitiesOfLessThanSignIntact() {
        String report = OperatorNotificationService.formatFailure(
                new IllegalStateException("y".repeat(201) + "<".repeat(2000)));

        String body = report.substring(0, report.length() - "</pre>".length());
        int lastAmpersand = body.lastIndexOf('&');
        assertTrue(body.indexOf(';', lastAmpersand) > lastAmpersand, body.substring(body.length() - 10));
        assertTrue(body.endsWith("&lt;"));
    }

    @Test
    void reportFailureNeverThrows() {
        when(channelPort.sendMessage(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("telegram down")));

        assertDoesNotThrow(() -> service.reportFailure(new RuntimeException("boom")));
    }

    @Test
    void escapeHtmlHandlesAmpersandFirst() {
        assertEquals("&amp;lt;", OperatorNotificationService.escapeHtml("&lt;"));
    }
}
