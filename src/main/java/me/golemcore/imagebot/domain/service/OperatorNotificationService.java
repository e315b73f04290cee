package me.golemcore.imagebot.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.imagebot.infrastructure.config.BotProperties;
import me.golemcore.imagebot.port.inbound.ChannelPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Messages to the operator chat ({@code bot.operator.chat-id}): audit copies of
 * generated images, blocked prompts, provider errors and failure reports.
 *
 * <p>
 * When no operator chat is configured every notice is skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OperatorNotificationService {

    static final String FAILURE_HEADER = "An exception was raised while handling an update\n<pre>";
    static final String FAILURE_FOOTER = "</pre>";
    static final int FAILURE_BODY_LIMIT = 4090;

    private final ChannelPort channelPort;
    private final BotProperties properties;

    public boolean isConfigured() {
        String chatId = properties.getOperator().getChatId();
        return chatId != null && !chatId.isBlank();
    }

    public CompletableFuture<Void> sendText(String text) {
        if (!isConfigured()) {
            log.debug("[Operator] No operator chat configured, notice skipped");
            return CompletableFuture.completedFuture(null);
        }
        return channelPort.sendMessage(properties.getOperator().getChatId(), text);
    }

    public CompletableFuture<Void> sendPhoto(String imageUrl, String caption) {
        if (!isConfigured()) {
            log.debug("[Operator] No operator chat configured, image copy skipped");
            return CompletableFuture.completedFuture(null);
        }
        return channelPort.sendPhoto(properties.getOperator().getChatId(), imageUrl, caption);
    }

    /**
     * Logs {@code error} and sends its stack trace to the operator. Never throws.
     */
    public void reportFailure(Throwable error) {
        log.error("[Operator] Exception while handling an update", error);
        if (!isConfigured()) {
            return;
        }
        try {
            channelPort.sendMessage(properties.getOperator().getChatId(), formatFailure(error),
                    Map.of(ChannelPort.HINT_PARSE_MODE, "HTML")).join();
        } catch (RuntimeException e) {
            log.error("[Operator] Failed to deliver failure report: {}", e.getMessage());
        }
    }

    static String formatFailure(Throwable error) {
        StringWriter trace = new StringWriter();
        error.printStackTrace(new PrintWriter(trace));
        String body = FAILURE_HEADER + escapeHtml(trace.toString());
        if (body.length() > FAILURE_BODY_LIMIT) {
            body = dropPartialEntity(body.substring(0, FAILURE_BODY_LIMIT));
        }
        return body + FAILURE_FOOTER;
    }

    // Telegram rejects HTML that ends inside an entity such as "&am"
    private static String dropPartialEntity(String text) {
        int ampersand = text.lastIndexOf('&');
        if (ampersand >= 0 && text.indexOf(';', ampersand) < 0) {
            return text.substring(0, ampersand);
        }
        return text;
    }

    static String escapeHtml(String text) {
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }
}
