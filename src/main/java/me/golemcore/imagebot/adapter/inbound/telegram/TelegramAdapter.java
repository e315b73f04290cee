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

package me.golemcore.imagebot.adapter.inbound.telegram;

import me.golemcore.imagebot.domain.loop.InboundMessageEvent;
import me.golemcore.imagebot.domain.model.Message;
import me.golemcore.imagebot.infrastructure.config.BotProperties;
import me.golemcore.imagebot.port.inbound.ChannelPort;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.ActionType;
import org.telegram.telegrambots.meta.api.methods.send.SendChatAction;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.send.SendPhoto;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Telegram channel adapter using long polling.
 *
 * <p>
 * This adapter implements both {@link ChannelPort} for outbound messaging and
 * {@link LongPollingSingleThreadUpdateConsumer} for inbound updates.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Long polling for incoming text messages via Telegram Bot API
 * <li>Slash command parsing ({@code /generate@MyBot a red fox} becomes command
 * {@code generate} with args {@code [a, red, fox]})
 * <li>Group and supergroup detection
 * <li>Truncation to Telegram's 4096 character message and 1024 character
 * caption limits
 * <li>Photo sending by URL
 * </ul>
 *
 * <p>
 * The adapter is always available as a Spring bean but only starts polling if
 * {@code bot.telegram.enabled=true} and a token is configured.
 *
 * @see me.golemcore.imagebot.port.inbound.ChannelPort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramAdapter implements ChannelPort, LongPollingSingleThreadUpdateConsumer {

    private static final String CHANNEL_TYPE = "telegram";
    private static final int TELEGRAM_MAX_MESSAGE_LENGTH = 4096;
    private static final int TELEGRAM_MAX_CAPTION_LENGTH = 1024;

    private final BotProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final Clock clock;

    private TelegramClient telegramClient;
    private volatile boolean running = false;
    private volatile boolean initialized = false;
    private final Object lifecycleLock = new Object();

    /**
     * Package-private setter for testing, allows injecting a mock TelegramClient.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
        this.initialized = true;
    }

    private boolean isEnabled() {
        return properties.getTelegram().isEnabled();
    }

    private synchronized void ensureInitialized() {
        if (initialized || !isEnabled())
            return;

        String token = properties.getTelegram().getToken();
        if (token == null || token.isBlank()) {
            log.warn("[Telegram] Token not configured, adapter will not start. Set TELEGRAM_BOT_TOKEN env var.");
            return;
        }
        this.telegramClient = new OkHttpTelegramClient(token);
        initialized = true;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("[Telegram] Adapter already running");
                return;
            }
            if (!isEnabled()) {
                log.info("[Telegram] Channel disabled");
                return;
            }
            ensureInitialized();
            if (telegramClient == null) {
                log.warn("[Telegram] Client not initialized, cannot start");
                return;
            }

            try {
                botsApplication.registerBot(properties.getTelegram().getToken(), this);
                running = true;
                log.info("[Telegram] Adapter started");
            } catch (TelegramApiException e) {
                log.error("[Telegram] Failed to start adapter", e);
            }
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            try {
                botsApplication.close();
                log.info("[Telegram] Adapter stopped");
            } catch (Exception e) {
                log.error("[Telegram] Error stopping adapter", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void consume(Update update) {
        if (update.hasMessage()) {
            handleMessage(update);
        }
    }

    private void handleMessage(Update update) {
        org.telegram.telegrambots.meta.api.objects.message.Message telegramMessage = update.getMessage();
        if (!telegramMessage.hasText() || telegramMessage.getFrom() == null) {
            return;
        }

        String chatId = telegramMessage.getChatId().toString();
        String text = telegramMessage.getText();

        Message.MessageBuilder messageBuilder = Message.builder()
                .id(telegramMessage.getMessageId().toString())
                .channelType(CHANNEL_TYPE)
                .chatId(chatId)
                .senderId(telegramMessage.getFrom().getId().toString())
                .groupChat(telegramMessage.isGroupMessage() || telegramMessage.isSuperGroupMessage())
                .content(text)
                .timestamp(clock.instant());

        if (text.startsWith("/")) {
            String[] parts = text.trim().split("\\s+", 2);
            String cmd = parts[0].substring(1).split("@")[0]; // strip / and @botname
            List<String> args = parts.length > 1
                    ? Arrays.asList(parts[1].trim().split("\\s+"))
                    : List.of();
            messageBuilder.command(cmd).commandArgs(args);
        }

        Message message = messageBuilder.build();
        log.debug("[Telegram] Inbound message: chatId={}, command={}, group={}", chatId, message.getCommand(),
                message.isGroupChat());
        eventPublisher.publishEvent(new InboundMessageEvent(message, message.getTimestamp()));
    }

    @Override
    public CompletableFuture<Void> sendMessage(String chatId, String content) {
        return sendMessage(chatId, content, Map.of());
    }

    @Override
    public CompletableFuture<Void> sendMessage(String chatId, String content, Map<String, Object> hints) {
        return CompletableFuture.runAsync(() -> {
            try {
                SendMessage.SendMessageBuilder<?, ?> builder = SendMessage.builder()
                        .chatId(chatId)
                        .text(truncate(content, TELEGRAM_MAX_MESSAGE_LENGTH));

                Object parseMode = hints != null ? hints.get(HINT_PARSE_MODE) : null;
                if (parseMode != null) {
                    builder.parseMode(parseMode.toString());
                }

                telegramClient.execute(builder.build());
            } catch (TelegramApiException e) {
                log.error("[Telegram] Failed to send message to chat: {}", chatId, e);
                throw new IllegalStateException("Failed to send message", e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> sendPhoto(String chatId, String imageUrl, String caption) {
        return CompletableFuture.runAsync(() -> {
            try {
                SendPhoto.SendPhotoBuilder<?, ?> builder = SendPhoto.builder()
                        .chatId(chatId)
                        .photo(new InputFile(imageUrl));

                if (caption != null && !caption.isBlank()) {
                    builder.caption(truncate(caption, TELEGRAM_MAX_CAPTION_LENGTH));
                }

                telegramClient.execute(builder.build());
                log.debug("[Telegram] Sent photo to chat: {}", chatId);
            } catch (TelegramApiException e) {
                log.error("[Telegram] Failed to send photo to chat: {}", chatId, e);
                throw new IllegalStateException("Failed to send photo", e);
            }
        });
    }

    @Override
    public void showTyping(String chatId) {
        try {
            SendChatAction action = SendChatAction.builder()
                    .chatId(chatId)
                    .action(ActionType.TYPING.toString())
                    .build();
            telegramClient.execute(action);
        } catch (Exception e) {
            log.debug("[Telegram] Failed to send typing indicator", e);
        }
    }

    static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength)
            return text;
        return text.substring(0, maxLength - 3) + "...";
    }
}
