package me.golemcore.imagebot.port.inbound;

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

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Bidirectional port for chat transports (Telegram). Inbound messages are
 * published as {@link me.golemcore.imagebot.domain.loop.InboundMessageEvent};
 * this port covers the lifecycle and the outbound operations the dispatch core
 * needs: text, photo by URL and a typing indicator.
 */
public interface ChannelPort {

    /**
     * Hint key selecting the transport parse mode (e.g. {@code "HTML"}).
     */
    String HINT_PARSE_MODE = "parseMode";

    /**
     * Returns the channel type identifier (e.g., "telegram").
     */
    String getChannelType();

    /**
     * Starts listening for incoming messages from the channel.
     */
    void start();

    /**
     * Stops listening for messages and disconnects from the channel.
     */
    void stop();

    /**
     * Checks if the channel is currently active and listening.
     */
    boolean isRunning();

    /**
     * Sends a plain text message to the specified chat.
     */
    CompletableFuture<Void> sendMessage(String chatId, String content);

    /**
     * Sends a text message with protocol-level hints such as
     * {@link #HINT_PARSE_MODE}. Default implementation ignores hints.
     */
    default CompletableFuture<Void> sendMessage(String chatId, String content, Map<String, Object> hints) {
        return sendMessage(chatId, content);
    }

    /**
     * Sends an image referenced by URL with an optional caption.
     */
    CompletableFuture<Void> sendPhoto(String chatId, String imageUrl, String caption);

    /**
     * Displays a typing indicator. Default implementation does nothing.
     */
    default void showTyping(String chatId) {
        // Default no-op implementation
    }
}
