package me.golemcore.imagebot.domain.loop;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.imagebot.domain.model.Message;
import me.golemcore.imagebot.domain.service.ConversationService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands inbound messages from the polling thread to the dispatch pool, where
 * {@link ConversationService} runs the slow provider calls.
 */
@Component
@Slf4j
public class InboundMessageListener {

    private final ConversationService conversationService;
    private final ExecutorService dispatchExecutor;

    public InboundMessageListener(ConversationService conversationService,
            @Qualifier("dispatchExecutor") ExecutorService dispatchExecutor) {
        this.conversationService = conversationService;
        this.dispatchExecutor = dispatchExecutor;
    }

    @EventListener
    public void onInboundMessage(InboundMessageEvent event) {
        Message message = event.message();
        log.debug("[Inbound] enqueue message (channel={}, chatId={})", message.getChannelType(), message.getChatId());
        try {
            dispatchExecutor.execute(() -> conversationService.handle(message));
        } catch (RejectedExecutionException e) {
            log.warn("[Inbound] Dispatch pool rejected message (chatId={}): {}", message.getChatId(),
                    e.getMessage());
        }
    }
}
