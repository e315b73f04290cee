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

import me.golemcore.imagebot.domain.model.ConversationState;
import me.golemcore.imagebot.domain.model.ConversationTrigger;
import me.golemcore.imagebot.domain.model.DispatchOutcome;
import me.golemcore.imagebot.domain.model.Message;
import me.golemcore.imagebot.infrastructure.config.BotProperties;
import me.golemcore.imagebot.infrastructure.i18n.MessageService;
import me.golemcore.imagebot.port.inbound.ChannelPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives the per-conversation state machine: resolves the trigger of an
 * inbound message, performs the action and stores the next
 * {@link ConversationState}.
 *
 * <p>
 * Conversations are keyed by channel, chat and sender, and kept in memory only.
 * Any exception escaping a dispatch cycle is reported to the operator and
 * leaves the conversation state unchanged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationService {

    private final ImageDispatchService dispatchService;
    private final IdentityHashService identityHashService;
    private final OperatorNotificationService operatorNotifications;
    private final ChannelPort channelPort;
    private final MessageService messageService;
    private final BotProperties properties;
    private final Clock clock;

    private final Map<String, ConversationState> states = new ConcurrentHashMap<>();

    /**
     * Handles one inbound message. Returns the dispatch outcome when the message
     * ran an admit-and-dispatch cycle, empty otherwise.
     */
    public Optional<DispatchOutcome> handle(Message message) {
        Optional<ConversationTrigger> resolved = ConversationTrigger.resolve(message);
        if (resolved.isEmpty()) {
            return Optional.empty();
        }
        ConversationTrigger trigger = resolved.get();
        String key = conversationKey(message);
        ConversationState current = getState(key);

        if (!current.accepts(trigger)) {
            log.trace("Ignoring {} in state {}", trigger, current);
            return Optional.empty();
        }

        DispatchOutcome outcome = null;
        try {
            switch (trigger) {
            case START -> channelPort.sendMessage(message.getChatId(), greeting()).join();
            case CANCEL -> log.debug("Conversation cancelled: {}", key);
            case GENERATE -> outcome = dispatch(message, message.joinedArgs());
            case PROMPT_TEXT -> outcome = dispatch(message, message.getContent());
            }
        } catch (RuntimeException e) {
            operatorNotifications.reportFailure(e);
            outcome = DispatchOutcome.internalError(e.getMessage());
            if (!current.dispatches(trigger)) {
                return Optional.empty();
            }
            return Optional.of(outcome);
        }

        ConversationState next = current.next(trigger, outcome);
        if (next == ConversationState.INITIAL) {
            states.remove(key);
        } else {
            states.put(key, next);
        }
        if (next != current) {
            log.debug("Conversation {}: {} -> {}", key, current, next);
        }
        return Optional.ofNullable(outcome);
    }

    public ConversationState getState(Message message) {
        return getState(conversationKey(message));
    }

    int activeConversations() {
        return states.size();
    }

    private ConversationState getState(String key) {
        return states.getOrDefault(key, ConversationState.INITIAL);
    }

    private DispatchOutcome dispatch(Message message, String prompt) {
        long identity = identityHashService.hash(message.getSenderId());
        Instant now = clock.instant();
        return dispatchService.admitAndDispatch(identity, prompt, message, now);
    }

    private String greeting() {
        BotProperties.LimitsProperties limits = properties.getLimits();
        return messageService.getMessage("conversation.greeting",
                String.valueOf(limits.getMinRequestInterval().toSeconds()),
                String.valueOf(limits.getMaxRequestsPerDay()));
    }

    private static String conversationKey(Message message) {
        return message.getChannelType() + ":" + message.getChatId() + ":" + message.getSenderId();
    }
}
