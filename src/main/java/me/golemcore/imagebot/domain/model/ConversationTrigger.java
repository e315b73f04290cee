package me.golemcore.imagebot.domain.model;

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

import java.util.Locale;
import java.util.Optional;

/**
 * Inbound events that drive the conversation state machine.
 */
public enum ConversationTrigger {

    /** {@code /start} greeting. */
    START,
    /** {@code /generate [prompt...]}. */
    GENERATE,
    /** Plain text, taken as the prompt while one is awaited. */
    PROMPT_TEXT,
    /** {@code /cancel}. */
    CANCEL;

    public static final String START_COMMAND = "start";
    public static final String GENERATE_COMMAND = "generate";
    public static final String CANCEL_COMMAND = "cancel";

    /**
     * Maps a message to its trigger. Unknown commands and empty messages map to
     * nothing and are ignored.
     */
    public static Optional<ConversationTrigger> resolve(Message message) {
        if (message.isCommand()) {
            return switch (message.getCommand().toLowerCase(Locale.ROOT)) {
            case START_COMMAND -> Optional.of(START);
            case GENERATE_COMMAND -> Optional.of(GENERATE);
            case CANCEL_COMMAND -> Optional.of(CANCEL);
            default -> Optional.empty();
            };
        }
        if (message.getContent() == null) {
            return Optional.empty();
        }
        return Optional.of(PROMPT_TEXT);
    }
}
