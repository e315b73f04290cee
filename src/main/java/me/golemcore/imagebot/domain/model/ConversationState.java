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

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-conversation state of the image bot.
 *
 * <p>
 * Transition table:
 *
 * <pre>
 * state             trigger       next
 * AWAITING_COMMAND  START         AWAITING_COMMAND
 * AWAITING_COMMAND  GENERATE      by outcome
 * AWAITING_COMMAND  CANCEL        AWAITING_COMMAND
 * AWAITING_PROMPT   START         AWAITING_COMMAND
 * AWAITING_PROMPT   GENERATE      by outcome
 * AWAITING_PROMPT   PROMPT_TEXT   by outcome
 * AWAITING_PROMPT   CANCEL        AWAITING_COMMAND
 * </pre>
 *
 * "By outcome" means {@link DispatchOutcome.Kind#PROMPT_REQUIRED} leads to
 * {@link #AWAITING_PROMPT}, {@link DispatchOutcome.Kind#INTERNAL_ERROR} keeps
 * the current state, and every other outcome leads to
 * {@link #AWAITING_COMMAND}. Triggers a state does not accept leave it
 * unchanged. There is no terminal state.
 */
public enum ConversationState {

    AWAITING_COMMAND(EnumSet.of(ConversationTrigger.START, ConversationTrigger.GENERATE,
            ConversationTrigger.CANCEL)),
    AWAITING_PROMPT(EnumSet.of(ConversationTrigger.START, ConversationTrigger.GENERATE,
            ConversationTrigger.PROMPT_TEXT, ConversationTrigger.CANCEL));

    public static final ConversationState INITIAL = AWAITING_COMMAND;

    private final Set<ConversationTrigger> accepted;

    ConversationState(Set<ConversationTrigger> accepted) {
        this.accepted = accepted;
    }

    public boolean accepts(ConversationTrigger trigger) {
        return accepted.contains(trigger);
    }

    /**
     * Whether the trigger runs an admit-and-dispatch cycle in this state.
     */
    public boolean dispatches(ConversationTrigger trigger) {
        return accepts(trigger)
                && (trigger == ConversationTrigger.GENERATE || trigger == ConversationTrigger.PROMPT_TEXT);
    }

    /**
     * Next state after {@code trigger}. {@code outcome} is only consulted for
     * dispatching triggers and may be {@code null} otherwise.
     */
    public ConversationState next(ConversationTrigger trigger, DispatchOutcome outcome) {
        if (!accepts(trigger)) {
            return this;
        }
        return switch (trigger) {
        case START, CANCEL -> AWAITING_COMMAND;
        case GENERATE, PROMPT_TEXT -> afterDispatch(outcome);
        };
    }

    private ConversationState afterDispatch(DispatchOutcome outcome) {
        if (outcome == null || outcome.getKind() == DispatchOutcome.Kind.INTERNAL_ERROR) {
            return this;
        }
        if (outcome.getKind() == DispatchOutcome.Kind.PROMPT_REQUIRED) {
            return AWAITING_PROMPT;
        }
        return AWAITING_COMMAND;
    }
}
