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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Transport-neutral inbound chat message. Commands arrive with
 * {@code command} set (without the leading slash) and their whitespace-split
 * arguments in {@code commandArgs}; plain text has {@code command == null}.
 */
@Data
@Builder
public class Message {

    private String id;
    private String channelType;
    private String chatId;
    private String senderId; // raw platform user id, hashed before it reaches the ledger
    private String content;
    private String command;
    private List<String> commandArgs;
    private boolean groupChat;
    private Instant timestamp;

    public boolean isCommand() {
        return command != null;
    }

    /**
     * Arguments joined back with single spaces.
     */
    public String joinedArgs() {
        if (commandArgs == null || commandArgs.isEmpty()) {
            return "";
        }
        return String.join(" ", commandArgs);
    }
}
