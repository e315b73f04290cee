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

import java.time.Duration;

/**
 * Result of an admission check against the usage ledger.
 *
 * <p>
 * Contains:
 * <ul>
 * <li>{@code status} - the admission decision</li>
 * <li>{@code waitTime} - for {@link Status#TOO_SOON}, how long until the
 * identity may ask again</li>
 * <li>{@code record} - for {@link Status#ALLOWED}, the ledger row that was
 * appended</li>
 * <li>{@code reason} - explanation for denial</li>
 * </ul>
 *
 * @since 1.0
 */
@Data
@Builder
public class RateLimitResult {

    public enum Status {
        ALLOWED, TOO_SOON, QUOTA_EXCEEDED, PROMPT_REQUIRED
    }

    private Status status;
    private Duration waitTime;
    private UsageRecord record;
    private String reason;

    public boolean isAllowed() {
        return status == Status.ALLOWED;
    }

    public static RateLimitResult allowed(UsageRecord record) {
        return RateLimitResult.builder()
                .status(Status.ALLOWED)
                .record(record)
                .build();
    }

    public static RateLimitResult tooSoon(Duration waitTime) {
        return RateLimitResult.builder()
                .status(Status.TOO_SOON)
                .waitTime(waitTime)
                .reason("Minimum request interval not reached")
                .build();
    }

    public static RateLimitResult quotaExceeded() {
        return RateLimitResult.builder()
                .status(Status.QUOTA_EXCEEDED)
                .reason("Daily request quota exceeded")
                .build();
    }

    public static RateLimitResult promptRequired() {
        return RateLimitResult.builder()
                .status(Status.PROMPT_REQUIRED)
                .reason("Prompt is empty")
                .build();
    }
}
