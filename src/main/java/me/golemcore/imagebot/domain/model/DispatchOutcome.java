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
import lombok.Value;

import java.time.Duration;

/**
 * Outcome of a single admit-and-dispatch cycle.
 *
 * <p>
 * Only the fields relevant to the {@link Kind} are set: {@code retryAfter} for
 * {@link Kind#TOO_SOON}, {@code prompt} for {@link Kind#BLOCKED} and
 * {@link Kind#DELIVERED}, {@code imageUrl} for {@link Kind#DELIVERED},
 * {@code message} for {@link Kind#PROVIDER_ERROR} and
 * {@link Kind#INTERNAL_ERROR}.
 */
@Value
@Builder
public class DispatchOutcome {

    public enum Kind {
        TOO_SOON, QUOTA_EXCEEDED, PROMPT_REQUIRED, BLOCKED, PROVIDER_ERROR, DELIVERED, INTERNAL_ERROR
    }

    Kind kind;
    Duration retryAfter;
    String prompt;
    String imageUrl;
    String message;

    public static DispatchOutcome tooSoon(Duration retryAfter) {
        return DispatchOutcome.builder().kind(Kind.TOO_SOON).retryAfter(retryAfter).build();
    }

    public static DispatchOutcome quotaExceeded() {
        return DispatchOutcome.builder().kind(Kind.QUOTA_EXCEEDED).build();
    }

    public static DispatchOutcome promptRequired() {
        return DispatchOutcome.builder().kind(Kind.PROMPT_REQUIRED).build();
    }

    public static DispatchOutcome blocked(String prompt) {
        return DispatchOutcome.builder().kind(Kind.BLOCKED).prompt(prompt).build();
    }

    public static DispatchOutcome providerError(String message) {
        return DispatchOutcome.builder().kind(Kind.PROVIDER_ERROR).message(message).build();
    }

    public static DispatchOutcome delivered(String imageUrl, String prompt) {
        return DispatchOutcome.builder().kind(Kind.DELIVERED).imageUrl(imageUrl).prompt(prompt).build();
    }

    public static DispatchOutcome internalError(String message) {
        return DispatchOutcome.builder().kind(Kind.INTERNAL_ERROR).message(message).build();
    }
}
