package me.golemcore.imagebot.ratelimit;

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

import me.golemcore.imagebot.domain.model.RateLimitResult;

import java.time.Instant;

/**
 * Per-identity admission control for image requests.
 *
 * <p>
 * Checks, in order:
 * <ul>
 * <li>Interval - time since the identity's last accepted request</li>
 * <li>Quota - requests since the start of the current day</li>
 * <li>Prompt - a non-blank prompt is required</li>
 * </ul>
 *
 * <p>
 * An admitted request is appended to the usage ledger before
 * {@link #tryAcquire} returns, so it counts against every later check.
 *
 * @since 1.0
 * @see LedgerUsageRateLimiter
 */
public interface UsageRateLimiter {

    /**
     * Check the limits for {@code identity} and, if they pass, record the request.
     *
     * @param identity
     *            hashed requester id
     * @param prompt
     *            trimmed prompt, may be empty
     * @param groupChat
     *            whether the request came from a group chat
     * @param now
     *            request time
     * @throws me.golemcore.imagebot.port.outbound.LedgerPersistenceException
     *             if the admitted request could not be persisted
     */
    RateLimitResult tryAcquire(long identity, String prompt, boolean groupChat, Instant now);
}
