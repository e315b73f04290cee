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
import me.golemcore.imagebot.domain.model.UsageRecord;
import me.golemcore.imagebot.infrastructure.config.BotProperties;
import me.golemcore.imagebot.port.outbound.UsageLedgerPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Usage rate limiter backed by the usage ledger.
 *
 * <p>
 * Limits come from {@code bot.limits.*}:
 * <ul>
 * <li><b>min-request-interval</b> - minimum gap between two accepted requests
 * of one identity (default 60s)</li>
 * <li><b>max-requests-per-day</b> - daily quota; a request is rejected once
 * the day's count exceeds it (default 5)</li>
 * </ul>
 *
 * <p>
 * Read, decide and append run under one global lock, so two concurrent
 * requests of the same identity can never both pass. Nothing network-bound
 * happens while the lock is held.
 *
 * @since 1.0
 * @see UsageLedgerPort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerUsageRateLimiter implements UsageRateLimiter {

    private final UsageLedgerPort ledger;
    private final BotProperties properties;

    private final ReentrantLock admissionLock = new ReentrantLock();

    @Override
    public RateLimitResult tryAcquire(long identity, String prompt, boolean groupChat, Instant now) {
        BotProperties.LimitsProperties limits = properties.getLimits();

        admissionLock.lock();
        try {
            Duration gap = ledger.timeSinceLast(identity, now);
            if (gap.compareTo(limits.getMinRequestInterval()) < 0) {
                Duration wait = limits.getMinRequestInterval().minus(gap);
                RateLimitResult result = RateLimitResult.tooSoon(wait);
                log.debug("[Admission] {}: identity={}, wait={}", result.getReason(), identity, wait);
                return result;
            }

            long count = ledger.countSince(identity, startOfDay(now, limits.resolveZone()));
            if (count > limits.getMaxRequestsPerDay()) {
                RateLimitResult result = RateLimitResult.quotaExceeded();
                log.debug("[Admission] {}: identity={}, count={}", result.getReason(), identity, count);
                return result;
            }

            if (prompt == null || prompt.isBlank()) {
                RateLimitResult result = RateLimitResult.promptRequired();
                log.debug("[Admission] {}: identity={}", result.getReason(), identity);
                return result;
            }

            UsageRecord entry = UsageRecord.builder()
                    .group(groupChat)
                    .timestamp(now)
                    .prompt(prompt)
                    .size(limits.getDefaultSize())
                    .identity(identity)
                    .build();
            ledger.record(entry);
            log.debug("[Admission] Admitted: identity={}, todayBefore={}", identity, count);
            return RateLimitResult.allowed(entry);
        } finally {
            admissionLock.unlock();
        }
    }

    static Instant startOfDay(Instant now, ZoneId zone) {
        return now.atZone(zone).toLocalDate().atStartOfDay(zone).toInstant();
    }
}
