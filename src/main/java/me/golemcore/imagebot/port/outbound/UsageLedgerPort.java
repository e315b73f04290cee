package me.golemcore.imagebot.port.outbound;

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

import me.golemcore.imagebot.domain.model.UsageRecord;

import java.time.Duration;
import java.time.Instant;

/**
 * Append-only, restart-durable record of accepted image requests.
 *
 * <p>
 * The ledger answers the two questions admission control asks about an
 * identity: how long ago its last accepted request was, and how many requests
 * it made since a given instant. Records are never mutated or removed.
 *
 * @since 1.0
 * @see me.golemcore.imagebot.ratelimit.UsageRateLimiter
 */
public interface UsageLedgerPort {

    /**
     * "Last request" of an identity that has none. Far enough in the past that
     * the resulting gap passes any realistic minimum interval.
     */
    Instant NO_PREVIOUS_REQUEST = Instant.parse("2022-01-01T00:00:00Z");

    /**
     * Appends a record and durably persists the whole ledger before returning.
     *
     * @throws LedgerPersistenceException
     *             if the ledger could not be written; the record still counts
     *             in memory
     */
    void record(UsageRecord entry);

    /**
     * {@code now} minus the latest timestamp recorded for {@code identity}, or
     * minus {@link #NO_PREVIOUS_REQUEST} when there is none.
     */
    Duration timeSinceLast(long identity, Instant now);

    /**
     * Number of records of {@code identity} with {@code timestamp >= reference}.
     */
    long countSince(long identity, Instant reference);

    /**
     * Total number of records.
     */
    int size();
}
