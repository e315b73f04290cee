package me.golemcore.imagebot.adapter.outbound.ledger;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.imagebot.domain.model.UsageRecord;
import me.golemcore.imagebot.infrastructure.config.BotProperties;
import me.golemcore.imagebot.port.outbound.LedgerPersistenceException;
import me.golemcore.imagebot.port.outbound.StoragePort;
import me.golemcore.imagebot.port.outbound.UsageLedgerPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * CSV-file implementation of {@link UsageLedgerPort}.
 *
 * <p>
 * Features:
 * <ul>
 * <li>All records are held in memory; queries never touch the disk</li>
 * <li>Every append rewrites the whole file through
 * {@link StoragePort#putTextAtomic} (fsync + atomic rename, previous version
 * kept as {@code .bak}) before returning</li>
 * <li>Loads the file on startup; a missing or unreadable file yields an empty
 * ledger instead of a startup failure</li>
 * </ul>
 *
 * <p>
 * File layout: header {@code is_group,timestamp,prompt,size,identity}, one
 * row per accepted request, ISO-8601 instants at full precision, RFC 4180
 * quoting for prompts.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class CsvUsageLedgerAdapter implements UsageLedgerPort {

    private static final String LOG_PREFIX = "[Ledger]";

    private final StoragePort storagePort;
    private final CsvMapper csvMapper;
    private final BotProperties properties;
    private final CsvSchema schema;

    private final List<UsageRecord> records = new ArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public CsvUsageLedgerAdapter(StoragePort storagePort, CsvMapper csvMapper, BotProperties properties) {
        this.storagePort = storagePort;
        this.csvMapper = csvMapper;
        this.properties = properties;
        this.schema = csvMapper.schemaFor(UsageRecord.class).withHeader();
    }

    @PostConstruct
    public void init() {
        String directory = properties.getLedger().getDirectory();
        String file = properties.getLedger().getFile();

        lock.writeLock().lock();
        try {
            records.clear();
            records.addAll(loadRecords(directory, file));
        } finally {
            lock.writeLock().unlock();
        }
    }

    private List<UsageRecord> loadRecords(String directory, String file) {
        try {
            String content = storagePort.getText(directory, file).join();
            if (content == null) {
                log.info("{} No ledger at {}/{}, starting empty", LOG_PREFIX, directory, file);
                ensureDirectory(directory);
                return List.of();
            }
            List<UsageRecord> loaded = parse(content);
            log.info("{} Loaded {} usage records from {}/{}", LOG_PREFIX, loaded.size(), directory, file);
            return loaded;
        } catch (IOException | RuntimeException e) {
            log.warn("{} Failed to read ledger {}/{}, starting empty: {}", LOG_PREFIX, directory, file,
                    e.getMessage());
            ensureDirectory(directory);
            return List.of();
        }
    }

    private void ensureDirectory(String directory) {
        try {
            storagePort.ensureDirectory(directory).join();
        } catch (RuntimeException e) {
            log.warn("{} Failed to create ledger directory {}: {}", LOG_PREFIX, directory, e.getMessage());
        }
    }

    private List<UsageRecord> parse(String content) throws IOException {
        if (content.isBlank()) {
            return List.of();
        }
        try (MappingIterator<UsageRecord> rows = csvMapper.readerFor(UsageRecord.class)
                .with(schema.withColumnReordering(true))
                .readValues(content)) {
            return rows.readAll();
        }
    }

    @Override
    public void record(UsageRecord entry) {
        Objects.requireNonNull(entry, "entry");
        lock.writeLock().lock();
        try {
            // Stays counted even if the write below fails
            records.add(entry);
            persist();
            log.debug("{} Recorded request: identity={}, size={}, group={}", LOG_PREFIX,
                    entry.getIdentity(), entry.getSize(), entry.isGroup());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void persist() {
        String directory = properties.getLedger().getDirectory();
        String file = properties.getLedger().getFile();
        try {
            String csv = csvMapper.writer(schema).writeValueAsString(records);
            storagePort.putTextAtomic(directory, file, csv, true).join();
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("{} Failed to persist ledger {}/{} ({} records)", LOG_PREFIX, directory, file,
                    records.size(), e);
            throw new LedgerPersistenceException("Failed to persist usage ledger " + directory + "/" + file, e);
        }
    }

    @Override
    public Duration timeSinceLast(long identity, Instant now) {
        Instant last = lastTimestamp(identity).orElse(NO_PREVIOUS_REQUEST);
        return Duration.between(last, now);
    }

    private Optional<Instant> lastTimestamp(long identity) {
        lock.readLock().lock();
        try {
            return records.stream()
                    .filter(r -> r.getIdentity() == identity)
                    .map(UsageRecord::getTimestamp)
                    .filter(Objects::nonNull)
                    .max(Comparator.naturalOrder());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long countSince(long identity, Instant reference) {
        lock.readLock().lock();
        try {
            return records.stream()
                    .filter(r -> r.getIdentity() == identity)
                    .filter(r -> r.getTimestamp() != null && !r.getTimestamp().isBefore(reference))
                    .count();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
