package me.golemcore.imagebot.infrastructure.config;

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

import me.golemcore.imagebot.infrastructure.i18n.MessageService;
import me.golemcore.imagebot.port.inbound.ChannelPort;
import me.golemcore.imagebot.port.outbound.UsageLedgerPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration that wires shared beans and starts the bot on
 * application startup.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the {@link Clock}, JSON and CSV mappers</li>
 * <li>Provides the dispatch pool that runs request cycles off the polling
 * thread</li>
 * <li>Logs startup information and auto-starts enabled channels</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BotProperties properties;
    private final List<ChannelPort> channelPorts;
    private final MessageService messageService;
    private final UsageLedgerPort usageLedger;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @Primary
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public static CsvMapper csvMapper() {
        CsvMapper mapper = new CsvMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean(name = "dispatchExecutor", destroyMethod = "shutdown")
    public ExecutorService dispatchExecutor() {
        int threads = Math.max(1, properties.getDispatch().getThreads());
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "image-dispatch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void init() {
        messageService.setLanguage(properties.getLanguage());
        BotProperties.LimitsProperties limits = properties.getLimits();
        log.info("Image bot starting...");
        log.info("Limits: interval={}, maxPerDay={}, size={}, zone={}", limits.getMinRequestInterval(),
                limits.getMaxRequestsPerDay(), limits.getDefaultSize(), limits.resolveZone());
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());
        log.info("Usage ledger: {} records", usageLedger.size());

        // Auto-start enabled channels
        for (ChannelPort channel : channelPorts) {
            String channelType = channel.getChannelType();
            boolean enabled = "telegram".equals(channelType) && properties.getTelegram().isEnabled();
            if (enabled) {
                log.info("Starting channel: {}", channelType);
                channel.start();
            }
        }

        log.info("Image bot started successfully");
    }
}
