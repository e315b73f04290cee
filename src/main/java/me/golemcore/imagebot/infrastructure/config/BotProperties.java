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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All bot configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link TelegramProperties} - Telegram transport</li>
 * <li>{@link OperatorProperties} - operator (audit) chat</li>
 * <li>{@link ProviderProperties} - OpenAI moderation and image API</li>
 * <li>{@link LimitsProperties} - per-user request interval and daily
 * quota</li>
 * <li>{@link StorageProperties} and {@link LedgerProperties} - where the usage
 * ledger lives</li>
 * </ul>
 *
 * <p>
 * Values are fixed at startup; nothing here is mutable at runtime.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private TelegramProperties telegram = new TelegramProperties();
    private OperatorProperties operator = new OperatorProperties();
    private ProviderProperties provider = new ProviderProperties();
    private LimitsProperties limits = new LimitsProperties();
    private IdentityProperties identity = new IdentityProperties();
    private StorageProperties storage = new StorageProperties();
    private LedgerProperties ledger = new LedgerProperties();
    private DispatchProperties dispatch = new DispatchProperties();
    private HttpProperties http = new HttpProperties();
    private String language = "en";

    @Data
    public static class TelegramProperties {
        private boolean enabled = true;
        private String token;
    }

    @Data
    public static class OperatorProperties {
        private String chatId;
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl = "https://api.openai.com";
        private String imageModel = "dall-e-2";
        private String moderationModel;
        private int maxAttempts = 3;
        private Duration retryBackoff = Duration.ofSeconds(1);
    }

    @Data
    public static class LimitsProperties {
        private Duration minRequestInterval = Duration.ofSeconds(60);
        private int maxRequestsPerDay = 5;
        private int defaultSize = 256;
        private String timezone;

        /**
         * Zone that defines "today" for the daily quota. Falls back to the system
         * default when unset.
         */
        public ZoneId resolveZone() {
            if (timezone == null || timezone.isBlank()) {
                return ZoneId.systemDefault();
            }
            return ZoneId.of(timezone);
        }
    }

    @Data
    public static class IdentityProperties {
        private String salt = "";
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/image-bot";
    }

    @Data
    public static class LedgerProperties {
        private String directory = "logs";
        private String file = "image_bot_requests.csv";
    }

    @Data
    public static class DispatchProperties {
        private int threads = 4;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 120000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
