package me.golemcore.imagebot;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the image bot.
 *
 * <p>
 * A Telegram bot that turns text prompts into images through the OpenAI
 * moderation and image generation APIs, with per-user request interval and
 * daily quota enforced against a restart-durable usage ledger.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → TelegramAdapter, InboundMessageListener
 * Domain Layer       → ConversationService, ImageDispatchService, LedgerUsageRateLimiter
 * Infrastructure     → OpenAI / CSV ledger / local storage adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code bot.*}
 * prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ImageBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImageBotApplication.class, args);
    }

}
