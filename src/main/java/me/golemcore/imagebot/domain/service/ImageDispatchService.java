package me.golemcore.imagebot.domain.service;

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

import me.golemcore.imagebot.domain.model.DispatchOutcome;
import me.golemcore.imagebot.domain.model.Message;
import me.golemcore.imagebot.domain.model.RateLimitResult;
import me.golemcore.imagebot.infrastructure.config.BotProperties;
import me.golemcore.imagebot.infrastructure.i18n.MessageService;
import me.golemcore.imagebot.port.inbound.ChannelPort;
import me.golemcore.imagebot.port.outbound.ImageGenerationPort;
import me.golemcore.imagebot.port.outbound.ProviderRequestRejectedException;
import me.golemcore.imagebot.ratelimit.UsageRateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Runs one admit-and-dispatch cycle for an image request.
 *
 * <p>
 * Admission (interval, daily quota, prompt presence and the ledger append) is
 * delegated to {@link UsageRateLimiter}. An admitted prompt goes through
 * provider moderation and then generation; the result is delivered to the
 * requester and copied to the operator chat. Rejections are answered with a
 * localized message and never reach the provider.
 *
 * <p>
 * Ledger persistence failures and unclassified provider errors propagate to
 * the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImageDispatchService {

    private final UsageRateLimiter rateLimiter;
    private final ImageGenerationPort imagePort;
    private final ChannelPort channelPort;
    private final OperatorNotificationService operatorNotifications;
    private final MessageService messageService;
    private final BotProperties properties;

    /**
     * @param identity
     *            hashed requester id
     * @param prompt
     *            raw prompt text, may be {@code null} or blank
     * @param origin
     *            message the request came from; supplies the reply chat and the
     *            group flag
     * @param now
     *            request time
     */
    public DispatchOutcome admitAndDispatch(long identity, String prompt, Message origin, Instant now) {
        String trimmed = prompt != null ? prompt.trim() : "";
        String chatId = origin.getChatId();
        BotProperties.LimitsProperties limits = properties.getLimits();

        RateLimitResult admission = rateLimiter.tryAcquire(identity, trimmed, origin.isGroupChat(), now);
        switch (admission.getStatus()) {
        case TOO_SOON -> {
            reply(chatId, messageService.getMessage("admission.too-soon",
                    String.valueOf(limits.getMinRequestInterval().toSeconds()),
                    String.valueOf(ceilSeconds(admission.getWaitTime()))));
            return DispatchOutcome.tooSoon(admission.getWaitTime());
        }
        case QUOTA_EXCEEDED -> {
            reply(chatId, messageService.getMessage("admission.quota-exceeded",
                    String.valueOf(limits.getMaxRequestsPerDay())));
            return DispatchOutcome.quotaExceeded();
        }
        case PROMPT_REQUIRED -> {
            reply(chatId, messageService.getMessage("conversation.prompt.request"));
            return DispatchOutcome.promptRequired();
        }
        case ALLOWED -> log.debug("[Dispatch] Admitted request: identity={}, prompt={}", identity, trimmed);
        }

        channelPort.showTyping(chatId);
        try {
            ImageGenerationPort.ModerationResult moderation = imagePort.checkModeration(trimmed);
            if (moderation.flagged()) {
                log.info("[Dispatch] Prompt blocked by moderation: categories={}", moderation.categories());
                reply(chatId, messageService.getMessage("dispatch.blocked"));
                operatorNotifications.sendText(messageService.getMessage("dispatch.operator.blocked", trimmed))
                        .join();
                return DispatchOutcome.blocked(trimmed);
            }

            ImageGenerationPort.GeneratedImage image = imagePort.generateImage(trimmed, limits.getDefaultSize(),
                    identity);
            String operatorCaption = messageService.getMessage(
                    origin.isGroupChat() ? "dispatch.caption.group" : "dispatch.caption.single", trimmed);
            CompletableFuture.allOf(
                    channelPort.sendPhoto(chatId, image.url(), trimmed),
                    operatorNotifications.sendPhoto(image.url(), operatorCaption))
                    .join();
            log.info("[Dispatch] Image delivered (group={})", origin.isGroupChat());
            return DispatchOutcome.delivered(image.url(), trimmed);
        } catch (ProviderRequestRejectedException e) {
            log.warn("[Dispatch] Provider rejected request: reason={}, status={}, message={}", e.getReason(),
                    e.getStatusCode(), e.getMessage());
            reply(chatId, e.getMessage());
            operatorNotifications.sendText(trimmed + "\n" + e.getMessage()).join();
            return DispatchOutcome.providerError(e.getMessage());
        }
    }

    private void reply(String chatId, String text) {
        channelPort.sendMessage(chatId, text).join();
    }

    static long ceilSeconds(Duration duration) {
        long seconds = duration.getSeconds();
        return duration.getNano() > 0 ? seconds + 1 : seconds;
    }
}
