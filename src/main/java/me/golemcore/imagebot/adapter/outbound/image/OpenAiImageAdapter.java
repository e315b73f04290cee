package me.golemcore.imagebot.adapter.outbound.image;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.imagebot.infrastructure.config.BotProperties;
import me.golemcore.imagebot.port.outbound.ImageGenerationPort;
import me.golemcore.imagebot.port.outbound.ProviderRequestRejectedException;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * OpenAI adapter for content moderation and DALL-E image generation.
 *
 * <p>
 * Calls are blocking and run on the dispatch pool. Transient server errors
 * (500, 502, 503) are retried with exponential backoff; 400/404/409/415 and
 * 429 are reported as {@link ProviderRequestRejectedException} with the
 * provider's own message. Everything else fails the request.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpenAiImageAdapter implements ImageGenerationPort {

    private static final String MODERATIONS_PATH = "/v1/moderations";
    private static final String GENERATIONS_PATH = "/v1/images/generations";
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient okHttpClient;
    private final BotProperties properties;
    private final ObjectMapper objectMapper;

    @PostConstruct
    void init() {
        BotProperties.ProviderProperties provider = properties.getProvider();
        boolean hasApiKey = provider.getApiKey() != null && !provider.getApiKey().isBlank();
        if (!hasApiKey) {
            log.warn("[OpenAI] API key is NOT configured, image requests will fail. Set OPENAI_API_KEY env var.");
        }
        log.info("[OpenAI] Adapter initialized: baseUrl={}, imageModel={}, apiKeyConfigured={}",
                provider.getBaseUrl(), provider.getImageModel(), hasApiKey);
    }

    @Override
    public ModerationResult checkModeration(String text) {
        BotProperties.ProviderProperties provider = properties.getProvider();
        ModerationRequest payload = new ModerationRequest(text, blankToNull(provider.getModerationModel()));

        ModerationResponse response = readBody(post(MODERATIONS_PATH, payload, "moderation"),
                ModerationResponse.class, "moderation");
        if (response.getResults() == null || response.getResults().isEmpty()) {
            throw new IllegalStateException("OpenAI moderation returned no results");
        }

        ModerationEntry entry = response.getResults().get(0);
        List<String> flaggedCategories = new ArrayList<>();
        if (entry.getCategories() != null) {
            entry.getCategories().forEach((name, flagged) -> {
                if (Boolean.TRUE.equals(flagged)) {
                    flaggedCategories.add(name);
                }
            });
        }
        log.debug("[OpenAI] Moderation verdict: flagged={}, categories={}", entry.isFlagged(), flaggedCategories);
        return new ModerationResult(entry.isFlagged(), List.copyOf(flaggedCategories));
    }

    @Override
    public GeneratedImage generateImage(String prompt, int size, long identity) {
        BotProperties.ProviderProperties provider = properties.getProvider();
        GenerationRequest payload = new GenerationRequest(provider.getImageModel(), prompt, 1,
                size + "x" + size, Long.toString(identity));

        GenerationResponse response = readBody(post(GENERATIONS_PATH, payload, "generation"),
                GenerationResponse.class, "generation");
        if (response.getData() == null || response.getData().isEmpty()
                || response.getData().get(0).getUrl() == null) {
            throw new IllegalStateException("OpenAI generation returned no image");
        }
        return new GeneratedImage(response.getData().get(0).getUrl());
    }

    private <T> T readBody(String body, Class<T> type, String operation) {
        try {
            return objectMapper.readValue(body, type);
        } catch (IOException e) {
            throw new IllegalStateException("OpenAI " + operation + " returned malformed body", e);
        }
    }

    @SuppressWarnings("PMD.CloseResource") // ResponseBody is closed when Response is closed in try-with-resources
    private String post(String path, Object payload, String operation) {
        BotProperties.ProviderProperties provider = properties.getProvider();
        String apiKey = requireApiKey(provider);
        int maxAttempts = Math.max(1, provider.getMaxAttempts());

        try {
            Request request = new Request.Builder()
                    .url(getBaseUrl() + path)
                    .header("Authorization", "Bearer " + apiKey)
                    .header("Content-Type", "application/json")
                    .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                    .build();

            long startTime = System.currentTimeMillis();
            int attempt = 0;

            while (attempt < maxAttempts) {
                try (Response response = okHttpClient.newCall(request).execute()) {
                    long elapsed = System.currentTimeMillis() - startTime;
                    ResponseBody body = response.body();

                    if (!response.isSuccessful()) {
                        if (isRetryableError(response.code()) && attempt < maxAttempts - 1) {
                            attempt++;
                            long backoffMs = provider.getRetryBackoff().toMillis() * (long) Math.pow(2, attempt - 1);
                            log.info("[OpenAI] {} retrying after {} (attempt {}/{}), backoff={}ms",
                                    operation, response.code(), attempt, maxAttempts, backoffMs);
                            Thread.sleep(backoffMs);
                            continue;
                        }
                        handleErrorResponse(response, body, elapsed, operation);
                    }

                    if (body == null) {
                        throw new IllegalStateException("OpenAI " + operation + " returned empty body");
                    }
                    log.debug("[OpenAI] {} succeeded in {}ms", operation, elapsed);
                    return body.string();
                }
            }
            throw new IllegalStateException("OpenAI " + operation + " failed after " + maxAttempts + " attempts");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("OpenAI " + operation + " interrupted", e);
        } catch (IOException e) {
            log.error("[OpenAI] {} network error: {}", operation, e.getMessage(), e);
            throw new UncheckedIOException("OpenAI " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private String requireApiKey(BotProperties.ProviderProperties provider) {
        String apiKey = provider.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[OpenAI] Request rejected: API key not configured");
            throw new IllegalStateException("OpenAI API key not configured");
        }
        return apiKey;
    }

    protected String getBaseUrl() {
        String baseUrl = properties.getProvider().getBaseUrl();
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    private boolean isRetryableError(int code) {
        return code == 500 || code == 502 || code == 503;
    }

    private boolean isInvalidRequest(int code) {
        return code == 400 || code == 404 || code == 409 || code == 415;
    }

    private void handleErrorResponse(Response response, ResponseBody body, long elapsed, String operation)
            throws IOException {
        int code = response.code();
        String errorBody = body != null ? body.string() : "";
        String errorMessage = extractErrorMessage(errorBody);

        log.warn("[OpenAI] {} failed: HTTP {} in {}ms: {}", operation, code, elapsed, errorMessage);

        if (isInvalidRequest(code)) {
            throw new ProviderRequestRejectedException(ProviderRequestRejectedException.Reason.INVALID_REQUEST,
                    code, errorMessage);
        }
        if (code == 429) {
            throw new ProviderRequestRejectedException(ProviderRequestRejectedException.Reason.RATE_LIMITED,
                    code, errorMessage);
        }
        throw new IllegalStateException(
                String.format("OpenAI %s error (HTTP %d): %s", operation, code, errorMessage));
    }

    private String extractErrorMessage(String errorBody) {
        try {
            ErrorResponse errorResponse = objectMapper.readValue(errorBody, ErrorResponse.class);
            if (errorResponse.getError() != null && errorResponse.getError().getMessage() != null) {
                return errorResponse.getError().getMessage();
            }
        } catch (IOException e) {
            log.debug("[OpenAI] Could not parse error response: {}", errorBody);
        }
        return errorBody.isBlank() ? "Unknown error" : errorBody;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ModerationRequest(String input, String model) {
    }

    record GenerationRequest(String model, String prompt, int n, String size, String user) {
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ModerationResponse {
        private List<ModerationEntry> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ModerationEntry {
        private boolean flagged;
        private Map<String, Boolean> categories;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GenerationResponse {
        private List<ImageData> data;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ImageData {
        private String url;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ErrorResponse {
        private ErrorDetail error;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ErrorDetail {
        private String message;
        private String type;
        private String code;
    }
}
