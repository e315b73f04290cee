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

import java.util.List;

/**
 * Port for the external moderation and image generation provider.
 *
 * <p>
 * Both operations block until the provider answers. A request the provider
 * refuses as invalid or rate limited surfaces as
 * {@link ProviderRequestRejectedException}; any other failure is thrown as an
 * unchecked exception and is fatal for the request.
 */
public interface ImageGenerationPort {

    /**
     * Runs the provider's content moderation on {@code text}.
     */
    ModerationResult checkModeration(String text);

    /**
     * Generates one square image of {@code size} pixels. {@code identity} is the
     * hashed requester id, forwarded to the provider for abuse tracking.
     */
    GeneratedImage generateImage(String prompt, int size, long identity);

    /**
     * Moderation verdict. {@code categories} lists the flagged category names.
     */
    record ModerationResult(boolean flagged, List<String> categories) {

        public static ModerationResult clean() {
            return new ModerationResult(false, List.of());
        }
    }

    /**
     * Generated image, referenced by a provider-hosted URL.
     */
    record GeneratedImage(String url) {
    }
}
