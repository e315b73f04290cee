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

/**
 * The provider refused the request as invalid or rate limited. The message is
 * the provider's own text and is safe to show to the requester.
 */
public class ProviderRequestRejectedException extends IllegalStateException {

    public enum Reason {
        INVALID_REQUEST, RATE_LIMITED
    }

    private final Reason reason;
    private final int statusCode;

    public ProviderRequestRejectedException(Reason reason, int statusCode, String message) {
        super(message);
        this.reason = reason;
        this.statusCode = statusCode;
    }

    public Reason getReason() {
        return reason;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
