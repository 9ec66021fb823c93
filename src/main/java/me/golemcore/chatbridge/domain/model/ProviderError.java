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

package me.golemcore.chatbridge.domain.model;

/**
 * Structured error envelope returned by a backend ({@code {"error": {...}}}).
 * Type and code are optional; an envelope without a message is described by
 * its type, then its code.
 */
public record ProviderError(String message, String type, String code) {

    public ProviderError {
        if (message == null || message.isBlank()) {
            if (type != null && !type.isBlank()) {
                message = type;
            } else if (code != null && !code.isBlank()) {
                message = "Error code " + code;
            } else {
                message = "Unknown error";
            }
        }
    }

    public static ProviderError of(String message) {
        return new ProviderError(message, null, null);
    }
}
