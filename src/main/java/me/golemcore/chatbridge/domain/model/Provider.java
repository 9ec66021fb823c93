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

import java.util.Locale;
import java.util.Optional;

/**
 * Supported model backends.
 */
public enum Provider {
    OPENAI, ANTHROPIC, GROQ, OPENROUTER;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Provider> fromId(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        for (Provider provider : values()) {
            if (provider.id().equalsIgnoreCase(id.trim())) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }
}
