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
import java.util.Objects;
import java.util.Optional;

/**
 * Provider plus the model id sent on the wire. For OpenRouter the model id
 * never contains the local {@code openrouter:} namespace prefix.
 */
public record ModelSelector(Provider provider, String modelId) {

    public ModelSelector {
        Objects.requireNonNull(provider, "provider");
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("Model id is required");
        }
    }

    /**
     * Parses {@code provider:model}. Strings without a known provider prefix are
     * classified by model name.
     */
    public static ModelSelector parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Model is required");
        }
        String trimmed = value.trim();
        int colon = trimmed.indexOf(':');
        if (colon > 0) {
            Optional<Provider> provider = Provider.fromId(trimmed.substring(0, colon));
            if (provider.isPresent()) {
                return new ModelSelector(provider.get(), trimmed.substring(colon + 1));
            }
        }
        return new ModelSelector(inferProvider(trimmed), trimmed);
    }

    static Provider inferProvider(String modelId) {
        String lower = modelId.toLowerCase(Locale.ROOT);
        if (lower.startsWith("claude")) {
            return Provider.ANTHROPIC;
        }
        if (lower.contains("/")) {
            return Provider.OPENROUTER;
        }
        if (lower.startsWith("llama") || lower.startsWith("mixtral") || lower.startsWith("gemma")) {
            return Provider.GROQ;
        }
        return Provider.OPENAI;
    }

    /**
     * Qualified form, e.g. {@code openrouter:google/gemini-2.5-flash-image}.
     */
    public String qualifiedName() {
        return provider.id() + ":" + modelId;
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
