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

package me.golemcore.chatbridge.adapter.outbound.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.chatbridge.domain.model.ProviderError;
import me.golemcore.chatbridge.domain.model.ProviderRequest;
import me.golemcore.chatbridge.infrastructure.config.BridgeProperties;
import me.golemcore.chatbridge.port.outbound.ProviderPort;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared plumbing of the provider adapters: credentials, timeouts, transport
 * and error envelope extraction.
 */
public abstract class AbstractProviderAdapter implements ProviderPort {

    protected final BridgeProperties properties;
    protected final ProviderHttpClient httpClient;
    protected final ObjectMapper objectMapper;

    protected AbstractProviderAdapter(BridgeProperties properties, ProviderHttpClient httpClient,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    protected abstract BridgeProperties.ProviderProperties providerProperties();

    @Override
    public boolean isAvailable() {
        String apiKey = providerProperties().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public JsonNode send(ProviderRequest request) {
        return httpClient.postJson(request);
    }

    protected String apiKey() {
        String apiKey = providerProperties().getApiKey();
        return apiKey != null ? apiKey : "";
    }

    protected Duration resolveTimeout(RequestOptions options) {
        if (options != null && options.timeout() != null) {
            return options.timeout();
        }
        return Duration.ofMillis(properties.getHttp().getRequestTimeout());
    }

    /**
     * Reads an {@code {"error": {...}}} or {@code {"error": "..."}} envelope.
     */
    protected Optional<ProviderError> extractError(JsonNode json) {
        JsonNode error = json.path("error");
        if (error.isTextual()) {
            return Optional.of(ProviderError.of(error.asText()));
        }
        if (!error.isObject()) {
            return Optional.empty();
        }
        return Optional.of(new ProviderError(
                textOrNull(error.path("message")),
                textOrNull(error.path("type")),
                textOrNull(error.path("code"))));
    }

    protected static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
