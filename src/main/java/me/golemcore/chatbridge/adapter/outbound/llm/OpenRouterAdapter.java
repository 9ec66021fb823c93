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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.chatbridge.domain.model.ImageCandidate;
import me.golemcore.chatbridge.domain.model.Message;
import me.golemcore.chatbridge.domain.model.Provider;
import me.golemcore.chatbridge.domain.model.ProviderRequest;
import me.golemcore.chatbridge.domain.model.ProviderResponse;
import me.golemcore.chatbridge.infrastructure.config.BridgeProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * OpenRouter adapter. Same schema as OpenAI plus image generation: the request
 * may carry {@code modalities} and {@code image_config}, and generated images
 * come back in a per-message {@code images} array in addition to (or instead
 * of) the content parts.
 */
@Component
public class OpenRouterAdapter extends ChatCompletionsAdapter {

    private static final String LOCAL_PREFIX = "openrouter:";

    public OpenRouterAdapter(BridgeProperties properties, ProviderHttpClient httpClient,
            ObjectMapper objectMapper) {
        super(properties, httpClient, objectMapper);
    }

    @Override
    public Provider getProvider() {
        return Provider.OPENROUTER;
    }

    @Override
    protected BridgeProperties.ProviderProperties providerProperties() {
        return properties.getProviders().getOpenrouter();
    }

    @Override
    protected String wireModelId(String modelId) {
        return modelId.startsWith(LOCAL_PREFIX) ? modelId.substring(LOCAL_PREFIX.length()) : modelId;
    }

    @Override
    protected void customizeBody(ObjectNode body, RequestOptions options) {
        if (!options.modalities().isEmpty()) {
            ArrayNode modalities = body.putArray("modalities");
            options.modalities().forEach(modalities::add);
        }
        if (isSet(options.aspectRatio()) || isSet(options.imageSize())) {
            ObjectNode imageConfig = body.putObject("image_config");
            if (isSet(options.aspectRatio())) {
                imageConfig.put("aspect_ratio", options.aspectRatio());
            }
            if (isSet(options.imageSize())) {
                imageConfig.put("image_size", options.imageSize());
            }
        }
    }

    @Override
    protected void customizeRequest(ProviderRequest.ProviderRequestBuilder request, List<Message> conversation) {
        BridgeProperties.ProvidersProperties providers = properties.getProviders();
        if (isSet(providers.getOpenrouterReferer())) {
            request.header("HTTP-Referer", providers.getOpenrouterReferer());
        }
        if (isSet(providers.getOpenrouterTitle())) {
            request.header("X-Title", providers.getOpenrouterTitle());
        }
    }

    @Override
    protected void parseSideImages(JsonNode message, ProviderResponse.ProviderResponseBuilder response) {
        JsonNode images = message.path("images");
        if (!images.isArray()) {
            return;
        }
        for (JsonNode entry : images) {
            if (entry.isTextual()) {
                response.sideImage(new ImageCandidate(entry.asText()));
            } else {
                imageUrlOf(entry).ifPresent(url -> response.sideImage(new ImageCandidate(url)));
            }
        }
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
