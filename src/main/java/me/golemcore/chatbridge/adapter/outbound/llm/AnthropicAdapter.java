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
import me.golemcore.chatbridge.domain.model.ContentPart;
import me.golemcore.chatbridge.domain.model.ExchangeFailureKind;
import me.golemcore.chatbridge.domain.model.ImagePayload;
import me.golemcore.chatbridge.domain.model.Message;
import me.golemcore.chatbridge.domain.model.Provider;
import me.golemcore.chatbridge.domain.model.ProviderCallException;
import me.golemcore.chatbridge.domain.model.ProviderError;
import me.golemcore.chatbridge.domain.model.ProviderRequest;
import me.golemcore.chatbridge.domain.model.ProviderResponse;
import me.golemcore.chatbridge.domain.model.Role;
import me.golemcore.chatbridge.infrastructure.config.BridgeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Anthropic Messages API adapter.
 *
 * <p>
 * System messages are joined into the top-level {@code system} field. Images
 * are sent as base64 sources only, so remote image URLs are downloaded before
 * the request is built; an image that cannot be fetched is left out and the
 * rest of the message is still sent. Usage is
 * {@code usage.input_tokens + usage.output_tokens}.
 */
@Component
@Slf4j
public class AnthropicAdapter extends AbstractProviderAdapter {

    private final RemoteImageFetcher imageFetcher;

    public AnthropicAdapter(BridgeProperties properties, ProviderHttpClient httpClient, ObjectMapper objectMapper,
            RemoteImageFetcher imageFetcher) {
        super(properties, httpClient, objectMapper);
        this.imageFetcher = imageFetcher;
    }

    @Override
    public Provider getProvider() {
        return Provider.ANTHROPIC;
    }

    @Override
    protected BridgeProperties.ProviderProperties providerProperties() {
        return properties.getProviders().getAnthropic();
    }

    @Override
    public ProviderRequest buildRequest(List<Message> conversation, String modelId, int maxTokens,
            RequestOptions options) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", modelId);
        body.put("max_tokens", maxTokens);

        StringBuilder system = new StringBuilder();
        ArrayNode messages = objectMapper.createArrayNode();
        for (Message message : conversation) {
            if (message.isSystemMessage()) {
                if (system.length() > 0) {
                    system.append("\n\n");
                }
                system.append(message.getText());
                continue;
            }
            ArrayNode content = toContentBlocks(message);
            if (content.isEmpty()) {
                log.debug("[LLM] Skipping {} message with no sendable content", message.getRole().wireName());
                continue;
            }
            ObjectNode node = messages.addObject();
            node.put("role", message.getRole().wireName());
            node.set("content", content);
        }
        if (system.length() > 0) {
            body.put("system", system.toString());
        }
        body.set("messages", messages);

        return ProviderRequest.builder()
                .provider(Provider.ANTHROPIC)
                .url(providerProperties().getUrl())
                .header("x-api-key", apiKey())
                .header("anthropic-version", properties.getProviders().getAnthropicVersion())
                .header("Content-Type", "application/json")
                .body(body)
                .timeout(resolveTimeout(options))
                .build();
    }

    private ArrayNode toContentBlocks(Message message) {
        ArrayNode content = objectMapper.createArrayNode();
        boolean imagesAllowed = message.getRole() == Role.USER;
        for (ContentPart part : message.getContent()) {
            if (part instanceof ContentPart.Text text) {
                if (!text.value().isEmpty()) {
                    content.addObject().put("type", "text").put("text", text.value());
                }
            } else if (part instanceof ContentPart.Image image && imagesAllowed) {
                addImageBlock(content, image.payload());
            } else if (part instanceof ContentPart.RemoteImage remote && imagesAllowed) {
                Optional<ImagePayload> fetched = imageFetcher.fetch(remote.url());
                if (fetched.isPresent()) {
                    addImageBlock(content, fetched.get());
                } else {
                    log.warn("[LLM] Omitting image {} from Anthropic request", remote.url());
                }
            }
        }
        return content;
    }

    private static void addImageBlock(ArrayNode content, ImagePayload image) {
        ObjectNode block = content.addObject();
        block.put("type", "image");
        ObjectNode source = block.putObject("source");
        source.put("type", "base64");
        source.put("media_type", image.mimeType());
        source.put("data", image.toBase64());
    }

    @Override
    public ProviderResponse parseResponse(JsonNode json) {
        Optional<ProviderError> error = extractError(json);
        if (error.isPresent()) {
            log.warn("[LLM] Anthropic returned error: {}", error.get().message());
            return ProviderResponse.failed(error.get());
        }

        JsonNode content = json.path("content");
        if (!content.isArray()) {
            throw new ProviderCallException(ExchangeFailureKind.SCHEMA, "Response has no content array");
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode block : content) {
            if ("text".equals(block.path("type").asText("text")) && block.path("text").isTextual()) {
                text.append(block.path("text").asText());
            }
        }

        JsonNode usage = json.path("usage");
        long tokens = usage.path("input_tokens").asLong(0) + usage.path("output_tokens").asLong(0);
        return ProviderResponse.builder()
                .text(text.toString())
                .usageTokens(tokens)
                .build();
    }
}
