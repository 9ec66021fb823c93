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
import me.golemcore.chatbridge.domain.model.ImageCandidate;
import me.golemcore.chatbridge.domain.model.Message;
import me.golemcore.chatbridge.domain.model.ProviderCallException;
import me.golemcore.chatbridge.domain.model.ProviderError;
import me.golemcore.chatbridge.domain.model.ProviderRequest;
import me.golemcore.chatbridge.domain.model.ProviderResponse;
import me.golemcore.chatbridge.domain.model.Role;
import me.golemcore.chatbridge.infrastructure.config.BridgeProperties;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Base for backends speaking the OpenAI chat-completions schema.
 *
 * <p>
 * Request: {@code {model, max_tokens, messages:[{role, content}]}} where user
 * content is a typed-part list ({@code text} / {@code image_url}) and system
 * and assistant content is a plain string. Response content may be a string or
 * a typed-part list; usage is {@code usage.total_tokens}, falling back to
 * {@code prompt_tokens + completion_tokens}.
 */
@Slf4j
public abstract class ChatCompletionsAdapter extends AbstractProviderAdapter {

    protected ChatCompletionsAdapter(BridgeProperties properties, ProviderHttpClient httpClient,
            ObjectMapper objectMapper) {
        super(properties, httpClient, objectMapper);
    }

    @Override
    public ProviderRequest buildRequest(List<Message> conversation, String modelId, int maxTokens,
            RequestOptions options) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", wireModelId(modelId));
        body.put("max_tokens", maxTokens);
        ArrayNode messages = body.putArray("messages");
        for (Message message : conversation) {
            messages.add(toWireMessage(message));
        }
        customizeBody(body, options != null ? options : RequestOptions.defaults());

        ProviderRequest.ProviderRequestBuilder request = ProviderRequest.builder()
                .provider(getProvider())
                .url(providerProperties().getUrl())
                .header("Authorization", "Bearer " + apiKey())
                .header("Content-Type", "application/json")
                .body(body)
                .timeout(resolveTimeout(options));
        customizeRequest(request, conversation);
        return request.build();
    }

    protected String wireModelId(String modelId) {
        return modelId;
    }

    protected ObjectNode toWireMessage(Message message) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("role", message.getRole().wireName());
        if (message.getRole() != Role.USER) {
            node.put("content", message.getText());
            return node;
        }
        ArrayNode content = node.putArray("content");
        for (ContentPart part : message.getContent()) {
            if (part instanceof ContentPart.Text text) {
                content.addObject().put("type", "text").put("text", text.value());
            } else if (part instanceof ContentPart.Image image) {
                addImageUrl(content, image.payload().toDataUrl());
            } else if (part instanceof ContentPart.RemoteImage remote) {
                addImageUrl(content, remote.url());
            }
        }
        return node;
    }

    private static void addImageUrl(ArrayNode content, String url) {
        ObjectNode part = content.addObject();
        part.put("type", "image_url");
        part.putObject("image_url").put("url", url);
    }

    protected void customizeBody(ObjectNode body, RequestOptions options) {
        // extra top-level fields
    }

    protected void customizeRequest(ProviderRequest.ProviderRequestBuilder request, List<Message> conversation) {
        // extra headers or notices
    }

    @Override
    public ProviderResponse parseResponse(JsonNode json) {
        Optional<ProviderError> error = extractError(json);
        if (error.isPresent()) {
            log.warn("[LLM] {} returned error: {}", getProvider(), error.get().message());
            return ProviderResponse.failed(error.get());
        }

        JsonNode choices = json.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new ProviderCallException(ExchangeFailureKind.SCHEMA, "Response has no choices");
        }
        JsonNode message = choices.get(0).path("message");
        if (!message.isObject()) {
            throw new ProviderCallException(ExchangeFailureKind.SCHEMA, "Response choice has no message");
        }

        ProviderResponse.ProviderResponseBuilder response = ProviderResponse.builder();
        JsonNode content = message.path("content");
        if (content.isTextual()) {
            response.text(content.asText());
        } else if (content.isArray()) {
            response.text(parseContentParts(content, response));
        }
        parseSideImages(message, response);
        response.usageTokens(parseUsage(json.path("usage")));
        return response.build();
    }

    private String parseContentParts(JsonNode parts, ProviderResponse.ProviderResponseBuilder response) {
        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            if (part.isTextual()) {
                text.append(part.asText());
                continue;
            }
            String type = part.path("type").asText("");
            if ("text".equals(type)) {
                text.append(part.path("text").asText(""));
            } else if ("image_url".equals(type)) {
                imageUrlOf(part).ifPresent(url -> response.contentImage(new ImageCandidate(url)));
            } else if (part.has("inline_data") || part.has("inlineData")) {
                JsonNode inline = part.has("inline_data") ? part.path("inline_data") : part.path("inlineData");
                inlineDataUrl(inline).ifPresent(url -> response.contentImage(new ImageCandidate(url)));
            }
        }
        return text.toString();
    }

    /**
     * Per-message image side array. Only some backends populate it.
     */
    protected void parseSideImages(JsonNode message, ProviderResponse.ProviderResponseBuilder response) {
        // not used by plain chat-completions backends
    }

    protected static Optional<String> imageUrlOf(JsonNode part) {
        JsonNode imageUrl = part.path("image_url");
        if (imageUrl.isTextual()) {
            return Optional.of(imageUrl.asText());
        }
        JsonNode url = imageUrl.path("url");
        return url.isTextual() ? Optional.of(url.asText()) : Optional.empty();
    }

    private static Optional<String> inlineDataUrl(JsonNode inline) {
        String data = inline.path("data").asText("");
        if (data.isEmpty()) {
            return Optional.empty();
        }
        String mimeType = inline.has("mime_type")
                ? inline.path("mime_type").asText("image/png")
                : inline.path("mimeType").asText("image/png");
        return Optional.of("data:" + mimeType + ";base64," + data);
    }

    static long parseUsage(JsonNode usage) {
        if (!usage.isObject()) {
            return 0;
        }
        if (usage.path("total_tokens").isNumber()) {
            return usage.path("total_tokens").asLong();
        }
        return usage.path("prompt_tokens").asLong(0) + usage.path("completion_tokens").asLong(0);
    }
}
