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

package me.golemcore.chatbridge.port.outbound;

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.chatbridge.domain.model.Message;
import me.golemcore.chatbridge.domain.model.Provider;
import me.golemcore.chatbridge.domain.model.ProviderRequest;
import me.golemcore.chatbridge.domain.model.ProviderResponse;

import java.time.Duration;
import java.util.List;

/**
 * Translation layer between the canonical conversation and one backend's wire
 * schema. Implementations are stateless apart from configuration.
 */
public interface ProviderPort {

    Provider getProvider();

    /**
     * Whether credentials for this backend are configured.
     */
    boolean isAvailable();

    default ProviderRequest buildRequest(List<Message> conversation, String modelId, int maxTokens) {
        return buildRequest(conversation, modelId, maxTokens, RequestOptions.defaults());
    }

    ProviderRequest buildRequest(List<Message> conversation, String modelId, int maxTokens, RequestOptions options);

    /**
     * Performs the network call.
     *
     * @throws me.golemcore.chatbridge.domain.model.ProviderCallException
     *             on transport failure after retries or an unreadable body
     */
    JsonNode send(ProviderRequest request);

    /**
     * Parses a wire response. Error envelopes become
     * {@link ProviderResponse#getError()}, never exceptions.
     */
    ProviderResponse parseResponse(JsonNode json);

    default ProviderResponse call(List<Message> conversation, String modelId, int maxTokens,
            RequestOptions options) {
        ProviderRequest request = buildRequest(conversation, modelId, maxTokens, options);
        ProviderResponse response = parseResponse(send(request));
        if (request.getNotices().isEmpty()) {
            return response;
        }
        return response.toBuilder().notices(request.getNotices()).build();
    }

    /**
     * Optional image-generation settings. Backends that cannot generate images
     * ignore them.
     */
    record RequestOptions(List<String> modalities, String aspectRatio, String imageSize,
            Duration timeout) {

        public RequestOptions {
            modalities = modalities != null ? List.copyOf(modalities) : List.of();
        }

        public static RequestOptions defaults() {
            return new RequestOptions(List.of(), null, null, null);
        }

        public RequestOptions withTimeout(Duration value) {
            return new RequestOptions(modalities, aspectRatio, imageSize, value);
        }
    }
}
