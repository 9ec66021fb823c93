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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.chatbridge.domain.model.Message;
import me.golemcore.chatbridge.domain.model.Provider;
import me.golemcore.chatbridge.domain.model.ProviderRequest;
import me.golemcore.chatbridge.infrastructure.config.BridgeProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Groq adapter. The hosted models are text-only: every message is flattened to
 * its first text part and images are not sent. When the latest user turn
 * carried an image, the reply gets a notice saying so.
 */
@Component
public class GroqAdapter extends ChatCompletionsAdapter {

    static final String IMAGE_IGNORED_NOTICE = "[Note: the attached image was ignored because this model "
            + "does not accept images]";

    public GroqAdapter(BridgeProperties properties, ProviderHttpClient httpClient, ObjectMapper objectMapper) {
        super(properties, httpClient, objectMapper);
    }

    @Override
    public Provider getProvider() {
        return Provider.GROQ;
    }

    @Override
    protected BridgeProperties.ProviderProperties providerProperties() {
        return properties.getProviders().getGroq();
    }

    @Override
    protected ObjectNode toWireMessage(Message message) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("role", message.getRole().wireName());
        node.put("content", message.getFirstText());
        return node;
    }

    @Override
    protected void customizeRequest(ProviderRequest.ProviderRequestBuilder request, List<Message> conversation) {
        for (int i = conversation.size() - 1; i >= 0; i--) {
            Message message = conversation.get(i);
            if (message.isUserMessage()) {
                if (message.hasImages()) {
                    request.notice(IMAGE_IGNORED_NOTICE);
                }
                return;
            }
        }
    }
}
