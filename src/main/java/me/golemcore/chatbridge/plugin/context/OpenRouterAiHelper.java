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

package me.golemcore.chatbridge.plugin.context;

import me.golemcore.chatbridge.adapter.outbound.llm.OpenRouterAdapter;
import me.golemcore.chatbridge.domain.model.ContentPart;
import me.golemcore.chatbridge.domain.model.ImagePayload;
import me.golemcore.chatbridge.domain.model.Message;
import me.golemcore.chatbridge.domain.model.ProviderResponse;
import me.golemcore.chatbridge.domain.model.Role;
import me.golemcore.chatbridge.infrastructure.config.BridgeProperties;
import me.golemcore.chatbridge.plugin.api.PluginAiHelper;
import me.golemcore.chatbridge.port.outbound.ProviderPort.RequestOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * {@link PluginAiHelper} backed by the OpenRouter adapter.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpenRouterAiHelper implements PluginAiHelper {

    private final OpenRouterAdapter openRouterAdapter;
    private final BridgeProperties properties;

    @Override
    public String callAi(String prompt, String model, int maxTokens, List<ImagePayload> images) {
        Message.MessageBuilder message = Message.builder().role(Role.USER).part(ContentPart.text(prompt));
        if (images != null) {
            images.forEach(image -> message.part(ContentPart.image(image)));
        }
        return call(List.of(message.build()), model, maxTokens);
    }

    @Override
    public String quickCall(String system, String user, String model) {
        return call(List.of(Message.system(system), Message.user(user)), model, 0);
    }

    private String call(List<Message> conversation, String model, int maxTokens) {
        BridgeProperties.PluginsProperties config = properties.getPlugins();
        String modelId = model != null && !model.isBlank() ? model : config.getHelperModel();
        int tokens = maxTokens > 0 ? maxTokens : config.getHelperMaxTokens();
        RequestOptions options = RequestOptions.defaults()
                .withTimeout(Duration.ofMillis(config.getHelperTimeout()));
        try {
            ProviderResponse response = openRouterAdapter.call(conversation, modelId, tokens, options);
            if (response.hasError()) {
                log.warn("[Plugins] AI helper call to {} failed: {}", modelId, response.getError().message());
                return "";
            }
            return response.getText();
        } catch (RuntimeException e) {
            log.warn("[Plugins] AI helper call to {} failed: {}", modelId, e.getMessage());
            return "";
        }
    }
}
