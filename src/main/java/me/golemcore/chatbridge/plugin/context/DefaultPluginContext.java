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

import me.golemcore.chatbridge.domain.model.ChatSession;
import me.golemcore.chatbridge.domain.model.Message;
import me.golemcore.chatbridge.plugin.api.PluginAiHelper;
import me.golemcore.chatbridge.plugin.api.PluginContext;
import me.golemcore.chatbridge.port.outbound.DeliveryPort;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Context built for a single hook or command invocation.
 */
@Slf4j
public class DefaultPluginContext implements PluginContext {

    private final ChatSession snapshot;
    private final PluginAiHelper aiHelper;
    private final DeliveryPort delivery;
    private final boolean kioskMode;

    public DefaultPluginContext(ChatSession snapshot, PluginAiHelper aiHelper, DeliveryPort delivery,
            boolean kioskMode) {
        this.snapshot = snapshot;
        this.aiHelper = aiHelper;
        this.delivery = delivery;
        this.kioskMode = kioskMode;
    }

    @Override
    public String chatId() {
        return snapshot.getChatId();
    }

    @Override
    public ChatSession session() {
        return snapshot;
    }

    @Override
    public List<Message> history() {
        return snapshot.getConversation();
    }

    @Override
    public Map<String, Object> metadata() {
        return snapshot.getPluginMetadata();
    }

    @Override
    public PluginAiHelper aiHelper() {
        return aiHelper;
    }

    @Override
    public String modelId() {
        return snapshot.getModel() != null ? snapshot.getModel().qualifiedName() : "unknown";
    }

    @Override
    public boolean kioskMode() {
        return kioskMode;
    }

    @Override
    public void sendMessage(String text) {
        if (delivery == null) {
            log.warn("[Plugins] sendMessage unavailable for chat {}", chatId());
            return;
        }
        delivery.sendMessage(chatId(), text);
    }

    @Override
    public void sendDocument(byte[] data, String filename, String caption) {
        if (delivery == null) {
            log.warn("[Plugins] sendDocument unavailable for chat {}", chatId());
            return;
        }
        delivery.sendDocument(chatId(), data, filename, caption);
    }
}
