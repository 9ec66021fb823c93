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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one chat: the canonical conversation, model choice, usage
 * counter, round limit, output preferences and plugin metadata. Every mutation
 * goes through the session store while holding this object's monitor.
 */
@Data
@Builder
public class ChatSession {

    private String chatId;

    @Builder.Default
    private List<Message> conversation = new ArrayList<>();

    private ModelSelector model;

    private long tokensUsed;

    private int maxRounds;

    @Builder.Default
    private ResponseFormat responseFormat = ResponseFormat.AUTO;

    @Builder.Default
    private Map<String, Object> pluginMetadata = new HashMap<>();

    private String systemPrompt;

    @Builder.Default
    private Modalities modalities = Modalities.AUTO;

    private String aspectRatio;
    private String imageSize;

    private boolean sessionStarted;

    @Builder.Default
    private boolean active = true;

    private Instant createdAt;
    private Instant updatedAt;

    public void addMessage(Message message) {
        if (conversation == null) {
            conversation = new ArrayList<>();
        }
        conversation.add(message);
    }

    public void addTokens(long tokens) {
        if (tokens > 0) {
            tokensUsed += tokens;
        }
    }

    /**
     * Detached copy handed to plugins. Collections are copied so hooks cannot
     * mutate the session through the snapshot. Metadata written by a hook
     * reaches the session only through {@link #replacePluginMetadata(Map)}.
     */
    public ChatSession snapshot() {
        return ChatSession.builder()
                .chatId(chatId)
                .conversation(List.copyOf(conversation))
                .model(model)
                .tokensUsed(tokensUsed)
                .maxRounds(maxRounds)
                .responseFormat(responseFormat)
                .pluginMetadata(pluginMetadata != null ? new HashMap<>(pluginMetadata) : new HashMap<>())
                .systemPrompt(systemPrompt)
                .modalities(modalities)
                .aspectRatio(aspectRatio)
                .imageSize(imageSize)
                .sessionStarted(sessionStarted)
                .active(active)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }

    public void replacePluginMetadata(Map<String, Object> metadata) {
        pluginMetadata = new HashMap<>(metadata);
    }
}
