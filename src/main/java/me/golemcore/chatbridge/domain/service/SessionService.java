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

package me.golemcore.chatbridge.domain.service;

import me.golemcore.chatbridge.domain.model.ChatSession;
import me.golemcore.chatbridge.domain.model.Message;
import me.golemcore.chatbridge.domain.model.Modalities;
import me.golemcore.chatbridge.domain.model.ModelSelector;
import me.golemcore.chatbridge.domain.model.ResponseFormat;
import me.golemcore.chatbridge.infrastructure.config.BridgeProperties;
import me.golemcore.chatbridge.port.outbound.SessionPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * In-memory session store keyed by chat id. Sessions live for the process
 * lifetime; every mutation synchronizes on the session object so that the
 * exchange running for a chat and explicit commands never interleave.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionService implements SessionPort {

    private final BridgeProperties properties;
    private final Clock clock;

    private final Map<String, ChatSession> sessions = new ConcurrentHashMap<>();
    private final List<Consumer<ChatSession>> creationListeners = new CopyOnWriteArrayList<>();

    @Override
    public ChatSession getOrCreate(String chatId) {
        ChatSession existing = sessions.get(chatId);
        if (existing != null) {
            return existing;
        }
        AtomicBoolean created = new AtomicBoolean();
        ChatSession session = sessions.computeIfAbsent(chatId, id -> {
            created.set(true);
            return createSession(id);
        });
        if (created.get()) {
            notifyCreated(session);
        }
        return session;
    }

    @Override
    public void onSessionCreated(Consumer<ChatSession> listener) {
        creationListeners.add(listener);
    }

    private void notifyCreated(ChatSession session) {
        for (Consumer<ChatSession> listener : creationListeners) {
            try {
                listener.accept(session);
            } catch (RuntimeException e) {
                log.warn("Session listener failed for {}: {}", session.getChatId(), e.getMessage(), e);
            }
        }
    }

    @Override
    public Optional<ChatSession> find(String chatId) {
        return Optional.ofNullable(sessions.get(chatId));
    }

    @Override
    public void clear(String chatId) {
        ChatSession session = getOrCreate(chatId);
        synchronized (session) {
            session.setConversation(initialConversation(session.getSystemPrompt()));
            session.setUpdatedAt(clock.instant());
        }
        log.debug("Cleared session: {}", chatId);
    }

    @Override
    public int trim(String chatId) {
        ChatSession session = getOrCreate(chatId);
        synchronized (session) {
            List<Message> conversation = session.getConversation();
            Message leadingSystem = !conversation.isEmpty() && conversation.get(0).isSystemMessage()
                    ? conversation.get(0)
                    : null;
            List<Message> rest = leadingSystem != null
                    ? new ArrayList<>(conversation.subList(1, conversation.size()))
                    : new ArrayList<>(conversation);

            int limit = 2 * session.getMaxRounds();
            if (rest.size() <= limit) {
                return 0;
            }

            List<Message> kept = new ArrayList<>(rest.subList(rest.size() - limit, rest.size()));
            // the first non-system message must be a user turn
            while (!kept.isEmpty() && kept.get(0).isAssistantMessage()) {
                kept.remove(0);
            }

            List<Message> trimmed = new ArrayList<>(kept.size() + 1);
            if (leadingSystem != null) {
                trimmed.add(leadingSystem);
            }
            trimmed.addAll(kept);
            int removed = conversation.size() - trimmed.size();
            session.setConversation(trimmed);
            session.setUpdatedAt(clock.instant());
            log.debug("Trimmed {} messages from session {}", removed, chatId);
            return removed;
        }
    }

    @Override
    public void deactivate(String chatId) {
        ChatSession session = sessions.get(chatId);
        if (session == null) {
            return;
        }
        synchronized (session) {
            session.setActive(false);
            session.setUpdatedAt(clock.instant());
        }
        log.info("Deactivated session: {}", chatId);
    }

    @Override
    public void setMaxRounds(String chatId, int maxRounds) {
        ChatSession session = getOrCreate(chatId);
        synchronized (session) {
            session.setMaxRounds(maxRounds > 0 ? maxRounds : defaultMaxRounds());
            session.setUpdatedAt(clock.instant());
        }
    }

    @Override
    public void setModel(String chatId, ModelSelector model) {
        ChatSession session = getOrCreate(chatId);
        synchronized (session) {
            session.setModel(model != null ? model : defaultModel());
            session.setUpdatedAt(clock.instant());
        }
    }

    @Override
    public void setResponseFormat(String chatId, ResponseFormat format) {
        ChatSession session = getOrCreate(chatId);
        synchronized (session) {
            session.setResponseFormat(format != null ? format : ResponseFormat.AUTO);
            session.setUpdatedAt(clock.instant());
        }
    }

    @Override
    public void setImageSettings(String chatId, Modalities modalities, String aspectRatio, String imageSize) {
        ChatSession session = getOrCreate(chatId);
        synchronized (session) {
            session.setModalities(modalities != null ? modalities : Modalities.AUTO);
            session.setAspectRatio(aspectRatio);
            session.setImageSize(imageSize);
            session.setUpdatedAt(clock.instant());
        }
    }

    @Override
    public List<ChatSession> listActive() {
        return sessions.values().stream()
                .filter(ChatSession::isActive)
                .toList();
    }

    private ChatSession createSession(String chatId) {
        String systemPrompt = properties.getSession().getSystemPrompt();
        if (systemPrompt != null && systemPrompt.isBlank()) {
            systemPrompt = null;
        }
        ChatSession session = ChatSession.builder()
                .chatId(chatId)
                .conversation(initialConversation(systemPrompt))
                .model(defaultModel())
                .maxRounds(defaultMaxRounds())
                .systemPrompt(systemPrompt)
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .build();
        log.info("Created new session: {}", chatId);
        return session;
    }

    private List<Message> initialConversation(String systemPrompt) {
        List<Message> conversation = new ArrayList<>();
        if (systemPrompt != null) {
            conversation.add(Message.system(systemPrompt));
        }
        return conversation;
    }

    private ModelSelector defaultModel() {
        return ModelSelector.parse(properties.getSession().getDefaultModel());
    }

    private int defaultMaxRounds() {
        int configured = properties.getSession().getMaxRounds();
        return configured > 0 ? configured : 4;
    }
}
