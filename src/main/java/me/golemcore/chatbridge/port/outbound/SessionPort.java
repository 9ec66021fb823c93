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

import me.golemcore.chatbridge.domain.model.ChatSession;
import me.golemcore.chatbridge.domain.model.Modalities;
import me.golemcore.chatbridge.domain.model.ModelSelector;
import me.golemcore.chatbridge.domain.model.ResponseFormat;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Port for the in-memory session store. Operations on an unknown chat id create
 * a default session instead of failing.
 */
public interface SessionPort {

    ChatSession getOrCreate(String chatId);

    Optional<ChatSession> find(String chatId);

    /**
     * Resets the conversation to empty, or to the configured system message.
     */
    void clear(String chatId);

    /**
     * Drops the oldest messages beyond {@code 2 * maxRounds}, keeping a leading
     * system message.
     *
     * @return number of removed messages
     */
    int trim(String chatId);

    void deactivate(String chatId);

    void setMaxRounds(String chatId, int maxRounds);

    void setModel(String chatId, ModelSelector model);

    void setResponseFormat(String chatId, ResponseFormat format);

    /**
     * Updates the image output settings sent to image-capable models. A
     * {@code null} aspect ratio or size clears the setting.
     */
    void setImageSettings(String chatId, Modalities modalities, String aspectRatio, String imageSize);

    List<ChatSession> listActive();

    /**
     * Registers a callback run once for every newly created session, on the
     * thread that created it.
     */
    void onSessionCreated(Consumer<ChatSession> listener);
}
