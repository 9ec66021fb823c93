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

package me.golemcore.chatbridge.plugin.api;

import me.golemcore.chatbridge.domain.model.ChatSession;
import me.golemcore.chatbridge.domain.model.Message;

import java.util.List;
import java.util.Map;

/**
 * Host-provided view handed to one hook or command invocation. Do not keep a
 * reference after the call returns.
 */
public interface PluginContext {

    String chatId();

    /**
     * Detached copy of the session as it was when the context was built.
     */
    ChatSession session();

    /**
     * Copy of the conversation.
     */
    List<Message> history();

    /**
     * Per-session storage owned by extensions. Writes are visible to later
     * hooks of the same session.
     */
    Map<String, Object> metadata();

    PluginAiHelper aiHelper();

    /**
     * Qualified id of the session's current model, e.g. {@code openai:gpt-4o}.
     */
    String modelId();

    boolean kioskMode();

    void sendMessage(String text);

    void sendDocument(byte[] data, String filename, String caption);
}
