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

import me.golemcore.chatbridge.domain.model.ImagePayload;

import java.util.List;

/**
 * Model access for extensions. Calls go through the OpenRouter adapter with
 * their own timeout. Failures are logged and yield an empty string.
 */
public interface PluginAiHelper {

    /**
     * General call with an optional set of images attached to the prompt.
     *
     * @param model
     *            OpenRouter model id, or {@code null} for the configured helper
     *            model
     * @param maxTokens
     *            token limit, or a non-positive value for the default
     */
    String callAi(String prompt, String model, int maxTokens, List<ImagePayload> images);

    /**
     * Two-message call: one system instruction, one user message.
     */
    String quickCall(String system, String user, String model);
}
