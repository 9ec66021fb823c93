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
import java.util.Map;

/**
 * Extension invoked around every exchange.
 *
 * <p>
 * Hooks fire in this order for one exchange: {@code preUserText},
 * {@code postUserText}, {@code preUserImages}, {@code postUserImages}, then
 * after the model replied {@code preAssistantText}, {@code postAssistantText},
 * {@code preAssistantImages}, {@code postAssistantImages}, and finally
 * {@code onMessageComplete}. {@code onSessionStart} fires once, before the
 * first exchange of a session.
 *
 * <p>
 * Text and image hooks must return a value of the same shape as their input.
 * A hook that throws, times out or returns {@code null} (or a list containing
 * {@code null}) is counted as a failure and its input is used instead. After
 * {@code bridge.plugins.max-failures} failures the whole extension is disabled
 * until restart.
 *
 * <p>
 * Extend {@link AbstractExchangePlugin} to override only the hooks you need.
 */
public interface ExchangePlugin {

    /**
     * Stable name used in logs and health reporting.
     */
    String getName();

    String preUserText(String text, PluginContext context);

    String postUserText(String text, PluginContext context);

    List<ImagePayload> preUserImages(List<ImagePayload> images, String text, PluginContext context);

    List<ImagePayload> postUserImages(List<ImagePayload> images, String text, PluginContext context);

    String preAssistantText(String text, PluginContext context);

    String postAssistantText(String text, PluginContext context);

    List<ImagePayload> preAssistantImages(List<ImagePayload> images, String text, PluginContext context);

    List<ImagePayload> postAssistantImages(List<ImagePayload> images, String text, PluginContext context);

    void onSessionStart(PluginContext context);

    void onMessageComplete(PluginContext context);

    /**
     * Slash commands contributed by this extension, keyed by name without the
     * leading slash. Must not return {@code null}.
     */
    Map<String, PluginCommand> getCommands();
}
