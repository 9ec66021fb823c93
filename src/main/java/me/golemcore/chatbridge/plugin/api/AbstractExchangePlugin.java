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
 * Pass-through base: every hook returns its input unchanged.
 */
public abstract class AbstractExchangePlugin implements ExchangePlugin {

    private final String name;

    protected AbstractExchangePlugin(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String preUserText(String text, PluginContext context) {
        return text;
    }

    @Override
    public String postUserText(String text, PluginContext context) {
        return text;
    }

    @Override
    public List<ImagePayload> preUserImages(List<ImagePayload> images, String text, PluginContext context) {
        return images;
    }

    @Override
    public List<ImagePayload> postUserImages(List<ImagePayload> images, String text, PluginContext context) {
        return images;
    }

    @Override
    public String preAssistantText(String text, PluginContext context) {
        return text;
    }

    @Override
    public String postAssistantText(String text, PluginContext context) {
        return text;
    }

    @Override
    public List<ImagePayload> preAssistantImages(List<ImagePayload> images, String text, PluginContext context) {
        return images;
    }

    @Override
    public List<ImagePayload> postAssistantImages(List<ImagePayload> images, String text, PluginContext context) {
        return images;
    }

    @Override
    public void onSessionStart(PluginContext context) {
        // no-op
    }

    @Override
    public void onMessageComplete(PluginContext context) {
        // no-op
    }

    @Override
    public Map<String, PluginCommand> getCommands() {
        return Map.of();
    }
}
