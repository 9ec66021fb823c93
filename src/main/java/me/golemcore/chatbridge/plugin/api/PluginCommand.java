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

/**
 * Slash command contributed by an extension.
 *
 * @param description
 *            one-line help text
 * @param handler
 *            invoked with the chat id and a fresh context
 * @param availableInKiosk
 *            whether the command is offered while kiosk mode is on
 */
public record PluginCommand(String description, CommandHandler handler, boolean availableInKiosk) {

    public static PluginCommand of(String description, CommandHandler handler) {
        return new PluginCommand(description, handler, true);
    }
}
