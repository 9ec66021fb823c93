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

import me.golemcore.chatbridge.plugin.api.ExchangePlugin;
import me.golemcore.chatbridge.plugin.api.PluginCommand;

import java.util.Map;

/**
 * Accepted extension with its validated command table and health monitor.
 */
public record RegisteredPlugin(ExchangePlugin plugin, Map<String, PluginCommand> commands,
        PluginHealthMonitor health) {

    public String name() {
        return plugin.getName();
    }
}
